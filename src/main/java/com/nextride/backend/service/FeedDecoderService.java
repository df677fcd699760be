package com.nextride.backend.service;

import com.google.transit.realtime.GtfsRealtime;
import com.nextride.backend.model.ActivePeriod;
import com.nextride.backend.model.Alert;
import com.nextride.backend.model.DecodedEntity;
import com.nextride.backend.model.DecodedFeed;
import com.nextride.backend.model.FeedPayload;
import com.nextride.backend.model.InformedEntity;
import com.nextride.backend.model.StopTimeUpdate;
import com.nextride.backend.model.TripUpdate;
import com.nextride.backend.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns GTFS-Realtime feed messages into trip updates, stop-time updates and
 * alerts. Optional protobuf fields are read only when present, so absent
 * values come out as null rather than protobuf defaults.
 */
@Service
@Slf4j
public class FeedDecoderService {

    /**
     * Decode every payload and merge the results.
     */
    public DecodedFeed decode(List<FeedPayload> payloads) {
        DecodedFeed decoded = new DecodedFeed();
        for (FeedPayload payload : payloads) {
            for (DecodedEntity entity : decodeFeed(payload.getGroup(), payload.getMessage())) {
                entity.addTo(decoded);
            }
        }
        log.info("🔄 Decoded {} feeds into {} trips, {} stop times, {} alerts", payloads.size(),
                decoded.getTripUpdates().size(), decoded.getStopTimeUpdates().size(), decoded.getAlerts().size());
        return decoded;
    }

    /**
     * Decode one feed. Entities that fail are skipped; a failure of the feed
     * as a whole yields no entities.
     */
    public List<DecodedEntity> decodeFeed(String group, GtfsRealtime.FeedMessage message) {
        try {
            List<DecodedEntity> entities = new ArrayList<>(message.getEntityCount());
            int skipped = 0;
            for (GtfsRealtime.FeedEntity entity : message.getEntityList()) {
                try {
                    entities.addAll(decodeEntity(entity));
                } catch (RuntimeException e) {
                    skipped++;
                    log.warn("   ⚠️ [{}] Skipping entity {}: {}", group, entity.getId(), e.getMessage());
                }
            }
            if (skipped > 0) {
                log.warn("   ⚠️ [{}] Skipped {} of {} entities", group, skipped, message.getEntityCount());
            }
            return entities;
        } catch (RuntimeException e) {
            log.error("   ❌ [{}] Failed to decode feed", group, e);
            return Collections.emptyList();
        }
    }

    /**
     * Classify an entity. An entity carrying neither a trip update nor an
     * alert decodes to nothing; vehicle positions are ignored.
     */
    public List<DecodedEntity> decodeEntity(GtfsRealtime.FeedEntity entity) {
        List<DecodedEntity> decoded = new ArrayList<>(1);
        if (entity.hasTripUpdate()) {
            decoded.add(decodeTripUpdate(entity.getTripUpdate()));
        }
        if (entity.hasAlert()) {
            decoded.add(new DecodedEntity.AlertEntity(decodeAlert(entity.getId(), entity.getAlert())));
        }
        return decoded;
    }

    private DecodedEntity.TripUpdateEntity decodeTripUpdate(GtfsRealtime.TripUpdate source) {
        GtfsRealtime.TripDescriptor trip = source.getTrip();
        if (!trip.hasTripId() || trip.getTripId().isEmpty()) {
            throw new IllegalArgumentException("trip update without trip_id");
        }
        String tripId = trip.getTripId();

        TripUpdate tripUpdate = TripUpdate.builder()
                .tripId(tripId)
                .startDateTime(TimeUtils.parseServiceDateTime(
                        trip.hasStartDate() ? trip.getStartDate() : null,
                        trip.hasStartTime() ? trip.getStartTime() : null))
                .routeId(trip.hasRouteId() ? trip.getRouteId() : null)
                .build();

        List<StopTimeUpdate> stopTimes = source.getStopTimeUpdateList().stream()
                .map(stopTime -> StopTimeUpdate.builder()
                        .tripId(tripId)
                        .stopId(stopTime.hasStopId() ? stopTime.getStopId() : null)
                        .arrivalTime(stopTime.hasArrival() ? eventTime(stopTime.getArrival()) : null)
                        .departureTime(stopTime.hasDeparture() ? eventTime(stopTime.getDeparture()) : null)
                        .build())
                .collect(Collectors.toList());

        return new DecodedEntity.TripUpdateEntity(tripUpdate, stopTimes);
    }

    private Alert decodeAlert(String alertId, GtfsRealtime.Alert source) {
        List<ActivePeriod> periods = source.getActivePeriodList().stream()
                .map(range -> ActivePeriod.builder()
                        .start(range.hasStart() ? TimeUtils.fromEpochSeconds(range.getStart()) : null)
                        .end(range.hasEnd() ? TimeUtils.fromEpochSeconds(range.getEnd()) : null)
                        .build())
                .collect(Collectors.toList());

        List<InformedEntity> entities = source.getInformedEntityList().stream()
                .map(selector -> InformedEntity.builder()
                        .agencyId(selector.hasAgencyId() ? selector.getAgencyId() : null)
                        .routeId(selector.hasRouteId() ? selector.getRouteId() : null)
                        .stopId(selector.hasStopId() ? selector.getStopId() : null)
                        .build())
                .collect(Collectors.toList());

        return Alert.builder()
                .alertId(alertId)
                .headerText(source.hasHeaderText() ? firstTranslation(source.getHeaderText()) : null)
                .descriptionText(source.hasDescriptionText() ? firstTranslation(source.getDescriptionText()) : null)
                .activePeriods(periods)
                .informedEntities(entities)
                .build();
    }

    private static Instant eventTime(GtfsRealtime.TripUpdate.StopTimeEvent event) {
        return event.hasTime() ? TimeUtils.fromEpochSeconds(event.getTime()) : null;
    }

    private static String firstTranslation(GtfsRealtime.TranslatedString text) {
        return text.getTranslationCount() > 0 ? text.getTranslation(0).getText() : null;
    }
}
