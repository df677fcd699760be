package com.nextride.backend.service;

import com.nextride.backend.model.StopTimeUpdate;
import com.nextride.backend.model.TripUpdate;
import com.nextride.backend.repository.RealtimeRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replaces the live trip and stop-time state with the latest decoded batch.
 * Live state is a point-in-time snapshot: nothing from the previous cycle
 * survives, and an empty batch leaves the state empty.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RealtimeReconciler {

    private final RealtimeRepository realtimeRepository;

    @Value
    public static class Result {
        int tripUpdates;
        int stopTimeUpdates;
        int duplicatesDropped;
    }

    /**
     * Replace live state with the batch. Duplicate trip ids and duplicate
     * (trip id, stop id) pairs keep their first occurrence.
     *
     * @throws org.springframework.dao.DataAccessException when the store rejects the
     *                                                     replace; the previous state is kept
     */
    public Result reconcile(List<TripUpdate> tripUpdates, List<StopTimeUpdate> stopTimeUpdates) {
        Map<String, TripUpdate> tripsById = new LinkedHashMap<>();
        for (TripUpdate trip : tripUpdates) {
            tripsById.putIfAbsent(trip.getTripId(), trip);
        }

        Set<String> seenPairs = new HashSet<>();
        List<StopTimeUpdate> uniqueStopTimes = new ArrayList<>(stopTimeUpdates.size());
        for (StopTimeUpdate stopTime : stopTimeUpdates) {
            if (seenPairs.add(stopTime.getTripId() + '\u0000' + stopTime.getStopId())) {
                uniqueStopTimes.add(stopTime);
            }
        }

        int dropped = (tripUpdates.size() - tripsById.size()) + (stopTimeUpdates.size() - uniqueStopTimes.size());
        if (dropped > 0) {
            log.info("Dropped {} duplicate records from the batch", dropped);
        }
        if (tripsById.isEmpty()) {
            log.warn("⚠️ No trip updates available, live state will be empty");
        }
        if (uniqueStopTimes.isEmpty()) {
            log.warn("⚠️ No stop time updates available, live state will be empty");
        }

        List<TripUpdate> uniqueTrips = new ArrayList<>(tripsById.values());
        realtimeRepository.replaceLiveState(uniqueTrips, uniqueStopTimes);
        return new Result(uniqueTrips.size(), uniqueStopTimes.size(), dropped);
    }
}
