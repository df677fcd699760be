package com.nextride.backend.service;

import com.nextride.backend.config.FeedProperties;
import com.nextride.backend.model.DecodedFeed;
import com.nextride.backend.model.FetchResult;
import com.nextride.backend.model.RefreshSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;

/**
 * Runs one ingestion cycle: fetch the configured feed groups, decode them and
 * reconcile the result into storage. Each call is self-contained, so a failed
 * cycle is retried simply by running the next one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedPollingService {

        public static final String STATUS_SUCCESS = "SUCCESS";
        public static final String STATUS_PARTIAL = "PARTIAL";
        public static final String STATUS_NO_DATA = "NO_DATA";
        public static final String STATUS_FAILED = "FAILED";

        private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

        private final FeedProperties feedProperties;
        private final FeedFetcherService feedFetcherService;
        private final FeedDecoderService feedDecoderService;
        private final RealtimeReconciler realtimeReconciler;
        private final AlertReconciler alertReconciler;
        private final Clock clock;

        /**
         * Refresh live trip and stop-time state from the realtime feed groups.
         * When no group could be fetched the live state is cleared.
         */
        public RefreshSummary refreshRealtime() {
                LocalDateTime startTime = LocalDateTime.now(clock);
                long startMillis = System.currentTimeMillis();
                Map<String, String> groups = feedProperties.getRealtime();

                log.info("═══════════════════════════════════════════════════════════════════");
                log.info("🚇 REALTIME REFRESH STARTED | Groups: {} | Time: {}", groups.keySet(),
                                startTime.format(TIME_FORMATTER));
                log.info("═══════════════════════════════════════════════════════════════════");

                FetchResult fetched = null;
                try {
                        fetched = feedFetcherService.fetchAll(groups);
                        if (fetched.getPayloads().isEmpty()) {
                                realtimeReconciler.reconcile(Collections.emptyList(), Collections.emptyList());
                                return noData("realtime", startTime, startMillis, fetched);
                        }

                        DecodedFeed decoded = feedDecoderService.decode(fetched.getPayloads());
                        RealtimeReconciler.Result result = realtimeReconciler.reconcile(decoded.getTripUpdates(),
                                        decoded.getStopTimeUpdates());

                        long duration = System.currentTimeMillis() - startMillis;
                        String status = fetched.hasFailures() ? STATUS_PARTIAL : STATUS_SUCCESS;
                        log.info("✅ SUMMARY: {} | {} groups → {} trips, {} stop times | Took: {}ms", status,
                                        fetched.getPayloads().size(), result.getTripUpdates(),
                                        result.getStopTimeUpdates(), duration);
                        log.info("═══════════════════════════════════════════════════════════════════");

                        return RefreshSummary.builder()
                                        .feed("realtime")
                                        .timestamp(startTime)
                                        .status(status)
                                        .groupsFetched(fetched.getPayloads().size())
                                        .failedGroups(new ArrayList<>(fetched.getFailedGroups()))
                                        .tripUpdates(result.getTripUpdates())
                                        .stopTimeUpdates(result.getStopTimeUpdates())
                                        .alerts(0)
                                        .processingTimeMs(duration)
                                        .message(String.format("Replaced live state with %d trips and %d stop times",
                                                        result.getTripUpdates(), result.getStopTimeUpdates()))
                                        .build();
                } catch (Exception e) {
                        return failed("realtime", startTime, startMillis, fetched, e);
                }
        }

        /**
         * Refresh stored alerts from the alert feed groups.
         */
        public RefreshSummary refreshAlerts() {
                LocalDateTime startTime = LocalDateTime.now(clock);
                long startMillis = System.currentTimeMillis();
                Map<String, String> groups = feedProperties.getAlerts();

                log.info("═══════════════════════════════════════════════════════════════════");
                log.info("🚨 ALERTS REFRESH STARTED | Groups: {} | Time: {}", groups.keySet(),
                                startTime.format(TIME_FORMATTER));
                log.info("═══════════════════════════════════════════════════════════════════");

                FetchResult fetched = null;
                try {
                        fetched = feedFetcherService.fetchAll(groups);
                        if (fetched.getPayloads().isEmpty()) {
                                return noData("alerts", startTime, startMillis, fetched);
                        }

                        DecodedFeed decoded = feedDecoderService.decode(fetched.getPayloads());
                        int written = alertReconciler.reconcile(decoded.getAlerts());

                        long duration = System.currentTimeMillis() - startMillis;
                        String status = fetched.hasFailures() ? STATUS_PARTIAL : STATUS_SUCCESS;
                        log.info("✅ SUMMARY: {} | {} groups → {} alerts | Took: {}ms", status,
                                        fetched.getPayloads().size(), written, duration);
                        log.info("═══════════════════════════════════════════════════════════════════");

                        return RefreshSummary.builder()
                                        .feed("alerts")
                                        .timestamp(startTime)
                                        .status(status)
                                        .groupsFetched(fetched.getPayloads().size())
                                        .failedGroups(new ArrayList<>(fetched.getFailedGroups()))
                                        .tripUpdates(0)
                                        .stopTimeUpdates(0)
                                        .alerts(written)
                                        .processingTimeMs(duration)
                                        .message(String.format("Upserted %d alerts", written))
                                        .build();
                } catch (Exception e) {
                        return failed("alerts", startTime, startMillis, fetched, e);
                }
        }

        private RefreshSummary noData(String feed, LocalDateTime startTime, long startMillis, FetchResult fetched) {
                long duration = System.currentTimeMillis() - startMillis;
                log.warn("⚠️  STATUS: NO DATA | No {} feed group could be fetched | Took: {}ms",
                                feed, duration);
                return RefreshSummary.builder()
                                .feed(feed)
                                .timestamp(startTime)
                                .status(STATUS_NO_DATA)
                                .groupsFetched(0)
                                .failedGroups(new ArrayList<>(fetched.getFailedGroups()))
                                .tripUpdates(0)
                                .stopTimeUpdates(0)
                                .alerts(0)
                                .processingTimeMs(duration)
                                .message("No feed data received for " + feed)
                                .build();
        }

        private RefreshSummary failed(String feed, LocalDateTime startTime, long startMillis, FetchResult fetched,
                        Exception e) {
                long duration = System.currentTimeMillis() - startMillis;
                log.error("❌ STATUS: FAILED | Error during {} refresh | Took: {}ms", feed, duration, e);
                return RefreshSummary.builder()
                                .feed(feed)
                                .timestamp(startTime)
                                .status(STATUS_FAILED)
                                .groupsFetched(fetched != null ? fetched.getPayloads().size() : 0)
                                .failedGroups(fetched != null ? new ArrayList<>(fetched.getFailedGroups()) : new ArrayList<>())
                                .tripUpdates(0)
                                .stopTimeUpdates(0)
                                .alerts(0)
                                .processingTimeMs(duration)
                                .message("Error during refresh: " + e.getMessage())
                                .build();
        }
}
