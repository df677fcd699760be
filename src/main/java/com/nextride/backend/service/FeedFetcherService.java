package com.nextride.backend.service;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.transit.realtime.GtfsRealtime;
import com.nextride.backend.client.FeedApi;
import com.nextride.backend.exception.FeedFetchException;
import com.nextride.backend.model.FeedPayload;
import com.nextride.backend.model.FetchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Retrieves one GTFS-Realtime feed per feed group. A group that cannot be
 * fetched or parsed is reported as failed without affecting the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedFetcherService {

        private static final int MAX_PARALLEL_FETCHES = 8;

        private final FeedApi feedApi;

        /**
         * Fetch every group concurrently.
         *
         * @param groups feed group name to endpoint URL
         * @return parsed feeds in group order, plus the names of the groups that failed
         */
        public FetchResult fetchAll(Map<String, String> groups) {
                FetchResult result = FetchResult.builder().build();
                if (groups == null || groups.isEmpty()) {
                        log.warn("⚠️ No feed groups configured, nothing to fetch");
                        return result;
                }

                ExecutorService executor = Executors.newFixedThreadPool(Math.min(groups.size(), MAX_PARALLEL_FETCHES));
                try {
                        Map<String, CompletableFuture<Optional<FeedPayload>>> futures = new LinkedHashMap<>();
                        groups.forEach((group, url) -> futures.put(group,
                                        CompletableFuture.supplyAsync(() -> fetchGroup(group, url), executor)));

                        futures.forEach((group, future) -> {
                                Optional<FeedPayload> payload = future.join();
                                if (payload.isPresent()) {
                                        result.getPayloads().add(payload.get());
                                } else {
                                        result.getFailedGroups().add(group);
                                }
                        });
                } finally {
                        executor.shutdown();
                }

                if (result.hasFailures()) {
                        log.warn("⚠️ Fetched {}/{} feed groups, failed: {}", result.getPayloads().size(), groups.size(),
                                        result.getFailedGroups());
                } else {
                        log.info("✅ Fetched all {} feed groups", groups.size());
                }
                return result;
        }

        /**
         * Fetch and parse a single group. Never throws: every failure is logged
         * and reported as an empty result.
         */
        public Optional<FeedPayload> fetchGroup(String group, String url) {
                long startMillis = System.currentTimeMillis();
                try {
                        byte[] bytes = feedApi.getFeed(url);
                        GtfsRealtime.FeedMessage message = GtfsRealtime.FeedMessage.parseFrom(bytes);
                        log.info("   📡 [{}] {} entities in {}ms", group, message.getEntityCount(),
                                        System.currentTimeMillis() - startMillis);
                        return Optional.of(new FeedPayload(group, message));
                } catch (FeedFetchException e) {
                        log.warn("   ⚠️ [{}] Fetch failed: {}", group, e.getMessage());
                } catch (InvalidProtocolBufferException e) {
                        log.warn("   ⚠️ [{}] Malformed feed payload: {}", group, e.getMessage());
                } catch (RuntimeException e) {
                        log.error("   ❌ [{}] Unexpected error fetching feed", group, e);
                }
                return Optional.empty();
        }
}
