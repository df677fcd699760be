package com.nextride.backend.client;

import com.nextride.backend.exception.FeedFetchException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.time.Duration;

@Component
public class MtaFeedClient implements FeedApi {

        private final WebClient webClient;

        @Value("${mta.api.key:}")
        private String apiKey;

        @Value("${mta.feed.timeout}")
        private int feedTimeout;

        public MtaFeedClient(WebClient.Builder webClientBuilder) {
                this.webClient = webClientBuilder
                                .codecs(configurer -> configurer
                                                .defaultCodecs()
                                                .maxInMemorySize(16 * 1024 * 1024)) // 16MB, the 1-7 feed is large at peak
                                .build();
        }

        @Override
        public byte[] getFeed(String url) {
                byte[] body;
                try {
                        // URI.create keeps the already-encoded %2F in MTA feed paths intact
                        body = webClient.get()
                                        .uri(URI.create(url))
                                        .accept(MediaType.APPLICATION_OCTET_STREAM, MediaType.ALL)
                                        .headers(headers -> {
                                                if (apiKey != null && !apiKey.isEmpty()) {
                                                        headers.set("x-api-key", apiKey);
                                                }
                                        })
                                        .retrieve()
                                        .bodyToMono(byte[].class)
                                        .timeout(Duration.ofSeconds(feedTimeout))
                                        .block();
                } catch (WebClientResponseException e) {
                        throw new FeedFetchException(
                                        "Feed request to " + url + " returned status " + e.getStatusCode().value(), e);
                } catch (RuntimeException e) {
                        throw new FeedFetchException("Feed request to " + url + " failed: " + e.getMessage(), e);
                }

                if (body == null || body.length == 0) {
                        throw new FeedFetchException("Feed request to " + url + " returned an empty body");
                }
                return body;
        }
}
