package com.nextride.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Feed group endpoints, keyed by group name. Groups keep their configured
 * order.
 */
@Data
@ConfigurationProperties(prefix = "mta.feeds")
public class FeedProperties {

    /**
     * Trip update feeds, one per group of subway lines.
     */
    private Map<String, String> realtime = new LinkedHashMap<>();

    /**
     * Service alert feeds.
     */
    private Map<String, String> alerts = new LinkedHashMap<>();
}
