package com.nextride.backend.model;

import com.google.transit.realtime.GtfsRealtime;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A feed message successfully fetched and parsed for one feed group.
 */
@Data
@AllArgsConstructor
public class FeedPayload {
    private String group;
    private GtfsRealtime.FeedMessage message;
}
