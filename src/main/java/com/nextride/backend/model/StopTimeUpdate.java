package com.nextride.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StopTimeUpdate {
    private String tripId;
    private String stopId; // platform id, e.g. 127N
    private Instant arrivalTime;
    private Instant departureTime;
}
