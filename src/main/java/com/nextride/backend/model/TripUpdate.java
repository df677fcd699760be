package com.nextride.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripUpdate {
    private String tripId;
    private LocalDateTime startDateTime; // null unless both start date and start time were sent
    private String routeId;
}
