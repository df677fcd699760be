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
public class UserAlert {
    private String alertId;
    private String headerText;
    private String descriptionText;
    private Instant startTime;
    private Instant endTime;
    private AlertStatus status;
    private String entityId;
}
