package com.nextride.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    private String alertId;
    private String headerText;
    private String descriptionText;
    private Instant lastUpdated;

    @Builder.Default
    private List<ActivePeriod> activePeriods = new ArrayList<>();

    @Builder.Default
    private List<InformedEntity> informedEntities = new ArrayList<>();
}
