package com.nextride.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Window during which an alert is in effect. A null start is unbounded in the
 * past, a null end is unbounded in the future.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivePeriod {
    private Instant start;
    private Instant end;
}
