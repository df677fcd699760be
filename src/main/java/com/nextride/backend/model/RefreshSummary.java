package com.nextride.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshSummary {
    private String feed;
    private LocalDateTime timestamp;
    private String status; // SUCCESS, PARTIAL, NO_DATA or FAILED
    private Integer groupsFetched;
    private List<String> failedGroups;
    private Integer tripUpdates;
    private Integer stopTimeUpdates;
    private Integer alerts;
    private Long processingTimeMs;
    private String message;
}
