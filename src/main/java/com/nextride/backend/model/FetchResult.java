package com.nextride.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchResult {

    @Builder.Default
    private List<FeedPayload> payloads = new ArrayList<>();

    @Builder.Default
    private Set<String> failedGroups = new LinkedHashSet<>();

    public boolean hasFailures() {
        return !failedGroups.isEmpty();
    }
}
