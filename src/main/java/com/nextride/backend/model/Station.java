package com.nextride.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Station {

    private String stopId;
    private String stopName;
    private String address;

    // Route ids serving the station, parsed from the comma-joined trains column
    @Builder.Default
    private List<String> trains = new ArrayList<>();

    public static List<String> parseTrains(String trains) {
        if (trains == null || trains.trim().isEmpty()) {
            return new ArrayList<>();
        }
        return Arrays.stream(trains.split(","))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toList());
    }
}
