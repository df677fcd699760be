package com.nextride.backend.service;

import com.nextride.backend.model.StopTimeUpdate;
import com.nextride.backend.model.TripUpdate;
import com.nextride.backend.repository.RealtimeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RealtimeReconcilerTest {

    @Mock
    private RealtimeRepository realtimeRepository;

    @Captor
    private ArgumentCaptor<List<TripUpdate>> tripsCaptor;

    @Captor
    private ArgumentCaptor<List<StopTimeUpdate>> stopTimesCaptor;

    private RealtimeReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new RealtimeReconciler(realtimeRepository);
    }

    @Test
    void testReconcile_FirstOccurrenceWins() {
        List<TripUpdate> trips = List.of(trip("T1", "1"), trip("T2", "2"), trip("T1", "3"));
        List<StopTimeUpdate> stopTimes = List.of(
                stopTime("T1", "127N", 100),
                stopTime("T1", "127N", 200),
                stopTime("T1", "128N", 300),
                stopTime("T2", "127N", 400));

        RealtimeReconciler.Result result = reconciler.reconcile(trips, stopTimes);

        assertEquals(2, result.getTripUpdates());
        assertEquals(3, result.getStopTimeUpdates());
        assertEquals(2, result.getDuplicatesDropped());

        verify(realtimeRepository).replaceLiveState(tripsCaptor.capture(), stopTimesCaptor.capture());
        assertEquals("1", tripsCaptor.getValue().get(0).getRouteId());
        assertEquals(Instant.ofEpochSecond(100), stopTimesCaptor.getValue().get(0).getDepartureTime());
        assertEquals("128N", stopTimesCaptor.getValue().get(1).getStopId());
    }

    @Test
    void testReconcile_EmptyBatchStillReplaces() {
        RealtimeReconciler.Result result = reconciler.reconcile(Collections.emptyList(), Collections.emptyList());

        assertEquals(0, result.getTripUpdates());
        verify(realtimeRepository).replaceLiveState(Collections.emptyList(), Collections.emptyList());
    }

    @Test
    void testReconcile_StorageFailurePropagates() {
        doThrow(new DataAccessResourceFailureException("connection refused"))
                .when(realtimeRepository).replaceLiveState(anyList(), anyList());

        assertThrows(DataAccessResourceFailureException.class,
                () -> reconciler.reconcile(List.of(trip("T1", "1")), List.of(stopTime("T1", "127N", 100))));
    }

    private static TripUpdate trip(String tripId, String routeId) {
        return TripUpdate.builder().tripId(tripId).routeId(routeId).build();
    }

    private static StopTimeUpdate stopTime(String tripId, String stopId, long epochSeconds) {
        return StopTimeUpdate.builder()
                .tripId(tripId)
                .stopId(stopId)
                .departureTime(Instant.ofEpochSecond(epochSeconds))
                .build();
    }
}
