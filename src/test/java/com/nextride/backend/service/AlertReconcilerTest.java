package com.nextride.backend.service;

import com.nextride.backend.model.Alert;
import com.nextride.backend.repository.AlertRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertReconcilerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T14:00:00Z");

    @Mock
    private AlertRepository alertRepository;

    private AlertReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new AlertReconciler(alertRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testReconcile_UpsertsEachAlertWithSameTimestamp() {
        Alert first = Alert.builder().alertId("a1").headerText("A delays").build();
        Alert second = Alert.builder().alertId("a2").headerText("L suspended").build();

        int written = reconciler.reconcile(List.of(first, second));

        assertEquals(2, written);
        verify(alertRepository).upsertAlert(first, NOW);
        verify(alertRepository).upsertAlert(second, NOW);
    }

    @Test
    void testReconcile_SkipsAlertsWithoutId() {
        int written = reconciler.reconcile(List.of(Alert.builder().alertId("").build(),
                Alert.builder().alertId("a1").build()));

        assertEquals(1, written);
        verify(alertRepository, times(1)).upsertAlert(any(Alert.class), eq(NOW));
    }

    @Test
    void testReconcile_EmptyBatchWritesNothing() {
        assertEquals(0, reconciler.reconcile(Collections.emptyList()));
        verifyNoInteractions(alertRepository);
    }

    @Test
    void testReconcile_StorageFailureStopsRun() {
        Alert first = Alert.builder().alertId("a1").build();
        Alert second = Alert.builder().alertId("a2").build();
        doThrow(new DataAccessResourceFailureException("down")).when(alertRepository).upsertAlert(first, NOW);

        assertThrows(DataAccessResourceFailureException.class, () -> reconciler.reconcile(List.of(first, second)));
        verify(alertRepository, never()).upsertAlert(second, NOW);
    }
}
