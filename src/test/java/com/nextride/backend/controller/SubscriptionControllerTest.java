package com.nextride.backend.controller;

import com.nextride.backend.exception.GlobalExceptionHandler;
import com.nextride.backend.model.Subscription;
import com.nextride.backend.model.SubscriptionTarget;
import com.nextride.backend.service.SubscriptionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SubscriptionControllerTest {

    @Mock
    private SubscriptionService subscriptionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SubscriptionController(subscriptionService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testSubscribeStation_Created() throws Exception {
        when(subscriptionService.subscribe("rider", SubscriptionTarget.stop("127"))).thenReturn(true);

        mockMvc.perform(post("/api/v1/users/rider/subscriptions/stops/127"))
                .andExpect(status().isCreated());
    }

    @Test
    void testSubscribeRoute_AlreadySubscribed() throws Exception {
        when(subscriptionService.subscribe("rider", SubscriptionTarget.route("A"))).thenReturn(false);

        mockMvc.perform(post("/api/v1/users/rider/subscriptions/routes/A"))
                .andExpect(status().isConflict());
    }

    @Test
    void testGetSubscriptions() throws Exception {
        when(subscriptionService.getSubscriptions("rider")).thenReturn(List.of(
                Subscription.builder().subscriptionId(3L).userId(1L).target(SubscriptionTarget.stop("127")).build(),
                Subscription.builder().subscriptionId(4L).userId(1L).target(SubscriptionTarget.route("A")).build()));

        mockMvc.perform(get("/api/v1/users/rider/subscriptions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].target.stopId").value("127"))
                .andExpect(jsonPath("$[1].target.routeId").value("A"))
                .andExpect(jsonPath("$[1].target.type").value("ROUTE"));
    }

    @Test
    void testUnsubscribe() throws Exception {
        when(subscriptionService.unsubscribe("rider", 3L)).thenReturn(true);
        when(subscriptionService.unsubscribe("rider", 99L)).thenReturn(false);

        mockMvc.perform(delete("/api/v1/users/rider/subscriptions/3"))
                .andExpect(status().isOk());
        mockMvc.perform(delete("/api/v1/users/rider/subscriptions/99"))
                .andExpect(status().isNotFound());
    }
}
