package com.nextride.backend.controller;

import com.nextride.backend.model.Subscription;
import com.nextride.backend.model.SubscriptionTarget;
import com.nextride.backend.service.SubscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/users/{username}/subscriptions")
@RequiredArgsConstructor
@Tag(name = "Subscriptions", description = "Station and route subscriptions for alerts")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @Operation(summary = "List Subscriptions", description = "Stations first, then routes.")
    @GetMapping
    public List<Subscription> getSubscriptions(
            @Parameter(description = "User name", required = true) @PathVariable String username) {
        return subscriptionService.getSubscriptions(username);
    }

    @Operation(summary = "Subscribe to Station", description = "Follow alerts for a station. Returns 409 when already subscribed.")
    @PostMapping("/stops/{stopId}")
    public ResponseEntity<String> subscribeStation(@PathVariable String username, @PathVariable String stopId) {
        return subscribe(username, SubscriptionTarget.stop(stopId), "station " + stopId);
    }

    @Operation(summary = "Subscribe to Route", description = "Follow alerts for a route. Returns 409 when already subscribed.")
    @PostMapping("/routes/{routeId}")
    public ResponseEntity<String> subscribeRoute(@PathVariable String username, @PathVariable String routeId) {
        return subscribe(username, SubscriptionTarget.route(routeId), "route " + routeId);
    }

    @Operation(summary = "Unsubscribe", description = "Remove one of the user's subscriptions.")
    @DeleteMapping("/{subscriptionId}")
    public ResponseEntity<String> unsubscribe(@PathVariable String username, @PathVariable long subscriptionId) {
        if (subscriptionService.unsubscribe(username, subscriptionId)) {
            return ResponseEntity.ok("Successfully unsubscribed!");
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("No such subscription.");
    }

    private ResponseEntity<String> subscribe(String username, SubscriptionTarget target, String label) {
        if (subscriptionService.subscribe(username, target)) {
            return ResponseEntity.status(HttpStatus.CREATED).body("Successfully subscribed to " + label + ".");
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body("You are already subscribed to " + label + ".");
    }
}
