package com.nextride.backend.controller;

import com.nextride.backend.model.AlertStatus;
import com.nextride.backend.model.UserAlert;
import com.nextride.backend.service.AlertMatcherService;
import com.nextride.backend.service.SubscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
@Tag(name = "Alerts", description = "Service alerts for a rider's subscriptions")
public class AlertController {

    private final AlertMatcherService alertMatcherService;
    private final SubscriptionService subscriptionService;

    @Operation(summary = "Get User Alerts", description = "Alerts matching the user's station and route subscriptions, grouped by route or stop. Only active alerts are returned unless includeInactive is set.")
    @GetMapping("/{username}/alerts")
    public Map<String, List<UserAlert>> getUserAlerts(
            @Parameter(description = "User name", required = true) @PathVariable String username,
            @Parameter(description = "Also return upcoming and past alerts") @RequestParam(defaultValue = "false") boolean includeInactive) {
        Optional<Long> userId = subscriptionService.findUserId(username);
        if (userId.isEmpty()) {
            return Collections.emptyMap();
        }
        List<UserAlert> alerts = alertMatcherService.getUserAlerts(userId.get());
        if (!includeInactive) {
            alerts = alerts.stream()
                    .filter(alert -> alert.getStatus() == AlertStatus.ACTIVE)
                    .collect(Collectors.toList());
        }
        return alertMatcherService.groupByEntity(alerts);
    }
}
