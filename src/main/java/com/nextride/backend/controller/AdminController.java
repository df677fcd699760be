package com.nextride.backend.controller;

import com.nextride.backend.model.RefreshSummary;
import com.nextride.backend.service.FeedPollingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import io.swagger.v3.oas.annotations.responses.ApiResponse;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin", description = "Manual feed refreshes, for deployments driven by an external scheduler")
public class AdminController {

    private final FeedPollingService feedPollingService;

    @Operation(summary = "Trigger Realtime Refresh", description = "Fetches all realtime feed groups and replaces live trip state.")
    @ApiResponse(responseCode = "200", description = "Refresh ran; see status for the outcome")
    @GetMapping("/refresh/realtime")
    public ResponseEntity<RefreshSummary> refreshRealtime() {
        log.info("🔄 ADMIN: Manual realtime refresh triggered");
        return ResponseEntity.ok(feedPollingService.refreshRealtime());
    }

    @Operation(summary = "Trigger Alerts Refresh", description = "Fetches the alerts feed and upserts alerts.")
    @ApiResponse(responseCode = "200", description = "Refresh ran; see status for the outcome")
    @GetMapping("/refresh/alerts")
    public ResponseEntity<RefreshSummary> refreshAlerts() {
        log.info("🔄 ADMIN: Manual alerts refresh triggered");
        return ResponseEntity.ok(feedPollingService.refreshAlerts());
    }
}
