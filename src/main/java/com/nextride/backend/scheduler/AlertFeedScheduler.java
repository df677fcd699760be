package com.nextride.backend.scheduler;

import com.nextride.backend.service.FeedPollingService;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AlertFeedScheduler {

    private final FeedPollingService feedPollingService;

    /**
     * Poll the subway alerts feed on the scheduled interval
     */
    @Scheduled(fixedRateString = "${mta.polling.alerts.interval}", initialDelayString = "${mta.polling.initial-delay}")
    public void pollAndUpdate() {
        feedPollingService.refreshAlerts();
    }

}
