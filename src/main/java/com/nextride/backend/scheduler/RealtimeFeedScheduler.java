package com.nextride.backend.scheduler;

import com.nextride.backend.service.FeedPollingService;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RealtimeFeedScheduler {

    private final FeedPollingService feedPollingService;

    /**
     * Poll the realtime trip feeds on the scheduled interval
     */
    @Scheduled(fixedRateString = "${mta.polling.realtime.interval}", initialDelayString = "${mta.polling.initial-delay}")
    public void pollAndUpdate() {
        feedPollingService.refreshRealtime();
    }

}
