package com.flagship.shipping_workflow.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final BacklogMetrics backlogMetrics;

    @Scheduled(initialDelay = 0, fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshBacklog() {
        backlogMetrics.refresh();
    }
}
