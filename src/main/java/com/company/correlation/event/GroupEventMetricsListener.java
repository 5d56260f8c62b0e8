package com.company.correlation.event;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class GroupEventMetricsListener {

    private final MeterRegistry meterRegistry;

    @EventListener
    public void onAlertGroupEvent(AlertGroupEvent event) {
        meterRegistry.counter("correlation.group.events",
                "type", event.getType().name().toLowerCase()
        ).increment();

        log.debug("Group {} event {}", event.getGroup().getId(), event.getType());
    }
}
