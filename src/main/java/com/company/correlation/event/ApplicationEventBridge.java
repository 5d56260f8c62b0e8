package com.company.correlation.event;

import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.enums.GroupEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Republishes group events on the Spring event bus as {@link AlertGroupEvent}
 */
@Component
@RequiredArgsConstructor
public class ApplicationEventBridge implements GroupEventListener {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void onGroupEvent(GroupEventType type, AlertGroup group) {
        eventPublisher.publishEvent(new AlertGroupEvent(type, group));
    }
}
