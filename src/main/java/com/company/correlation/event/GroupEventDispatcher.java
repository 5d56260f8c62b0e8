package com.company.correlation.event;

import com.company.correlation.domain.AlertGroup;
import com.company.correlation.domain.enums.GroupEventType;
import com.company.correlation.service.CorrelationStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans a group event out to every registered listener. A failing listener does not stop the rest.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GroupEventDispatcher {

    private final CorrelationStatistics statistics;
    private final List<GroupEventListener> listeners = new CopyOnWriteArrayList<>();

    public void register(GroupEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener must not be null");
        }
        listeners.add(listener);
        log.info("Registered group event listener: {}", listener.getClass().getSimpleName());
    }

    public void dispatch(GroupEventType type, AlertGroup group) {
        for (GroupEventListener listener : listeners) {
            try {
                listener.onGroupEvent(type, group);
            } catch (Exception e) {
                log.error("Group event listener {} failed on {} for group {}",
                        listener.getClass().getSimpleName(), type, group.getId(), e);
                statistics.recordCallbackFailure();
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
