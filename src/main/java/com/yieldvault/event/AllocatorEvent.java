package com.yieldvault.event;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the allocator for every strategy or crate state change. Carries the strategy
 * name (null for crate-level events) and before/after or delta values.
 */
public class AllocatorEvent extends ApplicationEvent {

    private final AllocatorEventType eventType;
    private final String strategyName;
    private final Map<String, Object> details;

    public AllocatorEvent(
            Object source, AllocatorEventType eventType, String strategyName, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.strategyName = strategyName;
        this.details = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
    }

    public AllocatorEventType getEventType() {
        return eventType;
    }

    public String getStrategyName() {
        return strategyName;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
