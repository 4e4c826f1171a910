package com.condortrader.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published for lifecycle and connection events: startup finished, feed state changes,
 * shutdown and fatal termination.
 */
public class SystemEvent extends ApplicationEvent {

    private final SystemEventType eventType;
    private final String message;
    private final Map<String, Object> details;

    public SystemEvent(Object source, SystemEventType eventType, String message) {
        this(source, eventType, message, null);
    }

    public SystemEvent(Object source, SystemEventType eventType, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public SystemEventType getEventType() {
        return eventType;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Event-specific details, e.g. {@code {"exitCode": 2, "attempts": 10}} for
     * FEED_UNAVAILABLE.
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
