package com.osa.aggregator.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class DispatchEvent {
    private final DispatchEventType type;
    private final String backendId;
    private final long timestamp;
    private final Map<String, Object> attributes;

    public DispatchEvent(DispatchEventType type, String backendId, long timestamp, Map<String, Object> attributes) {
        this.type = type;
        this.backendId = backendId;
        this.timestamp = timestamp;
        this.attributes = attributes == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static DispatchEvent of(DispatchEventType type, String backendId, Map<String, Object> attributes) {
        return new DispatchEvent(type, backendId, System.currentTimeMillis(), attributes);
    }

    public DispatchEventType getType() {
        return type;
    }

    public String getBackendId() {
        return backendId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return type.getCode() + " backend=" + backendId + " " + attributes;
    }
}
