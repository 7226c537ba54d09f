package com.osa.aggregator.event;

import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DispatchEventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(DispatchEventPublisher.class);

    private final List<DispatchEventListener> listeners;

    public DispatchEventPublisher(List<DispatchEventListener> listeners) {
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public static DispatchEventPublisher noop() {
        return new DispatchEventPublisher(List.of());
    }

    public void publish(DispatchEventType type, String backendId, Map<String, Object> attributes) {
        publish(DispatchEvent.of(type, backendId, attributes));
    }

    public void publish(DispatchEvent event) {
        for (DispatchEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn(
                    "dispatch_event_listener_failed listener={} event={} message={}",
                    listener.getClass().getSimpleName(),
                    event.getType().getCode(),
                    e.getMessage()
                );
            }
        }
    }
}
