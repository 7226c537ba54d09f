package com.osa.aggregator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingDispatchEventListener implements DispatchEventListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingDispatchEventListener.class);

    @Override
    public void onEvent(DispatchEvent event) {
        switch (event.getType()) {
            case BACKEND_FAILED -> logger.warn(
                "{} backend={} attributes={}",
                event.getType().getCode(),
                event.getBackendId(),
                event.getAttributes()
            );
            case BACKEND_RECOVERED, REQUEST_COMPLETED -> logger.info(
                "{} backend={} attributes={}",
                event.getType().getCode(),
                event.getBackendId(),
                event.getAttributes()
            );
            default -> logger.debug(
                "{} backend={} attributes={}",
                event.getType().getCode(),
                event.getBackendId(),
                event.getAttributes()
            );
        }
    }
}
