package com.osa.aggregator.event;

/**
 * Receives dispatch events. Implementations run on the thread that raised the
 * event and should return quickly.
 */
public interface DispatchEventListener {
    void onEvent(DispatchEvent event);
}
