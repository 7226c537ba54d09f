package com.osa.aggregator.event;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsDispatchEventListener implements DispatchEventListener {
    private final MeterRegistry meterRegistry;

    public MetricsDispatchEventListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onEvent(DispatchEvent event) {
        String backend = event.getBackendId() == null ? "none" : event.getBackendId();
        meterRegistry.counter(
            "aggregator_dispatch_events_total",
            "type",
            event.getType().getCode(),
            "backend",
            backend
        ).increment();
    }
}
