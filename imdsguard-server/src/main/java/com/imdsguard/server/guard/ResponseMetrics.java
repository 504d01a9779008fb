package com.imdsguard.server.guard;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/** Per-handler response counters, tagged by status class. */
public class ResponseMetrics {

    public static final String HANDLER_RESPONSES = "imdsguard.handler.responses";

    private final MeterRegistry registry;

    public ResponseMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void record(String handler, int status) {
        counter(handler, StatusBucket.of(status)).increment();
    }

    public double count(String handler, StatusBucket bucket) {
        Counter counter = registry.find(HANDLER_RESPONSES)
                .tag("handler", handler)
                .tag("status", bucket.label())
                .counter();
        return counter == null ? 0 : counter.count();
    }

    private Counter counter(String handler, StatusBucket bucket) {
        return Counter.builder(HANDLER_RESPONSES)
                .description("Responses written by guarded handlers")
                .tag("handler", handler)
                .tag("status", bucket.label())
                .register(registry);
    }
}
