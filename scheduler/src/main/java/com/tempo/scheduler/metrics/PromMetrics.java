package com.tempo.scheduler.metrics;

import com.tempo.scheduler.SchedulerMetrics;
import com.tempo.webhook.DispatchMetrics;
import com.tempo.webhook.WebhookResult;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.hotspot.DefaultExports;

/**
 * Prometheus-backed implementation of the dispatcher and scheduler metrics hooks.
 */
public class PromMetrics implements DispatchMetrics, SchedulerMetrics {
    private final CollectorRegistry registry;
    private final Counter dispatchTotal;
    private final Histogram dispatchDurationSeconds;
    private final Gauge triggersArmed;
    private final Counter triggersFired;
    private final Counter armRejected;
    private final Counter dispatchDropped;

    public PromMetrics(CollectorRegistry registry) {
        this(registry, true);
    }

    public PromMetrics(CollectorRegistry registry, boolean jvmMetrics) {
        this.registry = registry;
        if (jvmMetrics) {
            // registers into the default registry, once per JVM
            DefaultExports.initialize();
        }

        this.dispatchTotal = Counter.build()
                .name("tempo_webhook_dispatch_total")
                .help("Webhook dispatches by outcome")
                .labelNames("outcome")
                .register(registry);
        this.dispatchDurationSeconds = Histogram.build()
                .name("tempo_webhook_dispatch_duration_seconds")
                .help("Webhook dispatch duration in seconds")
                .buckets(0.05, 0.1, 0.25, 0.5, 1, 2, 5, 10, 30)
                .register(registry);
        this.triggersArmed = Gauge.build()
                .name("tempo_triggers_armed")
                .help("Currently armed triggers")
                .register(registry);
        this.triggersFired = Counter.build()
                .name("tempo_trigger_fired_total")
                .help("Triggers found due and handed to the dispatch pool")
                .register(registry);
        this.armRejected = Counter.build()
                .name("tempo_arm_rejected_total")
                .help("Jobs skipped at arm time because they could not be scheduled")
                .register(registry);
        this.dispatchDropped = Counter.build()
                .name("tempo_dispatch_dropped_total")
                .help("Firings dropped because the bounded dispatch pool was full")
                .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void observeDispatch(WebhookResult.Kind outcome, double seconds) {
        dispatchTotal.labels(outcome.label()).inc();
        dispatchDurationSeconds.observe(seconds);
    }

    @Override
    public void setTriggersArmed(int count) {
        triggersArmed.set(count);
    }

    @Override
    public void incTriggerFired() {
        triggersFired.inc();
    }

    @Override
    public void incArmRejected() {
        armRejected.inc();
    }

    @Override
    public void incDispatchDropped() {
        dispatchDropped.inc();
    }
}
