package com.tempo.scheduler;

/**
 * Metrics hook for the trigger loop. Default is no-op.
 */
public interface SchedulerMetrics {
    void setTriggersArmed(int count);

    void incTriggerFired();

    void incArmRejected();

    void incDispatchDropped();

    static SchedulerMetrics noop() {
        return new SchedulerMetrics() {
            public void setTriggersArmed(int count) {
            }

            public void incTriggerFired() {
            }

            public void incArmRejected() {
            }

            public void incDispatchDropped() {
            }
        };
    }
}
