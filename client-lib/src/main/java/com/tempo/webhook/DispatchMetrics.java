package com.tempo.webhook;

/**
 * Minimal metrics hook for the dispatcher. Default is no-op.
 */
public interface DispatchMetrics {
    void observeDispatch(WebhookResult.Kind outcome, double seconds);

    static DispatchMetrics noop() {
        return (outcome, seconds) -> {
        };
    }
}
