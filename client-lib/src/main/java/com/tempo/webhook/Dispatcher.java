package com.tempo.webhook;

import com.tempo.job.Job;

/**
 * Performs one webhook call for a job and classifies what happened. Implementations never throw
 * for transport or HTTP failures; those come back as a failed {@link WebhookResult}.
 */
public interface Dispatcher {
    WebhookResult dispatch(Job job);
}
