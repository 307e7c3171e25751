package com.tempo.scheduler;

/**
 * Cancels the one trigger it was issued for. Cancelling after the job was re-armed under the same
 * id leaves the newer trigger alone.
 */
public final class TriggerHandle {
    private final TriggerRegistry registry;
    private final String jobId;
    private final long generation;

    TriggerHandle(TriggerRegistry registry, String jobId, long generation) {
        this.registry = registry;
        this.jobId = jobId;
        this.generation = generation;
    }

    public String getJobId() {
        return jobId;
    }

    /**
     * @return true when this call removed the trigger
     */
    public boolean cancel() {
        return registry.disarm(jobId, generation);
    }
}
