package com.tempo.scheduler;

import com.tempo.job.Job;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * A job paired with its parsed schedule while it is armed in a {@link TriggerRegistry}.
 * <p>
 * Keeps the next firing time so that checking the seconds between two firings costs a comparison
 * rather than a schedule search.
 */
public final class Trigger {
    private final Job job;
    private final CronSchedule schedule;
    private final long generation;

    // next is the first firing after cursor, or null when there is none
    private ZonedDateTime cursor;
    private ZonedDateTime next;

    Trigger(Job job, CronSchedule schedule, long generation) {
        this.job = job;
        this.schedule = schedule;
        this.generation = generation;
    }

    public Job getJob() {
        return job;
    }

    public String getJobId() {
        return job.getId();
    }

    long getGeneration() {
        return generation;
    }

    /**
     * Same answer as {@link CronSchedule#isDue} for {@code time}.
     */
    public synchronized boolean isDue(ZonedDateTime time) {
        ZonedDateTime t = time.truncatedTo(ChronoUnit.SECONDS);
        if (cursor == null
                || !t.getZone().equals(cursor.getZone())
                || !t.isAfter(cursor)
                || (next != null && t.isAfter(next))) {
            cursor = t.minusSeconds(1);
            next = schedule.nextExecution(cursor).orElse(null);
        }
        return next != null && next.isEqual(t);
    }

    @Override
    public String toString() {
        return "Trigger{job=" + job.getId() + ", cron=" + schedule + "}";
    }
}
