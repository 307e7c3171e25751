package com.tempo.scheduler;

import com.tempo.job.Job;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The live set of armed triggers, keyed by job id. Holds its own copies of jobs and never calls
 * into the job store.
 */
public class TriggerRegistry {
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Trigger> triggers = new LinkedHashMap<>();
    private long generations;

    /**
     * Arms {@code job}, replacing any trigger already registered under its id.
     */
    public TriggerHandle arm(Job job, CronSchedule schedule) {
        lock.lock();
        try {
            long generation = ++generations;
            triggers.put(job.getId(), new Trigger(job, schedule, generation));
            return new TriggerHandle(this, job.getId(), generation);
        } finally {
            lock.unlock();
        }
    }

    public boolean disarm(String jobId) {
        lock.lock();
        try {
            return triggers.remove(jobId) != null;
        } finally {
            lock.unlock();
        }
    }

    boolean disarm(String jobId, long generation) {
        lock.lock();
        try {
            Trigger current = triggers.get(jobId);
            if (current == null || current.getGeneration() != generation) {
                return false;
            }
            triggers.remove(jobId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Triggers whose schedule matches {@code time}. The lock is held only while copying the set,
     * not while schedules are evaluated.
     */
    public List<Trigger> dueAt(ZonedDateTime time) {
        List<Trigger> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(triggers.values());
        } finally {
            lock.unlock();
        }
        List<Trigger> due = new ArrayList<>();
        for (Trigger trigger : snapshot) {
            if (trigger.isDue(time)) {
                due.add(trigger);
            }
        }
        return due;
    }

    public void clear() {
        lock.lock();
        try {
            triggers.clear();
        } finally {
            lock.unlock();
        }
    }

    public boolean isArmed(String jobId) {
        lock.lock();
        try {
            return triggers.containsKey(jobId);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> armedIds() {
        lock.lock();
        try {
            return new TreeSet<>(triggers.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return triggers.size();
        } finally {
            lock.unlock();
        }
    }
}
