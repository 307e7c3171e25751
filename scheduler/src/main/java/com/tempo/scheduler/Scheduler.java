package com.tempo.scheduler;

import com.tempo.exception.ValidationException;
import com.tempo.job.Job;
import com.tempo.webhook.Dispatcher;
import com.tempo.webhook.WebhookResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fires webhooks for armed jobs on their cron schedules.
 * <p>
 * Lifecycle is {@code CREATED -> RUNNING -> STOPPED}; a stopped scheduler cannot be restarted.
 * A single daemon thread evaluates every second once, in order, and hands each due trigger to the
 * dispatch pool. The tick thread never waits for a dispatch, and {@link #stop()} neither waits for
 * nor interrupts dispatches already running. With a bounded pool, firings that find every thread
 * busy and the queue full are dropped.
 */
@Slf4j
public class Scheduler {
    /** Seconds the tick loop will replay after a stall; older misfires are skipped. */
    static final int MAX_CATCH_UP_SECONDS = 60;
    public static final int DEFAULT_DISPATCH_QUEUE_CAPACITY = 100;

    private final Dispatcher dispatcher;
    private final TriggerRegistry registry = new TriggerRegistry();
    private final Clock clock;
    private final ZoneId zone;
    private final RetryPolicy retryPolicy;
    private final SchedulerMetrics metrics;
    private final ThreadPoolExecutor dispatchPool;

    // guards state transitions, lastTick and the hand-off of due triggers to the pool
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private volatile SchedulerState state = SchedulerState.CREATED;
    private Instant lastTick;
    private Thread tickThread;

    private Scheduler(Builder b) {
        this.dispatcher = b.dispatcher;
        this.clock = b.clock;
        this.zone = b.zone;
        this.retryPolicy = b.retryPolicy;
        this.metrics = b.metrics;
        this.dispatchPool = b.dispatchThreads > 0
                ? new ThreadPoolExecutor(b.dispatchThreads, b.dispatchThreads, 0L, TimeUnit.MILLISECONDS,
                        new ArrayBlockingQueue<>(b.dispatchQueueCapacity), daemonThreads("tempo-dispatch"),
                        this::dropDispatch)
                : new ThreadPoolExecutor(0, Integer.MAX_VALUE, 60L, TimeUnit.SECONDS,
                        new SynchronousQueue<>(), daemonThreads("tempo-dispatch"), this::dropDispatch);
    }

    public static Builder builder(Dispatcher dispatcher) {
        return new Builder(dispatcher);
    }

    public static Scheduler fromConfig(Dispatcher dispatcher, TempoConfig config, SchedulerMetrics metrics) {
        return builder(dispatcher)
                .zone(config.getZone())
                .retryPolicy(config.getRetryPolicy())
                .dispatchThreads(config.getDispatchThreads())
                .dispatchQueueCapacity(config.getDispatchQueueCapacity())
                .metrics(metrics)
                .build();
    }

    /**
     * Arms {@code job}. A job that is incomplete or whose cron expression does not parse is logged
     * and skipped; nothing is thrown.
     *
     * @return whether the job was armed
     */
    public boolean addJob(Job job) {
        try {
            arm(job);
            return true;
        } catch (ValidationException e) {
            log.error("[scheduler] error adding job {}: {}", job.getId(), e.getMessage());
            return false;
        }
    }

    /**
     * Arms {@code job}, replacing an earlier trigger with the same id.
     *
     * @throws ValidationException when the job cannot be scheduled
     */
    public TriggerHandle arm(Job job) {
        CronSchedule schedule;
        try {
            job.requireSchedulable();
            schedule = CronSchedule.parse(job.getCronExpr());
        } catch (ValidationException e) {
            metrics.incArmRejected();
            throw e;
        }
        TriggerHandle handle = registry.arm(job, schedule);
        metrics.setTriggersArmed(registry.size());
        log.info("[scheduler] armed job {}: {} {} on '{}'", job.getId(), job.getMethod(), job.getUrl(), schedule);
        return handle;
    }

    /**
     * Disarms the trigger for {@code jobId}, if any. A dispatch already running is not affected.
     */
    public boolean removeJob(String jobId) {
        boolean removed = registry.disarm(jobId);
        if (removed) {
            metrics.setTriggersArmed(registry.size());
            log.info("[scheduler] disarmed job {}", jobId);
        }
        return removed;
    }

    public void start() {
        lifecycleLock.lock();
        try {
            if (state == SchedulerState.RUNNING) {
                return;
            }
            if (state == SchedulerState.STOPPED) {
                throw new IllegalStateException("scheduler has been stopped and cannot be restarted");
            }
            state = SchedulerState.RUNNING;
            lastTick = clock.instant().truncatedTo(ChronoUnit.SECONDS);
            tickThread = daemonThreads("tempo-tick").newThread(this::runTickLoop);
            tickThread.start();
        } finally {
            lifecycleLock.unlock();
        }
        log.info("[scheduler] started with {} armed trigger(s)", registry.size());
    }

    public void stop() {
        Thread ticker;
        lifecycleLock.lock();
        try {
            if (state == SchedulerState.STOPPED) {
                return;
            }
            state = SchedulerState.STOPPED;
            registry.clear();
            dispatchPool.shutdown();
            ticker = tickThread;
        } finally {
            lifecycleLock.unlock();
        }
        if (ticker != null) {
            ticker.interrupt();
        }
        metrics.setTriggersArmed(0);
        log.info("[scheduler] stopped");
    }

    /**
     * Evaluates every whole second after the last evaluated one up to {@code now}. Seconds already
     * evaluated are never evaluated again, and nothing fires unless the scheduler is running.
     *
     * @return number of triggers handed to the dispatch pool
     */
    public int advanceTo(Instant now) {
        Instant target = now.truncatedTo(ChronoUnit.SECONDS);
        lifecycleLock.lock();
        try {
            if (state != SchedulerState.RUNNING || !target.isAfter(lastTick)) {
                return 0;
            }
            Instant from = lastTick.plusSeconds(1);
            Instant earliest = target.minusSeconds(MAX_CATCH_UP_SECONDS - 1);
            if (from.isBefore(earliest)) {
                log.warn("[scheduler] skipping {} missed second(s) before {}",
                        Duration.between(from, earliest).getSeconds(), earliest);
                from = earliest;
            }
            int fired = 0;
            for (Instant t = from; !t.isAfter(target); t = t.plusSeconds(1)) {
                fired += fireDue(t.atZone(zone));
            }
            lastTick = target;
            return fired;
        } finally {
            lifecycleLock.unlock();
        }
    }

    public SchedulerState getState() {
        return state;
    }

    public boolean isArmed(String jobId) {
        return registry.isArmed(jobId);
    }

    public Set<String> armedJobIds() {
        return registry.armedIds();
    }

    public ZoneId getZone() {
        return zone;
    }

    // caller holds lifecycleLock
    private int fireDue(ZonedDateTime at) {
        List<Trigger> due = registry.dueAt(at);
        for (Trigger trigger : due) {
            metrics.incTriggerFired();
            Job job = trigger.getJob();
            dispatchPool.execute(new DispatchTask(job, at));
        }
        return due.size();
    }

    // called by the pool when a bounded pool and its queue are both full
    private void dropDispatch(Runnable task, ThreadPoolExecutor pool) {
        String jobId = task instanceof DispatchTask ? ((DispatchTask) task).job.getId() : "?";
        log.warn("[scheduler] dispatch pool saturated ({} active, {} queued), dropping firing of job {}",
                pool.getActiveCount(), pool.getQueue().size(), jobId);
        metrics.incDispatchDropped();
    }

    private void runTickLoop() {
        while (state == SchedulerState.RUNNING) {
            try {
                advanceTo(clock.instant());
            } catch (RuntimeException e) {
                log.error("[scheduler] tick failed", e);
            }
            long sleepMs = 1000 - Math.floorMod(clock.millis(), 1000L);
            try {
                Thread.sleep(Math.max(1, sleepMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("[scheduler] tick loop exited");
    }

    private void runDispatch(Job job, ZonedDateTime scheduledAt) {
        int attempts = 0;
        while (true) {
            attempts++;
            WebhookResult result;
            try {
                result = dispatcher.dispatch(job);
            } catch (RuntimeException e) {
                log.error("[scheduler] dispatch of job {} due at {} failed unexpectedly", job.getId(), scheduledAt, e);
                return;
            }
            if (result.isSuccess()) {
                log.info("[scheduler] job {} executed successfully: {} (status {})", job.getId(), job.getUrl(),
                        result.getStatusCode());
                return;
            }
            log.warn("[scheduler] error calling webhook for job {} (attempt {}/{}): {}", job.getId(), attempts,
                    retryPolicy.getMaxAttempts(), result);
            if (!retryPolicy.shouldRetry(attempts) || state != SchedulerState.RUNNING) {
                return;
            }
            Duration delay = retryPolicy.delayAfter(attempts);
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (state != SchedulerState.RUNNING) {
                log.info("[scheduler] scheduler stopped, dropping retry of job {}", job.getId());
                return;
            }
        }
    }

    private final class DispatchTask implements Runnable {
        private final Job job;
        private final ZonedDateTime scheduledAt;

        private DispatchTask(Job job, ZonedDateTime scheduledAt) {
            this.job = job;
            this.scheduledAt = scheduledAt;
        }

        @Override
        public void run() {
            runDispatch(job, scheduledAt);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static final class Builder {
        private final Dispatcher dispatcher;
        private Clock clock = Clock.systemDefaultZone();
        private ZoneId zone = ZoneId.systemDefault();
        private RetryPolicy retryPolicy = RetryPolicy.none();
        private SchedulerMetrics metrics = SchedulerMetrics.noop();
        private int dispatchThreads;
        private int dispatchQueueCapacity = DEFAULT_DISPATCH_QUEUE_CAPACITY;

        private Builder(Dispatcher dispatcher) {
            if (dispatcher == null) {
                throw new IllegalArgumentException("dispatcher is required");
            }
            this.dispatcher = dispatcher;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy == null ? RetryPolicy.none() : retryPolicy;
            return this;
        }

        public Builder metrics(SchedulerMetrics metrics) {
            this.metrics = metrics == null ? SchedulerMetrics.noop() : metrics;
            return this;
        }

        /**
         * Upper bound on concurrent dispatches; 0 (the default) leaves it unbounded.
         */
        public Builder dispatchThreads(int dispatchThreads) {
            this.dispatchThreads = Math.max(0, dispatchThreads);
            return this;
        }

        /**
         * Firings that may wait for a free thread when {@link #dispatchThreads} is set; further
         * firings are dropped and logged. Ignored for the unbounded pool.
         */
        public Builder dispatchQueueCapacity(int capacity) {
            this.dispatchQueueCapacity = Math.max(1, capacity);
            return this;
        }

        public Scheduler build() {
            return new Scheduler(this);
        }
    }
}
