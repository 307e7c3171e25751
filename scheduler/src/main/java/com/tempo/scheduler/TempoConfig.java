package com.tempo.scheduler;

import com.tempo.webhook.HttpWebhookDispatcher;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

/**
 * Runtime settings, read from {@code TEMPO_*} environment variables with the defaults below.
 * Command-line options override individual values through the {@code with*} copies.
 */
public final class TempoConfig {
    private final Path dataDir;
    private final Duration httpTimeout;
    private final int dispatchThreads;
    private final int dispatchQueueCapacity;
    private final RetryPolicy retryPolicy;
    private final ZoneId zone;
    private final int metricsPort;

    public TempoConfig(Path dataDir, Duration httpTimeout, int dispatchThreads, int dispatchQueueCapacity,
                       RetryPolicy retryPolicy, ZoneId zone, int metricsPort) {
        this.dataDir = dataDir;
        this.httpTimeout = httpTimeout;
        this.dispatchThreads = dispatchThreads;
        this.dispatchQueueCapacity = dispatchQueueCapacity;
        this.retryPolicy = retryPolicy;
        this.zone = zone;
        this.metricsPort = metricsPort;
    }

    public static TempoConfig defaults() {
        return fromEnv(Map.of());
    }

    public static TempoConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static TempoConfig fromEnv(Map<String, String> env) {
        String dataDir = env(env, "TEMPO_DATA_DIR", "");
        long timeoutSeconds = Long.parseLong(env(env, "TEMPO_HTTP_TIMEOUT_SECONDS",
                String.valueOf(HttpWebhookDispatcher.DEFAULT_TIMEOUT.getSeconds())));
        int threads = Integer.parseInt(env(env, "TEMPO_DISPATCH_THREADS", "0"));
        int queue = Integer.parseInt(env(env, "TEMPO_DISPATCH_QUEUE",
                String.valueOf(Scheduler.DEFAULT_DISPATCH_QUEUE_CAPACITY)));
        int maxAttempts = Integer.parseInt(env(env, "TEMPO_MAX_ATTEMPTS", "1"));
        long baseMs = Long.parseLong(env(env, "TEMPO_BACKOFF_BASE_MS", "1000"));
        long maxMs = Long.parseLong(env(env, "TEMPO_BACKOFF_MAX_MS", "60000"));
        String timezone = env(env, "TEMPO_TIMEZONE", "");
        int metricsPort = Integer.parseInt(env(env, "TEMPO_METRICS_PORT", "0"));

        return new TempoConfig(
                dataDir.isBlank() ? null : Paths.get(dataDir),
                Duration.ofSeconds(timeoutSeconds),
                Math.max(0, threads),
                Math.max(1, queue),
                new RetryPolicy(maxAttempts, Duration.ofMillis(baseMs), Duration.ofMillis(maxMs)),
                timezone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timezone.trim()),
                metricsPort);
    }

    private static String env(Map<String, String> env, String k, String d) {
        String v = env.get(k);
        return v == null ? d : v;
    }

    /**
     * Store directory, or null for the default {@code ~/.tempo}.
     */
    public Path getDataDir() {
        return dataDir;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    /**
     * Size of the dispatch pool; 0 means one thread per in-flight dispatch.
     */
    public int getDispatchThreads() {
        return dispatchThreads;
    }

    /**
     * Firings that may wait for a thread of a bounded dispatch pool before new ones are dropped.
     */
    public int getDispatchQueueCapacity() {
        return dispatchQueueCapacity;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public ZoneId getZone() {
        return zone;
    }

    public int getMetricsPort() {
        return metricsPort;
    }

    public TempoConfig withDataDir(Path dir) {
        return dir == null ? this
                : new TempoConfig(dir, httpTimeout, dispatchThreads, dispatchQueueCapacity, retryPolicy, zone,
                        metricsPort);
    }

    public TempoConfig withMetricsPort(Integer port) {
        return port == null ? this
                : new TempoConfig(dataDir, httpTimeout, dispatchThreads, dispatchQueueCapacity, retryPolicy, zone,
                        port);
    }

    @Override
    public String toString() {
        return "TempoConfig{dataDir=" + dataDir + ", httpTimeout=" + httpTimeout + ", dispatchThreads="
                + dispatchThreads + ", dispatchQueueCapacity=" + dispatchQueueCapacity + ", retry=" + retryPolicy
                + ", zone=" + zone + ", metricsPort=" + metricsPort + "}";
    }
}
