package com.tempo.scheduler;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

public class TempoConfigTest {

    @Test
    public void defaultsWithoutEnvironment() {
        TempoConfig c = TempoConfig.defaults();
        assertThat(c.getDataDir(), is(nullValue()));
        assertThat(c.getHttpTimeout(), is(Duration.ofSeconds(10)));
        assertThat(c.getDispatchThreads(), is(0));
        assertThat(c.getDispatchQueueCapacity(), is(Scheduler.DEFAULT_DISPATCH_QUEUE_CAPACITY));
        assertThat(c.getRetryPolicy().getMaxAttempts(), is(1));
        assertThat(c.getZone(), is(ZoneId.systemDefault()));
        assertThat(c.getMetricsPort(), is(0));
    }

    @Test
    public void readsEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("TEMPO_DATA_DIR", "/var/lib/tempo");
        env.put("TEMPO_HTTP_TIMEOUT_SECONDS", "3");
        env.put("TEMPO_DISPATCH_THREADS", "8");
        env.put("TEMPO_DISPATCH_QUEUE", "16");
        env.put("TEMPO_MAX_ATTEMPTS", "4");
        env.put("TEMPO_BACKOFF_BASE_MS", "250");
        env.put("TEMPO_BACKOFF_MAX_MS", "2000");
        env.put("TEMPO_TIMEZONE", "Europe/Berlin");
        env.put("TEMPO_METRICS_PORT", "9400");

        TempoConfig c = TempoConfig.fromEnv(env);
        assertThat(c.getDataDir(), is(Paths.get("/var/lib/tempo")));
        assertThat(c.getHttpTimeout(), is(Duration.ofSeconds(3)));
        assertThat(c.getDispatchThreads(), is(8));
        assertThat(c.getDispatchQueueCapacity(), is(16));
        assertThat(c.getRetryPolicy().getMaxAttempts(), is(4));
        assertThat(c.getRetryPolicy().getBaseDelay(), is(Duration.ofMillis(250)));
        assertThat(c.getRetryPolicy().getMaxDelay(), is(Duration.ofMillis(2000)));
        assertThat(c.getZone(), is(ZoneId.of("Europe/Berlin")));
        assertThat(c.getMetricsPort(), is(9400));
    }

    @Test
    public void overridesKeepOtherValues() {
        Map<String, String> env = new HashMap<>();
        env.put("TEMPO_METRICS_PORT", "9400");
        TempoConfig c = TempoConfig.fromEnv(env).withDataDir(Paths.get("/tmp/x")).withMetricsPort(null);
        assertThat(c.getDataDir(), is(Paths.get("/tmp/x")));
        assertThat(c.getMetricsPort(), is(9400));
        assertThat(c.withDataDir(null).getDataDir(), is(Paths.get("/tmp/x")));
        assertThat(c.withMetricsPort(0).getMetricsPort(), is(0));
    }
}
