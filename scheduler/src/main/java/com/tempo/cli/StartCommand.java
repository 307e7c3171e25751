package com.tempo.cli;

import com.tempo.exception.TempoException;
import com.tempo.exception.ValidationException;
import com.tempo.job.Job;
import com.tempo.scheduler.Scheduler;
import com.tempo.scheduler.SchedulerMetrics;
import com.tempo.scheduler.TempoConfig;
import com.tempo.scheduler.metrics.MetricsServer;
import com.tempo.scheduler.metrics.PromMetrics;
import com.tempo.store.JobStore;
import com.tempo.webhook.DispatchMetrics;
import com.tempo.webhook.HttpWebhookDispatcher;
import io.prometheus.client.CollectorRegistry;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Loads every stored job, arms it and keeps firing webhooks until the process is interrupted.
 */
@Slf4j
@Command(name = "start",
        description = "Start the scheduler in the foreground; stop it with Ctrl+C.",
        mixinStandardHelpOptions = true)
public class StartCommand implements Callable<Integer> {
    @Spec
    CommandSpec spec;

    @Mixin
    StoreOptions store;

    @Option(names = "--metrics-port",
            description = "Serve /metrics, /healthz and /readyz on this port (default: $TEMPO_METRICS_PORT, 0 disables)")
    Integer metricsPort;

    @Option(names = {"--foreground", "-f"}, description = "Run in the foreground (the only mode)")
    boolean foreground;

    @Override
    public Integer call() throws InterruptedException {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Starting Tempo scheduler...");
        out.flush();

        TempoConfig config = store.config().withMetricsPort(metricsPort);
        JobStore jobs = JobStore.open(config.getDataDir());

        PromMetrics prom = config.getMetricsPort() > 0 ? new PromMetrics(CollectorRegistry.defaultRegistry, true) : null;
        DispatchMetrics dispatchMetrics = prom != null ? prom : DispatchMetrics.noop();
        SchedulerMetrics schedulerMetrics = prom != null ? prom : SchedulerMetrics.noop();

        HttpWebhookDispatcher dispatcher = new HttpWebhookDispatcher(config.getHttpTimeout(), dispatchMetrics);
        Scheduler scheduler = Scheduler.fromConfig(dispatcher, config, schedulerMetrics);

        int armed = armAll(jobs, scheduler, out);
        if (jobs.size() == 0) {
            out.println("No jobs configured. Use 'tempo add' to create jobs.");
        }
        out.printf("Loaded %d job(s), %d armed%n", jobs.size(), armed);

        MetricsServer metricsServer = null;
        if (prom != null) {
            try {
                metricsServer = MetricsServer.start(config.getMetricsPort(), prom.getRegistry(), scheduler);
            } catch (IOException e) {
                throw new TempoException("failed to start metrics server on port " + config.getMetricsPort(), e);
            }
        }

        CountDownLatch stopped = new CountDownLatch(1);
        MetricsServer server = metricsServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[scheduler] shutdown signal received");
            scheduler.stop();
            if (server != null) {
                server.close();
            }
            stopped.countDown();
        }, "tempo-shutdown"));

        scheduler.start();
        out.println("Scheduler is running. Press Ctrl+C to stop.");
        out.flush();
        stopped.await();
        return 0;
    }

    /**
     * Arms each stored job. Jobs that cannot be scheduled are reported and left out.
     *
     * @return number of jobs armed
     */
    static int armAll(JobStore jobs, Scheduler scheduler, PrintWriter out) {
        List<Job> all = jobs.getAllJobs();
        int armed = 0;
        for (Job job : all) {
            try {
                scheduler.arm(job);
                armed++;
                out.printf("  armed %s: %s %s (%s)%n", job.getId(), job.getMethod(), job.getUrl(), job.getCronExpr());
            } catch (ValidationException e) {
                log.warn("[scheduler] skipping job {}: {}", job.getId(), e.getMessage());
                out.printf("  skipped %s: %s%n", job.getId(), e.getMessage());
            }
        }
        out.flush();
        return armed;
    }
}
