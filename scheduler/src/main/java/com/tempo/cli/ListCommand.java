package com.tempo.cli;

import com.tempo.exception.ValidationException;
import com.tempo.job.Job;
import com.tempo.scheduler.CronSchedule;
import com.tempo.scheduler.TempoConfig;
import com.tempo.store.JobStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "list",
        description = "List all configured jobs with their next run time.",
        mixinStandardHelpOptions = true)
public class ListCommand implements Callable<Integer> {
    @Spec
    CommandSpec spec;

    @Mixin
    StoreOptions store;

    @Option(names = {"--verbose", "-v"}, description = "Show detailed job information")
    boolean verbose;

    @Override
    public Integer call() {
        TempoConfig config = store.config();
        List<Job> jobs = JobStore.open(config.getDataDir()).getAllJobs();
        jobs.sort(Comparator.comparing(Job::getId, Comparator.nullsFirst(Comparator.naturalOrder())));
        PrintWriter out = spec.commandLine().getOut();

        if (jobs.isEmpty()) {
            out.println("No jobs configured yet.");
            out.println("Use 'tempo add' to create your first job.");
            if (verbose) {
                out.println();
                out.println("Example jobs:");
                out.println("  tempo add health-check --url 'https://api.example.com/health' --schedule '*/30 * * * * *'");
                out.println("  tempo add weekly-report --url 'https://api.example.com/reports' --method POST --schedule '0 0 9 * * 1'");
            }
            out.flush();
            return 0;
        }

        ZonedDateTime now = ZonedDateTime.now(config.getZone());
        out.printf("Found %d job(s):%n%n", jobs.size());
        for (Job job : jobs) {
            out.printf("ID: %s%n", job.getId());
            out.printf("  Method: %s%n", job.getMethod());
            out.printf("  URL: %s%n", job.getUrl());
            out.printf("  Schedule: %s%n", job.getCronExpr());
            try {
                CronSchedule schedule = CronSchedule.parse(job.getCronExpr());
                if (verbose) {
                    out.printf("  Runs: %s%n", schedule.describe());
                }
                schedule.nextExecution(now).ifPresent(next -> out.printf("  Next run: %s%n", next));
            } catch (ValidationException e) {
                out.printf("  Invalid schedule, will not be armed: %s%n", e.getMessage());
            }
            if (!job.getBody().isEmpty()) {
                out.printf("  Body: %s%n", verbose ? job.getBody() : Formats.abbreviate(job.getBody()));
            }
            if (!job.getHeaders().isEmpty()) {
                out.printf("  Headers: %s%n", job.getHeaders());
            }
            out.println();
        }
        out.flush();
        return 0;
    }
}
