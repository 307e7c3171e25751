package com.tempo.cli;

import com.tempo.exception.ValidationException;
import com.tempo.job.Job;
import com.tempo.scheduler.CronSchedule;
import com.tempo.store.JobStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "add",
        description = {"Add a new webhook job.",
                "Example: tempo add health-check --url https://api.example.com/health --schedule '*/30 * * * * *'"},
        mixinStandardHelpOptions = true)
public class AddCommand implements Callable<Integer> {
    @Spec
    CommandSpec spec;

    @Mixin
    StoreOptions store;

    @Parameters(index = "0", arity = "0..1", paramLabel = "<job-id>", description = "Job ID")
    String jobId;

    @Option(names = {"--url", "-u"}, description = "Webhook URL")
    String url;

    @Option(names = {"--method", "-m"}, defaultValue = "GET", description = "HTTP method (GET, POST, PUT, DELETE)")
    String method;

    @Option(names = {"--schedule", "-s"}, description = "Cron schedule expression (e.g. '*/30 * * * * *')")
    String schedule;

    @Option(names = {"--body", "-b"}, defaultValue = "", description = "Request body")
    String body;

    @Option(names = {"--header", "-H"}, paramLabel = "Key=Value", description = "HTTP header, repeatable")
    List<String> headers = new ArrayList<>();

    @Override
    public Integer call() {
        if (url == null || url.isBlank()) {
            throw new ValidationException("URL is required. Use --url");
        }
        if (schedule == null || schedule.isBlank()) {
            throw new ValidationException("schedule is required. Use --schedule");
        }
        if (jobId == null || jobId.isBlank()) {
            throw new ValidationException("job ID is required");
        }
        Map<String, String> parsedHeaders = Headers.parse(headers);
        CronSchedule.parse(schedule);

        Job job = Job.builder()
                .id(jobId)
                .url(url)
                .method(method)
                .cronExpr(schedule)
                .body(body)
                .headers(parsedHeaders)
                .build();
        JobStore jobs = store.openStore();
        jobs.addJob(job);

        PrintWriter out = spec.commandLine().getOut();
        out.printf("Added job '%s': %s %s%n", job.getId(), job.getMethod(), job.getUrl());
        if (!job.getBody().isEmpty()) {
            out.printf("  Body: %s%n", Formats.abbreviate(job.getBody()));
        }
        if (!job.getHeaders().isEmpty()) {
            out.printf("  Headers: %s%n", job.getHeaders());
        }
        out.flush();
        return 0;
    }
}
