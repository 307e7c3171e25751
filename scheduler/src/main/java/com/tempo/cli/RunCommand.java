package com.tempo.cli;

import com.tempo.exception.JobNotFoundException;
import com.tempo.exception.ValidationException;
import com.tempo.job.Job;
import com.tempo.scheduler.TempoConfig;
import com.tempo.store.JobStore;
import com.tempo.webhook.Dispatcher;
import com.tempo.webhook.DispatchMetrics;
import com.tempo.webhook.HttpWebhookDispatcher;
import com.tempo.webhook.WebhookResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "run",
        description = {"Execute a webhook job immediately.",
                "Examples: tempo run health-check | tempo run --url https://api.example.com/test --method POST"},
        mixinStandardHelpOptions = true)
public class RunCommand implements Callable<Integer> {
    static final String ONE_OFF_ID = "one-off";

    @Spec
    CommandSpec spec;

    @Mixin
    StoreOptions store;

    @Parameters(index = "0", arity = "0..1", paramLabel = "<job-id>", description = "ID of a stored job")
    String jobId;

    @Option(names = {"--url", "-u"}, description = "Webhook URL for a one-off execution")
    String url;

    @Option(names = {"--method", "-m"}, defaultValue = "GET", description = "HTTP method")
    String method;

    @Option(names = {"--body", "-b"}, defaultValue = "", description = "Request body")
    String body;

    @Option(names = {"--header", "-H"}, paramLabel = "Key=Value", description = "HTTP header, repeatable")
    List<String> headers = new ArrayList<>();

    @Override
    public Integer call() {
        boolean stored = jobId != null && !jobId.isBlank();
        if (!stored && (url == null || url.isBlank())) {
            throw new ValidationException("either job ID or --url is required");
        }
        TempoConfig config = store.config();
        Job job = stored ? storedJob(config) : oneOffJob();

        PrintWriter out = spec.commandLine().getOut();
        if (stored) {
            out.printf("Running job '%s'...%n", job.getId());
        }
        out.printf("Executing: %s %s%n", job.getMethod(), job.getUrl());
        if (!job.getBody().isEmpty()) {
            out.printf("Body: %s%n", Formats.abbreviate(job.getBody()));
        }
        if (!job.getHeaders().isEmpty()) {
            out.printf("Headers: %s%n", job.getHeaders());
        }
        out.flush();

        Dispatcher dispatcher = new HttpWebhookDispatcher(config.getHttpTimeout(), DispatchMetrics.noop());
        WebhookResult result = dispatcher.dispatch(job);
        if (!result.isSuccess()) {
            PrintWriter err = spec.commandLine().getErr();
            err.printf("Error: %s%n", result);
            err.flush();
            return 1;
        }
        out.printf("%s executed successfully (status %d)%n", stored ? "Job" : "Webhook", result.getStatusCode());
        out.flush();
        return 0;
    }

    private Job storedJob(TempoConfig config) {
        return JobStore.open(config.getDataDir())
                .getJob(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private Job oneOffJob() {
        return Job.builder()
                .id(ONE_OFF_ID)
                .url(url)
                .method(method)
                .body(body)
                .headers(Headers.parse(headers))
                .build();
    }
}
