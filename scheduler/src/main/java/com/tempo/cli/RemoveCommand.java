package com.tempo.cli;

import com.tempo.exception.ValidationException;
import com.tempo.store.JobStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "remove",
        description = {"Remove a webhook job.", "Examples: tempo remove health-check | tempo remove --all"},
        mixinStandardHelpOptions = true)
public class RemoveCommand implements Callable<Integer> {
    @Spec
    CommandSpec spec;

    @Mixin
    StoreOptions store;

    @Parameters(index = "0", arity = "0..1", paramLabel = "<job-id>", description = "Job ID")
    String jobId;

    @Option(names = {"--all", "-a"}, description = "Remove all jobs")
    boolean all;

    @Override
    public Integer call() {
        JobStore jobs = store.openStore();
        if (all) {
            jobs.removeAllJobs();
            spec.commandLine().getOut().println("Removed all jobs");
            spec.commandLine().getOut().flush();
            return 0;
        }
        if (jobId == null || jobId.isBlank()) {
            throw new ValidationException("job ID is required");
        }
        jobs.removeJob(jobId);
        spec.commandLine().getOut().printf("Removed job '%s'%n", jobId);
        spec.commandLine().getOut().flush();
        return 0;
    }
}
