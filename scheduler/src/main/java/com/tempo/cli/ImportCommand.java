package com.tempo.cli;

import com.tempo.exception.StoreCorruptionException;
import com.tempo.exception.ValidationException;
import com.tempo.job.Job;
import com.tempo.store.JobJson;
import com.tempo.store.JobStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "import",
        description = {"Import job configurations from a file.", "Example: tempo import backup.json"},
        mixinStandardHelpOptions = true)
public class ImportCommand implements Callable<Integer> {
    @Spec
    CommandSpec spec;

    @Mixin
    StoreOptions store;

    @Parameters(index = "0", paramLabel = "<file>", description = "File produced by 'tempo export'")
    Path file;

    @Option(names = {"--format", "-f"}, defaultValue = Formats.JSON, description = "Import format (json, yaml)")
    String format;

    @Override
    public Integer call() {
        Formats.requireJson(format, "import");
        List<Job> jobs;
        try {
            jobs = JobJson.readJobs(JobJson.mapper(), Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            throw new ValidationException("failed to read file: " + file + " does not exist", e);
        } catch (IOException e) {
            throw new StoreCorruptionException(file, e);
        }
        for (Job job : jobs) {
            if (job.getId() == null || job.getId().isBlank()) {
                throw new ValidationException("failed to import: job ID is required");
            }
        }

        JobStore jobStore = store.openStore();
        for (Job job : jobs) {
            jobStore.addJob(job);
        }
        spec.commandLine().getOut().printf("Imported %d jobs from %s%n", jobs.size(), file);
        spec.commandLine().getOut().flush();
        return 0;
    }
}
