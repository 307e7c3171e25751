package com.tempo.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tempo.exception.PersistenceException;
import com.tempo.job.Job;
import com.tempo.store.JobJson;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "export",
        description = {"Export all job configurations for backup or migration.",
                "Examples: tempo export | tempo export backup.json"},
        mixinStandardHelpOptions = true)
public class ExportCommand implements Callable<Integer> {
    static final String DEFAULT_FILE = "tempo-jobs.json";

    @Spec
    CommandSpec spec;

    @Mixin
    StoreOptions store;

    @Parameters(index = "0", arity = "0..1", paramLabel = "<file>", description = "Target file (default: " + DEFAULT_FILE + ")")
    Path file = Path.of(DEFAULT_FILE);

    @Option(names = {"--format", "-f"}, defaultValue = Formats.JSON, description = "Export format (json, yaml)")
    String format;

    @Override
    public Integer call() {
        Formats.requireJson(format, "export");
        List<Job> jobs = store.openStore().getAllJobs();
        ObjectMapper mapper = JobJson.mapper();
        try {
            Files.write(file, JobJson.writeJobs(mapper, jobs));
        } catch (IOException e) {
            throw new PersistenceException(file, e);
        }
        spec.commandLine().getOut().printf("Exported %d jobs to %s%n", jobs.size(), file);
        spec.commandLine().getOut().flush();
        return 0;
    }
}
