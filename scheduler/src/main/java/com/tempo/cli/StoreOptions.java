package com.tempo.cli;

import com.tempo.scheduler.TempoConfig;
import com.tempo.store.JobStore;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by every command that touches the job store.
 */
public class StoreOptions {
    @Option(names = {"--data-dir", "-d"},
            description = "Directory holding jobs.json (default: $TEMPO_DATA_DIR or ~/.tempo)")
    Path dataDir;

    TempoConfig config() {
        return TempoConfig.fromEnv().withDataDir(dataDir);
    }

    JobStore openStore() {
        return JobStore.open(config().getDataDir());
    }
}
