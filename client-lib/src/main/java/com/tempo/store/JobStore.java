package com.tempo.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tempo.exception.JobNotFoundException;
import com.tempo.exception.PersistenceException;
import com.tempo.exception.StoreCorruptionException;
import com.tempo.exception.TempoException;
import com.tempo.job.Job;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * File-backed map of job id to {@link Job}.
 * <p>
 * Every mutation rewrites {@code jobs.json} while holding the write lock, so the file is always
 * a snapshot of some state callers could have observed. When the write fails the in-memory map
 * is put back the way it was before the call.
 */
@Slf4j
public class JobStore {
    public static final String FILE_NAME = "jobs.json";
    public static final String DEFAULT_DIR_NAME = ".tempo";

    private final Path file;
    private final ObjectMapper mapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<String, Job> jobs = new HashMap<>();

    JobStore(Path dataDir, ObjectMapper mapper) {
        this.file = dataDir.resolve(FILE_NAME);
        this.mapper = mapper;
    }

    /**
     * Opens (creating if needed) the store under {@code dataDir}, or under {@code ~/.tempo} when
     * {@code dataDir} is null, and loads whatever is already persisted there.
     */
    public static JobStore open(Path dataDir) {
        Path dir = dataDir == null ? defaultDataDir() : dataDir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new TempoException("failed to create data directory " + dir + ": " + e.getMessage(), e);
        }
        JobStore store = new JobStore(dir, JobJson.mapper());
        store.load();
        return store;
    }

    public static Path defaultDataDir() {
        return Paths.get(System.getProperty("user.home"), DEFAULT_DIR_NAME);
    }

    public Path getFile() {
        return file;
    }

    /**
     * Replaces the in-memory map with the persisted one. A missing file is an empty store.
     */
    public void load() {
        lock.writeLock().lock();
        try {
            byte[] data;
            try {
                data = Files.readAllBytes(file);
            } catch (NoSuchFileException e) {
                jobs = new HashMap<>();
                return;
            } catch (IOException e) {
                throw new StoreCorruptionException(file, e);
            }
            List<Job> loaded;
            try {
                loaded = JobJson.readJobs(mapper, data);
            } catch (IOException e) {
                throw new StoreCorruptionException(file, e);
            }
            Map<String, Job> next = new HashMap<>();
            for (Job job : loaded) {
                next.put(job.getId(), job);
            }
            jobs = next;
            log.debug("[store] loaded {} job(s) from {}", next.size(), file);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Inserts or replaces the job with the same id, then persists.
     */
    public void addJob(Job job) {
        lock.writeLock().lock();
        try {
            Map<String, Job> previous = new HashMap<>(jobs);
            jobs.put(job.getId(), job);
            persistOrRollback(previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Job> getJob(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(jobs.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of all jobs. Order is unspecified.
     */
    public List<Job> getAllJobs() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(jobs.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return jobs.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void removeJob(String id) {
        lock.writeLock().lock();
        try {
            if (!jobs.containsKey(id)) {
                throw new JobNotFoundException(id);
            }
            Map<String, Job> previous = new HashMap<>(jobs);
            jobs.remove(id);
            persistOrRollback(previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void removeAllJobs() {
        lock.writeLock().lock();
        try {
            Map<String, Job> previous = jobs;
            jobs = new HashMap<>();
            persistOrRollback(previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock
    private void persistOrRollback(Map<String, Job> previous) {
        try {
            save();
        } catch (IOException e) {
            jobs = previous;
            log.warn("[store] write to {} failed, in-memory state rolled back: {}", file, e.getMessage());
            throw new PersistenceException(file, e);
        }
    }

    private void save() throws IOException {
        byte[] data = JobJson.writeJobs(mapper, new ArrayList<>(jobs.values()));
        Path tmp = file.resolveSibling(FILE_NAME + ".tmp");
        Files.write(tmp, data);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
