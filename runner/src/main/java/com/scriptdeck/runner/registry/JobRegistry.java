package com.scriptdeck.runner.registry;

import com.scriptdeck.runner.model.Job;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of all known jobs, keyed by job id.
 *
 * Jobs live here from the run request until they have been done for longer
 * than the retention window; {@link #evictExpired()} removes them after that.
 * Transcript files stay on disk.
 */
@Component
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    private final Path     logsDir;
    private final int      historyCapacity;
    private final Duration retention;
    private final Clock    clock;

    @Autowired
    public JobRegistry(
            @Value("${scriptdeck.jobs.logs-dir:logs}") String logsDir,
            @Value("${scriptdeck.jobs.history-capacity:2500}") int historyCapacity,
            @Value("${scriptdeck.jobs.retention:24h}") String retention,
            MeterRegistry meterRegistry) {
        this(Path.of(logsDir), historyCapacity, DurationStyle.detectAndParse(retention), Clock.systemUTC());
        Gauge.builder("scriptdeck.jobs.registered", jobs, Map::size)
                .description("Jobs currently held in the registry")
                .register(meterRegistry);
    }

    public JobRegistry(Path logsDir, int historyCapacity, Duration retention, Clock clock) {
        this.logsDir         = logsDir.toAbsolutePath().normalize();
        this.historyCapacity = historyCapacity;
        this.retention       = retention;
        this.clock           = clock;
        try {
            Files.createDirectories(this.logsDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create logs directory " + this.logsDir, e);
        }
    }

    /** Register a new QUEUED job with a fresh id and a transcript path under the logs directory. */
    public Job create(String scriptRef) {
        String id = UUID.randomUUID().toString();
        Job job = new Job(id, scriptRef, logsDir.resolve(id + ".log"), historyCapacity);
        jobs.put(id, job);
        log.debug("Registered job {} for {}", id, scriptRef);
        return job;
    }

    public Optional<Job> get(String jobId) {
        if (jobId == null) return Optional.empty();
        return Optional.ofNullable(jobs.get(jobId));
    }

    public int size() {
        return jobs.size();
    }

    /**
     * Drop jobs that finished more than {@code retention} ago.
     * Queued and running jobs are never touched.
     *
     * @return number of jobs removed
     */
    @Scheduled(fixedDelayString = "${scriptdeck.jobs.eviction-interval:60000}")
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        for (Job job : jobs.values()) {
            Instant finishedAt = job.getFinishedAt();
            if (finishedAt != null && finishedAt.isBefore(cutoff)
                    && jobs.remove(job.getId(), job)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Evicted {} finished job(s) older than {}", removed, retention);
        }
        return removed;
    }

    public Path getLogsDir() {
        return logsDir;
    }
}
