package com.scriptdeck.runner.service;

import com.scriptdeck.runner.catalog.ResolvedScript;
import com.scriptdeck.runner.catalog.ScriptCatalog;
import com.scriptdeck.runner.launcher.LaunchRequest;
import com.scriptdeck.runner.launcher.LaunchResolutionException;
import com.scriptdeck.runner.launcher.ProcessLauncher;
import com.scriptdeck.runner.launcher.RunningProcess;
import com.scriptdeck.runner.model.Job;
import com.scriptdeck.runner.pipeline.OutputPipeline;
import com.scriptdeck.runner.registry.JobRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for running scripts as jobs.
 *
 * A run request is resolved through the {@link ScriptCatalog}, registered as a
 * QUEUED job and handed to a worker; the caller gets the job back immediately.
 * Each worker owns one job end to end:
 * <pre>
 *   launch → RUNNING → drain output → FINISHED | ERROR
 * </pre>
 * The worker pool grows with demand. There is no cancellation and no timeout:
 * a script that never exits keeps its own worker forever, but never delays
 * another job.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRegistry     registry;
    private final ScriptCatalog   catalog;
    private final ProcessLauncher launcher;
    private final OutputPipeline  pipeline;
    private final MeterRegistry   meterRegistry;
    private final ExecutorService workers;

    public JobService(JobRegistry registry,
                      ScriptCatalog catalog,
                      ProcessLauncher launcher,
                      OutputPipeline pipeline,
                      MeterRegistry meterRegistry) {
        this.registry      = registry;
        this.catalog       = catalog;
        this.launcher      = launcher;
        this.pipeline      = pipeline;
        this.meterRegistry = meterRegistry;
        this.workers       = Executors.newCachedThreadPool(new WorkerThreadFactory());
    }

    // ------------------------------------------------------------------
    // Run requests
    // ------------------------------------------------------------------

    /**
     * Run a script from the scripts directory.
     *
     * @throws com.scriptdeck.runner.catalog.ScriptNotFoundException if the name does not resolve; no job is created
     */
    public Job runScript(String scriptName, List<String> args, List<String> inputs) {
        return submit(catalog.resolveScript(scriptName), args, inputs);
    }

    /**
     * Run a file from a provisioned repository, with the repository root as working directory.
     *
     * @throws com.scriptdeck.runner.catalog.ScriptNotFoundException if the file does not resolve; no job is created
     */
    public Job runRepoFile(String repoId, String relativePath, List<String> args, List<String> inputs) {
        return submit(catalog.resolveRepoFile(repoId, relativePath), args, inputs);
    }

    private Job submit(ResolvedScript script, List<String> args, List<String> inputs) {
        Job job = registry.create(script.scriptRef());
        LaunchRequest request = new LaunchRequest(script.executable(), args, script.workingDir(), inputs);
        meterRegistry.counter("scriptdeck.jobs.started").increment();
        log.info("Job {} queued for {} ({} input line(s))", job.getId(), job.getScriptRef(), request.stdinPayload().size());
        workers.execute(() -> execute(job, request));
        return job;
    }

    // ------------------------------------------------------------------
    // Worker side
    // ------------------------------------------------------------------

    /**
     * Drive one job to a terminal state. Always leaves the job done, whatever happens.
     * Runs on a worker thread; package-private so tests can call it synchronously.
     */
    void execute(Job job, LaunchRequest request) {
        MDC.put("jobId",  job.getId());
        MDC.put("script", job.getScriptRef());
        Timer.Sample sample = Timer.start(meterRegistry);
        RunningProcess process = null;
        try {
            try {
                process = launcher.launch(request);
            } catch (LaunchResolutionException e) {
                log.warn("Job {} could not start: {}", job.getId(), e.getMessage());
                job.fail(ProcessLauncher.EXIT_COULD_NOT_START);
                return;
            }
            job.markRunning();
            pipeline.run(job, process);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job {} interrupted while waiting for its process", job.getId());
            abandon(job, process);
        } catch (RuntimeException e) {
            log.error("Unhandled error in job {}: {}", job.getId(), e.getMessage(), e);
            abandon(job, process);
        } finally {
            String status = job.snapshot().status().wireName();
            sample.stop(meterRegistry.timer("scriptdeck.job.duration", "status", status));
            meterRegistry.counter("scriptdeck.jobs.completed", "status", status).increment();
            MDC.clear();
        }
    }

    /** Fail the job if nothing else ended it and kill its process, which nobody reads any more. */
    private static void abandon(Job job, RunningProcess process) {
        if (!job.isDone()) {
            job.fail(ProcessLauncher.EXIT_COULD_NOT_START);
        }
        if (process != null) {
            process.destroy();
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<Job> find(String jobId) {
        return registry.get(jobId);
    }

    /**
     * Full transcript of a job, read from its log file rather than the bounded history.
     * Empty when the job is unknown or no output file exists yet.
     */
    public Optional<String> readTranscript(String jobId) {
        Optional<Job> job = registry.get(jobId);
        if (job.isEmpty()) return Optional.empty();
        try {
            byte[] bytes = Files.readAllBytes(job.get().getLogPath());
            return Optional.of(new String(bytes, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Could not read transcript of job {}: {}", jobId, e.getMessage());
            return Optional.empty();
        }
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            return new Thread(r, "job-worker-" + counter.incrementAndGet());
        }
    }
}
