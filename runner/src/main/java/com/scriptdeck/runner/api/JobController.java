package com.scriptdeck.runner.api;

import com.scriptdeck.runner.api.dto.JobResponse;
import com.scriptdeck.runner.api.dto.LogFileResponse;
import com.scriptdeck.runner.api.dto.RunRepoRequest;
import com.scriptdeck.runner.api.dto.RunResponse;
import com.scriptdeck.runner.api.dto.RunScriptRequest;
import com.scriptdeck.runner.catalog.ScriptNotFoundException;
import com.scriptdeck.runner.model.Job;
import com.scriptdeck.runner.service.JobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for running scripts and reading their results.
 *
 * POST /run                 : run a script from the scripts directory
 * POST /run_repo            : run a file inside a provisioned repository
 * GET  /jobs/{jobId}        : current state of a job
 * GET  /logs/{jobId}.log    : full transcript as plain text
 * GET  /download/{jobId}    : server-side path of the transcript
 *
 * Live output is served separately over WebSocket at /ws/{jobId}.
 * A run request returns as soon as the job is queued; a failing script shows
 * up later as status "error", never as an HTTP error here.
 */
@RestController
public class JobController {

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/run \
     *     -H "Content-Type: application/json" \
     *     -d '{"script":"backup_db.py","inputVars":["prod", 3]}'
     */
    @PostMapping("/run")
    public RunResponse run(@RequestBody RunScriptRequest req) {
        try {
            Job job = jobService.runScript(req.script(), req.args(), req.inputs());
            return new RunResponse(job.getId());
        } catch (ScriptNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @PostMapping("/run_repo")
    public RunResponse runRepo(@RequestBody RunRepoRequest req) {
        try {
            Job job = jobService.runRepoFile(req.repoId(), req.path(), req.args(), req.inputs());
            return new RunResponse(job.getId());
        } catch (ScriptNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @GetMapping("/jobs/{jobId}")
    public JobResponse getJob(@PathVariable String jobId) {
        return JobResponse.from(requireJob(jobId));
    }

    /** Reads the transcript file, so it holds every line, not just the live history. */
    @GetMapping(value = "/logs/{jobId}.log", produces = MediaType.TEXT_PLAIN_VALUE)
    public String getLog(@PathVariable String jobId) {
        requireJob(jobId);
        return jobService.readTranscript(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "log missing"));
    }

    @GetMapping("/download/{jobId}")
    public LogFileResponse download(@PathVariable String jobId) {
        return new LogFileResponse(requireJob(jobId).getLogPath().toString());
    }

    private Job requireJob(String jobId) {
        return jobService.find(jobId).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + jobId));
    }
}
