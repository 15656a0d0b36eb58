package com.scriptdeck.runner.api.dto;

import com.scriptdeck.runner.model.Job;
import com.scriptdeck.runner.model.JobSnapshot;
import com.scriptdeck.runner.model.JobStatus;

import java.time.Instant;

/**
 * Response body for GET /jobs/{jobId}.
 * Enough for a client that prefers polling over the WebSocket stream.
 */
public record JobResponse(
        String    jobId,
        String    script,
        int       percent,
        JobStatus status,
        String    step,
        boolean   done,
        Integer   returnCode,
        long      lines,
        Instant   createdAt,
        Instant   finishedAt
) {
    public static JobResponse from(Job job) {
        JobSnapshot s = job.snapshot();
        return new JobResponse(
                job.getId(),
                job.getScriptRef(),
                s.percent(),
                s.status(),
                s.step(),
                s.done(),
                s.returnCode(),
                s.lines(),
                job.getCreatedAt(),
                s.finishedAt()
        );
    }
}
