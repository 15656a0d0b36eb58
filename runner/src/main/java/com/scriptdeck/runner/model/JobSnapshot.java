package com.scriptdeck.runner.model;

import java.time.Instant;

/**
 * Point-in-time copy of a job's scalar fields.
 * All values come from the same critical section, so they are mutually consistent.
 */
public record JobSnapshot(
        int       percent,
        JobStatus status,
        String    step,
        boolean   done,
        Integer   returnCode,  // null until the job is done
        long      lines,       // lines ever appended, evicted ones included
        Instant   finishedAt   // null until the job is done
) {}
