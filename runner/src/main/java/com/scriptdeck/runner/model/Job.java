package com.scriptdeck.runner.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * One run of one script, from run request to terminal state.
 *
 * Written by exactly one output pipeline, read by any number of viewers.
 * Every compound operation (append + evict, marker update, terminal transition,
 * snapshot read) runs under this object's monitor, so readers never observe a
 * half-applied update.
 *
 * History positions are absolute sequence numbers: line {@code n} is the n-th line
 * ever appended (0-based). The buffer only keeps the newest {@code historyCapacity}
 * lines, so positions older than {@link #evictedCount} are gone for good.
 */
public class Job {

    public static final String STEP_STARTING = "starting";
    public static final String STEP_DONE     = "done";

    private final String  id;
    private final String  scriptRef;
    private final Path    logPath;
    private final int     historyCapacity;
    private final Instant createdAt = Instant.now();

    private final Deque<String> history = new ArrayDeque<>();
    private long appendedCount = 0;

    private int       percent    = 0;
    private JobStatus status     = JobStatus.QUEUED;
    private String    step       = "";
    private boolean   done       = false;
    private Integer   returnCode = null;
    private Instant   finishedAt = null;

    public Job(String id, String scriptRef, Path logPath, int historyCapacity) {
        if (historyCapacity < 1) {
            throw new IllegalArgumentException("historyCapacity must be positive: " + historyCapacity);
        }
        this.id              = id;
        this.scriptRef       = scriptRef;
        this.logPath         = logPath;
        this.historyCapacity = historyCapacity;
    }

    // ------------------------------------------------------------------
    // Immutable identity
    // ------------------------------------------------------------------

    public String  getId()              { return id; }
    public String  getScriptRef()       { return scriptRef; }
    public Path    getLogPath()         { return logPath; }
    public int     getHistoryCapacity() { return historyCapacity; }
    public Instant getCreatedAt()       { return createdAt; }

    // ------------------------------------------------------------------
    // Writer side (output pipeline / job service)
    // ------------------------------------------------------------------

    /** QUEUED → RUNNING once the process has been spawned. */
    public synchronized void markRunning() {
        requireNotDone();
        if (status != JobStatus.QUEUED) {
            throw new IllegalStateException("Job " + id + " is already " + status.wireName());
        }
        status = JobStatus.RUNNING;
        step   = STEP_STARTING;
    }

    /** Append one output line, dropping the oldest lines once the capacity is exceeded. */
    public synchronized void appendLine(String line) {
        requireNotDone();
        history.addLast(line);
        appendedCount++;
        while (history.size() > historyCapacity) {
            history.removeFirst();
        }
    }

    /**
     * Apply a progress marker. {@code percent} is clamped to [0, 100];
     * a null or blank {@code newStep} keeps the current step.
     */
    public synchronized void updateProgress(int percent, String newStep) {
        requireNotDone();
        this.percent = Math.max(0, Math.min(100, percent));
        if (newStep != null && !newStep.isBlank()) {
            this.step = newStep;
        }
    }

    /** Apply a completion marker: the script declares itself done ahead of its exit. */
    public synchronized void markDeclaredDone() {
        requireNotDone();
        percent = 100;
        step    = STEP_DONE;
    }

    /**
     * Record the process exit. Zero means FINISHED (forced to 100% and, if no phase
     * was ever reported, step "done"); anything else means ERROR with percent and
     * step left as last reported.
     */
    public synchronized void complete(int exitCode) {
        requireNotDone();
        returnCode = exitCode;
        if (exitCode == 0) {
            status  = JobStatus.FINISHED;
            percent = 100;
            if (step.isEmpty() || STEP_STARTING.equals(step)) {
                step = STEP_DONE;
            }
        } else {
            status = JobStatus.ERROR;
        }
        finish();
    }

    /**
     * End the job as ERROR without a process exit code: the process never started,
     * or the run was aborted. Percent and step are left as they are.
     */
    public synchronized void fail(int sentinelCode) {
        requireNotDone();
        returnCode = sentinelCode;
        status     = JobStatus.ERROR;
        finish();
    }

    private void finish() {
        done       = true;
        finishedAt = Instant.now();
    }

    private void requireNotDone() {
        if (done) {
            throw new IllegalStateException("Job " + id + " is already done");
        }
    }

    // ------------------------------------------------------------------
    // Reader side (viewers, REST)
    // ------------------------------------------------------------------

    public synchronized JobSnapshot snapshot() {
        return new JobSnapshot(percent, status, step, done, returnCode, appendedCount, finishedAt);
    }

    /**
     * Lines from absolute position {@code cursor} onward plus the state at the same
     * instant. A cursor that points at already-evicted lines resumes at the oldest
     * retained line and reports how many were skipped.
     */
    public synchronized JobView viewSince(long cursor) {
        long evicted = evictedCount();
        long from    = Math.max(cursor, evicted);
        long skipped = from - Math.max(cursor, 0);

        List<String> lines = new ArrayList<>();
        long offset = from - evicted;
        long index  = 0;
        for (String line : history) {
            if (index++ >= offset) {
                lines.add(line);
            }
        }
        return new JobView(lines, appendedCount, skipped, snapshot());
    }

    /** Copy of the retained history, oldest first. */
    public synchronized List<String> history() {
        return new ArrayList<>(history);
    }

    public synchronized long getAppendedCount() { return appendedCount; }
    public synchronized long evictedCount()     { return appendedCount - history.size(); }
    public synchronized boolean isDone()        { return done; }
    public synchronized Instant getFinishedAt() { return finishedAt; }
}
