package com.scriptdeck.runner.stream;

import com.scriptdeck.runner.model.Job;
import com.scriptdeck.runner.model.JobView;
import com.scriptdeck.runner.registry.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One viewer following one job.
 *
 * Holds a private cursor into the job's history; the history itself is shared
 * with every other viewer and never modified here. Each {@link #pollOnce()}
 * sends the lines that arrived since the last poll, then a state snapshot, and
 * ends the session once the job is done or has disappeared.
 */
public class ViewerSession {

    private static final Logger log = LoggerFactory.getLogger(ViewerSession.class);

    private final String        jobId;
    private final ViewerChannel channel;
    private final JobRegistry   registry;

    private long cursor = 0;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ViewerSession(String jobId, ViewerChannel channel, JobRegistry registry) {
        this.jobId    = jobId;
        this.channel  = channel;
        this.registry = registry;
    }

    /**
     * Send everything new and report whether another poll is needed.
     * Not thread-safe: the broadcaster runs at most one poll per session at a time.
     *
     * @return true while the job is still running and the viewer is connected
     */
    public boolean pollOnce() {
        if (closed.get()) return false;
        try {
            Optional<Job> job = registry.get(jobId);
            if (job.isEmpty()) {
                channel.send(StreamMessages.error("Job not found"));
                stop();
                return false;
            }

            JobView view = job.get().viewSince(cursor);
            if (view.skipped() > 0) {
                log.debug("Viewer {} of job {} fell behind, {} line(s) no longer in history",
                        channel.id(), jobId, view.skipped());
            }
            for (String line : view.lines()) {
                channel.send(StreamMessages.log(line));
            }
            cursor = view.nextCursor();

            channel.send(StreamMessages.state(view.snapshot()));
            if (view.snapshot().done()) {
                channel.send(StreamMessages.done(view.snapshot().returnCode()));
                stop();
                return false;
            }
            return true;
        } catch (IOException e) {
            log.debug("Viewer {} of job {} went away: {}", channel.id(), jobId, e.getMessage());
            stop();
            return false;
        }
    }

    /** End the session; further polls do nothing. Safe to call more than once. */
    public void stop() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Closing viewer {} failed: {}", channel.id(), e.getMessage());
        }
    }

    public boolean isClosed()  { return closed.get(); }
    public long    getCursor() { return cursor; }
    public String  getJobId()  { return jobId; }
}
