package com.scriptdeck.runner.stream;

import com.scriptdeck.runner.registry.JobRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans job progress out to live viewers by polling.
 *
 * Each attached viewer gets its own {@link ViewerSession}. A poll is a short task
 * on the shared scheduler; when the job is still running the task reschedules
 * itself after the poll interval, so waiting viewers hold no thread.
 * The first poll runs immediately, which makes an unknown job id fail at once.
 */
@Component
public class JobStreamBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(JobStreamBroadcaster.class);

    private final JobRegistry   registry;
    private final TaskScheduler scheduler;
    private final Duration      pollInterval;

    private final Map<String, ViewerSession> sessions = new ConcurrentHashMap<>();

    public JobStreamBroadcaster(JobRegistry registry,
                                @Qualifier("viewerPollScheduler") TaskScheduler scheduler,
                                @Value("${scriptdeck.stream.poll-interval-ms:350}") long pollIntervalMs,
                                MeterRegistry meterRegistry) {
        this.registry     = registry;
        this.scheduler    = scheduler;
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
        Gauge.builder("scriptdeck.viewers.active", sessions, Map::size)
                .description("Live viewer connections being served")
                .register(meterRegistry);
    }

    /** Start streaming {@code jobId} to {@code channel}. */
    public ViewerSession attach(String jobId, ViewerChannel channel) {
        ViewerSession session = new ViewerSession(jobId, channel, registry);
        sessions.put(channel.id(), session);
        log.debug("Viewer {} attached to job {}", channel.id(), jobId);
        scheduler.schedule(() -> poll(channel.id(), session), Instant.now());
        return session;
    }

    /** Stop streaming to a viewer whose connection has closed. */
    public void detach(String channelId) {
        ViewerSession session = sessions.remove(channelId);
        if (session != null) {
            session.stop();
            log.debug("Viewer {} detached from job {}", channelId, session.getJobId());
        }
    }

    public int activeViewers() {
        return sessions.size();
    }

    private void poll(String channelId, ViewerSession session) {
        boolean more;
        try {
            more = session.pollOnce();
        } catch (RuntimeException e) {
            log.error("Polling job {} for viewer {} failed: {}", session.getJobId(), channelId, e.getMessage(), e);
            session.stop();
            more = false;
        }
        if (more) {
            scheduler.schedule(() -> poll(channelId, session), Instant.now().plus(pollInterval));
        } else {
            sessions.remove(channelId, session);
        }
    }
}
