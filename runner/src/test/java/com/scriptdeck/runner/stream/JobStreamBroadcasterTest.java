package com.scriptdeck.runner.stream;

import com.scriptdeck.runner.model.Job;
import com.scriptdeck.runner.registry.JobRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JobStreamBroadcaster with a real scheduler and a short poll interval.
 */
class JobStreamBroadcasterTest {

    @TempDir Path tmp;

    ThreadPoolTaskScheduler scheduler;
    JobRegistry registry;
    JobStreamBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.initialize();
        registry = new JobRegistry(tmp, 2500, Duration.ofHours(1), Clock.systemUTC());
        broadcaster = new JobStreamBroadcaster(registry, scheduler, 20, new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void attach_unknownJob_failsImmediately() throws Exception {
        RecordingChannel channel = new RecordingChannel("v1");

        broadcaster.attach("missing", channel);

        assertThat(channel.closed.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(channel.messages).containsExactly("ERROR Job not found");
    }

    @Test
    void attach_keepsPollingUntilJobIsDone() throws Exception {
        Job job = registry.create("slow.sh");
        job.markRunning();
        RecordingChannel channel = new RecordingChannel("v1");

        broadcaster.attach(job.getId(), channel);
        job.appendLine("first");
        Thread.sleep(100);
        job.appendLine("second");
        job.complete(0);

        assertThat(channel.closed.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(channel.logLines()).containsExactly("first", "second");
        assertThat(channel.messages.get(channel.messages.size() - 1)).isEqualTo("DONE rc=0");
        assertThat(channel.messages.stream().filter(m -> m.startsWith("STATE ")).count()).isGreaterThan(1);
    }

    @Test
    void detach_stopsPollingAndForgetsViewer() throws Exception {
        Job job = registry.create("forever.sh");
        job.markRunning();
        RecordingChannel channel = new RecordingChannel("v1");
        broadcaster.attach(job.getId(), channel);
        Thread.sleep(60);

        broadcaster.detach("v1");
        Thread.sleep(30);             // let a poll already in flight finish
        int sent = channel.messages.size();
        Thread.sleep(100);

        assertThat(channel.isClosed()).isTrue();
        assertThat(channel.messages).hasSize(sent);
        assertThat(broadcaster.activeViewers()).isZero();
    }
}
