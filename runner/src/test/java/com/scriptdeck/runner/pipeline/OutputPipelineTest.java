package com.scriptdeck.runner.pipeline;

import com.scriptdeck.runner.launcher.RunningProcess;
import com.scriptdeck.runner.model.Job;
import com.scriptdeck.runner.model.JobSnapshot;
import com.scriptdeck.runner.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for OutputPipeline.
 *
 * The process is a canned byte stream plus a fixed exit code, so each test
 * controls exactly what the "script" printed.
 */
class OutputPipelineTest {

    @TempDir Path tmp;

    OutputPipeline pipeline;
    Job job;

    @BeforeEach
    void setUp() {
        pipeline = new OutputPipeline();
        job = new Job("job-1", "test.sh", tmp.resolve("job-1.log"), 2500);
        job.markRunning();
    }

    private static RunningProcess process(byte[] output, int exitCode) {
        return new RunningProcess() {
            @Override public InputStream output() { return new ByteArrayInputStream(output); }
            @Override public int waitFor() { return exitCode; }
            @Override public void destroy() {}
        };
    }

    private static RunningProcess process(String output, int exitCode) {
        return process(output.getBytes(StandardCharsets.UTF_8), exitCode);
    }

    // ------------------------------------------------------------------
    // Transcript and history
    // ------------------------------------------------------------------

    @Test
    void run_writesEveryLineToTranscriptAndHistory() throws Exception {
        pipeline.run(job, process("one\ntwo\nthree\n", 0));

        assertThat(Files.readAllLines(job.getLogPath())).containsExactly("one", "two", "three");
        assertThat(job.history()).containsExactly("one", "two", "three");
    }

    @Test
    void run_lastLineWithoutNewline_isKept() throws Exception {
        pipeline.run(job, process("one\ntwo", 0));

        assertThat(job.history()).containsExactly("one", "two");
        assertThat(Files.readString(job.getLogPath())).isEqualTo("one\ntwo\n");
    }

    @Test
    void run_malformedBytes_areDroppedNotFatal() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.writeBytes("caf".getBytes(StandardCharsets.UTF_8));
        bytes.write(0xC3);              // truncated two-byte sequence
        bytes.write('\n');
        bytes.writeBytes("ok\n".getBytes(StandardCharsets.UTF_8));

        pipeline.run(job, process(bytes.toByteArray(), 0));

        assertThat(job.history()).containsExactly("caf", "ok");
    }

    @Test
    void run_moreLinesThanCapacity_transcriptKeepsAllHistoryKeepsNewest() throws Exception {
        String output = IntStream.range(0, 2600)
                .mapToObj(i -> "line " + i)
                .collect(Collectors.joining("\n", "", "\n"));

        pipeline.run(job, process(output, 0));

        List<String> transcript = Files.readAllLines(job.getLogPath());
        assertThat(transcript).hasSize(2600);
        assertThat(transcript.get(0)).isEqualTo("line 0");
        assertThat(job.history()).hasSize(2500);
        assertThat(job.history().get(0)).isEqualTo("line 100");
        assertThat(job.history().get(2499)).isEqualTo("line 2599");
    }

    @Test
    void run_transcriptIsAppendedNotTruncated() throws Exception {
        Files.writeString(job.getLogPath(), "earlier\n");

        pipeline.run(job, process("later\n", 0));

        assertThat(Files.readAllLines(job.getLogPath())).containsExactly("earlier", "later");
    }

    // ------------------------------------------------------------------
    // Markers and terminal state
    // ------------------------------------------------------------------

    @Test
    void run_progressMarkers_updatePercentAndStep() throws Exception {
        pipeline.run(job, process("PROGRESS 30 Fetching\nPROGRESS 60\nboom\n", 1));

        JobSnapshot s = job.snapshot();
        assertThat(s.percent()).isEqualTo(60);
        assertThat(s.step()).isEqualTo("Fetching");
        assertThat(s.status()).isEqualTo(JobStatus.ERROR);
        assertThat(s.returnCode()).isEqualTo(1);
        assertThat(job.history()).contains("PROGRESS 30 Fetching");
    }

    @Test
    void run_doneMarker_setsHundredEvenIfExitFails() throws Exception {
        pipeline.run(job, process("PROGRESS 20 Start\nDONE\ncleanup failed\n", 3));

        JobSnapshot s = job.snapshot();
        assertThat(s.percent()).isEqualTo(100);
        assertThat(s.step()).isEqualTo("done");
        assertThat(s.status()).isEqualTo(JobStatus.ERROR);
        assertThat(s.done()).isTrue();
    }

    @Test
    void run_successWithoutMarkers_reportsHundredAndDone() throws Exception {
        int rc = pipeline.run(job, process("hello\n", 0));

        JobSnapshot s = job.snapshot();
        assertThat(rc).isZero();
        assertThat(s.percent()).isEqualTo(100);
        assertThat(s.step()).isEqualTo("done");
        assertThat(s.status()).isEqualTo(JobStatus.FINISHED);
    }

    @Test
    void run_noOutput_stillCompletes() throws Exception {
        pipeline.run(job, process("", 0));

        assertThat(job.isDone()).isTrue();
        assertThat(job.history()).isEmpty();
        assertThat(Files.exists(job.getLogPath())).isTrue();
    }
}
