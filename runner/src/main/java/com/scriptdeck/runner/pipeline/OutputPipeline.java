package com.scriptdeck.runner.pipeline;

import com.scriptdeck.runner.launcher.RunningProcess;
import com.scriptdeck.runner.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;

/**
 * Drains a running script's output into its job.
 *
 * For every line, in arrival order:
 * <ol>
 *   <li>append it to the job's transcript file and flush, so the file can be tailed;</li>
 *   <li>append it to the job's bounded history;</li>
 *   <li>apply a PROGRESS or DONE marker if the line carries one.</li>
 * </ol>
 * When the stream closes, the exit code decides the terminal state.
 *
 * The transcript is opened once per run and never shared with another job.
 */
@Component
public class OutputPipeline {

    private static final Logger log = LoggerFactory.getLogger(OutputPipeline.class);

    /**
     * Consume {@code process} until end of stream, then record its exit.
     * Blocks the calling thread for the whole life of the process.
     *
     * @return the exit code recorded on the job
     */
    public int run(Job job, RunningProcess process) throws InterruptedException {
        long lines = 0;
        try (Writer transcript = Files.newBufferedWriter(job.getLogPath(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
            LineReader reader = new LineReader(process.output());
            String line;
            while ((line = reader.readLine()) != null) {
                transcript.write(line);
                transcript.write('\n');
                transcript.flush();

                accept(job, line);
                lines++;
            }
        } catch (IOException e) {
            // The exit code is still awaited below so the job always reaches a terminal state.
            log.error("Output of job {} interrupted after {} line(s): {}", job.getId(), lines, e.getMessage(), e);
            drain(process);
        }

        int exitCode = process.waitFor();
        job.complete(exitCode);
        log.info("Job {} exited with code {} after {} line(s)", job.getId(), exitCode, lines);
        return exitCode;
    }

    /** Record one line in the job's history and apply any marker it carries. */
    static void accept(Job job, String line) {
        job.appendLine(line);

        MarkerParser.parseProgress(line).ifPresent(p -> job.updateProgress(p.percent(), p.step()));
        if (MarkerParser.isDone(line)) {
            job.markDeclaredDone();
        }
    }

    /** Discard whatever output is left so a blocked writer can run to exit. */
    private static void drain(RunningProcess process) {
        try {
            process.output().transferTo(OutputStream.nullOutputStream());
        } catch (IOException e) {
            log.debug("Could not drain remaining output: {}", e.getMessage());
        }
    }
}
