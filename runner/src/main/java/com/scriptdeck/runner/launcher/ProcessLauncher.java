package com.scriptdeck.runner.launcher;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts scripts as child processes.
 *
 * The interpreter is chosen from the file suffix:
 * <pre>
 *   .py  → python command (default "python3")
 *   .sh  → shell command  (default "/bin/bash")
 * </pre>
 * stderr is merged into stdout. Predetermined input is written to stdin on a
 * separate thread and stdin is closed right after, so the caller can start
 * reading output immediately.
 */
@Component
public class ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessLauncher.class);

    /** Return code recorded for a job whose process could not be started. */
    public static final int EXIT_COULD_NOT_START = 127;

    private final String pythonCommand;
    private final String shellCommand;

    private final ExecutorService stdinWriters = Executors.newCachedThreadPool(new StdinThreadFactory());

    public ProcessLauncher(
            @Value("${scriptdeck.launcher.python-command:python3}") String pythonCommand,
            @Value("${scriptdeck.launcher.shell-command:/bin/bash}") String shellCommand) {
        this.pythonCommand = pythonCommand;
        this.shellCommand  = shellCommand;
    }

    /**
     * Spawn the script described by {@code request}.
     *
     * @throws LaunchResolutionException if the suffix has no interpreter or the spawn fails
     */
    public RunningProcess launch(LaunchRequest request) {
        List<String> command = resolveCommand(request);

        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        if (request.workingDir() != null) {
            builder.directory(request.workingDir().toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new LaunchResolutionException("Could not start " + request.executable() + ": " + e.getMessage(), e);
        }
        log.info("Started pid {}: {}", process.pid(), command);

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        stdinWriters.execute(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                InputDelivery.Outcome outcome =
                        InputDelivery.deliver(process.getOutputStream(), request.stdinPayload());
                if (outcome == InputDelivery.Outcome.FAILED) {
                    // The script may already have exited or closed stdin; its output is still read.
                    log.warn("Could not deliver {} input line(s) to pid {}",
                            request.stdinPayload().size(), process.pid());
                }
            } finally {
                MDC.clear();
            }
        });

        return new OsProcess(process);
    }

    /** Build the full command line: interpreter, script path, then the extra args. */
    public List<String> resolveCommand(LaunchRequest request) {
        String fileName = request.executable().getFileName().toString().toLowerCase(Locale.ROOT);
        String interpreter;
        if (fileName.endsWith(".py")) {
            interpreter = pythonCommand;
        } else if (fileName.endsWith(".sh")) {
            interpreter = shellCommand;
        } else {
            throw new LaunchResolutionException("No interpreter for script type: " + request.executable().getFileName());
        }

        List<String> command = new ArrayList<>();
        command.add(interpreter);
        command.add(request.executable().toString());
        command.addAll(request.args());
        return command;
    }

    @PreDestroy
    void shutdown() {
        stdinWriters.shutdownNow();
    }

    private static final class OsProcess implements RunningProcess {

        private final Process process;

        OsProcess(Process process) {
            this.process = process;
        }

        @Override public InputStream output() { return process.getInputStream(); }

        @Override public int waitFor() throws InterruptedException { return process.waitFor(); }

        @Override
        public void destroy() {
            if (process.isAlive()) {
                log.warn("Killing pid {}", process.pid());
                process.destroyForcibly();
            }
        }
    }

    private static final class StdinThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "stdin-writer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
