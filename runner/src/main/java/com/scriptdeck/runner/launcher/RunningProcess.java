package com.scriptdeck.runner.launcher;

import java.io.InputStream;

/**
 * A started script as seen by the output pipeline:
 * one merged stdout+stderr byte stream and an eventual exit code.
 */
public interface RunningProcess {

    /** Merged stdout and stderr. Reaches end-of-stream when the process closes both. */
    InputStream output();

    /** Block until the process exits and return its exit code. */
    int waitFor() throws InterruptedException;

    /** Kill the process. Used when its output will no longer be read. */
    void destroy();
}
