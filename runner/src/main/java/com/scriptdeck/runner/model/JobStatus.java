package com.scriptdeck.runner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a script run.
 *
 * Transitions:
 *   QUEUED → RUNNING → FINISHED | ERROR
 *   QUEUED → ERROR   (script could not be started)
 *
 * FINISHED and ERROR are terminal.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    FINISHED,
    ERROR;

    /** Lowercase name used in the REST API and on the live stream. */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == FINISHED || this == ERROR;
    }
}
