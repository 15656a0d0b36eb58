package com.scriptdeck.runner.launcher;

/**
 * Thrown when a script cannot be started: its type has no known interpreter,
 * or the operating system refused to spawn the process.
 * No process exists when this is thrown.
 */
public class LaunchResolutionException extends RuntimeException {

    public LaunchResolutionException(String message) {
        super(message);
    }

    public LaunchResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
