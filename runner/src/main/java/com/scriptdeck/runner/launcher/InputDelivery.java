package com.scriptdeck.runner.launcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes the predetermined input to a script's stdin in one go and closes it.
 *
 * A script that asks for more input than was supplied sees end-of-input.
 * Failures are reported as {@link Outcome#FAILED} instead of thrown: the caller
 * logs them and carries on reading output.
 */
public final class InputDelivery {

    private static final Logger log = LoggerFactory.getLogger(InputDelivery.class);

    public enum Outcome { DELIVERED, NOTHING_TO_SEND, FAILED }

    private InputDelivery() {}

    /** Newline-joined payload with a trailing newline, or an empty string for no payload. */
    public static String render(List<String> payload) {
        if (payload == null || payload.isEmpty()) return "";
        return String.join("\n", payload) + "\n";
    }

    public static Outcome deliver(OutputStream stdin, List<String> payload) {
        String text = render(payload);
        Outcome outcome = text.isEmpty() ? Outcome.NOTHING_TO_SEND : Outcome.DELIVERED;
        try {
            if (!text.isEmpty()) {
                stdin.write(text.getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            }
        } catch (IOException e) {
            log.debug("stdin write failed: {}", e.getMessage());
            outcome = Outcome.FAILED;
        }
        try {
            stdin.close();
        } catch (IOException e) {
            log.debug("stdin close failed: {}", e.getMessage());
            outcome = Outcome.FAILED;
        }
        return outcome;
    }
}
