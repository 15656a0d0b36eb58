package com.scriptdeck.runner.pipeline;

import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises the two control markers a script can print:
 * <pre>
 *   PROGRESS 40 Downloading files   → percent 40, step "Downloading files"
 *   PROGRESS 75                     → percent 75, step unchanged
 *   DONE                            → percent 100, step "done"
 * </pre>
 * Marker lines are still ordinary output: they are logged and streamed like any other line.
 */
public final class MarkerParser {

    private static final Pattern PROGRESS = Pattern.compile("^PROGRESS\\s+(-?\\d+)\\s*(.*)$", Pattern.DOTALL);

    private static final Pattern DONE = Pattern.compile("^DONE\\b");

    private static final BigInteger ZERO    = BigInteger.ZERO;
    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    /**
     * @param percent  already clamped to [0, 100]
     * @param step     trimmed trailing text; empty means "keep the current step"
     */
    public record Progress(int percent, String step) {}

    private MarkerParser() {}

    public static Optional<Progress> parseProgress(String line) {
        Matcher m = PROGRESS.matcher(line);
        if (!m.matches()) return Optional.empty();
        return Optional.of(new Progress(clampPercent(m.group(1)), m.group(2).strip()));
    }

    public static boolean isDone(String line) {
        return DONE.matcher(line).lookingAt();
    }

    /** Clamp any integer literal, however long, to [0, 100]. */
    static int clampPercent(String digits) {
        BigInteger value = new BigInteger(digits);
        if (value.compareTo(ZERO) < 0) return 0;
        if (value.compareTo(HUNDRED) > 0) return 100;
        return value.intValue();
    }
}
