package com.scriptdeck.runner.stream;

import com.scriptdeck.runner.model.JobSnapshot;

/**
 * Text messages of the live stream, one per event:
 * <pre>
 *   LOG &lt;line&gt;
 *   STATE &lt;percent&gt;|&lt;status&gt;|&lt;step&gt;
 *   DONE rc=&lt;return code&gt;
 *   ERROR &lt;text&gt;
 * </pre>
 * The step text is sent as is; a '|' inside it cannot be told apart from the separator.
 */
public final class StreamMessages {

    /** Shown after "rc=" when the job has no return code. */
    static final String NO_RETURN_CODE = "None";

    private StreamMessages() {}

    public static String log(String line) {
        return "LOG " + line;
    }

    public static String state(JobSnapshot s) {
        return "STATE " + s.percent() + "|" + s.status().wireName() + "|" + s.step();
    }

    public static String done(Integer returnCode) {
        return "DONE rc=" + (returnCode == null ? NO_RETURN_CODE : returnCode);
    }

    public static String error(String text) {
        return "ERROR " + text;
    }
}
