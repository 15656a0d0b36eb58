package com.scriptdeck.runner.launcher;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything needed to start one script.
 *
 * @param executable    already validated, existing script file
 * @param args          extra command-line arguments passed after the script path
 * @param workingDir    process working directory; null inherits the server's
 * @param stdinPayload  lines written to stdin once, then stdin is closed; may be empty
 */
public record LaunchRequest(Path executable, List<String> args, Path workingDir, List<String> stdinPayload) {

    public LaunchRequest {
        if (executable == null) throw new IllegalArgumentException("executable is required");
        args         = args == null ? List.of() : List.copyOf(args);
        stdinPayload = stdinPayload == null ? List.of() : List.copyOf(stdinPayload);
    }
}
