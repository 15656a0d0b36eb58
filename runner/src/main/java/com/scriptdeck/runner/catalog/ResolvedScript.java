package com.scriptdeck.runner.catalog;

import java.nio.file.Path;

/**
 * A script the catalog has validated and located.
 *
 * @param scriptRef   name shown for the job: "name.py" or "repo-1a2b3c4d:tools/run.sh"
 * @param executable  absolute path of an existing .py or .sh file
 * @param workingDir  directory to run in, or null for the server's own working directory
 */
public record ResolvedScript(String scriptRef, Path executable, Path workingDir) {}
