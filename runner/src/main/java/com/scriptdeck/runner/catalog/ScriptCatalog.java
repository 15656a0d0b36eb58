package com.scriptdeck.runner.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Knows which scripts may be run and where they live.
 *
 * Two sources:
 * <ul>
 *   <li>the scripts directory: flat, names like {@code backup_db.py};</li>
 *   <li>the repos directory: one checkout per {@code repo-xxxxxxxx} id, provisioned
 *       by an external process; any .py/.sh file inside may be run with the
 *       checkout root as working directory.</li>
 * </ul>
 * Every lookup rejects names that would escape their directory.
 */
@Component
public class ScriptCatalog {

    private static final Logger log = LoggerFactory.getLogger(ScriptCatalog.class);

    private static final Pattern SAFE_NAME = Pattern.compile("^[a-zA-Z0-9_.-]+\\.(py|sh)$");
    private static final Pattern REPO_ID   = Pattern.compile("^repo-[a-f0-9]{8}$");

    private final Path scriptsDir;
    private final Path reposDir;

    public ScriptCatalog(
            @Value("${scriptdeck.catalog.scripts-dir:scripts}") String scriptsDir,
            @Value("${scriptdeck.catalog.repos-dir:repos}") String reposDir) {
        this.scriptsDir = createDir(Path.of(scriptsDir));
        this.reposDir   = createDir(Path.of(reposDir));
    }

    // ------------------------------------------------------------------
    // Resolution
    // ------------------------------------------------------------------

    /** Resolve a top-level script by file name. */
    public ResolvedScript resolveScript(String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches()) {
            throw new ScriptNotFoundException("script not found");
        }
        Path p = scriptsDir.resolve(name).normalize();
        if (!p.startsWith(scriptsDir) || !Files.isRegularFile(p)) {
            throw new ScriptNotFoundException("script not found");
        }
        return new ResolvedScript(name, p, null);
    }

    /** Resolve a file inside a provisioned repository; the repo root becomes the working directory. */
    public ResolvedScript resolveRepoFile(String repoId, String relativePath) {
        Path base = repoDir(repoId);
        if (base == null || relativePath == null || relativePath.isBlank()
                || relativePath.contains("..")
                || relativePath.startsWith("/") || relativePath.startsWith("\\")) {
            throw new ScriptNotFoundException("repo file not found");
        }
        Path target = base.resolve(relativePath).normalize();
        if (!target.startsWith(base) || !Files.isRegularFile(target) || !isRunnable(target)) {
            throw new ScriptNotFoundException("repo file not found");
        }
        return new ResolvedScript(repoId + ":" + relativePath, target, base);
    }

    // ------------------------------------------------------------------
    // Listing
    // ------------------------------------------------------------------

    /** Runnable top-level scripts, sorted. Names starting with "_" are helpers and hidden. */
    public List<String> listScripts() {
        try (Stream<Path> files = Files.list(scriptsDir)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> !n.startsWith("_"))
                    .filter(n -> n.endsWith(".py") || n.endsWith(".sh"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + scriptsDir, e);
        }
    }

    public List<String> listRepos() {
        try (Stream<Path> dirs = Files.list(reposDir)) {
            return dirs.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> REPO_ID.matcher(n).matches())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + reposDir, e);
        }
    }

    /** Runnable files of a repository as sorted relative paths; hidden files are skipped. */
    public List<String> listRepoFiles(String repoId) {
        Path base = repoDir(repoId);
        if (base == null) {
            throw new ScriptNotFoundException("repo not found");
        }
        try (Stream<Path> files = Files.walk(base)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .filter(ScriptCatalog::isRunnable)
                    .map(p -> base.relativize(p).toString())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + base, e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Existing checkout directory for {@code repoId}, or null. */
    private Path repoDir(String repoId) {
        if (repoId == null || !REPO_ID.matcher(repoId).matches()) return null;
        Path p = reposDir.resolve(repoId).normalize();
        return p.startsWith(reposDir) && Files.isDirectory(p) ? p : null;
    }

    private static boolean isRunnable(Path p) {
        String n = p.getFileName().toString();
        return n.endsWith(".py") || n.endsWith(".sh");
    }

    private static Path createDir(Path dir) {
        Path abs = dir.toAbsolutePath().normalize();
        try {
            Files.createDirectories(abs);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory " + abs, e);
        }
        log.info("Using directory {}", abs);
        return abs;
    }
}
