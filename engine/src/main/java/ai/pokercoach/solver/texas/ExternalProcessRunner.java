package ai.pokercoach.solver.texas;

import ai.pokercoach.solver.ProcessExecutionException;
import ai.pokercoach.solver.ProcessSpawnException;
import ai.pokercoach.solver.ProcessTimeoutException;
import ai.pokercoach.solver.SolverException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the solver as a child process in a private temporary working directory.
 * <p>
 * The input script is written to the working directory before start; stdout and stderr
 * go to files there so a chatty solver can never block on a full pipe. On timeout the
 * process and all of its descendants are killed and reaped before the timeout is
 * reported. The working directory is removed afterwards.
 */
public class ExternalProcessRunner implements ProcessRunner {
    private static final Logger log = LoggerFactory.getLogger(ExternalProcessRunner.class);

    static final int EXCERPT_LIMIT = 2000;
    private static final long REAP_SECONDS = 5;

    private final Set<Integer> transientExitCodes;

    /**
     * @param transientExitCodes exit statuses that signal resource exhaustion and may be retried
     */
    public ExternalProcessRunner(List<Integer> transientExitCodes) {
        this.transientExitCodes = Set.copyOf(transientExitCodes);
    }

    @Override
    public RawOutput run(ProcessInvocation invocation, Duration timeout) {
        checkProgram(invocation.program());
        Path workDir;
        try {
            workDir = Files.createTempDirectory("texas-solver-");
        } catch (IOException e) {
            throw new ProcessSpawnException("Cannot create solver working directory", e);
        }
        try {
            return runIn(workDir, invocation, timeout);
        } finally {
            deleteQuietly(workDir);
        }
    }

    private RawOutput runIn(Path workDir, ProcessInvocation invocation, Duration timeout) {
        Path stdoutFile = workDir.resolve("stdout.log");
        Path stderrFile = workDir.resolve("stderr.log");
        Process process;
        long startNanos = System.nanoTime();
        try {
            Files.writeString(workDir.resolve(invocation.inputFileName()), invocation.inputScript(),
                    StandardCharsets.UTF_8);
            process = new ProcessBuilder(invocation.command())
                    .directory(workDir.toFile())
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile())
                    .start();
        } catch (IOException e) {
            throw new ProcessSpawnException("Cannot start solver " + invocation.program() + ": " + e.getMessage(), e);
        }
        if (log.isDebugEnabled()) {
            log.debug("Started solver pid={} in {} with {}", process.pid(), workDir, invocation.command());
        }

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            throw new ProcessExecutionException("Interrupted while waiting for solver pid=" + process.pid(), e);
        }
        long durationMillis = (System.nanoTime() - startNanos) / 1_000_000L;

        if (!finished) {
            kill(process);
            log.warn("Solver pid={} killed after {} ms (limit {} ms)", process.pid(), durationMillis,
                    timeout.toMillis());
            throw new ProcessTimeoutException(timeout, SolverException.excerpt(readQuietly(stderrFile), EXCERPT_LIMIT));
        }

        String stdout = readQuietly(stdoutFile);
        String stderr = readQuietly(stderrFile);
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            boolean transientFailure = transientExitCodes.contains(exitCode);
            log.warn("Solver exited with status {} after {} ms{}", exitCode, durationMillis,
                    transientFailure ? " (transient)" : "");
            throw new ProcessExecutionException("Solver failed", exitCode,
                    SolverException.excerpt(stderr.isBlank() ? stdout : stderr, EXCERPT_LIMIT), transientFailure);
        }

        String resultJson = null;
        if (invocation.resultFileName() != null) {
            Path resultFile = workDir.resolve(invocation.resultFileName());
            if (Files.isRegularFile(resultFile)) {
                resultJson = readQuietly(resultFile);
            }
        }
        log.info("Solver finished in {} ms", durationMillis);
        return new RawOutput(exitCode, stdout, stderr, resultJson, Duration.ofMillis(durationMillis));
    }

    /**
     * Programs given as a path must exist and be executable; bare names are resolved by the OS on start.
     */
    private static void checkProgram(String program) {
        if (program.indexOf('/') < 0 && program.indexOf('\\') < 0) {
            return;
        }
        Path binary = Path.of(program);
        if (!Files.isRegularFile(binary)) {
            throw new ProcessSpawnException("Solver binary not found at " + binary);
        }
        if (!Files.isExecutable(binary)) {
            throw new ProcessSpawnException("Solver binary is not executable: " + binary);
        }
    }

    /** Kills the process tree and waits for the root to be reaped. */
    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(REAP_SECONDS, TimeUnit.SECONDS)) {
                log.error("Solver pid={} still alive {} s after kill", process.pid(), REAP_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String readQuietly(Path file) {
        try {
            return Files.isRegularFile(file) ? Files.readString(file, StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            log.warn("Could not read solver output {}: {}", file, e.toString());
            return "";
        }
    }

    private static void deleteQuietly(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not remove solver working directory {}: {}", dir, e.toString());
        }
    }
}
