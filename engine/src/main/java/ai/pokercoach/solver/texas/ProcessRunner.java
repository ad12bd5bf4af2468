package ai.pokercoach.solver.texas;

import ai.pokercoach.solver.ProcessExecutionException;
import java.time.Duration;

/**
 * Executes a solver invocation and captures its output. Tests substitute a
 * deterministic double for the real process.
 */
public interface ProcessRunner {

    /**
     * Runs {@code invocation} to completion, or kills it once {@code timeout} elapses.
     * No process started by this call is left running when it returns or throws.
     *
     * @return the captured output of a process that exited with status 0
     * @throws ProcessExecutionException on spawn failure, non-zero exit or timeout
     */
    RawOutput run(ProcessInvocation invocation, Duration timeout);
}
