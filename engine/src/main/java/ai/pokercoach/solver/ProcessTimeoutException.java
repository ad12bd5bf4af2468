package ai.pokercoach.solver;

import java.time.Duration;

/**
 * The solver process exceeded its wall-clock limit and was forcibly terminated.
 */
public class ProcessTimeoutException extends ProcessExecutionException {
    private final Duration timeout;

    public ProcessTimeoutException(Duration timeout, String stderrExcerpt) {
        super("Solver timed out after " + timeout.toMillis() + " ms", NO_EXIT_STATUS, stderrExcerpt, true);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
