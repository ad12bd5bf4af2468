package ai.pokercoach.solver;

import java.time.Duration;

/**
 * A caller gave up waiting for a shared computation. The computation itself keeps
 * running and is cached when it completes.
 */
public class SolveWaitTimeoutException extends SolverException {

    public SolveWaitTimeoutException(String key, Duration waited) {
        super("Gave up waiting " + waited.toMillis() + " ms for solution " + key);
    }
}
