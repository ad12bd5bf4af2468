package ai.pokercoach.solver;

/**
 * The external solver process failed: non-zero exit, timeout or spawn failure.
 *
 * <p>Only failures the runner classified as transient (see {@link #isRetryable()})
 * are eligible for the single automatic retry.
 */
public class ProcessExecutionException extends SolverException {
    /** Exit status used when the process never produced one. */
    public static final int NO_EXIT_STATUS = -1;

    private final int exitStatus;
    private final String stderrExcerpt;
    private final boolean transientFailure;

    public ProcessExecutionException(String message, int exitStatus, String stderrExcerpt, boolean transientFailure) {
        super(message + " (exit=" + exitStatus + ")" + (stderrExcerpt == null || stderrExcerpt.isEmpty()
                ? "" : ": " + stderrExcerpt));
        this.exitStatus = exitStatus;
        this.stderrExcerpt = stderrExcerpt == null ? "" : stderrExcerpt;
        this.transientFailure = transientFailure;
    }

    public ProcessExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.exitStatus = NO_EXIT_STATUS;
        this.stderrExcerpt = "";
        this.transientFailure = false;
    }

    public int getExitStatus() {
        return exitStatus;
    }

    public String getStderrExcerpt() {
        return stderrExcerpt;
    }

    @Override
    public boolean isRetryable() {
        return transientFailure;
    }
}
