package ai.pokercoach.solver;

/**
 * The solver binary could not be started (missing, not executable, working directory
 * unwritable). A configuration problem: reported, never retried.
 */
public class ProcessSpawnException extends ProcessExecutionException {

    public ProcessSpawnException(String message, Throwable cause) {
        super(message, cause);
    }

    public ProcessSpawnException(String message) {
        super(message, null);
    }
}
