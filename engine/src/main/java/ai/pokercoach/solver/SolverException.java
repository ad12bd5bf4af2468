package ai.pokercoach.solver;

/**
 * Root of the solver bridge's failure types. Every subtype carries enough context
 * (offending field, exit status, output excerpt) to diagnose without re-running.
 */
public class SolverException extends RuntimeException {

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the same operation might succeed. Only transient process
     * failures say yes.
     */
    public boolean isRetryable() {
        return false;
    }

    /**
     * Trims {@code text} to at most {@code max} characters from its end, where
     * solver diagnostics usually are, marking the cut.
     */
    public static String excerpt(String text, int max) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        if (trimmed.length() <= max) {
            return trimmed;
        }
        return "..." + trimmed.substring(trimmed.length() - max);
    }
}
