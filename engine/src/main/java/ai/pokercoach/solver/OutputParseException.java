package ai.pokercoach.solver;

/**
 * Solver output did not match the pinned schema. Usually a version mismatch between
 * the configured binary and the parser; surfaced immediately, never retried.
 */
public class OutputParseException extends SolverException {
    private final String rawExcerpt;

    public OutputParseException(String message, String rawExcerpt) {
        super(message + (rawExcerpt == null || rawExcerpt.isEmpty() ? "" : " [output: " + rawExcerpt + "]"));
        this.rawExcerpt = rawExcerpt == null ? "" : rawExcerpt;
    }

    public OutputParseException(String message, String rawExcerpt, Throwable cause) {
        super(message + (rawExcerpt == null || rawExcerpt.isEmpty() ? "" : " [output: " + rawExcerpt + "]"), cause);
        this.rawExcerpt = rawExcerpt == null ? "" : rawExcerpt;
    }

    /** Bounded excerpt of the offending output. */
    public String getRawExcerpt() {
        return rawExcerpt;
    }
}
