package ai.pokercoach.solver;

/**
 * A structurally invalid situation or solver configuration. Caller error; never retried.
 */
public class ConfigurationException extends SolverException {
    private final String field;

    public ConfigurationException(String field, String message) {
        super("Invalid " + field + ": " + message);
        this.field = field;
    }

    /** Name of the offending field, e.g. "board" or "solver.accuracy". */
    public String getField() {
        return field;
    }
}
