package ai.pokercoach.solver;

/**
 * A requested hand, action or precomputed solution is absent from otherwise valid data.
 */
public class NotFoundException extends SolverException {

    public NotFoundException(String message) {
        super(message);
    }
}
