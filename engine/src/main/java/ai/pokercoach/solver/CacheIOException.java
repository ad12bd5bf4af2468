package ai.pokercoach.solver;

/**
 * Reading or writing the solution store failed. Absorbed by the cache: logged, and the
 * affected key behaves as a miss.
 */
public class CacheIOException extends SolverException {
    private final String key;

    public CacheIOException(String key, String message, Throwable cause) {
        super(message + " (key=" + key + ")", cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
