package ai.pokercoach.solver.cache;

import ai.pokercoach.solver.CacheIOException;
import java.util.Optional;

/**
 * Durable storage of cache entries, one per canonical key. A save replaces the whole
 * entry atomically: a concurrent load sees either the old entry or the new one.
 * Implementations signal storage failures with {@link CacheIOException}.
 */
public interface SolutionStore {

    Optional<CacheEntry> load(String key);

    void save(CacheEntry entry);

    boolean contains(String key);

    int size();
}
