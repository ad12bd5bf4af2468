package ai.pokercoach.solver.cache;

import ai.pokercoach.solver.Solution;
import java.time.Instant;
import java.util.Objects;

/**
 * A canonical-form solution as held by the cache.
 *
 * @param key canonical solution key
 * @param solution the solution, in canonical suits and canonical amounts
 * @param provenance how the entry was produced
 * @param createdAt when the entry was written
 */
public record CacheEntry(String key, Solution solution, Provenance provenance, Instant createdAt) {

    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(solution, "solution");
        Objects.requireNonNull(provenance, "provenance");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
