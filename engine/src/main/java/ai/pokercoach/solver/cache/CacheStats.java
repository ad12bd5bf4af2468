package ai.pokercoach.solver.cache;

/**
 * Snapshot of cache counters.
 *
 * @param hits lookups answered from the cache
 * @param misses lookups that found nothing
 * @param size entries currently stored
 * @param coalesced callers that joined a computation already in flight instead of starting one
 * @param writeFailures write-throughs that failed and were absorbed
 */
public record CacheStats(long hits, long misses, int size, long coalesced, long writeFailures) {

    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    @Override
    public String toString() {
        return String.format("hits=%d misses=%d size=%d coalesced=%d writeFailures=%d hitRate=%.1f%%",
                hits, misses, size, coalesced, writeFailures, hitRate() * 100);
    }
}
