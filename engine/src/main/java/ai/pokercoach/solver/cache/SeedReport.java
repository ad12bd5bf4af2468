package ai.pokercoach.solver.cache;

/**
 * Outcome of a bulk load of precomputed solutions.
 *
 * @param loaded entries written to the cache
 * @param skipped files whose key was already cached
 * @param rejected files that could not be read or stored
 */
public record SeedReport(int loaded, int skipped, int rejected) {
}
