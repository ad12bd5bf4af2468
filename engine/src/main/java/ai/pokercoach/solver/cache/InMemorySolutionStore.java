package ai.pokercoach.solver.cache;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime store, for tests and for running without a cache directory.
 */
public class InMemorySolutionStore implements SolutionStore {
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> load(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void save(CacheEntry entry) {
        entries.put(entry.key(), entry);
    }

    @Override
    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    @Override
    public int size() {
        return entries.size();
    }
}
