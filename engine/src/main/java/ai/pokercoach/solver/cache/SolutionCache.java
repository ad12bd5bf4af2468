package ai.pokercoach.solver.cache;

import ai.pokercoach.solver.CacheIOException;
import ai.pokercoach.solver.SolveWaitTimeoutException;
import ai.pokercoach.solver.Solution;
import ai.pokercoach.solver.SolverException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonical-key to {@link Solution} cache over a {@link SolutionStore}, with
 * single-flight computation of misses.
 * <p>
 * Reads are lock-free. Writes to one key are serialized on a lock stripe, so store I/O
 * never runs inside the in-memory map. A miss handed to
 * {@link #getOrCompute(String, Supplier)} starts at most one computation per key; callers
 * arriving while it runs join it and receive the same result. Computations run on the
 * worker pool passed in, whose size bounds the number running at once; callers only
 * wait, each up to its own timeout, and giving up does not cancel the shared work.
 * <p>
 * The store is an optimisation, never a dependency: a failed write-through is logged
 * and counted, the result is still delivered, and the key simply stays a miss. A stored
 * entry that cannot be read is a miss too, and the next write-through replaces it.
 */
public class SolutionCache {
    private static final Logger log = LoggerFactory.getLogger(SolutionCache.class);
    private static final int WRITE_LOCK_STRIPES = 32;

    private final SolutionStore store;
    private final ObjectMapper objectMapper;
    private final ExecutorService workers;
    private final Duration callerTimeout;

    private final Map<String, CacheEntry> memory = new ConcurrentHashMap<>();
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();
    private final Object[] writeLocks = new Object[WRITE_LOCK_STRIPES];

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder coalesced = new LongAdder();
    private final LongAdder writeFailures = new LongAdder();

    public SolutionCache(SolutionStore store, ObjectMapper objectMapper, ExecutorService workers,
            Duration callerTimeout) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.workers = workers;
        this.callerTimeout = callerTimeout;
        for (int i = 0; i < writeLocks.length; i++) {
            writeLocks[i] = new Object();
        }
    }

    /**
     * Looks up {@code key}, counting a hit or a miss. A store that cannot be read counts as a miss.
     */
    public Optional<Solution> get(String key) {
        Optional<CacheEntry> entry = lookup(key);
        if (entry.isPresent()) {
            hits.increment();
            return Optional.of(entry.get().solution());
        }
        misses.increment();
        return Optional.empty();
    }

    /**
     * The stored entry for {@code key} with its provenance, without touching the counters.
     */
    public Optional<CacheEntry> entry(String key) {
        return lookup(key);
    }

    /**
     * Stores {@code solution} under {@code key} unless an entry already exists.
     *
     * @return true if written
     * @throws CacheIOException if the store rejects the write
     */
    public boolean put(String key, Solution solution, Provenance provenance) {
        return put(key, solution, provenance, false);
    }

    /**
     * Stores {@code solution} under {@code key}; an existing entry is replaced only when
     * {@code force} is set. Writes to the same key are serialized.
     *
     * @return true if written
     * @throws CacheIOException if the store rejects the write; the previous state is kept
     */
    public boolean put(String key, Solution solution, Provenance provenance, boolean force) {
        synchronized (writeLock(key)) {
            if (!force && (memory.containsKey(key) || storedReadably(key))) {
                return false;
            }
            CacheEntry entry = new CacheEntry(key, solution, provenance, Instant.now());
            store.save(entry);
            memory.put(key, entry);
            return true;
        }
    }

    /**
     * Returns the cached solution for {@code key}, or computes it once for all concurrent
     * callers, writes it through and delivers it to every one of them.
     *
     * @throws SolveWaitTimeoutException if this caller's wait exceeds the caller timeout
     * @throws SolverException whatever the computation failed with, unchanged
     */
    public Solution getOrCompute(String key, Supplier<Solution> compute) {
        Optional<Solution> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        return await(key, join(key, compute, false));
    }

    /**
     * Computes {@code key} afresh and overwrites the stored entry with the result as
     * {@link Provenance#DYNAMIC}. Joins a computation already in flight for the key.
     */
    public Solution recompute(String key, Supplier<Solution> compute) {
        return await(key, join(key, compute, true));
    }

    /**
     * Bulk-loads every {@code *.json} cache document in {@code directory} as precomputed data.
     *
     * @param force replace entries that already exist
     * @throws CacheIOException if the directory cannot be listed
     */
    public SeedReport seed(Path directory, boolean force) {
        List<Path> files = new ArrayList<>();
        try (Stream<Path> listing = Files.list(directory)) {
            listing.filter(path -> path.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .forEach(files::add);
        } catch (IOException e) {
            throw new CacheIOException("*", "Cannot list seed directory " + directory, e);
        }
        FileSolutionStore reader = new FileSolutionStore(directory, objectMapper);
        int loaded = 0;
        int skipped = 0;
        int rejected = 0;
        for (Path file : files) {
            try {
                CacheEntry entry = reader.read(file, file.getFileName().toString());
                if (put(entry.key(), entry.solution(), Provenance.PRECOMPUTED, force)) {
                    loaded++;
                } else {
                    skipped++;
                }
            } catch (CacheIOException e) {
                rejected++;
                log.warn("Rejected seed file {}: {}", file, e.getMessage());
            }
        }
        log.info("Seeded from {}: loaded={} skipped={} rejected={}", directory, loaded, skipped, rejected);
        return new SeedReport(loaded, skipped, rejected);
    }

    public CacheStats stats() {
        int size;
        try {
            size = store.size();
        } catch (CacheIOException e) {
            log.warn("Cannot size solution store, reporting memory size: {}", e.getMessage());
            size = memory.size();
        }
        return new CacheStats(hits.sum(), misses.sum(), size, coalesced.sum(), writeFailures.sum());
    }

    /** Number of keys with a computation currently running or queued. */
    public int inFlightCount() {
        return inFlight.size();
    }

    private Object writeLock(String key) {
        return writeLocks[Math.floorMod(key.hashCode(), writeLocks.length)];
    }

    /** An entry the store holds but cannot read does not count: the next write replaces it. */
    private boolean storedReadably(String key) {
        if (!store.contains(key)) {
            return false;
        }
        try {
            Optional<CacheEntry> stored = store.load(key);
            stored.ifPresent(loaded -> memory.putIfAbsent(key, loaded));
            return stored.isPresent();
        } catch (CacheIOException e) {
            log.warn("Replacing unreadable cache entry {}: {}", key, e.getMessage());
            return false;
        }
    }

    private Optional<CacheEntry> lookup(String key) {
        CacheEntry entry = memory.get(key);
        if (entry != null) {
            return Optional.of(entry);
        }
        try {
            Optional<CacheEntry> stored = store.load(key);
            stored.ifPresent(loaded -> memory.putIfAbsent(key, loaded));
            return stored;
        } catch (CacheIOException e) {
            log.warn("Treating unreadable cache entry as a miss: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private InFlight join(String key, Supplier<Solution> compute, boolean force) {
        boolean[] started = {false};
        InFlight flight = inFlight.compute(key, (k, existing) -> {
            if (existing != null) {
                existing.waiters.incrementAndGet();
                coalesced.increment();
                return existing;
            }
            started[0] = true;
            return new InFlight();
        });
        if (started[0]) {
            try {
                workers.execute(() -> runComputation(key, flight, compute, force));
            } catch (RejectedExecutionException e) {
                inFlight.remove(key, flight);
                flight.future.completeExceptionally(new SolverException("Solver workers are shut down", e));
            }
        } else if (log.isDebugEnabled()) {
            log.debug("Joined in-flight solve of {} ({} waiting)", key, flight.waiters.get());
        }
        return flight;
    }

    private void runComputation(String key, InFlight flight, Supplier<Solution> compute, boolean force) {
        long startNanos = System.nanoTime();
        try {
            Optional<CacheEntry> existing = force ? Optional.empty() : lookup(key);
            Solution solution;
            if (existing.isPresent()) {
                solution = existing.get().solution();
            } else {
                solution = compute.get();
                writeThrough(key, solution, force);
            }
            flight.future.complete(solution);
            if (log.isDebugEnabled()) {
                log.debug("Solved {} in {} ms for {} caller(s)", key,
                        (System.nanoTime() - startNanos) / 1_000_000L, flight.waiters.get());
            }
        } catch (RuntimeException | Error e) {
            flight.future.completeExceptionally(e);
            log.warn("Solve of {} failed after {} ms: {}", key, (System.nanoTime() - startNanos) / 1_000_000L,
                    e.toString());
        } finally {
            inFlight.remove(key, flight);
        }
    }

    private void writeThrough(String key, Solution solution, boolean force) {
        try {
            put(key, solution, Provenance.DYNAMIC, force);
        } catch (CacheIOException e) {
            writeFailures.increment();
            log.warn("Cache write failed, delivering uncached result: {}", e.getMessage());
        }
    }

    private Solution await(String key, InFlight flight) {
        try {
            return flight.future.get(callerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Caller gave up on {} after {} ms; the solve continues", key, callerTimeout.toMillis());
            throw new SolveWaitTimeoutException(key, callerTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverException("Interrupted while waiting for " + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new SolverException("Solve of " + key + " failed", cause);
        } finally {
            flight.waiters.decrementAndGet();
        }
    }

    /** A computation in progress and the number of callers waiting on it. */
    private static final class InFlight {
        final CompletableFuture<Solution> future = new CompletableFuture<>();
        final AtomicInteger waiters = new AtomicInteger(1);
    }
}
