package ai.pokercoach.solver.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.pokercoach.solver.OutputParseException;
import ai.pokercoach.solver.SolveWaitTimeoutException;
import ai.pokercoach.solver.Solution;
import ai.pokercoach.solver.TestSolutions;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SolutionCache")
class SolutionCacheTest {
    private static final String KEY = "v1|FLOP|Ac7d2h|S4|P10|IP|r-c";
    private static final String OTHER = "v1|TURN|Ac7d2hJs|S3|P25|OOP|x-b-c";
    private static final String THIRD = "v1|RIVER|Ac7d2hJs3c|S3|P40|IP|x";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExecutorService workers;
    private ExecutorService callers;
    private RecordingSolutionStore store;
    private SolutionCache cache;

    @BeforeEach
    void setUp() {
        workers = Executors.newFixedThreadPool(2);
        callers = Executors.newFixedThreadPool(8);
        store = new RecordingSolutionStore();
        cache = new SolutionCache(store, objectMapper, workers, Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        callers.shutdownNow();
    }

    @Nested
    @DisplayName("Lookup and storage")
    class StorageTests {

        @Test
        void putThenGetRoundTrips() {
            Solution solution = TestSolutions.solution("AcKd", "QcQd");
            assertTrue(cache.put(KEY, solution, Provenance.DYNAMIC));
            assertEquals(solution, cache.get(KEY).orElseThrow());
        }

        @Test
        void countsHitsAndMisses() {
            cache.get(KEY);
            cache.put(KEY, TestSolutions.solution("AcKd"), Provenance.PRECOMPUTED);
            cache.get(KEY);
            cache.get(KEY);

            CacheStats stats = cache.stats();
            assertEquals(2, stats.hits());
            assertEquals(1, stats.misses());
            assertEquals(1, stats.size());
        }

        @Test
        void putNeverOverwritesUnlessForced() {
            Solution first = TestSolutions.solution("AcKd");
            Solution second = TestSolutions.solution("QcQd");
            cache.put(KEY, first, Provenance.PRECOMPUTED);

            assertFalse(cache.put(KEY, second, Provenance.DYNAMIC));
            assertEquals(first, cache.get(KEY).orElseThrow());

            assertTrue(cache.put(KEY, second, Provenance.DYNAMIC, true));
            assertEquals(second, cache.get(KEY).orElseThrow());
            assertEquals(Provenance.DYNAMIC, cache.entry(KEY).orElseThrow().provenance());
        }

        @Test
        void slowWriteDoesNotBlockOtherKeys() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            RecordingSolutionStore slow = new RecordingSolutionStore().holdingWritesOf(KEY, release);
            SolutionCache slowCache = new SolutionCache(slow, objectMapper, workers, Duration.ofSeconds(10));
            try {
                Future<Boolean> held = callers.submit(
                        () -> slowCache.put(KEY, TestSolutions.solution("AcKd"), Provenance.DYNAMIC));
                assertTrue(slow.awaitWriting(5_000));

                Future<Boolean> other = callers.submit(
                        () -> slowCache.put(OTHER, TestSolutions.solution("QcQd"), Provenance.DYNAMIC));
                assertTrue(other.get(1, TimeUnit.SECONDS));
                assertTrue(slowCache.get(OTHER).isPresent());
                assertFalse(slowCache.get(KEY).isPresent());

                release.countDown();
                assertTrue(held.get(5, TimeUnit.SECONDS));
                assertTrue(slowCache.get(KEY).isPresent());
            } finally {
                release.countDown();
            }
        }

        @Test
        void readsEntriesWrittenByAnEarlierCache() {
            store.save(new CacheEntry(KEY, TestSolutions.solution("AcKd"), Provenance.PRECOMPUTED, Instant.now()));
            assertTrue(cache.get(KEY).isPresent());
        }
    }

    @Nested
    @DisplayName("Single flight")
    class SingleFlightTests {

        @Test
        void concurrentMissesShareOneComputation() throws Exception {
            AtomicInteger computations = new AtomicInteger();
            CountDownLatch release = new CountDownLatch(1);
            Solution solution = TestSolutions.solution("AcKd");
            Callable<Solution> caller = () -> cache.getOrCompute(KEY, () -> {
                computations.incrementAndGet();
                await(release);
                return solution;
            });

            List<Future<Solution>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(callers.submit(caller));
            }
            waitUntil(() -> cache.stats().coalesced() == 7);
            release.countDown();

            for (Future<Solution> result : results) {
                assertSame(solution, result.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, computations.get());
            assertEquals(1, store.saves());
            waitUntil(() -> cache.inFlightCount() == 0);
        }

        @Test
        void laterCallersHitTheCache() {
            AtomicInteger computations = new AtomicInteger();
            cache.getOrCompute(KEY, () -> {
                computations.incrementAndGet();
                return TestSolutions.solution("AcKd");
            });
            cache.getOrCompute(KEY, () -> {
                computations.incrementAndGet();
                return TestSolutions.solution("AcKd");
            });
            assertEquals(1, computations.get());
            assertEquals(1, cache.stats().hits());
        }

        @Test
        void failuresReachEveryCallerAndAreNotCached() {
            OutputParseException failure = new OutputParseException("truncated", "{\"str");
            OutputParseException thrown = assertThrows(OutputParseException.class,
                    () -> cache.getOrCompute(KEY, () -> {
                        throw failure;
                    }));
            assertSame(failure, thrown);
            assertEquals(0, store.saves());
            assertFalse(cache.get(KEY).isPresent());
        }

        @Test
        void callerTimeoutDoesNotCancelTheSharedSolve() throws Exception {
            SolutionCache impatient = new SolutionCache(store, objectMapper, workers, Duration.ofMillis(100));
            CountDownLatch release = new CountDownLatch(1);
            Solution solution = TestSolutions.solution("AcKd");

            assertThrows(SolveWaitTimeoutException.class, () -> impatient.getOrCompute(KEY, () -> {
                await(release);
                return solution;
            }));
            release.countDown();

            waitUntil(() -> impatient.inFlightCount() == 0);
            assertEquals(solution, impatient.get(KEY).orElseThrow());
        }

        @Test
        void boundedPoolRunsDistinctKeysOneAtATimeInArrivalOrder() throws Exception {
            ExecutorService single = Executors.newFixedThreadPool(1);
            try {
                SolutionCache bounded = new SolutionCache(store, objectMapper, single, Duration.ofSeconds(10));
                List<String> started = new CopyOnWriteArrayList<>();
                CountDownLatch releaseFirst = new CountDownLatch(1);

                Future<Solution> first = callers.submit(() -> bounded.getOrCompute(KEY, () -> {
                    started.add(KEY);
                    await(releaseFirst);
                    return TestSolutions.solution("AcKd");
                }));
                waitUntil(() -> started.size() == 1);
                Future<Solution> second = callers.submit(() -> bounded.getOrCompute(OTHER, () -> {
                    started.add(OTHER);
                    return TestSolutions.solution("QcQd");
                }));
                waitUntil(() -> bounded.inFlightCount() == 2);
                Future<Solution> third = callers.submit(() -> bounded.getOrCompute(THIRD, () -> {
                    started.add(THIRD);
                    return TestSolutions.solution("JcJd");
                }));
                waitUntil(() -> bounded.inFlightCount() == 3);

                Thread.sleep(100);
                assertEquals(List.of(KEY), started, "queued keys wait for the running one");

                releaseFirst.countDown();
                assertEquals(TestSolutions.solution("AcKd"), first.get(5, TimeUnit.SECONDS));
                assertEquals(TestSolutions.solution("QcQd"), second.get(5, TimeUnit.SECONDS));
                assertEquals(TestSolutions.solution("JcJd"), third.get(5, TimeUnit.SECONDS));
                assertEquals(List.of(KEY, OTHER, THIRD), started);
            } finally {
                single.shutdownNow();
            }
        }

        @Test
        void recomputeOverwritesTheEntry() {
            cache.put(KEY, TestSolutions.solution("AcKd"), Provenance.PRECOMPUTED);
            Solution fresh = TestSolutions.solution("QcQd");

            assertEquals(fresh, cache.recompute(KEY, () -> fresh));
            assertEquals(fresh, cache.get(KEY).orElseThrow());
            assertEquals(Provenance.DYNAMIC, cache.entry(KEY).orElseThrow().provenance());
        }
    }

    @Nested
    @DisplayName("Storage failures")
    class StorageFailureTests {

        @Test
        void failedWriteStillDeliversTheResult() {
            RecordingSolutionStore failing = new RecordingSolutionStore().failingWrites();
            SolutionCache degraded = new SolutionCache(failing, objectMapper, workers, Duration.ofSeconds(10));
            Solution solution = TestSolutions.solution("AcKd");

            assertEquals(solution, degraded.getOrCompute(KEY, () -> solution));
            assertEquals(1, degraded.stats().writeFailures());
            assertFalse(degraded.get(KEY).isPresent(), "key stays a miss");
        }
    }

    @Nested
    @DisplayName("Unreadable entries")
    class UnreadableEntryTests {

        @Test
        void unreadableFileIsReplacedByTheFirstSolve(@TempDir Path dir) throws IOException {
            FileSolutionStore files = new FileSolutionStore(dir, objectMapper);
            Files.writeString(files.pathFor(KEY), "{ truncated");
            SolutionCache onDisk = new SolutionCache(files, objectMapper, workers, Duration.ofSeconds(10));
            AtomicInteger computations = new AtomicInteger();

            for (int i = 0; i < 3; i++) {
                onDisk.getOrCompute(KEY, () -> {
                    computations.incrementAndGet();
                    return TestSolutions.solution("AcKd");
                });
            }

            assertEquals(1, computations.get());
            assertTrue(files.load(KEY).isPresent());
            SolutionCache restarted = new SolutionCache(files, objectMapper, workers, Duration.ofSeconds(10));
            assertTrue(restarted.get(KEY).isPresent());
        }

        @Test
        void putReplacesAnUnreadableFile(@TempDir Path dir) throws IOException {
            FileSolutionStore files = new FileSolutionStore(dir, objectMapper);
            Files.writeString(files.pathFor(KEY), "{ truncated");
            SolutionCache onDisk = new SolutionCache(files, objectMapper, workers, Duration.ofSeconds(10));

            assertTrue(onDisk.put(KEY, TestSolutions.solution("AcKd"), Provenance.PRECOMPUTED));
            assertEquals(Provenance.PRECOMPUTED, files.load(KEY).orElseThrow().provenance());
        }
    }

    @Nested
    @DisplayName("Seeding")
    class SeedTests {

        @Test
        void loadsDocumentsAsPrecomputed(@TempDir Path dir) throws IOException {
            FileSolutionStore source = new FileSolutionStore(dir, objectMapper);
            source.save(new CacheEntry(KEY, TestSolutions.solution("AcKd"), Provenance.DYNAMIC, Instant.now()));
            source.save(new CacheEntry("v1|PREFLOP|-|S4|P10|OPEN3|_", TestSolutions.solution("AcAd"),
                    Provenance.DYNAMIC, Instant.now()));
            Files.writeString(dir.resolve("broken.json"), "{\"key\": ");

            SeedReport report = cache.seed(dir, false);

            assertEquals(new SeedReport(2, 0, 1), report);
            assertEquals(Provenance.PRECOMPUTED, cache.entry(KEY).orElseThrow().provenance());
        }

        @Test
        void skipsKnownKeysUnlessForced(@TempDir Path dir) {
            new FileSolutionStore(dir, objectMapper)
                    .save(new CacheEntry(KEY, TestSolutions.solution("QcQd"), Provenance.PRECOMPUTED, Instant.now()));
            cache.put(KEY, TestSolutions.solution("AcKd"), Provenance.DYNAMIC);

            assertEquals(new SeedReport(0, 1, 0), cache.seed(dir, false));
            assertEquals(new SeedReport(1, 0, 0), cache.seed(dir, true));
            assertEquals(TestSolutions.solution("QcQd"), cache.get(KEY).orElseThrow());
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5 s");
            }
            Thread.sleep(10);
        }
    }
}
