package ai.pokercoach.solver.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.pokercoach.game.Action;
import ai.pokercoach.game.Hand;
import ai.pokercoach.solver.CacheIOException;
import ai.pokercoach.solver.Solution;
import ai.pokercoach.solver.Strategy;
import ai.pokercoach.solver.TestSolutions;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileSolutionStore")
class FileSolutionStoreTest {
    private static final String KEY = "v1|TURN|Ac7d2hJs|S3|P25|OOP|x-b-c";

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void savedEntriesLoadBackEqual() {
        FileSolutionStore store = new FileSolutionStore(dir.resolve("cache"), objectMapper);
        CacheEntry entry = new CacheEntry(KEY, TestSolutions.solution("AcKd", "QcQd"), Provenance.DYNAMIC,
                Instant.parse("2026-01-02T03:04:05Z"));

        store.save(entry);

        assertEquals(entry, store.load(KEY).orElseThrow());
        assertTrue(store.contains(KEY));
        assertEquals(1, store.size());
    }

    @Test
    void keepsEvsOfActionsThatAreNeverPlayed() {
        Map<Action, Double> frequencies = new LinkedHashMap<>();
        frequencies.put(Action.check(), 1.0);
        Map<Action, Double> evs = new LinkedHashMap<>();
        evs.put(Action.check(), 0.8);
        evs.put(Action.allIn(), -4.5);
        Strategy strategy = new Strategy(Hand.parse("7c2d"), frequencies, evs);
        Solution solution = new Solution(Map.of(strategy.getHand(), strategy), 0.1, 50);
        FileSolutionStore store = new FileSolutionStore(dir, objectMapper);

        store.save(new CacheEntry(KEY, solution, Provenance.DYNAMIC, Instant.now()));

        assertEquals(solution, store.load(KEY).orElseThrow().solution());
    }

    @Test
    void filesAreNamedByKeyDigestAndLeaveNoTemporaries() throws IOException {
        FileSolutionStore store = new FileSolutionStore(dir, objectMapper);
        store.save(new CacheEntry(KEY, TestSolutions.solution("AcKd"), Provenance.DYNAMIC, Instant.now()));
        store.save(new CacheEntry(KEY, TestSolutions.solution("QcQd"), Provenance.DYNAMIC, Instant.now()));

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
        assertTrue(Files.isRegularFile(store.pathFor(KEY)));
        assertEquals(64 + ".json".length(), store.pathFor(KEY).getFileName().toString().length());
    }

    @Test
    void unknownKeyIsAbsent() {
        FileSolutionStore store = new FileSolutionStore(dir, objectMapper);
        assertFalse(store.load(KEY).isPresent());
        assertEquals(0, store.size());
    }

    @Test
    void corruptDocumentIsACacheError() throws IOException {
        FileSolutionStore store = new FileSolutionStore(dir, objectMapper);
        Files.writeString(store.pathFor(KEY), "{\"key\": \"" + KEY + "\", \"hands\": [{\"hand\": \"AcAc\"}]}");
        CacheIOException failure = assertThrows(CacheIOException.class, () -> store.load(KEY));
        assertEquals(KEY, failure.getKey());
    }

    @Test
    void unwritableDirectoryIsACacheError() throws IOException {
        Path blocker = Files.writeString(dir.resolve("not-a-directory"), "");
        FileSolutionStore store = new FileSolutionStore(blocker, objectMapper);
        assertThrows(CacheIOException.class, () -> store.save(
                new CacheEntry(KEY, TestSolutions.solution("AcKd"), Provenance.DYNAMIC, Instant.now())));
    }
}
