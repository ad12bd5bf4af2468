package ai.pokercoach;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.pokercoach.config.CanonicalProperties;
import ai.pokercoach.game.Action;
import ai.pokercoach.game.Position;
import ai.pokercoach.game.Situation;
import ai.pokercoach.solver.PrecomputedSolverBridge;
import ai.pokercoach.solver.TestSolutions;
import ai.pokercoach.solver.cache.InMemorySolutionStore;
import ai.pokercoach.solver.cache.Provenance;
import ai.pokercoach.solver.cache.SolutionCache;
import ai.pokercoach.solver.canonical.Canonicalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("PokerCoach command line")
class PokerCoachTest {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final Canonicalizer canonicalizer = new Canonicalizer(new CanonicalProperties());
    private ExecutorService workers;
    private SolutionCache cache;
    private PokerCoach coach;

    @BeforeEach
    void setUp() {
        workers = Executors.newSingleThreadExecutor();
        cache = new SolutionCache(new InMemorySolutionStore(), new ObjectMapper(), workers, Duration.ofSeconds(5));
        coach = new PokerCoach(new PrecomputedSolverBridge(canonicalizer, cache), cache,
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void printsUsageWithoutCommand() {
        coach.run("--spring.profiles.active=solver-precomputed");
        assertEquals(PokerCoach.USAGE, output().trim());
    }

    @Test
    void printsStrategyInRealSuits() {
        Situation situation = Situation.builder().pot(7.5).effectiveStack(100).position(Position.CO).build();
        cache.put(canonicalizer.canonicalize(situation).getKey().solutionKey(),
                TestSolutions.solution("AcQd"), Provenance.PRECOMPUTED);

        coach.run("strategy", "AhQs", "CO", "7.5", "100");

        String text = output();
        assertTrue(text.startsWith("AhQs in "), text);
        assertTrue(text.contains("primary: bet 1.777778"), text);
    }

    @Test
    void slashInActionsStartsTheNextStreet() {
        Situation situation = Situation.builder().board("9c 7d 2h").pot(6).effectiveStack(100)
                .position(Position.BTN)
                .action(Position.BTN, Action.raise(2.5)).action(Position.BB, Action.call())
                .newStreet()
                .action(Position.BB, Action.check())
                .build();
        cache.put(canonicalizer.canonicalize(situation).getKey().solutionKey(),
                TestSolutions.solution("AcQd"), Provenance.PRECOMPUTED);

        coach.run("strategy", "AcQd", "BTN", "6", "100", "--board=9c 7d 2h",
                "--actions=BTN:raise 2.5, BB:call, /, BB:check");

        String text = output();
        assertTrue(text.startsWith("AcQd in "), text);
        assertTrue(text.contains("primary: bet 1.777778"), text);
    }

    @Test
    void reportsMissingSolutionAsError() {
        coach.run("strategy", "AhQs", "BTN", "7.5", "100", "--board=Ah Kh 7s");
        assertTrue(output().startsWith("Error: No precomputed solution for v1|FLOP|"), output());
    }

    @Test
    void rejectsBadInputWithUsage() {
        coach.run("strategy", "AhQs", "DEALER", "7.5", "100");
        String text = output();
        assertTrue(text.startsWith("Invalid input: Unknown position: DEALER"), text);
        assertTrue(text.contains(PokerCoach.USAGE), text);
    }

    @Test
    void rejectsWrongArgumentCount() {
        coach.run("solve", "CO", "7.5");
        assertTrue(output().startsWith("Invalid input: expected 3 arguments"), output());
    }

    @Test
    void refreshNeedsLiveBridge() {
        coach.run("refresh", "CO", "7.5", "100");
        assertEquals("refresh needs the solver-live profile", output().trim());
    }

    @Test
    void printsCacheStatistics() {
        coach.run("stats");
        assertTrue(output().startsWith("hits=0 misses=0 size=0 coalesced=0 writeFailures=0"), output());
    }

    @Test
    void seedsFromEmptyDirectory(@TempDir Path dir) {
        coach.run("seed", dir.toString());
        assertEquals("loaded=0 skipped=0 rejected=0", output().trim());
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
