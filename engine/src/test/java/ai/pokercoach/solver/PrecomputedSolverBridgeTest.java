package ai.pokercoach.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.pokercoach.config.CanonicalProperties;
import ai.pokercoach.game.Action;
import ai.pokercoach.game.Hand;
import ai.pokercoach.game.Position;
import ai.pokercoach.game.Situation;
import ai.pokercoach.solver.cache.InMemorySolutionStore;
import ai.pokercoach.solver.cache.Provenance;
import ai.pokercoach.solver.cache.SolutionCache;
import ai.pokercoach.solver.canonical.CanonicalForm;
import ai.pokercoach.solver.canonical.Canonicalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PrecomputedSolverBridgeTest {
    private final Canonicalizer canonicalizer = new Canonicalizer(new CanonicalProperties());
    private ExecutorService workers;
    private SolutionCache cache;
    private PrecomputedSolverBridge bridge;

    @BeforeEach
    void setUp() {
        workers = Executors.newSingleThreadExecutor();
        cache = new SolutionCache(new InMemorySolutionStore(), new ObjectMapper(), workers, Duration.ofSeconds(5));
        bridge = new PrecomputedSolverBridge(canonicalizer, cache);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void missIsNotFoundWithoutSolving() {
        NotFoundException failure = assertThrows(NotFoundException.class,
                () -> bridge.getStrategy(flop("Ah Kh 7s"), Hand.parse("QhJh")));
        assertTrue(failure.getMessage().startsWith("No precomputed solution for v1|FLOP|"), failure.getMessage());
        assertEquals(0, cache.inFlightCount());
    }

    @Test
    void answersInTheCallersSuits() {
        Situation situation = flop("Ah Kh 7s");
        CanonicalForm form = canonicalizer.canonicalize(situation, Hand.parse("QhJh"));
        Hand canonicalHand = form.getHand().orElseThrow();
        cache.put(form.getKey().solutionKey(), TestSolutions.solution(canonicalHand.toString()), Provenance.PRECOMPUTED);

        Strategy strategy = bridge.getStrategy(situation, Hand.parse("QhJh"));

        assertEquals(Hand.parse("QhJh"), strategy.getHand());
        assertEquals(0.6, strategy.frequency(Action.bet(2)), 1e-9);
        assertEquals(1.0, bridge.getEv(situation, Hand.parse("QhJh"), Action.check()), 1e-9);
    }

    @Test
    void suitPermutedBoardHitsTheSameEntry() {
        Situation stored = flop("Ah Kh 7s");
        CanonicalForm form = canonicalizer.canonicalize(stored, Hand.parse("QhJh"));
        cache.put(form.getKey().solutionKey(),
                TestSolutions.solution(form.getHand().orElseThrow().toString()), Provenance.PRECOMPUTED);

        // hearts become diamonds and spades become clubs
        Strategy strategy = bridge.getStrategy(flop("Ad Kd 7c"), Hand.parse("QdJd"));

        assertEquals(Hand.parse("QdJd"), strategy.getHand());
        assertEquals(0.4, strategy.frequency(Action.check()), 1e-9);
    }

    @Test
    void tinyStacksKeepSmallSizes() {
        // 0.3bb sits in the 0-25 bucket, so canonical amounts shrink by 0.3 / 12.5
        Situation situation = Situation.builder().pot(0.3).effectiveStack(0.3).position(Position.BTN).build();
        CanonicalForm form = canonicalizer.canonicalize(situation, Hand.parse("QhJh"));
        Hand canonicalHand = form.getHand().orElseThrow();
        Map<Action, Double> frequencies = new LinkedHashMap<>();
        frequencies.put(Action.fold(), 0.5);
        frequencies.put(Action.bet(0.2), 0.5);
        Map<Action, Double> evs = new LinkedHashMap<>();
        evs.put(Action.fold(), 0.0);
        evs.put(Action.bet(0.2), 0.5);
        Strategy stored = new Strategy(canonicalHand, frequencies, evs);
        cache.put(form.getKey().solutionKey(), new Solution(Map.of(canonicalHand, stored), 0.1, 10),
                Provenance.PRECOMPUTED);

        Strategy strategy = bridge.getStrategy(situation, Hand.parse("QhJh"));

        assertEquals(0.5, strategy.frequency(Action.bet(0.0048)), 1e-9);
        assertEquals(0.012, strategy.ev(Action.bet(0.0048)), 1e-9);
    }

    private static Situation flop(String board) {
        // 62.5bb is the middle of the 50-75 bucket, so amounts come back unscaled
        return Situation.builder()
                .board(board)
                .pot(7.5)
                .effectiveStack(62.5)
                .position(Position.BTN)
                .build();
    }
}
