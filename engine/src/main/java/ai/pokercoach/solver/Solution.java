package ai.pokercoach.solver;

import ai.pokercoach.game.Card;
import ai.pokercoach.game.Hand;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * The full per-hand strategy table of a solved situation, with the solver's
 * exploitability (distance from equilibrium, lower is better) and iteration count.
 *
 * <p>Immutable. Solutions held by the cache are in canonical suits; callers receive
 * a copy relabeled to their real cards via {@link #relabel(UnaryOperator, double)}.
 */
public final class Solution {
    private final Map<Hand, Strategy> strategies;
    private final double exploitability;
    private final int iterations;

    /**
     * @throws IllegalArgumentException on negative exploitability or iterations, or a
     *         strategy filed under the wrong hand
     */
    public Solution(Map<Hand, Strategy> strategies, double exploitability, int iterations) {
        Objects.requireNonNull(strategies, "strategies");
        if (!(exploitability >= 0)) {
            throw new IllegalArgumentException("Exploitability must be >= 0 but was " + exploitability);
        }
        if (iterations < 0) {
            throw new IllegalArgumentException("Iterations must be >= 0 but was " + iterations);
        }
        for (Map.Entry<Hand, Strategy> entry : strategies.entrySet()) {
            if (!entry.getKey().equals(entry.getValue().getHand())) {
                throw new IllegalArgumentException(
                        "Strategy for " + entry.getValue().getHand() + " filed under " + entry.getKey());
            }
        }
        this.strategies = Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
        this.exploitability = exploitability;
        this.iterations = iterations;
    }

    public Map<Hand, Strategy> getStrategies() {
        return strategies;
    }

    public double getExploitability() {
        return exploitability;
    }

    public int getIterations() {
        return iterations;
    }

    public int handCount() {
        return strategies.size();
    }

    public Optional<Strategy> findStrategy(Hand hand) {
        return Optional.ofNullable(strategies.get(hand));
    }

    /**
     * @throws NotFoundException if the table has no row for {@code hand}
     */
    public Strategy strategyFor(Hand hand) {
        Strategy strategy = strategies.get(hand);
        if (strategy == null) {
            throw new NotFoundException("No strategy for hand " + hand + " in a table of " + strategies.size() + " hands");
        }
        return strategy;
    }

    /**
     * Returns a copy with every hand relabeled through {@code cardMapping} and every
     * amount multiplied by {@code scale}.
     */
    public Solution relabel(UnaryOperator<Card> cardMapping, double scale) {
        Map<Hand, Strategy> relabeled = new LinkedHashMap<>();
        for (Strategy strategy : strategies.values()) {
            Strategy mapped = strategy.relabel(cardMapping, scale);
            relabeled.put(mapped.getHand(), mapped);
        }
        return new Solution(relabeled, exploitability, iterations);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Solution other)) {
            return false;
        }
        return Double.compare(exploitability, other.exploitability) == 0
                && iterations == other.iterations
                && strategies.equals(other.strategies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategies, exploitability, iterations);
    }

    @Override
    public String toString() {
        return "Solution{hands=" + strategies.size() + ", exploitability=" + exploitability
                + ", iterations=" + iterations + "}";
    }
}
