package ai.pokercoach.solver;

import ai.pokercoach.game.Action;
import ai.pokercoach.game.Card;
import ai.pokercoach.game.Hand;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * GTO strategy for one hand in one situation: how often to take each available
 * action, and the expected value (big blinds) of each.
 *
 * <p>Invariants, checked on construction: every frequency lies in [0, 1], the
 * frequencies sum to 1 within {@link #SUM_TOLERANCE}, and every action played with
 * non-zero frequency has a finite EV. Instances are immutable.
 */
public final class Strategy {
    public static final double SUM_TOLERANCE = 1e-6;

    private final Hand hand;
    private final Map<Action, Double> frequencies;
    private final Map<Action, Double> evs;

    /**
     * @throws IllegalArgumentException if the frequencies or EVs violate the invariants
     */
    public Strategy(Hand hand, Map<Action, Double> frequencies, Map<Action, Double> evs) {
        this.hand = Objects.requireNonNull(hand, "hand");
        Objects.requireNonNull(frequencies, "frequencies");
        Objects.requireNonNull(evs, "evs");
        if (frequencies.isEmpty()) {
            throw new IllegalArgumentException("Strategy for " + hand + " has no actions");
        }
        double sum = 0;
        for (Map.Entry<Action, Double> entry : frequencies.entrySet()) {
            double frequency = entry.getValue();
            if (!(frequency >= 0 && frequency <= 1)) {
                throw new IllegalArgumentException(
                        "Frequency of " + entry.getKey() + " for " + hand + " out of range: " + frequency);
            }
            if (frequency > 0) {
                Double ev = evs.get(entry.getKey());
                if (ev == null || !Double.isFinite(ev)) {
                    throw new IllegalArgumentException(
                            "Action " + entry.getKey() + " for " + hand + " is played but has no finite EV");
                }
            }
            sum += frequency;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Frequencies for " + hand + " sum to " + sum);
        }
        this.frequencies = Collections.unmodifiableMap(new LinkedHashMap<>(frequencies));
        this.evs = Collections.unmodifiableMap(new LinkedHashMap<>(evs));
    }

    public Hand getHand() {
        return hand;
    }

    /** Action to frequency, in the solver's action order. */
    public Map<Action, Double> getFrequencies() {
        return frequencies;
    }

    /** Action to EV in big blinds. */
    public Map<Action, Double> getEvs() {
        return evs;
    }

    public Set<Action> actions() {
        return frequencies.keySet();
    }

    /**
     * Frequency of {@code action}, 0 when the action is not available.
     */
    public double frequency(Action action) {
        return frequencies.getOrDefault(action, 0.0);
    }

    /**
     * EV of {@code action} in big blinds.
     *
     * @throws NotFoundException if the strategy has no EV for the action
     */
    public double ev(Action action) {
        Double ev = evs.get(action);
        if (ev == null) {
            throw new NotFoundException("No EV for action " + action + " with " + hand + "; available " + evs.keySet());
        }
        return ev;
    }

    /**
     * The most frequent action. Ties go to the action listed first.
     */
    public Action primaryAction() {
        Action best = null;
        double bestFrequency = -1;
        for (Map.Entry<Action, Double> entry : frequencies.entrySet()) {
            if (entry.getValue() > bestFrequency) {
                best = entry.getKey();
                bestFrequency = entry.getValue();
            }
        }
        return best;
    }

    /**
     * Frequency-weighted EV of playing this strategy.
     */
    public double expectedValue() {
        double total = 0;
        for (Map.Entry<Action, Double> entry : frequencies.entrySet()) {
            if (entry.getValue() > 0) {
                total += entry.getValue() * evs.get(entry.getKey());
            }
        }
        return total;
    }

    /**
     * Returns this strategy with cards relabeled and amounts (action sizes and EVs)
     * multiplied by {@code scale}.
     *
     * @throws SolverException if two sizes become indistinguishable or a size vanishes
     */
    public Strategy relabel(UnaryOperator<Card> cardMapping, double scale) {
        Map<Action, Double> scaledFrequencies = new LinkedHashMap<>();
        Map<Action, Double> scaledEvs = new LinkedHashMap<>();
        try {
            for (Map.Entry<Action, Double> entry : frequencies.entrySet()) {
                if (scaledFrequencies.put(entry.getKey().scaled(scale), entry.getValue()) != null) {
                    throw new IllegalArgumentException(entry.getKey() + " collides with another size");
                }
            }
            for (Map.Entry<Action, Double> entry : evs.entrySet()) {
                scaledEvs.put(entry.getKey().scaled(scale), entry.getValue() * scale);
            }
        } catch (IllegalArgumentException e) {
            throw new SolverException("Cannot rescale the strategy for " + hand + " by " + scale + ": "
                    + e.getMessage(), e);
        }
        return new Strategy(hand.map(cardMapping), scaledFrequencies, scaledEvs);
    }

    @Override
    public String toString() {
        return hand + " " + frequencies;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Strategy other)) {
            return false;
        }
        return hand.equals(other.hand) && frequencies.equals(other.frequencies) && evs.equals(other.evs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hand, frequencies, evs);
    }
}
