package ai.pokercoach.solver;

import ai.pokercoach.game.Action;
import ai.pokercoach.game.Hand;
import ai.pokercoach.game.Situation;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Source of GTO strategies. Callers work in real cards and real stack sizes and never
 * see how the answer was obtained: solved on demand or read from precomputed data.
 * <p>
 * A failure is always reported as a typed {@link SolverException}; no implementation
 * substitutes a default or stale strategy.
 */
public interface SolverBridge {

    /**
     * Returns the full per-hand strategy table for {@code situation}, keyed by real cards.
     *
     * @throws ConfigurationException if the situation is invalid
     * @throws NotFoundException if no solution is available (precomputed backend)
     */
    Solution solve(Situation situation);

    /**
     * Returns the strategy of {@code hand} in {@code situation}.
     *
     * @throws ConfigurationException if the situation is invalid or the hand overlaps the board
     * @throws NotFoundException if the table has no row for the hand
     */
    Strategy getStrategy(Situation situation, Hand hand);

    /**
     * Returns the EV, in big blinds, of taking {@code action} with {@code hand}.
     *
     * @throws NotFoundException if the action is not part of the hand's strategy
     */
    default double getEv(Situation situation, Hand hand, Action action) {
        return getStrategy(situation, hand).ev(action);
    }

    /**
     * Returns the EV of each of {@code actions}, in the order given.
     *
     * @throws NotFoundException if any action is not part of the hand's strategy
     */
    default Map<Action, Double> compareActions(Situation situation, Hand hand, List<Action> actions) {
        Strategy strategy = getStrategy(situation, hand);
        Map<Action, Double> evs = new LinkedHashMap<>();
        for (Action action : actions) {
            evs.put(action, strategy.ev(action));
        }
        return evs;
    }
}
