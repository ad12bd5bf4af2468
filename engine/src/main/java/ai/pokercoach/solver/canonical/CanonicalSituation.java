package ai.pokercoach.solver.canonical;

import ai.pokercoach.game.Action;
import ai.pokercoach.game.Card;
import ai.pokercoach.game.Street;
import java.util.List;
import java.util.Objects;

/**
 * The situation as the solver sees it: board in canonical suits, the bucket
 * representative stack and the pot implied by the pot-ratio bucket.
 *
 * @param street the street
 * @param board canonical board in dealing order (flop sorted, then turn, then river)
 * @param pot canonical pot in big blinds
 * @param effectiveStack canonical effective stack in big blinds
 * @param relativePosition hero's position relative to the live opponents, e.g. {@code IP}
 * @param actionLine the non-fold actions so far, rounds separated by {@code /}, e.g. {@code r-c/x-b10}
 * @param streetActions the non-fold actions on the current street with canonical amounts,
 *        the path from the start of the street to the hero's decision
 */
public record CanonicalSituation(
        Street street,
        List<Card> board,
        double pot,
        double effectiveStack,
        String relativePosition,
        String actionLine,
        List<Action> streetActions) {

    public CanonicalSituation {
        Objects.requireNonNull(street, "street");
        board = List.copyOf(board);
        Objects.requireNonNull(relativePosition, "relativePosition");
        Objects.requireNonNull(actionLine, "actionLine");
        streetActions = List.copyOf(streetActions);
    }

    /** Board cards concatenated, e.g. "Ac7d2c", empty preflop. */
    public String boardText() {
        StringBuilder sb = new StringBuilder();
        for (Card card : board) {
            sb.append(card);
        }
        return sb.toString();
    }
}
