package ai.pokercoach.game;

import java.util.Objects;

/**
 * An action taken by the player in a given position, one step of a prior-action sequence.
 */
public record PlayerAction(Position actor, Action action) {

    public PlayerAction {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(action, "action");
    }

    /**
     * Parses "POSITION:action", e.g. "BTN:raise 2.5" or "BB:call".
     *
     * @throws IllegalArgumentException on malformed text
     */
    public static PlayerAction parse(String text) {
        int colon = text == null ? -1 : text.indexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("Expected POSITION:action but got: " + text);
        }
        return new PlayerAction(
                Position.fromLabel(text.substring(0, colon)),
                Action.parse(text.substring(colon + 1)));
    }

    public boolean isFold() {
        return action.type() == ActionType.FOLD;
    }

    @Override
    public String toString() {
        return actor.getLabel() + ":" + action;
    }
}
