package ai.pokercoach.game;

import java.util.Locale;

/**
 * Kinds of poker actions. Bets and raises carry a size; all-in may carry one.
 */
public enum ActionType {
    FOLD("fold", false),
    CHECK("check", false),
    CALL("call", false),
    BET("bet", true),
    RAISE("raise", true),
    ALL_IN("allin", false);

    private final String label;
    private final boolean sized;

    ActionType(String label, boolean sized) {
        this.label = label;
        this.sized = sized;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether actions of this type must state an amount.
     */
    public boolean isSized() {
        return sized;
    }

    /**
     * Resolves a type from its label, accepting "all-in" and "all_in" for {@link #ALL_IN}.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static ActionType fromLabel(String text) {
        String normalised = text == null ? "" : text.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (ActionType type : values()) {
            if (type.label.equals(normalised)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action type: " + text);
    }
}
