package ai.pokercoach.game;

/**
 * Absolute table positions.
 * <p>
 * Each position knows its place in the preflop acting order (under the gun first,
 * big blind last) and in the postflop acting order (small blind first, button last).
 * Relative labels such as in-position / out-of-position are derived from these.
 */
public enum Position {
    UTG("UTG", 0, 2),
    UTG1("UTG+1", 1, 3),
    UTG2("UTG+2", 2, 4),
    MP("MP", 3, 5),
    MP1("MP+1", 4, 6),
    HJ("HJ", 5, 7),
    CO("CO", 6, 8),
    BTN("BTN", 7, 9),
    SB("SB", 8, 0),
    BB("BB", 9, 1);

    private final String label;
    private final int preflopOrder;
    private final int postflopOrder;

    Position(String label, int preflopOrder, int postflopOrder) {
        this.label = label;
        this.preflopOrder = preflopOrder;
        this.postflopOrder = postflopOrder;
    }

    public String getLabel() {
        return label;
    }

    public int getPreflopOrder() {
        return preflopOrder;
    }

    public int getPostflopOrder() {
        return postflopOrder;
    }

    /**
     * Number of seats that act after this one preflop.
     */
    public int seatsBehindPreflop() {
        return values().length - 1 - preflopOrder;
    }

    /**
     * Resolves a position from its label or enum name, case-insensitive ("UTG+1", "utg1", "btn").
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static Position fromLabel(String text) {
        if (text != null) {
            String trimmed = text.trim();
            for (Position position : values()) {
                if (position.label.equalsIgnoreCase(trimmed) || position.name().equalsIgnoreCase(trimmed)) {
                    return position;
                }
            }
        }
        throw new IllegalArgumentException("Unknown position: " + text);
    }

    @Override
    public String toString() {
        return label;
    }
}
