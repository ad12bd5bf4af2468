package ai.pokercoach.game;

/**
 * Enumeration representing the 13 ranks of a standard playing card deck, deuce low.
 * <p>
 * Each rank has a numeric value (2–14, ace high) for ordering and a single-character
 * label as used by poker text formats ("T" for ten).
 */
public enum Rank {
    TWO(2, '2'),
    THREE(3, '3'),
    FOUR(4, '4'),
    FIVE(5, '5'),
    SIX(6, '6'),
    SEVEN(7, '7'),
    EIGHT(8, '8'),
    NINE(9, '9'),
    TEN(10, 'T'),
    JACK(11, 'J'),
    QUEEN(12, 'Q'),
    KING(13, 'K'),
    ACE(14, 'A');

    /** Numeric value of the rank, used for ordering (2–14). */
    private final int value;
    /** Single-character label (e.g., 'A', 'T', '7'). */
    private final char label;

    Rank(int value, char label) {
        this.value = value;
        this.label = label;
    }

    /**
     * Returns the numeric value of this rank.
     *
     * @return the rank value (2 for a deuce, 14 for an ace)
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the single-character label of this rank.
     *
     * @return the label (e.g., 'A', 'T')
     */
    public char getLabel() {
        return label;
    }

    /**
     * Resolves a rank from its label (case-insensitive).
     *
     * @param label a label such as 'A', 't' or '9'
     * @return the matching rank
     * @throws IllegalArgumentException if the label names no rank
     */
    public static Rank fromLabel(char label) {
        char upper = Character.toUpperCase(label);
        for (Rank rank : values()) {
            if (rank.label == upper) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Unknown rank: " + label);
    }

    @Override
    public String toString() {
        return String.valueOf(label);
    }
}
