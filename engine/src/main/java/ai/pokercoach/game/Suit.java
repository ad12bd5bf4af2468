package ai.pokercoach.game;

/**
 * Enumeration representing the four suits of a standard playing card deck.
 * <p>
 * Each suit carries the single-letter code used by hand-history and solver text
 * formats ("c", "d", "h", "s"). The declaration order (clubs, diamonds, hearts,
 * spades) is the canonical suit order: canonical suit index {@code i} is
 * {@code values()[i]}.
 */
public enum Suit {
    /** Clubs, code {@code c}. */
    CLUBS('c'),
    /** Diamonds, code {@code d}. */
    DIAMONDS('d'),
    /** Hearts, code {@code h}. */
    HEARTS('h'),
    /** Spades, code {@code s}. */
    SPADES('s');

    private final char code;

    Suit(char code) {
        this.code = code;
    }

    /**
     * Returns the single-letter code of this suit.
     *
     * @return the suit code (e.g., 'c', 'h')
     */
    public char getCode() {
        return code;
    }

    /**
     * Resolves a suit from its letter code, case-insensitive.
     *
     * @param symbol a code such as 'h' or 'H'
     * @return the matching suit
     * @throws IllegalArgumentException if the symbol names no suit
     */
    public static Suit fromCode(char symbol) {
        char lower = Character.toLowerCase(symbol);
        for (Suit suit : values()) {
            if (suit.code == lower) {
                return suit;
            }
        }
        throw new IllegalArgumentException("Unknown suit: " + symbol);
    }

    /**
     * Returns the letter code as a string, the form used in solver text.
     *
     * @return the suit code
     */
    @Override
    public String toString() {
        return String.valueOf(code);
    }
}
