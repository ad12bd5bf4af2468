package ai.pokercoach.game;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A player's two hole cards.
 * <p>
 * Cards are stored high card first (rank descending, then suit order c&lt;d&lt;h&lt;s), so
 * "KdAh" and "AhKd" denote the same hand and print as "AhKd". This is the form
 * used as the key of a per-hand strategy table.
 */
public final class Hand {
    private final Card high;
    private final Card low;

    /**
     * Creates a hand from two distinct cards in any order.
     *
     * @throws IllegalArgumentException if both cards are the same
     */
    public Hand(Card first, Card second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.equals(second)) {
            throw new IllegalArgumentException("Hand cards must be distinct: " + first + first);
        }
        if (first.compareTo(second) <= 0) {
            this.high = first;
            this.low = second;
        } else {
            this.high = second;
            this.low = first;
        }
    }

    /**
     * Parses a hand such as "AhKd" or "Ah Kd".
     *
     * @throws IllegalArgumentException if the text is not exactly two distinct cards
     */
    public static Hand parse(String text) {
        List<Card> cards = Card.parseAll(text);
        if (cards.size() != 2) {
            throw new IllegalArgumentException("Invalid hand string: " + text);
        }
        return new Hand(cards.get(0), cards.get(1));
    }

    public Card getHigh() {
        return high;
    }

    public Card getLow() {
        return low;
    }

    public List<Card> cards() {
        return List.of(high, low);
    }

    public boolean isSuited() {
        return high.getSuit() == low.getSuit();
    }

    public boolean isPair() {
        return high.getRank() == low.getRank();
    }

    public boolean contains(Card card) {
        return high.equals(card) || low.equals(card);
    }

    /**
     * Returns the hand obtained by applying {@code mapping} to both cards.
     */
    public Hand map(UnaryOperator<Card> mapping) {
        return new Hand(mapping.apply(high), mapping.apply(low));
    }

    @Override
    public String toString() {
        return high.toString() + low;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Hand other)) {
            return false;
        }
        return high.equals(other.high) && low.equals(other.low);
    }

    @Override
    public int hashCode() {
        return Objects.hash(high, low);
    }
}
