package ai.pokercoach.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Represents a single playing card with a {@link Rank} and a {@link Suit}.
 * <p>
 * Each card is immutable and uniquely identified by its rank and suit combination.
 * The text form is rank label followed by suit code (e.g., "Ah", "Td"), the notation
 * used by hand histories and by the external solver.
 */
public final class Card implements Comparable<Card> {
    /** The rank (deuce through ace) of this card. */
    private final Rank rank;
    /** The suit (clubs, diamonds, hearts, spades) of this card. */
    private final Suit suit;

    /**
     * Constructs a Card with the given rank and suit.
     *
     * @param rank the rank of the card (must not be null)
     * @param suit the suit of the card (must not be null)
     * @throws NullPointerException if rank or suit is null
     */
    public Card(Rank rank, Suit suit) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
    }

    /**
     * Parses a card from its two-character text form.
     *
     * @param text a card such as "As" or "td"
     * @return the parsed card
     * @throws IllegalArgumentException if the text is not a valid card
     */
    public static Card parse(String text) {
        if (text == null || text.trim().length() != 2) {
            throw new IllegalArgumentException("Invalid card string: " + text);
        }
        String trimmed = text.trim();
        return new Card(Rank.fromLabel(trimmed.charAt(0)), Suit.fromCode(trimmed.charAt(1)));
    }

    /**
     * Parses a run of concatenated or separated cards, e.g. "AhKd2c", "Ah Kd 2c" or "Ah,Kd,2c".
     *
     * @param text the card run; blank yields an empty list
     * @return the cards in the order given
     * @throws IllegalArgumentException if any card is invalid
     */
    public static List<Card> parseAll(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        String compact = text.replaceAll("[\\s,]", "");
        if (compact.length() % 2 != 0) {
            throw new IllegalArgumentException("Invalid card run: " + text);
        }
        List<Card> cards = new ArrayList<>(compact.length() / 2);
        for (int i = 0; i < compact.length(); i += 2) {
            cards.add(parse(compact.substring(i, i + 2)));
        }
        return cards;
    }

    public Rank getRank() {
        return rank;
    }

    public Suit getSuit() {
        return suit;
    }

    /**
     * Returns a copy of this card with its suit replaced.
     *
     * @param newSuit the suit to use
     * @return a card of the same rank in {@code newSuit}
     */
    public Card withSuit(Suit newSuit) {
        return newSuit == suit ? this : new Card(rank, newSuit);
    }

    /**
     * Orders cards by rank descending, then by suit in canonical order.
     */
    @Override
    public int compareTo(Card other) {
        int byRank = Integer.compare(other.rank.getValue(), rank.getValue());
        if (byRank != 0) {
            return byRank;
        }
        return Integer.compare(suit.ordinal(), other.suit.ordinal());
    }

    /**
     * Returns the solver text form, e.g. "Ah".
     */
    @Override
    public String toString() {
        return rank.toString() + suit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return rank == card.rank && suit == card.suit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit);
    }
}
