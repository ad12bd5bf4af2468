package ai.pokercoach.solver.canonical;

import ai.pokercoach.game.Card;
import ai.pokercoach.game.Hand;
import ai.pokercoach.game.Suit;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * A bijection from real suits to canonical suits.
 * <p>
 * The outbound solver query is written in canonical suits; the inbound strategy table
 * is translated back with {@link #toReal(Card)}. Instances are immutable and never
 * stored: they are re-derived from the caller's own situation and hand.
 */
public final class SuitMapping {
    private static final Suit[] SUITS = Suit.values();
    private static final SuitMapping IDENTITY = new SuitMapping(SUITS.clone());

    /** Indexed by real suit ordinal. */
    private final Suit[] realToCanonical;
    /** Indexed by canonical suit ordinal. */
    private final Suit[] canonicalToReal;

    private SuitMapping(Suit[] realToCanonical) {
        if (realToCanonical.length != SUITS.length) {
            throw new IllegalArgumentException("A suit mapping needs " + SUITS.length + " entries");
        }
        Set<Suit> seen = EnumSet.noneOf(Suit.class);
        this.canonicalToReal = new Suit[SUITS.length];
        for (int real = 0; real < realToCanonical.length; real++) {
            Suit canonical = realToCanonical[real];
            if (canonical == null || !seen.add(canonical)) {
                throw new IllegalArgumentException("Not a bijection: " + Arrays.toString(realToCanonical));
            }
            canonicalToReal[canonical.ordinal()] = SUITS[real];
        }
        this.realToCanonical = realToCanonical.clone();
    }

    /**
     * @param realToCanonical canonical suit for each real suit, indexed by real suit ordinal
     * @throws IllegalArgumentException if the array is not a permutation of the suits
     */
    public static SuitMapping of(Suit... realToCanonical) {
        return new SuitMapping(realToCanonical.clone());
    }

    public static SuitMapping identity() {
        return IDENTITY;
    }

    public Suit toCanonical(Suit real) {
        return realToCanonical[real.ordinal()];
    }

    public Suit toReal(Suit canonical) {
        return canonicalToReal[canonical.ordinal()];
    }

    public Card toCanonical(Card real) {
        return real.withSuit(toCanonical(real.getSuit()));
    }

    public Card toReal(Card canonical) {
        return canonical.withSuit(toReal(canonical.getSuit()));
    }

    public Hand toCanonical(Hand real) {
        return real.map(this::toCanonical);
    }

    public Hand toReal(Hand canonical) {
        return canonical.map(this::toReal);
    }

    public SuitMapping inverse() {
        return new SuitMapping(canonicalToReal);
    }

    public boolean isIdentity() {
        return Arrays.equals(realToCanonical, SUITS);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SuitMapping other)) {
            return false;
        }
        return Arrays.equals(realToCanonical, other.realToCanonical);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(realToCanonical);
    }

    /**
     * Returns the mapping as "c>d h>c ...", one real-to-canonical pair per suit.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Suit real : SUITS) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(real).append('>').append(toCanonical(real));
        }
        return sb.toString();
    }
}
