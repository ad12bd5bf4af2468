package ai.pokercoach.solver.canonical;

import ai.pokercoach.game.Hand;
import ai.pokercoach.solver.Solution;
import ai.pokercoach.solver.Strategy;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of canonicalizing one caller's request: the key, the suit mapping that
 * produced it, the canonical situation to solve, the canonical hand (if any) and the
 * factor that converts canonical amounts back to the caller's stack depth.
 */
public final class CanonicalForm {
    private final CanonicalKey key;
    private final SuitMapping mapping;
    private final CanonicalSituation situation;
    private final Hand hand;
    private final double amountScale;

    public CanonicalForm(CanonicalKey key, SuitMapping mapping, CanonicalSituation situation, Hand hand,
            double amountScale) {
        this.key = Objects.requireNonNull(key, "key");
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        this.situation = Objects.requireNonNull(situation, "situation");
        this.hand = hand;
        if (!(amountScale > 0) || Double.isInfinite(amountScale)) {
            throw new IllegalArgumentException("Amount scale must be positive but was " + amountScale);
        }
        this.amountScale = amountScale;
    }

    public CanonicalKey getKey() {
        return key;
    }

    public SuitMapping getMapping() {
        return mapping;
    }

    public CanonicalSituation getSituation() {
        return situation;
    }

    /** The queried hand in canonical suits, empty for whole-table requests. */
    public Optional<Hand> getHand() {
        return Optional.ofNullable(hand);
    }

    /** Real effective stack over canonical effective stack. */
    public double getAmountScale() {
        return amountScale;
    }

    /**
     * Translates a canonical-form solution to the caller's real suits and stack depth.
     */
    public Solution toReal(Solution canonical) {
        return canonical.relabel(mapping::toReal, amountScale);
    }

    public Strategy toReal(Strategy canonical) {
        return canonical.relabel(mapping::toReal, amountScale);
    }

    @Override
    public String toString() {
        return key + " [" + mapping + ", scale=" + amountScale + "]";
    }
}
