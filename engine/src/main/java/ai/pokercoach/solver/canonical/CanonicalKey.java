package ai.pokercoach.solver.canonical;

import java.util.Objects;

/**
 * Deterministic identifier of a canonical situation, optionally narrowed to one hand.
 * <p>
 * The situation part addresses the solution cache: every hand dealt into the same
 * canonical situation shares one solve and one entry. The hand part, when present,
 * names the canonical hand being queried.
 *
 * @param solutionKey the situation part, e.g. {@code v1|FLOP|Ac7d2c|S4|P10|IP|r-c}
 * @param handKey the canonical hand, e.g. {@code AhKc}, or empty for a whole-table query
 */
public record CanonicalKey(String solutionKey, String handKey) {

    public CanonicalKey {
        Objects.requireNonNull(solutionKey, "solutionKey");
        Objects.requireNonNull(handKey, "handKey");
    }

    public static CanonicalKey forSituation(String solutionKey) {
        return new CanonicalKey(solutionKey, "");
    }

    public boolean hasHand() {
        return !handKey.isEmpty();
    }

    /**
     * The full key: the situation part, then {@code |H=} and the hand when one is present.
     */
    public String value() {
        return hasHand() ? solutionKey + "|H=" + handKey : solutionKey;
    }

    @Override
    public String toString() {
        return value();
    }
}
