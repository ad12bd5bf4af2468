package ai.pokercoach.solver.canonical;

import ai.pokercoach.config.CanonicalProperties;
import ai.pokercoach.game.Action;
import ai.pokercoach.game.ActionType;
import ai.pokercoach.game.Card;
import ai.pokercoach.game.Hand;
import ai.pokercoach.game.PlayerAction;
import ai.pokercoach.game.Position;
import ai.pokercoach.game.Situation;
import ai.pokercoach.game.Suit;
import ai.pokercoach.solver.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a situation (and optionally a hand) to its canonical form.
 * <p>
 * Two requests that differ only by a consistent relabeling of suits, by the absolute
 * seat names behind the same relative position, or by stack and pot sizes inside the
 * same buckets produce the same {@link CanonicalKey}.
 * <p>
 * The suit mapping is the relabeling, among all 24, that yields the lexicographically
 * smallest encoding of the cards: the flop as a set, then turn, then river, then the
 * hand as a set. The first relabeling in enumeration order wins ties, so suits that do
 * not appear get the lowest remaining canonical suit in real-suit order. On boards
 * without repeated ranks this is the same as assigning canonical suits by first
 * occurrence. Taking the minimum also covers paired boards and pocket pairs, where a
 * first-occurrence scan depends on which of two equal-rank cards is seen first.
 * <p>
 * Stateless and thread-safe.
 */
@Component
public class Canonicalizer {
    private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);

    static final String KEY_VERSION = "v1";
    private static final String NO_ACTIONS = "_";
    private static final List<SuitMapping> RELABELINGS = allRelabelings();

    private final CanonicalProperties properties;

    public Canonicalizer(CanonicalProperties properties) {
        this.properties = properties;
    }

    /**
     * Canonicalizes a whole-table request.
     *
     * @throws ConfigurationException if the situation is structurally invalid
     */
    public CanonicalForm canonicalize(Situation situation) {
        return canonicalize(situation, null);
    }

    /**
     * Canonicalizes a request for one hand in a situation.
     *
     * @param situation the real situation
     * @param hand the real hand, or null for a whole-table request
     * @throws ConfigurationException if the situation is structurally invalid or the
     *         hand shares a card with the board
     */
    public CanonicalForm canonicalize(Situation situation, Hand hand) {
        validate(situation, hand);

        SuitMapping mapping = RELABELINGS.get(0);
        String best = null;
        for (SuitMapping candidate : RELABELINGS) {
            String encoding = encode(candidate, situation.getBoard(), hand);
            if (best == null || encoding.compareTo(best) < 0) {
                best = encoding;
                mapping = candidate;
            }
        }

        List<Card> board = canonicalBoard(mapping, situation.getBoard());
        double stackBucketSize = properties.getStackBucketSize();
        int potStep = properties.getPotRatioStepPercent();
        int stackBucket = (int) Math.floor(situation.getEffectiveStack() / stackBucketSize);
        double canonicalStack = (stackBucket + 0.5) * stackBucketSize;
        long potRatio = stackPercent(situation.getPot(), situation.getEffectiveStack(), potStep);
        double canonicalPot = potRatio / 100.0 * canonicalStack;

        String relativePosition = relativePosition(situation.getPosition(), situation.getActions());
        String actionLine = actionLine(situation.getRounds(), situation.getEffectiveStack(), potStep);
        List<Action> streetActions = streetActions(situation.getStreetActions(), situation.getEffectiveStack(),
                canonicalStack, potStep);
        CanonicalSituation canonical = new CanonicalSituation(situation.getStreet(), board, canonicalPot,
                canonicalStack, relativePosition, actionLine, streetActions);

        StringJoiner solutionKey = new StringJoiner("|")
                .add(KEY_VERSION)
                .add(situation.getStreet().name())
                .add(board.isEmpty() ? "-" : canonical.boardText())
                .add("S" + stackBucket)
                .add("P" + potRatio)
                .add(relativePosition)
                .add(actionLine);
        Hand canonicalHand = hand == null ? null : mapping.toCanonical(hand);
        CanonicalKey key = new CanonicalKey(solutionKey.toString(),
                canonicalHand == null ? "" : canonicalHand.toString());

        if (log.isDebugEnabled()) {
            log.debug("Canonicalized {} {} -> {} ({})", situation, hand == null ? "" : hand, key, mapping);
        }
        return new CanonicalForm(key, mapping, canonical, canonicalHand,
                situation.getEffectiveStack() / canonicalStack);
    }

    private void validate(Situation situation, Hand hand) {
        if (!(properties.getStackBucketSize() > 0)) {
            throw new ConfigurationException("canonical.stack-bucket-size",
                    "Stack bucket size must be positive but was " + properties.getStackBucketSize());
        }
        if (properties.getPotRatioStepPercent() <= 0) {
            throw new ConfigurationException("canonical.pot-ratio-step-percent",
                    "Pot ratio step must be positive but was " + properties.getPotRatioStepPercent());
        }
        List<Card> board = situation.getBoard();
        if (board.size() != situation.getStreet().getBoardSize()) {
            throw new ConfigurationException("board", situation.getStreet() + " needs "
                    + situation.getStreet().getBoardSize() + " board cards but got " + board.size());
        }
        Set<Card> seen = new HashSet<>();
        for (Card card : board) {
            if (!seen.add(card)) {
                throw new ConfigurationException("board", "Duplicate board card " + card);
            }
        }
        if (!(situation.getPot() > 0) || Double.isInfinite(situation.getPot())) {
            throw new ConfigurationException("pot", "Pot must be positive but was " + situation.getPot());
        }
        if (!(situation.getEffectiveStack() > 0) || Double.isInfinite(situation.getEffectiveStack())) {
            throw new ConfigurationException("effectiveStack",
                    "Effective stack must be positive but was " + situation.getEffectiveStack());
        }
        if (hand != null) {
            for (Card card : hand.cards()) {
                if (seen.contains(card)) {
                    throw new ConfigurationException("hand", "Hand " + hand + " shares " + card + " with the board");
                }
            }
        }
    }

    private static String encode(SuitMapping mapping, List<Card> board, Hand hand) {
        StringBuilder sb = new StringBuilder();
        for (Card card : canonicalBoard(mapping, board)) {
            sb.append(card);
        }
        sb.append('/');
        if (hand != null) {
            sb.append(mapping.toCanonical(hand));
        }
        return sb.toString();
    }

    /** Flop cards sorted (their dealing order carries no information), turn and river in place. */
    private static List<Card> canonicalBoard(SuitMapping mapping, List<Card> board) {
        List<Card> mapped = new ArrayList<>(board.size());
        for (Card card : board) {
            mapped.add(mapping.toCanonical(card));
        }
        if (mapped.size() >= 3) {
            Collections.sort(mapped.subList(0, 3));
        }
        return mapped;
    }

    /**
     * Hero's position relative to the opponents still in the hand: {@code OPEN<n>} when
     * nobody else has acted without folding (n players left to act preflop), {@code IP}
     * or {@code OOP} heads-up, {@code MW<i>of<n>} multiway where i is the hero's postflop
     * acting slot.
     */
    static String relativePosition(Position hero, List<PlayerAction> actions) {
        Map<Position, PlayerAction> lastByActor = new LinkedHashMap<>();
        for (PlayerAction action : actions) {
            if (action.actor() != hero) {
                lastByActor.put(action.actor(), action);
            }
        }
        List<Position> live = new ArrayList<>();
        for (PlayerAction last : lastByActor.values()) {
            if (!last.isFold()) {
                live.add(last.actor());
            }
        }
        if (live.isEmpty()) {
            return "OPEN" + hero.seatsBehindPreflop();
        }
        if (live.size() == 1) {
            return hero.getPostflopOrder() > live.get(0).getPostflopOrder() ? "IP" : "OOP";
        }
        live.add(hero);
        live.sort(Comparator.comparingInt(Position::getPostflopOrder));
        return "MW" + (live.indexOf(hero) + 1) + "of" + live.size();
    }

    /**
     * Non-fold actions per betting round, rounds joined by {@code /}, e.g. {@code r-c/x-b10}.
     * Bets and raises of the current round carry their size as a percentage of the effective
     * stack on the pot-ratio grid; sizes of earlier rounds are carried by the pot bucket.
     */
    static String actionLine(List<List<PlayerAction>> rounds, double effectiveStack, int step) {
        StringJoiner line = new StringJoiner("/");
        boolean any = false;
        for (int i = 0; i < rounds.size(); i++) {
            boolean current = i == rounds.size() - 1;
            StringJoiner round = new StringJoiner("-");
            for (PlayerAction action : rounds.get(i)) {
                if (action.isFold()) {
                    continue;
                }
                String letter = letter(action.action().type());
                if (current && action.action().type().isSized()) {
                    letter += stackPercent(action.action().amount(), effectiveStack, step);
                }
                round.add(letter);
                any = true;
            }
            line.add(round.toString());
        }
        return any || rounds.size() > 1 ? line.toString() : NO_ACTIONS;
    }

    /**
     * The current street's non-fold actions as the solver sees them: bet and raise sizes
     * snapped to the grid used in the key and expressed against the canonical stack.
     */
    static List<Action> streetActions(List<PlayerAction> street, double effectiveStack, double canonicalStack,
            int step) {
        List<Action> path = new ArrayList<>(street.size());
        for (PlayerAction action : street) {
            Action taken = action.action();
            switch (taken.type()) {
                case FOLD -> {
                }
                case BET, RAISE -> path.add(new Action(taken.type(),
                        stackPercent(taken.amount(), effectiveStack, step) / 100.0 * canonicalStack));
                case ALL_IN -> path.add(Action.allIn());
                default -> path.add(taken);
            }
        }
        return path;
    }

    /** {@code amount} as a percentage of {@code stack}, rounded to the step grid and at least one step. */
    private static long stackPercent(double amount, double stack, int step) {
        return Math.max(step, Math.round(amount * 100.0 / stack / step) * step);
    }

    private static String letter(ActionType type) {
        return switch (type) {
            case CHECK -> "x";
            case CALL -> "c";
            case BET -> "b";
            case RAISE -> "r";
            case ALL_IN -> "a";
            case FOLD -> throw new IllegalStateException("folds are filtered");
        };
    }

    /** All 24 suit relabelings, identity first, in lexicographic order of their images. */
    private static List<SuitMapping> allRelabelings() {
        List<SuitMapping> result = new ArrayList<>(24);
        permute(new Suit[Suit.values().length], 0, EnumSet.noneOf(Suit.class), result);
        return Collections.unmodifiableList(result);
    }

    private static void permute(Suit[] image, int index, Set<Suit> used, List<SuitMapping> out) {
        if (index == image.length) {
            out.add(SuitMapping.of(image));
            return;
        }
        for (Suit suit : Suit.values()) {
            if (used.add(suit)) {
                image[index] = suit;
                permute(image, index + 1, used, out);
                used.remove(suit);
            }
        }
    }
}
