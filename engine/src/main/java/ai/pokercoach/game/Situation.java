package ai.pokercoach.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Immutable description of a poker decision point: street, board, pot, effective
 * stack (both in big blinds), the hero's position and the actions taken so far.
 * <p>
 * The actions are grouped into betting rounds. {@link Builder#newStreet()} closes the
 * round being recorded, so the last round holds the actions taken on the current street
 * before the hero's decision. A history recorded without any break is read as a single
 * round on the current street. The pot is the pot at the start of the current street;
 * bets made on the current street are carried by the actions.
 *
 * <p>This is a plain value; structural validity (board size for the street, distinct
 * cards, positive pot and stack) is checked where the situation is canonicalized, so
 * that invalid input surfaces as a typed error there instead of at construction.
 * Use {@link #builder()} to create instances.
 */
public final class Situation {
    private final Street street;
    private final List<Card> board;
    private final double pot;
    private final double effectiveStack;
    private final Position position;
    private final List<PlayerAction> actions;
    private final List<Integer> streetBreaks;

    private Situation(Builder builder) {
        this.street = Objects.requireNonNull(builder.street, "street");
        this.board = Collections.unmodifiableList(new ArrayList<>(builder.board));
        this.pot = builder.pot;
        this.effectiveStack = builder.effectiveStack;
        this.position = Objects.requireNonNull(builder.position, "position");
        this.actions = Collections.unmodifiableList(new ArrayList<>(builder.actions));
        this.streetBreaks = Collections.unmodifiableList(new ArrayList<>(builder.streetBreaks));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Street getStreet() {
        return street;
    }

    /** Board cards in dealing order: three flop cards, then turn, then river. */
    public List<Card> getBoard() {
        return board;
    }

    public double getPot() {
        return pot;
    }

    public double getEffectiveStack() {
        return effectiveStack;
    }

    /** The hero's position. */
    public Position getPosition() {
        return position;
    }

    /** All actions of the hand so far, in order, across betting rounds. */
    public List<PlayerAction> getActions() {
        return actions;
    }

    /**
     * The actions split into betting rounds, oldest first. Never empty: a hand with no
     * actions has one empty round.
     */
    public List<List<PlayerAction>> getRounds() {
        List<List<PlayerAction>> rounds = new ArrayList<>(streetBreaks.size() + 1);
        int start = 0;
        for (int end : streetBreaks) {
            rounds.add(actions.subList(start, end));
            start = end;
        }
        rounds.add(actions.subList(start, actions.size()));
        return Collections.unmodifiableList(rounds);
    }

    /** The actions taken on the current street before the hero's decision. */
    public List<PlayerAction> getStreetActions() {
        return streetBreaks.isEmpty()
                ? actions
                : actions.subList(streetBreaks.get(streetBreaks.size() - 1), actions.size());
    }

    /**
     * Returns a builder pre-filled with this situation's values.
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .street(street)
                .board(board)
                .pot(pot)
                .effectiveStack(effectiveStack)
                .position(position)
                .actions(actions);
        builder.streetBreaks.addAll(streetBreaks);
        return builder;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(street).append(' ');
        for (Card card : board) {
            sb.append(card);
        }
        sb.append(board.isEmpty() ? "" : " ")
                .append("pot=").append(pot)
                .append(" stack=").append(effectiveStack)
                .append(" pos=").append(position);
        if (!actions.isEmpty()) {
            StringJoiner rounds = new StringJoiner(" / ", " actions=[", "]");
            for (List<PlayerAction> round : getRounds()) {
                StringJoiner line = new StringJoiner(", ");
                round.forEach(action -> line.add(action.toString()));
                rounds.add(line.toString());
            }
            sb.append(rounds);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Situation other)) {
            return false;
        }
        return street == other.street
                && Double.compare(pot, other.pot) == 0
                && Double.compare(effectiveStack, other.effectiveStack) == 0
                && position == other.position
                && board.equals(other.board)
                && actions.equals(other.actions)
                && streetBreaks.equals(other.streetBreaks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(street, board, pot, effectiveStack, position, actions, streetBreaks);
    }

    /**
     * Fluent builder. When no street is given, it is derived from the board size.
     */
    public static final class Builder {
        private Street street;
        private final List<Card> board = new ArrayList<>();
        private double pot;
        private double effectiveStack;
        private Position position;
        private final List<PlayerAction> actions = new ArrayList<>();
        private final List<Integer> streetBreaks = new ArrayList<>();

        private Builder() {
        }

        public Builder street(Street street) {
            this.street = street;
            return this;
        }

        public Builder board(List<Card> cards) {
            this.board.clear();
            this.board.addAll(cards);
            return this;
        }

        /** Board in text form, e.g. "AhKd2c" or "Ah Kd 2c Js". */
        public Builder board(String cards) {
            return board(Card.parseAll(cards));
        }

        public Builder pot(double pot) {
            this.pot = pot;
            return this;
        }

        public Builder effectiveStack(double effectiveStack) {
            this.effectiveStack = effectiveStack;
            return this;
        }

        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        public Builder action(Position actor, Action action) {
            this.actions.add(new PlayerAction(actor, action));
            return this;
        }

        /** Replaces the history with {@code actions} as one betting round. */
        public Builder actions(List<PlayerAction> actions) {
            this.actions.clear();
            this.actions.addAll(actions);
            this.streetBreaks.clear();
            return this;
        }

        /** Ends the betting round recorded so far; later actions belong to the next street. */
        public Builder newStreet() {
            this.streetBreaks.add(actions.size());
            return this;
        }

        /**
         * @throws IllegalArgumentException if no street was given and the board size
         *         matches none
         */
        public Situation build() {
            if (street == null) {
                street = Street.forBoardSize(board.size())
                        .orElseThrow(() -> new IllegalArgumentException(
                                "No street has a board of " + board.size() + " cards"));
            }
            return new Situation(this);
        }
    }
}
