package ai.pokercoach.game;

import java.util.Optional;

/**
 * Betting streets, each with the number of board cards it shows.
 */
public enum Street {
    PREFLOP(0, "preflop"),
    FLOP(3, "flop"),
    TURN(4, "turn"),
    RIVER(5, "river");

    private final int boardSize;
    private final String solverName;

    Street(int boardSize, String solverName) {
        this.boardSize = boardSize;
        this.solverName = solverName;
    }

    public int getBoardSize() {
        return boardSize;
    }

    /**
     * Street name as written in solver bet-size commands ("flop", "turn", "river").
     */
    public String getSolverName() {
        return solverName;
    }

    /**
     * Resolves the street a board of {@code size} cards belongs to.
     *
     * @return the street, or empty for sizes 1, 2 and above 5
     */
    public static Optional<Street> forBoardSize(int size) {
        for (Street street : values()) {
            if (street.boardSize == size) {
                return Optional.of(street);
            }
        }
        return Optional.empty();
    }
}
