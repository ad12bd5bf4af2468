package ai.pokercoach.game;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * An available or taken action: a type and, for bets and raises, an amount in big blinds.
 *
 * <p>Text form is the lowercase type label, followed by the amount when non-zero:
 * {@code fold}, {@code check}, {@code bet 2.5}, {@code raise 9}, {@code allin}.
 * {@link #parse(String)} also accepts the solver's uppercase form such as {@code BET 2.500000}.
 */
public record Action(ActionType type, double amount) {
    /** Decimal places kept when an amount is rescaled. */
    public static final int AMOUNT_PRECISION = 6;

    public Action {
        Objects.requireNonNull(type, "type");
        if (Double.isNaN(amount) || amount < 0) {
            throw new IllegalArgumentException("Invalid action amount " + amount + " for " + type);
        }
        if (type.isSized() && amount == 0) {
            throw new IllegalArgumentException(type.getLabel() + " requires a positive amount");
        }
    }

    public static Action fold() {
        return new Action(ActionType.FOLD, 0);
    }

    public static Action check() {
        return new Action(ActionType.CHECK, 0);
    }

    public static Action call() {
        return new Action(ActionType.CALL, 0);
    }

    public static Action bet(double amount) {
        return new Action(ActionType.BET, amount);
    }

    public static Action raise(double amount) {
        return new Action(ActionType.RAISE, amount);
    }

    public static Action allIn() {
        return new Action(ActionType.ALL_IN, 0);
    }

    /**
     * Parses the text form, e.g. "bet 2.5", "CHECK", "RAISE 6.000000".
     *
     * @throws IllegalArgumentException on an unknown type or malformed amount
     */
    public static Action parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Blank action");
        }
        String[] parts = text.trim().split("\\s+");
        if (parts.length > 2) {
            throw new IllegalArgumentException("Invalid action: " + text);
        }
        ActionType type = ActionType.fromLabel(parts[0]);
        double amount = 0;
        if (parts.length == 2) {
            try {
                amount = Double.parseDouble(parts[1]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid action amount: " + text, e);
            }
        }
        return new Action(type, amount);
    }

    /**
     * Returns this action with its amount multiplied by {@code factor}, rounded to
     * {@link #AMOUNT_PRECISION} decimal places.
     *
     * @throws IllegalArgumentException if a sized amount scales down to nothing
     */
    public Action scaled(double factor) {
        if (amount == 0 || factor == 1.0) {
            return this;
        }
        double scaled = BigDecimal.valueOf(amount * factor).setScale(AMOUNT_PRECISION, RoundingMode.HALF_UP)
                .doubleValue();
        return new Action(type, scaled);
    }

    public String label() {
        if (amount == 0) {
            return type.getLabel();
        }
        String size = BigDecimal.valueOf(amount).stripTrailingZeros().toPlainString();
        return type.getLabel() + " " + size;
    }

    @Override
    public String toString() {
        return label();
    }
}
