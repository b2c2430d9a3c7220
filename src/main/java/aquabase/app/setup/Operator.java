package aquabase.app.setup;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import aquabase.app.error.ValidationException;

/**
 * Comparison applied between a tank level and a threshold.
 */
public enum Operator {
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    EQ("==");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    /**
     * Lower-bound operators compare against the configured minimum.
     */
    public boolean isLowerBound() {
        return this == LT || this == LTE;
    }

    public boolean apply(double level, double threshold) {
        final int cmp = Double.compare(level, threshold);
        switch (this) {
            case LT:
                return cmp < 0;
            case LTE:
                return cmp <= 0;
            case GT:
                return cmp > 0;
            case GTE:
                return cmp >= 0;
            case EQ:
                return cmp == 0;
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    /**
     * @return the operator for a symbol, with {@code ===} read as {@code ==}; null
     *         when blank
     * @throws ValidationException for any other symbol
     */
    @JsonCreator
    public static Operator fromSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return null;
        }
        final String trimmed = symbol.trim();
        if ("===".equals(trimmed)) {
            return EQ;
        }
        for (Operator operator : values()) {
            if (operator.symbol.equals(trimmed)) {
                return operator;
            }
        }
        throw new ValidationException(String.format("Invalid operator '%s'. Must be one of <, <=, >, >=, ==, ===", symbol));
    }
}
