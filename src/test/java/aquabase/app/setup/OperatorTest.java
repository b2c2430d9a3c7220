package aquabase.app.setup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import aquabase.app.error.ValidationException;

class OperatorTest {

    @ParameterizedTest
    @CsvSource({
        "<, 19.9, 20, true",
        "<, 20, 20, false",
        "<=, 20, 20, true",
        "<=, 20.1, 20, false",
        ">, 90.5, 90, true",
        ">, 90, 90, false",
        ">=, 90, 90, true",
        ">=, 89, 90, false",
        "==, 50, 50.0, true",
        "===, 50, 50, true",
        "==, 50.5, 50, false"
    })
    void testComparisons(String symbol, double level, double threshold, boolean expected) {
        assertEquals(expected, Operator.fromSymbol(symbol).apply(level, threshold));
    }

    @Test
    void testStrictEqualityReadsAsLooseEquality() {
        assertEquals(Operator.EQ, Operator.fromSymbol("==="));
        assertEquals("==", Operator.EQ.getSymbol());
    }

    @Test
    void testBlankSymbolIsUnset() {
        assertNull(Operator.fromSymbol(null));
        assertNull(Operator.fromSymbol(" "));
    }

    @Test
    void testUnknownSymbolRejected() {
        final ValidationException e = assertThrows(ValidationException.class, () -> Operator.fromSymbol("!="));
        assertEquals("Invalid operator '!='. Must be one of <, <=, >, >=, ==, ===", e.getMessage());
    }
}
