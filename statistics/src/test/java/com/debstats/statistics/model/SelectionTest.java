package com.debstats.statistics.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link Selection} parsing and limits.
 */
class SelectionTest {

    @Test
    @DisplayName("'all' and '0' both select every package")
    void parseAll() {
        assertSame(Selection.all(), Selection.parse("all"));
        assertSame(Selection.all(), Selection.parse("ALL"));
        assertSame(Selection.all(), Selection.parse("0"));
    }

    @Test
    @DisplayName("Positive integer selects the top n")
    void parseTop() {
        assertEquals(Selection.top(15), Selection.parse("15"));
        assertEquals(new Selection.Top(3), Selection.parse(" 3 "));
    }

    @Test
    @DisplayName("Negative count is rejected")
    void parseNegative_throws() {
        InvalidSelectionException ex = assertThrows(InvalidSelectionException.class,
                () -> Selection.parse("-4"));

        assertTrue(ex.getMessage().contains("-4"));
    }

    @Test
    @DisplayName("Non-numeric count is rejected")
    void parseNonNumeric_throws() {
        InvalidSelectionException ex = assertThrows(InvalidSelectionException.class,
                () -> Selection.parse("lots"));

        assertInstanceOf(NumberFormatException.class, ex.getCause());
    }

    @Test
    @DisplayName("Blank count is rejected")
    void parseBlank_throws() {
        assertThrows(InvalidSelectionException.class, () -> Selection.parse(" "));
    }

    @Test
    @DisplayName("Top requires a positive limit")
    void topRequiresPositive() {
        assertThrows(InvalidSelectionException.class, () -> Selection.top(0));
        assertThrows(InvalidSelectionException.class, () -> Selection.top(-1));
    }

    @Test
    @DisplayName("limit caps at the number of available packages")
    void limits() {
        assertEquals(5, Selection.top(5).limit(10));
        assertEquals(2, Selection.top(5).limit(2));
        assertEquals(10, Selection.all().limit(10));
        assertEquals(0, Selection.all().limit(0));
    }
}
