package com.example.s3explorer.naming;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitNameParserTest {
    @Test
    void parsesWellFormedName() {
        CircuitName name = CircuitNameParser.parse("202508-028-S-KHI-R-UW-00152");

        assertTrue(name.isRecognized());
        assertEquals(new CircuitName("202508", "028", "S", "KHI", "R-UW", "00152"), name);
        assertEquals("Aug 2025", name.groupKey(CircuitDimension.YEAR_MONTH));
        assertEquals("R-UW", name.groupKey(CircuitDimension.TYPE));
    }

    @Test
    void uppercasesTypeOfLowercaseName() {
        CircuitName name = CircuitNameParser.parse("202508-028-s-khi-r-uw-00152");
        assertEquals("R-UW", name.type());
    }

    @Test
    void fallsBackToDashSplitForUnknownShapes() {
        CircuitName name = CircuitNameParser.parse("2025-01-X-PRJ-foo-77");

        assertFalse(name.isRecognized());
        assertEquals("", name.yearMonth());
        assertEquals("01", name.batch());
        assertEquals("X", name.letter());
        assertEquals("PRJ", name.project());
        assertEquals("77", name.serial());
        assertEquals(CircuitName.OTHER, name.groupKey(CircuitDimension.YEAR_MONTH));
    }

    @Test
    void plainFileNameIsTypedOther() {
        CircuitName name = CircuitNameParser.parse("random-name.txt");

        assertEquals(CircuitName.OTHER, name.type());
        assertEquals("", name.yearMonth());
        assertEquals("name.txt", name.batch());
        assertEquals("", name.letter());
        assertEquals("", name.project());
        assertEquals("", name.serial());
    }

    @Test
    void neverFailsOnEmptyInput() {
        CircuitName name = CircuitNameParser.parse(null);
        assertEquals(CircuitName.OTHER, name.type());
        assertEquals(CircuitName.OTHER, name.groupKey(CircuitDimension.BATCH));
    }

    @Test
    void formatsYearMonth() {
        assertEquals("May 2025", CircuitNameParser.formatYearMonth("202505"));
        assertEquals("202513", CircuitNameParser.formatYearMonth("202513"));
        assertEquals("abc", CircuitNameParser.formatYearMonth("abc"));
    }
}
