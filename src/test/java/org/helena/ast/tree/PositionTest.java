package org.helena.ast.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PositionTest {

    @Test
    void start_isFirstLineFirstCharacter() {
        assertEquals(1, Position.START.column());
        assertEquals(0, Position.START.row());
        assertEquals("1:0", Position.START.toString());
    }

    // === Row ===

    @Test
    void next_advancesRowByConsumedLength() {
        assertEquals(Position.at(1, 4), Position.START.next("func"));
        assertEquals(Position.at(1, 5), Position.at(1, 4).next(" "));
    }

    @Test
    void next_capsRowAtLimit() {
        assertEquals(Position.at(1, 100), Position.at(1, 98).next("abcd"));
        assertEquals(Position.at(1, 100), Position.at(1, 100).next("x"));
        assertEquals(Position.at(1, Position.ROW_LIMIT), Position.START.next("x".repeat(500)));
    }

    // === Column ===

    @Test
    void next_keepsColumnWhenTextIsConsumed() {
        assertEquals(1, Position.START.next("\n").column());
        assertEquals(7, Position.at(7, 99).next("abc").column());
    }

    @Test
    void next_advancesColumnOnlyWhenNextRowIsZero() {
        assertEquals(Position.at(2, 0), Position.START.next(""));
        assertEquals(Position.at(1, 3), Position.at(1, 3).next(""));
    }

    @Test
    void next_neverAdvancesColumnZero() {
        assertEquals(Position.at(0, 0), Position.at(0, 0).next(""));
    }

    @Test
    void negativeCoordinates_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> Position.at(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> Position.at(1, -1));
    }
}
