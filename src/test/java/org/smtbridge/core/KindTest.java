package org.smtbridge.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KindTest {

    @Test
    @DisplayName("结构相等")
    void testStructuralEquality() {
        assertAll(
                () -> assertEquals(Kind.unsigned(8), Kind.bounded(false, 8)),
                () -> assertNotEquals(Kind.unsigned(8), Kind.signed(8)),
                () -> assertEquals(Kind.userSort("C", List.of("a", "b")), Kind.userSort("C", List.of("a", "b"))),
                () -> assertNotEquals(Kind.userSort("C", List.of("a", "b")), Kind.userSort("C")),
                () -> assertEquals(Kind.unsigned(8).hashCode(), Kind.bounded(false, 8).hashCode())
        );
    }

    @Test
    @DisplayName("SMT-LIB 排序与显示名")
    void testRendering() {
        assertAll(
                () -> assertEquals("(_ BitVec 16)", Kind.signed(16).toSmtLib()),
                () -> assertEquals("Int", Kind.UNBOUNDED.toSmtLib()),
                () -> assertEquals("(_ FloatingPoint 11 53)", Kind.DOUBLE.toSmtLib()),
                () -> assertEquals("SWord8", Kind.unsigned(8).toString()),
                () -> assertEquals("SInt32", Kind.signed(32).toString())
        );
    }

    @Test
    @DisplayName("非正的位宽非法")
    void testInvalidWidth() {
        assertThrows(IllegalArgumentException.class, () -> Kind.unsigned(0));
    }

    @Test
    @DisplayName("保留的布尔引用")
    void testReservedRefs() {
        assertSame(SymRef.TRUE_REF, SymRef.of(-1, Kind.BOOL));
        assertSame(SymRef.FALSE_REF, SymRef.of(-2, Kind.BOOL));
        assertEquals("s7", SymRef.of(7, Kind.UNBOUNDED).getName());
    }
}
