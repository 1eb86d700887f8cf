package io.github.eutro.relift.test;

import io.github.eutro.relift.core.types.Type;
import io.github.eutro.relift.core.types.Types;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class TypesTest {
    @Test
    void testUnknownIsNeutral() {
        assertEquals(Type.signed(32), Types.refine(Type.UNKNOWN, Type.signed(32)));
        assertEquals(Type.signed(32), Types.refine(Type.signed(32), Type.UNKNOWN));
        assertEquals(Type.UNKNOWN, Types.refine(Type.UNKNOWN, Type.UNKNOWN));
    }

    @Test
    void testSignedness() {
        assertEquals(Type.signed(64), Types.refine(Type.signed(64), Type.signed(64)));
        assertEquals(Type.genericInt(64), Types.refine(Type.signed(64), Type.unsigned(64)));
        assertEquals(Type.signed(64), Types.refine(Type.genericInt(64), Type.signed(64)));
        assertEquals(Type.signed(64), Types.refine(Type.signed(64), Type.genericInt(64)));
        assertEquals(Type.unsigned(32), Types.refine(Type.genericInt(32), Type.unsigned(32)));
        assertEquals(Type.unsigned(32), Types.refine(Type.unsigned(32), Type.genericInt(32)));
        assertTrue(Types.conflicts(Type.signed(32), Type.signed(64)));
    }

    @Test
    void testPointerRefinesInteger() {
        Type ptr = Type.pointerTo(Type.UNKNOWN);
        assertEquals(ptr, Types.refine(Type.genericInt(64), ptr));
        assertEquals(ptr, Types.refine(ptr, Type.unsigned(64)));
        assertTrue(Types.conflicts(ptr, Type.genericInt(32)));
        assertEquals(Type.BOOL, Types.refine(Type.genericInt(8), Type.BOOL));
        assertTrue(Types.conflicts(Type.BOOL, Type.genericInt(32)));
    }

    @Test
    void testPointerTargets() {
        Type toInt = Type.pointerTo(Type.signed(32));
        assertEquals(toInt, Types.refine(Type.pointerTo(Type.UNKNOWN), toInt));
        assertEquals(Type.pointerTo(Type.UNKNOWN), Types.refine(toInt, Type.pointerTo(Type.floatOf(64))));
        assertTrue(Types.conflicts(toInt, Type.floatOf(64)));
    }

    @Test
    void testArrays() {
        Type a = Type.arrayOf(Type.UNKNOWN, 4);
        assertEquals(Type.arrayOf(Type.BOOL, 4), Types.refine(a, Type.arrayOf(Type.BOOL, 4)));
        assertTrue(Types.conflicts(a, Type.arrayOf(Type.BOOL, 5)));
        assertTrue(Types.conflicts(Type.arrayOf(Type.BOOL, 4), Type.arrayOf(Type.floatOf(32), 4)));
        assertEquals(16, Type.arrayOf(Type.signed(32), 4).sizeInBytes());
    }

    @Test
    void testOtherKindsConflict() {
        assertTrue(Types.conflicts(Type.floatOf(64), Type.genericInt(64)));
        assertTrue(Types.conflicts(Type.floatOf(32), Type.floatOf(64)));
        assertTrue(Types.conflicts(Type.VOID, Type.BOOL));
        assertFalse(Types.conflicts(Type.floatOf(64), Type.floatOf(64)));
    }

    @Test
    void testRefinementOrder() {
        assertTrue(Types.isRefinementOf(Type.signed(64), Type.UNKNOWN));
        assertFalse(Types.isRefinementOf(Type.UNKNOWN, Type.signed(64)));
        assertTrue(Types.isRefinementOf(Type.pointerTo(Type.BOOL), Type.genericInt(64)));
        assertFalse(Types.isRefinementOf(Type.signed(64), Type.unsigned(64)));
    }

    @Test
    void testJoin() {
        assertEquals(Type.UNKNOWN, Types.join(Collections.emptyList()));
        assertEquals(Type.signed(32), Types.join(Arrays.asList(Type.UNKNOWN, Type.signed(32), Type.UNKNOWN)));
        assertEquals(Type.genericInt(32), Types.join(Arrays.asList(Type.signed(32), Type.unsigned(32))));
        assertEquals(Type.UNKNOWN, Types.join(Arrays.asList(Type.signed(32), Type.floatOf(32))));
    }

    @Test
    void testPointerDepthIsBounded() {
        Type t = Type.BOOL;
        for (int i = 0; i < 10; i++) {
            t = Type.pointerTo(t);
        }
        assertEquals(Type.MAX_POINTER_DEPTH, t.pointerDepth());
        assertEquals(8, t.sizeInBytes());
    }

    @Test
    void testCNames() {
        assertEquals("int64_t", Type.genericInt(64).toCString());
        assertEquals("int32_t", Type.signed(32).toCString());
        assertEquals("uint8_t", Type.unsigned(8).toCString());
        assertEquals("double", Type.floatOf(64).toCString());
        assertEquals("float", Type.floatOf(32).toCString());
        assertEquals("bool", Type.BOOL.toCString());
        assertEquals("void *", Type.pointerTo(Type.UNKNOWN).toCString());
        assertEquals("uint16_t **", Type.pointerTo(Type.pointerTo(Type.unsigned(16))).toCString());
        assertEquals("int32_t[3]", Type.arrayOf(Type.signed(32), 3).toCString());
        assertEquals("struct { int32_t x; bool y; }", Type.struct(Arrays.asList(
                new Type.Field("x", Type.signed(32)), new Type.Field("y", Type.BOOL))).toCString());
        assertEquals("void (*)(int64_t, void *)", Type.function(Type.VOID,
                Arrays.asList(Type.genericInt(64), Type.pointerTo(Type.UNKNOWN))).toCString());
    }
}
