package com.acme.studio.tracing.collector;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldResultTest {

    @Test
    void captureKeepsValue() {
        FieldResult<Integer> result = FieldResult.capture(() -> 42);

        assertTrue(result.isSuccess());
        assertEquals(42, result.getOrThrow());
    }

    @Test
    void captureKeepsThrownException() {
        IllegalArgumentException boom = new IllegalArgumentException("bad id");

        FieldResult<Integer> result = FieldResult.capture(() -> {
            throw boom;
        });

        assertFalse(result.isSuccess());
        assertSame(boom, assertThrows(IllegalArgumentException.class, result::getOrThrow));
    }
}
