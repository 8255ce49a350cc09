package org.Aayush.association.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("AssociationException Tests")
class AssociationExceptionTest {

    @Test
    @DisplayName("Three-arg constructor preserves reason code, message prefix, and cause")
    void testThreeArgConstructor() {
        IllegalStateException cause = new IllegalStateException("boom");
        AssociationException ex = new AssociationException("TEST_REASON", "details", cause);

        assertEquals("TEST_REASON", ex.getReasonCode());
        assertEquals("[TEST_REASON] details", ex.getMessage());
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Two-arg constructor carries no cause")
    void testTwoArgConstructor() {
        AssociationException ex = new AssociationException(AssociationException.REASON_INVALID_INDEX, "index 7");

        assertEquals(AssociationException.REASON_INVALID_INDEX, ex.getReasonCode());
        assertEquals("[ASSOC_INVALID_INDEX] index 7", ex.getMessage());
        assertNull(ex.getCause());
    }

    @Test
    @DisplayName("Blank or null reason codes are rejected")
    void testInvalidReasonCodeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AssociationException(" ", "details"));
        assertThrows(NullPointerException.class, () -> new AssociationException(null, "details"));
        assertThrows(NullPointerException.class, () -> new AssociationException("CODE", null));
    }
}
