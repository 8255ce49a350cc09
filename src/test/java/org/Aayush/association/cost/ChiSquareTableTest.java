package org.Aayush.association.cost;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("ChiSquareTable Tests")
class ChiSquareTableTest {

    @Test
    @DisplayName("Gating thresholds use 2 DOF for position and 4 DOF for full boxes")
    void testGatingThresholds() {
        assertEquals(5.9915d, ChiSquareTable.gatingThreshold(true));
        assertEquals(9.4877d, ChiSquareTable.gatingThreshold(false));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 10, -1})
    @DisplayName("Degrees of freedom outside [1, 9] are rejected")
    void testOutOfRange(int dof) {
        assertThrows(IllegalArgumentException.class, () -> ChiSquareTable.inverse95(dof));
    }
}
