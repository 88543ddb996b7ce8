package com.tilemerge.core.ai;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class AutoPlayerRunnerTest {

    @Test
    void parsesBooleanOptions() {
        assertTrue(AutoPlayerRunner.parseBoolean("TRUE"));
        assertFalse(AutoPlayerRunner.parseBoolean("false"));
        assertThrows(IllegalArgumentException.class, () -> AutoPlayerRunner.parseBoolean("yes"));
    }

    @Test
    void invalidArgumentsDoNotThrow() {
        assertDoesNotThrow(() -> AutoPlayerRunner.main(new String[] {"not-a-number"}));
        assertDoesNotThrow(() -> AutoPlayerRunner.main(new String[] {"1", "--mode=FAST"}));
        assertDoesNotThrow(() -> AutoPlayerRunner.main(new String[] {"1", "--unknown"}));
    }
}
