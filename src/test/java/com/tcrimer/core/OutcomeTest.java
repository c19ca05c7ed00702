package com.tcrimer.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutcomeTest {

    @Test
    void insufficientShouldCarryRequiredAndAvailable() {
        Outcome<Double> out = Outcome.insufficient("rsi", 15, 3);

        assertFalse(out.success);
        assertNull(out.value);
        assertTrue(out.isInsufficientData());
        assertEquals(Map.of("required", 15, "available", 3), out.details);
    }

    @Test
    void castFailureShouldKeepTheSameFailure() {
        Outcome<Double> failed = Outcome.failure(CauseCode.NO_BARS, "sma");

        Outcome<String> recast = failed.castFailure();

        assertFalse(recast.success);
        assertEquals(CauseCode.NO_BARS, recast.causeCode);
        assertEquals("sma", recast.owner);
        assertThrows(IllegalStateException.class, () -> Outcome.success(1.0, "sma").castFailure());
    }

    @Test
    void successShouldHaveNoCause() {
        Outcome<Double> out = Outcome.success(4.0, "sma");

        assertTrue(out.success);
        assertEquals(CauseCode.NONE, out.causeCode);
        assertEquals("sma", out.owner);
    }
}
