package io.poolscope.merge;

import io.poolscope.fixtures.Limits;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmptinessPolicyTest {
    private final EmptinessPolicy strict = EmptinessPolicy.of(false);
    private final EmptinessPolicy allowEmpty = EmptinessPolicy.of(true);

    @Test
    void zeroValuesAreEmptyUnlessAllowed() {
        for (Object zero : List.of(0, 0L, 0.0d, "", false, '\0', BigDecimal.ZERO, List.of(), new int[0], Optional.empty())) {
            assertTrue(strict.isEmpty(zero), "strict should treat as empty: " + zero);
            assertFalse(allowEmpty.isEmpty(zero), "allowEmpty should keep: " + zero);
        }
    }

    @Test
    void nullIsAlwaysEmpty() {
        assertTrue(strict.isEmpty(null));
        assertTrue(allowEmpty.isEmpty(null));
    }

    @Test
    void nonZeroValuesAreNeverEmpty() {
        for (Object value : List.of(1, -1L, 0.5d, "x", true, List.of(0), new BigDecimal("0.01"))) {
            assertFalse(strict.isEmpty(value), "should not be empty: " + value);
        }
    }

    @Test
    void mapsAndTimeValuesAreEmptyOnlyWhenNull() {
        assertFalse(strict.isEmpty(Map.of()));
        assertFalse(strict.isEmpty(Instant.EPOCH));
    }

    @Test
    void recordIsEmptyWhenAllFieldsAreZero() {
        assertTrue(strict.isEmpty(new Limits(0, 0), Limits.SCHEMA));
        assertFalse(strict.isEmpty(new Limits(0, 1), Limits.SCHEMA));
        assertFalse(allowEmpty.isEmpty(new Limits(0, 0), Limits.SCHEMA));
    }
}
