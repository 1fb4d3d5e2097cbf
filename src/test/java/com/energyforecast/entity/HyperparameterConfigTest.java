package com.energyforecast.entity;

import com.energyforecast.exception.InvalidHyperparameterException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HyperparameterConfigTest {

    @Test
    void testValidConfig() {
        HyperparameterConfig config = new HyperparameterConfig(64, 0.2, 32, 50);

        assertEquals(64, config.getRecurrentUnits());
        assertEquals(0.2, config.getDropoutRate(), 0.0);
        assertEquals(32, config.getBatchSize());
        assertEquals(50, config.getEpochBudget());
        assertEquals(new HyperparameterConfig(64, 0.2, 32, 50), config);
        assertEquals(new HyperparameterConfig(64, 0.2, 32, 50).hashCode(), config.hashCode());
    }

    @Test
    void testZeroDropoutIsAllowed() {
        assertEquals(0.0, new HyperparameterConfig(1, 0.0, 1, 1).getDropoutRate(), 0.0);
    }

    @Test
    void testOutOfRangeValuesAreRejected() {
        assertThrows(InvalidHyperparameterException.class, () -> new HyperparameterConfig(0, 0.2, 32, 50));
        assertThrows(InvalidHyperparameterException.class, () -> new HyperparameterConfig(64, 1.0, 32, 50));
        assertThrows(InvalidHyperparameterException.class, () -> new HyperparameterConfig(64, -0.1, 32, 50));
        assertThrows(InvalidHyperparameterException.class, () -> new HyperparameterConfig(64, Double.NaN, 32, 50));
        assertThrows(InvalidHyperparameterException.class, () -> new HyperparameterConfig(64, 0.2, 0, 50));
        assertThrows(InvalidHyperparameterException.class, () -> new HyperparameterConfig(64, 0.2, 32, 0));
    }

    @Test
    void testErrorCode() {
        InvalidHyperparameterException e = assertThrows(InvalidHyperparameterException.class,
                () -> new HyperparameterConfig(-1, 0.2, 32, 50));
        assertEquals("INVALID_HYPERPARAMETER", e.getErrorCode());
    }
}
