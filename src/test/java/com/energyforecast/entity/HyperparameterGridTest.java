package com.energyforecast.entity;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HyperparameterGridTest {

    @Test
    void testDefaultGridEnumeratesCartesianProduct() {
        HyperparameterGrid grid = HyperparameterGrid.getDefaultGrid();
        List<HyperparameterConfig> configs = grid.enumerate();

        assertEquals(16, grid.size());
        assertEquals(16, configs.size());
        assertEquals(16, configs.stream().distinct().count());
    }

    @Test
    void testEnumerationOrderIsUnitsThenDropoutThenBatchThenEpochs() {
        HyperparameterGrid grid = new HyperparameterGrid(List.of(8, 16), List.of(0.1, 0.2), List.of(4), List.of(2, 3));
        List<HyperparameterConfig> configs = grid.enumerate();

        assertEquals(new HyperparameterConfig(8, 0.1, 4, 2), configs.get(0));
        assertEquals(new HyperparameterConfig(8, 0.1, 4, 3), configs.get(1));
        assertEquals(new HyperparameterConfig(8, 0.2, 4, 2), configs.get(2));
        assertEquals(new HyperparameterConfig(16, 0.1, 4, 2), configs.get(4));
        assertEquals(new HyperparameterConfig(16, 0.2, 4, 3), configs.get(7));
    }

    @Test
    void testEmptyDomainIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new HyperparameterGrid(List.of(), List.of(0.1), List.of(4), List.of(2)));
    }
}
