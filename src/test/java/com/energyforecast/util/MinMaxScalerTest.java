package com.energyforecast.util;

import org.junit.jupiter.api.Test;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import static org.junit.jupiter.api.Assertions.*;

class MinMaxScalerTest {

    @Test
    void testMidpointMapsToHalf() {
        MinMaxScaler scaler = new MinMaxScaler();
        scaler.fit(Nd4j.createFromArray(0.0, 100.0, 25.0));

        assertEquals(0.5, scaler.transform(50.0), 0.0);
        assertEquals(0.0, scaler.transform(0.0), 0.0);
        assertEquals(1.0, scaler.transform(100.0), 0.0);
    }

    @Test
    void testTransformInPlaceAndRoundTrip() {
        double[] raw = {13_000.5, 9_870.25, 15_432.0, 11_111.1};
        INDArray data = Nd4j.createFromArray(raw);
        MinMaxScaler scaler = new MinMaxScaler();
        scaler.fit(data);

        INDArray scaled = scaler.transformCopy(data);
        assertEquals(0.0, scaled.minNumber().doubleValue(), 1e-12);
        assertEquals(1.0, scaled.maxNumber().doubleValue(), 1e-12);
        // 原数组不变
        assertArrayEquals(raw, data.toDoubleVector(), 0.0);

        INDArray restored = scaler.inverseTransformCopy(scaled);
        assertArrayEquals(raw, restored.toDoubleVector(), 1e-9);

        scaler.transform(data);
        assertArrayEquals(scaled.toDoubleVector(), data.toDoubleVector(), 0.0);
    }

    @Test
    void testConstantRangeMapsToMidpointAndBackToMinimum() {
        MinMaxScaler scaler = new MinMaxScaler();
        scaler.fit(Nd4j.createFromArray(7.0, 7.0, 7.0));

        assertEquals(0.5, scaler.transform(7.0), 0.0);
        assertEquals(7.0, scaler.inverseTransform(0.9), 0.0);
    }

    @Test
    void testCustomTargetRange() {
        MinMaxScaler scaler = new MinMaxScaler(-1.0, 1.0);
        scaler.fit(Nd4j.createFromArray(10.0, 20.0));

        assertEquals(0.0, scaler.transform(15.0), 1e-12);
        assertEquals(20.0, scaler.inverseTransform(1.0), 1e-12);
    }

    @Test
    void testRestoreMatchesFittedScaler() {
        MinMaxScaler fitted = new MinMaxScaler();
        fitted.fit(Nd4j.createFromArray(3.0, 9.0, 5.0));

        MinMaxScaler restored = MinMaxScaler.restore(fitted.getDataMin(), fitted.getDataMax());
        assertTrue(restored.isFitted());
        assertEquals(fitted.transform(6.0), restored.transform(6.0), 0.0);
    }

    @Test
    void testUnfittedScalerIsRejected() {
        MinMaxScaler scaler = new MinMaxScaler();
        assertFalse(scaler.isFitted());
        assertThrows(IllegalStateException.class, () -> scaler.transform(1.0));
        assertThrows(IllegalStateException.class, () -> scaler.inverseTransform(Nd4j.createFromArray(1.0)));
    }
}
