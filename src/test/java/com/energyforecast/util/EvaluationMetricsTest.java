package com.energyforecast.util;

import org.junit.jupiter.api.Test;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationMetricsTest {

    @Test
    void testKnownErrors() {
        INDArray actual = Nd4j.createFromArray(new double[][]{{1.0}, {2.0}, {3.0}, {4.0}});
        INDArray predicted = Nd4j.createFromArray(new double[][]{{1.5}, {2.0}, {2.0}, {4.0}});

        assertEquals(0.375, EvaluationMetrics.calculateMAE(predicted, actual), 1e-12);
        assertEquals(0.3125, EvaluationMetrics.calculateMSE(predicted, actual), 1e-12);
        assertEquals(Math.sqrt(0.3125), EvaluationMetrics.calculateRMSE(predicted, actual), 1e-12);
        // SS_res = 1.25, SS_tot = 5
        assertEquals(0.75, EvaluationMetrics.calculateR2(predicted, actual), 1e-12);
    }

    @Test
    void testPerfectPrediction() {
        INDArray actual = Nd4j.createFromArray(0.1, 0.4, 0.9);

        assertEquals(0.0, EvaluationMetrics.calculateMAE(actual.dup(), actual), 0.0);
        assertEquals(0.0, EvaluationMetrics.calculateRMSE(actual.dup(), actual), 0.0);
        assertEquals(1.0, EvaluationMetrics.calculateR2(actual.dup(), actual), 0.0);
    }

    @Test
    void testR2IsNaNForConstantTargets() {
        INDArray actual = Nd4j.createFromArray(0.5, 0.5, 0.5);
        INDArray predicted = Nd4j.createFromArray(0.4, 0.5, 0.6);

        assertTrue(Double.isNaN(EvaluationMetrics.calculateR2(predicted, actual)));
        assertTrue(EvaluationMetrics.calculateMAE(predicted, actual) > 0.0);
    }

    @Test
    void testInputsAreNotModified() {
        INDArray actual = Nd4j.createFromArray(1.0, 2.0);
        INDArray predicted = Nd4j.createFromArray(2.0, 4.0);

        EvaluationMetrics.calculateMAE(predicted, actual);
        EvaluationMetrics.calculateR2(predicted, actual);

        assertArrayEquals(new double[]{1.0, 2.0}, actual.toDoubleVector(), 0.0);
        assertArrayEquals(new double[]{2.0, 4.0}, predicted.toDoubleVector(), 0.0);
    }
}
