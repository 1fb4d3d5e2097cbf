package com.energyforecast.service;

import com.energyforecast.TestSeries;
import com.energyforecast.entity.EvaluationResult;
import com.energyforecast.entity.HyperparameterConfig;
import com.energyforecast.entity.WindowSet;
import com.energyforecast.exception.InsufficientDataException;
import com.energyforecast.model.ArchitectureVariant;
import com.energyforecast.model.ModelBuilder;
import com.energyforecast.util.MinMaxScaler;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.nd4j.linalg.factory.Nd4j;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationServiceTest {
    private EvaluationService evaluationService;
    private ComputationGraph model;
    private WindowSet test;

    @BeforeEach
    void setUp() {
        evaluationService = new EvaluationService();
        model = new ModelBuilder(ArchitectureVariant.BASIC, 6, 0.001)
                .build(new HyperparameterConfig(4, 0.0, 8, 1), 3L);

        MinMaxScaler scaler = new MinMaxScaler();
        double[] series = TestSeries.dailySine(40, 1000.0, 100.0);
        scaler.fit(Nd4j.createFromArray(series));
        test = new WindowingService().createWindows(scaler.transformCopy(Nd4j.createFromArray(series)), 6);
    }

    @Test
    void testMetricsAreConsistent() {
        EvaluationResult result = evaluationService.evaluate(model, test);

        assertTrue(result.getMae() >= 0.0);
        assertTrue(result.getRmse() >= result.getMae());
        assertTrue(Double.isFinite(result.getR2()));
        assertArrayEquals(new long[]{test.size(), 1}, evaluationService.predict(model, test).shape());
    }

    @Test
    void testOriginalUnitsScaleErrorsByDataRange() {
        MinMaxScaler scaler = MinMaxScaler.restore(200.0, 1200.0);

        EvaluationResult normalized = evaluationService.evaluate(model, test);
        EvaluationResult original = evaluationService.evaluateInOriginalUnits(model, test, scaler);

        assertEquals(normalized.getMae() * 1000.0, original.getMae(), 1e-6);
        assertEquals(normalized.getRmse() * 1000.0, original.getRmse(), 1e-6);
        assertEquals(normalized.getR2(), original.getR2(), 1e-9);
    }

    @Test
    void testEmptyTestSet() {
        assertThrows(InsufficientDataException.class, () -> evaluationService.evaluate(model, test.slice(0, 0)));
    }
}
