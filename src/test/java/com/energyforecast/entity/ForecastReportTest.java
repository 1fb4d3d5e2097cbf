package com.energyforecast.entity;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ForecastReportTest {
    private static final HyperparameterConfig CONFIG = new HyperparameterConfig(32, 0.2, 32, 20);

    private ForecastReport report() {
        return new ForecastReport(List.of(
                DatasetOutcome.success("AEP",
                        new EvaluationResult(0.012345, 0.023456, 0.987654),
                        new EvaluationResult(123.45678, 234.5, 0.987654), CONFIG),
                DatasetOutcome.failure("FLAT", "DEGENERATE_SERIES", "Series has zero variance"),
                DatasetOutcome.success("COMED",
                        new EvaluationResult(0.1, 0.2, Double.NaN),
                        new EvaluationResult(10.0, 20.0, Double.NaN), CONFIG)));
    }

    @Test
    void testRenderTableWithFourDecimals() {
        String table = report().render(false);
        String[] lines = table.split("\\R");

        assertTrue(lines[0].startsWith("Dataset"));
        assertTrue(lines[0].contains("MAE") && lines[0].contains("RMSE") && lines[0].contains("R²"));
        assertTrue(lines[2].startsWith("AEP"));
        assertTrue(lines[2].contains("0.0123"));
        assertTrue(lines[2].contains("0.0235"));
        assertTrue(lines[2].contains("0.9877"));
        assertTrue(lines[3].startsWith("COMED"));
        assertTrue(lines[3].contains("NaN"));
        assertTrue(table.contains("Failed datasets:"));
        assertTrue(table.contains("FLAT: [DEGENERATE_SERIES] Series has zero variance"));
    }

    @Test
    void testRenderOriginalUnits() {
        String table = report().render(true);
        assertTrue(table.contains("123.4568"));
    }

    @Test
    void testOutcomesKeepInsertionOrder() {
        ForecastReport report = report();

        assertEquals(List.of("AEP", "FLAT", "COMED"), List.copyOf(report.getOutcomes().keySet()));
        assertEquals(2, report.successes().size());
        assertEquals(1, report.failures().size());
        assertFalse(report.get("FLAT").isSuccess());
    }

    @Test
    void testJsonWritesNaNAsNull() {
        JSONObject json = JSON.parseObject(report().toJson());
        JSONArray datasets = json.getJSONArray("datasets");

        assertEquals(3, datasets.size());
        JSONObject aep = datasets.getJSONObject(0);
        assertTrue(aep.getBooleanValue("success"));
        assertEquals(32, aep.getJSONObject("hyperparameters").getIntValue("recurrentUnits"));

        JSONObject flat = datasets.getJSONObject(1);
        assertEquals("DEGENERATE_SERIES", flat.getString("errorCode"));

        JSONObject comed = datasets.getJSONObject(2);
        assertNull(comed.getJSONObject("normalized").get("r2"));
    }
}
