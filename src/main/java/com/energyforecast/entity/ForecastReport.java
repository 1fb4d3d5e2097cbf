package com.energyforecast.entity;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 汇总报告：数据集名称 -> 处理结果，保持提交顺序
 */
public class ForecastReport {
    private static final String ROW_FORMAT = "%-16s | %10s | %10s | %10s%n";

    private final Map<String, DatasetOutcome> outcomes = new LinkedHashMap<>();

    public ForecastReport(List<DatasetOutcome> outcomes) {
        for (DatasetOutcome outcome : outcomes) {
            this.outcomes.put(outcome.getDatasetName(), outcome);
        }
    }

    public Map<String, DatasetOutcome> getOutcomes() {
        return Collections.unmodifiableMap(outcomes);
    }

    public DatasetOutcome get(String datasetName) {
        return outcomes.get(datasetName);
    }

    public List<DatasetOutcome> successes() {
        List<DatasetOutcome> result = new ArrayList<>();
        for (DatasetOutcome outcome : outcomes.values()) {
            if (outcome.isSuccess()) {
                result.add(outcome);
            }
        }
        return result;
    }

    public List<DatasetOutcome> failures() {
        List<DatasetOutcome> result = new ArrayList<>();
        for (DatasetOutcome outcome : outcomes.values()) {
            if (!outcome.isSuccess()) {
                result.add(outcome);
            }
        }
        return result;
    }

    /**
     * 渲染为固定列表格
     *
     * @param originalUnits true 时输出反归一化后的指标（原始负荷单位）
     */
    public String render(boolean originalUnits) {
        StringBuilder table = new StringBuilder();
        table.append(String.format(Locale.ROOT, ROW_FORMAT, "Dataset", "MAE", "RMSE", "R²"));
        table.append("-".repeat(55)).append(System.lineSeparator());

        for (DatasetOutcome outcome : successes()) {
            EvaluationResult metrics = originalUnits ? outcome.getOriginalUnitMetrics() : outcome.getNormalizedMetrics();
            table.append(String.format(Locale.ROOT, ROW_FORMAT,
                    outcome.getDatasetName(),
                    format(metrics.getMae()),
                    format(metrics.getRmse()),
                    format(metrics.getR2())));
        }

        List<DatasetOutcome> failed = failures();
        if (!failed.isEmpty()) {
            table.append(System.lineSeparator()).append("Failed datasets:").append(System.lineSeparator());
            for (DatasetOutcome outcome : failed) {
                table.append(String.format(Locale.ROOT, "  %s: [%s] %s%n",
                        outcome.getDatasetName(), outcome.getErrorCode(), outcome.getErrorMessage()));
            }
        }
        return table.toString();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    public String toJson() {
        JSONArray datasets = new JSONArray();
        for (DatasetOutcome outcome : outcomes.values()) {
            JSONObject entry = new JSONObject();
            entry.put("dataset", outcome.getDatasetName());
            entry.put("success", outcome.isSuccess());
            if (outcome.isSuccess()) {
                entry.put("normalized", metricsJson(outcome.getNormalizedMetrics()));
                entry.put("originalUnits", metricsJson(outcome.getOriginalUnitMetrics()));
                HyperparameterConfig config = outcome.getConfig();
                JSONObject hyperparameters = new JSONObject();
                hyperparameters.put("recurrentUnits", config.getRecurrentUnits());
                hyperparameters.put("dropoutRate", config.getDropoutRate());
                hyperparameters.put("batchSize", config.getBatchSize());
                hyperparameters.put("epochBudget", config.getEpochBudget());
                entry.put("hyperparameters", hyperparameters);
            } else {
                entry.put("errorCode", outcome.getErrorCode());
                entry.put("errorMessage", outcome.getErrorMessage());
            }
            datasets.add(entry);
        }
        JSONObject root = new JSONObject();
        root.put("datasets", datasets);
        return root.toJSONString(JSONWriter.Feature.PrettyFormat, JSONWriter.Feature.WriteNulls);
    }

    private static JSONObject metricsJson(EvaluationResult metrics) {
        JSONObject json = new JSONObject();
        // NaN 不是合法 JSON 数字
        json.put("mae", finiteOrNull(metrics.getMae()));
        json.put("rmse", finiteOrNull(metrics.getRmse()));
        json.put("r2", finiteOrNull(metrics.getR2()));
        return json;
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
