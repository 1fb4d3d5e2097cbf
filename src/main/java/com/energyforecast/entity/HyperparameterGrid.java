package com.energyforecast.entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 超参数搜索网格
 */
public class HyperparameterGrid {
    private final List<Integer> recurrentUnits;
    private final List<Double> dropoutRates;
    private final List<Integer> batchSizes;
    private final List<Integer> epochBudgets;

    public HyperparameterGrid(List<Integer> recurrentUnits, List<Double> dropoutRates,
                              List<Integer> batchSizes, List<Integer> epochBudgets) {
        this.recurrentUnits = requireNonEmpty(recurrentUnits, "recurrentUnits");
        this.dropoutRates = requireNonEmpty(dropoutRates, "dropoutRates");
        this.batchSizes = requireNonEmpty(batchSizes, "batchSizes");
        this.epochBudgets = requireNonEmpty(epochBudgets, "epochBudgets");
    }

    public static HyperparameterGrid getDefaultGrid() {
        return new HyperparameterGrid(List.of(32, 64), List.of(0.2, 0.3), List.of(32, 64), List.of(20, 50));
    }

    private static <T> List<T> requireNonEmpty(List<T> values, String name) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Grid domain " + name + " must not be empty");
        }
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * 笛卡尔积枚举，顺序：单元数 > dropout > 批大小 > 轮数
     */
    public List<HyperparameterConfig> enumerate() {
        List<HyperparameterConfig> configs = new ArrayList<>(size());
        for (int units : recurrentUnits) {
            for (double dropout : dropoutRates) {
                for (int batchSize : batchSizes) {
                    for (int epochs : epochBudgets) {
                        configs.add(new HyperparameterConfig(units, dropout, batchSize, epochs));
                    }
                }
            }
        }
        return configs;
    }

    public int size() {
        return recurrentUnits.size() * dropoutRates.size() * batchSizes.size() * epochBudgets.size();
    }

    public List<Integer> getRecurrentUnits() {
        return recurrentUnits;
    }

    public List<Double> getDropoutRates() {
        return dropoutRates;
    }

    public List<Integer> getBatchSizes() {
        return batchSizes;
    }

    public List<Integer> getEpochBudgets() {
        return epochBudgets;
    }
}
