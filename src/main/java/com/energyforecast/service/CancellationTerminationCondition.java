package com.energyforecast.service;

import org.deeplearning4j.earlystopping.termination.EpochTerminationCondition;

import java.util.function.BooleanSupplier;

/**
 * 每轮结束后检查外部取消标志
 */
public class CancellationTerminationCondition implements EpochTerminationCondition {
    private final transient BooleanSupplier cancelled;

    public CancellationTerminationCondition(BooleanSupplier cancelled) {
        this.cancelled = cancelled;
    }

    @Override
    public void initialize() {
        // 无状态
    }

    @Override
    public boolean terminate(int epochNum, double score, boolean minimize) {
        return cancelled != null && cancelled.getAsBoolean();
    }

    @Override
    public String toString() {
        return "CancellationTerminationCondition()";
    }
}
