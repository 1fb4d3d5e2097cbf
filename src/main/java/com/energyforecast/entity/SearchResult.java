package com.energyforecast.entity;

import java.util.Collections;
import java.util.List;

public class SearchResult {
    private final HyperparameterConfig bestConfig;
    private final TrainingRun bestRun;
    private final List<CandidateOutcome> candidates;

    public SearchResult(HyperparameterConfig bestConfig, TrainingRun bestRun, List<CandidateOutcome> candidates) {
        this.bestConfig = bestConfig;
        this.bestRun = bestRun;
        this.candidates = Collections.unmodifiableList(candidates);
    }

    public HyperparameterConfig getBestConfig() {
        return bestConfig;
    }

    public TrainingRun getBestRun() {
        return bestRun;
    }

    public double getBestValidationLoss() {
        return bestRun.getBestValidationLoss();
    }

    /**
     * 按枚举顺序排列的所有候选结果
     */
    public List<CandidateOutcome> getCandidates() {
        return candidates;
    }
}
