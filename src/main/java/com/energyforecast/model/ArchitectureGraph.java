package com.energyforecast.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 不可变的网络结构描述：按拓扑顺序排列的阶段列表
 */
public class ArchitectureGraph {
    private final ArchitectureVariant variant;
    private final int windowLength;
    private final Map<String, StageDescriptor> stages;

    ArchitectureGraph(ArchitectureVariant variant, int windowLength, List<StageDescriptor> stages) {
        this.variant = variant;
        this.windowLength = windowLength;
        Map<String, StageDescriptor> ordered = new LinkedHashMap<>();
        for (StageDescriptor stage : stages) {
            for (String input : stage.getInputs()) {
                if (!ModelBuilder.INPUT.equals(input) && !ordered.containsKey(input)) {
                    throw new IllegalArgumentException("Stage " + stage.getName() + " consumes unknown stage " + input);
                }
            }
            if (ordered.put(stage.getName(), stage) != null) {
                throw new IllegalArgumentException("Duplicate stage name " + stage.getName());
            }
        }
        this.stages = Collections.unmodifiableMap(ordered);
    }

    public ArchitectureVariant getVariant() {
        return variant;
    }

    public int getWindowLength() {
        return windowLength;
    }

    public List<StageDescriptor> getStages() {
        return Collections.unmodifiableList(new ArrayList<>(stages.values()));
    }

    public StageDescriptor getStage(String name) {
        StageDescriptor stage = stages.get(name);
        if (stage == null) {
            throw new IllegalArgumentException("No stage named " + name);
        }
        return stage;
    }

    public boolean hasStage(String name) {
        return stages.containsKey(name);
    }

    public StageDescriptor getOutputStage() {
        return getStage(ModelBuilder.OUTPUT);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(variant).append(" architecture, input [1, ").append(windowLength).append("]\n");
        for (StageDescriptor stage : stages.values()) {
            sb.append("  ").append(stage).append('\n');
        }
        return sb.toString();
    }
}
