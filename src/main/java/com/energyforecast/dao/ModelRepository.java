package com.energyforecast.dao;

import com.energyforecast.entity.ModelArtifact;

/**
 * 训练好的模型按数据集名称保存与加载
 */
public interface ModelRepository {

    void save(String datasetName, ModelArtifact artifact);

    /**
     * @throws com.energyforecast.exception.ModelArtifactNotFoundException 未保存过该数据集的模型
     */
    ModelArtifact load(String datasetName);

    boolean exists(String datasetName);
}
