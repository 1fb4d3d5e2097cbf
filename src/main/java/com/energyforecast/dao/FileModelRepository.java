package com.energyforecast.dao;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.energyforecast.entity.HyperparameterConfig;
import com.energyforecast.entity.ModelArtifact;
import com.energyforecast.exception.ModelArtifactNotFoundException;
import com.energyforecast.exception.ModelPersistenceException;
import com.energyforecast.util.MinMaxScaler;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.deeplearning4j.util.ModelSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 模型目录结构：{root}/{dataset}/model.zip + metadata.json
 */
public class FileModelRepository implements ModelRepository {
    private static final Logger logger = LoggerFactory.getLogger(FileModelRepository.class);

    static final String MODEL_FILE = "model.zip";
    static final String METADATA_FILE = "metadata.json";

    private final Path root;

    public FileModelRepository(Path root) {
        this.root = root;
    }

    @Override
    public void save(String datasetName, ModelArtifact artifact) {
        Path modelDir = root.resolve(datasetName);
        try {
            Files.createDirectories(modelDir);

            File modelFile = modelDir.resolve(MODEL_FILE).toFile();
            ModelSerializer.writeModel(artifact.getNetwork(), modelFile, false);

            Files.write(modelDir.resolve(METADATA_FILE),
                    toMetadata(datasetName, artifact).toString(JSONWriter.Feature.PrettyFormat)
                            .getBytes(StandardCharsets.UTF_8));

            logger.info("Model for dataset {} saved to: {}", datasetName, modelDir.toAbsolutePath());
        } catch (IOException e) {
            logger.error("Failed to save model for dataset {}", datasetName, e);
            throw new ModelPersistenceException("Failed to save model for dataset " + datasetName, e);
        }
    }

    @Override
    public ModelArtifact load(String datasetName) {
        Path modelDir = root.resolve(datasetName);
        Path modelFile = modelDir.resolve(MODEL_FILE);
        Path metadataFile = modelDir.resolve(METADATA_FILE);
        if (!Files.exists(modelFile) || !Files.exists(metadataFile)) {
            throw new ModelArtifactNotFoundException(datasetName, modelDir.toString());
        }

        try {
            ComputationGraph network = ModelSerializer.restoreComputationGraph(modelFile.toFile(), false);
            JSONObject metadata = JSON.parseObject(new String(Files.readAllBytes(metadataFile), StandardCharsets.UTF_8));

            JSONObject configJson = metadata.getJSONObject("config");
            HyperparameterConfig config = new HyperparameterConfig(
                    configJson.getIntValue("recurrentUnits"),
                    configJson.getDoubleValue("dropoutRate"),
                    configJson.getIntValue("batchSize"),
                    configJson.getIntValue("epochBudget"));

            JSONObject scalerJson = metadata.getJSONObject("scaler");
            MinMaxScaler scaler = MinMaxScaler.restore(scalerJson.getDoubleValue("min"), scalerJson.getDoubleValue("max"));

            List<Double> lossHistory = new ArrayList<>();
            JSONArray lossJson = metadata.getJSONArray("lossHistory");
            for (int i = 0; i < lossJson.size(); i++) {
                Double loss = lossJson.getDouble(i);
                lossHistory.add(loss == null ? Double.NaN : loss);
            }

            logger.info("Model for dataset {} loaded from: {}", datasetName, modelDir.toAbsolutePath());
            return new ModelArtifact(network, config, scaler, lossHistory);
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to load model for dataset {}", datasetName, e);
            throw new ModelPersistenceException("Failed to load model for dataset " + datasetName, e);
        }
    }

    @Override
    public boolean exists(String datasetName) {
        Path modelDir = root.resolve(datasetName);
        return Files.exists(modelDir.resolve(MODEL_FILE)) && Files.exists(modelDir.resolve(METADATA_FILE));
    }

    private static JSONObject toMetadata(String datasetName, ModelArtifact artifact) {
        HyperparameterConfig config = artifact.getConfig();
        JSONObject configJson = new JSONObject();
        configJson.put("recurrentUnits", config.getRecurrentUnits());
        configJson.put("dropoutRate", config.getDropoutRate());
        configJson.put("batchSize", config.getBatchSize());
        configJson.put("epochBudget", config.getEpochBudget());

        JSONObject scalerJson = new JSONObject();
        scalerJson.put("min", artifact.getScaler().getDataMin());
        scalerJson.put("max", artifact.getScaler().getDataMax());

        // NaN 无法写入 JSON，用 null 表示
        JSONArray lossJson = new JSONArray();
        for (Double loss : artifact.getLossHistory()) {
            lossJson.add(Double.isFinite(loss) ? loss : null);
        }

        JSONObject metadata = new JSONObject();
        metadata.put("dataset", datasetName);
        metadata.put("config", configJson);
        metadata.put("scaler", scalerJson);
        metadata.put("lossHistory", lossJson);
        metadata.put("savedAt", LocalDateTime.now().toString());
        return metadata;
    }
}
