package com.energyforecast.service;

import com.energyforecast.dao.ModelRepository;
import com.energyforecast.dao.SeriesSource;
import com.energyforecast.entity.DatasetOutcome;
import com.energyforecast.entity.EvaluationResult;
import com.energyforecast.entity.ForecastReport;
import com.energyforecast.entity.HyperparameterConfig;
import com.energyforecast.entity.ModelArtifact;
import com.energyforecast.entity.PipelineConfig;
import com.energyforecast.entity.RawSeries;
import com.energyforecast.entity.ScalerFitScope;
import com.energyforecast.entity.SearchResult;
import com.energyforecast.entity.SplitRatios;
import com.energyforecast.entity.SplitSet;
import com.energyforecast.entity.TrainingRun;
import com.energyforecast.entity.WindowSet;
import com.energyforecast.exception.ForecastException;
import com.energyforecast.exception.InvalidWindowLengthException;
import com.energyforecast.model.ModelBuilder;
import com.energyforecast.util.SeedSequence;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 多数据集预测流程
 * 每个数据集独立执行：加载 -> 预处理 -> 滑窗 -> 切分 -> (网格搜索) -> 训练 -> 保存 -> 加载 -> 评估
 * 单个数据集失败不影响其他数据集
 */
public class ForecastPipeline {
    private static final Logger logger = LoggerFactory.getLogger(ForecastPipeline.class);

    static final String IO_ERROR = "IO_ERROR";
    static final String CANCELLED = "CANCELLED";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final PipelineConfig config;
    private final SeriesSource seriesSource;
    private final ModelRepository modelRepository;

    private final PreprocessingService preprocessingService = new PreprocessingService();
    private final WindowingService windowingService = new WindowingService();
    private final SplittingService splittingService = new SplittingService();
    private final ModelTrainingService trainingService;
    private final EvaluationService evaluationService = new EvaluationService();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ForecastPipeline(PipelineConfig config, SeriesSource seriesSource, ModelRepository modelRepository) {
        this(config, seriesSource, modelRepository, new ModelTrainingService());
    }

    ForecastPipeline(PipelineConfig config, SeriesSource seriesSource, ModelRepository modelRepository,
                     ModelTrainingService trainingService) {
        this.config = config;
        this.seriesSource = seriesSource;
        this.modelRepository = modelRepository;
        this.trainingService = trainingService;
    }

    /**
     * 处理所有数据集，报告顺序与输入顺序一致
     */
    public ForecastReport run(List<String> datasetNames) {
        Set<String> names = new LinkedHashSet<>(datasetNames);
        if (names.size() < datasetNames.size()) {
            logger.warn("Duplicate dataset names ignored: {}", datasetNames);
        }
        if (names.isEmpty()) {
            return new ForecastReport(new ArrayList<>());
        }

        int threads = Math.max(1, Math.min(config.getDatasetParallelism(), names.size()));
        logger.info("Running forecast pipeline for {} datasets ({} in parallel)", names.size(), threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<String> ordered = new ArrayList<>(names);
        List<Future<DatasetOutcome>> futures = new ArrayList<>();
        try {
            for (String name : ordered) {
                futures.add(executor.submit(() -> runDataset(name)));
            }
            executor.shutdown();

            List<DatasetOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                String name = ordered.get(i);
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    logger.error("Dataset {} failed unexpectedly", name, cause);
                    outcomes.add(DatasetOutcome.failure(name, INTERNAL_ERROR, String.valueOf(cause)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancel();
                    outcomes.add(DatasetOutcome.failure(name, CANCELLED, "Interrupted while waiting for dataset"));
                }
            }

            ForecastReport report = new ForecastReport(outcomes);
            logger.info("Forecast pipeline finished: {} succeeded, {} failed",
                    report.successes().size(), report.failures().size());
            return report;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * 请求取消：未开始的数据集直接标记失败，正在训练的网络在当前轮结束后停止
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    DatasetOutcome runDataset(String datasetName) {
        if (cancelled.get()) {
            return DatasetOutcome.failure(datasetName, CANCELLED, "Pipeline cancelled before the dataset started");
        }

        logger.info("===== Dataset {} =====", datasetName);
        try {
            return process(datasetName);
        } catch (ForecastException e) {
            logger.error("Dataset {} failed: [{}] {}", datasetName, e.getErrorCode(), e.getMessage());
            return DatasetOutcome.failure(datasetName, e.getErrorCode(), e.getMessage());
        } catch (IOException e) {
            logger.error("Dataset {} could not be read", datasetName, e);
            return DatasetOutcome.failure(datasetName, IO_ERROR, String.valueOf(e));
        } catch (RuntimeException e) {
            logger.error("Dataset {} failed", datasetName, e);
            return DatasetOutcome.failure(datasetName, INTERNAL_ERROR, String.valueOf(e));
        }
    }

    private DatasetOutcome process(String datasetName) throws IOException {
        long seed = SeedSequence.derive(config.getSeed(), datasetName);
        int windowLength = config.getWindowLength();
        SplitRatios ratios = config.getSplitRatios();

        // 1. 加载与预处理
        RawSeries raw = seriesSource.load(datasetName);
        if (windowLength < 1 || windowLength >= raw.size()) {
            throw new InvalidWindowLengthException(windowLength, raw.size());
        }
        int fitLength = scalerFitLength(raw.size(), windowLength, ratios);
        PreprocessingService.PreprocessedSeries preprocessed = preprocessingService.preprocess(raw, fitLength);

        // 2. 滑窗与切分
        WindowSet windows = windowingService.createWindows(preprocessed.getValues(), windowLength);
        SplitSet split = splittingService.split(windows, ratios);

        // 3. 选择超参数并训练
        ModelBuilder modelBuilder = new ModelBuilder(config.getArchitecture(), windowLength, config.getLearningRate());
        HyperparameterConfig chosen = config.getFixedConfig();
        if (config.isSearchEnabled()) {
            HyperparameterSearchService searchService = new HyperparameterSearchService(
                    modelBuilder, trainingService, config.getSearchParallelism());
            SearchResult searchResult = searchService.search(split.getTrain(), split.getValidation(),
                    config.getGrid(), config.getSearchPatience(), seed, cancelled::get);
            chosen = searchResult.getBestConfig();
        }

        ComputationGraph model = modelBuilder.build(chosen, seed);
        TrainingRun run = trainingService.train(model, split.getTrain(), split.getValidation(), chosen,
                config.getFinalPatience(), cancelled::get);

        // 4. 保存后重新加载再评估
        modelRepository.save(datasetName,
                new ModelArtifact(run.getModel(), chosen, preprocessed.getScaler(), run.getLossHistory()));
        ModelArtifact artifact = modelRepository.load(datasetName);

        EvaluationResult normalized = evaluationService.evaluate(artifact.getNetwork(), split.getTest());
        EvaluationResult originalUnits = evaluationService.evaluateInOriginalUnits(
                artifact.getNetwork(), split.getTest(), artifact.getScaler());

        logger.info("Dataset {} done with {}: {}", datasetName, chosen, normalized);
        return DatasetOutcome.success(datasetName, normalized, originalUnits, chosen);
    }

    /**
     * 归一化器拟合长度：整条序列，或仅覆盖训练窗口的前缀 floor((N-T)*trainEnd)+T
     */
    int scalerFitLength(int seriesLength, int windowLength, SplitRatios ratios) {
        if (config.getScalerFitScope() == ScalerFitScope.TRAINING_PREFIX) {
            int trainWindows = SplittingService.trainWindowCount(seriesLength - windowLength, ratios);
            return trainWindows + windowLength;
        }
        return seriesLength;
    }
}
