package com.energyforecast.service;

import com.energyforecast.entity.CandidateOutcome;
import com.energyforecast.entity.HyperparameterConfig;
import com.energyforecast.entity.HyperparameterGrid;
import com.energyforecast.entity.SearchResult;
import com.energyforecast.entity.TrainingRun;
import com.energyforecast.entity.WindowSet;
import com.energyforecast.exception.InsufficientDataException;
import com.energyforecast.exception.NoViableConfigurationException;
import com.energyforecast.model.ModelBuilder;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/**
 * 网格搜索
 * 每个候选配置使用新建的网络和早停训练，按枚举顺序以严格小于比较选出验证损失最小者
 */
public class HyperparameterSearchService {
    private static final Logger logger = LoggerFactory.getLogger(HyperparameterSearchService.class);

    private final ModelBuilder modelBuilder;
    private final ModelTrainingService trainingService;
    private final int parallelism;

    public HyperparameterSearchService(ModelBuilder modelBuilder, ModelTrainingService trainingService) {
        this(modelBuilder, trainingService, 1);
    }

    public HyperparameterSearchService(ModelBuilder modelBuilder, ModelTrainingService trainingService,
                                       int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        this.modelBuilder = modelBuilder;
        this.trainingService = trainingService;
        this.parallelism = parallelism;
    }

    public SearchResult search(WindowSet train, WindowSet validation, HyperparameterGrid grid,
                               int patience, long seed) {
        return search(train, validation, grid, patience, seed, () -> false);
    }

    public SearchResult search(WindowSet train, WindowSet validation, HyperparameterGrid grid,
                               int patience, long seed, BooleanSupplier cancelled) {
        if (validation == null || validation.isEmpty()) {
            throw new InsufficientDataException("Hyperparameter search needs a non-empty validation set");
        }

        List<HyperparameterConfig> configs = grid.enumerate();
        logger.info("Starting grid search over {} configurations (parallelism={}, patience={})",
                configs.size(), parallelism, patience);

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, configs.size()));
        List<Future<TrainingRun>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < configs.size(); i++) {
                HyperparameterConfig config = configs.get(i);
                int candidateIndex = i + 1;
                futures.add(executor.submit(() -> {
                    logger.debug("Candidate {}/{} started: {}", candidateIndex, configs.size(), config);
                    ComputationGraph model = modelBuilder.build(config, seed);
                    return trainingService.train(model, train, validation, config, patience, cancelled);
                }));
            }
            executor.shutdown();

            return reduce(configs, futures);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * 按提交顺序收集结果，平局保留先出现的候选
     */
    private SearchResult reduce(List<HyperparameterConfig> configs, List<Future<TrainingRun>> futures) {
        List<CandidateOutcome> outcomes = new ArrayList<>();
        TrainingRun bestRun = null;
        double bestLoss = Double.POSITIVE_INFINITY;
        int failedConfigs = 0;

        for (int i = 0; i < futures.size(); i++) {
            HyperparameterConfig config = configs.get(i);
            try {
                TrainingRun run = futures.get(i).get();
                double loss = run.getBestValidationLoss();
                if (!Double.isFinite(loss)) {
                    failedConfigs++;
                    logger.warn("Candidate {} produced a non-finite validation loss", config);
                    outcomes.add(CandidateOutcome.failed(i, config, "non-finite validation loss"));
                    continue;
                }

                outcomes.add(CandidateOutcome.succeeded(i, config, loss));
                logger.info("Candidate {}/{} {} -> validation loss {}", i + 1, configs.size(), config,
                        String.format("%.6f", loss));
                if (loss < bestLoss) {
                    bestLoss = loss;
                    bestRun = run;
                }
            } catch (ExecutionException e) {
                failedConfigs++;
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.warn("Candidate {} failed: {}", config, cause.toString());
                outcomes.add(CandidateOutcome.failed(i, config, cause.toString()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for search candidates", e);
            }
        }

        if (bestRun == null) {
            logger.error("All {} candidate configurations failed", failedConfigs);
            throw new NoViableConfigurationException("All " + configs.size() + " candidate configurations failed");
        }

        logger.info("Grid search finished: best {} with validation loss {} ({} failed)",
                bestRun.getConfig(), String.format("%.6f", bestLoss), failedConfigs);
        return new SearchResult(bestRun.getConfig(), bestRun, outcomes);
    }
}
