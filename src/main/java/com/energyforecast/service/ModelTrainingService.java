package com.energyforecast.service;

import com.energyforecast.entity.HyperparameterConfig;
import com.energyforecast.entity.TrainingRun;
import com.energyforecast.entity.WindowSet;
import com.energyforecast.exception.InsufficientDataException;
import org.deeplearning4j.datasets.iterator.utilty.ListDataSetIterator;
import org.deeplearning4j.earlystopping.EarlyStoppingConfiguration;
import org.deeplearning4j.earlystopping.EarlyStoppingResult;
import org.deeplearning4j.earlystopping.saver.InMemoryModelSaver;
import org.deeplearning4j.earlystopping.scorecalc.DataSetLossCalculator;
import org.deeplearning4j.earlystopping.termination.InvalidScoreIterationTerminationCondition;
import org.deeplearning4j.earlystopping.termination.MaxEpochsTerminationCondition;
import org.deeplearning4j.earlystopping.termination.ScoreImprovementEpochTerminationCondition;
import org.deeplearning4j.earlystopping.trainer.EarlyStoppingGraphTrainer;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.dataset.api.iterator.DataSetIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;

public class ModelTrainingService {
    private static final Logger logger = LoggerFactory.getLogger(ModelTrainingService.class);

    static final String EPOCH_BUDGET_EXHAUSTED = "EpochBudgetExhausted";
    static final String CANCELLED = "Cancelled";

    public TrainingRun train(ComputationGraph model, WindowSet train, WindowSet validation,
                             HyperparameterConfig config, int patience) {
        return train(model, train, validation, config, patience, () -> false);
    }

    /**
     * 训练模型
     * 有验证集时使用早停并返回验证损失最小的网络，否则跑满轮数并返回最终网络
     *
     * @param cancelled 每轮结束后检查，为 true 时停止训练
     */
    public TrainingRun train(ComputationGraph model, WindowSet train, WindowSet validation,
                             HyperparameterConfig config, int patience, BooleanSupplier cancelled) {
        if (train == null || train.isEmpty()) {
            throw new InsufficientDataException("Training set is empty");
        }
        if (patience < 1) {
            throw new IllegalArgumentException("patience must be >= 1, got " + patience);
        }
        logger.info("Starting model training with {} on {} windows{}", config, train.size(),
                validation == null ? "" : " (validation " + validation.size() + ")");

        if (validation == null) {
            return trainFullBudget(model, train, config, cancelled);
        }
        if (validation.isEmpty()) {
            throw new InsufficientDataException("Validation set is empty");
        }
        return trainWithEarlyStopping(model, train, validation, config, patience, cancelled);
    }

    private TrainingRun trainWithEarlyStopping(ComputationGraph model, WindowSet train, WindowSet validation,
                                               HyperparameterConfig config, int patience,
                                               BooleanSupplier cancelled) {
        DataSetIterator trainIterator = createDataSetIterator(train, config.getBatchSize());
        DataSetIterator validationIterator = createDataSetIterator(validation, config.getBatchSize());

        EarlyStoppingConfiguration<ComputationGraph> esConf = new EarlyStoppingConfiguration.Builder<ComputationGraph>()
                .epochTerminationConditions(
                        new MaxEpochsTerminationCondition(config.getEpochBudget()),
                        new ScoreImprovementEpochTerminationCondition(patience),
                        new CancellationTerminationCondition(cancelled))
                .iterationTerminationConditions(new InvalidScoreIterationTerminationCondition())
                .scoreCalculator(new DataSetLossCalculator(validationIterator, true))
                .evaluateEveryNEpochs(1)
                .modelSaver(new InMemoryModelSaver<>())
                .build();

        EarlyStoppingGraphTrainer trainer = new EarlyStoppingGraphTrainer(esConf, model, trainIterator,
                new TrainingProgressListener(config.toString(), config.getEpochBudget()));
        EarlyStoppingResult<ComputationGraph> result = trainer.fit();

        ComputationGraph best = result.getBestModel();
        double bestLoss = bestValidationLoss(result);
        if (best == null || !Double.isFinite(bestLoss)) {
            throw new IllegalStateException("Training produced no finite validation loss ("
                    + result.getTerminationReason() + ": " + result.getTerminationDetails() + ")");
        }

        List<Double> lossHistory = new ArrayList<>(new TreeMap<>(result.getScoreVsEpoch()).values());
        return new TrainingRun(config, best, lossHistory, true, result.getBestModelEpoch(),
                bestLoss, result.getTotalEpochs(), describeTermination(result));
    }

    /**
     * 最优轮次对应的验证损失
     * 图训练器的 getBestModelScore() 不是实际得分，以每轮得分记录为准
     */
    static double bestValidationLoss(EarlyStoppingResult<ComputationGraph> result) {
        Map<Integer, Double> scoreVsEpoch = result.getScoreVsEpoch();
        if (scoreVsEpoch == null || scoreVsEpoch.isEmpty()) {
            return Double.NaN;
        }
        Double atBestEpoch = scoreVsEpoch.get(result.getBestModelEpoch());
        if (atBestEpoch != null) {
            return atBestEpoch;
        }
        double min = Double.NaN;
        for (double score : scoreVsEpoch.values()) {
            if (Double.isFinite(score) && (Double.isNaN(min) || score < min)) {
                min = score;
            }
        }
        return min;
    }

    private static String describeTermination(EarlyStoppingResult<ComputationGraph> result) {
        String details = result.getTerminationDetails();
        if (details != null && details.startsWith(CancellationTerminationCondition.class.getSimpleName())) {
            return CANCELLED;
        }
        return result.getTerminationReason() + (details == null ? "" : ": " + details);
    }

    private TrainingRun trainFullBudget(ComputationGraph model, WindowSet train, HyperparameterConfig config,
                                        BooleanSupplier cancelled) {
        DataSetIterator trainIterator = createDataSetIterator(train, config.getBatchSize());
        int epochs = config.getEpochBudget();

        // 记录训练过程中的损失
        List<Double> epochLosses = new ArrayList<>();
        String termination = EPOCH_BUDGET_EXHAUSTED;

        for (int epoch = 0; epoch < epochs; epoch++) {
            trainIterator.reset();
            model.fit(trainIterator);

            double epochLoss = calculateLoss(model, trainIterator);
            epochLosses.add(epochLoss);

            if ((epoch + 1) % 5 == 0) {
                logger.info("Epoch {}/{} - training loss: {}", epoch + 1, epochs, String.format("%.6f", epochLoss));
            }
            if (cancelled.getAsBoolean() && epoch + 1 < epochs) {
                logger.warn("Training cancelled after epoch {}", epoch + 1);
                termination = CANCELLED;
                break;
            }
        }

        logger.info("Model training completed, final loss: {}",
                String.format("%.6f", epochLosses.get(epochLosses.size() - 1)));
        return new TrainingRun(config, model, epochLosses, false, epochLosses.size() - 1, Double.NaN,
                epochLosses.size(), termination);
    }

    /**
     * 计算模型在数据集上按样本数加权的平均损失
     */
    double calculateLoss(ComputationGraph model, DataSetIterator iterator) {
        double totalLoss = 0.0;
        long exampleCount = 0;

        iterator.reset();
        while (iterator.hasNext()) {
            DataSet batch = iterator.next();
            int examples = batch.numExamples();
            totalLoss += model.score(batch) * examples;
            exampleCount += examples;
        }

        iterator.reset();
        return exampleCount > 0 ? totalLoss / exampleCount : Double.NaN;
    }

    /**
     * 按时间顺序的批迭代器，不打乱样本
     */
    DataSetIterator createDataSetIterator(WindowSet windows, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        }
        List<DataSet> samples = windows.isEmpty() ? new ArrayList<>() : windows.toDataSet().asList();
        return new ListDataSetIterator<>(samples, Math.min(batchSize, Math.max(1, windows.size())));
    }
}
