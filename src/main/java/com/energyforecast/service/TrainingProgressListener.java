package com.energyforecast.service;

import org.deeplearning4j.earlystopping.EarlyStoppingConfiguration;
import org.deeplearning4j.earlystopping.EarlyStoppingResult;
import org.deeplearning4j.earlystopping.listener.EarlyStoppingListener;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 早停训练进度日志，每5轮输出一次验证损失
 */
public class TrainingProgressListener implements EarlyStoppingListener<ComputationGraph> {
    private static final Logger logger = LoggerFactory.getLogger(TrainingProgressListener.class);
    private static final int LOG_EVERY_EPOCHS = 5;

    private final String label;
    private final int epochBudget;

    public TrainingProgressListener(String label, int epochBudget) {
        this.label = label;
        this.epochBudget = epochBudget;
    }

    @Override
    public void onStart(EarlyStoppingConfiguration<ComputationGraph> esConfig, ComputationGraph net) {
        logger.debug("[{}] Early stopping training started, budget {} epochs", label, epochBudget);
    }

    @Override
    public void onEpoch(int epochNum, double score, EarlyStoppingConfiguration<ComputationGraph> esConfig,
                        ComputationGraph net) {
        if ((epochNum + 1) % LOG_EVERY_EPOCHS == 0) {
            logger.info("[{}] Epoch {}/{} - validation loss: {}", label, epochNum + 1, epochBudget,
                    String.format("%.6f", score));
        }
    }

    @Override
    public void onCompletion(EarlyStoppingResult<ComputationGraph> esResult) {
        logger.info("[{}] Training finished after {} epochs ({}: {}), best epoch {} with loss {}",
                label, esResult.getTotalEpochs(), esResult.getTerminationReason(),
                esResult.getTerminationDetails(), esResult.getBestModelEpoch() + 1,
                String.format("%.6f", ModelTrainingService.bestValidationLoss(esResult)));
    }
}
