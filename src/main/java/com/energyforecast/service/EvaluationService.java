package com.energyforecast.service;

import com.energyforecast.entity.EvaluationResult;
import com.energyforecast.entity.WindowSet;
import com.energyforecast.exception.InsufficientDataException;
import com.energyforecast.util.EvaluationMetrics;
import com.energyforecast.util.MinMaxScaler;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class EvaluationService {
    private static final Logger logger = LoggerFactory.getLogger(EvaluationService.class);

    /**
     * 在归一化空间计算 MAE / RMSE / R²
     */
    public EvaluationResult evaluate(ComputationGraph model, WindowSet test) {
        INDArray predictions = predict(model, test);
        return score(predictions, test.getLabels());
    }

    /**
     * 先反归一化预测值与真实值，再在原始负荷单位下计算指标
     */
    public EvaluationResult evaluateInOriginalUnits(ComputationGraph model, WindowSet test, MinMaxScaler scaler) {
        INDArray predictions = scaler.inverseTransformCopy(predict(model, test));
        INDArray actuals = scaler.inverseTransformCopy(test.getLabels());
        return score(predictions, actuals);
    }

    /**
     * 对测试窗口做推理，返回 [n, 1]
     */
    public INDArray predict(ComputationGraph model, WindowSet test) {
        if (test == null || test.isEmpty()) {
            throw new InsufficientDataException("Test set is empty");
        }
        return model.outputSingle(test.getFeatures()).reshape(test.size(), 1);
    }

    EvaluationResult score(INDArray predictions, INDArray actuals) {
        double mae = EvaluationMetrics.calculateMAE(predictions, actuals);
        double rmse = EvaluationMetrics.calculateRMSE(predictions, actuals);
        double r2 = EvaluationMetrics.calculateR2(predictions, actuals);

        EvaluationResult result = new EvaluationResult(mae, rmse, r2);
        logger.info("Evaluation on {} windows: {}", actuals.size(0), result);
        return result;
    }
}
