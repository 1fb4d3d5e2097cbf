package com.energyforecast.model;

import org.deeplearning4j.nn.conf.inputs.InputType;
import org.deeplearning4j.nn.conf.inputs.InvalidInputTypeException;
import org.deeplearning4j.nn.conf.layers.samediff.SameDiffLambdaVertex;
import org.nd4j.autodiff.samediff.SDVariable;
import org.nd4j.autodiff.samediff.SameDiff;

/**
 * 时间注意力上下文向量
 * 输入0: 循环层输出 [minibatch, units, time]；输入1: 注意力权重 [minibatch, 1, time]
 * 输出: 按时间加权后求平均 [minibatch, units]
 */
public class TemporalAttentionVertex extends SameDiffLambdaVertex {

    @Override
    public SDVariable defineVertex(SameDiff sameDiff, VertexInputs inputs) {
        SDVariable sequence = inputs.getInput(0);
        SDVariable weights = inputs.getInput(1);
        return sequence.mul(weights).mean(2);
    }

    @Override
    public InputType getOutputType(int layerIndex, InputType... vertexInputs) throws InvalidInputTypeException {
        if (vertexInputs.length != 2 || vertexInputs[0].getType() != InputType.Type.RNN) {
            throw new InvalidInputTypeException("Temporal attention expects a recurrent sequence and its weights");
        }
        InputType.InputTypeRecurrent sequence = (InputType.InputTypeRecurrent) vertexInputs[0];
        return InputType.feedForward(sequence.getSize());
    }
}
