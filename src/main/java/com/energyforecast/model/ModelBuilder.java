package com.energyforecast.model;

import com.energyforecast.entity.HyperparameterConfig;
import org.deeplearning4j.nn.api.OptimizationAlgorithm;
import org.deeplearning4j.nn.conf.ComputationGraphConfiguration;
import org.deeplearning4j.nn.conf.ConvolutionMode;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.inputs.InputType;
import org.deeplearning4j.nn.conf.layers.Convolution1DLayer;
import org.deeplearning4j.nn.conf.layers.DropoutLayer;
import org.deeplearning4j.nn.conf.layers.LSTM;
import org.deeplearning4j.nn.conf.layers.Layer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.conf.layers.Subsampling1DLayer;
import org.deeplearning4j.nn.conf.layers.SubsamplingLayer;
import org.deeplearning4j.nn.conf.layers.recurrent.LastTimeStep;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.deeplearning4j.nn.weights.WeightInit;
import org.deeplearning4j.optimize.listeners.ScoreIterationListener;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 根据超参数构建未训练的网络
 * 先生成 {@link ArchitectureGraph} 描述，再翻译为 DL4J 计算图
 */
public class ModelBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ModelBuilder.class);

    public static final String INPUT = "input";
    public static final String OUTPUT = "output";
    public static final String ATTENTION_SCORE = "attention-score";
    public static final String ATTENTION_CONTEXT = "attention-context";

    static final int FEATURE_FILTERS = 64;
    static final int KERNEL_SIZE = 3;
    static final int POOL_FACTOR = 2;
    static final int HYBRID_RECURRENT_LAYERS = 3;

    private final ArchitectureVariant variant;
    private final int windowLength;
    private final double learningRate;

    public ModelBuilder(ArchitectureVariant variant, int windowLength, double learningRate) {
        if (windowLength < 1) {
            throw new IllegalArgumentException("windowLength must be >= 1");
        }
        if (variant == ArchitectureVariant.HYBRID && windowLength < POOL_FACTOR) {
            throw new IllegalArgumentException("Hybrid architecture needs a window of at least " + POOL_FACTOR + " steps");
        }
        if (!(learningRate > 0.0)) {
            throw new IllegalArgumentException("learningRate must be positive");
        }
        this.variant = variant;
        this.windowLength = windowLength;
        this.learningRate = learningRate;
    }

    /**
     * 生成网络结构描述
     */
    public ArchitectureGraph describe(HyperparameterConfig config) {
        List<StageDescriptor> stages = variant == ArchitectureVariant.HYBRID
                ? describeHybrid(config)
                : describeBasic(config);
        return new ArchitectureGraph(variant, windowLength, stages);
    }

    private List<StageDescriptor> describeBasic(HyperparameterConfig config) {
        int units = config.getRecurrentUnits();
        double dropout = config.getDropoutRate();
        List<StageDescriptor> stages = new ArrayList<>();

        StageDescriptor first = StageDescriptor.recurrent("recurrent-1", INPUT, units, windowLength);
        stages.add(first);
        String previous = appendDropout(stages, "dropout-1", first, dropout);

        StageDescriptor second = StageDescriptor.recurrentLastStep("recurrent-2", previous, units);
        stages.add(second);
        previous = appendDropout(stages, "dropout-2", second, dropout);

        stages.add(StageDescriptor.denseOutput(OUTPUT, previous));
        return stages;
    }

    private List<StageDescriptor> describeHybrid(HyperparameterConfig config) {
        int units = config.getRecurrentUnits();
        double dropout = config.getDropoutRate();
        List<StageDescriptor> stages = new ArrayList<>();

        // 特征提取
        StageDescriptor conv = StageDescriptor.convolution("feature-conv", StageKind.CONVOLUTION, INPUT,
                FEATURE_FILTERS, KERNEL_SIZE, Activation.RELU, windowLength);
        stages.add(conv);
        StageDescriptor pool = StageDescriptor.maxPool("feature-pool", conv.getName(), POOL_FACTOR,
                FEATURE_FILTERS, conv.getOutputTimesteps());
        stages.add(pool);

        // 三层 LSTM，均输出完整序列
        int timesteps = pool.getOutputTimesteps();
        String previous = pool.getName();
        for (int i = 1; i <= HYBRID_RECURRENT_LAYERS; i++) {
            StageDescriptor recurrent = StageDescriptor.recurrent("recurrent-" + i, previous, units, timesteps);
            stages.add(recurrent);
            previous = appendDropout(stages, "dropout-" + i, recurrent, dropout);
        }

        // 时间注意力
        String sequence = previous;
        StageDescriptor features = StageDescriptor.convolution("attention-features", StageKind.ATTENTION_FEATURES,
                sequence, FEATURE_FILTERS, KERNEL_SIZE, Activation.TANH, timesteps);
        stages.add(features);
        StageDescriptor score = StageDescriptor.convolution(ATTENTION_SCORE, StageKind.ATTENTION_SCORE,
                features.getName(), 1, 1, Activation.SIGMOID, timesteps);
        stages.add(score);
        stages.add(StageDescriptor.attentionContext(ATTENTION_CONTEXT, sequence, score.getName(), units));

        stages.add(StageDescriptor.denseOutput(OUTPUT, ATTENTION_CONTEXT));
        return stages;
    }

    /**
     * dropout 为0时不插入该阶段
     */
    private static String appendDropout(List<StageDescriptor> stages, String name, StageDescriptor input, double rate) {
        if (rate <= 0.0) {
            return input.getName();
        }
        stages.add(StageDescriptor.dropout(name, input.getName(), rate,
                input.getOutputChannels(), input.getOutputTimesteps()));
        return name;
    }

    /**
     * 将结构描述翻译为计算图配置
     */
    public ComputationGraphConfiguration buildConfiguration(ArchitectureGraph architecture, long seed) {
        ComputationGraphConfiguration.GraphBuilder graph = new NeuralNetConfiguration.Builder()
                .seed(seed)
                .dataType(DataType.DOUBLE)
                .optimizationAlgo(OptimizationAlgorithm.STOCHASTIC_GRADIENT_DESCENT)
                .updater(new Adam(learningRate))
                .weightInit(WeightInit.XAVIER)
                .graphBuilder()
                .addInputs(INPUT)
                .setInputTypes(InputType.recurrent(1, windowLength));

        for (StageDescriptor stage : architecture.getStages()) {
            String[] inputs = stage.getInputs().toArray(new String[0]);
            if (stage.getKind() == StageKind.ATTENTION_CONTEXT) {
                graph.addVertex(stage.getName(), new TemporalAttentionVertex(), inputs);
            } else {
                graph.addLayer(stage.getName(), toLayer(stage), inputs);
            }
        }

        return graph.setOutputs(OUTPUT).build();
    }

    private static Layer toLayer(StageDescriptor stage) {
        switch (stage.getKind()) {
            case CONVOLUTION:
            case ATTENTION_FEATURES:
            case ATTENTION_SCORE:
                return new Convolution1DLayer.Builder()
                        .kernelSize(stage.getKernelSize())
                        .stride(1)
                        .nOut(stage.getWidth())
                        .convolutionMode(ConvolutionMode.Same)
                        .activation(stage.getActivation())
                        .build();
            case MAX_POOL:
                return new Subsampling1DLayer.Builder(SubsamplingLayer.PoolingType.MAX)
                        .kernelSize(stage.getKernelSize())
                        .stride(stage.getWidth())
                        .build();
            case RECURRENT:
                return lstm(stage.getWidth());
            case RECURRENT_LAST_STEP:
                return new LastTimeStep(lstm(stage.getWidth()));
            case DROPOUT:
                // DL4J 的参数是保留概率
                return new DropoutLayer.Builder(1.0 - stage.getDropoutRate()).build();
            case DENSE_OUTPUT:
                return new OutputLayer.Builder(LossFunctions.LossFunction.MSE)
                        .nOut(stage.getWidth())
                        .activation(stage.getActivation())
                        .build();
            default:
                throw new IllegalArgumentException("Stage " + stage.getName() + " is not a layer");
        }
    }

    private static LSTM lstm(int units) {
        return new LSTM.Builder()
                .nOut(units)
                .activation(Activation.TANH)
                .gateActivationFunction(Activation.SIGMOID)
                .build();
    }

    /**
     * 构建并初始化网络
     */
    public ComputationGraph build(HyperparameterConfig config, long seed) {
        ArchitectureGraph architecture = describe(config);
        ComputationGraph model = new ComputationGraph(buildConfiguration(architecture, seed));
        model.init();
        model.setListeners(new ScoreIterationListener(100));

        logger.debug("Built {} model: {}", variant, architecture);
        logger.info("Model initialized with {} parameters (variant={}, units={}, dropout={})",
                model.numParams(), variant, config.getRecurrentUnits(), config.getDropoutRate());
        return model;
    }

    /**
     * 获取模型摘要
     */
    public static String getModelSummary(ComputationGraph model) {
        StringBuilder summary = new StringBuilder();
        summary.append("=== Forecast Model Summary ===\n");
        summary.append(String.format("Total Parameters: %,d%n", model.numParams()));
        summary.append(String.format("Number of Layers: %d%n", model.getNumLayers()));

        for (org.deeplearning4j.nn.api.Layer layer : model.getLayers()) {
            summary.append(String.format("Layer %d: %s - %s%n",
                    layer.getIndex(), layer.conf().getLayer().getLayerName(), layer.type()));
        }

        return summary.toString();
    }

    public ArchitectureVariant getVariant() {
        return variant;
    }

    public int getWindowLength() {
        return windowLength;
    }

    public double getLearningRate() {
        return learningRate;
    }
}
