package com.energyforecast.dao;

import com.energyforecast.entity.HyperparameterConfig;
import com.energyforecast.entity.ModelArtifact;
import com.energyforecast.exception.ModelArtifactNotFoundException;
import com.energyforecast.model.ArchitectureVariant;
import com.energyforecast.model.ModelBuilder;
import com.energyforecast.util.MinMaxScaler;
import org.deeplearning4j.nn.graph.ComputationGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class FileModelRepositoryTest {

    @TempDir
    Path root;

    private void assertRoundTrip(ArchitectureVariant variant, int windowLength) {
        HyperparameterConfig config = new HyperparameterConfig(4, 0.2, 16, 3);
        ComputationGraph network = new ModelBuilder(variant, windowLength, 0.001).build(config, 5L);
        MinMaxScaler scaler = MinMaxScaler.restore(9000.0, 15000.0);
        ModelArtifact artifact = new ModelArtifact(network, config, scaler, Arrays.asList(0.3, 0.2, Double.NaN));

        FileModelRepository repository = new FileModelRepository(root);
        assertFalse(repository.exists("AEP"));
        repository.save("AEP", artifact);
        assertTrue(repository.exists("AEP"));

        ModelArtifact loaded = repository.load("AEP");
        assertEquals(config, loaded.getConfig());
        assertEquals(9000.0, loaded.getScaler().getDataMin(), 0.0);
        assertEquals(15000.0, loaded.getScaler().getDataMax(), 0.0);
        assertEquals(3, loaded.getLossHistory().size());
        assertEquals(0.3, loaded.getLossHistory().get(0), 0.0);
        assertTrue(Double.isNaN(loaded.getLossHistory().get(2)));

        INDArray input = Nd4j.rand(DataType.DOUBLE, 3, 1, windowLength);
        assertEquals(network.outputSingle(input), loaded.getNetwork().outputSingle(input));
    }

    @Test
    void testBasicRoundTrip() {
        assertRoundTrip(ArchitectureVariant.BASIC, 6);
    }

    @Test
    void testHybridRoundTrip() {
        assertRoundTrip(ArchitectureVariant.HYBRID, 8);
    }

    @Test
    void testMissingArtifact() {
        ModelArtifactNotFoundException e = assertThrows(ModelArtifactNotFoundException.class,
                () -> new FileModelRepository(root).load("NOPE"));
        assertEquals("MODEL_NOT_FOUND", e.getErrorCode());
    }
}
