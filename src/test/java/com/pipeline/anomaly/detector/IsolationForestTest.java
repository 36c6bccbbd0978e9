package com.pipeline.anomaly.detector;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IsolationForestTest {

    @Test
    void averagePathLengthMatchesKnownValues() {
        assertEquals(0.0, IsolationTree.averagePathLength(1));
        assertEquals(1.0, IsolationTree.averagePathLength(2));
        // c(256) ≈ 10.24
        assertEquals(10.24, IsolationTree.averagePathLength(256), 0.01);
    }

    @Test
    void isolatedPointScoresHigherThanClusterPoints() {
        double[][] data = new double[51][];
        Random jitter = new Random(4);
        for (int i = 0; i < 50; i++) {
            data[i] = new double[]{23.0 + jitter.nextGaussian() * 0.5, 60.0 + jitter.nextGaussian() * 0.5};
        }
        data[50] = new double[]{80.0, 5.0};

        IsolationForest forest = IsolationForest.fit(data, 100, 256, new Random(42));
        double[] scores = forest.scoreAll(data);

        for (int i = 0; i < 50; i++) {
            assertTrue(scores[50] > scores[i], "outlier should outscore point " + i);
        }
        assertTrue(scores[50] > 0.6);
    }

    @Test
    void subSampleSizeIsCappedByData() {
        double[][] data = {{1, 1}, {2, 2}, {3, 3}, {4, 4}};

        IsolationForest forest = IsolationForest.fit(data, 10, 256, new Random(1));

        assertEquals(4, forest.getSampleSize());
        assertEquals(10, forest.getTreeCount());
    }

    @Test
    void identicalPointsScoreIdentically() {
        double[][] data = new double[20][];
        for (int i = 0; i < data.length; i++) {
            data[i] = new double[]{23.0, 60.0};
        }

        double[] scores = IsolationForest.fit(data, 50, 256, new Random(7)).scoreAll(data);

        for (double score : scores) {
            assertEquals(scores[0], score);
        }
    }

    @Test
    void rejectsTooFewSamples() {
        assertThrows(IllegalArgumentException.class,
                () -> IsolationForest.fit(new double[][]{{1, 2}}, 10, 256, new Random()));
    }
}
