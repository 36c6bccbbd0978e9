package com.pipeline.anomaly.detector;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 隔离森林：由多棵随机切分树组成的无监督离群点模型。
 *
 * 越容易被随机切分隔离（平均路径越短）的点越异常。异常分数
 * s(x) = 2^(-E[h(x)] / c(ψ))，取值 (0, 1]，越接近1越异常；ψ 为每棵树的子采样大小。
 *
 * 模型实例只在拟合它的数据上有意义，拟合后不可变。
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final double normalizer;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
        this.normalizer = IsolationTree.averagePathLength(sampleSize);
    }

    /**
     * 在给定数据上拟合森林。
     *
     * @param data       特征矩阵，每行一个样本，至少2行且列数一致
     * @param numTrees   树的数量
     * @param maxSamples 每棵树的子采样上限，实际取 min(maxSamples, 行数)
     * @param random     随机源
     */
    public static IsolationForest fit(double[][] data, int numTrees, int maxSamples, Random random) {
        if (data.length < 2) {
            throw new IllegalArgumentException("Isolation forest needs at least 2 samples, got: " + data.length);
        }
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be >= 1, got: " + numTrees);
        }
        if (maxSamples < 2) {
            throw new IllegalArgumentException("maxSamples must be >= 2, got: " + maxSamples);
        }

        int sampleSize = Math.min(maxSamples, data.length);
        int heightLimit = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));

        int[] all = new int[data.length];
        for (int i = 0; i < all.length; i++) all[i] = i;

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int t = 0; t < numTrees; t++) {
            int[] sample = subSample(all, sampleSize, random);
            trees.add(IsolationTree.build(sample, data, heightLimit, random));
        }
        return new IsolationForest(trees, sampleSize);
    }

    /** 无放回子采样；样本量不超过上限时使用全部数据 */
    private static int[] subSample(int[] all, int size, Random random) {
        int[] pool = all.clone();
        if (size >= pool.length) {
            return pool;
        }
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(pool.length - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(pool, 0, sample, 0, size);
        return sample;
    }

    /** 单个样本的异常分数 */
    public double score(double[] point) {
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        double meanPath = total / trees.size();
        return Math.pow(2.0, -meanPath / normalizer);
    }

    public double[] scoreAll(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = score(data[i]);
        }
        return scores;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getTreeCount() {
        return trees.size();
    }
}
