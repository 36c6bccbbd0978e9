package com.pipeline.anomaly.detector;

import java.util.Random;

/**
 * 单棵隔离树。
 * 每个内部节点随机选择一个在当前样本上非常量的特征，并在该特征的
 * [min, max) 区间内均匀抽取切分值，小于等于切分值的样本进入左子树；
 * 达到高度上限或样本无法再切分时成为叶子。
 */
final class IsolationTree {

    private final Node root;

    private IsolationTree(Node root) {
        this.root = root;
    }

    /**
     * 在给定样本上构建一棵隔离树。
     *
     * @param samples     样本下标（引用 data 的行），构建过程中会被原地重排
     * @param data        全部特征矩阵
     * @param heightLimit 树高上限
     * @param random      随机源
     */
    static IsolationTree build(int[] samples, double[][] data, int heightLimit, Random random) {
        return new IsolationTree(grow(samples, 0, samples.length, data, 0, heightLimit, random));
    }

    private static Node grow(int[] idx, int from, int to, double[][] data,
                             int depth, int heightLimit, Random random) {
        int size = to - from;
        if (depth >= heightLimit || size <= 1) {
            return Node.leaf(size);
        }

        int features = data[idx[from]].length;
        double[] min = new double[features];
        double[] max = new double[features];
        for (int f = 0; f < features; f++) {
            min[f] = Double.POSITIVE_INFINITY;
            max[f] = Double.NEGATIVE_INFINITY;
        }
        for (int i = from; i < to; i++) {
            double[] row = data[idx[i]];
            for (int f = 0; f < features; f++) {
                if (row[f] < min[f]) min[f] = row[f];
                if (row[f] > max[f]) max[f] = row[f];
            }
        }

        // 仅在非常量特征上切分；全部为常量时无法再隔离
        int[] candidates = new int[features];
        int candidateCount = 0;
        for (int f = 0; f < features; f++) {
            if (max[f] > min[f]) candidates[candidateCount++] = f;
        }
        if (candidateCount == 0) {
            return Node.leaf(size);
        }

        int feature = candidates[random.nextInt(candidateCount)];
        double split = min[feature] + random.nextDouble() * (max[feature] - min[feature]);
        if (split >= max[feature]) {
            split = min[feature];
        }

        // 原地划分：左侧 <= split，右侧 > split
        int mid = from;
        for (int i = from; i < to; i++) {
            if (data[idx[i]][feature] <= split) {
                int tmp = idx[i];
                idx[i] = idx[mid];
                idx[mid] = tmp;
                mid++;
            }
        }
        // split 落在 [min, max) 内，最小值在左、最大值在右，两侧均非空
        Node left = grow(idx, from, mid, data, depth + 1, heightLimit, random);
        Node right = grow(idx, mid, to, data, depth + 1, heightLimit, random);
        return Node.internal(feature, split, left, right);
    }

    /**
     * 样本点的路径长度：到达叶子的边数，加上叶子内剩余样本的平均路径长度修正。
     */
    double pathLength(double[] point) {
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.feature] <= node.split ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * 在 n 个样本上构建的二叉搜索树中，一次不成功查找的平均路径长度 c(n)。
     */
    static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + 0.5772156649015329;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static final class Node {
        final int feature;
        final double split;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double split, Node left, Node right, int size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, null, null, size);
        }

        static Node internal(int feature, double split, Node left, Node right) {
            return new Node(feature, split, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
