package com.cadence.models;

import com.cadence.config.EngineConfig;
import com.cadence.domain.FeatureWindow;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ModelProfile;
import com.cadence.models.params.IsolationParameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest. Points that are isolated with few random splits are
 * anomalous; the usual anomaly score {@code 2^(-E[h]/c(psi))} is inverted so
 * that short paths give low genuineness.
 */
public class IsolationForestModel implements ScoringModel {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final int treeCount;
    private final int sampleSize;

    public IsolationForestModel(EngineConfig config) {
        this.treeCount = config.getIsolationTrees();
        this.sampleSize = config.getIsolationSampleSize();
    }

    @Override
    public ModelKind kind() {
        return ModelKind.ISOLATION;
    }

    @Override
    public ModelProfile train(TrainingSet trainingSet) {
        int n = trainingSet.size();
        int psi = Math.min(sampleSize, n);
        int heightLimit = (int) Math.ceil(Math.log(psi) / Math.log(2.0));
        Random random = new Random(ModelSupport.seed(trainingSet.getUserId(), kind()));

        IsolationParameters parameters = new IsolationParameters();
        parameters.setSampleSize(psi);
        List<IsolationParameters.Tree> trees = new ArrayList<>(treeCount);
        for (int t = 0; t < treeCount; t++) {
            int[] sample = sample(n, psi, random);
            TreeBuilder builder = new TreeBuilder(trainingSet, random, heightLimit);
            builder.grow(sample, 0);
            trees.add(builder.toTree());
        }
        parameters.setTrees(trees);
        return ModelSupport.newProfile(kind(), trainingSet, parameters);
    }

    @Override
    public double score(ModelProfile profile, List<FeatureWindow> recent) {
        IsolationParameters parameters = ModelSupport.requireParameters(profile, kind(), IsolationParameters.class);
        double[] z = ModelSupport.standardize(profile, recent.get(recent.size() - 1));
        if (parameters.getTrees().isEmpty()) {
            throw new ModelUntrainedException(profile.getUserId(), kind());
        }
        double total = 0.0;
        for (IsolationParameters.Tree tree : parameters.getTrees()) {
            total += pathLength(tree, z);
        }
        double meanPath = total / parameters.getTrees().size();
        double normalizer = averagePathLength(parameters.getSampleSize());
        if (normalizer <= 0) {
            return 1.0;
        }
        double anomaly = Math.pow(2.0, -meanPath / normalizer);
        return ModelSupport.clampUnit(1.0 - anomaly);
    }

    private double pathLength(IsolationParameters.Tree tree, double[] z) {
        return pathLength(tree, z, 0, 0);
    }

    /**
     * A split on a missing feature follows both branches, weighted by the
     * training points each one holds.
     */
    private double pathLength(IsolationParameters.Tree tree, double[] z, int node, int depth) {
        int[] feature = tree.getFeature();
        int[] size = tree.getSize();
        while (feature[node] >= 0) {
            if (feature[node] >= z.length) {
                throw new ModelScoreException(kind(), "Tree split on feature " + feature[node]
                    + " outside a " + z.length + "-feature vector");
            }
            double value = z[feature[node]];
            if (Double.isNaN(value)) {
                int left = tree.getLeft()[node];
                int right = tree.getRight()[node];
                double leftWeight = size[left];
                double rightWeight = size[right];
                double total = leftWeight + rightWeight;
                if (total <= 0) {
                    leftWeight = 1.0;
                    rightWeight = 1.0;
                    total = 2.0;
                }
                return (leftWeight * pathLength(tree, z, left, depth + 1)
                    + rightWeight * pathLength(tree, z, right, depth + 1)) / total;
            }
            node = value < tree.getThreshold()[node] ? tree.getLeft()[node] : tree.getRight()[node];
            depth++;
        }
        return depth + averagePathLength(size[node]);
    }

    /**
     * Expected path length of an unsuccessful search in a binary tree of {@code n} points
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    private static int[] sample(int n, int psi, Random random) {
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < psi; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] result = new int[psi];
        System.arraycopy(indices, 0, result, 0, psi);
        return result;
    }

    private static final class TreeBuilder {

        private final TrainingSet trainingSet;
        private final Random random;
        private final int heightLimit;
        private final List<Integer> feature = new ArrayList<>();
        private final List<Double> threshold = new ArrayList<>();
        private final List<Integer> left = new ArrayList<>();
        private final List<Integer> right = new ArrayList<>();
        private final List<Integer> size = new ArrayList<>();

        TreeBuilder(TrainingSet trainingSet, Random random, int heightLimit) {
            this.trainingSet = trainingSet;
            this.random = random;
            this.heightLimit = heightLimit;
        }

        int grow(int[] points, int depth) {
            int node = feature.size();
            feature.add(-1);
            threshold.add(0.0);
            left.add(-1);
            right.add(-1);
            size.add(points.length);
            if (depth >= heightLimit || points.length <= 1) {
                return node;
            }

            int d = trainingSet.featureCount();
            int start = random.nextInt(d);
            for (int attempt = 0; attempt < d; attempt++) {
                int q = (start + attempt) % d;
                double min = Double.POSITIVE_INFINITY;
                double max = Double.NEGATIVE_INFINITY;
                for (int p : points) {
                    double v = trainingSet.row(p)[q];
                    min = Math.min(min, v);
                    max = Math.max(max, v);
                }
                if (max > min) {
                    double split = min + random.nextDouble() * (max - min);
                    int below = 0;
                    for (int p : points) {
                        if (trainingSet.row(p)[q] < split) {
                            below++;
                        }
                    }
                    if (below == 0 || below == points.length) {
                        continue;
                    }
                    int[] lower = new int[below];
                    int[] upper = new int[points.length - below];
                    int li = 0;
                    int ui = 0;
                    for (int p : points) {
                        if (trainingSet.row(p)[q] < split) {
                            lower[li++] = p;
                        } else {
                            upper[ui++] = p;
                        }
                    }
                    feature.set(node, q);
                    threshold.set(node, split);
                    left.set(node, grow(lower, depth + 1));
                    right.set(node, grow(upper, depth + 1));
                    return node;
                }
            }
            return node;
        }

        IsolationParameters.Tree toTree() {
            int nodes = feature.size();
            int[] f = new int[nodes];
            double[] t = new double[nodes];
            int[] l = new int[nodes];
            int[] r = new int[nodes];
            int[] s = new int[nodes];
            for (int i = 0; i < nodes; i++) {
                f[i] = feature.get(i);
                t[i] = threshold.get(i);
                l[i] = left.get(i);
                r[i] = right.get(i);
                s[i] = size.get(i);
            }
            return new IsolationParameters.Tree(f, t, l, r, s);
        }
    }
}
