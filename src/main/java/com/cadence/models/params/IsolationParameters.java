package com.cadence.models.params;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Forest of isolation trees, each stored as flat node arrays.
 */
public class IsolationParameters implements ModelParameters {

    @JsonProperty("sample_size")
    private int sampleSize;

    @JsonProperty("trees")
    private List<Tree> trees = new ArrayList<>();

    @Override
    public IsolationParameters copy() {
        IsolationParameters copy = new IsolationParameters();
        copy.sampleSize = sampleSize;
        copy.trees = new ArrayList<>(trees.size());
        for (Tree tree : trees) {
            copy.trees.add(tree.copy());
        }
        return copy;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public List<Tree> getTrees() {
        return trees;
    }

    public void setTrees(List<Tree> trees) {
        this.trees = trees;
    }

    /**
     * Node {@code i} is a leaf when {@code feature[i] < 0}; {@code size[i]} is then
     * the number of training points that reached it.
     */
    public static class Tree {

        @JsonProperty("feature")
        private int[] feature;

        @JsonProperty("threshold")
        private double[] threshold;

        @JsonProperty("left")
        private int[] left;

        @JsonProperty("right")
        private int[] right;

        @JsonProperty("size")
        private int[] size;

        public Tree() {
        }

        public Tree(int[] feature, double[] threshold, int[] left, int[] right, int[] size) {
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        public Tree copy() {
            return new Tree(feature.clone(), threshold.clone(), left.clone(), right.clone(), size.clone());
        }

        public int[] getFeature() {
            return feature;
        }

        public void setFeature(int[] feature) {
            this.feature = feature;
        }

        public double[] getThreshold() {
            return threshold;
        }

        public void setThreshold(double[] threshold) {
            this.threshold = threshold;
        }

        public int[] getLeft() {
            return left;
        }

        public void setLeft(int[] left) {
            this.left = left;
        }

        public int[] getRight() {
            return right;
        }

        public void setRight(int[] right) {
            this.right = right;
        }

        public int[] getSize() {
            return size;
        }

        public void setSize(int[] size) {
            this.size = size;
        }
    }
}
