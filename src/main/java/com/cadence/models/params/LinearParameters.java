package com.cadence.models.params;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weight vector of the passive-aggressive classifier; the last entry is the bias.
 */
public class LinearParameters implements ModelParameters {

    @JsonProperty("weights")
    private double[] weights;

    @JsonProperty("aggressiveness")
    private double aggressiveness;

    @JsonProperty("updates")
    private long updates;

    @JsonProperty("seed")
    private long seed;

    @Override
    public LinearParameters copy() {
        LinearParameters copy = new LinearParameters();
        copy.weights = weights == null ? null : weights.clone();
        copy.aggressiveness = aggressiveness;
        copy.updates = updates;
        copy.seed = seed;
        return copy;
    }

    public double[] getWeights() {
        return weights;
    }

    public void setWeights(double[] weights) {
        this.weights = weights;
    }

    public double getAggressiveness() {
        return aggressiveness;
    }

    public void setAggressiveness(double aggressiveness) {
        this.aggressiveness = aggressiveness;
    }

    public long getUpdates() {
        return updates;
    }

    public void setUpdates(long updates) {
        this.updates = updates;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }
}
