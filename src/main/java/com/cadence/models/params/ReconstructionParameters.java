package com.cadence.models.params;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Principal subspace of genuine standardized vectors and the training-time
 * reconstruction error distribution.
 */
public class ReconstructionParameters implements ModelParameters {

    @JsonProperty("components")
    private double[][] components;

    @JsonProperty("error_median")
    private double errorMedian;

    @JsonProperty("error_p95")
    private double errorP95;

    @Override
    public ReconstructionParameters copy() {
        ReconstructionParameters copy = new ReconstructionParameters();
        if (components != null) {
            copy.components = new double[components.length][];
            for (int i = 0; i < components.length; i++) {
                copy.components[i] = components[i].clone();
            }
        }
        copy.errorMedian = errorMedian;
        copy.errorP95 = errorP95;
        return copy;
    }

    public double[][] getComponents() {
        return components;
    }

    public void setComponents(double[][] components) {
        this.components = components;
    }

    public double getErrorMedian() {
        return errorMedian;
    }

    public void setErrorMedian(double errorMedian) {
        this.errorMedian = errorMedian;
    }

    public double getErrorP95() {
        return errorP95;
    }

    public void setErrorP95(double errorP95) {
        this.errorP95 = errorP95;
    }
}
