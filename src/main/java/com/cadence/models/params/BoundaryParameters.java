package com.cadence.models.params;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hypersphere enclosing the genuine vectors.
 */
public class BoundaryParameters implements ModelParameters {

    @JsonProperty("center")
    private double[] center;

    @JsonProperty("scales")
    private double[] scales;

    @JsonProperty("radius")
    private double radius;

    @JsonProperty("steepness")
    private double steepness;

    @Override
    public BoundaryParameters copy() {
        BoundaryParameters copy = new BoundaryParameters();
        copy.center = center == null ? null : center.clone();
        copy.scales = scales == null ? null : scales.clone();
        copy.radius = radius;
        copy.steepness = steepness;
        return copy;
    }

    public double[] getCenter() {
        return center;
    }

    public void setCenter(double[] center) {
        this.center = center;
    }

    public double[] getScales() {
        return scales;
    }

    public void setScales(double[] scales) {
        this.scales = scales;
    }

    public double getRadius() {
        return radius;
    }

    public void setRadius(double radius) {
        this.radius = radius;
    }

    public double getSteepness() {
        return steepness;
    }

    public void setSteepness(double steepness) {
        this.steepness = steepness;
    }
}
