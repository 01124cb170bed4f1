package com.cadence.models.params;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded store of the most recent genuine vectors, oldest first.
 */
public class NearestNeighborParameters implements ModelParameters {

    @JsonProperty("capacity")
    private int capacity;

    @JsonProperty("k")
    private int k;

    @JsonProperty("typical_distance")
    private double typicalDistance;

    @JsonProperty("vectors")
    private List<double[]> vectors = new ArrayList<>();

    @Override
    public NearestNeighborParameters copy() {
        NearestNeighborParameters copy = new NearestNeighborParameters();
        copy.capacity = capacity;
        copy.k = k;
        copy.typicalDistance = typicalDistance;
        copy.vectors = new ArrayList<>(vectors.size());
        for (double[] vector : vectors) {
            copy.vectors.add(vector.clone());
        }
        return copy;
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public int getK() {
        return k;
    }

    public void setK(int k) {
        this.k = k;
    }

    public double getTypicalDistance() {
        return typicalDistance;
    }

    public void setTypicalDistance(double typicalDistance) {
        this.typicalDistance = typicalDistance;
    }

    public List<double[]> getVectors() {
        return vectors;
    }

    public void setVectors(List<double[]> vectors) {
        this.vectors = vectors;
    }
}
