package com.cadence.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-user affine map applied to a model's raw score before aggregation.
 * Results are clamped to [0, 1].
 */
public class CalibrationTransform {

    @JsonProperty("slope")
    private double slope = 1.0;

    @JsonProperty("intercept")
    private double intercept = 0.0;

    public CalibrationTransform() {
    }

    public CalibrationTransform(double slope, double intercept) {
        this.slope = slope;
        this.intercept = intercept;
    }

    public static CalibrationTransform identity() {
        return new CalibrationTransform(1.0, 0.0);
    }

    public double apply(double raw) {
        double calibrated = slope * raw + intercept;
        if (Double.isNaN(calibrated)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, calibrated));
    }

    public double getSlope() {
        return slope;
    }

    public void setSlope(double slope) {
        this.slope = slope;
    }

    public double getIntercept() {
        return intercept;
    }

    public void setIntercept(double intercept) {
        this.intercept = intercept;
    }

    @Override
    public String toString() {
        return "CalibrationTransform{slope=" + slope + ", intercept=" + intercept + "}";
    }
}
