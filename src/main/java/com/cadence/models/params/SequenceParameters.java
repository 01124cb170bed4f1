package com.cadence.models.params;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-feature first-order autoregressive transition model.
 *
 * Sequences longer than {@code sequenceLength} are truncated to their most recent
 * windows; shorter ones are left-padded by repeating their earliest window.
 */
public class SequenceParameters implements ModelParameters {

    public static final String PADDING_REPEAT_EARLIEST = "repeat-earliest";

    @JsonProperty("sequence_length")
    private int sequenceLength;

    @JsonProperty("padding")
    private String padding = PADDING_REPEAT_EARLIEST;

    @JsonProperty("ar_coefficients")
    private double[] arCoefficients;

    @JsonProperty("residual_std_devs")
    private double[] residualStdDevs;

    @JsonProperty("marginal_std_devs")
    private double[] marginalStdDevs;

    @JsonProperty("nll_median")
    private double nllMedian;

    @JsonProperty("nll_p95")
    private double nllP95;

    @Override
    public SequenceParameters copy() {
        SequenceParameters copy = new SequenceParameters();
        copy.sequenceLength = sequenceLength;
        copy.padding = padding;
        copy.arCoefficients = arCoefficients == null ? null : arCoefficients.clone();
        copy.residualStdDevs = residualStdDevs == null ? null : residualStdDevs.clone();
        copy.marginalStdDevs = marginalStdDevs == null ? null : marginalStdDevs.clone();
        copy.nllMedian = nllMedian;
        copy.nllP95 = nllP95;
        return copy;
    }

    public int getSequenceLength() {
        return sequenceLength;
    }

    public void setSequenceLength(int sequenceLength) {
        this.sequenceLength = sequenceLength;
    }

    public String getPadding() {
        return padding;
    }

    public void setPadding(String padding) {
        this.padding = padding;
    }

    public double[] getArCoefficients() {
        return arCoefficients;
    }

    public void setArCoefficients(double[] arCoefficients) {
        this.arCoefficients = arCoefficients;
    }

    public double[] getResidualStdDevs() {
        return residualStdDevs;
    }

    public void setResidualStdDevs(double[] residualStdDevs) {
        this.residualStdDevs = residualStdDevs;
    }

    public double[] getMarginalStdDevs() {
        return marginalStdDevs;
    }

    public void setMarginalStdDevs(double[] marginalStdDevs) {
        this.marginalStdDevs = marginalStdDevs;
    }

    public double getNllMedian() {
        return nllMedian;
    }

    public void setNllMedian(double nllMedian) {
        this.nllMedian = nllMedian;
    }

    public double getNllP95() {
        return nllP95;
    }

    public void setNllP95(double nllP95) {
        this.nllP95 = nllP95;
    }
}
