package com.cadence.models;

import com.cadence.domain.ModelKind;

/**
 * Exception thrown when a window cannot be scored against a trained profile,
 * typically because its dimensionality does not match the profile
 */
public class ModelScoreException extends RuntimeException {

    private final ModelKind modelKind;
    private final int expectedDimension;
    private final int actualDimension;

    public ModelScoreException(ModelKind modelKind, int expectedDimension, int actualDimension) {
        super("Feature dimension mismatch");
        this.modelKind = modelKind;
        this.expectedDimension = expectedDimension;
        this.actualDimension = actualDimension;
    }

    public ModelScoreException(ModelKind modelKind, String message) {
        super(message);
        this.modelKind = modelKind;
        this.expectedDimension = -1;
        this.actualDimension = -1;
    }

    public ModelKind getModelKind() {
        return modelKind;
    }

    public int getExpectedDimension() {
        return expectedDimension;
    }

    public int getActualDimension() {
        return actualDimension;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (modelKind != null) {
            sb.append(" [Model: ").append(modelKind).append("]");
        }
        if (expectedDimension >= 0) {
            sb.append(" [Expected: ").append(expectedDimension)
                .append(", Actual: ").append(actualDimension).append("]");
        }
        return sb.toString();
    }
}
