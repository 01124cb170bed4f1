package com.cadence.models;

import com.cadence.domain.ModelKind;

/**
 * Exception thrown when a model is asked to score without a trained profile,
 * or when no model at all is available to score a window
 */
public class ModelUntrainedException extends RuntimeException {

    private final String userId;
    private final ModelKind modelKind;

    public ModelUntrainedException(String userId, ModelKind modelKind) {
        super("Model " + modelKind + " has no trained profile for user: " + userId);
        this.userId = userId;
        this.modelKind = modelKind;
    }

    public ModelUntrainedException(String message) {
        super(message);
        this.userId = null;
        this.modelKind = null;
    }

    public String getUserId() {
        return userId;
    }

    public ModelKind getModelKind() {
        return modelKind;
    }
}
