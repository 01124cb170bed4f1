package com.cadence.storage;

import com.cadence.domain.ModelKind;

/**
 * Raised when a persisted profile or drift state exists but cannot be read back.
 */
public class ModelLoadException extends RuntimeException {

    private final String userId;
    private final ModelKind modelKind;

    public ModelLoadException(String userId, ModelKind modelKind, String message, Throwable cause) {
        super(message, cause);
        this.userId = userId;
        this.modelKind = modelKind;
    }

    public ModelLoadException(String userId, ModelKind modelKind, String message) {
        this(userId, modelKind, message, null);
    }

    public String getUserId() {
        return userId;
    }

    public ModelKind getModelKind() {
        return modelKind;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        sb.append(" [user: ").append(userId);
        if (modelKind != null) {
            sb.append(", model: ").append(modelKind);
        }
        sb.append("]");
        if (getCause() != null) {
            sb.append(": ").append(getCause().getMessage());
        }
        return sb.toString();
    }
}
