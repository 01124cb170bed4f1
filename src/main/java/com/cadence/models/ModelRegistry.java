package com.cadence.models;

import com.cadence.config.EngineConfig;
import com.cadence.domain.ModelKind;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed set of scoring models, one per {@link ModelKind}.
 */
public class ModelRegistry {

    private final Map<ModelKind, ScoringModel> models;

    public ModelRegistry(Collection<? extends ScoringModel> models) {
        EnumMap<ModelKind, ScoringModel> byKind = new EnumMap<>(ModelKind.class);
        for (ScoringModel model : models) {
            if (byKind.put(model.kind(), model) != null) {
                throw new IllegalArgumentException("Duplicate model for kind " + model.kind());
            }
        }
        this.models = Collections.unmodifiableMap(byKind);
    }

    /**
     * The six-model ensemble used in production.
     */
    public static ModelRegistry standard(EngineConfig config) {
        return new ModelRegistry(List.of(
            new SequenceLikelihoodModel(config),
            new ReconstructionModel(config),
            new BoundaryModel(config),
            new NearestNeighborModel(config),
            new OnlineLinearModel(config),
            new IsolationForestModel(config)));
    }

    public ScoringModel get(ModelKind kind) {
        ScoringModel model = models.get(kind);
        if (model == null) {
            throw new IllegalArgumentException("No model registered for kind " + kind);
        }
        return model;
    }

    public Collection<ScoringModel> all() {
        return models.values();
    }

    public int size() {
        return models.size();
    }
}
