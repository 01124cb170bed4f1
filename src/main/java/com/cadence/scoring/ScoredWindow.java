package com.cadence.scoring;

import com.cadence.domain.CalibrationTransform;
import com.cadence.domain.ModelKind;
import com.cadence.domain.ScoreRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Raw ensemble output for one window together with the calibration transforms
 * of the profiles that produced it.
 */
public final class ScoredWindow {

    private final ScoreRecord record;
    private final Map<ModelKind, CalibrationTransform> transforms;

    public ScoredWindow(ScoreRecord record, Map<ModelKind, CalibrationTransform> transforms) {
        this.record = record;
        this.transforms = transforms.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(transforms));
    }

    public ScoreRecord getRecord() {
        return record;
    }

    /**
     * Transform of a scored model, identity when the profile carried none
     */
    public CalibrationTransform transformOf(ModelKind kind) {
        CalibrationTransform transform = transforms.get(kind);
        return transform == null ? CalibrationTransform.identity() : transform;
    }
}
