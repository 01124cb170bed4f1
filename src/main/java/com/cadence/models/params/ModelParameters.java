package com.cadence.models.params;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Model-specific learned state stored inside a model profile.
 * The concrete type is recorded in the serialized form.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SequenceParameters.class, name = "sequence"),
    @JsonSubTypes.Type(value = ReconstructionParameters.class, name = "reconstruction"),
    @JsonSubTypes.Type(value = BoundaryParameters.class, name = "boundary"),
    @JsonSubTypes.Type(value = NearestNeighborParameters.class, name = "nearest_neighbor"),
    @JsonSubTypes.Type(value = LinearParameters.class, name = "online_linear"),
    @JsonSubTypes.Type(value = IsolationParameters.class, name = "isolation")
})
public interface ModelParameters {

    /**
     * Deep copy, so a published profile is never modified in place
     */
    ModelParameters copy();
}
