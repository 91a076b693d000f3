package com.example.xtractor.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Nested State / LGA / Ward document produced by one extraction run.
 * Serializes to the {@code states/lgas/wards} JSON layout consumed by downstream loaders.
 */
public final class BoundaryDocument {

    private final List<StateNode> states = new ArrayList<>();

    public BoundaryDocument() {
    }

    /**
     * Rebuilds a document from its serialized form.
     *
     * @param states states in document order (may be {@code null})
     */
    @JsonCreator
    public BoundaryDocument(@JsonProperty("states") List<StateNode> states) {
        if (states != null) {
            this.states.addAll(states);
        }
    }

    @JsonProperty("states")
    public List<StateNode> states() {
        return Collections.unmodifiableList(states);
    }

    public void addState(StateNode state) {
        states.add(state);
    }
}
