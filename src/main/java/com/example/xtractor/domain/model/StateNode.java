package com.example.xtractor.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top level of the boundary hierarchy. Owns its LGAs exclusively and keeps them in first-seen order.
 */
public final class StateNode {

    private final String name;
    private final List<LgaNode> lgas = new ArrayList<>();

    public StateNode(String name) {
        this.name = name;
    }

    /**
     * Rebuilds a state from its serialized form.
     *
     * @param name state name
     * @param lgas LGAs in document order (may be {@code null})
     */
    @JsonCreator
    public StateNode(@JsonProperty("name") String name,
                     @JsonProperty("lgas") List<LgaNode> lgas) {
        this(name);
        if (lgas != null) {
            this.lgas.addAll(lgas);
        }
    }

    @JsonProperty("name")
    public String name() {
        return name;
    }

    @JsonProperty("lgas")
    public List<LgaNode> lgas() {
        return Collections.unmodifiableList(lgas);
    }

    public void addLga(LgaNode lga) {
        lgas.add(lga);
    }

    /**
     * @return {@code true} when at least one LGA was attached
     */
    @JsonIgnore
    public boolean isPopulated() {
        return !lgas.isEmpty();
    }

    @Override
    public String toString() {
        return name;
    }
}
