package com.example.xtractor.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Local government area owned by a single {@link StateNode}.
 * Wards are kept in first-seen order; the node only grows by appending children.
 */
public final class LgaNode {

    private final String name;
    private final String code;
    private final List<WardNode> wards = new ArrayList<>();

    /**
     * Creates an empty LGA.
     *
     * @param name normalized LGA name
     * @param code LGA code as printed in the source, or a generated fallback
     */
    public LgaNode(String name, String code) {
        this.name = name;
        this.code = code;
    }

    /**
     * Rebuilds an LGA from its serialized form.
     *
     * @param name  LGA name
     * @param code  LGA code
     * @param wards wards in document order (may be {@code null})
     */
    @JsonCreator
    public LgaNode(@JsonProperty("name") String name,
                   @JsonProperty("code") String code,
                   @JsonProperty("wards") List<WardNode> wards) {
        this(name, code);
        if (wards != null) {
            this.wards.addAll(wards);
        }
    }

    @JsonProperty("name")
    public String name() {
        return name;
    }

    @JsonProperty("code")
    public String code() {
        return code;
    }

    /**
     * @return read-only view of the wards in insertion order
     */
    @JsonProperty("wards")
    public List<WardNode> wards() {
        return Collections.unmodifiableList(wards);
    }

    /**
     * Appends a ward. Callers are responsible for duplicate rejection.
     *
     * @param ward ward to attach
     */
    public void addWard(WardNode ward) {
        wards.add(ward);
    }

    @Override
    public String toString() {
        return name + " (" + code + ")";
    }
}
