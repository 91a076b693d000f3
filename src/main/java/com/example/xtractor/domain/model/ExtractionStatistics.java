package com.example.xtractor.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Summary counts derived from a {@link BoundaryDocument}.
 * Only states that own at least one LGA are counted and listed.
 */
public record ExtractionStatistics(
        @JsonProperty("total_states") int totalStates,
        @JsonProperty("total_lgas") int totalLgas,
        @JsonProperty("total_wards") int totalWards,
        @JsonProperty("states") List<String> states
) {

    /**
     * Walks the document and computes the counts.
     *
     * @param document extracted document
     * @return statistics for the document
     */
    public static ExtractionStatistics of(BoundaryDocument document) {
        List<StateNode> populated = document.states().stream()
                .filter(StateNode::isPopulated)
                .toList();
        int lgas = document.states().stream()
                .mapToInt(state -> state.lgas().size())
                .sum();
        int wards = document.states().stream()
                .flatMap(state -> state.lgas().stream())
                .mapToInt(lga -> lga.wards().size())
                .sum();
        return new ExtractionStatistics(
                populated.size(),
                lgas,
                wards,
                populated.stream().map(StateNode::name).toList()
        );
    }
}
