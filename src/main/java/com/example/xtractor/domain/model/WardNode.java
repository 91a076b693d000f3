package com.example.xtractor.domain.model;

/**
 * Leaf of the boundary hierarchy: a ward owned by exactly one {@link LgaNode}.
 * Names and codes are already normalized (trimmed, upper-cased) when the node is created.
 */
public record WardNode(
        String name,
        String code
) {
}
