package dev.pathways.model;

import java.util.Map;

/**
 * A procedure is a flow of steps carrying all of its variants, such as a recipe with
 * vegan and quick versions.
 */
public record Procedure(
    String id,
    String label,
    String description,
    Map<Integer, String> slotNames, // empty when the file declares no slot names
    Flow flow,
    WalkLimits limits
) {}
