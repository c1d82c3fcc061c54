package de.julielab.kgraph.datarepresentation;

/**
 * The direction in which relationships are followed from an entity.
 */
public enum Direction {
    OUTGOING, INCOMING, BOTH
}
