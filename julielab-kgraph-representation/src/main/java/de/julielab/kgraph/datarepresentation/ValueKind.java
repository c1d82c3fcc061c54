package de.julielab.kgraph.datarepresentation;

/**
 * The closed set of scalar kinds a {@link PropertyValue} may have.
 */
public enum ValueKind {
    STRING, NUMBER, BOOLEAN
}
