package de.julielab.kgraph.datarepresentation;

/**
 * The kinds of non-fatal problems that are recorded while sources are loaded.
 */
public enum IssueType {
    /**
     * A source file could not be parsed and was skipped.
     */
    PARSE_ERROR,
    /**
     * Annotation support is not available; annotation sources were skipped.
     */
    DEPENDENCY_MISSING,
    /**
     * A relationship referenced an individual that is neither declared in its source nor present in the graph.
     */
    DANGLING_REFERENCE,
    /**
     * An annotation key did not match any entity.
     */
    UNMATCHED_ANNOTATION,
    /**
     * An annotation sheet had no column that could serve as entity key.
     */
    UNKEYED_SHEET
}
