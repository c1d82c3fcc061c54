package de.julielab.kgraph;

/**
 * The lifecycle of a {@link KnowledgeGraphManager}.
 */
public enum LoaderState {
	/**
	 * Nothing has been loaded yet.
	 */
	EMPTY,
	LOADING,
	/**
	 * The last load batch completed. Further batches may be loaded.
	 */
	READY,
	/**
	 * The graph store was found to violate its invariants. Loads and writes are refused, reads still work.
	 */
	FAILED
}
