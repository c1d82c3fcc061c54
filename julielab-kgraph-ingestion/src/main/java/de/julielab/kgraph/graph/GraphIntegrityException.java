package de.julielab.kgraph.graph;

/**
 * Signals that the graph store violates its own invariants, e.g. a relationship pointing to a removed entity. This
 * is a programming error, not an input error.
 */
public class GraphIntegrityException extends IllegalStateException {

	/**
	 * 
	 */
	private static final long serialVersionUID = -2590148736529915338L;

	public GraphIntegrityException() {
		super();
	}

	public GraphIntegrityException(String message, Throwable cause) {
		super(message, cause);
	}

	public GraphIntegrityException(String message) {
		super(message);
	}

	public GraphIntegrityException(Throwable cause) {
		super(cause);
	}

}
