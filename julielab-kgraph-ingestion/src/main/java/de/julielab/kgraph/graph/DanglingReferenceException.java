package de.julielab.kgraph.graph;

import de.julielab.kgraph.util.KnowledgeGraphException;

/**
 * Thrown when a relationship should be created for an entity ID that does not exist in the graph store.
 */
public class DanglingReferenceException extends KnowledgeGraphException {

	/**
	 * 
	 */
	private static final long serialVersionUID = 7745921186053372304L;

	public DanglingReferenceException() {
		super();
	}

	public DanglingReferenceException(String message, Throwable cause, boolean enableSuppression,
			boolean writableStackTrace) {
		super(message, cause, enableSuppression, writableStackTrace);
	}

	public DanglingReferenceException(String message, Throwable cause) {
		super(message, cause);
	}

	public DanglingReferenceException(String message) {
		super(message);
	}

	public DanglingReferenceException(Throwable cause) {
		super(cause);
	}

}
