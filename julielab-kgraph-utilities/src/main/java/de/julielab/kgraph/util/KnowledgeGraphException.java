package de.julielab.kgraph.util;

/**
 * Base class of the checked exceptions raised while reading sources into the knowledge graph or while writing to it.
 */
public class KnowledgeGraphException extends Exception {

	/**
	 * 
	 */
	private static final long serialVersionUID = 4170522863019837721L;

	public KnowledgeGraphException() {
		super();
	}

	public KnowledgeGraphException(String message, Throwable cause, boolean enableSuppression,
			boolean writableStackTrace) {
		super(message, cause, enableSuppression, writableStackTrace);
	}

	public KnowledgeGraphException(String message, Throwable cause) {
		super(message, cause);
	}

	public KnowledgeGraphException(String message) {
		super(message);
	}

	public KnowledgeGraphException(Throwable cause) {
		super(cause);
	}

}
