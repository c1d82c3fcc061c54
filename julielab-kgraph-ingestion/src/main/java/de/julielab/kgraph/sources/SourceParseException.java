package de.julielab.kgraph.sources;

import de.julielab.kgraph.util.KnowledgeGraphException;

/**
 * A source file could not be read or does not have the expected structure.
 */
public class SourceParseException extends KnowledgeGraphException {

	/**
	 * 
	 */
	private static final long serialVersionUID = 1358664073921400736L;

	public SourceParseException() {
		super();
	}

	public SourceParseException(String message, Throwable cause, boolean enableSuppression,
			boolean writableStackTrace) {
		super(message, cause, enableSuppression, writableStackTrace);
	}

	public SourceParseException(String message, Throwable cause) {
		super(message, cause);
	}

	public SourceParseException(String message) {
		super(message);
	}

	public SourceParseException(Throwable cause) {
		super(cause);
	}

}
