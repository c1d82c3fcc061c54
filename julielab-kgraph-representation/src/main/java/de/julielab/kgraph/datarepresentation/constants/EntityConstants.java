package de.julielab.kgraph.datarepresentation.constants;

public class EntityConstants {
	public static final String PROP_ID = "id";
	public static final String PROP_EXTERNAL_KEY = "externalKey";
	public static final String PROP_TYPE = "type";
	public static final String PROP_NAME = "name";
	public static final String PROP_PROPERTIES = "properties";
	public static final String PROP_ANNOTATIONS = "annotations";
	public static final String PROP_SOURCES = "sources";
	/**
	 * Explicit entity property holding the IRI of the ontology individual the entity was created from.
	 */
	public static final String PROP_IRI = "iri";

	/**
	 * The type given to entities whose sources did not name a class.
	 */
	public static final String DEFAULT_ENTITY_TYPE = "Entity";
	/**
	 * Provenance tag for data written by direct API calls instead of a source file.
	 */
	public static final String SOURCE_API = "api";

	public static final String ENTITY_ID_PREFIX = "ent";
	public static final String RELATIONSHIP_ID_PREFIX = "rel";

	private EntityConstants() {
	}
}
