package de.julielab.kgraph.datarepresentation.constants;

public class RelationshipConstants {
	public static final String RS_ID = "id";
	public static final String RS_TYPE = "type";
	public static final String RS_SOURCE_ID = "sourceId";
	public static final String RS_TARGET_ID = "targetId";
	public static final String RS_PROPS = "properties";
	public static final String RS_SOURCES = "sources";
	/**
	 * Relationship property keeping the relation name as it was given by the source before it was mapped to its
	 * canonical type.
	 */
	public static final String PROP_SOURCE_RELATION = "sourceRelation";

	private RelationshipConstants() {
	}
}
