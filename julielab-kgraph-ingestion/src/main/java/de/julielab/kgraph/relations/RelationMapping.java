package de.julielab.kgraph.relations;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a {@link RelationVocabulary}: the relation name used by a source, the canonical relation type it
 * maps to and whether the source states the relation in the opposite direction of the canonical type.
 */
public class RelationMapping {
	@JsonProperty("sourceName")
	public String sourceName;
	@JsonProperty("canonical")
	public String canonical;
	/**
	 * If <tt>true</tt>, subject and object of the source assertion become target and source of the canonical
	 * relationship, e.g. <tt>isTreatedBy</tt> mapped to <tt>treatsDisease</tt>.
	 */
	@JsonProperty("inverse")
	public boolean inverse;

	public RelationMapping() {
	}

	public RelationMapping(String sourceName, String canonical, boolean inverse) {
		this.sourceName = sourceName;
		this.canonical = canonical;
		this.inverse = inverse;
	}

	public RelationMapping(String sourceName, String canonical) {
		this(sourceName, canonical, false);
	}

	@Override
	public String toString() {
		return sourceName + " -> " + canonical + (inverse ? " (inverse)" : "");
	}
}
