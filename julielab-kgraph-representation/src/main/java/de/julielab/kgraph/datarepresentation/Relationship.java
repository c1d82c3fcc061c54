package de.julielab.kgraph.datarepresentation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.julielab.kgraph.auxiliaries.PropertyUtilities;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static de.julielab.kgraph.datarepresentation.constants.RelationshipConstants.*;

/**
 * A directed, typed edge between two entities of the knowledge graph. The type is always a canonical relation name.
 */
@JsonPropertyOrder({RS_ID, RS_TYPE, RS_SOURCE_ID, RS_TARGET_ID, RS_PROPS, RS_SOURCES})
public class Relationship {
    @JsonProperty(RS_ID)
    private final String id;
    @JsonProperty(RS_TYPE)
    private final String type;
    @JsonProperty(RS_SOURCE_ID)
    private final String sourceId;
    @JsonProperty(RS_TARGET_ID)
    private final String targetId;
    @JsonProperty(RS_PROPS)
    private final Map<String, PropertyValue> properties = new LinkedHashMap<>();
    @JsonProperty(RS_SOURCES)
    private final Set<String> sources = new LinkedHashSet<>();

    public Relationship(String id, String type, String sourceId, String targetId) {
        if (id == null || type == null || sourceId == null || targetId == null)
            throw new IllegalArgumentException("Relationship ID, type, source ID and target ID are mandatory but got "
                    + id + ", " + type + ", " + sourceId + ", " + targetId + ".");
        this.id = id;
        this.type = type;
        this.sourceId = sourceId;
        this.targetId = targetId;
    }

    public Relationship(Relationship other) {
        this(other.id, other.type, other.sourceId, other.targetId);
        properties.putAll(other.properties);
        sources.addAll(other.sources);
    }

    public Relationship copy() {
        return new Relationship(this);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public Map<String, PropertyValue> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Set<String> getSources() {
        return Collections.unmodifiableSet(sources);
    }

    public Set<String> mergeProperties(Map<String, PropertyValue> newProperties) {
        return PropertyUtilities.mergeProperties(properties, newProperties);
    }

    public void addSource(String source) {
        if (source != null)
            sources.add(source);
    }

    /**
     * @param entityId The ID of one of the endpoints of this relationship.
     * @return The ID of the other endpoint.
     */
    public String getOtherEndpoint(String entityId) {
        if (sourceId.equals(entityId))
            return targetId;
        if (targetId.equals(entityId))
            return sourceId;
        throw new IllegalArgumentException("Entity " + entityId + " is no endpoint of relationship " + this);
    }

    @Override
    public String toString() {
        return "(" + sourceId + ")-[" + id + ":" + type + "]->(" + targetId + ")";
    }
}
