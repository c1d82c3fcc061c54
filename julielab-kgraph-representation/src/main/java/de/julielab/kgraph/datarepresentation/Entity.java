package de.julielab.kgraph.datarepresentation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.julielab.kgraph.auxiliaries.PropertyUtilities;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static de.julielab.kgraph.datarepresentation.constants.EntityConstants.*;

/**
 * <p>
 * A node of the knowledge graph. An entity is identified by its store-wide unique {@link #getId() ID} and is found
 * again through its normalized {@link #getExternalKey() external key}.
 * </p>
 * <p>
 * Explicit properties stem from direct API calls or from ontology literal assertions. Annotations stem from
 * annotation sources; they are kept in a map of their own because they must never override explicit properties.
 * </p>
 * <p>
 * Entities handed out by the graph store are copies. Changing them has no effect on the store.
 * </p>
 */
@JsonPropertyOrder({PROP_ID, PROP_EXTERNAL_KEY, PROP_TYPE, PROP_NAME, PROP_PROPERTIES, PROP_ANNOTATIONS, PROP_SOURCES})
public class Entity {

    @JsonProperty(PROP_ID)
    private final String id;
    @JsonProperty(PROP_EXTERNAL_KEY)
    private final String externalKey;
    @JsonProperty(PROP_TYPE)
    private String type;
    @JsonProperty(PROP_NAME)
    private final String name;
    @JsonProperty(PROP_PROPERTIES)
    private final Map<String, PropertyValue> properties = new LinkedHashMap<>();
    @JsonProperty(PROP_ANNOTATIONS)
    private final Map<String, PropertyValue> annotations = new LinkedHashMap<>();
    @JsonProperty(PROP_SOURCES)
    private final Set<String> sources = new LinkedHashSet<>();

    public Entity(String id, String externalKey, String type, String name) {
        if (id == null || externalKey == null || name == null)
            throw new IllegalArgumentException("Entity ID, external key and name are mandatory but got ID " + id
                    + ", external key " + externalKey + " and name " + name + ".");
        this.id = id;
        this.externalKey = externalKey;
        this.type = type == null ? DEFAULT_ENTITY_TYPE : type;
        this.name = name;
    }

    public Entity(Entity other) {
        this(other.id, other.externalKey, other.type, other.name);
        properties.putAll(other.properties);
        annotations.putAll(other.annotations);
        sources.addAll(other.sources);
    }

    public Entity copy() {
        return new Entity(this);
    }

    public String getId() {
        return id;
    }

    public String getExternalKey() {
        return externalKey;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public Map<String, PropertyValue> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Map<String, PropertyValue> getAnnotations() {
        return Collections.unmodifiableMap(annotations);
    }

    public Set<String> getSources() {
        return Collections.unmodifiableSet(sources);
    }

    public boolean hasProperty(String key) {
        return properties.containsKey(key);
    }

    public Optional<PropertyValue> getProperty(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public Optional<PropertyValue> getAnnotation(String key) {
        return Optional.ofNullable(annotations.get(key));
    }

    /**
     * @param key A property or annotation key.
     * @return The explicit property value for <tt>key</tt> if there is one, the annotation value otherwise.
     */
    @JsonIgnore
    public Optional<PropertyValue> getEffectiveValue(String key) {
        PropertyValue value = properties.get(key);
        if (value == null)
            value = annotations.get(key);
        return Optional.ofNullable(value);
    }

    /**
     * Merges explicit properties, overwriting existing values with the same keys.
     *
     * @param newProperties The new property values.
     * @return The keys that were added or changed.
     */
    public Set<String> mergeProperties(Map<String, PropertyValue> newProperties) {
        return PropertyUtilities.mergeProperties(properties, newProperties);
    }

    public void setProperty(String key, PropertyValue value) {
        properties.put(key, value);
    }

    /**
     * Merges annotations. Keys that are explicit properties of this entity are not added.
     *
     * @param newAnnotations The annotation values.
     * @return The keys that were rejected because an explicit property with the same key exists.
     */
    public Set<String> mergeAnnotations(Map<String, PropertyValue> newAnnotations) {
        return PropertyUtilities.mergeUnprotectedProperties(annotations, newAnnotations, properties.keySet());
    }

    public void addSource(String source) {
        if (source != null)
            sources.add(source);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", name='" + name + '\'' +
                ", properties=" + properties +
                ", annotations=" + annotations +
                '}';
    }
}
