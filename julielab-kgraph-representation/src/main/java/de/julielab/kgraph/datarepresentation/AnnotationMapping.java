package de.julielab.kgraph.datarepresentation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>
 * The annotations read from one annotation source: for each entity key (the value of the key column of a sheet)
 * the annotation fields and their values. Keys and fields keep the order in which they were read. When a key and
 * field occur more than once, the value read last wins.
 * </p>
 * <p>
 * A mapping created by {@link #dependencyMissing(String)} is empty and signals that annotation support is not
 * available.
 * </p>
 */
public class AnnotationMapping {
    @JsonProperty("sourceName")
    private final String sourceName;
    @JsonProperty("annotations")
    private final Map<String, Map<String, PropertyValue>> annotations = new LinkedHashMap<>();
    /**
     * Sheet name to the header of the column that was used as entity key.
     */
    @JsonProperty("keyColumns")
    private final Map<String, String> keyColumns = new LinkedHashMap<>();
    @JsonProperty("unkeyedSheets")
    private final List<String> unkeyedSheets = new ArrayList<>();
    @JsonProperty("dependencyMissing")
    private final boolean dependencyMissing;

    public AnnotationMapping(String sourceName) {
        this(sourceName, false);
    }

    private AnnotationMapping(String sourceName, boolean dependencyMissing) {
        this.sourceName = sourceName;
        this.dependencyMissing = dependencyMissing;
    }

    public static AnnotationMapping dependencyMissing(String sourceName) {
        return new AnnotationMapping(sourceName, true);
    }

    public void put(String key, String field, PropertyValue value) {
        annotations.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(field, value);
    }

    public void addKeyedSheet(String sheetName, String keyColumn) {
        keyColumns.put(sheetName, keyColumn);
    }

    public void addUnkeyedSheet(String sheetName) {
        unkeyedSheets.add(sheetName);
    }

    public String getSourceName() {
        return sourceName;
    }

    public Map<String, Map<String, PropertyValue>> getAnnotations() {
        return Collections.unmodifiableMap(annotations);
    }

    public Map<String, PropertyValue> getAnnotations(String key) {
        Map<String, PropertyValue> fields = annotations.get(key);
        return fields == null ? Collections.emptyMap() : Collections.unmodifiableMap(fields);
    }

    public Map<String, String> getKeyColumns() {
        return Collections.unmodifiableMap(keyColumns);
    }

    public List<String> getUnkeyedSheets() {
        return Collections.unmodifiableList(unkeyedSheets);
    }

    public boolean isDependencyMissing() {
        return dependencyMissing;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return annotations.isEmpty();
    }

    public int size() {
        return annotations.size();
    }

    @Override
    public String toString() {
        return "AnnotationMapping{" +
                "sourceName='" + sourceName + '\'' +
                ", keys=" + annotations.size() +
                ", keyColumns=" + keyColumns +
                ", unkeyedSheets=" + unkeyedSheets +
                ", dependencyMissing=" + dependencyMissing +
                '}';
    }
}
