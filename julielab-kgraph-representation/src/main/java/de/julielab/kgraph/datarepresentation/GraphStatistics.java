package de.julielab.kgraph.datarepresentation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;

/**
 * Entity and relationship counts of a graph at the time the statistics were taken. Per-type counts are sorted by
 * type name.
 */
@JsonPropertyOrder({"totalEntities", "totalRelationships", "entitiesByType", "relationshipsByType"})
public class GraphStatistics {
    @JsonProperty("totalEntities")
    private final int totalEntities;
    @JsonProperty("totalRelationships")
    private final int totalRelationships;
    @JsonProperty("entitiesByType")
    private final ImmutableSortedMap<String, Integer> entitiesByType;
    @JsonProperty("relationshipsByType")
    private final ImmutableSortedMap<String, Integer> relationshipsByType;

    public GraphStatistics(Map<String, Integer> entitiesByType, Map<String, Integer> relationshipsByType) {
        this.entitiesByType = ImmutableSortedMap.copyOf(entitiesByType);
        this.relationshipsByType = ImmutableSortedMap.copyOf(relationshipsByType);
        this.totalEntities = entitiesByType.values().stream().mapToInt(Integer::intValue).sum();
        this.totalRelationships = relationshipsByType.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getTotalEntities() {
        return totalEntities;
    }

    public int getTotalRelationships() {
        return totalRelationships;
    }

    public Map<String, Integer> getEntitiesByType() {
        return entitiesByType;
    }

    public Map<String, Integer> getRelationshipsByType() {
        return relationshipsByType;
    }

    public int getEntityCount(String type) {
        return entitiesByType.getOrDefault(type, 0);
    }

    public int getRelationshipCount(String type) {
        return relationshipsByType.getOrDefault(type, 0);
    }

    @Override
    public String toString() {
        return "GraphStatistics{" +
                "totalEntities=" + totalEntities +
                ", totalRelationships=" + totalRelationships +
                ", entitiesByType=" + entitiesByType +
                ", relationshipsByType=" + relationshipsByType +
                '}';
    }
}
