package de.julielab.kgraph.datarepresentation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A snapshot of all entities and relationships of a graph, used for JSON export.
 */
@JsonPropertyOrder({"statistics", "entities", "relationships"})
public class GraphExport {
    @JsonProperty("statistics")
    public GraphStatistics statistics;
    @JsonProperty("entities")
    public List<Entity> entities;
    @JsonProperty("relationships")
    public List<Relationship> relationships;

    public GraphExport(GraphStatistics statistics, List<Entity> entities, List<Relationship> relationships) {
        this.statistics = statistics;
        this.entities = entities;
        this.relationships = relationships;
    }
}
