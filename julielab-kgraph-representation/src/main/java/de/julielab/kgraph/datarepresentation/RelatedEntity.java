package de.julielab.kgraph.datarepresentation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A relationship together with the entity at its other end, as seen from the entity the relationship was retrieved
 * for.
 */
public class RelatedEntity {
    @JsonProperty("relationship")
    private final Relationship relationship;
    @JsonProperty("entity")
    private final Entity entity;
    @JsonProperty("direction")
    private final Direction direction;

    public RelatedEntity(Relationship relationship, Entity entity, Direction direction) {
        if (direction == Direction.BOTH)
            throw new IllegalArgumentException("A related entity is either reached via an outgoing or an incoming relationship.");
        this.relationship = relationship;
        this.entity = entity;
        this.direction = direction;
    }

    public Relationship getRelationship() {
        return relationship;
    }

    public Entity getEntity() {
        return entity;
    }

    /**
     * @return {@link Direction#OUTGOING} if the entity the relationship was retrieved for is its source,
     * {@link Direction#INCOMING} if it is its target.
     */
    public Direction getDirection() {
        return direction;
    }

    @Override
    public String toString() {
        return relationship + " -> " + entity.getName();
    }
}
