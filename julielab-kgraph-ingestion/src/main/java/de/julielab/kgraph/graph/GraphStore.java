package de.julielab.kgraph.graph;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import de.julielab.kgraph.auxiliaries.NameUtilities;
import de.julielab.kgraph.datarepresentation.Direction;
import de.julielab.kgraph.datarepresentation.Entity;
import de.julielab.kgraph.datarepresentation.GraphExport;
import de.julielab.kgraph.datarepresentation.GraphStatistics;
import de.julielab.kgraph.datarepresentation.ImportAssertion;
import de.julielab.kgraph.datarepresentation.ImportIndividual;
import de.julielab.kgraph.datarepresentation.IssueType;
import de.julielab.kgraph.datarepresentation.PropertyValue;
import de.julielab.kgraph.datarepresentation.RelatedEntity;
import de.julielab.kgraph.datarepresentation.Relationship;
import de.julielab.kgraph.datarepresentation.SourceDescriptor;
import de.julielab.kgraph.relations.RelationMapping;
import de.julielab.kgraph.relations.RelationVocabulary;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static de.julielab.kgraph.datarepresentation.constants.EntityConstants.*;
import static de.julielab.kgraph.datarepresentation.constants.RelationshipConstants.PROP_SOURCE_RELATION;

/**
 * <p>
 * The canonical, deduplicated collection of entities and relationships. The store resolves entity identity through
 * normalized external keys and refuses relationships whose endpoints do not exist.
 * </p>
 * <p>
 * All mutations are done under the write lock, all reads under the read lock. A source descriptor is merged under a
 * single write lock acquisition so that readers see either none or all of its content. Entities and relationships
 * returned by the store are copies.
 * </p>
 */
public class GraphStore {

	private final static Logger log = LoggerFactory.getLogger(GraphStore.class);

	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	private final Map<String, Entity> entities = new LinkedHashMap<>();
	private final Map<String, Relationship> relationships = new LinkedHashMap<>();
	private final EntityKeyIndex keyIndex = new EntityKeyIndex();
	/**
	 * Relationship identifier (type, source and target ID) to relationship ID.
	 */
	private final Map<String, String> relationshipIdsByTriple = new LinkedHashMap<>();
	private final SetMultimap<String, String> outgoing = LinkedHashMultimap.create();
	private final SetMultimap<String, String> incoming = LinkedHashMultimap.create();

	private final RelationVocabulary vocabulary;
	private final String defaultEntityType;

	private long entitySequence = 0;
	private long relationshipSequence = 0;

	public GraphStore(RelationVocabulary vocabulary, String defaultEntityType) {
		this.vocabulary = vocabulary;
		this.defaultEntityType = StringUtils.isBlank(defaultEntityType) ? DEFAULT_ENTITY_TYPE : defaultEntityType;
	}

	public GraphStore(RelationVocabulary vocabulary) {
		this(vocabulary, DEFAULT_ENTITY_TYPE);
	}

	public GraphStore() {
		this(RelationVocabulary.createDefault());
	}

	public RelationVocabulary getVocabulary() {
		return vocabulary;
	}

	/**
	 * Creates the entity for <tt>externalKey</tt> or, if it already exists, merges <tt>properties</tt> into its
	 * explicit properties. Existing values of the same keys are overwritten.
	 *
	 * @param externalKey The name or key identifying the entity. It is normalized for the lookup; the first-seen form
	 *                    becomes the display name.
	 * @param type        The entity type, may be null.
	 * @param properties  Property values as strings, numbers, booleans or {@link PropertyValue}s, may be null.
	 * @param source      The provenance of the properties.
	 * @return The entity ID.
	 */
	public String upsertEntity(String externalKey, String type, Map<String, ?> properties, String source) {
		Map<String, PropertyValue> values = toPropertyValues(properties, source);
		lock.writeLock().lock();
		try {
			return upsert(externalKey, type, values, source, null);
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * Adds a relationship of the canonical type of <tt>type</tt>. If the relation is registered as inverse in the
	 * vocabulary, the relationship is created from <tt>targetId</tt> to <tt>sourceId</tt>.
	 *
	 * @return The ID of the new relationship or of the already existing relationship with the same type and
	 * endpoints.
	 * @throws DanglingReferenceException If one of the entity IDs does not exist.
	 */
	public String addRelationship(String type, String sourceId, String targetId, Map<String, ?> properties,
			String source) throws DanglingReferenceException {
		if (StringUtils.isBlank(type))
			throw new IllegalArgumentException("The relationship type must not be blank.");
		RelationMapping mapping = vocabulary.resolve(type);
		Map<String, PropertyValue> values = toPropertyValues(properties, source);
		lock.writeLock().lock();
		try {
			for (String id : Arrays.asList(sourceId, targetId)) {
				if (id == null || !entities.containsKey(id))
					throw new DanglingReferenceException("Cannot create relationship " + sourceId + " -" + type
							+ "-> " + targetId + " because the entity with ID " + id + " does not exist.");
			}
			String from = mapping.inverse ? targetId : sourceId;
			String to = mapping.inverse ? sourceId : targetId;
			return link(mapping.canonical, from, to, values, source, null);
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * <p>
	 * Merges the individuals and assertions of one source. Declared individuals create or update entities, literal
	 * values of individuals only mentioned in the source are applied if the entity already exists. Assertions become
	 * relationships of the canonical type given by the relation vocabulary.
	 * </p>
	 * <p>
	 * An assertion whose subject or object is neither declared in the source nor present in the store is dropped
	 * and reported as {@link IssueType#DANGLING_REFERENCE}; the rest of the source is merged nevertheless.
	 * </p>
	 *
	 * @param descriptor The parsed source.
	 * @return The merge report.
	 */
	public MergeReport mergeDescriptor(SourceDescriptor descriptor) {
		String source = descriptor.sourceName;
		MergeReport report = new MergeReport(source);
		lock.writeLock().lock();
		try {
			// stage everything before the first change so that only consistent content is committed
			Set<String> stagedKeys = descriptor.getDeclaredIndividuals().stream()
					.map(i -> NameUtilities.normalizeKey(i.name)).collect(Collectors.toCollection(LinkedHashSet::new));
			List<StagedEntity> stagedEntities = new ArrayList<>();
			for (ImportIndividual individual : descriptor.individuals.values()) {
				String key = NameUtilities.normalizeKey(individual.name);
				Map<String, PropertyValue> values = new LinkedHashMap<>();
				if (individual.declared) {
					if (individual.iri != null)
						values.put(PROP_IRI, PropertyValue.ofString(individual.iri, source));
					values.putAll(individual.literals);
					stagedEntities.add(new StagedEntity(individual.name, individual.getPrimaryType(), values));
				} else if (!individual.literals.isEmpty()) {
					if (stagedKeys.contains(key) || keyIndex.contains(key)) {
						values.putAll(individual.literals);
						stagedEntities.add(new StagedEntity(individual.name, null, values));
					} else {
						log.debug("Source {} states {} literal values about the unknown individual {}; they are skipped.",
								source, individual.literals.size(), individual.name);
						report.numLiteralsSkipped += individual.literals.size();
					}
				}
			}
			List<StagedRelationship> stagedRelationships = new ArrayList<>();
			for (ImportAssertion assertion : descriptor.assertions) {
				String subjectKey = NameUtilities.normalizeKey(assertion.subject);
				String objectKey = NameUtilities.normalizeKey(assertion.object);
				String missing = null;
				if (!stagedKeys.contains(subjectKey) && !keyIndex.contains(subjectKey))
					missing = assertion.subject;
				else if (!stagedKeys.contains(objectKey) && !keyIndex.contains(objectKey))
					missing = assertion.object;
				if (missing != null) {
					String message = "The assertion " + assertion + " references the individual " + missing
							+ " which is neither declared in the source nor known to the graph; it is dropped.";
					log.warn("{}: {}", source, message);
					report.addIssue(IssueType.DANGLING_REFERENCE, message);
					continue;
				}
				RelationMapping mapping = vocabulary.resolve(assertion.predicate);
				Map<String, PropertyValue> properties = new LinkedHashMap<>();
				if (!mapping.canonical.equals(assertion.predicate))
					properties.put(PROP_SOURCE_RELATION, PropertyValue.ofString(assertion.predicate, source));
				if (mapping.inverse)
					stagedRelationships.add(new StagedRelationship(mapping.canonical, objectKey, subjectKey, properties));
				else
					stagedRelationships.add(new StagedRelationship(mapping.canonical, subjectKey, objectKey, properties));
			}

			for (StagedEntity staged : stagedEntities)
				upsert(staged.name, staged.type, staged.properties, source, report);
			for (StagedRelationship staged : stagedRelationships) {
				String sourceId = keyIndex.getByKey(staged.sourceKey);
				String targetId = keyIndex.getByKey(staged.targetKey);
				if (sourceId == null || !entities.containsKey(sourceId) || targetId == null || !entities.containsKey(targetId))
					throw new GraphIntegrityException("The key index does not resolve the staged endpoints "
							+ staged.sourceKey + " and " + staged.targetKey + " to existing entities.");
				link(staged.type, sourceId, targetId, staged.properties, source, report);
			}
		} finally {
			lock.writeLock().unlock();
		}
		log.info("Merged source {}: {} entities created, {} updated, {} relationships created, {} already existing, {} issues.",
				source, report.numEntitiesCreated, report.numEntitiesUpdated, report.numRelationshipsCreated,
				report.numRelationshipsExisting, report.getIssues().size());
		return report;
	}

	/**
	 * Adds annotation values to entities. Keys that are explicit properties of an entity are not written. The whole
	 * batch is applied under one write lock acquisition.
	 *
	 * @param annotationsByEntityId Entity ID to annotation values.
	 * @return For each entity ID that exists in the store the annotation keys that were rejected because of explicit
	 * properties. IDs of entities that do not exist are missing from the result.
	 */
	public Map<String, Set<String>> applyAnnotations(Map<String, Map<String, PropertyValue>> annotationsByEntityId,
			String source) {
		Map<String, Set<String>> rejected = new LinkedHashMap<>();
		lock.writeLock().lock();
		try {
			for (Map.Entry<String, Map<String, PropertyValue>> e : annotationsByEntityId.entrySet()) {
				Entity entity = entities.get(e.getKey());
				if (entity == null) {
					log.debug("Annotations for entity {} are not applied because it does not exist (anymore).", e.getKey());
					continue;
				}
				Map<String, PropertyValue> values = new LinkedHashMap<>();
				e.getValue().forEach((k, v) -> values.put(k, v.withSource(source)));
				rejected.put(entity.getId(), entity.mergeAnnotations(values));
				entity.addSource(source);
			}
		} finally {
			lock.writeLock().unlock();
		}
		return rejected;
	}

	public Optional<Entity> getEntity(String id) {
		lock.readLock().lock();
		try {
			return Optional.ofNullable(entities.get(id)).map(Entity::copy);
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * @param externalKey A name or key, normalized before lookup.
	 * @return The entity with the normalized key.
	 */
	public Optional<Entity> getEntityByKey(String externalKey) {
		lock.readLock().lock();
		try {
			return Optional.ofNullable(keyIndex.getByRawKey(externalKey)).map(entities::get).map(Entity::copy);
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Looks up an entity by its display name, first exactly, then ignoring case. If more than one entity matches
	 * ignoring case, the one inserted first is returned.
	 */
	public Optional<Entity> findByName(String name) {
		if (name == null)
			return Optional.empty();
		lock.readLock().lock();
		try {
			String id = keyIndex.getByName(name);
			if (id == null) {
				List<String> ids = keyIndex.getByNameIgnoreCase(name);
				id = ids.isEmpty() ? null : ids.get(0);
			}
			return Optional.ofNullable(id).map(entities::get).map(Entity::copy);
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Finds the entity an annotation key refers to: by exact display name, then by display name ignoring case, then
	 * by normalized external key.
	 */
	public Optional<Entity> resolveAnnotationKey(String key) {
		lock.readLock().lock();
		try {
			Optional<Entity> byName = findByName(key);
			if (byName.isPresent())
				return byName;
			return getEntityByKey(key);
		} finally {
			lock.readLock().unlock();
		}
	}

	public boolean hasEntityName(String name) {
		return findByName(name).isPresent();
	}

	/**
	 * Returns all entities matching the given criteria in insertion order. Criteria that are null are not applied.
	 *
	 * @param type           The exact entity type.
	 * @param nameSubstring  A part of the display name, compared ignoring case.
	 * @param propertyFilter Property values that must all match the effective entity values, see
	 *                       {@link Entity#getEffectiveValue(String)}. Numbers match numerically.
	 * @return The matching entities.
	 */
	public List<Entity> query(String type, String nameSubstring, Map<String, ?> propertyFilter) {
		Map<String, PropertyValue> filter = toPropertyValues(propertyFilter, null);
		String nameLc = nameSubstring == null ? null : nameSubstring.toLowerCase(Locale.ROOT);
		Predicate<Entity> matches = e -> {
			if (type != null && !type.equals(e.getType()))
				return false;
			if (nameLc != null && !e.getName().toLowerCase(Locale.ROOT).contains(nameLc))
				return false;
			for (Map.Entry<String, PropertyValue> f : filter.entrySet()) {
				Optional<PropertyValue> value = e.getEffectiveValue(f.getKey());
				if (value.isEmpty() || !value.get().matches(f.getValue()))
					return false;
			}
			return true;
		};
		return collectEntities(matches);
	}

	/**
	 * Searches entities whose name or any property or annotation value contains <tt>text</tt>, ignoring case.
	 *
	 * @param text The search text.
	 * @param type An entity type to restrict the search to, may be null.
	 * @return The matching entities in insertion order.
	 */
	public List<Entity> search(String text, String type) {
		if (StringUtils.isBlank(text))
			return Collections.emptyList();
		String textLc = text.trim().toLowerCase(Locale.ROOT);
		Predicate<String> containsText = s -> s != null && s.toLowerCase(Locale.ROOT).contains(textLc);
		return collectEntities(e -> (type == null || type.equals(e.getType()))
				&& (containsText.test(e.getName())
				|| e.getProperties().values().stream().map(PropertyValue::asString).anyMatch(containsText)
				|| e.getAnnotations().values().stream().map(PropertyValue::asString).anyMatch(containsText)));
	}

	private List<Entity> collectEntities(Predicate<Entity> filter) {
		lock.readLock().lock();
		try {
			return entities.values().stream().filter(filter).map(Entity::copy).collect(Collectors.toList());
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Returns the relationships of an entity together with the entities at their other ends. Outgoing relationships
	 * come first, each group in the order the relationships were created. A relationship from an entity to itself is
	 * returned once, as outgoing, when both directions are followed.
	 *
	 * @param entityId      The entity ID.
	 * @param relationTypes Relation names to restrict the result to; names are mapped to their canonical types. Null
	 *                      or empty for all types.
	 * @param direction     The direction to follow, null for both.
	 * @return The related entities, empty if the entity does not exist.
	 */
	public List<RelatedEntity> getRelated(String entityId, Collection<String> relationTypes, Direction direction) {
		Set<String> types = relationTypes == null ? Collections.emptySet() : relationTypes.stream()
				.filter(StringUtils::isNotBlank).map(vocabulary::getCanonicalName).collect(Collectors.toSet());
		Direction dir = direction == null ? Direction.BOTH : direction;
		lock.readLock().lock();
		try {
			List<RelatedEntity> related = new ArrayList<>();
			if (!entities.containsKey(entityId))
				return related;
			if (dir != Direction.INCOMING)
				collectRelated(entityId, outgoing.get(entityId), types, Direction.OUTGOING, false, related);
			if (dir != Direction.OUTGOING)
				collectRelated(entityId, incoming.get(entityId), types, Direction.INCOMING, dir == Direction.BOTH, related);
			return related;
		} finally {
			lock.readLock().unlock();
		}
	}

	private void collectRelated(String entityId, Set<String> relationshipIds, Set<String> types, Direction direction,
			boolean skipSelfLoops, List<RelatedEntity> related) {
		for (String relationshipId : relationshipIds) {
			Relationship relationship = relationships.get(relationshipId);
			if (!types.isEmpty() && !types.contains(relationship.getType()))
				continue;
			if (skipSelfLoops && relationship.getSourceId().equals(relationship.getTargetId()))
				continue;
			Entity other = entities.get(relationship.getOtherEndpoint(entityId));
			related.add(new RelatedEntity(relationship.copy(), other.copy(), direction));
		}
	}

	public Optional<Relationship> getRelationship(String id) {
		lock.readLock().lock();
		try {
			return Optional.ofNullable(relationships.get(id)).map(Relationship::copy);
		} finally {
			lock.readLock().unlock();
		}
	}

	public List<Relationship> getRelationships() {
		lock.readLock().lock();
		try {
			return relationships.values().stream().map(Relationship::copy).collect(Collectors.toList());
		} finally {
			lock.readLock().unlock();
		}
	}

	public GraphStatistics stats() {
		lock.readLock().lock();
		try {
			Map<String, Integer> entitiesByType = new TreeMap<>();
			for (Entity entity : entities.values())
				entitiesByType.merge(entity.getType(), 1, Integer::sum);
			Map<String, Integer> relationshipsByType = new TreeMap<>();
			for (Relationship relationship : relationships.values())
				relationshipsByType.merge(relationship.getType(), 1, Integer::sum);
			return new GraphStatistics(entitiesByType, relationshipsByType);
		} finally {
			lock.readLock().unlock();
		}
	}

	public int getNumEntities() {
		lock.readLock().lock();
		try {
			return entities.size();
		} finally {
			lock.readLock().unlock();
		}
	}

	public int getNumRelationships() {
		lock.readLock().lock();
		try {
			return relationships.size();
		} finally {
			lock.readLock().unlock();
		}
	}

	public GraphExport export() {
		lock.readLock().lock();
		try {
			return new GraphExport(stats(),
					entities.values().stream().map(Entity::copy).collect(Collectors.toList()),
					relationships.values().stream().map(Relationship::copy).collect(Collectors.toList()));
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Removes an entity together with all relationships it participates in.
	 *
	 * @param id The entity ID.
	 * @return <tt>true</tt> if the entity existed.
	 */
	public boolean removeEntity(String id) {
		lock.writeLock().lock();
		try {
			Entity entity = entities.get(id);
			if (entity == null)
				return false;
			Set<String> incident = new LinkedHashSet<>(outgoing.get(id));
			incident.addAll(incoming.get(id));
			incident.forEach(this::unlink);
			entities.remove(id);
			keyIndex.remove(entity.getExternalKey(), entity.getName(), id);
			log.debug("Removed entity {} and its {} relationships.", entity.getName(), incident.size());
			return true;
		} finally {
			lock.writeLock().unlock();
		}
	}

	public boolean removeRelationship(String id) {
		lock.writeLock().lock();
		try {
			return unlink(id);
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * Checks the invariants of the store: every relationship references existing entities, the key index and the
	 * relationship indexes agree with the stored entities and relationships.
	 *
	 * @return Descriptions of the violations found, empty if the store is consistent.
	 */
	public List<String> checkIntegrity() {
		lock.readLock().lock();
		try {
			List<String> violations = new ArrayList<>();
			for (Relationship relationship : relationships.values()) {
				if (!entities.containsKey(relationship.getSourceId()))
					violations.add("Relationship " + relationship + " has the missing source entity " + relationship.getSourceId());
				if (!entities.containsKey(relationship.getTargetId()))
					violations.add("Relationship " + relationship + " has the missing target entity " + relationship.getTargetId());
				String triple = MergeReport.getRelationshipIdentifier(relationship.getType(), relationship.getSourceId(), relationship.getTargetId());
				if (!relationship.getId().equals(relationshipIdsByTriple.get(triple)))
					violations.add("Relationship " + relationship + " is not registered for its type and endpoints.");
			}
			if (relationshipIdsByTriple.size() != relationships.size())
				violations.add("There are " + relationshipIdsByTriple.size() + " registered relationship triples but "
						+ relationships.size() + " relationships.");
			for (String key : keyIndex) {
				String id = keyIndex.getByKey(key);
				Entity entity = entities.get(id);
				if (entity == null)
					violations.add("The external key " + key + " points to the missing entity " + id);
				else if (!entity.getExternalKey().equals(key))
					violations.add("The external key " + key + " points to entity " + id + " with key " + entity.getExternalKey());
			}
			if (keyIndex.size() != entities.size())
				violations.add("There are " + keyIndex.size() + " external keys but " + entities.size() + " entities.");
			for (Map.Entry<String, String> e : outgoing.entries()) {
				if (!relationships.containsKey(e.getValue()))
					violations.add("Entity " + e.getKey() + " lists the missing relationship " + e.getValue());
			}
			for (Map.Entry<String, String> e : incoming.entries()) {
				if (!relationships.containsKey(e.getValue()))
					violations.add("Entity " + e.getKey() + " lists the missing relationship " + e.getValue());
			}
			return violations;
		} finally {
			lock.readLock().unlock();
		}
	}

	private String upsert(String externalKey, String type, Map<String, PropertyValue> properties, String source,
			MergeReport report) {
		String key = NameUtilities.normalizeKey(externalKey);
		String specificType = StringUtils.isBlank(type) || type.equals(defaultEntityType) ? null : type.trim();
		String id = keyIndex.getByKey(key);
		Entity entity;
		if (id == null) {
			id = ENTITY_ID_PREFIX + entitySequence++;
			entity = new Entity(id, key, specificType == null ? defaultEntityType : specificType, externalKey.trim());
			entities.put(id, entity);
			keyIndex.add(key, entity.getName(), id);
			if (report != null)
				report.numEntitiesCreated++;
			log.trace("Created entity {} with key {} and type {}", id, key, entity.getType());
		} else {
			entity = entities.get(id);
			if (entity == null)
				throw new GraphIntegrityException("The external key " + key + " points to the missing entity " + id);
			if (specificType != null && !specificType.equals(entity.getType())) {
				log.debug("Type of entity {} changes from {} to {}", entity.getName(), entity.getType(), specificType);
				entity.setType(specificType);
			}
			if (report != null)
				report.numEntitiesUpdated++;
		}
		entity.mergeProperties(properties);
		entity.addSource(source);
		return id;
	}

	private String link(String type, String sourceId, String targetId, Map<String, PropertyValue> properties,
			String source, MergeReport report) {
		String triple = MergeReport.getRelationshipIdentifier(type, sourceId, targetId);
		String id = relationshipIdsByTriple.get(triple);
		Relationship relationship;
		if (id == null) {
			id = RELATIONSHIP_ID_PREFIX + relationshipSequence++;
			relationship = new Relationship(id, type, sourceId, targetId);
			relationships.put(id, relationship);
			relationshipIdsByTriple.put(triple, id);
			outgoing.put(sourceId, id);
			incoming.put(targetId, id);
			if (report != null)
				report.numRelationshipsCreated++;
		} else {
			relationship = relationships.get(id);
			if (report != null) {
				if (report.relationshipAlreadyWasCreated(type, sourceId, targetId))
					report.numDuplicateAssertions++;
				else
					report.numRelationshipsExisting++;
			}
		}
		if (report != null)
			report.addCreatedRelationship(type, sourceId, targetId);
		relationship.mergeProperties(properties);
		relationship.addSource(source);
		return id;
	}

	private boolean unlink(String relationshipId) {
		Relationship relationship = relationships.remove(relationshipId);
		if (relationship == null)
			return false;
		relationshipIdsByTriple.remove(MergeReport.getRelationshipIdentifier(relationship.getType(),
				relationship.getSourceId(), relationship.getTargetId()));
		outgoing.remove(relationship.getSourceId(), relationshipId);
		incoming.remove(relationship.getTargetId(), relationshipId);
		return true;
	}

	private static Map<String, PropertyValue> toPropertyValues(Map<String, ?> properties, String source) {
		Map<String, PropertyValue> values = new LinkedHashMap<>();
		if (properties == null)
			return values;
		for (Map.Entry<String, ?> e : properties.entrySet()) {
			if (StringUtils.isBlank(e.getKey()))
				throw new IllegalArgumentException("Property keys must not be blank.");
			if (e.getValue() == null)
				continue;
			values.put(e.getKey(), PropertyValue.of(e.getValue(), source));
		}
		return values;
	}

	private static class StagedEntity {
		private final String name;
		private final String type;
		private final Map<String, PropertyValue> properties;

		private StagedEntity(String name, String type, Map<String, PropertyValue> properties) {
			this.name = name;
			this.type = type;
			this.properties = properties;
		}
	}

	private static class StagedRelationship {
		private final String type;
		private final String sourceKey;
		private final String targetKey;
		private final Map<String, PropertyValue> properties;

		private StagedRelationship(String type, String sourceKey, String targetKey, Map<String, PropertyValue> properties) {
			this.type = type;
			this.sourceKey = sourceKey;
			this.targetKey = targetKey;
			this.properties = properties;
		}
	}
}
