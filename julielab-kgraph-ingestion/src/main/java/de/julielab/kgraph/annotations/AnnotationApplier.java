package de.julielab.kgraph.annotations;

import de.julielab.kgraph.datarepresentation.AnnotationMapping;
import de.julielab.kgraph.datarepresentation.Entity;
import de.julielab.kgraph.datarepresentation.IssueType;
import de.julielab.kgraph.datarepresentation.PropertyValue;
import de.julielab.kgraph.graph.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * <p>
 * Writes the values of an {@link AnnotationMapping} into the annotations of the matching entities of a graph store.
 * An annotation key matches the entity with the same display name, else the entity whose display name equals the key
 * ignoring case, else the entity with the same normalized external key.
 * </p>
 * <p>
 * Annotations have lower precedence than explicit properties: a field is not written if the entity has an explicit
 * property with the same key. Keys without a matching entity are reported as
 * {@link IssueType#UNMATCHED_ANNOTATION}.
 * </p>
 */
public class AnnotationApplier {

	private final static Logger log = LoggerFactory.getLogger(AnnotationApplier.class);

	private final GraphStore store;

	public AnnotationApplier(GraphStore store) {
		this.store = store;
	}

	public AnnotationReport apply(AnnotationMapping mapping) {
		String source = mapping.getSourceName();
		AnnotationReport report = new AnnotationReport(source);
		if (mapping.isDependencyMissing()) {
			report.addIssue(IssueType.DEPENDENCY_MISSING, "Annotation support is disabled; " + source + " was not read.");
			return report;
		}
		for (String sheet : mapping.getUnkeyedSheets())
			report.addIssue(IssueType.UNKEYED_SHEET, "The sheet \"" + sheet + "\" has no column identifying entities.");
		Map<String, Map<String, PropertyValue>> annotationsByEntityId = new LinkedHashMap<>();
		Map<String, String> keysByEntityId = new LinkedHashMap<>();
		for (Map.Entry<String, Map<String, PropertyValue>> e : mapping.getAnnotations().entrySet()) {
			String key = e.getKey();
			Optional<Entity> entity = store.resolveAnnotationKey(key);
			if (entity.isEmpty()) {
				unmatched(report, key);
				continue;
			}
			String id = entity.get().getId();
			report.numMatchedKeys++;
			log.trace("Annotation key {} resolved to entity {}", key, id);
			// several keys may resolve to the same entity, the later ones win
			annotationsByEntityId.computeIfAbsent(id, k -> new LinkedHashMap<>()).putAll(e.getValue());
			keysByEntityId.putIfAbsent(id, key);
		}

		Map<String, Set<String>> rejected = store.applyAnnotations(annotationsByEntityId, source);
		for (Map.Entry<String, Map<String, PropertyValue>> e : annotationsByEntityId.entrySet()) {
			Set<String> rejectedKeys = rejected.get(e.getKey());
			if (rejectedKeys == null) {
				// the entity was removed in the meantime
				report.numMatchedKeys--;
				unmatched(report, keysByEntityId.get(e.getKey()));
				continue;
			}
			report.numSkippedFields += rejectedKeys.size();
			report.numAppliedFields += e.getValue().size() - rejectedKeys.size();
			if (!rejectedKeys.isEmpty())
				log.debug("Annotations {} of {} were not applied because they are explicit properties of entity {}.",
						rejectedKeys, source, e.getKey());
		}
		log.info("Applied annotations of {}: {} keys matched, {} unmatched, {} fields applied, {} fields kept from explicit properties.",
				source, report.numMatchedKeys, report.numUnmatchedKeys, report.numAppliedFields, report.numSkippedFields);
		return report;
	}

	private void unmatched(AnnotationReport report, String key) {
		report.numUnmatchedKeys++;
		String message = "No entity matches the annotation key \"" + key + "\".";
		log.warn("{}: {}", report.sourceName, message);
		report.addIssue(IssueType.UNMATCHED_ANNOTATION, message);
	}
}
