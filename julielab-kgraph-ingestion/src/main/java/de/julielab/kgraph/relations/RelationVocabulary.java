package de.julielab.kgraph.relations;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.julielab.kgraph.auxiliaries.NameUtilities;
import de.julielab.kgraph.datarepresentation.util.GraphJsonSerializer;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <p>
 * Lookup table from relation names as they occur in sources to canonical relationship types. Lookups ignore case,
 * underscores, hyphens and whitespace. Names without a registered mapping are used as canonical type unchanged so
 * that new relations in sources do not require a vocabulary update.
 * </p>
 * <p>
 * The vocabulary is data: defaults are read from the classpath resource {@link #DEFAULT_VOCABULARY_RESOURCE} and
 * further mappings may be registered or read from JSON files of the form
 * <code>{"relations":[{"sourceName":"isTreatedBy","canonical":"treatsDisease","inverse":true}]}</code>. A later
 * registration for the same name replaces the earlier one.
 * </p>
 */
public class RelationVocabulary {
	public static final String DEFAULT_VOCABULARY_RESOURCE = "de/julielab/kgraph/relation-vocabulary.json";

	private final static Logger log = LoggerFactory.getLogger(RelationVocabulary.class);

	private final Map<String, RelationMapping> mappings = new ConcurrentHashMap<>();

	/**
	 * The JSON document format of vocabulary files.
	 */
	public static class Definition {
		@JsonProperty("relations")
		public List<RelationMapping> relations = new ArrayList<>();
	}

	/**
	 * @return A vocabulary with the mappings of {@link #DEFAULT_VOCABULARY_RESOURCE}.
	 */
	public static RelationVocabulary createDefault() {
		RelationVocabulary vocabulary = new RelationVocabulary();
		try (InputStream is = RelationVocabulary.class.getClassLoader().getResourceAsStream(DEFAULT_VOCABULARY_RESOURCE)) {
			if (is == null)
				throw new FileNotFoundException("The default relation vocabulary " + DEFAULT_VOCABULARY_RESOURCE + " was not found on the classpath.");
			vocabulary.load(is);
		} catch (IOException e) {
			throw new IllegalStateException("Could not read the default relation vocabulary.", e);
		}
		return vocabulary;
	}

	public void register(RelationMapping mapping) {
		if (mapping == null || StringUtils.isBlank(mapping.sourceName) || StringUtils.isBlank(mapping.canonical))
			throw new IllegalArgumentException("A relation mapping requires a source name and a canonical name but got " + mapping);
		RelationMapping previous = mappings.put(NameUtilities.normalizeRelationName(mapping.sourceName),
				new RelationMapping(mapping.sourceName.trim(), mapping.canonical.trim(), mapping.inverse));
		if (previous != null)
			log.trace("Relation mapping {} replaced by {}", previous, mapping);
	}

	public void register(String sourceName, String canonical, boolean inverse) {
		register(new RelationMapping(sourceName, canonical, inverse));
	}

	public void registerAll(Collection<RelationMapping> mappings) {
		if (mappings != null)
			mappings.forEach(this::register);
	}

	public void load(InputStream is) throws IOException {
		Definition definition = GraphJsonSerializer.fromJson(is, Definition.class);
		registerAll(definition.relations);
		log.debug("Read {} relation mappings", definition.relations.size());
	}

	public void load(Path file) throws IOException {
		try (InputStream is = Files.newInputStream(file)) {
			load(is);
		}
		log.info("Relation vocabulary read from {}", file);
	}

	/**
	 * @param relationName A relation name as given by a source.
	 * @return The registered mapping for <tt>relationName</tt> or an identity mapping to the trimmed name itself.
	 */
	public RelationMapping resolve(String relationName) {
		RelationMapping mapping = mappings.get(NameUtilities.normalizeRelationName(relationName));
		if (mapping == null) {
			log.trace("No mapping for relation {}, it is used as given", relationName);
			return new RelationMapping(relationName.trim(), relationName.trim(), false);
		}
		return mapping;
	}

	public String getCanonicalName(String relationName) {
		return resolve(relationName).canonical;
	}

	public boolean isKnown(String relationName) {
		return mappings.containsKey(NameUtilities.normalizeRelationName(relationName));
	}

	public Map<String, RelationMapping> getMappings() {
		return Collections.unmodifiableMap(new TreeMap<>(mappings));
	}

	public int size() {
		return mappings.size();
	}
}
