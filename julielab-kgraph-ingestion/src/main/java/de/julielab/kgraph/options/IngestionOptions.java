package de.julielab.kgraph.options;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.julielab.kgraph.datarepresentation.constants.EntityConstants;
import de.julielab.kgraph.datarepresentation.util.GraphJsonSerializer;
import de.julielab.kgraph.relations.RelationMapping;
import org.apache.commons.lang3.ClassUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Settings of a knowledge graph manager. Options are resolved once when the manager is created, either from a JSON
 * file or from system properties with the prefix {@link #SYSPROP_PREFIX}.
 */
public class IngestionOptions {
	public static final String SYSPROP_PREFIX = "de.julielab.kgraph.";
	/**
	 * Whether spreadsheet annotation sources are read. Without this property, annotation support is enabled exactly
	 * if Apache POI is on the classpath.
	 */
	public static final String SYSPROP_ANNOTATIONS_ENABLED = SYSPROP_PREFIX + "annotations.enabled";
	public static final String SYSPROP_ONTOLOGY_EXTENSIONS = SYSPROP_PREFIX + "ontology.extensions";
	public static final String SYSPROP_ANNOTATION_EXTENSIONS = SYSPROP_PREFIX + "annotation.extensions";
	public static final String SYSPROP_RECURSIVE = SYSPROP_PREFIX + "discovery.recursive";
	public static final String SYSPROP_RELATION_VOCABULARY = SYSPROP_PREFIX + "relations.vocabulary";
	public static final String SYSPROP_DEFAULT_ENTITY_TYPE = SYSPROP_PREFIX + "entity.defaulttype";
	/**
	 * A class of the spreadsheet library whose presence enables annotation support by default.
	 */
	public static final String SPREADSHEET_LIBRARY_CLASS = "org.apache.poi.ss.usermodel.WorkbookFactory";

	/**
	 * The declared availability of the spreadsheet library. When <tt>false</tt>, annotation sources are not read
	 * and each load reports the missing capability. Defaults to whether {@link #SPREADSHEET_LIBRARY_CLASS} can be
	 * found.
	 */
	@JsonProperty("annotationSupport")
	public boolean annotationSupport;
	/**
	 * File name extensions, including the dot, identifying ontology sources during directory discovery.
	 */
	@JsonProperty("ontologyExtensions")
	public List<String> ontologyExtensions;
	@JsonProperty("annotationExtensions")
	public List<String> annotationExtensions;
	/**
	 * If set to <tt>true</tt>, directory discovery descends into subdirectories.
	 */
	@JsonProperty("recursive")
	public boolean recursive;
	/**
	 * Relation mappings added to the default vocabulary. They take precedence over the defaults and over
	 * {@link #relationVocabularyFile}.
	 */
	@JsonProperty("relationMappings")
	public List<RelationMapping> relationMappings;
	/**
	 * An optional JSON file with further relation mappings.
	 */
	@JsonProperty("relationVocabularyFile")
	public String relationVocabularyFile;
	/**
	 * The type of entities whose sources do not name a class.
	 */
	@JsonProperty("defaultEntityType")
	public String defaultEntityType;

	public IngestionOptions() {
		annotationSupport = isClassPresent(SPREADSHEET_LIBRARY_CLASS);
		ontologyExtensions = new ArrayList<>(Arrays.asList(".owl", ".rdf", ".xml"));
		annotationExtensions = new ArrayList<>(Arrays.asList(".xlsx", ".xls"));
		recursive = false;
		relationMappings = new ArrayList<>();
		defaultEntityType = EntityConstants.DEFAULT_ENTITY_TYPE;
	}

	public IngestionOptions(boolean annotationSupport) {
		this();
		this.annotationSupport = annotationSupport;
	}

	/**
	 * Checks whether a class can be found by the class loader of this class without initializing it.
	 *
	 * @param className The fully qualified class name.
	 * @return Whether the class is available.
	 */
	public static boolean isClassPresent(String className) {
		try {
			ClassUtils.getClass(IngestionOptions.class.getClassLoader(), className, false);
			return true;
		} catch (ClassNotFoundException | LinkageError e) {
			return false;
		}
	}

	public static IngestionOptions fromJson(Path file) throws IOException {
		try (InputStream is = Files.newInputStream(file)) {
			return GraphJsonSerializer.fromJson(is, IngestionOptions.class);
		}
	}

	/**
	 * Creates options from the system properties starting with {@link #SYSPROP_PREFIX}. Properties that are not set
	 * keep their default values. Extension lists are given comma separated.
	 *
	 * @return The options.
	 */
	public static IngestionOptions fromSystemProperties() {
		IngestionOptions options = new IngestionOptions();
		String annotations = System.getProperty(SYSPROP_ANNOTATIONS_ENABLED);
		if (!StringUtils.isBlank(annotations))
			options.annotationSupport = Boolean.parseBoolean(annotations.trim());
		String ontologyExtensions = System.getProperty(SYSPROP_ONTOLOGY_EXTENSIONS);
		if (!StringUtils.isBlank(ontologyExtensions))
			options.ontologyExtensions = splitExtensions(ontologyExtensions);
		String annotationExtensions = System.getProperty(SYSPROP_ANNOTATION_EXTENSIONS);
		if (!StringUtils.isBlank(annotationExtensions))
			options.annotationExtensions = splitExtensions(annotationExtensions);
		String recursive = System.getProperty(SYSPROP_RECURSIVE);
		if (!StringUtils.isBlank(recursive))
			options.recursive = Boolean.parseBoolean(recursive.trim());
		options.relationVocabularyFile = StringUtils.trimToNull(System.getProperty(SYSPROP_RELATION_VOCABULARY));
		String defaultType = System.getProperty(SYSPROP_DEFAULT_ENTITY_TYPE);
		if (!StringUtils.isBlank(defaultType))
			options.defaultEntityType = defaultType.trim();
		return options;
	}

	private static List<String> splitExtensions(String extensions) {
		return Arrays.stream(extensions.split(","))
				.map(String::trim)
				.filter(StringUtils::isNotEmpty)
				.map(e -> e.startsWith(".") ? e : "." + e)
				.collect(Collectors.toList());
	}

	public boolean isOntologyFile(Path file) {
		return hasExtension(file, ontologyExtensions);
	}

	public boolean isAnnotationFile(Path file) {
		return hasExtension(file, annotationExtensions);
	}

	private boolean hasExtension(Path file, List<String> extensions) {
		if (extensions == null || file.getFileName() == null)
			return false;
		String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
		return extensions.stream().anyMatch(e -> name.endsWith(e.toLowerCase(Locale.ROOT)));
	}

	@Override
	public String toString() {
		return "IngestionOptions{" +
				"annotationSupport=" + annotationSupport +
				", ontologyExtensions=" + ontologyExtensions +
				", annotationExtensions=" + annotationExtensions +
				", recursive=" + recursive +
				", relationMappings=" + relationMappings +
				", relationVocabularyFile='" + relationVocabularyFile + '\'' +
				", defaultEntityType='" + defaultEntityType + '\'' +
				'}';
	}
}
