package de.julielab.kgraph;

import de.julielab.kgraph.annotations.AnnotationApplier;
import de.julielab.kgraph.annotations.AnnotationReport;
import de.julielab.kgraph.datarepresentation.AnnotationMapping;
import de.julielab.kgraph.datarepresentation.Direction;
import de.julielab.kgraph.datarepresentation.Entity;
import de.julielab.kgraph.datarepresentation.GraphStatistics;
import de.julielab.kgraph.datarepresentation.IssueType;
import de.julielab.kgraph.datarepresentation.LoadIssue;
import de.julielab.kgraph.datarepresentation.RelatedEntity;
import de.julielab.kgraph.datarepresentation.SourceDescriptor;
import de.julielab.kgraph.datarepresentation.util.GraphJsonSerializer;
import de.julielab.kgraph.graph.DanglingReferenceException;
import de.julielab.kgraph.graph.GraphIntegrityException;
import de.julielab.kgraph.graph.GraphStore;
import de.julielab.kgraph.graph.MergeReport;
import de.julielab.kgraph.options.IngestionOptions;
import de.julielab.kgraph.relations.RelationVocabulary;
import de.julielab.kgraph.sources.AnnotationSourceLoader;
import de.julielab.kgraph.sources.OntologySourceLoader;
import de.julielab.kgraph.sources.SourceParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static de.julielab.kgraph.datarepresentation.constants.EntityConstants.SOURCE_API;

/**
 * <p>
 * Entry point for building and querying a knowledge graph from ontology and annotation sources. A manager owns one
 * {@link GraphStore} together with the relation vocabulary and the loaders, all configured from one
 * {@link IngestionOptions} instance.
 * </p>
 * <p>
 * A load batch first merges all ontology sources, then applies all annotation sources. Within each group, files
 * are processed in the order of their file names, so that the outcome of overlapping sources does not depend on the
 * order the files were given or discovered in. A file that cannot be parsed is skipped and reported; the batch
 * continues with the next file.
 * </p>
 * <p>
 * Load batches are mutually exclusive. Queries may be issued at any time and never see a partially merged file.
 * If a batch is aborted by an unexpected error, the files merged so far stay in the graph and the manager returns
 * to its state before the batch, or to {@link LoaderState#READY} if the graph has content.
 * </p>
 */
public class KnowledgeGraphManager {

	private final static Logger log = LoggerFactory.getLogger(KnowledgeGraphManager.class);

	/**
	 * The order in which the files of a batch are processed: by file name, then by full path.
	 */
	public static final Comparator<Path> FILE_ORDER = Comparator.comparing((Path p) -> String.valueOf(p.getFileName()))
			.thenComparing(Path::toString);

	private final IngestionOptions options;
	private final GraphStore store;
	private final OntologySourceLoader ontologyLoader;
	private final AnnotationSourceLoader annotationLoader;
	private final AnnotationApplier annotationApplier;
	private final Set<String> loadedSources = Collections.synchronizedSet(new LinkedHashSet<>());
	private final Object loadLock = new Object();
	private volatile LoaderState state = LoaderState.EMPTY;

	public KnowledgeGraphManager() {
		this(new IngestionOptions());
	}

	public KnowledgeGraphManager(IngestionOptions options) {
		this(options, new GraphStore(createVocabulary(options), options.defaultEntityType));
	}

	/**
	 * Creates a manager on top of an existing store. The relation vocabulary and the default entity type of the store
	 * are used; the respective options are ignored.
	 *
	 * @param options The ingestion options.
	 * @param store   The graph store to load into.
	 */
	public KnowledgeGraphManager(IngestionOptions options, GraphStore store) {
		this.options = options;
		this.store = store;
		this.ontologyLoader = new OntologySourceLoader();
		this.annotationLoader = new AnnotationSourceLoader(options);
		this.annotationApplier = new AnnotationApplier(store);
		log.debug("Created knowledge graph manager with options {}", options);
	}

	private static RelationVocabulary createVocabulary(IngestionOptions options) {
		RelationVocabulary vocabulary = RelationVocabulary.createDefault();
		if (options.relationVocabularyFile != null) {
			try {
				vocabulary.load(Paths.get(options.relationVocabularyFile));
			} catch (IOException e) {
				throw new UncheckedIOException("Could not read the relation vocabulary " + options.relationVocabularyFile, e);
			}
		}
		vocabulary.registerAll(options.relationMappings);
		return vocabulary;
	}

	/**
	 * Loads the ontology and annotation files found in <tt>directory</tt>, recognized by the file extensions given in
	 * the options. Subdirectories are searched if {@link IngestionOptions#recursive} is set.
	 *
	 * @param directory The source directory.
	 * @return The report of the load batch.
	 * @throws IOException If the directory cannot be listed.
	 */
	public LoadReport loadDirectory(Path directory) throws IOException {
		if (!Files.isDirectory(directory))
			throw new IOException(directory + " is not a directory.");
		List<Path> files;
		try (Stream<Path> stream = options.recursive ? Files.walk(directory) : Files.list(directory)) {
			files = stream.filter(Files::isRegularFile).collect(Collectors.toList());
		}
		List<Path> ontologyFiles = files.stream().filter(options::isOntologyFile).collect(Collectors.toList());
		List<Path> annotationFiles = files.stream().filter(options::isAnnotationFile).collect(Collectors.toList());
		log.info("Found {} ontology files and {} annotation files in {}", ontologyFiles.size(), annotationFiles.size(), directory);
		return load(ontologyFiles, annotationFiles);
	}

	public LoadReport loadOntologies(Path... ontologyFiles) {
		return load(Arrays.asList(ontologyFiles), Collections.emptyList());
	}

	/**
	 * Loads one batch of sources. All ontology files are merged before any annotation file is applied.
	 *
	 * @param ontologyFiles   Ontology files, in any order.
	 * @param annotationFiles Annotation files, in any order.
	 * @return The report of the load batch.
	 * @throws IllegalStateException   If the manager is in state {@link LoaderState#FAILED}.
	 * @throws GraphIntegrityException If the graph store is found to be inconsistent. The manager is in state
	 *                                 {@link LoaderState#FAILED} afterwards.
	 */
	public LoadReport load(Collection<Path> ontologyFiles, Collection<Path> annotationFiles) {
		synchronized (loadLock) {
			checkNotFailed();
			LoaderState previous = state;
			state = LoaderState.LOADING;
			LoadReport report = new LoadReport();
			try {
				List<Path> ontologies = sort(ontologyFiles);
				List<Path> annotations = sort(annotationFiles);
				log.info("Loading {} ontology files and {} annotation files.", ontologies.size(), annotations.size());
				for (Path file : ontologies)
					mergeOntology(file, report);
				if (!annotations.isEmpty()) {
					if (annotationLoader.isAnnotationSupport()) {
						for (Path file : annotations)
							applyAnnotations(file, report);
					} else {
						String message = "Annotation support is disabled, " + annotations.size()
								+ " annotation files were not read.";
						log.warn(message);
						report.addIssue(new LoadIssue(IssueType.DEPENDENCY_MISSING, null, message));
					}
				}
				List<String> violations = store.checkIntegrity();
				if (!violations.isEmpty())
					throw new GraphIntegrityException("The graph store is inconsistent after loading: " + violations);
				state = LoaderState.READY;
			} catch (GraphIntegrityException e) {
				log.error("The graph store is corrupted, no further loads or writes are accepted.", e);
				state = LoaderState.FAILED;
				report.setFinalState(state);
				throw e;
			} catch (RuntimeException | Error e) {
				state = previous == LoaderState.EMPTY && store.getNumEntities() == 0 ? LoaderState.EMPTY : LoaderState.READY;
				log.error("Load aborted by an unexpected error, the manager returns to state {}.", state, e);
				throw e;
			}
			report.setFinalState(state);
			log.info("Load finished with {} issues; the graph has {} entities and {} relationships.",
					report.getIssues().size(), store.getNumEntities(), store.getNumRelationships());
			return report;
		}
	}

	private void mergeOntology(Path file, LoadReport report) {
		SourceDescriptor descriptor;
		try {
			descriptor = ontologyLoader.load(file);
		} catch (SourceParseException | RuntimeException e) {
			log.warn("Skipping ontology {}: {}", file, e.getMessage());
			report.addSkippedFile(file, new LoadIssue(IssueType.PARSE_ERROR, String.valueOf(file.getFileName()), e.getMessage()));
			return;
		}
		MergeReport mergeReport = store.mergeDescriptor(descriptor);
		report.addMergeReport(file, mergeReport);
		loadedSources.add(descriptor.sourceName);
	}

	private void applyAnnotations(Path file, LoadReport report) {
		AnnotationMapping mapping;
		try {
			mapping = annotationLoader.load(file, store::hasEntityName);
		} catch (SourceParseException | RuntimeException e) {
			log.warn("Skipping annotation file {}: {}", file, e.getMessage());
			report.addSkippedFile(file, new LoadIssue(IssueType.PARSE_ERROR, String.valueOf(file.getFileName()), e.getMessage()));
			return;
		} catch (LinkageError e) {
			// the spreadsheet library is incomplete or incompatible
			log.error("Skipping annotation file {}, the spreadsheet library could not be loaded: {}", file, e.toString());
			report.addSkippedFile(file, new LoadIssue(IssueType.DEPENDENCY_MISSING, String.valueOf(file.getFileName()),
					e.toString()));
			return;
		}
		AnnotationReport annotationReport = annotationApplier.apply(mapping);
		report.addAnnotationReport(file, annotationReport);
		loadedSources.add(mapping.getSourceName());
	}

	private static List<Path> sort(Collection<Path> files) {
		if (files == null)
			return Collections.emptyList();
		return new ArrayList<>(files.stream().sorted(FILE_ORDER).collect(Collectors.toCollection(LinkedHashSet::new)));
	}

	public List<Entity> query(String type, String nameSubstring, Map<String, ?> properties) {
		return store.query(type, nameSubstring, properties);
	}

	public List<Entity> query(String type) {
		return query(type, null, null);
	}

	public Optional<Entity> getEntity(String id) {
		return store.getEntity(id);
	}

	public Optional<Entity> findByName(String name) {
		return store.findByName(name);
	}

	public List<Entity> search(String text, String type) {
		return store.search(text, type);
	}

	public List<RelatedEntity> getRelated(String id, Collection<String> relationTypes, Direction direction) {
		return store.getRelated(id, relationTypes, direction);
	}

	public List<RelatedEntity> getRelated(String id, String... relationTypes) {
		return store.getRelated(id, Arrays.asList(relationTypes), Direction.BOTH);
	}

	/**
	 * Creates an entity or, if an entity with the same normalized name exists, merges the properties into it.
	 *
	 * @return The entity ID.
	 */
	public String addEntity(String type, String name, Map<String, ?> properties) {
		checkNotFailed();
		String id = store.upsertEntity(name, type, properties, SOURCE_API);
		markWritten();
		return id;
	}

	public String addRelationship(String type, String sourceId, String targetId) throws DanglingReferenceException {
		return addRelationship(type, sourceId, targetId, null);
	}

	public String addRelationship(String type, String sourceId, String targetId, Map<String, ?> properties)
			throws DanglingReferenceException {
		checkNotFailed();
		String id = store.addRelationship(type, sourceId, targetId, properties, SOURCE_API);
		markWritten();
		return id;
	}

	public boolean removeEntity(String id) {
		checkNotFailed();
		return store.removeEntity(id);
	}

	public boolean removeRelationship(String id) {
		checkNotFailed();
		return store.removeRelationship(id);
	}

	public GraphStatistics stats() {
		return store.stats();
	}

	/**
	 * Checks the invariants of the graph store. If a violation is found, the manager changes to
	 * {@link LoaderState#FAILED}.
	 *
	 * @return The violations found, empty if the store is consistent.
	 */
	public List<String> checkIntegrity() {
		List<String> violations = store.checkIntegrity();
		if (!violations.isEmpty() && state != LoaderState.FAILED) {
			log.error("The graph store is inconsistent: {}", violations);
			state = LoaderState.FAILED;
		}
		return violations;
	}

	/**
	 * @return All entities and relationships as JSON, for inspection.
	 */
	public String exportGraphAsJson() {
		return GraphJsonSerializer.toJson(store.export());
	}

	/**
	 * @return The names of the sources that have been loaded successfully, in load order.
	 */
	public List<String> getLoadedSources() {
		synchronized (loadedSources) {
			return new ArrayList<>(loadedSources);
		}
	}

	public LoaderState getState() {
		return state;
	}

	public GraphStore getStore() {
		return store;
	}

	public IngestionOptions getOptions() {
		return options;
	}

	/**
	 * A graph filled through the write API without any load is {@link LoaderState#READY} as well.
	 */
	private void markWritten() {
		if (state == LoaderState.EMPTY) {
			synchronized (loadLock) {
				if (state == LoaderState.EMPTY)
					state = LoaderState.READY;
			}
		}
	}

	private void checkNotFailed() {
		if (state == LoaderState.FAILED)
			throw new IllegalStateException("The knowledge graph is in state " + LoaderState.FAILED
					+ " because its store was found to be inconsistent; only reads are allowed.");
	}
}
