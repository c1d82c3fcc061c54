package de.julielab.kgraph.sources;

import de.julielab.kgraph.datarepresentation.AnnotationMapping;
import de.julielab.kgraph.options.IngestionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Predicate;

/**
 * <p>
 * Reads spreadsheet annotation sources into {@link AnnotationMapping}s.
 * </p>
 * <p>
 * Whether annotation sources can be read is declared by {@link IngestionOptions#annotationSupport}. When it is
 * switched off, or the spreadsheet library cannot be found although it is declared available, this loader returns an empty mapping flagged as
 * {@link AnnotationMapping#isDependencyMissing() dependency missing} and does not load any spreadsheet classes, so
 * the spreadsheet library may be absent from the classpath.
 * </p>
 */
public class AnnotationSourceLoader {

	private final static Logger log = LoggerFactory.getLogger(AnnotationSourceLoader.class);

	private final boolean annotationSupport;

	public AnnotationSourceLoader(IngestionOptions options) {
		this(options, IngestionOptions.isClassPresent(IngestionOptions.SPREADSHEET_LIBRARY_CLASS));
	}

	AnnotationSourceLoader(IngestionOptions options, boolean libraryPresent) {
		if (options.annotationSupport && !libraryPresent)
			log.warn("Annotation support is enabled but {} cannot be found. Annotation sources will not be read.",
					IngestionOptions.SPREADSHEET_LIBRARY_CLASS);
		this.annotationSupport = options.annotationSupport && libraryPresent;
	}

	public boolean isAnnotationSupport() {
		return annotationSupport;
	}

	/**
	 * Reads all sheets of a workbook.
	 *
	 * @param file         The workbook file.
	 * @param isEntityName Tells whether a cell value is the display name of an existing entity. It is used to find
	 *                     the key column of sheets without a <tt>name</tt> or <tt>id</tt> column.
	 * @return The annotations of the workbook.
	 * @throws SourceParseException If the file cannot be read or is not a workbook.
	 */
	public AnnotationMapping load(Path file, Predicate<String> isEntityName) throws SourceParseException {
		String sourceName = file.getFileName() != null ? file.getFileName().toString() : file.toString();
		if (!annotationSupport) {
			log.debug("Annotation support is disabled, {} is not read.", file);
			return AnnotationMapping.dependencyMissing(sourceName);
		}
		if (!Files.isRegularFile(file))
			throw new SourceParseException("The annotation file " + file + " does not exist or is not a regular file.");
		log.info("Reading annotations from {}", file);
		return new WorkbookReader(isEntityName).read(file, sourceName);
	}
}
