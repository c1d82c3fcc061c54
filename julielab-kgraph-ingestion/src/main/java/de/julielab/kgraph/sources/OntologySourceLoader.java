package de.julielab.kgraph.sources;

import de.julielab.kgraph.datarepresentation.SourceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <p>
 * Reads ontology files in RDF/XML syntax into {@link SourceDescriptor}s. The file is streamed through a SAX parser,
 * no document tree is built. External entities and DTDs are never fetched; entities declared in the internal DTD
 * subset, like <tt>&amp;xsd;</tt>, are expanded.
 * </p>
 * <p>
 * The loader does not touch any graph. It can be used by several threads, each call creates its own parser.
 * </p>
 */
public class OntologySourceLoader {

	private final static Logger log = LoggerFactory.getLogger(OntologySourceLoader.class);

	private final SAXParserFactory factory;

	public OntologySourceLoader() {
		factory = SAXParserFactory.newInstance();
		factory.setNamespaceAware(true);
		factory.setValidating(false);
		try {
			factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
			factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
			factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
		} catch (ParserConfigurationException | SAXException e) {
			throw new IllegalStateException("The XML parser does not support the features required to read ontologies safely.", e);
		}
	}

	/**
	 * Parses one ontology file. The file name serves as source name.
	 *
	 * @param file The ontology file.
	 * @return The descriptor of the file's content.
	 * @throws SourceParseException If the file cannot be read, is not well-formed or its root is not <tt>rdf:RDF</tt>.
	 */
	public SourceDescriptor load(Path file) throws SourceParseException {
		String sourceName = file.getFileName() != null ? file.getFileName().toString() : file.toString();
		if (!Files.isRegularFile(file))
			throw new SourceParseException("The ontology file " + file + " does not exist or is not a regular file.");
		log.info("Reading ontology {}", file);
		try (InputStream is = new BufferedInputStream(Files.newInputStream(file))) {
			return load(is, sourceName, file.toUri().toString());
		} catch (IOException e) {
			throw new SourceParseException("Could not read the ontology file " + file, e);
		}
	}

	public SourceDescriptor load(InputStream is, String sourceName) throws SourceParseException {
		return load(is, sourceName, null);
	}

	private SourceDescriptor load(InputStream is, String sourceName, String systemId) throws SourceParseException {
		SourceDescriptor descriptor = new SourceDescriptor(sourceName);
		OwlSaxHandler handler = new OwlSaxHandler(descriptor);
		try {
			SAXParser parser = factory.newSAXParser();
			InputSource inputSource = new InputSource(is);
			if (systemId != null)
				inputSource.setSystemId(systemId);
			parser.parse(inputSource, handler);
		} catch (SAXParseException e) {
			throw new SourceParseException("Malformed ontology " + sourceName + " at line " + e.getLineNumber()
					+ ", column " + e.getColumnNumber() + ": " + e.getMessage(), e);
		} catch (SAXException e) {
			throw new SourceParseException("Could not parse the ontology " + sourceName + ": " + e.getMessage(), e);
		} catch (ParserConfigurationException | IOException e) {
			throw new SourceParseException("Could not read the ontology " + sourceName, e);
		}
		log.debug("Read {} classes, {} object properties, {} individuals and {} assertions from {}; {} constructs skipped.",
				descriptor.classes.size(), descriptor.objectProperties.size(), descriptor.individuals.size(),
				descriptor.assertions.size(), sourceName, handler.getNumSkipped());
		return descriptor;
	}
}
