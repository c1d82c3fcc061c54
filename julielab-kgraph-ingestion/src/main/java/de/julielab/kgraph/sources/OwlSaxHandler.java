package de.julielab.kgraph.sources;

import de.julielab.kgraph.auxiliaries.NameUtilities;
import de.julielab.kgraph.datarepresentation.ImportAssertion;
import de.julielab.kgraph.datarepresentation.ImportClass;
import de.julielab.kgraph.datarepresentation.ImportIndividual;
import de.julielab.kgraph.datarepresentation.ImportObjectProperty;
import de.julielab.kgraph.datarepresentation.PropertyValue;
import de.julielab.kgraph.datarepresentation.SourceDescriptor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

/**
 * <p>
 * SAX handler reading the subset of OWL in RDF/XML syntax that describes classes, object properties, individuals and
 * property assertions into a {@link SourceDescriptor}.
 * </p>
 * <p>
 * The document alternates between node elements (describing a resource) and property elements (describing one
 * statement about the enclosing resource). The handler keeps a stack of frames for the open elements. Node elements
 * are committed to the descriptor when they end, so that an <tt>rdf:type</tt> appearing after other properties still
 * determines what the node is. Content of constructs outside the supported subset is skipped as a whole.
 * </p>
 */
public class OwlSaxHandler extends DefaultHandler {
	public static final String RDF_NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
	public static final String RDFS_NS = "http://www.w3.org/2000/01/rdf-schema#";
	public static final String OWL_NS = "http://www.w3.org/2002/07/owl#";
	public static final String XML_NS = "http://www.w3.org/XML/1998/namespace";
	/**
	 * Key of the document's <tt>xml:base</tt> in the namespace table of the descriptor.
	 */
	public static final String BASE_KEY = "xml:base";

	private final static Logger log = LoggerFactory.getLogger(OwlSaxHandler.class);

	private enum NodeKind {
		CLASS, OBJECT_PROPERTY, NAMED_INDIVIDUAL, DESCRIPTION, TYPED_NODE
	}

	private static class NodeFrame {
		private final NodeKind kind;
		private final String name;
		private final String iri;
		private final List<String> typeIris = new ArrayList<>();
		private final List<String> superClasses = new ArrayList<>();
		private final Map<String, PropertyValue> literals = new LinkedHashMap<>();
		private final List<ImportAssertion> assertions = new ArrayList<>();
		private String domain;
		private String range;

		private NodeFrame(NodeKind kind, String name, String iri) {
			this.kind = kind;
			this.name = name;
			this.iri = iri;
		}
	}

	private static class PropertyFrame {
		private final String namespace;
		private final String localName;
		private final String resource;
		private final String datatype;
		private final StringBuilder text = new StringBuilder();
		private String nestedNode;

		private PropertyFrame(String namespace, String localName, String resource, String datatype) {
			this.namespace = namespace;
			this.localName = localName;
			this.resource = resource;
			this.datatype = datatype;
		}
	}

	private final SourceDescriptor descriptor;
	private final LinkedList<Object> stack = new LinkedList<>();
	/**
	 * Depth of open elements inside a skipped construct, 0 if nothing is skipped.
	 */
	private int skipDepth = 0;
	private boolean rootSeen = false;
	private int numSkipped = 0;

	public OwlSaxHandler(SourceDescriptor descriptor) {
		this.descriptor = descriptor;
	}

	@Override
	public void startPrefixMapping(String prefix, String uri) {
		descriptor.namespaces.putIfAbsent(prefix, uri);
	}

	@Override
	public void startElement(String uri, String localName, String qName, Attributes attributes) throws SAXException {
		if (skipDepth > 0) {
			skipDepth++;
			return;
		}
		if (!rootSeen) {
			rootSeen = true;
			if (!RDF_NS.equals(uri) || !"RDF".equals(localName))
				throw new SAXException("The document root is " + qName + " but an rdf:RDF root element is required.");
			String base = attributes.getValue(XML_NS, "base");
			if (base != null)
				descriptor.namespaces.put(BASE_KEY, base);
			stack.push(Boolean.TRUE);
			return;
		}
		Object parent = stack.peek();
		if (parent instanceof NodeFrame)
			startProperty(uri, localName, attributes);
		else
			startNode(uri, localName, qName, attributes, parent instanceof PropertyFrame);
	}

	private void startNode(String uri, String localName, String qName, Attributes attributes, boolean nested) {
		String reference = attributes.getValue(RDF_NS, "about");
		String id = attributes.getValue(RDF_NS, "ID");
		String name = id != null ? StringUtils.trimToNull(id) : NameUtilities.localName(reference, descriptor.namespaces);
		String iri = id != null ? expand("#" + id.trim()) : expand(reference);
		NodeKind kind = nodeKind(uri, localName);
		if (kind == null || name == null) {
			log.debug("{}: skipping {}{}", descriptor.sourceName, qName, name == null ? " without identifier" : "");
			numSkipped++;
			skipDepth = 1;
			return;
		}
		NodeFrame frame = new NodeFrame(kind, name, iri);
		if (kind == NodeKind.NAMED_INDIVIDUAL || kind == NodeKind.TYPED_NODE) {
			// register early to keep document order
			ImportIndividual individual = descriptor.getOrCreateIndividual(name, iri);
			individual.declared = true;
			if (kind == NodeKind.TYPED_NODE)
				individual.addClassTag(localName);
		}
		for (int i = 0; i < attributes.getLength(); i++) {
			String attributeNs = attributes.getURI(i);
			if (StringUtils.isEmpty(attributeNs) || RDF_NS.equals(attributeNs) || XML_NS.equals(attributeNs)
					|| OWL_NS.equals(attributeNs) || RDFS_NS.equals(attributeNs))
				continue;
			frame.literals.put(attributes.getLocalName(i),
					PropertyValue.fromLiteral(attributes.getValue(i), null, descriptor.sourceName));
		}
		stack.push(frame);
		if (nested)
			((PropertyFrame) stack.get(1)).nestedNode = name;
	}

	private NodeKind nodeKind(String uri, String localName) {
		if (OWL_NS.equals(uri)) {
			switch (localName) {
				case "Class":
					return NodeKind.CLASS;
				case "ObjectProperty":
					return NodeKind.OBJECT_PROPERTY;
				case "NamedIndividual":
					return NodeKind.NAMED_INDIVIDUAL;
				default:
					return null;
			}
		}
		if (RDFS_NS.equals(uri))
			return "Class".equals(localName) ? NodeKind.CLASS : null;
		if (RDF_NS.equals(uri))
			return "Description".equals(localName) ? NodeKind.DESCRIPTION : null;
		return NodeKind.TYPED_NODE;
	}

	private void startProperty(String uri, String localName, Attributes attributes) {
		String parseType = attributes.getValue(RDF_NS, "parseType");
		if (parseType != null) {
			log.debug("{}: skipping property {} with rdf:parseType {}", descriptor.sourceName, localName, parseType);
			numSkipped++;
			skipDepth = 1;
			return;
		}
		String resource = attributes.getValue(RDF_NS, "resource");
		stack.push(new PropertyFrame(uri, localName, resource, attributes.getValue(RDF_NS, "datatype")));
	}

	@Override
	public void characters(char[] ch, int start, int length) {
		if (skipDepth == 0 && stack.peek() instanceof PropertyFrame)
			((PropertyFrame) stack.peek()).text.append(ch, start, length);
	}

	@Override
	public void endElement(String uri, String localName, String qName) {
		if (skipDepth > 0) {
			skipDepth--;
			return;
		}
		Object top = stack.pop();
		if (top instanceof PropertyFrame)
			endProperty((PropertyFrame) top, (NodeFrame) stack.peek());
		else if (top instanceof NodeFrame)
			endNode((NodeFrame) top);
	}

	private void endProperty(PropertyFrame property, NodeFrame node) {
		String ns = property.namespace;
		String predicate = property.localName;
		if (RDF_NS.equals(ns) && "type".equals(predicate)) {
			if (property.resource != null)
				node.typeIris.add(expand(property.resource));
			return;
		}
		String objectName = property.resource != null
				? NameUtilities.localName(property.resource, descriptor.namespaces) : property.nestedNode;
		if (node.kind == NodeKind.CLASS || node.kind == NodeKind.OBJECT_PROPERTY) {
			if (RDFS_NS.equals(ns) && objectName != null) {
				switch (predicate) {
					case "subClassOf":
						node.superClasses.add(objectName);
						break;
					case "domain":
						node.domain = objectName;
						break;
					case "range":
						node.range = objectName;
						break;
					default:
						break;
				}
			}
			return;
		}
		if (OWL_NS.equals(ns) || RDF_NS.equals(ns) || (RDFS_NS.equals(ns) && objectName != null)) {
			log.debug("{}: skipping the vocabulary statement {} of {}", descriptor.sourceName, predicate, node.name);
			numSkipped++;
			return;
		}
		if (objectName != null) {
			node.assertions.add(new ImportAssertion(node.name, predicate, expandName(ns, predicate), objectName));
		} else {
			String text = property.text.toString();
			if (!text.isBlank())
				node.literals.put(predicate, PropertyValue.fromLiteral(text, expand(property.datatype), descriptor.sourceName));
		}
	}

	private void endNode(NodeFrame node) {
		boolean namedIndividual = node.kind == NodeKind.NAMED_INDIVIDUAL || node.kind == NodeKind.TYPED_NODE;
		boolean isClass = node.kind == NodeKind.CLASS;
		boolean isObjectProperty = node.kind == NodeKind.OBJECT_PROPERTY;
		List<String> classTags = new ArrayList<>();
		for (String typeIri : node.typeIris) {
			if ((OWL_NS + "Class").equals(typeIri) || (RDFS_NS + "Class").equals(typeIri))
				isClass = true;
			else if ((OWL_NS + "ObjectProperty").equals(typeIri))
				isObjectProperty = true;
			else if ((OWL_NS + "NamedIndividual").equals(typeIri))
				namedIndividual = true;
			else if ((OWL_NS + "Thing").equals(typeIri))
				namedIndividual = true;
			else if (typeIri.startsWith(OWL_NS) || typeIri.startsWith(RDFS_NS) || typeIri.startsWith(RDF_NS))
				log.debug("{}: {} is typed as {} which is not supported", descriptor.sourceName, node.name, typeIri);
			else
				classTags.add(NameUtilities.localName(typeIri, descriptor.namespaces));
		}
		if (isClass) {
			ImportClass importClass = descriptor.classes.computeIfAbsent(node.name, n -> new ImportClass(n, node.iri));
			node.superClasses.stream().filter(s -> !importClass.superClasses.contains(s)).forEach(importClass.superClasses::add);
			return;
		}
		if (isObjectProperty) {
			ImportObjectProperty property = descriptor.objectProperties.computeIfAbsent(node.name,
					n -> new ImportObjectProperty(n, node.iri));
			if (node.domain != null)
				property.domain = node.domain;
			if (node.range != null)
				property.range = node.range;
			return;
		}
		ImportIndividual individual = descriptor.getOrCreateIndividual(node.name, node.iri);
		if (namedIndividual || !classTags.isEmpty())
			individual.declared = true;
		classTags.forEach(individual::addClassTag);
		individual.literals.putAll(node.literals);
		node.assertions.forEach(descriptor::addAssertion);
	}

	/**
	 * Expands relative references and qualified names to IRIs using the document base and the namespace table.
	 */
	private String expand(String reference) {
		if (reference == null)
			return null;
		String ref = reference.trim();
		if (ref.startsWith("#")) {
			String base = descriptor.namespaces.get(BASE_KEY);
			if (base == null)
				base = descriptor.namespaces.get("");
			if (base == null)
				return ref;
			return StringUtils.stripEnd(base, "#") + ref;
		}
		int colon = ref.indexOf(':');
		if (colon > 0 && !ref.contains("/")) {
			String namespace = descriptor.namespaces.get(ref.substring(0, colon));
			if (namespace != null)
				return namespace + ref.substring(colon + 1);
		}
		return ref;
	}

	private String expandName(String namespace, String localName) {
		return StringUtils.isEmpty(namespace) ? localName : namespace + localName;
	}

	public int getNumSkipped() {
		return numSkipped;
	}

	@Override
	public void warning(SAXParseException e) {
		log.warn("{}: {} (line {})", descriptor.sourceName, e.getMessage(), e.getLineNumber());
	}
}
