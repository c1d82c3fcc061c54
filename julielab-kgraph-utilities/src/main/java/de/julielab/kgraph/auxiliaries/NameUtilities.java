package de.julielab.kgraph.auxiliaries;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Map;

/**
 * Helpers to derive names and lookup keys from IRIs, qualified names and free text.
 */
public class NameUtilities {

	private NameUtilities() {
	}

	/**
	 * <p>
	 * Returns the local part of an IRI or name. The local part is the fragment after the last <tt>#</tt>, else the
	 * last path segment after <tt>/</tt>, else the part after a <tt>prefix:</tt> that is a key of
	 * <tt>namespaces</tt>. Bare names are returned trimmed but otherwise unchanged.
	 * </p>
	 *
	 * @param value      An IRI, a relative reference like <tt>#Diabetes</tt>, a qualified name or a bare name.
	 * @param namespaces The namespace table (prefix to IRI) used to recognize qualified names, may be null.
	 * @return The local name or null if <tt>value</tt> is blank.
	 */
	public static String localName(String value, Map<String, String> namespaces) {
		if (StringUtils.isBlank(value))
			return null;
		String name = StringUtils.stripEnd(value.trim(), "/#");
		int hash = name.lastIndexOf('#');
		if (hash >= 0)
			return StringUtils.trimToNull(name.substring(hash + 1));
		int slash = name.lastIndexOf('/');
		if (slash >= 0)
			return StringUtils.trimToNull(name.substring(slash + 1));
		int colon = name.indexOf(':');
		if (colon >= 0 && null != namespaces && namespaces.containsKey(name.substring(0, colon)))
			return StringUtils.trimToNull(name.substring(colon + 1));
		return StringUtils.trimToNull(name);
	}

	public static String localName(String value) {
		return localName(value, null);
	}

	/**
	 * Normalizes an external entity key: surrounding whitespace is removed, inner whitespace runs are collapsed into a
	 * single space and the result is lower-cased independently of the default locale.
	 *
	 * @param key The raw key, e.g. an individual name or an entity display name.
	 * @return The normalized key.
	 * @throws IllegalArgumentException If <tt>key</tt> is null or blank.
	 */
	public static String normalizeKey(String key) {
		if (StringUtils.isBlank(key))
			throw new IllegalArgumentException("An external entity key must not be blank but was \"" + key + "\".");
		return StringUtils.normalizeSpace(key).toLowerCase(Locale.ROOT);
	}

	/**
	 * Normalizes a relation name for vocabulary lookup. Case, underscores, hyphens and whitespace are ignored so that
	 * <tt>has_disease</tt>, <tt>hasDisease</tt> and <tt>HAS-DISEASE</tt> yield the same key.
	 *
	 * @param relationName The relation name as given by a source.
	 * @return The lookup key.
	 */
	public static String normalizeRelationName(String relationName) {
		if (StringUtils.isBlank(relationName))
			throw new IllegalArgumentException("A relation name must not be blank but was \"" + relationName + "\".");
		StringBuilder sb = new StringBuilder(relationName.length());
		for (char c : relationName.toCharArray()) {
			if (c == '_' || c == '-' || Character.isWhitespace(c))
				continue;
			sb.append(Character.toLowerCase(c));
		}
		return sb.toString();
	}
}
