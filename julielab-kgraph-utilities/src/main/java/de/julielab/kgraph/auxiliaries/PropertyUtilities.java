package de.julielab.kgraph.auxiliaries;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Merge operations on property maps. All maps handled here are expected to keep insertion order (e.g.
 * {@link java.util.LinkedHashMap}) so that merged results stay deterministic.
 */
public class PropertyUtilities {

	private PropertyUtilities() {
	}

	/**
	 * Copies all non-null entries of <tt>source</tt> into <tt>target</tt>. Existing keys are overwritten, i.e. the
	 * last write wins on the level of single property keys.
	 *
	 * @param target The map to merge into.
	 * @param source The new property values, may be null.
	 * @return The keys whose value in <tt>target</tt> was added or changed.
	 */
	public static <V> Set<String> mergeProperties(Map<String, V> target, Map<String, ? extends V> source) {
		Set<String> changed = new LinkedHashSet<>();
		if (null == source)
			return changed;
		for (Map.Entry<String, ? extends V> e : source.entrySet()) {
			if (e.getKey() == null || e.getValue() == null)
				continue;
			V previous = target.put(e.getKey(), e.getValue());
			if (!e.getValue().equals(previous))
				changed.add(e.getKey());
		}
		return changed;
	}

	/**
	 * Copies those non-null entries of <tt>source</tt> into <tt>target</tt> whose keys are not contained in
	 * <tt>protectedKeys</tt>. This is used to let lower-precedence values fill gaps without touching values that have
	 * been set with higher precedence elsewhere.
	 *
	 * @param target        The map to merge into.
	 * @param source        The lower-precedence values.
	 * @param protectedKeys Keys that must not be written to <tt>target</tt>.
	 * @return The keys of <tt>source</tt> that were rejected because they were protected.
	 */
	public static <V> Set<String> mergeUnprotectedProperties(Map<String, V> target, Map<String, ? extends V> source,
			Set<String> protectedKeys) {
		Set<String> rejected = new LinkedHashSet<>();
		if (null == source)
			return rejected;
		for (Map.Entry<String, ? extends V> e : source.entrySet()) {
			if (e.getKey() == null || e.getValue() == null)
				continue;
			if (protectedKeys.contains(e.getKey())) {
				rejected.add(e.getKey());
				continue;
			}
			target.put(e.getKey(), e.getValue());
		}
		return rejected;
	}
}
