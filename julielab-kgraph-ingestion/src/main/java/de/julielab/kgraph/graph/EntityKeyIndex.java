package de.julielab.kgraph.graph;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import de.julielab.kgraph.auxiliaries.NameUtilities;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lookup of entity IDs by normalized external key, by exact display name and by case-insensitive display name.
 * The index is not synchronized; the graph store guards it with its lock.
 */
public class EntityKeyIndex implements Iterable<String> {
	private final Map<String, String> idsByKey = new LinkedHashMap<>();
	private final Map<String, String> idsByName = new HashMap<>();
	private final SetMultimap<String, String> idsByLowerCaseName = LinkedHashMultimap.create();

	/**
	 * Adds an entity to the index.
	 *
	 * @param externalKey The normalized external key of the entity.
	 * @param name        The display name of the entity.
	 * @param id          The entity ID.
	 * @return <tt>true</tt> if there already was an entity for <tt>externalKey</tt>. In this case, the index is not
	 * changed.
	 */
	public boolean add(String externalKey, String name, String id) {
		if (idsByKey.containsKey(externalKey))
			return true;
		idsByKey.put(externalKey, id);
		idsByName.putIfAbsent(name, id);
		idsByLowerCaseName.put(name.toLowerCase(Locale.ROOT), id);
		return false;
	}

	public String getByKey(String externalKey) {
		return idsByKey.get(externalKey);
	}

	/**
	 * Normalizes <tt>rawKey</tt> and looks up the respective entity ID.
	 *
	 * @param rawKey A name or key as given by a source or a caller.
	 * @return The entity ID or null if there is no such entity or <tt>rawKey</tt> is blank.
	 */
	public String getByRawKey(String rawKey) {
		if (rawKey == null || rawKey.isBlank())
			return null;
		return idsByKey.get(NameUtilities.normalizeKey(rawKey));
	}

	public String getByName(String name) {
		return idsByName.get(name);
	}

	public List<String> getByNameIgnoreCase(String name) {
		return new ArrayList<>(idsByLowerCaseName.get(name.toLowerCase(Locale.ROOT)));
	}

	public boolean contains(String externalKey) {
		return idsByKey.containsKey(externalKey);
	}

	public void remove(String externalKey, String name, String id) {
		idsByKey.remove(externalKey, id);
		idsByName.remove(name, id);
		idsByLowerCaseName.remove(name.toLowerCase(Locale.ROOT), id);
	}

	/**
	 * @return An iterator over the external keys in insertion order.
	 */
	@Override
	public Iterator<String> iterator() {
		return idsByKey.keySet().iterator();
	}

	public int size() {
		return idsByKey.size();
	}

	public boolean isEmpty() {
		return idsByKey.isEmpty();
	}
}
