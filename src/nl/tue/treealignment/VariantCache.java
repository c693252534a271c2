package nl.tue.treealignment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded least-recently-used cache from trace variants to their alignments.
 * Variants are compared by value. When two threads store an alignment for the
 * same variant, the first one is kept and returned to both.
 *
 * A cache of size 0 stores nothing.
 */
public class VariantCache {

	private final int maximumSize;
	private final Map<List<String>, Alignment> map;

	public VariantCache(final int maximumSize) {
		if (maximumSize < 0) {
			throw new IllegalArgumentException("Negative cache size: " + maximumSize);
		}
		this.maximumSize = maximumSize;
		this.map = Collections.synchronizedMap(new LinkedHashMap<List<String>, Alignment>(16, 0.75f, true) {
			private static final long serialVersionUID = 1L;

			protected boolean removeEldestEntry(Map.Entry<List<String>, Alignment> eldest) {
				return size() > maximumSize;
			}
		});
	}

	/**
	 * Returns the cached alignment of the variant, or null.
	 */
	public Alignment get(List<String> variant) {
		if (maximumSize == 0) {
			return null;
		}
		return map.get(variant);
	}

	/**
	 * Stores the alignment unless one is already present for the variant.
	 *
	 * @return the alignment now associated with the variant
	 */
	public Alignment putIfAbsent(List<String> variant, Alignment alignment) {
		if (maximumSize == 0) {
			return alignment;
		}
		synchronized (map) {
			Alignment present = map.get(variant);
			if (present != null) {
				return present;
			}
			map.put(variant, alignment);
			return alignment;
		}
	}

	public int size() {
		return map.size();
	}
}
