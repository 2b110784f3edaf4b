/*-
 * #%L
 * This file is part of SPMView.
 * %%
 * Copyright (C) 2024 - 2025 SPMView developers
 * %%
 * SPMView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SPMView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SPMView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package spmview.lib.images.stores;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Map for storing cached arrays or images, which automatically removes the entry that has been accessed
 * least recently once it holds a maximum number of entries.
 * <p>
 * All access is synchronized on the cache itself. Callers must not compute values while holding the lock:
 * look up, compute outside, then {@link #put(Object, Object)}.
 *
 * @param <K> key type
 * @param <V> value type
 */
class BoundedLruCache<K, V> {

	private final int maxCapacity;
	private final Map<K, V> map;
	private long nEvicted = 0;

	BoundedLruCache(final int maxCapacity) {
		if (maxCapacity <= 0)
			throw new IllegalArgumentException("Cache capacity must be > 0, but was " + maxCapacity);
		this.maxCapacity = maxCapacity;
		// Access order, so that iteration starts with the least recently used entry
		this.map = new LinkedHashMap<K, V>(maxCapacity + 1, 2f, true) {

			private static final long serialVersionUID = 1L;

			@Override
			protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
				boolean doRemove = size() > BoundedLruCache.this.maxCapacity;
				if (doRemove)
					nEvicted++;
				return doRemove;
			}

		};
	}

	/**
	 * Get a value, marking it as most recently used.
	 * @param key
	 * @return the value, or null if the key is not in the cache
	 */
	synchronized V get(K key) {
		return map.get(key);
	}

	/**
	 * Query whether a key is present, without changing the access order.
	 * @param key
	 * @return
	 */
	synchronized boolean containsKey(K key) {
		return map.containsKey(key);
	}

	/**
	 * Add a value, evicting the least recently used entry if the capacity is exceeded.
	 * @param key
	 * @param value
	 * @return the previous value for the key, or null
	 */
	synchronized V put(K key, V value) {
		return map.put(key, value);
	}

	/**
	 * Add a value after first removing all entries with keys matching a predicate, unless the cache contains
	 * an entry that takes precedence over the new one.
	 * The check, removal and insertion happen within the same critical section.
	 * @param key
	 * @param value
	 * @param precedence predicate identifying keys that take precedence; if any is present, nothing changes
	 * @param superseded predicate identifying keys that should be removed
	 * @return true if the value was added, false if an entry with precedence was found
	 */
	synchronized boolean replace(K key, V value, Predicate<? super K> precedence, Predicate<? super K> superseded) {
		for (var k : map.keySet()) {
			if (precedence.test(k))
				return false;
		}
		removeIf(superseded);
		map.put(key, value);
		return true;
	}

	/**
	 * Remove a single entry.
	 * @param key
	 * @return the removed value, or null
	 */
	synchronized V remove(K key) {
		return map.remove(key);
	}

	/**
	 * Remove all entries with keys matching a predicate.
	 * @param predicate
	 * @return the number of entries removed
	 */
	synchronized int removeIf(Predicate<? super K> predicate) {
		int n = 0;
		Iterator<K> iter = map.keySet().iterator();
		while (iter.hasNext()) {
			if (predicate.test(iter.next())) {
				iter.remove();
				n++;
			}
		}
		return n;
	}

	/**
	 * Get the keys, from least to most recently used.
	 * @return a snapshot of the keys
	 */
	synchronized List<K> keys() {
		return new ArrayList<>(map.keySet());
	}

	synchronized int size() {
		return map.size();
	}

	synchronized void clear() {
		map.clear();
	}

	int getCapacity() {
		return maxCapacity;
	}

	/**
	 * Number of entries removed because the capacity was exceeded.
	 * @return
	 */
	synchronized long getEvictionCount() {
		return nEvicted;
	}

	@Override
	public synchronized String toString() {
		return String.format("Cache: %d/%d, %d evicted", map.size(), maxCapacity, nEvicted);
	}

}
