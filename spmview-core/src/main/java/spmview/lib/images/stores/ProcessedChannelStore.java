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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import spmview.lib.filters.FilterPipeline;
import spmview.lib.filters.UnitNormalizer;
import spmview.lib.images.ChannelArray;

/**
 * Bounded cache of channel arrays after unit normalization and filtering.
 */
public class ProcessedChannelStore {

	private static final Logger logger = LoggerFactory.getLogger(ProcessedChannelStore.class);

	private final BoundedLruCache<ProcessedChannelKey, ChannelArray> cache;

	/**
	 * Constructor.
	 * @param capacity maximum number of arrays to keep
	 */
	public ProcessedChannelStore(int capacity) {
		this.cache = new BoundedLruCache<>(capacity);
	}

	/**
	 * Get a cached processed array, or compute and cache it.
	 * @param key
	 * @param raw the raw array identified by {@code key.getRawKey()}
	 * @param pipeline the filter pipeline; its signature must match the key
	 * @return
	 * @throws IllegalArgumentException if the pipeline signature does not match the key
	 */
	public ChannelArray getOrProcess(ProcessedChannelKey key, ChannelArray raw, FilterPipeline pipeline) {
		var array = cache.get(key);
		if (array != null) {
			logger.trace("Processed cache hit for {}", key);
			return array;
		}
		array = process(key, raw, pipeline);
		cache.put(key, array);
		return array;
	}

	/**
	 * Convert a raw array to its normalized unit and apply a filter pipeline, without using the cache.
	 * Filter steps that cannot be applied are skipped.
	 *
	 * @param key
	 * @param raw
	 * @param pipeline the filter pipeline; its signature must match the key
	 * @return
	 * @throws IllegalArgumentException if the pipeline signature does not match the key
	 */
	public static ChannelArray process(ProcessedChannelKey key, ChannelArray raw, FilterPipeline pipeline) {
		Objects.requireNonNull(raw);
		if (!pipeline.getSignature().equals(key.getSignature()))
			throw new IllegalArgumentException("Pipeline " + pipeline + " does not match key " + key);
		var normalized = UnitNormalizer.normalize(raw, key.getSourceUnit());
		if (pipeline.isEmpty())
			return normalized;
		logger.debug("Applying {} to {}", pipeline, key.getRawKey());
		var output = pipeline.apply(normalized);
		if (output.getSkippedCount() > 0)
			logger.debug("{} filter step(s) skipped for {}", output.getSkippedCount(), key.getRawKey());
		return output.getArray();
	}

	/**
	 * Get a cached array, marking it as recently used.
	 * @param key
	 * @return
	 */
	public Optional<ChannelArray> getIfPresent(ProcessedChannelKey key) {
		return Optional.ofNullable(cache.get(key));
	}

	/**
	 * Store a processed array.
	 * @param key
	 * @param array
	 */
	public void put(ProcessedChannelKey key, ChannelArray array) {
		cache.put(key, Objects.requireNonNull(array));
	}

	/**
	 * Remove all entries within a scope.
	 * @param scope
	 * @return the number of entries removed
	 */
	public int invalidate(InvalidationScope scope) {
		return cache.removeIf(k -> scope.matches(k.getRawKey()));
	}

	/**
	 * Keys currently cached, from least to most recently used.
	 * @return
	 */
	public List<ProcessedChannelKey> getKeys() {
		return cache.keys();
	}

	/**
	 * Number of cached arrays.
	 * @return
	 */
	public int size() {
		return cache.size();
	}

	/**
	 * Maximum number of cached arrays.
	 * @return
	 */
	public int getCapacity() {
		return cache.getCapacity();
	}

	/**
	 * Remove all entries.
	 */
	public void clear() {
		cache.clear();
	}

	@Override
	public String toString() {
		return "ProcessedChannelStore [" + cache + "]";
	}

}
