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

import spmview.lib.images.ChannelArray;
import spmview.lib.io.ChannelDecodeException;

/**
 * Bounded cache of decoded channel arrays.
 * <p>
 * Only one version of each channel is kept: storing a newer version removes any older ones,
 * and an older version is never stored once a newer one is cached.
 */
public class RawChannelStore {

	private static final Logger logger = LoggerFactory.getLogger(RawChannelStore.class);

	private final BoundedLruCache<RawChannelKey, ChannelArray> cache;

	/**
	 * Constructor.
	 * @param capacity maximum number of arrays to keep
	 */
	public RawChannelStore(int capacity) {
		this.cache = new BoundedLruCache<>(capacity);
	}

	/**
	 * Get a cached array, or decode and cache it.
	 * The decoder is called without holding the cache lock, so that other threads are not blocked while it reads the file.
	 * Nothing is cached if decoding fails.
	 *
	 * @param key
	 * @param decoder
	 * @return
	 * @throws ChannelDecodeException if the array was not cached and could not be decoded
	 */
	public ChannelArray getOrDecode(RawChannelKey key, ChannelDecoder decoder) throws ChannelDecodeException {
		var array = cache.get(key);
		if (array != null) {
			logger.trace("Raw cache hit for {}", key);
			return array;
		}
		logger.debug("Decoding {}", key);
		array = Objects.requireNonNull(decoder.decode(key), "Decoder returned null");
		put(key, array);
		return array;
	}

	/**
	 * Get a cached array, marking it as recently used.
	 * @param key
	 * @return
	 */
	public Optional<ChannelArray> getIfPresent(RawChannelKey key) {
		return Optional.ofNullable(cache.get(key));
	}

	/**
	 * Store an array, removing any older versions of the same channel.
	 * Nothing is stored if a newer version of the channel is already cached, since results may arrive
	 * in any order.
	 * @param key
	 * @param array
	 * @return true if the array was stored, false if a newer version was found
	 */
	public boolean put(RawChannelKey key, ChannelArray array) {
		Objects.requireNonNull(array);
		boolean added = cache.replace(key, array,
				k -> k.isNewerVersionOf(key),
				k -> k.isSameChannel(key) && !k.equals(key));
		if (!added)
			logger.debug("Not caching {}, a newer version is already cached", key);
		return added;
	}

	/**
	 * Remove all entries within a scope.
	 * @param scope
	 * @return the number of entries removed
	 */
	public int invalidate(InvalidationScope scope) {
		return cache.removeIf(scope::matches);
	}

	/**
	 * Keys currently cached, from least to most recently used.
	 * @return
	 */
	public List<RawChannelKey> getKeys() {
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
		return "RawChannelStore [" + cache + "]";
	}

}
