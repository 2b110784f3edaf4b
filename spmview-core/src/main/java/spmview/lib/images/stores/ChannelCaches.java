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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The caches used to create channel thumbnails: decoded arrays, processed arrays, downsampled arrays and rendered images.
 */
public class ChannelCaches {

	private static final Logger logger = LoggerFactory.getLogger(ChannelCaches.class);

	private final RawChannelStore rawStore;
	private final ProcessedChannelStore processedStore;
	private final ThumbnailStore thumbnailStore;

	/**
	 * Create caches with capacities from the specified settings.
	 * @param settings
	 */
	public ChannelCaches(CacheSettings settings) {
		this.rawStore = new RawChannelStore(settings.getRawCapacity());
		this.processedStore = new ProcessedChannelStore(settings.getProcessedCapacity());
		this.thumbnailStore = new ThumbnailStore(settings.getThumbnailCapacity(), settings.getRenderedCapacity());
	}

	/**
	 * Cache of decoded arrays.
	 * @return
	 */
	public RawChannelStore getRawStore() {
		return rawStore;
	}

	/**
	 * Cache of unit-normalized, filtered arrays.
	 * @return
	 */
	public ProcessedChannelStore getProcessedStore() {
		return processedStore;
	}

	/**
	 * Cache of downsampled arrays and rendered images.
	 * @return
	 */
	public ThumbnailStore getThumbnailStore() {
		return thumbnailStore;
	}

	/**
	 * Remove all entries within a scope from every cache.
	 * @param scope
	 * @return the total number of entries removed
	 */
	public int invalidate(InvalidationScope scope) {
		if (scope.isAll()) {
			int n = rawStore.size() + processedStore.size() + thumbnailStore.size() + thumbnailStore.renderedSize();
			clear();
			logger.debug("Cleared all caches ({} entries)", n);
			return n;
		}
		int n = rawStore.invalidate(scope);
		n += processedStore.invalidate(scope);
		n += thumbnailStore.invalidate(scope);
		logger.debug("Invalidated {} cache entries for {}", n, scope);
		return n;
	}

	/**
	 * Remove all entries from every cache.
	 */
	public void clear() {
		rawStore.clear();
		processedStore.clear();
		thumbnailStore.clear();
	}

	@Override
	public String toString() {
		return "ChannelCaches [" + rawStore + ", " + processedStore + ", " + thumbnailStore + "]";
	}

}
