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

import java.util.Properties;

import spmview.lib.common.GeneralTools;
import spmview.lib.common.Prefs;

/**
 * Capacities of the channel caches, and the size of the render worker pool.
 * <p>
 * Settings are validated when they are built, so that misconfiguration is reported immediately
 * rather than when images are first requested.
 */
public final class CacheSettings {

	/**
	 * Property key for the raw channel cache capacity.
	 */
	public static final String KEY_RAW_CAPACITY = "spmview.cache.raw";

	/**
	 * Property key for the processed channel cache capacity.
	 */
	public static final String KEY_PROCESSED_CAPACITY = "spmview.cache.processed";

	/**
	 * Property key for the downsampled array cache capacity.
	 */
	public static final String KEY_THUMBNAIL_CAPACITY = "spmview.cache.thumbnails";

	/**
	 * Property key for the rendered image cache capacity.
	 */
	public static final String KEY_RENDERED_CAPACITY = "spmview.cache.rendered";

	/**
	 * Property key for the number of render workers.
	 */
	public static final String KEY_WORKERS = "spmview.workers";

	/**
	 * Property key for the default thumbnail size, in pixels.
	 */
	public static final String KEY_THUMBNAIL_SIZE = "spmview.thumbnail.size";

	/**
	 * Property key for the default colormap name.
	 */
	public static final String KEY_COLOR_MAP = "spmview.colormap";

	static final int DEFAULT_RAW_CAPACITY = 24;
	static final int DEFAULT_PROCESSED_CAPACITY = 32;
	static final int DEFAULT_THUMBNAIL_CAPACITY = 256;
	static final int DEFAULT_RENDERED_CAPACITY = 256;
	static final int DEFAULT_THUMBNAIL_SIZE = 160;

	private final int rawCapacity;
	private final int processedCapacity;
	private final int thumbnailCapacity;
	private final int renderedCapacity;
	private final int nWorkers;
	private final int thumbnailSize;
	private final String colorMapName;

	private CacheSettings(Builder builder) {
		this.rawCapacity = requirePositive(KEY_RAW_CAPACITY, builder.rawCapacity);
		this.processedCapacity = requirePositive(KEY_PROCESSED_CAPACITY, builder.processedCapacity);
		this.thumbnailCapacity = requirePositive(KEY_THUMBNAIL_CAPACITY, builder.thumbnailCapacity);
		this.renderedCapacity = requirePositive(KEY_RENDERED_CAPACITY, builder.renderedCapacity);
		this.nWorkers = requirePositive(KEY_WORKERS, builder.nWorkers);
		this.thumbnailSize = requirePositive(KEY_THUMBNAIL_SIZE, builder.thumbnailSize);
		if (GeneralTools.blankString(builder.colorMapName, true))
			throw new IllegalArgumentException(KEY_COLOR_MAP + " must not be blank");
		this.colorMapName = builder.colorMapName.trim();
	}

	private static int requirePositive(String name, int value) {
		if (value <= 0)
			throw new IllegalArgumentException(name + " must be > 0, but was " + value);
		return value;
	}

	/**
	 * Get the default settings.
	 * The number of workers and the colormap are taken from {@link Prefs}.
	 * @return
	 */
	public static CacheSettings getDefault() {
		return builder().build();
	}

	/**
	 * Create a new builder, initialized with the default settings.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Read settings from properties. Missing properties take their default values.
	 * @param properties
	 * @return
	 * @throws IllegalArgumentException if a property is not a valid integer, or a value is invalid
	 */
	public static CacheSettings fromProperties(Properties properties) {
		var builder = builder();
		builder.rawCapacity(readInt(properties, KEY_RAW_CAPACITY, builder.rawCapacity));
		builder.processedCapacity(readInt(properties, KEY_PROCESSED_CAPACITY, builder.processedCapacity));
		builder.thumbnailCapacity(readInt(properties, KEY_THUMBNAIL_CAPACITY, builder.thumbnailCapacity));
		builder.renderedCapacity(readInt(properties, KEY_RENDERED_CAPACITY, builder.renderedCapacity));
		builder.workers(readInt(properties, KEY_WORKERS, builder.nWorkers));
		builder.thumbnailSize(readInt(properties, KEY_THUMBNAIL_SIZE, builder.thumbnailSize));
		builder.colorMap(properties.getProperty(KEY_COLOR_MAP, builder.colorMapName));
		return builder.build();
	}

	private static int readInt(Properties properties, String key, int defaultValue) {
		String value = properties.getProperty(key);
		if (value == null)
			return defaultValue;
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(key + " must be an integer, but was '" + value + "'", e);
		}
	}

	/**
	 * Maximum number of decoded channel arrays.
	 * @return
	 */
	public int getRawCapacity() {
		return rawCapacity;
	}

	/**
	 * Maximum number of processed channel arrays.
	 * @return
	 */
	public int getProcessedCapacity() {
		return processedCapacity;
	}

	/**
	 * Maximum number of downsampled arrays.
	 * @return
	 */
	public int getThumbnailCapacity() {
		return thumbnailCapacity;
	}

	/**
	 * Maximum number of rendered images.
	 * @return
	 */
	public int getRenderedCapacity() {
		return renderedCapacity;
	}

	/**
	 * Number of render worker threads.
	 * @return
	 */
	public int getWorkerCount() {
		return nWorkers;
	}

	/**
	 * Default thumbnail size in pixels.
	 * @return
	 */
	public int getThumbnailSize() {
		return thumbnailSize;
	}

	/**
	 * Name of the colormap used when none is requested.
	 * @return
	 */
	public String getColorMapName() {
		return colorMapName;
	}

	@Override
	public String toString() {
		return String.format("CacheSettings [raw=%d, processed=%d, thumbnails=%d, rendered=%d, workers=%d, size=%d, colormap=%s]",
				rawCapacity, processedCapacity, thumbnailCapacity, renderedCapacity, nWorkers, thumbnailSize, colorMapName);
	}

	/**
	 * Builder for {@link CacheSettings}.
	 */
	public static class Builder {

		private int rawCapacity = DEFAULT_RAW_CAPACITY;
		private int processedCapacity = DEFAULT_PROCESSED_CAPACITY;
		private int thumbnailCapacity = DEFAULT_THUMBNAIL_CAPACITY;
		private int renderedCapacity = DEFAULT_RENDERED_CAPACITY;
		private int nWorkers = Prefs.getNumWorkers();
		private int thumbnailSize = DEFAULT_THUMBNAIL_SIZE;
		private String colorMapName = Prefs.getDefaultColorMapName();

		private Builder() {}

		/**
		 * Maximum number of decoded channel arrays.
		 * @param capacity
		 * @return this builder
		 */
		public Builder rawCapacity(int capacity) {
			this.rawCapacity = capacity;
			return this;
		}

		/**
		 * Maximum number of processed channel arrays.
		 * @param capacity
		 * @return this builder
		 */
		public Builder processedCapacity(int capacity) {
			this.processedCapacity = capacity;
			return this;
		}

		/**
		 * Maximum number of downsampled arrays.
		 * @param capacity
		 * @return this builder
		 */
		public Builder thumbnailCapacity(int capacity) {
			this.thumbnailCapacity = capacity;
			return this;
		}

		/**
		 * Maximum number of rendered images.
		 * @param capacity
		 * @return this builder
		 */
		public Builder renderedCapacity(int capacity) {
			this.renderedCapacity = capacity;
			return this;
		}

		/**
		 * Number of render worker threads.
		 * @param nWorkers
		 * @return this builder
		 */
		public Builder workers(int nWorkers) {
			this.nWorkers = nWorkers;
			return this;
		}

		/**
		 * Default thumbnail size in pixels.
		 * @param size
		 * @return this builder
		 */
		public Builder thumbnailSize(int size) {
			this.thumbnailSize = size;
			return this;
		}

		/**
		 * Name of the colormap used when none is requested.
		 * @param name
		 * @return this builder
		 */
		public Builder colorMap(String name) {
			this.colorMapName = name;
			return this;
		}

		/**
		 * Build the settings.
		 * @return
		 * @throws IllegalArgumentException if any value is invalid
		 */
		public CacheSettings build() {
			return new CacheSettings(this);
		}

	}

}
