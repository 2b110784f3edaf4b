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

import java.awt.image.BufferedImage;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import spmview.lib.awt.common.BufferedImageTools;
import spmview.lib.color.ChannelRenderer;
import spmview.lib.images.ChannelArray;

/**
 * Bounded caches of downsampled channel arrays, and of the color-mapped images created from them.
 * <p>
 * The two caches have independent capacities and locks.
 */
public class ThumbnailStore {

	private static final Logger logger = LoggerFactory.getLogger(ThumbnailStore.class);

	private final BoundedLruCache<ThumbnailKey, ChannelArray> dataCache;
	private final BoundedLruCache<RenderedKey, BufferedImage> renderedCache;

	/**
	 * Constructor.
	 * @param dataCapacity maximum number of downsampled arrays
	 * @param renderedCapacity maximum number of rendered images
	 */
	public ThumbnailStore(int dataCapacity, int renderedCapacity) {
		this.dataCache = new BoundedLruCache<>(dataCapacity);
		this.renderedCache = new BoundedLruCache<>(renderedCapacity);
	}

	/**
	 * Get a cached downsampled array, or compute and cache it.
	 * @param key
	 * @param processed the processed array to downsample
	 * @param width target width
	 * @param height target height
	 * @return
	 */
	public ChannelArray getOrDownsample(ThumbnailKey key, ChannelArray processed, int width, int height) {
		var array = dataCache.get(key);
		if (array != null)
			return array;
		array = downsample(processed, width, height);
		dataCache.put(key, array);
		return array;
	}

	/**
	 * Downsample an array by nearest-neighbour selection of evenly spaced rows and columns.
	 * <p>
	 * Each axis is reduced to the target size only if it is larger; arrays are never upsampled.
	 * Source index {@code i} of {@code n} selected values is {@code round(i * (size - 1) / (n - 1))}.
	 *
	 * @param array
	 * @param width target width
	 * @param height target height
	 * @return the downsampled array, or the input array if no downsampling is needed
	 */
	public static ChannelArray downsample(ChannelArray array, int width, int height) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Target size must be > 0, but was " + width + "x" + height);
		int w = array.getWidth();
		int h = array.getHeight();
		int outWidth = Math.min(width, w);
		int outHeight = Math.min(height, h);
		if (outWidth == w && outHeight == h)
			return array;
		int[] xs = selectIndices(w, outWidth);
		int[] ys = selectIndices(h, outHeight);
		double[] source = array.getArray(true);
		double[] output = new double[outWidth * outHeight];
		for (int y = 0; y < outHeight; y++) {
			int row = ys[y] * w;
			for (int x = 0; x < outWidth; x++)
				output[y * outWidth + x] = source[row + xs[x]];
		}
		return ChannelArray.wrap(output, outWidth, outHeight);
	}

	static int[] selectIndices(int size, int n) {
		int[] indices = new int[n];
		if (n == 1)
			return indices;
		for (int i = 0; i < n; i++)
			indices[i] = (int)Math.round(i * (size - 1) / (double)(n - 1));
		return indices;
	}

	/**
	 * Get a cached downsampled array, marking it as recently used.
	 * @param key
	 * @return
	 */
	public Optional<ChannelArray> getIfPresent(ThumbnailKey key) {
		return Optional.ofNullable(dataCache.get(key));
	}

	/**
	 * Store a downsampled array.
	 * @param key
	 * @param array
	 */
	public void put(ThumbnailKey key, ChannelArray array) {
		dataCache.put(key, Objects.requireNonNull(array));
	}

	/**
	 * Get a cached rendered image, or render and cache it.
	 * @param key
	 * @param thumbnail the downsampled array to render
	 * @return a copy of the cached image, which the caller may modify
	 */
	public BufferedImage getOrRender(RenderedKey key, ChannelArray thumbnail) {
		var img = renderedCache.get(key);
		if (img == null) {
			img = ChannelRenderer.render(thumbnail, key.getColorMapName());
			renderedCache.put(key, img);
		}
		return BufferedImageTools.duplicate(img);
	}

	/**
	 * Get a cached rendered image, marking it as recently used.
	 * @param key
	 * @return a copy of the cached image, which the caller may modify
	 */
	public Optional<BufferedImage> getRenderedIfPresent(RenderedKey key) {
		return Optional.ofNullable(renderedCache.get(key)).map(BufferedImageTools::duplicate);
	}

	/**
	 * Store a copy of a rendered image. Later changes to {@code img} do not affect the cache.
	 * @param key
	 * @param img
	 */
	public void putRendered(RenderedKey key, BufferedImage img) {
		renderedCache.put(key, BufferedImageTools.duplicate(Objects.requireNonNull(img)));
	}

	/**
	 * Remove all downsampled arrays and rendered images within a scope.
	 * @param scope
	 * @return the number of entries removed
	 */
	public int invalidate(InvalidationScope scope) {
		int n = dataCache.removeIf(k -> scope.matches(k.getRawKey()));
		n += renderedCache.removeIf(k -> scope.matches(k.getThumbnailKey().getRawKey()));
		if (n > 0)
			logger.debug("Removed {} thumbnail entries for {}", n, scope);
		return n;
	}

	/**
	 * Number of cached downsampled arrays.
	 * @return
	 */
	public int size() {
		return dataCache.size();
	}

	/**
	 * Number of cached rendered images.
	 * @return
	 */
	public int renderedSize() {
		return renderedCache.size();
	}

	/**
	 * Maximum number of cached downsampled arrays.
	 * @return
	 */
	public int getCapacity() {
		return dataCache.getCapacity();
	}

	/**
	 * Maximum number of cached rendered images.
	 * @return
	 */
	public int getRenderedCapacity() {
		return renderedCache.getCapacity();
	}

	/**
	 * Remove all entries from both caches.
	 */
	public void clear() {
		dataCache.clear();
		renderedCache.clear();
	}

	@Override
	public String toString() {
		return "ThumbnailStore [data " + dataCache + ", rendered " + renderedCache + "]";
	}

}
