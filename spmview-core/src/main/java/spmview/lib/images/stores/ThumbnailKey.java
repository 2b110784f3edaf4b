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

import java.util.Objects;

import spmview.lib.filters.FilterSignature;

/**
 * Identity of a downsampled channel array: the versioned channel, the filters applied and the target size.
 */
public final class ThumbnailKey {

	private final RawChannelKey rawKey;
	private final FilterSignature signature;
	private final int width;
	private final int height;

	/**
	 * Constructor.
	 * @param rawKey key of the raw channel, giving the file, channel index and version
	 * @param signature signature of the filter pipeline
	 * @param width target width
	 * @param height target height
	 */
	public ThumbnailKey(RawChannelKey rawKey, FilterSignature signature, int width, int height) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Thumbnail size must be > 0, but was " + width + "x" + height);
		this.rawKey = Objects.requireNonNull(rawKey);
		this.signature = Objects.requireNonNull(signature);
		this.width = width;
		this.height = height;
	}

	/**
	 * Key of the raw channel.
	 * @return
	 */
	public RawChannelKey getRawKey() {
		return rawKey;
	}

	/**
	 * Signature of the filter pipeline.
	 * @return
	 */
	public FilterSignature getSignature() {
		return signature;
	}

	/**
	 * Target width.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Target height.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	@Override
	public String toString() {
		return "ThumbnailKey [" + rawKey + ", filters=" + signature + ", " + width + "x" + height + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(rawKey, signature, width, height);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ThumbnailKey))
			return false;
		var other = (ThumbnailKey)obj;
		return width == other.width && height == other.height && rawKey.equals(other.rawKey) && signature.equals(other.signature);
	}

}
