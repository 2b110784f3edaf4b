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

/**
 * Identity of a color-mapped thumbnail image.
 */
public final class RenderedKey {

	private final ThumbnailKey thumbnailKey;
	private final String colorMapName;

	/**
	 * Constructor.
	 * @param thumbnailKey key of the downsampled array
	 * @param colorMapName name of the colormap
	 */
	public RenderedKey(ThumbnailKey thumbnailKey, String colorMapName) {
		this.thumbnailKey = Objects.requireNonNull(thumbnailKey);
		this.colorMapName = Objects.requireNonNull(colorMapName);
	}

	/**
	 * Key of the downsampled array.
	 * @return
	 */
	public ThumbnailKey getThumbnailKey() {
		return thumbnailKey;
	}

	/**
	 * Name of the colormap.
	 * @return
	 */
	public String getColorMapName() {
		return colorMapName;
	}

	@Override
	public String toString() {
		return "RenderedKey [" + thumbnailKey + ", " + colorMapName + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(thumbnailKey, colorMapName);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof RenderedKey))
			return false;
		var other = (RenderedKey)obj;
		return thumbnailKey.equals(other.thumbnailKey) && colorMapName.equals(other.colorMapName);
	}

}
