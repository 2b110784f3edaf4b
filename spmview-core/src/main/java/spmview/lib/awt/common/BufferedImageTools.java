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

package spmview.lib.awt.common;

import java.awt.image.BufferedImage;

/**
 * Static methods for working with {@link BufferedImage}.
 */
public final class BufferedImageTools {

	// Suppressed default constructor for non-instantiability
	private BufferedImageTools() {
		throw new AssertionError();
	}

	/**
	 * Create a new image with the same color model and a copy of the raster of an existing image.
	 * Changes to one image are not reflected in the other.
	 * @param img
	 * @return
	 */
	public static BufferedImage duplicate(BufferedImage img) {
		return new BufferedImage(
				img.getColorModel(),
				img.copyData(img.getRaster().createCompatibleWritableRaster()),
				img.isAlphaPremultiplied(),
				null);
	}

}
