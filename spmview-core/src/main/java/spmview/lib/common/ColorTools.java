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

package spmview.lib.common;

/**
 * Static functions to help work with packed RGB values.
 */
public class ColorTools {

	/**
	 * Packed RGB representation of black.
	 */
	public static final int BLACK = packRGB(0, 0, 0);

	/**
	 * Packed RGB representation of red.
	 */
	public static final int RED = packRGB(255, 0, 0);

	/**
	 * Fill used for thumbnails that are still loading, or have failed.
	 */
	public static final int PLACEHOLDER = packRGB(11, 11, 18);

	/**
	 * Make a packed RGB value from specified input values.
	 * This is equivalent to an ARGB value with alpha set to 255.
	 * Input values should be in the range 0-255; higher bits are discarded.
	 *
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public static int packRGB(int r, int g, int b) {
		return ((255 & 0xff)<<24) +
			   ((r & 0xff)<<16) +
			   ((g & 0xff)<<8) +
			    (b & 0xff);
	}

	/**
	 * Get the red value from a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb >> 16) & 0xff;
	}

	/**
	 * Get the green value from a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb >> 8) & 0xff;
	}

	/**
	 * Get the blue value from a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return rgb & 0xff;
	}

}
