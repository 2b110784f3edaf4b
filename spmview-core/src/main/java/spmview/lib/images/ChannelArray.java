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

package spmview.lib.images;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * A 2D, single-channel array of double values, stored in row-major order.
 * <p>
 * Instances are shared between caches and threads and must be treated as immutable:
 * anything that needs to modify pixels should work on a copy obtained with {@code getArray(false)}.
 */
public final class ChannelArray {

	private final double[] data;
	private final int width;
	private final int height;

	private ChannelArray(double[] data, int width, int height) {
		if (width < 0 || height < 0)
			throw new IllegalArgumentException("Width and height must be >= 0, but got " + width + "x" + height);
		if (data.length != width * height)
			throw new IllegalArgumentException("Array length " + data.length + " does not match " + width + "x" + height);
		this.data = data;
		this.width = width;
		this.height = height;
	}

	/**
	 * Create a channel array backed by an existing array of values.
	 * The caller should not modify the array afterwards.
	 *
	 * @param data values in row-major order
	 * @param width
	 * @param height
	 * @return
	 */
	public static ChannelArray wrap(double[] data, int width, int height) {
		return new ChannelArray(data, width, height);
	}

	/**
	 * Create a channel array filled with zeros.
	 * @param width
	 * @param height
	 * @return
	 */
	public static ChannelArray createEmpty(int width, int height) {
		return new ChannelArray(new double[width * height], width, height);
	}

	/**
	 * Get the value at a specific pixel.
	 * @param x
	 * @param y
	 * @return
	 */
	public double getValue(int x, int y) {
		if (x < 0 || x >= width || y < 0 || y >= height)
			throw new IndexOutOfBoundsException("Pixel " + x + ", " + y + " outside " + width + "x" + height);
		return data[y * width + x];
	}

	/**
	 * Get the array width.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Get the array height.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Get the total number of values.
	 * @return
	 */
	public int size() {
		return data.length;
	}

	/**
	 * Request the values in row-major order.
	 * @param direct if true, the internal array is returned; the caller must not modify it
	 * @return
	 */
	public double[] getArray(boolean direct) {
		return direct ? data : data.clone();
	}

	/**
	 * Return a new array with every value multiplied by a constant factor.
	 * @param factor
	 * @return this instance if the factor is 1, otherwise a scaled copy
	 */
	public ChannelArray multiply(double factor) {
		if (factor == 1.0)
			return this;
		double[] output = new double[data.length];
		for (int i = 0; i < data.length; i++)
			output[i] = data[i] * factor;
		return new ChannelArray(output, width, height);
	}

	/**
	 * Get all finite values, in row-major order.
	 * @return
	 */
	public double[] getFiniteValues() {
		return Arrays.stream(data).filter(Double::isFinite).toArray();
	}

	/**
	 * Get the value of the pixel nearest to a (fractional) pixel coordinate.
	 * @param col column coordinate, from 0 to width-1
	 * @param row row coordinate, from 0 to height-1
	 * @return the value, or empty if the coordinate is outside the array or the value is not finite
	 */
	public OptionalDouble sampleValue(double col, double row) {
		if (!(col >= 0 && col <= width - 1 && row >= 0 && row <= height - 1))
			return OptionalDouble.empty();
		double v = data[(int)Math.round(row) * width + (int)Math.round(col)];
		return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
	}

	/**
	 * Get the value of the pixel nearest to a physical coordinate.
	 * <p>
	 * Along each axis, the lower bound of the extent maps to the first column or row and the upper bound
	 * to the last, whichever order the bounds are given in.
	 *
	 * @param x physical x coordinate
	 * @param y physical y coordinate
	 * @param extent {@code [x0, x1, y0, y1]}, or null to treat x and y as pixel coordinates
	 * @return the value, or empty if the coordinate is outside the extent or the value is not finite
	 */
	public OptionalDouble sampleValue(double x, double y, double[] extent) {
		if (extent == null)
			return sampleValue(x, y);
		if (extent.length != 4)
			throw new IllegalArgumentException("Extent must have 4 values, but has " + extent.length);
		double col = toIndex(x, extent[0], extent[1], width);
		double row = toIndex(y, extent[2], extent[3], height);
		if (Double.isNaN(col) || Double.isNaN(row))
			return OptionalDouble.empty();
		return sampleValue(col, row);
	}

	/**
	 * Map a coordinate within a range onto a fractional index, or NaN if it is outside the range.
	 */
	static double toIndex(double coord, double start, double end, int size) {
		if (size <= 0 || start == end)
			return Double.NaN;
		double lo = Math.min(start, end);
		double hi = Math.max(start, end);
		if (!(coord >= lo && coord <= hi))
			return Double.NaN;
		return (coord - lo) / (hi - lo) * (size - 1);
	}

	/**
	 * Check if the values of two arrays are identical, including dimensions.
	 * @param other
	 * @return
	 */
	public boolean contentEquals(ChannelArray other) {
		if (other == this)
			return true;
		return other != null && width == other.width && height == other.height && Arrays.equals(data, other.data);
	}

	@Override
	public String toString() {
		return "ChannelArray (" + width + "x" + height + ")";
	}

}
