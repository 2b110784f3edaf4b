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

package spmview.lib.filters;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import spmview.lib.images.ChannelArray;
import spmview.opencv.tools.OpenCVTools;

@SuppressWarnings("javadoc")
public class TestChannelFilters {

	private static ChannelArray create(int width, int height, PixelFunction fun) {
		double[] values = new double[width * height];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				values[y * width + x] = fun.apply(x, y);
		}
		return ChannelArray.wrap(values, width, height);
	}

	private static interface PixelFunction {
		double apply(int x, int y);
	}

	@Test
	public void test_flattenRows() {
		var input = create(3, 4, (x, y) -> x + 10 * y);
		var output = ChannelFilters.flatten(input, "row");
		for (int y = 0; y < 4; y++) {
			assertEquals(-1.0, output.getValue(0, y), 1e-12);
			assertEquals(0.0, output.getValue(1, y), 1e-12);
			assertEquals(1.0, output.getValue(2, y), 1e-12);
		}
		// Input is unchanged
		assertEquals(30.0, input.getValue(0, 3));
	}

	@Test
	public void test_flattenBoth() {
		var input = create(3, 4, (x, y) -> x + 10 * y);
		var output = ChannelFilters.flatten(input, "both");
		for (double v : output.getArray(false))
			assertEquals(0.0, v, 1e-9);
		assertArrayEquals(output.getArray(false), ChannelFilters.flatten(input, null).getArray(false), 0.0);
	}

	@Test
	public void test_flattenIgnoresNaN() {
		var input = ChannelArray.wrap(new double[] {1, Double.NaN, 3, 5}, 4, 1);
		var output = ChannelFilters.flatten(input, "row");
		assertEquals(-2.0, output.getValue(0, 0), 1e-12);
		assertTrue(Double.isNaN(output.getValue(1, 0)));
		assertEquals(2.0, output.getValue(3, 0), 1e-12);
	}

	@Test
	public void test_flattenInvalidAxis() {
		var input = create(3, 3, (x, y) -> x);
		assertThrows(IllegalArgumentException.class, () -> ChannelFilters.flatten(input, "diagonal"));
	}

	@Test
	public void test_subtractPlane() {
		var input = create(8, 6, (x, y) -> 2.5 * x - 0.75 * y + 12);
		var output = ChannelFilters.subtractPlane(input);
		for (double v : output.getArray(false))
			assertEquals(0.0, v, 1e-9);
	}

	@Test
	public void test_subtractSecondOrderSurface() {
		var input = create(9, 7, (x, y) -> 0.1 * x * x - 0.2 * y * y + 0.05 * x * y + x - 3);
		var output = ChannelFilters.subtractSecondOrderSurface(input);
		for (double v : output.getArray(false))
			assertEquals(0.0, v, 1e-8);

		// A plane does not remove curvature
		var planeOnly = ChannelFilters.subtractPlane(input);
		double maxAbs = Arrays.stream(planeOnly.getArray(false)).map(Math::abs).max().getAsDouble();
		assertTrue(maxAbs > 0.1);
	}

	@Test
	public void test_subtractPlaneSingleRow() {
		var input = create(5, 1, (x, y) -> 3 * x + 1);
		var output = ChannelFilters.subtractPlane(input);
		for (double v : output.getArray(false))
			assertEquals(0.0, v, 1e-9);
	}

	@Test
	public void test_subtractPlaneNoFiniteValues() {
		var input = ChannelArray.wrap(new double[] {Double.NaN, Double.NaN}, 2, 1);
		assertThrows(IllegalArgumentException.class, () -> ChannelFilters.subtractPlane(input));
	}

	@Test
	public void test_gaussianKernelSize() {
		assertEquals(17, OpenCVTools.getGaussianKernelSize(2.0));
		assertEquals(9, OpenCVTools.getGaussianKernelSize(1.0));
		assertEquals(1, OpenCVTools.getGaussianKernelSize(0.1));
	}

	@Test
	public void test_gaussianReflectsAtBorder() {
		// A horizontal ramp stays symmetric about the edge pixel, so the first column is pulled upwards
		var input = create(8, 3, (x, y) -> x);
		var output = ChannelFilters.gaussianLowPass(input, 1.0);
		assertTrue(output.getValue(0, 1) > 0.0);
		assertTrue(output.getValue(7, 1) < 7.0);
		assertEquals(3.5, (output.getValue(3, 1) + output.getValue(4, 1)) / 2.0, 1e-9);
		assertEquals(output.getValue(0, 0), output.getValue(0, 2), 1e-9);
	}

	@Test
	public void test_gaussianConstant() {
		var input = create(10, 8, (x, y) -> 4.0);
		var lowpass = ChannelFilters.gaussianLowPass(input, 1.5);
		for (double v : lowpass.getArray(false))
			assertEquals(4.0, v, 1e-9);
		var highpass = ChannelFilters.gaussianHighPass(input, 1.5);
		for (double v : highpass.getArray(false))
			assertEquals(0.0, v, 1e-9);
		assertNotSame(input, lowpass);
	}

	@Test
	public void test_gaussianSmooths() {
		var input = create(9, 9, (x, y) -> x == 4 && y == 4 ? 1.0 : 0.0);
		var output = ChannelFilters.gaussianLowPass(input, 1.0);
		assertTrue(output.getValue(4, 4) < 1.0);
		assertTrue(output.getValue(5, 4) > 0.0);
		assertEquals(output.getValue(3, 4), output.getValue(5, 4), 1e-9);
		assertEquals(1.0, Arrays.stream(output.getArray(false)).sum(), 1e-6);
	}

	@Test
	public void test_gaussianKeepsNaN() {
		var input = create(5, 5, (x, y) -> x == 2 && y == 2 ? Double.NaN : 1.0);
		var output = ChannelFilters.gaussianLowPass(input, 1.0);
		assertTrue(Double.isNaN(output.getValue(2, 2)));
		assertEquals(1.0, output.getValue(1, 2), 1e-9);
	}

	@Test
	public void test_invalidSigma() {
		var input = create(3, 3, (x, y) -> 1.0);
		assertThrows(IllegalArgumentException.class, () -> ChannelFilters.gaussianLowPass(input, 0));
		assertThrows(IllegalArgumentException.class, () -> ChannelFilters.gaussianLowPass(input, -1));
		assertThrows(IllegalArgumentException.class, () -> ChannelFilters.gaussianHighPass(input, Double.NaN));
	}

	@Test
	public void test_registeredFilters() {
		var names = ChannelFilters.getFilterNames();
		assertTrue(names.containsAll(Arrays.asList(
				ChannelFilters.FLATTEN, ChannelFilters.TILT, ChannelFilters.PLANE2, ChannelFilters.LOWPASS, ChannelFilters.HIGHPASS)));
		assertTrue(ChannelFilters.getFilter("not-a-filter").isEmpty());
	}

}
