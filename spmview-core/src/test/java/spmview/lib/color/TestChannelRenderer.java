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

package spmview.lib.color;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import spmview.lib.common.ColorTools;
import spmview.lib.images.ChannelArray;

@SuppressWarnings("javadoc")
public class TestChannelRenderer {

	private static final int WHITE = ColorTools.packRGB(255, 255, 255);

	@Test
	public void test_displayLimits() {
		double[] values = new double[101];
		for (int i = 0; i < values.length; i++)
			values[i] = i;
		var limits = ChannelRenderer.getDisplayLimits(ChannelArray.wrap(values, 101, 1));
		assertArrayEquals(new double[] {1.0, 99.0}, limits, 1e-9);

		// Constant arrays fall back to min and max
		limits = ChannelRenderer.getDisplayLimits(ChannelArray.wrap(new double[] {3, 3, 3, Double.NaN}, 2, 2));
		assertArrayEquals(new double[] {3.0, 3.0}, limits, 0.0);

		assertNull(ChannelRenderer.getDisplayLimits(ChannelArray.wrap(new double[] {Double.NaN, Double.POSITIVE_INFINITY}, 2, 1)));
	}

	@Test
	public void test_render() {
		var array = ChannelArray.wrap(new double[] {0, 1, 2, Double.NaN}, 2, 2);
		var img = ChannelRenderer.render(array, "Gray");
		assertEquals(2, img.getWidth());
		assertEquals(2, img.getHeight());
		assertEquals(ColorTools.BLACK, img.getRGB(0, 0));
		assertEquals(WHITE, img.getRGB(0, 1));
		// Non-finite values are black
		assertEquals(ColorTools.BLACK, img.getRGB(1, 1));
		int mid = img.getRGB(1, 0);
		assertNotEquals(ColorTools.BLACK, mid);
		assertNotEquals(WHITE, mid);
	}

	@Test
	public void test_renderNoFiniteValues() {
		var array = ChannelArray.wrap(new double[] {Double.NaN, Double.NaN}, 1, 2);
		var img = ChannelRenderer.render(array, "Viridis");
		assertEquals(ColorTools.BLACK, img.getRGB(0, 0));
		assertEquals(ColorTools.BLACK, img.getRGB(0, 1));
	}

	@Test
	public void test_unknownColorMap() {
		var array = ChannelArray.wrap(new double[] {0, 1}, 2, 1);
		var img = ChannelRenderer.render(array, "NoSuchMap");
		var expected = ChannelRenderer.render(array, ColorMaps.getDefaultColorMap());
		assertEquals(expected.getRGB(0, 0), img.getRGB(0, 0));
		assertEquals(expected.getRGB(1, 0), img.getRGB(1, 0));
	}

	@Test
	public void test_placeholders() {
		var placeholder = ChannelRenderer.createPlaceholder(8, 6);
		assertEquals(8, placeholder.getWidth());
		assertEquals(ColorTools.PLACEHOLDER, placeholder.getRGB(4, 0));

		var failure = ChannelRenderer.createFailurePlaceholder(32, 32);
		assertTrue(ColorTools.red(failure.getRGB(16, 16)) > 100);
		assertEquals(ColorTools.PLACEHOLDER, failure.getRGB(16, 0));

		assertEquals(1, ChannelRenderer.createPlaceholder(0, 0).getWidth());
	}

}
