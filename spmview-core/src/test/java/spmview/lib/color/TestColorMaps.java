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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import spmview.lib.common.ColorTools;

@SuppressWarnings("javadoc")
public class TestColorMaps {

	@Test
	public void test_bundledColorMaps() {
		var maps = ColorMaps.getColorMaps();
		for (var name : new String[] {"Viridis", "Inferno", "Magma", "Plasma", "Cividis", "Gray"})
			assertTrue(maps.containsKey(name), "Missing colormap " + name);
		assertEquals("Viridis", ColorMaps.getDefaultColorMap().getName());
	}

	@Test
	public void test_lookup() {
		assertTrue(ColorMaps.getColorMap(null).isEmpty());
		assertTrue(ColorMaps.getColorMap("NoSuchMap").isEmpty());
		assertEquals(ColorMaps.getDefaultColorMap(), ColorMaps.getColorMapOrDefault("NoSuchMap"));
		assertEquals(ColorMaps.getDefaultColorMap(), ColorMaps.getColorMapOrDefault(null));
		assertEquals("Magma", ColorMaps.getColorMapOrDefault("Magma").getName());
	}

	@Test
	public void test_grayColorMap() {
		var gray = ColorMaps.getColorMap("Gray").get();
		assertEquals(ColorTools.BLACK, gray.getColor(0, 0, 1));
		assertEquals(ColorTools.packRGB(255, 255, 255), gray.getColor(1, 0, 1));
		// Values are clipped to the range
		assertEquals(ColorTools.BLACK, gray.getColor(-5, 0, 1));
		assertEquals(ColorTools.packRGB(255, 255, 255), gray.getColor(5, 0, 1));
		assertEquals(ColorTools.packRGB(128, 128, 128), gray.getColor(0.5, 0, 1));
	}

	@Test
	public void test_viridisEndpoints() {
		var viridis = ColorMaps.getColorMap("Viridis").get();
		int low = viridis.getColor(0, 0, 1);
		int high = viridis.getColor(1, 0, 1);
		assertNotEquals(low, high);
		// Viridis runs from dark purple to yellow
		assertTrue(ColorTools.red(high) > ColorTools.blue(high));
		assertTrue(ColorTools.blue(low) > ColorTools.green(low));
	}

	@Test
	public void test_installColorMap(@TempDir Path dir) throws Exception {
		Path path = Files.writeString(dir.resolve("Custom.tsv"), "0 0 0\n0.5 0 0\n1 0 0\n");
		var cm = ColorMaps.installColorMap(path);
		assertEquals("Custom", cm.getName());
		assertEquals(cm, ColorMaps.getColorMap("Custom").get());
		assertEquals(ColorTools.packRGB(255, 0, 0), cm.getColor(1, 0, 1));

		Path invalid = Files.writeString(dir.resolve("Invalid.tsv"), "0 0 2\n1 1 1\n");
		assertThrows(IllegalArgumentException.class, () -> ColorMaps.installColorMap(invalid));
	}

}
