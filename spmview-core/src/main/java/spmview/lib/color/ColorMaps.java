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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.DoubleStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import spmview.lib.common.ColorTools;
import spmview.lib.common.GeneralTools;
import spmview.lib.common.LogTools;
import spmview.lib.common.Prefs;

/**
 * Helper class to manage colormaps, which are rather like lookup tables but easily support interpolation.
 */
public class ColorMaps {

	private static final Logger logger = LoggerFactory.getLogger(ColorMaps.class);

	/**
	 * Names of the colormaps bundled as resources under {@code /colormaps}.
	 */
	private static final List<String> BUNDLED_COLOR_MAPS = Arrays.asList(
			"Viridis", "Inferno", "Magma", "Plasma", "Cividis"
			);

	private static ColorMap LEGACY_COLOR_MAP = new PseudoColorMap();

	private static List<ColorMap> SINGLE_COLOR_MAPS = Arrays.asList(
			createColorMap("Gray", 255, 255, 255),
			createColorMap("Red", 255, 0, 0),
			createColorMap("Green", 0, 255, 0),
			createColorMap("Blue", 0, 0, 255)
			);

	private static Map<String, ColorMap> maps = Collections.synchronizedMap(new LinkedHashMap<>(loadDefaultColorMaps()));

	/**
	 * Colormap, which acts as an interpolating lookup table with an arbitrary range.
	 */
	public interface ColorMap {

		/**
		 * Get the name of the colormap.
		 * @return
		 */
		public String getName();

		/**
		 * Get a packed RGB representation of the (interpolated) color at the specified value.
		 * @param value value that should be colorized
		 * @param minValue minimum display value, corresponding to the first color in the lookup table of this map
		 * @param maxValue maximum display value, corresponding to the last color in the lookup table of this map
		 * @return
		 */
		public int getColor(double value, double minValue, double maxValue);

	}

	private static Map<String, ColorMap> loadDefaultColorMaps() {
		Map<String, ColorMap> maps = new LinkedHashMap<>();
		for (var name : BUNDLED_COLOR_MAPS) {
			String resource = "/colormaps/" + name + ".tsv";
			try (InputStream stream = ColorMaps.class.getResourceAsStream(resource)) {
				if (stream == null) {
					logger.error("Colormap resource {} not found", resource);
					continue;
				}
				var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
				var lines = reader.lines().collect(Collectors.toList());
				maps.put(name, parseColorMap(name, lines));
			} catch (Exception e) {
				logger.error("Error loading colormap " + name + ": " + e.getLocalizedMessage(), e);
			}
		}
		for (var cm : SINGLE_COLOR_MAPS)
			maps.put(cm.getName(), cm);
		maps.put(LEGACY_COLOR_MAP.getName(), LEGACY_COLOR_MAP);
		return maps;
	}

	/**
	 * Install a colormap from a .tsv file containing one line of red, green and blue values (0-1) per color.
	 * The name of the colormap is the file name without extension.
	 *
	 * @param path
	 * @return the installed colormap
	 * @throws IOException if the file cannot be read
	 * @throws IllegalArgumentException if the file does not contain valid colors
	 */
	public static ColorMap installColorMap(Path path) throws IOException {
		String name = GeneralTools.getNameWithoutExtension(path);
		var cm = parseColorMap(name, Files.readAllLines(path, StandardCharsets.UTF_8));
		maps.put(cm.getName(), cm);
		return cm;
	}

	/**
	 * Install colormaps.
	 *
	 * @param colorMaps one or more colormaps.
	 * @return true if changes were made, false otherwise
	 */
	public static boolean installColorMaps(ColorMap... colorMaps) {
		boolean changes = false;
		for (var cm : colorMaps) {
			maps.put(cm.getName(), cm);
			changes = true;
		}
		return changes;
	}

	private static ColorMap parseColorMap(String name, List<String> allLines) {
		List<String> lines = allLines.stream().filter(s -> !s.isBlank()).collect(Collectors.toList());
		int n = lines.size();
		double[] r = new double[n];
		double[] g = new double[n];
		double[] b = new double[n];
		int i = 0;
		for (String line : lines) {
			String[] split = line.trim().split("\\s+");
			if (split.length < 3) {
				logger.warn("Invalid line (must contain 3 doubles): {}", line);
				continue;
			}
			r[i] = Double.parseDouble(split[0]);
			g[i] = Double.parseDouble(split[1]);
			b[i] = Double.parseDouble(split[2]);
			i++;
		}
		if (i < 2)
			throw new IllegalArgumentException("Colormap " + name + " needs at least 2 colors, but found " + i);
		return createColorMap(name, Arrays.copyOf(r, i), Arrays.copyOf(g, i), Arrays.copyOf(b, i));
	}

	/**
	 * Get the colormap used when no name is given, or the requested name is unknown.
	 * This is the colormap named by {@link Prefs#getDefaultColorMapName()}, if available.
	 * @return
	 */
	public static ColorMap getDefaultColorMap() {
		var cm = maps.get(Prefs.getDefaultColorMapName());
		if (cm != null)
			return cm;
		cm = maps.get(BUNDLED_COLOR_MAPS.get(0));
		return cm == null ? LEGACY_COLOR_MAP : cm;
	}

	/**
	 * Get a colormap by name.
	 * @param name
	 * @return the colormap, or empty if no colormap with the name is installed
	 */
	public static Optional<ColorMap> getColorMap(String name) {
		if (name == null)
			return Optional.empty();
		return Optional.ofNullable(maps.get(name));
	}

	/**
	 * Get a colormap by name, falling back to the default colormap if the name is null or unknown.
	 * @param name
	 * @return
	 */
	public static ColorMap getColorMapOrDefault(String name) {
		var cm = getColorMap(name).orElse(null);
		if (cm != null)
			return cm;
		if (name != null)
			LogTools.warnOnce(logger, "Unknown colormap '" + name + "', the default will be used instead");
		return getDefaultColorMap();
	}

	/**
	 * Get an unmodifiable snapshot of all the currently-available colormaps.
	 * @return the available colormaps, by name
	 */
	public static Map<String, ColorMap> getColorMaps() {
		synchronized (maps) {
			return Collections.unmodifiableMap(new LinkedHashMap<>(maps));
		}
	}

	/**
	 * Create a colormap using floating point values for red, green and blue.
	 * These should be in the range 0-1.
	 * @param name
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public static ColorMap createColorMap(String name, double[] r, double[] g, double[] b) {
		return createColorMap(name, convertToInt(r), convertToInt(g), convertToInt(b));
	}

	private static int[] convertToInt(double[] arr) {
		return DoubleStream.of(arr).mapToInt(d -> convertToInt(d)).toArray();
	}

	private static int convertToInt(double d) {
		if (!Double.isFinite(d) || d > 1 || d < 0)
			throw new IllegalArgumentException("Color value must be between 0 and 1, but actual value is " + d);
		return (int)Math.round(d * 255.0);
	}

	/**
	 * Create a colormap using integer values for red, green and blue.
	 * These should be in the range 0-255.
	 * @param name
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public static ColorMap createColorMap(String name, int[] r, int[] g, int[] b) {
		return new DefaultColorMap(name, r, g, b);
	}

	/**
	 * Create a colormap using int values for red, green and blue corresponding to the maximum value;
	 * the minimum color will be black.
	 * These should be in the range 0-255.
	 * @param name
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public static ColorMap createColorMap(String name, int r, int g, int b) {
		return new SingleColorMap(name, 0, r, 0, g, 0, b);
	}

	private static int[] createLookupTable(int[] r, int[] g, int[] b, int nColors) {
		int[] colors = new int[nColors];
		double scale = (double)(r.length - 1) / nColors;
		for (int i = 0; i < nColors; i++) {
			int ind = (int)(i * scale);
			double residual = (i * scale) - ind;
			colors[i] = ColorTools.packRGB(
					r[ind] + (int)((r[ind+1] - r[ind]) * residual),
					g[ind] + (int)((g[ind+1] - g[ind]) * residual),
					b[ind] + (int)((b[ind+1] - b[ind]) * residual));
		}
		colors[nColors-1] = ColorTools.packRGB(r[r.length-1], g[g.length-1], b[b.length-1]);
		return colors;
	}

	private static int lookupIndex(double value, double minValue, double maxValue, int nColors) {
		int ind = 0;
		if (maxValue > minValue) {
			ind = (int)Math.round((value - minValue) / (maxValue - minValue) * (nColors - 1));
		} else if (minValue > maxValue) {
			ind = (int)Math.round((value - maxValue) / (minValue - maxValue) * (nColors - 1));
			ind = nColors - 1 - ind;
		}
		return GeneralTools.clipValue(ind, 0, nColors - 1);
	}

	private static class DefaultColorMap implements ColorMap {

		private final String name;
		private final int[] colors;

		DefaultColorMap(String name, int[] r, int[] g, int[] b) {
			Objects.requireNonNull(name);
			if (r.length < 2 || r.length != g.length || r.length != b.length)
				throw new IllegalArgumentException("Colormap needs at least 2 colors, with equal numbers of red, green and blue values");
			this.name = name;
			this.colors = createLookupTable(r, g, b, 256);
		}

		@Override
		public String getName() {
			return name;
		}

		@Override
		public String toString() {
			return getName();
		}

		@Override
		public int getColor(double value, double minValue, double maxValue) {
			return colors[lookupIndex(value, minValue, maxValue, colors.length)];
		}

	}

	/**
	 * The classic 'jet' colormap.
	 */
	private static class PseudoColorMap implements ColorMap {

		private static final int[] r = {0, 0,   0,   0,   255, 255};
		private static final int[] g = {0, 0,   255, 255, 255, 0};
		private static final int[] b = {0, 255, 255, 0,   0,   0};
		private static final int[] colors = createLookupTable(r, g, b, 256);

		@Override
		public String toString() {
			return getName() + " (legacy)";
		}

		@Override
		public String getName() {
			return "Jet";
		}

		@Override
		public int getColor(double value, double minValue, double maxValue) {
			return colors[lookupIndex(value, minValue, maxValue, colors.length)];
		}

	}

	private static class SingleColorMap implements ColorMap {

		private final String name;

		private final int minRed, maxRed;
		private final int minGreen, maxGreen;
		private final int minBlue, maxBlue;

		SingleColorMap(String name, int minRed, int maxRed, int minGreen, int maxGreen, int minBlue, int maxBlue) {
			this.name = name;
			this.minRed = minRed;
			this.maxRed = maxRed;
			this.minGreen = minGreen;
			this.maxGreen = maxGreen;
			this.minBlue = minBlue;
			this.maxBlue = maxBlue;
		}

		@Override
		public String getName() {
			return name;
		}

		@Override
		public String toString() {
			return getName();
		}

		@Override
		public int getColor(double value, double minValue, double maxValue) {
			if (minValue == maxValue)
				return ColorTools.packRGB(maxRed, maxGreen, maxBlue);

			double val = (value - minValue) / (maxValue - minValue);
			if (val >= 1)
				return ColorTools.packRGB(maxRed, maxGreen, maxBlue);
			if (val <= 0)
				return ColorTools.packRGB(minRed, minGreen, minBlue);

			int r = (int)Math.round(linearInterp1D(minRed, maxRed, val));
			int g = (int)Math.round(linearInterp1D(minGreen, maxGreen, val));
			int b = (int)Math.round(linearInterp1D(minBlue, maxBlue, val));

			return ColorTools.packRGB(r, g, b);
		}

		private static double linearInterp1D(double fx0, double fx1, double x) {
			return fx0 * (1 - x) + x * fx1;
		}

	}

}
