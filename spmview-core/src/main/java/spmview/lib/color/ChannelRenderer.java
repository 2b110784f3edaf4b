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

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import spmview.lib.color.ColorMaps.ColorMap;
import spmview.lib.common.ColorTools;
import spmview.lib.common.GeneralTools;
import spmview.lib.images.ChannelArray;

/**
 * Static methods to convert channel arrays into RGB images.
 * <p>
 * Display limits are set automatically from the 1st and 99th percentiles of the finite values,
 * so that a few outlying pixels do not wash out the rest of the image.
 */
public class ChannelRenderer {

	/**
	 * Lower percentile used for display limits.
	 */
	public static final double LOWER_PERCENTILE = 1.0;

	/**
	 * Upper percentile used for display limits.
	 */
	public static final double UPPER_PERCENTILE = 99.0;

	// Suppressed default constructor for non-instantiability
	private ChannelRenderer() {
		throw new AssertionError();
	}

	/**
	 * Compute display limits for an array.
	 * These are the 1st and 99th percentiles of the finite values; if these are equal, the minimum and maximum are used.
	 * @param array
	 * @return {@code [min, max]}, or null if the array contains no finite values
	 */
	public static double[] getDisplayLimits(ChannelArray array) {
		double[] values = array.getFiniteValues();
		if (values.length == 0)
			return null;
		Arrays.sort(values);
		var percentile = new Percentile().withEstimationType(EstimationType.R_7);
		percentile.setData(values);
		double min = percentile.evaluate(LOWER_PERCENTILE);
		double max = percentile.evaluate(UPPER_PERCENTILE);
		if (min == max) {
			min = values[0];
			max = values[values.length - 1];
		}
		return new double[] {min, max};
	}

	/**
	 * Render an array with a named colormap.
	 * @param array
	 * @param colorMapName the colormap name; the default colormap is used if this is null or unknown
	 * @return
	 * @see #render(ChannelArray, ColorMap)
	 */
	public static BufferedImage render(ChannelArray array, String colorMapName) {
		return render(array, ColorMaps.getColorMapOrDefault(colorMapName));
	}

	/**
	 * Render an array with a colormap, using automatic display limits.
	 * Non-finite values are shown as black.
	 * @param array
	 * @param colorMap
	 * @return an RGB image with the same dimensions as the array
	 */
	public static BufferedImage render(ChannelArray array, ColorMap colorMap) {
		int width = Math.max(1, array.getWidth());
		int height = Math.max(1, array.getHeight());
		var img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		double[] limits = getDisplayLimits(array);
		int[] rgb = new int[width * height];
		if (limits == null || array.size() == 0) {
			Arrays.fill(rgb, ColorTools.BLACK);
		} else {
			double min = limits[0];
			double range = limits[1] - limits[0];
			double[] values = array.getArray(true);
			for (int i = 0; i < values.length; i++) {
				double v = values[i];
				if (!Double.isFinite(v)) {
					rgb[i] = ColorTools.BLACK;
					continue;
				}
				double norm = range > 0 ? GeneralTools.clipValue((v - min) / range, 0.0, 1.0) : 0.0;
				rgb[i] = colorMap.getColor(norm, 0.0, 1.0);
			}
		}
		img.setRGB(0, 0, width, height, rgb, 0, width);
		return img;
	}

	/**
	 * Create a neutral placeholder image, shown while a thumbnail is being computed.
	 * @param width
	 * @param height
	 * @return
	 */
	public static BufferedImage createPlaceholder(int width, int height) {
		var img = new BufferedImage(Math.max(1, width), Math.max(1, height), BufferedImage.TYPE_INT_RGB);
		var g2d = img.createGraphics();
		g2d.setColor(new Color(ColorTools.PLACEHOLDER));
		g2d.fillRect(0, 0, img.getWidth(), img.getHeight());
		g2d.dispose();
		return img;
	}

	/**
	 * Create a placeholder image indicating that a thumbnail could not be computed.
	 * @param width
	 * @param height
	 * @return
	 */
	public static BufferedImage createFailurePlaceholder(int width, int height) {
		var img = createPlaceholder(width, height);
		var g2d = img.createGraphics();
		g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
		g2d.setColor(new Color(ColorTools.RED));
		g2d.setStroke(new BasicStroke(Math.max(1f, Math.min(img.getWidth(), img.getHeight()) / 32f)));
		int w = img.getWidth() - 1;
		int h = img.getHeight() - 1;
		g2d.drawLine(0, 0, w, h);
		g2d.drawLine(0, h, w, 0);
		g2d.dispose();
		return img;
	}

}
