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

package spmview.opencv.tools;

import org.bytedeco.javacpp.PointerScope;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import spmview.lib.images.ChannelArray;

/**
 * Collection of static methods to help with using OpenCV from Java.
 */
public class OpenCVTools {

	// Suppressed default constructor for non-instantiability
	private OpenCVTools() {
		throw new AssertionError();
	}

	/**
	 * Create a single-channel 64-bit Mat containing the values of an array.
	 * @param values pixel values, in row-major order
	 * @param width
	 * @param height
	 * @return
	 */
	public static Mat createMat(double[] values, int width, int height) {
		if (values.length != width * height)
			throw new IllegalArgumentException("Expected " + (width * height) + " values, but got " + values.length);
		var mat = new Mat(height, width, opencv_core.CV_64FC1);
		DoubleIndexer idx = mat.createIndexer();
		idx.put(0L, values);
		idx.release();
		return mat;
	}

	/**
	 * Extract pixels as a double array.
	 * @param mat a continuous single-channel 64-bit Mat
	 * @return
	 */
	public static double[] extractDoubles(Mat mat) {
		if (mat.depth() != opencv_core.CV_64F || mat.channels() != 1)
			throw new IllegalArgumentException("Expected a single-channel 64-bit Mat, but got " + mat);
		var pixels = new double[(int)mat.total()];
		DoubleIndexer idx = mat.createIndexer();
		idx.get(0L, pixels);
		idx.release();
		return pixels;
	}

	/**
	 * Size of the Gaussian kernel used for a specified sigma. The kernel is truncated at 4 sigma.
	 * @param sigma
	 * @return an odd kernel size
	 */
	public static int getGaussianKernelSize(double sigma) {
		int radius = (int)(4.0 * sigma + 0.5);
		return radius * 2 + 1;
	}

	/**
	 * Apply a Gaussian filter in place, reflecting the image at its boundaries (d c b a | a b c d | d c b a).
	 * @param mat
	 * @param sigma
	 */
	public static void gaussianBlur(Mat mat, double sigma) {
		int s = getGaussianKernelSize(sigma);
		opencv_imgproc.GaussianBlur(mat, mat, new Size(s, s), sigma, sigma, opencv_core.BORDER_REFLECT);
	}

	/**
	 * Apply a Gaussian filter to a channel array, ignoring non-finite values.
	 * <p>
	 * Non-finite values do not contribute to their neighbours, and are unchanged in the output.
	 * This is done by filtering the finite values (with non-finite values set to zero) and a mask of
	 * finite pixels, then dividing one by the other.
	 *
	 * @param input
	 * @param sigma Gaussian sigma in pixels
	 * @return a new array
	 */
	public static ChannelArray gaussianBlurFinite(ChannelArray input, double sigma) {
		int w = input.getWidth();
		int h = input.getHeight();
		double[] source = input.getArray(true);
		double[] values = new double[source.length];
		double[] weights = new double[source.length];
		for (int i = 0; i < source.length; i++) {
			if (Double.isFinite(source[i])) {
				values[i] = source[i];
				weights[i] = 1.0;
			}
		}
		double[] blurredValues;
		double[] blurredWeights;
		try (var scope = new PointerScope()) {
			var matValues = createMat(values, w, h);
			var matWeights = createMat(weights, w, h);
			gaussianBlur(matValues, sigma);
			gaussianBlur(matWeights, sigma);
			blurredValues = extractDoubles(matValues);
			blurredWeights = extractDoubles(matWeights);
		}
		double[] output = new double[source.length];
		for (int i = 0; i < source.length; i++) {
			if (!Double.isFinite(source[i]) || !(blurredWeights[i] > 0))
				output[i] = source[i];
			else
				output[i] = blurredValues[i] / blurredWeights[i];
		}
		return ChannelArray.wrap(output, w, h);
	}

}
