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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import com.google.common.collect.ImmutableList;

import spmview.lib.images.ChannelArray;
import spmview.opencv.tools.OpenCVTools;

/**
 * Built-in filters for channel arrays, and a registry of filters by name.
 * <p>
 * All filters are pure functions: they never modify their input, and they ignore non-finite values
 * when estimating backgrounds. Non-finite values are passed through to the output unchanged.
 */
public class ChannelFilters {

	/**
	 * Subtract row and/or column medians. Parameter {@code axis} is one of "both" (default), "row" or "col".
	 */
	public static final String FLATTEN = "flatten";

	/**
	 * Subtract a best-fit plane.
	 */
	public static final String TILT = "tilt";

	/**
	 * Subtract a best-fit second order surface.
	 */
	public static final String PLANE2 = "plane2";

	/**
	 * Gaussian low-pass filter. Parameter {@code sigma} (default 2.0).
	 */
	public static final String LOWPASS = "lowpass";

	/**
	 * Gaussian high-pass filter, i.e. input minus its low-pass. Parameter {@code sigma} (default 2.0).
	 */
	public static final String HIGHPASS = "highpass";

	/**
	 * Default Gaussian sigma, in pixels.
	 */
	public static final double DEFAULT_SIGMA = 2.0;

	/**
	 * A filter that can be applied by a {@link FilterStep}.
	 */
	@FunctionalInterface
	public interface ChannelFilter {

		/**
		 * Apply the filter.
		 * @param input the input array; this must not be modified
		 * @param step the step, providing any parameters
		 * @return a new array
		 * @throws IllegalArgumentException if the parameters are invalid, or the filter cannot be applied to the input
		 */
		ChannelArray apply(ChannelArray input, FilterStep step) throws IllegalArgumentException;

	}

	private static final Map<String, ChannelFilter> filters = Collections.synchronizedMap(new LinkedHashMap<>());

	static {
		filters.put(FLATTEN, (input, step) -> flatten(input, step.getString("axis", "both")));
		filters.put(TILT, (input, step) -> subtractPlane(input));
		filters.put(PLANE2, (input, step) -> subtractSecondOrderSurface(input));
		filters.put(LOWPASS, (input, step) -> gaussianLowPass(input, step.getDouble("sigma", DEFAULT_SIGMA)));
		filters.put(HIGHPASS, (input, step) -> gaussianHighPass(input, step.getDouble("sigma", DEFAULT_SIGMA)));
	}

	// Suppressed default constructor for non-instantiability
	private ChannelFilters() {
		throw new AssertionError();
	}

	/**
	 * Get a filter by name.
	 * @param name
	 * @return the filter, or empty if no filter is registered with that name
	 */
	public static Optional<ChannelFilter> getFilter(String name) {
		return Optional.ofNullable(filters.get(name));
	}

	/**
	 * Register an additional filter. This replaces any existing filter with the same name.
	 * @param name
	 * @param filter
	 */
	public static void registerFilter(String name, ChannelFilter filter) {
		filters.put(name, filter);
	}

	/**
	 * Names of all registered filters.
	 * @return
	 */
	public static List<String> getFilterNames() {
		synchronized (filters) {
			return ImmutableList.copyOf(filters.keySet());
		}
	}

	/**
	 * Subtract the median of each row and/or column.
	 * Rows are processed before columns when both are requested.
	 * @param input
	 * @param axis "both", "row" or "col"
	 * @return
	 */
	public static ChannelArray flatten(ChannelArray input, String axis) {
		boolean doRows, doCols;
		switch (axis == null ? "both" : axis.trim().toLowerCase()) {
		case "both":
			doRows = true;
			doCols = true;
			break;
		case "row":
		case "rows":
		case "0":
			doRows = true;
			doCols = false;
			break;
		case "col":
		case "cols":
		case "1":
			doRows = false;
			doCols = true;
			break;
		default:
			throw new IllegalArgumentException("Unknown flatten axis: " + axis);
		}
		int w = input.getWidth();
		int h = input.getHeight();
		double[] values = input.getArray(false);
		double[] buffer = new double[Math.max(w, h)];
		var medianCalculator = new Median();
		if (doRows) {
			for (int y = 0; y < h; y++) {
				int n = 0;
				for (int x = 0; x < w; x++) {
					double v = values[y * w + x];
					if (Double.isFinite(v))
						buffer[n++] = v;
				}
				if (n == 0)
					continue;
				double median = medianCalculator.evaluate(buffer, 0, n);
				for (int x = 0; x < w; x++)
					values[y * w + x] -= median;
			}
		}
		if (doCols) {
			for (int x = 0; x < w; x++) {
				int n = 0;
				for (int y = 0; y < h; y++) {
					double v = values[y * w + x];
					if (Double.isFinite(v))
						buffer[n++] = v;
				}
				if (n == 0)
					continue;
				double median = medianCalculator.evaluate(buffer, 0, n);
				for (int y = 0; y < h; y++)
					values[y * w + x] -= median;
			}
		}
		return ChannelArray.wrap(values, w, h);
	}

	/**
	 * Subtract the least-squares plane {@code a*x + b*y + c}.
	 * @param input
	 * @return
	 */
	public static ChannelArray subtractPlane(ChannelArray input) {
		return subtractPolynomialSurface(input, false);
	}

	/**
	 * Subtract the least-squares surface {@code a*x^2 + b*y^2 + c*x*y + d*x + e*y + f}.
	 * @param input
	 * @return
	 */
	public static ChannelArray subtractSecondOrderSurface(ChannelArray input) {
		return subtractPolynomialSurface(input, true);
	}

	private static ChannelArray subtractPolynomialSurface(ChannelArray input, boolean secondOrder) {
		int w = input.getWidth();
		int h = input.getHeight();
		double[] values = input.getArray(false);
		int nTerms = secondOrder ? 6 : 3;

		// Centered and scaled coordinates keep the normal equations well conditioned
		double cx = (w - 1) / 2.0;
		double cy = (h - 1) / 2.0;
		double sx = Math.max(1.0, cx);
		double sy = Math.max(1.0, cy);

		double[][] ata = new double[nTerms][nTerms];
		double[] atb = new double[nTerms];
		double[] terms = new double[nTerms];
		int nFinite = 0;
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				double v = values[y * w + x];
				if (!Double.isFinite(v))
					continue;
				computeTerms((x - cx) / sx, (y - cy) / sy, secondOrder, terms);
				for (int i = 0; i < nTerms; i++) {
					atb[i] += terms[i] * v;
					for (int j = i; j < nTerms; j++)
						ata[i][j] += terms[i] * terms[j];
				}
				nFinite++;
			}
		}
		if (nFinite == 0)
			throw new IllegalArgumentException("No finite values to fit");
		for (int i = 0; i < nTerms; i++) {
			for (int j = 0; j < i; j++)
				ata[i][j] = ata[j][i];
		}

		// The pseudo-inverse gives the minimum-norm solution when the fit is underdetermined (e.g. a single row)
		var solver = new SingularValueDecomposition(new Array2DRowRealMatrix(ata, false)).getSolver();
		RealVector coefficients = solver.solve(new ArrayRealVector(atb, false));

		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				int ind = y * w + x;
				if (!Double.isFinite(values[ind]))
					continue;
				computeTerms((x - cx) / sx, (y - cy) / sy, secondOrder, terms);
				double fitted = 0;
				for (int i = 0; i < nTerms; i++)
					fitted += coefficients.getEntry(i) * terms[i];
				values[ind] -= fitted;
			}
		}
		return ChannelArray.wrap(values, w, h);
	}

	private static void computeTerms(double x, double y, boolean secondOrder, double[] terms) {
		if (secondOrder) {
			terms[0] = x * x;
			terms[1] = y * y;
			terms[2] = x * y;
			terms[3] = x;
			terms[4] = y;
			terms[5] = 1.0;
		} else {
			terms[0] = x;
			terms[1] = y;
			terms[2] = 1.0;
		}
	}

	/**
	 * Apply a Gaussian filter.
	 * The kernel is truncated at 4 sigma, and the image is extended by mirror reflection at its boundaries.
	 * Non-finite values do not contribute to their neighbours, and are unchanged in the output.
	 *
	 * @param input
	 * @param sigma Gaussian sigma in pixels
	 * @return
	 * @see OpenCVTools#gaussianBlurFinite(ChannelArray, double)
	 */
	public static ChannelArray gaussianLowPass(ChannelArray input, double sigma) {
		if (!(sigma > 0) || !Double.isFinite(sigma))
			throw new IllegalArgumentException("Gaussian sigma must be > 0, but was " + sigma);
		return OpenCVTools.gaussianBlurFinite(input, sigma);
	}

	/**
	 * Apply a Gaussian high-pass filter, i.e. subtract the output of {@link #gaussianLowPass(ChannelArray, double)}.
	 * @param input
	 * @param sigma Gaussian sigma in pixels
	 * @return
	 */
	public static ChannelArray gaussianHighPass(ChannelArray input, double sigma) {
		var lowpass = gaussianLowPass(input, sigma).getArray(true);
		double[] values = input.getArray(false);
		for (int i = 0; i < values.length; i++) {
			if (Double.isFinite(values[i]))
				values[i] -= lowpass[i];
		}
		return ChannelArray.wrap(values, input.getWidth(), input.getHeight());
	}

}
