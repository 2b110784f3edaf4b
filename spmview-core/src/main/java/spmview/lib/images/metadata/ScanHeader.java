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

package spmview.lib.images.metadata;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

import spmview.lib.common.GeneralTools;

/**
 * Scan-level metadata for one acquisition.
 * <p>
 * The fields read by the caches and the spectroscopy assignment are parsed into typed values;
 * everything else (instrument settings, comments, etc.) is available unchanged through {@link #getProperties()}.
 * Parsing is lenient: a missing or malformed value is treated as absent, and the defaults
 * used by the acquisition software apply.
 */
public final class ScanHeader {

	/**
	 * Pixel width used when the header does not specify one.
	 */
	public static final int DEFAULT_PIXEL_SIZE = 128;

	static final String KEY_X_PIXEL = "xPixel";
	static final String KEY_Y_PIXEL = "yPixel";
	static final String KEY_X_RANGE = "XScanRange";
	static final String KEY_Y_RANGE = "YScanRange";
	static final String KEY_RANGE = "ScanRange";
	static final String KEY_X_CENTER = "xCenter";
	static final String KEY_Y_CENTER = "yCenter";
	static final String KEY_DATE = "Date";
	static final String KEY_TIME = "Time";
	static final String KEY_BIAS = "Bias";
	static final String KEY_SETPOINT = "SetPoint";

	private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
			DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
			DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
			DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
			DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"),
			DateTimeFormatter.ofPattern("dd-MM-yyyy HH:mm:ss"),
			DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss")
			);

	private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
			DateTimeFormatter.ofPattern("yyyy-MM-dd"),
			DateTimeFormatter.ofPattern("dd/MM/yyyy"),
			DateTimeFormatter.ofPattern("MM/dd/yyyy"),
			DateTimeFormatter.ofPattern("dd.MM.yyyy")
			);

	private final int pixelWidth;
	private final int pixelHeight;
	private final Double xRange;
	private final Double yRange;
	private final double xCenter;
	private final double yCenter;
	private final LocalDateTime acquisitionTime;
	private final Double bias;
	private final Double setpoint;
	private final Map<String, String> properties;

	private ScanHeader(Map<String, String> properties) {
		var builder = ImmutableMap.<String, String>builder();
		for (var entry : properties.entrySet()) {
			if (entry.getKey() != null && entry.getValue() != null)
				builder.put(entry.getKey(), entry.getValue());
		}
		this.properties = builder.build();

		Integer xPix = GeneralTools.parseInteger(properties.get(KEY_X_PIXEL));
		this.pixelWidth = xPix == null || xPix <= 0 ? DEFAULT_PIXEL_SIZE : xPix;
		Integer yPix = GeneralTools.parseInteger(properties.get(KEY_Y_PIXEL));
		this.pixelHeight = yPix == null || yPix <= 0 ? pixelWidth : yPix;

		Double range = positiveOrNull(GeneralTools.parseDouble(properties.get(KEY_RANGE)));
		Double xr = positiveOrNull(GeneralTools.parseDouble(properties.get(KEY_X_RANGE)));
		Double yr = positiveOrNull(GeneralTools.parseDouble(properties.get(KEY_Y_RANGE)));
		this.xRange = xr == null ? range : xr;
		this.yRange = yr == null ? range : yr;

		this.xCenter = valueOrZero(GeneralTools.parseDouble(properties.get(KEY_X_CENTER)));
		this.yCenter = valueOrZero(GeneralTools.parseDouble(properties.get(KEY_Y_CENTER)));
		this.bias = GeneralTools.parseDouble(properties.get(KEY_BIAS));
		this.setpoint = GeneralTools.parseDouble(properties.get(KEY_SETPOINT));
		this.acquisitionTime = parseDateTime(properties.get(KEY_DATE), properties.get(KEY_TIME));
	}

	/**
	 * Create a header from the key/value mapping produced by a header parser.
	 * @param properties
	 * @return
	 */
	public static ScanHeader fromMap(Map<String, String> properties) {
		return new ScanHeader(properties);
	}

	private static Double positiveOrNull(Double value) {
		return value == null || !(value > 0) ? null : value;
	}

	private static double valueOrZero(Double value) {
		return value == null || !Double.isFinite(value) ? 0.0 : value;
	}

	/**
	 * Parse a date and (optional) time using the formats written by common SPM controllers.
	 * @param date
	 * @param time
	 * @return the parsed date/time, or null if neither could be interpreted
	 */
	static LocalDateTime parseDateTime(String date, String time) {
		String d = date == null ? "" : date.trim();
		String t = time == null ? "" : time.trim();
		if (d.isEmpty() && t.isEmpty())
			return null;
		if (!d.isEmpty() && !t.isEmpty()) {
			String combined = d + " " + t;
			for (var format : DATE_TIME_FORMATS) {
				try {
					return LocalDateTime.parse(combined, format);
				} catch (DateTimeParseException e) {
					continue;
				}
			}
		}
		if (!d.isEmpty()) {
			for (var format : DATE_TIME_FORMATS) {
				try {
					return LocalDateTime.parse(d, format);
				} catch (DateTimeParseException e) {
					continue;
				}
			}
			for (var format : DATE_FORMATS) {
				try {
					return LocalDate.parse(d, format).atStartOfDay();
				} catch (DateTimeParseException e) {
					continue;
				}
			}
		}
		return null;
	}

	/**
	 * Number of pixels along x.
	 * @return
	 */
	public int getPixelWidth() {
		return pixelWidth;
	}

	/**
	 * Number of pixels along y.
	 * @return
	 */
	public int getPixelHeight() {
		return pixelHeight;
	}

	/**
	 * Scan range along x in physical units, if known.
	 * @return
	 */
	public Optional<Double> getXRange() {
		return Optional.ofNullable(xRange);
	}

	/**
	 * Scan range along y in physical units, if known.
	 * @return
	 */
	public Optional<Double> getYRange() {
		return Optional.ofNullable(yRange);
	}

	/**
	 * Scan center along x in physical units (0 if not specified).
	 * @return
	 */
	public double getXCenter() {
		return xCenter;
	}

	/**
	 * Scan center along y in physical units (0 if not specified).
	 * @return
	 */
	public double getYCenter() {
		return yCenter;
	}

	/**
	 * Acquisition date and time, if it could be parsed.
	 * @return
	 */
	public Optional<LocalDateTime> getAcquisitionTime() {
		return Optional.ofNullable(acquisitionTime);
	}

	/**
	 * Sample bias, if specified.
	 * @return
	 */
	public Optional<Double> getBias() {
		return Optional.ofNullable(bias);
	}

	/**
	 * Feedback setpoint, if specified.
	 * @return
	 */
	public Optional<Double> getSetpoint() {
		return Optional.ofNullable(setpoint);
	}

	/**
	 * Get a single raw header value.
	 * @param key
	 * @return the value, or null if the header does not contain the key
	 */
	public String getProperty(String key) {
		return properties.get(key);
	}

	/**
	 * Get all header values, unmodified.
	 * @return an unmodifiable map
	 */
	public Map<String, String> getProperties() {
		return properties;
	}

	/**
	 * Get the scan extent as {@code [xMin, xMax, yMin, yMax]}, with the origin at 0.
	 * @return the extent, or empty if either scan range is unknown
	 */
	public Optional<double[]> getExtent() {
		if (xRange == null || yRange == null)
			return Optional.empty();
		return Optional.of(new double[] {0.0, xRange, yRange, 0.0});
	}

	/**
	 * Map a physical position onto (fractional) pixel coordinates within this scan.
	 * The scan frame is defined by its center and range; y increases upwards in physical space
	 * but downwards in pixel space.
	 *
	 * @param x physical x coordinate
	 * @param y physical y coordinate
	 * @return {@code [col, row]}, or empty if the ranges are unknown or the point is outside the frame
	 */
	public Optional<double[]> physicalToPixel(double x, double y) {
		if (xRange == null || yRange == null || !Double.isFinite(x) || !Double.isFinite(y))
			return Optional.empty();
		double xMin = xCenter - xRange / 2.0;
		double yMax = yCenter + yRange / 2.0;
		double fracX = (x - xMin) / xRange;
		double fracY = (yMax - y) / yRange;
		if (fracX < 0 || fracX > 1 || fracY < 0 || fracY > 1)
			return Optional.empty();
		double cols = Math.max(1, pixelWidth - 1);
		double rows = Math.max(1, pixelHeight - 1);
		return Optional.of(new double[] {fracX * cols, fracY * rows});
	}

	@Override
	public String toString() {
		return "ScanHeader [" + pixelWidth + "x" + pixelHeight + ", time=" + acquisitionTime + "]";
	}

}
