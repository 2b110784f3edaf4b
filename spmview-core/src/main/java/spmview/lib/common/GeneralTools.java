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

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * A collection of static methods that are generally useful for dealing with file names and numbers.
 */
public final class GeneralTools {

	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Get the extension of a file name, including the dot (e.g. ".dat"), if present.
	 * @param name
	 * @return
	 */
	public static Optional<String> getExtension(String name) {
		if (name == null)
			return Optional.empty();
		int ind = name.lastIndexOf('.');
		if (ind <= 0 || ind == name.length() - 1)
			return Optional.empty();
		return Optional.of(name.substring(ind).toLowerCase(Locale.ROOT));
	}

	/**
	 * Get the file name with extension removed.
	 * @param name
	 * @return
	 */
	public static String getNameWithoutExtension(String name) {
		var ext = getExtension(name).orElse(null);
		return ext == null ? name : name.substring(0, name.length() - ext.length());
	}

	/**
	 * Get the file name of a path with extension removed.
	 * @param path
	 * @return the stem, or an empty string if the path has no file name
	 */
	public static String getNameWithoutExtension(Path path) {
		if (path == null || path.getFileName() == null)
			return "";
		return getNameWithoutExtension(path.getFileName().toString());
	}

	/**
	 * Check if a file name has one of the specified extensions, ignoring case.
	 * @param name
	 * @param extensions extensions including the dot, e.g. ".txt"
	 * @return
	 */
	public static boolean checkExtensions(String name, String... extensions) {
		String lower = name.toLowerCase(Locale.ROOT);
		for (String ext : extensions) {
			if (lower.endsWith(ext.toLowerCase(Locale.ROOT)))
				return true;
		}
		return false;
	}

	/**
	 * Check if a String is null or empty, optionally after trimming.
	 * @param s
	 * @param trim
	 * @return
	 */
	public static boolean blankString(final String s, final boolean trim) {
		return s == null || (trim ? s.trim().isEmpty() : s.isEmpty());
	}

	/**
	 * Clip an input value to be within a specified range.
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : value > max ? max : value;
	}

	/**
	 * Clip an input value to be within a specified range.
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : value > max ? max : value;
	}

	/**
	 * Parse a double leniently.
	 * @param s
	 * @return the parsed value, or null if the input is null, blank or not a number
	 */
	public static Double parseDouble(String s) {
		if (blankString(s, true))
			return null;
		try {
			return Double.parseDouble(s.trim());
		} catch (NumberFormatException e) {
			return null;
		}
	}

	/**
	 * Parse an integer leniently, accepting values written as doubles (e.g. "256.0").
	 * @param s
	 * @return the parsed value, or null if the input cannot be interpreted as an integer
	 */
	public static Integer parseInteger(String s) {
		Double d = parseDouble(s);
		if (d == null || !Double.isFinite(d))
			return null;
		return (int)Math.round(d);
	}

}
