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

/**
 * Core SPMView preferences. These are not persistent; they provide process-wide defaults
 * used when building cache settings.
 */
public class Prefs {

	private static int nWorkers = ThreadTools.getDefaultWorkerCount();

	private static String defaultColorMapName = "Viridis";

	/**
	 * Get the requested number of render workers.
	 * @return
	 */
	public static int getNumWorkers() {
		return nWorkers;
	}

	/**
	 * Set the requested number of render workers. This will be clipped to be at least 1.
	 * @param n
	 */
	public static void setNumWorkers(int n) {
		nWorkers = Math.max(1, n);
	}

	/**
	 * Get the name of the color map used when none is specified, or the requested one is unknown.
	 * @return
	 */
	public static String getDefaultColorMapName() {
		return defaultColorMapName;
	}

	/**
	 * Set the name of the default color map.
	 * @param name
	 */
	public static void setDefaultColorMapName(String name) {
		if (GeneralTools.blankString(name, true))
			throw new IllegalArgumentException("Color map name must not be blank");
		defaultColorMapName = name;
	}

}
