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

package spmview.lib.tags;

/**
 * Feedback mode used to acquire a scan.
 */
public enum ScanMode {

	/**
	 * Tip height held constant, feedback off.
	 */
	CONSTANT_HEIGHT("constant-height", "CH"),

	/**
	 * Tunnelling current held constant by the feedback loop.
	 */
	CONSTANT_CURRENT("constant-current", "CC");

	private final String name;
	private final String abbreviation;

	ScanMode(String name, String abbreviation) {
		this.name = name;
		this.abbreviation = abbreviation;
	}

	/**
	 * Short label, e.g. for a badge drawn over a thumbnail.
	 * @return
	 */
	public String getAbbreviation() {
		return abbreviation;
	}

	@Override
	public String toString() {
		return name;
	}

}
