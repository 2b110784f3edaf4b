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

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Scan mode assigned to a file, either detected automatically or set by the user.
 */
public final class ScanModeTag {

	private final ScanMode mode;
	private final Integer absoluteZPicometers;
	private final boolean manual;

	private ScanModeTag(ScanMode mode, Integer absoluteZPicometers, boolean manual) {
		this.mode = Objects.requireNonNull(mode);
		this.absoluteZPicometers = absoluteZPicometers;
		this.manual = manual;
	}

	/**
	 * Create a tag from automatic detection.
	 * @param mode
	 * @param absoluteZPicometers tip height for constant-height scans, or null if unknown
	 * @return
	 */
	public static ScanModeTag detected(ScanMode mode, Integer absoluteZPicometers) {
		return new ScanModeTag(mode, absoluteZPicometers, false);
	}

	/**
	 * Create a tag set by the user. Manual tags are never replaced by automatic detection.
	 * @param mode
	 * @param absoluteZPicometers tip height for constant-height scans, or null if unknown
	 * @return
	 */
	public static ScanModeTag manual(ScanMode mode, Integer absoluteZPicometers) {
		return new ScanModeTag(mode, absoluteZPicometers, true);
	}

	/**
	 * The scan mode.
	 * @return
	 */
	public ScanMode getMode() {
		return mode;
	}

	/**
	 * Absolute tip height in picometers, if known.
	 * @return
	 */
	public OptionalInt getAbsoluteZPicometers() {
		return absoluteZPicometers == null ? OptionalInt.empty() : OptionalInt.of(absoluteZPicometers);
	}

	/**
	 * True if the tag was set by the user.
	 * @return
	 */
	public boolean isManual() {
		return manual;
	}

	@Override
	public String toString() {
		return mode.getAbbreviation() + (absoluteZPicometers == null ? "" : " (" + absoluteZPicometers + " pm)") + (manual ? " [manual]" : "");
	}

	@Override
	public int hashCode() {
		return Objects.hash(mode, absoluteZPicometers, manual);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ScanModeTag))
			return false;
		var other = (ScanModeTag)obj;
		return mode == other.mode && manual == other.manual && Objects.equals(absoluteZPicometers, other.absoluteZPicometers);
	}

}
