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

import java.nio.file.Path;
import java.util.Objects;

/**
 * Change in absolute tip height between a file and an earlier reference file.
 */
public final class HeightDifference {

	private final int picometers;
	private final Path reference;

	HeightDifference(int picometers, Path reference) {
		this.picometers = picometers;
		this.reference = Objects.requireNonNull(reference);
	}

	/**
	 * Height of the file minus the height of the reference, in pm.
	 * @return
	 */
	public int getPicometers() {
		return picometers;
	}

	/**
	 * Height difference in nm.
	 * @return
	 */
	public double getNanometers() {
		return picometers / 1000.0;
	}

	/**
	 * Header path of the reference file.
	 * @return
	 */
	public Path getReference() {
		return reference;
	}

	@Override
	public String toString() {
		return String.format("%+d pm vs %s", picometers, reference.getFileName());
	}

	@Override
	public int hashCode() {
		return Objects.hash(picometers, reference);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof HeightDifference))
			return false;
		var other = (HeightDifference)obj;
		return picometers == other.picometers && reference.equals(other.reference);
	}

}
