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

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * The path and acquisition time of an image, used to associate spectroscopy records with the scan
 * that preceded them.
 */
public final class ImageAcquisition {

	private final Path path;
	private final LocalDateTime time;

	/**
	 * Constructor.
	 * @param path header path of the image
	 * @param time acquisition time, or null if unknown
	 */
	public ImageAcquisition(Path path, LocalDateTime time) {
		this.path = Objects.requireNonNull(path);
		this.time = time;
	}

	/**
	 * Image path.
	 * @return
	 */
	public Path getPath() {
		return path;
	}

	/**
	 * Acquisition time, if known.
	 * @return
	 */
	public Optional<LocalDateTime> getTime() {
		return Optional.ofNullable(time);
	}

	@Override
	public String toString() {
		return path.getFileName() + " @ " + time;
	}

	@Override
	public int hashCode() {
		return Objects.hash(path, time);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ImageAcquisition))
			return false;
		ImageAcquisition other = (ImageAcquisition) obj;
		return path.equals(other.path) && Objects.equals(time, other.time);
	}

}
