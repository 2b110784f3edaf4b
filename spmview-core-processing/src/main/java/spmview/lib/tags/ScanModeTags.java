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
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

import spmview.lib.images.metadata.ScanFile;

/**
 * Scan mode tags of files, keyed by header path.
 * <p>
 * Automatic detection never replaces a tag that was set manually.
 */
public class ScanModeTags {

	private static final Logger logger = LoggerFactory.getLogger(ScanModeTags.class);

	private final Map<Path, ScanModeTag> tags = new LinkedHashMap<>();

	/**
	 * Detect the scan mode of each file, unless it has a manual tag.
	 * Files where the mode cannot be detected keep any previous automatic tag.
	 * @param files
	 * @return the number of files tagged
	 */
	public synchronized int autoTag(Collection<ScanFile> files) {
		int n = 0;
		for (var file : files) {
			var path = file.getHeaderPath();
			var existing = tags.get(path);
			if (existing != null && existing.isManual())
				continue;
			var tag = ScanModeDetector.detect(file).orElse(null);
			if (tag != null) {
				tags.put(path, tag);
				n++;
			}
		}
		logger.debug("Auto-tagged {}/{} file(s)", n, files.size());
		return n;
	}

	/**
	 * Set a manual tag, which will not be changed by automatic detection.
	 * @param path header path
	 * @param mode
	 * @param absoluteZPicometers tip height for constant-height scans, or null if unknown
	 */
	public synchronized void setManualTag(Path path, ScanMode mode, Integer absoluteZPicometers) {
		tags.put(normalize(path), ScanModeTag.manual(mode, absoluteZPicometers));
	}

	/**
	 * Remove the tag of a file, whether manual or automatic.
	 * @param path
	 * @return the removed tag, if there was one
	 */
	public synchronized Optional<ScanModeTag> removeTag(Path path) {
		return Optional.ofNullable(tags.remove(normalize(path)));
	}

	/**
	 * Get the tag of a file.
	 * @param path
	 * @return
	 */
	public synchronized Optional<ScanModeTag> getTag(Path path) {
		return Optional.ofNullable(tags.get(normalize(path)));
	}

	/**
	 * Get a snapshot of all tags.
	 * @return
	 */
	public synchronized Map<Path, ScanModeTag> getTags() {
		return ImmutableMap.copyOf(tags);
	}

	/**
	 * Get the height of a file relative to the most recent earlier file tagged as constant height.
	 * Only files with a known absolute height are considered.
	 * @param files header paths in acquisition order, e.g. the files of a catalog
	 * @param path the file of interest, which must have a known absolute height
	 * @return the difference, or empty if there is no such earlier file
	 */
	public Optional<HeightDifference> getDifferenceToPreviousConstantHeight(List<Path> files, Path path) {
		return findDifference(files, path, true);
	}

	/**
	 * Get the height of a file relative to the most recent earlier file that is not tagged as constant height,
	 * e.g. the last constant-current scan before a series of constant-height scans.
	 * Only files with a known absolute height are considered.
	 * @param files header paths in acquisition order, e.g. the files of a catalog
	 * @param path the file of interest, which must have a known absolute height
	 * @return the difference, or empty if there is no such earlier file
	 */
	public Optional<HeightDifference> getDifferenceToLastNonConstantHeight(List<Path> files, Path path) {
		return findDifference(files, path, false);
	}

	private synchronized Optional<HeightDifference> findDifference(List<Path> files, Path path, boolean constantHeight) {
		var target = normalize(path);
		var current = tags.get(target);
		if (current == null || current.getAbsoluteZPicometers().isEmpty())
			return Optional.empty();
		int ind = -1;
		for (int i = 0; i < files.size(); i++) {
			if (normalize(files.get(i)).equals(target)) {
				ind = i;
				break;
			}
		}
		for (int i = ind - 1; i >= 0; i--) {
			var previous = normalize(files.get(i));
			var tag = tags.get(previous);
			if (tag == null || tag.getAbsoluteZPicometers().isEmpty())
				continue;
			if ((tag.getMode() == ScanMode.CONSTANT_HEIGHT) == constantHeight) {
				int dz = current.getAbsoluteZPicometers().getAsInt() - tag.getAbsoluteZPicometers().getAsInt();
				return Optional.of(new HeightDifference(dz, previous));
			}
		}
		return Optional.empty();
	}

	private static Path normalize(Path path) {
		return path.toAbsolutePath().normalize();
	}

}
