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

package spmview.lib.spectroscopy;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;

import spmview.lib.common.GeneralTools;
import spmview.lib.images.metadata.ImageAcquisition;

/**
 * Associate spectroscopy records with the image that was acquired immediately before them.
 * <p>
 * Images and records are both sorted by time, and a single sweep assigns each record to the most recent image
 * acquired at or before it. Where several images share that timestamp, the one with the smallest path is used.
 * Records without a timestamp, or that precede every image, are assigned by comparing file names instead.
 */
public class TemporalAssignment {

	private static final Logger logger = LoggerFactory.getLogger(TemporalAssignment.class);

	private static final Ordering<LocalDateTime> TIME_ORDER = Ordering.<LocalDateTime>natural().nullsLast();

	private static final Pattern PATTERN_MATRIX_SUFFIX = Pattern.compile("[_-]matrix.*$");
	private static final Pattern PATTERN_GRID_SUFFIX = Pattern.compile("[_-]grid.*$");

	/**
	 * Images sorted by acquisition time (missing times last), then by path.
	 */
	static final Comparator<ImageAcquisition> IMAGE_COMPARATOR = (a, b) -> ComparisonChain.start()
			.compare(a.getTime().orElse(null), b.getTime().orElse(null), TIME_ORDER)
			.compare(a.getPath(), b.getPath())
			.result();

	/**
	 * Records sorted by acquisition time (missing times last), then by path, then by matrix index.
	 */
	static final Comparator<SpectroscopyRecord> RECORD_COMPARATOR = (a, b) -> ComparisonChain.start()
			.compare(a.getTime().orElse(null), b.getTime().orElse(null), TIME_ORDER)
			.compare(a.getPath(), b.getPath())
			.compare(a.getMatrixIndex().orElse(null), b.getMatrixIndex().orElse(null), Ordering.<Integer>natural().nullsFirst())
			.result();

	private static final Comparator<SpectroscopyRecord> RECORD_TIME_COMPARATOR =
			Comparator.comparing(r -> r.getTime().orElse(null), TIME_ORDER);

	// Suppressed default constructor for non-instantiability
	private TemporalAssignment() {
		throw new AssertionError();
	}

	/**
	 * Assign spectroscopy records to images.
	 *
	 * @param images the images, with their acquisition times
	 * @param records the records to assign
	 * @return a map from image path to the records assigned to it, sorted by time.
	 *         Only images with at least one record are included, in order of acquisition.
	 *         Records that cannot be matched to any image are omitted.
	 */
	public static Map<Path, List<SpectroscopyRecord>> assign(Collection<ImageAcquisition> images, Collection<SpectroscopyRecord> records) {
		if (images.isEmpty() || records.isEmpty())
			return ImmutableMap.of();

		var sortedImages = new ArrayList<>(images);
		sortedImages.sort(IMAGE_COMPARATOR);
		var sortedRecords = new ArrayList<>(records);
		sortedRecords.sort(RECORD_COMPARATOR);

		Map<Path, List<SpectroscopyRecord>> assigned = new LinkedHashMap<>();
		for (var image : sortedImages)
			assigned.put(image.getPath(), new ArrayList<>());

		int nImages = sortedImages.size();
		int cursor = -1;
		int groupStart = -1;
		int nHeuristic = 0;
		int nUnassigned = 0;
		for (var record : sortedRecords) {
			ImageAcquisition match = null;
			var time = record.getTime().orElse(null);
			if (time != null) {
				while (cursor + 1 < nImages) {
					var nextTime = sortedImages.get(cursor + 1).getTime().orElse(null);
					if (nextTime == null || nextTime.isAfter(time))
						break;
					cursor++;
					if (cursor == 0 || !nextTime.equals(sortedImages.get(cursor - 1).getTime().orElse(null)))
						groupStart = cursor;
				}
				if (groupStart >= 0)
					match = sortedImages.get(groupStart);
			}
			if (match == null) {
				match = matchByName(record, sortedImages);
				if (match != null)
					nHeuristic++;
			}
			if (match == null) {
				logger.debug("Unable to assign {} to any image", record);
				nUnassigned++;
				continue;
			}
			assigned.get(match.getPath()).add(record);
		}

		var builder = ImmutableMap.<Path, List<SpectroscopyRecord>>builder();
		for (var entry : assigned.entrySet()) {
			var list = entry.getValue();
			if (list.isEmpty())
				continue;
			list.sort(RECORD_TIME_COMPARATOR);
			builder.put(entry.getKey(), ImmutableList.copyOf(list));
		}
		logger.debug("Assigned {} record(s) to {} image(s) ({} by name, {} unassigned)",
				sortedRecords.size() - nUnassigned, nImages, nHeuristic, nUnassigned);
		return builder.build();
	}

	/**
	 * Find the image whose file name best matches that of a record.
	 * @param record
	 * @param images candidate images
	 * @return the best match, or null if the record's file name is empty or there are no images
	 */
	static ImageAcquisition matchByName(SpectroscopyRecord record, List<ImageAcquisition> images) {
		String recordStem = normalizeStem(GeneralTools.getNameWithoutExtension(record.getPath()));
		if (recordStem.isEmpty())
			return null;
		ImageAcquisition best = null;
		int bestScore = -1;
		for (var image : images) {
			String imageStem = normalizeStem(GeneralTools.getNameWithoutExtension(image.getPath()));
			int score = similarity(recordStem, imageStem);
			if (score > bestScore || (score == bestScore && image.getPath().compareTo(best.getPath()) < 0)) {
				bestScore = score;
				best = image;
			}
		}
		return best;
	}

	/**
	 * Normalize a file name stem for comparison: lowercase, without any matrix or grid suffix, and with hyphens
	 * replaced by underscores.
	 * @param stem
	 * @return
	 */
	static String normalizeStem(String stem) {
		String s = stem.toLowerCase(Locale.ROOT).strip();
		s = PATTERN_MATRIX_SUFFIX.matcher(s).replaceFirst("");
		s = PATTERN_GRID_SUFFIX.matcher(s).replaceFirst("");
		return s.replace('-', '_');
	}

	/**
	 * Score the similarity of two normalized stems.
	 * Each equal leading token (split at underscores) scores 10, each character of the common prefix scores 1,
	 * and 50 is added if either stem contains the other.
	 * @param a
	 * @param b
	 * @return
	 */
	static int similarity(String a, String b) {
		int score = 0;
		var tokensA = tokenize(a);
		var tokensB = tokenize(b);
		int nTokens = Math.min(tokensA.size(), tokensB.size());
		for (int i = 0; i < nTokens; i++) {
			if (!tokensA.get(i).equals(tokensB.get(i)))
				break;
			score += 10;
		}
		int n = Math.min(a.length(), b.length());
		int prefix = 0;
		while (prefix < n && a.charAt(prefix) == b.charAt(prefix))
			prefix++;
		score += prefix;
		if (a.contains(b) || b.contains(a))
			score += 50;
		return score;
	}

	private static List<String> tokenize(String s) {
		var tokens = new ArrayList<String>();
		for (var token : s.split("_")) {
			if (!token.isEmpty())
				tokens.add(token);
		}
		return tokens;
	}

}
