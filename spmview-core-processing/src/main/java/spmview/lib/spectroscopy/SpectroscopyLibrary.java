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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import spmview.lib.common.GeneralTools;

/**
 * The spectroscopy records found within a folder.
 * <p>
 * Parsed files are cached by modification time, so that rescanning a folder only parses files that have changed.
 */
public class SpectroscopyLibrary {

	private static final Logger logger = LoggerFactory.getLogger(SpectroscopyLibrary.class);

	private static final String[] EXTENSIONS = {".dat", ".txt"};

	private final SpectroscopyParser parser;

	private final Map<Path, CachedFile> cache = new HashMap<>();

	private Path folder;
	private List<SpectroscopyRecord> records = ImmutableList.of();
	private int nFailed;
	private int nParsed;

	/**
	 * Constructor.
	 * @param parser parser used to read spectroscopy files
	 */
	public SpectroscopyLibrary(SpectroscopyParser parser) {
		this.parser = Objects.requireNonNull(parser);
	}

	/**
	 * Scan a folder for spectroscopy files, replacing the current records.
	 * <p>
	 * Files that cannot be parsed are logged and skipped. If the folder is null or does not exist,
	 * the library is emptied.
	 *
	 * @param folder
	 * @return all records found, sorted by time (records without a time last)
	 * @throws IOException if the folder exists but cannot be listed
	 */
	public synchronized List<SpectroscopyRecord> scan(Path folder) throws IOException {
		nFailed = 0;
		nParsed = 0;
		if (folder == null || !Files.isDirectory(folder)) {
			if (folder != null)
				logger.debug("Spectroscopy folder {} does not exist", folder);
			this.folder = null;
			this.records = ImmutableList.of();
			cache.clear();
			return records;
		}
		Path dir = folder.toAbsolutePath().normalize();

		List<Path> files;
		try (var stream = Files.list(dir)) {
			files = stream
					.filter(p -> Files.isRegularFile(p) && GeneralTools.checkExtensions(p.getFileName().toString(), EXTENSIONS))
					.sorted(Comparator.comparing(p -> p.getFileName().toString()))
					.collect(Collectors.toList());
		}

		var list = new ArrayList<SpectroscopyRecord>();
		for (var path : files) {
			long lastModified;
			try {
				lastModified = Files.getLastModifiedTime(path).toMillis();
			} catch (IOException e) {
				logger.warn("Unable to read {}: {}", path.getFileName(), e.getLocalizedMessage());
				nFailed++;
				continue;
			}
			var cached = cache.get(path);
			if (cached == null || cached.lastModified != lastModified) {
				try {
					cached = new CachedFile(lastModified, parser.parse(path));
					cache.put(path, cached);
					nParsed++;
				} catch (SpectroscopyParseException e) {
					logger.warn("Skipping spectroscopy file {}: {}", path.getFileName(), e.getLocalizedMessage());
					cache.remove(path);
					nFailed++;
					continue;
				}
			}
			list.addAll(cached.records);
		}
		// Remove files that no longer exist
		cache.keySet().retainAll(files);

		list.sort(TemporalAssignment.RECORD_COMPARATOR);
		this.folder = dir;
		this.records = ImmutableList.copyOf(list);
		logger.info("Loaded {} spectroscopy record(s) from {} file(s) in {} ({} parsed, {} failed)",
				records.size(), files.size(), dir, nParsed, nFailed);
		return records;
	}

	/**
	 * Get the most recently scanned folder.
	 * @return
	 */
	public synchronized Optional<Path> getFolder() {
		return Optional.ofNullable(folder);
	}

	/**
	 * Get all records from the most recent scan, sorted by time.
	 * @return
	 */
	public synchronized List<SpectroscopyRecord> getRecords() {
		return records;
	}

	/**
	 * Get all records that belong to a spectroscopy matrix.
	 * @return
	 */
	public synchronized List<SpectroscopyRecord> getMatrixRecords() {
		return records.stream()
				.filter(r -> r.getMatrixIndex().isPresent())
				.collect(ImmutableList.toImmutableList());
	}

	/**
	 * Number of files that could not be parsed during the most recent scan.
	 * @return
	 */
	public synchronized int getFailedCount() {
		return nFailed;
	}

	/**
	 * Number of files that were parsed (rather than read from the cache) during the most recent scan.
	 * @return
	 */
	public synchronized int getParsedCount() {
		return nParsed;
	}

	/**
	 * Number of files currently cached.
	 * @return
	 */
	public synchronized int getCachedFileCount() {
		return cache.size();
	}

	/**
	 * Remove all records and cached files.
	 */
	public synchronized void clear() {
		cache.clear();
		records = ImmutableList.of();
		folder = null;
	}


	private static class CachedFile {

		private final long lastModified;
		private final List<SpectroscopyRecord> records;

		CachedFile(long lastModified, List<SpectroscopyRecord> records) {
			this.lastModified = lastModified;
			this.records = records == null ? ImmutableList.of() : ImmutableList.copyOf(records);
		}

	}

}
