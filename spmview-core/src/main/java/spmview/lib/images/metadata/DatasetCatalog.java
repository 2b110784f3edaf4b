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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import spmview.lib.common.GeneralTools;
import spmview.lib.io.HeaderMetadataCache;
import spmview.lib.io.HeaderParseException;
import spmview.lib.io.HeaderParser;
import spmview.lib.io.ParsedHeader;

/**
 * The parsed headers of the currently loaded folder.
 * <p>
 * The catalog is replaced wholesale each time a folder is loaded. Queries may be made from any thread,
 * and always see either the previous or the new folder, never a mixture.
 */
public class DatasetCatalog {

	private static final Logger logger = LoggerFactory.getLogger(DatasetCatalog.class);

	/**
	 * Extension of header files.
	 */
	public static final String HEADER_EXTENSION = ".txt";

	private volatile Path folder;
	private volatile Map<Path, ScanFile> files = ImmutableMap.of();

	/**
	 * Load all headers within a folder, without a metadata cache.
	 * @param folder
	 * @param parser
	 * @return
	 * @throws IOException if the folder does not exist or cannot be listed
	 * @see #loadFolder(Path, HeaderParser, HeaderMetadataCache)
	 */
	public LoadSummary loadFolder(Path folder, HeaderParser parser) throws IOException {
		return loadFolder(folder, parser, null);
	}

	/**
	 * Load all headers within a folder, replacing the current contents of the catalog.
	 * <p>
	 * Header files are identified by their extension and processed in order of file name.
	 * Headers that cannot be parsed are logged and skipped.
	 * If a metadata cache is provided, headers that have not been modified since they were cached are
	 * not parsed again; newly parsed headers are added to the cache, and the cache is saved if it changed.
	 *
	 * @param folder the folder containing headers and binary channel files
	 * @param parser parser for header files
	 * @param cache optional metadata cache (may be null)
	 * @return a summary of the headers that were loaded, skipped and read from the cache
	 * @throws IOException if the folder does not exist or cannot be listed
	 */
	public LoadSummary loadFolder(Path folder, HeaderParser parser, HeaderMetadataCache cache) throws IOException {
		Path dir = folder.toAbsolutePath().normalize();
		if (!Files.isDirectory(dir))
			throw new NotDirectoryException(dir.toString());

		List<Path> headers;
		try (var stream = Files.list(dir)) {
			headers = stream
					.filter(p -> Files.isRegularFile(p) && GeneralTools.checkExtensions(p.getFileName().toString(), HEADER_EXTENSION))
					.sorted(Comparator.comparing(p -> p.getFileName().toString()))
					.collect(Collectors.toList());
		}
		logger.debug("Found {} header(s) in {}", headers.size(), dir);

		var builder = ImmutableMap.<Path, ScanFile>builder();
		int nLoaded = 0;
		int nFailed = 0;
		int nHits = 0;
		int nMisses = 0;
		for (var path : headers) {
			try {
				long lastModified = Files.getLastModifiedTime(path).toMillis();
				ParsedHeader parsed = cache == null ? null : cache.get(path, lastModified).orElse(null);
				if (parsed == null) {
					parsed = parser.parseHeader(path);
					nMisses++;
					if (cache != null)
						cache.put(path, lastModified, parsed);
				} else
					nHits++;
				builder.put(path, createScanFile(path, parsed));
				nLoaded++;
			} catch (HeaderParseException e) {
				logger.warn("Skipping {}: {}", path.getFileName(), e.getLocalizedMessage());
				nFailed++;
			} catch (IOException e) {
				logger.warn("Unable to read {}: {}", path.getFileName(), e.getLocalizedMessage());
				nFailed++;
			}
		}
		if (cache != null && cache.isDirty()) {
			try {
				cache.save();
			} catch (IOException e) {
				logger.warn("Unable to save header cache: {}", e.getLocalizedMessage());
				logger.debug(e.getLocalizedMessage(), e);
			}
		}

		this.files = builder.build();
		this.folder = dir;
		var summary = new LoadSummary(nLoaded, nFailed, nHits, nMisses);
		logger.info("Headers loaded from {} (hits={}, miss={}, failed={})", dir, nHits, nMisses, nFailed);
		return summary;
	}

	/**
	 * Create a scan file from the output of a header parser.
	 * @param headerPath
	 * @param parsed
	 * @return
	 */
	public static ScanFile createScanFile(Path headerPath, ParsedHeader parsed) {
		var header = ScanHeader.fromMap(parsed.getHeader());
		var channels = new ArrayList<ChannelDescriptor>();
		int i = 0;
		for (var fields : parsed.getChannels())
			channels.add(ChannelDescriptor.fromFields(i++, fields));
		return new ScanFile(headerPath, header, channels);
	}

	/**
	 * Get the folder that was most recently loaded.
	 * @return
	 */
	public Optional<Path> getFolder() {
		return Optional.ofNullable(folder);
	}

	/**
	 * Get the header paths of all loaded files, in order of file name.
	 * @return an immutable list
	 */
	public List<Path> getFiles() {
		return ImmutableList.copyOf(files.keySet());
	}

	/**
	 * Get all loaded files, in order of file name.
	 * @return an immutable list
	 */
	public List<ScanFile> getScanFiles() {
		return ImmutableList.copyOf(files.values());
	}

	/**
	 * Get the parsed header and channels of a file.
	 * @param headerPath
	 * @return the scan file, or empty if the path is not part of the catalog
	 */
	public Optional<ScanFile> getScanFile(Path headerPath) {
		if (headerPath == null)
			return Optional.empty();
		return Optional.ofNullable(files.get(headerPath.toAbsolutePath().normalize()));
	}

	/**
	 * Number of loaded files.
	 * @return
	 */
	public int size() {
		return files.size();
	}

	/**
	 * Get labels for the channels, in the form {@code "<index>: <caption>"}.
	 * Captions are taken from the first file; if other files have more channels,
	 * labels are added for the extra indices using generic captions.
	 *
	 * @return an immutable list of labels, empty if no files are loaded
	 */
	public List<String> getChannelLabels() {
		var current = files;
		if (current.isEmpty())
			return ImmutableList.of();
		var first = current.values().iterator().next();
		var labels = ImmutableList.<String>builder();
		for (var channel : first.getChannels())
			labels.add(channel.getIndex() + ": " + channel.getCaption());
		int maxChannels = current.values().stream().mapToInt(ScanFile::nChannels).max().orElse(0);
		for (int i = first.nChannels(); i < maxChannels; i++)
			labels.add(i + ": chan" + i);
		return labels.build();
	}

	/**
	 * Get the scan extent of a file in physical units, as {@code [xMin, xMax, yMin, yMax]}.
	 * @param headerPath
	 * @return the extent, or empty if the file is unknown or its scan range is not specified
	 */
	public Optional<double[]> getExtent(Path headerPath) {
		return getScanFile(headerPath).flatMap(f -> f.getHeader().getExtent());
	}

	/**
	 * Get the acquisition time of every loaded image, in order of file name.
	 * The time is read from the header if possible; otherwise the modification time of the header file is used.
	 * @return
	 */
	public List<ImageAcquisition> getImageAcquisitions() {
		var list = new ArrayList<ImageAcquisition>();
		for (var file : files.values()) {
			var path = file.getHeaderPath();
			var time = file.getHeader().getAcquisitionTime().orElseGet(() -> getModifiedTime(path));
			list.add(new ImageAcquisition(path, time));
		}
		return list;
	}

	private static LocalDateTime getModifiedTime(Path path) {
		try {
			return LocalDateTime.ofInstant(Files.getLastModifiedTime(path).toInstant(), ZoneId.systemDefault());
		} catch (IOException e) {
			logger.debug("Unable to read modification time of {}: {}", path, e.getLocalizedMessage());
			return null;
		}
	}

	/**
	 * Remove all files from the catalog.
	 */
	public void clear() {
		files = ImmutableMap.of();
		folder = null;
	}

}
