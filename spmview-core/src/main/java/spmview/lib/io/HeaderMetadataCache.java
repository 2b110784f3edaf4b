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

package spmview.lib.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

/**
 * Persistent cache of parsed headers, stored as a JSON file.
 * <p>
 * Each entry records the modification time of the header when it was parsed; an entry is only
 * used if the header has not changed since. Reading a folder of several hundred headers is then
 * limited by listing the folder rather than by parsing.
 * <p>
 * Instances are not thread-safe; they are used by the thread that loads a folder.
 */
public class HeaderMetadataCache {

	private static final Logger logger = LoggerFactory.getLogger(HeaderMetadataCache.class);

	private final Path file;
	private final Map<String, Entry> entries;
	private boolean dirty = false;

	private HeaderMetadataCache(Path file, Map<String, Entry> entries) {
		this.file = file;
		this.entries = entries;
	}

	/**
	 * Create an empty cache that is never written to disk.
	 * @return
	 */
	public static HeaderMetadataCache createInMemory() {
		return new HeaderMetadataCache(null, new LinkedHashMap<>());
	}

	/**
	 * Read a cache from a JSON file.
	 * A missing file gives an empty cache. A file that cannot be read or parsed is logged and
	 * also gives an empty cache, which will overwrite the file on the next {@link #save()}.
	 *
	 * @param file
	 * @return
	 */
	public static HeaderMetadataCache load(Path file) {
		Objects.requireNonNull(file);
		Map<String, Entry> entries = new LinkedHashMap<>();
		if (Files.isRegularFile(file)) {
			try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
				Map<String, Entry> read = GsonTools.getInstance().fromJson(reader, new TypeToken<Map<String, Entry>>() {}.getType());
				if (read != null) {
					for (var e : read.entrySet()) {
						var entry = e.getValue();
						if (e.getKey() == null || entry == null || entry.header == null)
							continue;
						if (entry.channels != null)
							entry.channels.removeIf(Objects::isNull);
						entries.put(e.getKey(), entry);
					}
				}
				logger.debug("Read {} cached header(s) from {}", entries.size(), file);
			} catch (IOException | JsonParseException e) {
				logger.warn("Unable to read header cache {}: {}", file, e.getLocalizedMessage());
				logger.debug(e.getLocalizedMessage(), e);
			}
		}
		return new HeaderMetadataCache(file, entries);
	}

	/**
	 * Get the cached header for a file, if it was stored with the same modification time.
	 * @param headerPath
	 * @param lastModified modification time of the header, in milliseconds
	 * @return
	 */
	public Optional<ParsedHeader> get(Path headerPath, long lastModified) {
		var entry = entries.get(toKey(headerPath));
		if (entry == null || entry.mtime != lastModified || entry.header == null)
			return Optional.empty();
		List<Map<String, String>> channels = entry.channels == null ? List.of() : entry.channels;
		return Optional.of(new ParsedHeader(entry.header, channels));
	}

	/**
	 * Store a parsed header. This marks the cache as needing to be saved.
	 * @param headerPath
	 * @param lastModified modification time of the header, in milliseconds
	 * @param header
	 */
	public void put(Path headerPath, long lastModified, ParsedHeader header) {
		var entry = new Entry();
		entry.mtime = lastModified;
		entry.header = new LinkedHashMap<>(header.getHeader());
		entry.channels = new ArrayList<>();
		for (var channel : header.getChannels())
			entry.channels.add(new LinkedHashMap<>(channel));
		entries.put(toKey(headerPath), entry);
		dirty = true;
	}

	/**
	 * Number of cached headers.
	 * @return
	 */
	public int size() {
		return entries.size();
	}

	/**
	 * Query whether there are changes that have not yet been saved.
	 * @return
	 */
	public boolean isDirty() {
		return dirty;
	}

	/**
	 * Get the file backing this cache.
	 * @return the file, or empty for an in-memory cache
	 */
	public Optional<Path> getFile() {
		return Optional.ofNullable(file);
	}

	/**
	 * Write the cache to its file, if there have been changes since it was read or last saved.
	 * @return true if the file was written, false if there was nothing to save
	 * @throws IOException
	 */
	public boolean save() throws IOException {
		if (!dirty || file == null)
			return false;
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null)
			Files.createDirectories(parent);
		try (var writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
			GsonTools.getInstance().toJson(entries, new TypeToken<Map<String, Entry>>() {}.getType(), writer);
		}
		dirty = false;
		logger.debug("Wrote {} cached header(s) to {}", entries.size(), file);
		return true;
	}

	private static String toKey(Path path) {
		return path.toAbsolutePath().normalize().toString();
	}

	private static class Entry {

		private long mtime;
		private Map<String, String> header;
		private List<Map<String, String>> channels;

	}

}
