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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestHeaderMetadataCache {

	private static ParsedHeader createHeader() {
		return new ParsedHeader(
				Map.of("xPixel", "64", "Date", "2023-05-01"),
				List.of(Map.of("Caption", "Topography", "FileName", "scan_0.bin"), Map.of("Caption", "Current")));
	}

	@Test
	public void test_inMemory() throws Exception {
		var cache = HeaderMetadataCache.createInMemory();
		var path = Path.of("data", "scan.txt");
		assertTrue(cache.get(path, 100L).isEmpty());

		cache.put(path, 100L, createHeader());
		assertEquals(1, cache.size());
		assertTrue(cache.isDirty());
		var cached = cache.get(path, 100L).get();
		assertEquals("64", cached.getHeader().get("xPixel"));
		assertEquals(2, cached.getChannels().size());

		// Modified files are not returned
		assertTrue(cache.get(path, 200L).isEmpty());

		// Nothing to write
		assertFalse(cache.save());
		assertTrue(cache.getFile().isEmpty());
	}

	@Test
	public void test_saveAndLoad(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("cache").resolve("headers.json");
		var cache = HeaderMetadataCache.load(file);
		assertEquals(0, cache.size());
		assertFalse(cache.isDirty());

		var path = dir.resolve("scan.txt");
		cache.put(path, 1234L, createHeader());
		assertTrue(cache.save());
		assertFalse(cache.isDirty());
		assertTrue(Files.isRegularFile(file));
		assertFalse(cache.save());

		var loaded = HeaderMetadataCache.load(file);
		assertEquals(1, loaded.size());
		var header = loaded.get(path, 1234L).get();
		assertEquals("2023-05-01", header.getHeader().get("Date"));
		assertEquals("scan_0.bin", header.getChannels().get(0).get("FileName"));
		assertEquals("Current", header.getChannels().get(1).get("Caption"));
	}

	@Test
	public void test_corruptFile(@TempDir Path dir) throws Exception {
		Path file = Files.writeString(dir.resolve("headers.json"), "{ not valid json");
		var cache = HeaderMetadataCache.load(file);
		assertEquals(0, cache.size());

		cache.put(dir.resolve("scan.txt"), 1L, createHeader());
		assertTrue(cache.save());
		assertEquals(1, HeaderMetadataCache.load(file).size());
	}

	@Test
	public void test_nullChannelsIgnored(@TempDir Path dir) throws Exception {
		Path header = dir.resolve("scan.txt");
		var key = GsonTools.getInstance().toJson(header.toAbsolutePath().normalize().toString());
		String json = "{" + key + ": {\"mtime\": 5, \"header\": {\"xPixel\": \"64\"}, "
				+ "\"channels\": [null, {\"Caption\": \"Topography\"}, null]}}";
		Path file = Files.writeString(dir.resolve("headers.json"), json);

		var cache = HeaderMetadataCache.load(file);
		assertEquals(1, cache.size());
		var cached = cache.get(header, 5L).get();
		assertEquals(1, cached.getChannels().size());
		assertEquals("Topography", cached.getChannels().get(0).get("Caption"));
	}

}
