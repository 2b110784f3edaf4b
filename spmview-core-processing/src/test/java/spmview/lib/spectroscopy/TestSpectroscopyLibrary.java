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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestSpectroscopyLibrary {

	private static void writeFiles(Path dir) throws Exception {
		Files.writeString(dir.resolve("a_matrix.dat"), String.join("\n",
				"# spectroscopy",
				"time=2023-05-01T10:30:00", "matrix=1", "bias=-1,0,1", "current=1,2,3",
				"---",
				"time=2023-05-01T10:31:00", "matrix=0", "bias=-1,0,1", "current=4,5,6"));
		Files.writeString(dir.resolve("b_point.TXT"), String.join("\n",
				"# spectroscopy",
				"time=2023-05-01T09:00:00", "position=1.5,2.5", "bias=0,1"));
		Files.writeString(dir.resolve("scan_header.txt"), "xPixel=64");
		Files.writeString(dir.resolve("broken.dat"), "# broken");
		Files.writeString(dir.resolve("ignored.csv"), "# spectroscopy\ntime=2023-05-01T08:00:00");
	}

	private static List<String> names(List<SpectroscopyRecord> records) {
		return records.stream().map(r -> r.getPath().getFileName().toString()).collect(Collectors.toList());
	}

	@Test
	public void test_scan(@TempDir Path dir) throws Exception {
		writeFiles(dir);
		var library = new SpectroscopyLibrary(new KeyValueSpectroscopyParser());
		var records = library.scan(dir);
		assertEquals(3, records.size());
		assertEquals(records, library.getRecords());
		// Sorted by time
		assertEquals(List.of("b_point.TXT", "a_matrix.dat", "a_matrix.dat"), names(records));
		assertEquals(LocalDateTime.of(2023, 5, 1, 10, 30), records.get(1).getTime().get());
		assertEquals(1, records.get(1).getMatrixIndex().get());

		assertEquals(2, library.getMatrixRecords().size());
		assertEquals(1, library.getFailedCount());
		assertEquals(3, library.getParsedCount());
		assertEquals(3, library.getCachedFileCount());
		assertEquals(dir.toAbsolutePath().normalize(), library.getFolder().get());
	}

	@Test
	public void test_rescanUsesCache(@TempDir Path dir) throws Exception {
		writeFiles(dir);
		var parser = new KeyValueSpectroscopyParser();
		var library = new SpectroscopyLibrary(parser);
		library.scan(dir);
		int nCalls = parser.getCallCount();

		var records = library.scan(dir);
		assertEquals(3, records.size());
		assertEquals(0, library.getParsedCount());
		// Only the broken file is read again
		assertEquals(nCalls + 1, parser.getCallCount());

		// A modified file is parsed again
		Path point = dir.resolve("b_point.TXT");
		Files.writeString(point, String.join("\n",
				"# spectroscopy",
				"time=2023-05-01T09:00:00", "bias=0,1",
				"---",
				"time=2023-05-01T09:05:00", "bias=0,1"));
		Files.setLastModifiedTime(point, FileTime.fromMillis(Files.getLastModifiedTime(point).toMillis() + 10_000L));
		records = library.scan(dir);
		assertEquals(1, library.getParsedCount());
		assertEquals(4, records.size());

		// Removed files are dropped
		Files.delete(dir.resolve("a_matrix.dat"));
		records = library.scan(dir);
		assertEquals(2, records.size());
		assertEquals(2, library.getCachedFileCount());
		assertTrue(library.getMatrixRecords().isEmpty());
	}

	@Test
	public void test_missingFolder(@TempDir Path dir) throws Exception {
		writeFiles(dir);
		var library = new SpectroscopyLibrary(new KeyValueSpectroscopyParser());
		library.scan(dir);
		assertTrue(library.scan(dir.resolve("missing")).isEmpty());
		assertFalse(library.getFolder().isPresent());
		assertEquals(0, library.getCachedFileCount());

		library.scan(dir);
		assertTrue(library.scan(null).isEmpty());
		assertTrue(library.getRecords().isEmpty());

		library.scan(dir);
		library.clear();
		assertTrue(library.getRecords().isEmpty());
		assertEquals(0, library.getCachedFileCount());
	}

}
