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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestScanModeTags {

	@Test
	public void test_autoTag(@TempDir Path dir) throws Exception {
		var flat = TagFixtures.createScan(dir, "flat", "nm", Map.of(), TagFixtures.constant(16, 0.25));
		var rough = TagFixtures.createScan(dir, "rough", "nm", Map.of(), TagFixtures.ramp(16));
		var tags = new ScanModeTags();
		assertEquals(2, tags.autoTag(List.of(flat, rough)));
		assertEquals(ScanMode.CONSTANT_HEIGHT, tags.getTag(flat.getHeaderPath()).get().getMode());
		assertEquals(ScanMode.CONSTANT_CURRENT, tags.getTag(rough.getHeaderPath()).get().getMode());
		assertEquals(2, tags.getTags().size());
	}

	@Test
	public void test_manualTagsKept(@TempDir Path dir) throws Exception {
		var flat = TagFixtures.createScan(dir, "flat", "nm", Map.of(), TagFixtures.constant(16, 0.25));
		var tags = new ScanModeTags();
		tags.setManualTag(flat.getHeaderPath(), ScanMode.CONSTANT_CURRENT, null);
		assertEquals(0, tags.autoTag(List.of(flat)));
		var tag = tags.getTag(flat.getHeaderPath()).get();
		assertTrue(tag.isManual());
		assertEquals(ScanMode.CONSTANT_CURRENT, tag.getMode());

		assertTrue(tags.removeTag(flat.getHeaderPath()).isPresent());
		assertTrue(tags.getTag(flat.getHeaderPath()).isEmpty());
		assertEquals(1, tags.autoTag(List.of(flat)));
		assertEquals(250, tags.getTag(flat.getHeaderPath()).get().getAbsoluteZPicometers().getAsInt());
	}

	@Test
	public void test_undetectableKeepsPrevious(@TempDir Path dir) throws Exception {
		var flat = TagFixtures.createScan(dir, "flat", "nm", Map.of(), TagFixtures.constant(16, 0.25));
		var tags = new ScanModeTags();
		tags.autoTag(List.of(flat));
		Files.delete(flat.getBinaryPath(0));
		assertEquals(0, tags.autoTag(List.of(flat)));
		assertEquals(ScanMode.CONSTANT_HEIGHT, tags.getTag(flat.getHeaderPath()).get().getMode());
	}

	@Test
	public void test_scanModeNames() {
		assertEquals("CH", ScanMode.CONSTANT_HEIGHT.getAbbreviation());
		assertEquals("constant-current", ScanMode.CONSTANT_CURRENT.toString());
		assertEquals(ScanModeTag.manual(ScanMode.CONSTANT_HEIGHT, 120), ScanModeTag.manual(ScanMode.CONSTANT_HEIGHT, 120));
		assertTrue(!ScanModeTag.manual(ScanMode.CONSTANT_HEIGHT, 120).equals(ScanModeTag.detected(ScanMode.CONSTANT_HEIGHT, 120)));
	}

	@Test
	public void test_heightDifferences(@TempDir Path dir) {
		var files = List.of(dir.resolve("s1.txt"), dir.resolve("s2.txt"), dir.resolve("s3.txt"),
				dir.resolve("s4.txt"), dir.resolve("s5.txt"), dir.resolve("s6.txt"));
		var tags = new ScanModeTags();
		tags.setManualTag(files.get(0), ScanMode.CONSTANT_CURRENT, 900);
		tags.setManualTag(files.get(1), ScanMode.CONSTANT_CURRENT, 1000);
		tags.setManualTag(files.get(2), ScanMode.CONSTANT_HEIGHT, 950);
		// No height, so never used as a reference
		tags.setManualTag(files.get(3), ScanMode.CONSTANT_HEIGHT, null);
		tags.setManualTag(files.get(4), ScanMode.CONSTANT_HEIGHT, 920);

		var vsPrevious = tags.getDifferenceToPreviousConstantHeight(files, files.get(4)).get();
		assertEquals(-30, vsPrevious.getPicometers());
		assertEquals(-0.03, vsPrevious.getNanometers(), 1e-12);
		assertEquals(files.get(2), vsPrevious.getReference());

		var vsNonConstantHeight = tags.getDifferenceToLastNonConstantHeight(files, files.get(4)).get();
		assertEquals(-80, vsNonConstantHeight.getPicometers());
		assertEquals(files.get(1), vsNonConstantHeight.getReference());

		assertEquals(-50, tags.getDifferenceToLastNonConstantHeight(files, files.get(2)).get().getPicometers());
		assertTrue(tags.getDifferenceToPreviousConstantHeight(files, files.get(2)).isEmpty());
		// The first file has nothing before it
		assertTrue(tags.getDifferenceToLastNonConstantHeight(files, files.get(0)).isEmpty());
		// Files without a height or tag have no difference
		assertTrue(tags.getDifferenceToPreviousConstantHeight(files, files.get(3)).isEmpty());
		assertTrue(tags.getDifferenceToPreviousConstantHeight(files, files.get(5)).isEmpty());
		// Files that are not in the list have nothing before them
		assertTrue(tags.getDifferenceToPreviousConstantHeight(files.subList(0, 4), files.get(4)).isEmpty());
	}

}
