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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.Map;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestScanHeader {

	@Test
	public void test_parseDateTime() {
		var expected = LocalDateTime.of(2023, 5, 1, 10, 15, 30);
		assertEquals(expected, ScanHeader.parseDateTime("2023-05-01", "10:15:30"));
		assertEquals(expected, ScanHeader.parseDateTime("01/05/2023", "10:15:30"));
		assertEquals(expected, ScanHeader.parseDateTime("01.05.2023", "10:15:30"));
		assertEquals(expected, ScanHeader.parseDateTime("2023-05-01 10:15:30", null));
		assertEquals(LocalDateTime.of(2023, 5, 1, 10, 15), ScanHeader.parseDateTime("2023-05-01", "10:15"));
		assertEquals(LocalDateTime.of(2023, 5, 1, 0, 0), ScanHeader.parseDateTime("2023-05-01", ""));
		assertNull(ScanHeader.parseDateTime(null, null));
		assertNull(ScanHeader.parseDateTime("yesterday", "noon"));
	}

	@Test
	public void test_defaults() {
		var header = ScanHeader.fromMap(Map.of("Comment", "nothing useful"));
		assertEquals(ScanHeader.DEFAULT_PIXEL_SIZE, header.getPixelWidth());
		assertEquals(ScanHeader.DEFAULT_PIXEL_SIZE, header.getPixelHeight());
		assertTrue(header.getXRange().isEmpty());
		assertTrue(header.getAcquisitionTime().isEmpty());
		assertTrue(header.getExtent().isEmpty());
		assertEquals("nothing useful", header.getProperty("Comment"));

		// Height defaults to the width
		header = ScanHeader.fromMap(Map.of("xPixel", "256", "yPixel", "-1", "Bias", "abc"));
		assertEquals(256, header.getPixelHeight());
		assertTrue(header.getBias().isEmpty());
	}

	@Test
	public void test_ranges() {
		var header = ScanHeader.fromMap(Map.of("ScanRange", "50", "YScanRange", "20", "SetPoint", "0.1"));
		assertEquals(50.0, header.getXRange().get(), 0.0);
		assertEquals(20.0, header.getYRange().get(), 0.0);
		assertEquals(0.1, header.getSetpoint().get(), 0.0);
		assertArrayEquals(new double[] {0, 50, 20, 0}, header.getExtent().get(), 0.0);
	}

	@Test
	public void test_physicalToPixel() {
		var header = ScanHeader.fromMap(Map.of(
				"xPixel", "11", "yPixel", "11", "ScanRange", "10", "xCenter", "100", "yCenter", "-5"));
		// Top-left corner of the frame
		assertArrayEquals(new double[] {0, 0}, header.physicalToPixel(95, 0).get(), 1e-12);
		assertArrayEquals(new double[] {5, 5}, header.physicalToPixel(100, -5).get(), 1e-12);
		assertArrayEquals(new double[] {10, 10}, header.physicalToPixel(105, -10).get(), 1e-12);
		assertTrue(header.physicalToPixel(106, -5).isEmpty());
		assertTrue(header.physicalToPixel(Double.NaN, 0).isEmpty());
	}

}
