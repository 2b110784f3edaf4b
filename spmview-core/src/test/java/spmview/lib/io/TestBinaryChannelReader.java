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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestBinaryChannelReader {

	@Test
	public void test_inferSampleType() throws Exception {
		assertEquals(SampleType.INT16, BinaryChannelReader.inferSampleType(200, 100));
		assertEquals(SampleType.FLOAT32, BinaryChannelReader.inferSampleType(400, 100));
		assertEquals(SampleType.FLOAT64, BinaryChannelReader.inferSampleType(800, 100));
		assertEquals(SampleType.UINT8, BinaryChannelReader.inferSampleType(100, 100));
		// Padded files use the first candidate that fits
		assertEquals(SampleType.INT16, BinaryChannelReader.inferSampleType(250, 100));
		assertEquals(SampleType.INT16, BinaryChannelReader.inferSampleType(500, 100));
		assertEquals(SampleType.UINT8, BinaryChannelReader.inferSampleType(150, 100));
		assertThrows(ChannelDecodeException.class, () -> BinaryChannelReader.inferSampleType(99, 100));
		assertThrows(ChannelDecodeException.class, () -> BinaryChannelReader.inferSampleType(10, 0));
	}

	@Test
	public void test_decodeInt16(@TempDir Path dir) throws Exception {
		var buffer = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);
		buffer.putShort((short)1).putShort((short)-2).putShort((short)300).putShort((short)0);
		Path path = Files.write(dir.resolve("int16.bin"), buffer.array());

		var array = BinaryChannelReader.decodeChannel(path, 2, 2, 0.5, 10.0);
		assertEquals(2, array.getWidth());
		assertEquals(2, array.getHeight());
		assertArrayEquals(new double[] {10.5, 9.0, 160.0, 10.0}, array.getArray(false), 1e-12);
	}

	@Test
	public void test_decodeDeclaredType(@TempDir Path dir) throws Exception {
		var buffer = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);
		buffer.putShort((short)-1).putShort((short)2).putShort((short)3).putShort((short)4);
		Path path = Files.write(dir.resolve("uint16.bin"), buffer.array());

		var array = BinaryChannelReader.decodeChannel(path, 2, 2, 1.0, 0.0, SampleType.UINT16);
		assertEquals(65535.0, array.getValue(0, 0), 0.0);

		// Declared type needs more bytes than available
		assertThrows(ChannelDecodeException.class, () -> BinaryChannelReader.decodeChannel(path, 2, 2, 1.0, 0.0, SampleType.FLOAT64));
	}

	@Test
	public void test_decodeFloat32WithPadding(@TempDir Path dir) throws Exception {
		var buffer = ByteBuffer.allocate(20).order(ByteOrder.LITTLE_ENDIAN);
		buffer.putFloat(1.5f).putFloat(-2.5f).putFloat(3f).putFloat(4f).putFloat(99f);
		Path path = Files.write(dir.resolve("float.bin"), buffer.array());

		var array = BinaryChannelReader.decodeChannel(path, 2, 2, 1.0, 0.0, SampleType.FLOAT32);
		assertArrayEquals(new double[] {1.5, -2.5, 3.0, 4.0}, array.getArray(false), 1e-12);
	}

	@Test
	public void test_missingOrShort(@TempDir Path dir) throws Exception {
		Path missing = dir.resolve("missing.bin");
		assertThrows(ChannelDecodeException.class, () -> BinaryChannelReader.decodeChannel(missing, 2, 2, 1.0, 0.0));

		Path shortFile = Files.write(dir.resolve("short.bin"), new byte[3]);
		assertThrows(ChannelDecodeException.class, () -> BinaryChannelReader.decodeChannel(shortFile, 2, 2, 1.0, 0.0));
		assertThrows(ChannelDecodeException.class, () -> BinaryChannelReader.decodeChannel(shortFile, 0, 2, 1.0, 0.0));
	}

	@Test
	public void test_sampleValues(@TempDir Path dir) throws Exception {
		var buffer = ByteBuffer.allocate(20).order(ByteOrder.LITTLE_ENDIAN);
		for (int i = 0; i < 10; i++)
			buffer.putShort((short)i);
		Path path = Files.write(dir.resolve("samples.bin"), buffer.array());

		double[] samples = BinaryChannelReader.sampleValues(path, 4, 5, 2, 2.0, 1.0, null);
		assertArrayEquals(new double[] {1.0, 7.0, 13.0, 19.0}, samples, 1e-12);

		assertEquals(10, BinaryChannelReader.sampleValues(path, 100, 5, 2, 1.0, 0.0, null).length);
		assertEquals(0, BinaryChannelReader.sampleValues(path, 0, 5, 2, 1.0, 0.0, null).length);
	}

}
