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
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import spmview.lib.images.ChannelArray;

/**
 * Static methods to decode raw binary channel files.
 * <p>
 * Channel files contain {@code width * height} little-endian samples in row-major order,
 * optionally followed by padding. When the header does not declare the sample type,
 * it is inferred from the file size.
 */
public class BinaryChannelReader {

	private static final Logger logger = LoggerFactory.getLogger(BinaryChannelReader.class);

	/**
	 * Candidate types when the file is larger than needed, in order of preference.
	 */
	private static final List<SampleType> PADDED_CANDIDATES = List.of(
			SampleType.INT16, SampleType.UINT16, SampleType.INT32, SampleType.UINT32,
			SampleType.INT64, SampleType.FLOAT32, SampleType.FLOAT64, SampleType.UINT8);

	// Suppressed default constructor for non-instantiability
	private BinaryChannelReader() {
		throw new AssertionError();
	}

	/**
	 * Infer the sample type of a channel file from its size.
	 * <p>
	 * An exact size match is preferred ({@code INT16}, {@code FLOAT32}, {@code FLOAT64} or {@code UINT8} for
	 * 2, 4, 8 or 1 bytes per pixel); otherwise the first candidate whose samples fit within the file is used.
	 *
	 * @param fileSize size of the file in bytes
	 * @param nPixels expected number of samples
	 * @return the inferred sample type
	 * @throws ChannelDecodeException if the file is too short to contain {@code nPixels} samples of any type
	 */
	public static SampleType inferSampleType(long fileSize, long nPixels) throws ChannelDecodeException {
		if (nPixels <= 0)
			throw new ChannelDecodeException("Invalid number of pixels: " + nPixels);
		if (fileSize == nPixels * 2)
			return SampleType.INT16;
		if (fileSize == nPixels * 4)
			return SampleType.FLOAT32;
		if (fileSize == nPixels * 8)
			return SampleType.FLOAT64;
		if (fileSize == nPixels)
			return SampleType.UINT8;
		for (var type : PADDED_CANDIDATES) {
			if (fileSize >= nPixels * type.getBytesPerSample())
				return type;
		}
		throw new ChannelDecodeException("File too short: " + fileSize + " bytes for " + nPixels + " pixels");
	}

	/**
	 * Decode a channel file, inferring the sample type from the file size.
	 *
	 * @param path
	 * @param width
	 * @param height
	 * @param scale
	 * @param offset
	 * @return
	 * @throws ChannelDecodeException if the file is missing, too short or cannot be read
	 * @see #decodeChannel(Path, int, int, double, double, SampleType)
	 */
	public static ChannelArray decodeChannel(Path path, int width, int height, double scale, double offset) throws ChannelDecodeException {
		return decodeChannel(path, width, height, scale, offset, null);
	}

	/**
	 * Decode a channel file, applying {@code value = raw * scale + offset} to every sample.
	 *
	 * @param path path to the binary file
	 * @param width number of pixels along x
	 * @param height number of pixels along y
	 * @param scale multiplicative factor
	 * @param offset additive offset
	 * @param sampleType declared sample type, or null to infer it from the file size
	 * @return a new array of decoded values
	 * @throws ChannelDecodeException if the file is missing, too short or cannot be read
	 */
	public static ChannelArray decodeChannel(Path path, int width, int height, double scale, double offset, SampleType sampleType) throws ChannelDecodeException {
		if (width <= 0 || height <= 0)
			throw new ChannelDecodeException("Invalid channel dimensions " + width + "x" + height + " for " + path);
		long nPixels = (long)width * height;
		long fileSize = getFileSize(path);
		SampleType type = sampleType == null ? inferSampleType(fileSize, nPixels) : sampleType;
		long nBytes = nPixels * type.getBytesPerSample();
		if (fileSize < nBytes)
			throw new ChannelDecodeException(String.format("%s is too short: %d bytes, but %d %s samples need %d", path.getFileName(), fileSize, nPixels, type, nBytes));
		if (nBytes > Integer.MAX_VALUE)
			throw new ChannelDecodeException("Channel too large to decode: " + path);

		logger.debug("Decoding {} as {} ({}x{})", path, type, width, height);
		ByteBuffer buffer = ByteBuffer.allocate((int)nBytes).order(ByteOrder.LITTLE_ENDIAN);
		try (var channel = FileChannel.open(path, StandardOpenOption.READ)) {
			while (buffer.hasRemaining()) {
				if (channel.read(buffer) < 0)
					throw new ChannelDecodeException("Unexpected end of file in " + path);
			}
		} catch (ChannelDecodeException e) {
			throw e;
		} catch (IOException e) {
			throw new ChannelDecodeException("Unable to read " + path, e);
		}

		int n = (int)nPixels;
		int bytesPerSample = type.getBytesPerSample();
		double[] values = new double[n];
		for (int i = 0; i < n; i++)
			values[i] = type.read(buffer, i * bytesPerSample) * scale + offset;
		return ChannelArray.wrap(values, width, height);
	}

	/**
	 * Read a small number of evenly spaced samples from a channel file without decoding all of it.
	 *
	 * @param path path to the binary file
	 * @param count maximum number of samples to read
	 * @param width number of pixels along x
	 * @param height number of pixels along y
	 * @param scale multiplicative factor
	 * @param offset additive offset
	 * @param sampleType declared sample type, or null to infer it from the file size
	 * @return the transformed samples (fewer than {@code count} if the channel is smaller)
	 * @throws ChannelDecodeException if the file is missing, too short or cannot be read
	 */
	public static double[] sampleValues(Path path, int count, int width, int height, double scale, double offset, SampleType sampleType) throws ChannelDecodeException {
		if (count <= 0)
			return new double[0];
		long nPixels = (long)Math.max(1, width) * Math.max(1, height);
		long fileSize = getFileSize(path);
		SampleType type = sampleType == null ? inferSampleType(fileSize, nPixels) : sampleType;
		int bytesPerSample = type.getBytesPerSample();
		long total = Math.min(nPixels, fileSize / bytesPerSample);
		if (total <= 0)
			throw new ChannelDecodeException("No samples in " + path);
		int n = (int)Math.min(count, total);
		double[] values = new double[n];
		ByteBuffer buffer = ByteBuffer.allocate(bytesPerSample).order(ByteOrder.LITTLE_ENDIAN);
		try (var channel = FileChannel.open(path, StandardOpenOption.READ)) {
			for (int i = 0; i < n; i++) {
				long index = n == 1 ? 0 : Math.round(i * (total - 1) / (double)(n - 1));
				buffer.clear();
				long position = index * bytesPerSample;
				while (buffer.hasRemaining()) {
					int read = channel.read(buffer, position + buffer.position());
					if (read < 0)
						throw new ChannelDecodeException("Unexpected end of file in " + path);
				}
				values[i] = type.read(buffer, 0) * scale + offset;
			}
		} catch (ChannelDecodeException e) {
			throw e;
		} catch (IOException e) {
			throw new ChannelDecodeException("Unable to sample " + path, e);
		}
		return values;
	}

	private static long getFileSize(Path path) throws ChannelDecodeException {
		try {
			return Files.size(path);
		} catch (NoSuchFileException e) {
			throw new ChannelDecodeException("Channel file not found: " + path, e);
		} catch (IOException e) {
			throw new ChannelDecodeException("Unable to access " + path, e);
		}
	}

}
