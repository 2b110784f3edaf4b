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

package spmview.lib.images.stores;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import spmview.lib.images.metadata.ScanFile;
import spmview.lib.io.ChannelDecodeException;

/**
 * Identity of a decoded channel: the scan it belongs to, its binary file and the version of that file.
 * <p>
 * The version is given by the modification time and size of the binary file, so that a file rewritten
 * in place gives a different key even if its path is unchanged.
 */
public final class RawChannelKey {

	private static final Logger logger = LoggerFactory.getLogger(RawChannelKey.class);

	/**
	 * Version used when the binary file cannot be accessed.
	 */
	static final long UNKNOWN = -1L;

	private final Path headerPath;
	private final Path binaryPath;
	private final int channelIndex;
	private final long lastModified;
	private final long fileSize;

	private final int hash;

	/**
	 * Constructor.
	 * @param headerPath path to the header file
	 * @param binaryPath path to the binary channel file
	 * @param channelIndex channel index within the header
	 * @param lastModified modification time of the binary file, in milliseconds
	 * @param fileSize size of the binary file, in bytes
	 */
	public RawChannelKey(Path headerPath, Path binaryPath, int channelIndex, long lastModified, long fileSize) {
		this.headerPath = headerPath.toAbsolutePath().normalize();
		this.binaryPath = binaryPath.toAbsolutePath().normalize();
		this.channelIndex = channelIndex;
		this.lastModified = lastModified;
		this.fileSize = fileSize;
		this.hash = Objects.hash(this.headerPath, this.binaryPath, channelIndex, lastModified, fileSize);
	}

	/**
	 * Create a key for the current version of a channel's binary file.
	 * If the file cannot be accessed, the key is still created (with an unknown version) so that the failure
	 * is reported when the channel is decoded.
	 *
	 * @param file
	 * @param channelIndex
	 * @return
	 * @throws ChannelDecodeException if the channel does not reference a binary file
	 * @throws IndexOutOfBoundsException if the channel index is invalid
	 */
	public static RawChannelKey forChannel(ScanFile file, int channelIndex) throws ChannelDecodeException {
		Path binaryPath;
		try {
			binaryPath = file.getBinaryPath(channelIndex);
		} catch (IllegalStateException e) {
			throw new ChannelDecodeException(e.getLocalizedMessage(), e);
		}
		long lastModified = UNKNOWN;
		long size = UNKNOWN;
		try {
			var attributes = Files.readAttributes(binaryPath, BasicFileAttributes.class);
			lastModified = attributes.lastModifiedTime().toMillis();
			size = attributes.size();
		} catch (IOException e) {
			logger.debug("Unable to read attributes of {}: {}", binaryPath, e.getLocalizedMessage());
		}
		return new RawChannelKey(file.getHeaderPath(), binaryPath, channelIndex, lastModified, size);
	}

	/**
	 * Query whether another key refers to the same channel, regardless of version.
	 * @param other
	 * @return
	 */
	public boolean isSameChannel(RawChannelKey other) {
		return other != null && channelIndex == other.channelIndex
				&& headerPath.equals(other.headerPath) && binaryPath.equals(other.binaryPath);
	}

	/**
	 * Query whether this key refers to the same channel as another key, but a more recently modified file.
	 * @param other
	 * @return
	 */
	public boolean isNewerVersionOf(RawChannelKey other) {
		return isSameChannel(other) && lastModified > other.lastModified;
	}

	/**
	 * Path to the header.
	 * @return
	 */
	public Path getHeaderPath() {
		return headerPath;
	}

	/**
	 * Path to the binary file.
	 * @return
	 */
	public Path getBinaryPath() {
		return binaryPath;
	}

	/**
	 * Channel index within the header.
	 * @return
	 */
	public int getChannelIndex() {
		return channelIndex;
	}

	/**
	 * Modification time of the binary file in milliseconds, or -1 if unknown.
	 * @return
	 */
	public long getLastModified() {
		return lastModified;
	}

	/**
	 * Size of the binary file in bytes, or -1 if unknown.
	 * @return
	 */
	public long getFileSize() {
		return fileSize;
	}

	@Override
	public String toString() {
		return "RawChannelKey [" + headerPath.getFileName() + ", channel=" + channelIndex + ", modified=" + lastModified + ", size=" + fileSize + "]";
	}

	@Override
	public int hashCode() {
		return hash;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof RawChannelKey))
			return false;
		var other = (RawChannelKey)obj;
		return hash == other.hash && lastModified == other.lastModified && fileSize == other.fileSize && isSameChannel(other);
	}

}
