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

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * A parsed header file, together with the descriptors of the channels it references.
 * Instances are immutable and replaced wholesale when a folder is reloaded.
 */
public final class ScanFile {

	private final Path headerPath;
	private final ScanHeader header;
	private final List<ChannelDescriptor> channels;

	/**
	 * Constructor.
	 * @param headerPath path to the header file; this is the identity of the scan throughout the caches
	 * @param header
	 * @param channels channel descriptors, in index order
	 */
	public ScanFile(Path headerPath, ScanHeader header, List<ChannelDescriptor> channels) {
		this.headerPath = Objects.requireNonNull(headerPath).toAbsolutePath().normalize();
		this.header = Objects.requireNonNull(header);
		this.channels = ImmutableList.copyOf(channels);
	}

	/**
	 * Path to the header file.
	 * @return
	 */
	public Path getHeaderPath() {
		return headerPath;
	}

	/**
	 * Parsed header.
	 * @return
	 */
	public ScanHeader getHeader() {
		return header;
	}

	/**
	 * All channel descriptors, in index order.
	 * @return an immutable list
	 */
	public List<ChannelDescriptor> getChannels() {
		return channels;
	}

	/**
	 * Number of channels.
	 * @return
	 */
	public int nChannels() {
		return channels.size();
	}

	/**
	 * Get a channel descriptor.
	 * @param index
	 * @return
	 * @throws IndexOutOfBoundsException if there is no channel with the specified index
	 */
	public ChannelDescriptor getChannel(int index) {
		if (index < 0 || index >= channels.size())
			throw new IndexOutOfBoundsException("Channel " + index + " requested, but " + headerPath.getFileName() + " has " + channels.size() + " channel(s)");
		return channels.get(index);
	}

	/**
	 * Resolve the binary file of a channel against the header's folder.
	 * @param index
	 * @return
	 * @throws IllegalStateException if the channel has no file name
	 */
	public Path getBinaryPath(int index) {
		var channel = getChannel(index);
		if (channel.getFileName().isEmpty())
			throw new IllegalStateException("Missing file name for channel " + channel);
		Path parent = headerPath.getParent();
		Path resolved = parent == null ? Path.of(channel.getFileName()) : parent.resolve(channel.getFileName());
		return resolved.toAbsolutePath().normalize();
	}

	@Override
	public String toString() {
		return headerPath.getFileName() + " (" + channels.size() + " channels)";
	}

}
