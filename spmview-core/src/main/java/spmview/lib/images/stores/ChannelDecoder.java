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

import spmview.lib.images.ChannelArray;
import spmview.lib.images.metadata.ScanFile;
import spmview.lib.io.BinaryChannelReader;
import spmview.lib.io.ChannelDecodeException;

/**
 * Decodes the values of a channel identified by a {@link RawChannelKey}.
 */
@FunctionalInterface
public interface ChannelDecoder {

	/**
	 * Decode a channel.
	 * @param key
	 * @return the decoded values
	 * @throws ChannelDecodeException if the channel cannot be decoded
	 */
	ChannelArray decode(RawChannelKey key) throws ChannelDecodeException;

	/**
	 * Create a decoder that reads a channel of a scan with a {@link BinaryChannelReader},
	 * using the dimensions from the header and the transform and sample type from the channel descriptor.
	 * @param file
	 * @param channelIndex
	 * @return
	 */
	static ChannelDecoder forChannel(ScanFile file, int channelIndex) {
		var channel = file.getChannel(channelIndex);
		var header = file.getHeader();
		return key -> BinaryChannelReader.decodeChannel(
				key.getBinaryPath(),
				header.getPixelWidth(),
				header.getPixelHeight(),
				channel.getScale(),
				channel.getOffset(),
				channel.getSampleType().orElse(null));
	}

}
