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

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The raw output of a {@link HeaderParser}: scan-level key/value pairs, and one key/value map per channel
 * (in channel order).
 */
public final class ParsedHeader {

	private final Map<String, String> header;
	private final List<Map<String, String>> channels;

	/**
	 * Constructor.
	 * @param header scan-level fields
	 * @param channels channel fields, in channel order
	 */
	public ParsedHeader(Map<String, String> header, List<Map<String, String>> channels) {
		this.header = copyWithoutNulls(header);
		var builder = ImmutableList.<Map<String, String>>builder();
		for (var channel : channels)
			builder.add(copyWithoutNulls(channel));
		this.channels = builder.build();
	}

	private static Map<String, String> copyWithoutNulls(Map<String, String> map) {
		var builder = ImmutableMap.<String, String>builder();
		if (map != null) {
			for (var entry : map.entrySet()) {
				if (entry.getKey() != null && entry.getValue() != null)
					builder.put(entry.getKey(), entry.getValue());
			}
		}
		return builder.build();
	}

	/**
	 * Scan-level fields.
	 * @return
	 */
	public Map<String, String> getHeader() {
		return header;
	}

	/**
	 * Channel fields, in channel order.
	 * @return
	 */
	public List<Map<String, String>> getChannels() {
		return channels;
	}

}
