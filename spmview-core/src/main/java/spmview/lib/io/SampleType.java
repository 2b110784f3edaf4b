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

import java.nio.ByteBuffer;
import java.util.Locale;
import java.util.Optional;

/**
 * Binary sample types that may be found in raw channel files.
 */
public enum SampleType {

	/**
	 * Signed 16-bit integer.
	 */
	INT16(2),
	/**
	 * Unsigned 16-bit integer.
	 */
	UINT16(2),
	/**
	 * Signed 32-bit integer.
	 */
	INT32(4),
	/**
	 * Unsigned 32-bit integer.
	 */
	UINT32(4),
	/**
	 * Signed 64-bit integer.
	 */
	INT64(8),
	/**
	 * 32-bit floating point.
	 */
	FLOAT32(4),
	/**
	 * 64-bit floating point.
	 */
	FLOAT64(8),
	/**
	 * Unsigned 8-bit integer.
	 */
	UINT8(1);

	private final int bytesPerSample;

	SampleType(int bytesPerSample) {
		this.bytesPerSample = bytesPerSample;
	}

	/**
	 * Number of bytes needed to store one sample.
	 * @return
	 */
	public int getBytesPerSample() {
		return bytesPerSample;
	}

	/**
	 * Read a single sample at an absolute byte position.
	 * @param buffer buffer with the byte order already set
	 * @param position byte position
	 * @return
	 */
	double read(ByteBuffer buffer, int position) {
		switch (this) {
		case INT16:
			return buffer.getShort(position);
		case UINT16:
			return buffer.getShort(position) & 0xffff;
		case INT32:
			return buffer.getInt(position);
		case UINT32:
			return buffer.getInt(position) & 0xffffffffL;
		case INT64:
			return buffer.getLong(position);
		case FLOAT32:
			return buffer.getFloat(position);
		case FLOAT64:
			return buffer.getDouble(position);
		case UINT8:
			return buffer.get(position) & 0xff;
		default:
			throw new IllegalArgumentException("Unsupported sample type " + this);
		}
	}

	/**
	 * Look up a sample type from a name written in a header, e.g. "int16", "float", "double".
	 * @param name
	 * @return the sample type, or empty if the name is null or not recognized
	 */
	public static Optional<SampleType> fromName(String name) {
		if (name == null)
			return Optional.empty();
		switch (name.trim().toLowerCase(Locale.ROOT)) {
		case "int16": case "short": case "i2":
			return Optional.of(INT16);
		case "uint16": case "ushort": case "u2":
			return Optional.of(UINT16);
		case "int32": case "int": case "i4":
			return Optional.of(INT32);
		case "uint32": case "uint": case "u4":
			return Optional.of(UINT32);
		case "int64": case "long": case "i8":
			return Optional.of(INT64);
		case "float32": case "float": case "f4":
			return Optional.of(FLOAT32);
		case "float64": case "double": case "f8":
			return Optional.of(FLOAT64);
		case "uint8": case "byte": case "u1":
			return Optional.of(UINT8);
		default:
			return Optional.empty();
		}
	}

}
