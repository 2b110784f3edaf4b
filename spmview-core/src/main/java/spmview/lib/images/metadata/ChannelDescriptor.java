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

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import spmview.lib.common.GeneralTools;
import spmview.lib.io.SampleType;

/**
 * Description of one channel recorded with a scan: its label, the binary file holding its samples,
 * the physical unit and the linear transform {@code value = raw * scale + offset}.
 */
public final class ChannelDescriptor {

	static final String KEY_CAPTION = "Caption";
	static final String KEY_FILE_NAME = "FileName";
	static final String KEY_UNIT = "PhysUnit";
	static final String KEY_SCALE = "Scale";
	static final String KEY_OFFSET = "Offset";
	static final String KEY_DATA_TYPE = "DataType";

	private final int index;
	private final String caption;
	private final String fileName;
	private final String unit;
	private final double scale;
	private final double offset;
	private final SampleType sampleType;

	/**
	 * Constructor.
	 * @param index ordinal index of the channel within its header
	 * @param caption label; if blank, the file name (or "chan&lt;index&gt;") is used instead
	 * @param fileName binary file name, relative to the header's folder
	 * @param unit physical unit (may be empty)
	 * @param scale
	 * @param offset
	 * @param sampleType declared sample type, or null if it should be inferred from the file size
	 */
	public ChannelDescriptor(int index, String caption, String fileName, String unit, double scale, double offset, SampleType sampleType) {
		if (index < 0)
			throw new IllegalArgumentException("Channel index must be >= 0");
		this.index = index;
		this.fileName = fileName == null ? "" : fileName.trim();
		if (GeneralTools.blankString(caption, true))
			this.caption = this.fileName.isEmpty() ? "chan" + index : this.fileName;
		else
			this.caption = caption.trim();
		this.unit = unit == null ? "" : unit.trim();
		this.scale = scale;
		this.offset = offset;
		this.sampleType = sampleType;
	}

	/**
	 * Create a descriptor from the key/value fields produced by a header parser.
	 * @param index
	 * @param fields
	 * @return
	 */
	public static ChannelDescriptor fromFields(int index, Map<String, String> fields) {
		Double scale = GeneralTools.parseDouble(fields.get(KEY_SCALE));
		Double offset = GeneralTools.parseDouble(fields.get(KEY_OFFSET));
		return new ChannelDescriptor(index,
				fields.get(KEY_CAPTION),
				fields.get(KEY_FILE_NAME),
				fields.get(KEY_UNIT),
				scale == null ? 1.0 : scale,
				offset == null ? 0.0 : offset,
				SampleType.fromName(fields.get(KEY_DATA_TYPE)).orElse(null));
	}

	/**
	 * Ordinal index within the header.
	 * @return
	 */
	public int getIndex() {
		return index;
	}

	/**
	 * Display label.
	 * @return
	 */
	public String getCaption() {
		return caption;
	}

	/**
	 * Binary file name relative to the header's folder (may be empty if the header did not specify one).
	 * @return
	 */
	public String getFileName() {
		return fileName;
	}

	/**
	 * Physical unit, as written in the header.
	 * @return
	 */
	public String getUnit() {
		return unit;
	}

	/**
	 * Multiplicative decode factor.
	 * @return
	 */
	public double getScale() {
		return scale;
	}

	/**
	 * Additive decode offset.
	 * @return
	 */
	public double getOffset() {
		return offset;
	}

	/**
	 * Sample type declared in the header, if any.
	 * @return
	 */
	public Optional<SampleType> getSampleType() {
		return Optional.ofNullable(sampleType);
	}

	@Override
	public String toString() {
		return index + ": " + caption;
	}

	@Override
	public int hashCode() {
		return Objects.hash(index, caption, fileName, unit, scale, offset, sampleType);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ChannelDescriptor))
			return false;
		ChannelDescriptor other = (ChannelDescriptor) obj;
		return index == other.index && Objects.equals(caption, other.caption)
				&& Objects.equals(fileName, other.fileName) && Objects.equals(unit, other.unit)
				&& Double.compare(scale, other.scale) == 0 && Double.compare(offset, other.offset) == 0
				&& sampleType == other.sampleType;
	}

}
