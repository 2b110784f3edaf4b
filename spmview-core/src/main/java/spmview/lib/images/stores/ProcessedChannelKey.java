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

import java.util.Objects;

import spmview.lib.filters.FilterSignature;
import spmview.lib.filters.UnitNormalizer;

/**
 * Identity of a processed channel: the raw channel, the unit it is converted from, and the filters applied.
 */
public final class ProcessedChannelKey {

	private final RawChannelKey rawKey;
	private final String sourceUnit;
	private final String unit;
	private final FilterSignature signature;

	/**
	 * Constructor.
	 * @param rawKey key of the raw channel
	 * @param sourceUnit the unit of the raw values, as given in the header
	 * @param signature signature of the filter pipeline
	 */
	public ProcessedChannelKey(RawChannelKey rawKey, String sourceUnit, FilterSignature signature) {
		this.rawKey = Objects.requireNonNull(rawKey);
		this.sourceUnit = sourceUnit == null ? "" : sourceUnit.trim();
		this.unit = UnitNormalizer.normalizeUnit(this.sourceUnit);
		this.signature = Objects.requireNonNull(signature);
	}

	/**
	 * Key of the raw channel.
	 * @return
	 */
	public RawChannelKey getRawKey() {
		return rawKey;
	}

	/**
	 * Unit of the raw values.
	 * @return
	 */
	public String getSourceUnit() {
		return sourceUnit;
	}

	/**
	 * Unit of the processed values.
	 * @return
	 */
	public String getUnit() {
		return unit;
	}

	/**
	 * Signature of the filter pipeline.
	 * @return
	 */
	public FilterSignature getSignature() {
		return signature;
	}

	@Override
	public String toString() {
		return "ProcessedChannelKey [" + rawKey + ", unit=" + unit + ", filters=" + signature + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(rawKey, sourceUnit, signature);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ProcessedChannelKey))
			return false;
		var other = (ProcessedChannelKey)obj;
		return rawKey.equals(other.rawKey) && sourceUnit.equals(other.sourceUnit) && signature.equals(other.signature);
	}

}
