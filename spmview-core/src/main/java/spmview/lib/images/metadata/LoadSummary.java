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

/**
 * Outcome of loading a folder of headers.
 */
public final class LoadSummary {

	private final int nLoaded;
	private final int nFailed;
	private final int nCacheHits;
	private final int nCacheMisses;

	LoadSummary(int nLoaded, int nFailed, int nCacheHits, int nCacheMisses) {
		this.nLoaded = nLoaded;
		this.nFailed = nFailed;
		this.nCacheHits = nCacheHits;
		this.nCacheMisses = nCacheMisses;
	}

	/**
	 * Number of headers that were loaded successfully.
	 * @return
	 */
	public int getLoadedCount() {
		return nLoaded;
	}

	/**
	 * Number of headers that could not be parsed and were skipped.
	 * @return
	 */
	public int getFailedCount() {
		return nFailed;
	}

	/**
	 * Number of headers read from the metadata cache.
	 * @return
	 */
	public int getCacheHits() {
		return nCacheHits;
	}

	/**
	 * Number of headers that had to be parsed.
	 * @return
	 */
	public int getCacheMisses() {
		return nCacheMisses;
	}

	@Override
	public String toString() {
		return String.format("LoadSummary [loaded=%d, failed=%d, hits=%d, misses=%d]", nLoaded, nFailed, nCacheHits, nCacheMisses);
	}

}
