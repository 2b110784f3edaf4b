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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonically increasing counter marking the state of the viewer.
 * <p>
 * The counter is advanced whenever a change makes pending render results obsolete (e.g. a folder is loaded,
 * or filters change). Render jobs record the value when they are submitted; results carrying an older value
 * are discarded on delivery.
 */
public class GenerationCounter {

	private final AtomicLong generation = new AtomicLong(0L);

	/**
	 * Get the current generation.
	 * @return
	 */
	public long get() {
		return generation.get();
	}

	/**
	 * Advance to the next generation.
	 * @return the new generation
	 */
	public long advance() {
		return generation.incrementAndGet();
	}

	/**
	 * Query whether a generation is the current one.
	 * @param value
	 * @return
	 */
	public boolean isCurrent(long value) {
		return generation.get() == value;
	}

	@Override
	public String toString() {
		return "Generation " + generation.get();
	}

}
