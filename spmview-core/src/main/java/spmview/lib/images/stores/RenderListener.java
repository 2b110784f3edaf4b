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

/**
 * Listener notified when render results are delivered by a {@link RenderScheduler}.
 * <p>
 * Listeners are called on the thread that drains the scheduler, and only for results that are still current.
 */
public interface RenderListener {

	/**
	 * A requested image is available.
	 * @param result
	 */
	public void renderAvailable(RenderResult.Success result);

	/**
	 * A requested image could not be created.
	 * @param result
	 */
	public default void renderFailed(RenderResult.Failure result) {}

}
