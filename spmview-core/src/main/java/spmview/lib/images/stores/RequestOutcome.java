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

import java.awt.image.BufferedImage;
import java.util.Objects;
import java.util.Optional;

/**
 * Immediate outcome of a {@link RenderRequest}: either the image was already cached,
 * or it is pending and will be delivered later through the {@link RenderScheduler}.
 */
public abstract class RequestOutcome {

	private final RenderedKey key;
	private final long generation;

	private RequestOutcome(RenderedKey key, long generation) {
		this.key = key;
		this.generation = generation;
	}

	static RequestOutcome hit(BufferedImage img, RenderedKey key, long generation) {
		return new Hit(img, key, generation);
	}

	static RequestOutcome pending(RenderedKey key, long generation) {
		return new Pending(key, generation);
	}

	/**
	 * Key of the requested image.
	 * @return the key, or empty if the channel's binary file could not be identified
	 *         (in which case a failure will be delivered)
	 */
	public Optional<RenderedKey> getRenderedKey() {
		return Optional.ofNullable(key);
	}

	/**
	 * Generation at the time of the request.
	 * @return
	 */
	public long getGeneration() {
		return generation;
	}

	/**
	 * True if the image is immediately available.
	 * @return
	 */
	public abstract boolean isHit();

	/**
	 * The image was found in the cache.
	 */
	public static final class Hit extends RequestOutcome {

		private final BufferedImage img;

		private Hit(BufferedImage img, RenderedKey key, long generation) {
			super(Objects.requireNonNull(key), generation);
			this.img = Objects.requireNonNull(img);
		}

		/**
		 * The cached image.
		 * @return
		 */
		public BufferedImage getImage() {
			return img;
		}

		@Override
		public boolean isHit() {
			return true;
		}

		@Override
		public String toString() {
			return "Hit [" + getRenderedKey().orElse(null) + "]";
		}

	}

	/**
	 * The image is being computed, and will be delivered later.
	 */
	public static final class Pending extends RequestOutcome {

		private Pending(RenderedKey key, long generation) {
			super(key, generation);
		}

		@Override
		public boolean isHit() {
			return false;
		}

		@Override
		public String toString() {
			return "Pending [" + getRenderedKey().orElse(null) + ", generation=" + getGeneration() + "]";
		}

	}

}
