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
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import spmview.lib.images.ChannelArray;

/**
 * Result of a render job, delivered to the thread that drains the {@link RenderScheduler}.
 * <p>
 * Each result carries the generation at which its job was submitted. Successful results also carry any
 * arrays the worker had to compute, so that they can be added to the caches on delivery if the result is still current.
 */
public abstract class RenderResult {

	private final RenderRequest request;
	private final RenderedKey key;
	private final long generation;

	private RenderResult(RenderRequest request, RenderedKey key, long generation) {
		this.request = Objects.requireNonNull(request);
		this.key = key;
		this.generation = generation;
	}

	/**
	 * The request that produced this result.
	 * @return
	 */
	public RenderRequest getRequest() {
		return request;
	}

	/**
	 * Header path of the scan.
	 * @return
	 */
	public Path getHeaderPath() {
		return request.getHeaderPath();
	}

	/**
	 * Channel index.
	 * @return
	 */
	public int getChannelIndex() {
		return request.getChannelIndex();
	}

	/**
	 * Key of the rendered image.
	 * @return the key, or empty if the key could not be created
	 */
	public Optional<RenderedKey> getRenderedKey() {
		return Optional.ofNullable(key);
	}

	/**
	 * Generation at which the job was submitted.
	 * @return
	 */
	public long getGeneration() {
		return generation;
	}

	/**
	 * True if the image was created successfully.
	 * @return
	 */
	public abstract boolean isSuccess();

	/**
	 * A successful render.
	 */
	public static final class Success extends RenderResult {

		private final BufferedImage img;
		private final RawChannelKey rawKey;
		private final ChannelArray rawArray;
		private final ProcessedChannelKey processedKey;
		private final ChannelArray processedArray;
		private final ChannelArray thumbnailArray;

		Success(RenderRequest request, RenderedKey key, long generation, BufferedImage img,
				RawChannelKey rawKey, ChannelArray rawArray,
				ProcessedChannelKey processedKey, ChannelArray processedArray,
				ChannelArray thumbnailArray) {
			super(request, Objects.requireNonNull(key), generation);
			this.img = Objects.requireNonNull(img);
			this.rawKey = rawKey;
			this.rawArray = rawArray;
			this.processedKey = processedKey;
			this.processedArray = processedArray;
			this.thumbnailArray = thumbnailArray;
		}

		/**
		 * The rendered image.
		 * @return
		 */
		public BufferedImage getImage() {
			return img;
		}

		/**
		 * Key of the downsampled array.
		 * @return
		 */
		public ThumbnailKey getThumbnailKey() {
			return getRenderedKey().get().getThumbnailKey();
		}

		/**
		 * Raw array decoded by the worker.
		 * @return the array, or empty if it was already cached
		 */
		public Optional<ChannelArray> getComputedRaw() {
			return Optional.ofNullable(rawArray);
		}

		/**
		 * Processed array computed by the worker.
		 * @return the array, or empty if it was already cached
		 */
		public Optional<ChannelArray> getComputedProcessed() {
			return Optional.ofNullable(processedArray);
		}

		/**
		 * Downsampled array computed by the worker.
		 * @return the array, or empty if it was already cached
		 */
		public Optional<ChannelArray> getComputedThumbnail() {
			return Optional.ofNullable(thumbnailArray);
		}

		RawChannelKey getRawKey() {
			return rawKey;
		}

		ProcessedChannelKey getProcessedKey() {
			return processedKey;
		}

		@Override
		public boolean isSuccess() {
			return true;
		}

		@Override
		public String toString() {
			return "Success [" + getRequest() + ", generation=" + getGeneration() + "]";
		}

	}

	/**
	 * A render that failed, e.g. because the binary file is missing or truncated.
	 */
	public static final class Failure extends RenderResult {

		private final String message;

		Failure(RenderRequest request, RenderedKey key, long generation, String message) {
			super(request, key, generation);
			this.message = message == null ? "Unknown error" : message;
		}

		/**
		 * Description of the error.
		 * @return
		 */
		public String getMessage() {
			return message;
		}

		@Override
		public boolean isSuccess() {
			return false;
		}

		@Override
		public String toString() {
			return "Failure [" + getRequest() + ", generation=" + getGeneration() + ": " + message + "]";
		}

	}

}
