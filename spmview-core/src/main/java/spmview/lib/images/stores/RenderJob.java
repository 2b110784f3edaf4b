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
import java.util.concurrent.Callable;
import java.util.concurrent.FutureTask;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import spmview.lib.color.ChannelRenderer;
import spmview.lib.images.ChannelArray;
import spmview.lib.io.ChannelDecodeException;

/**
 * Worker that decodes, processes, downsamples and renders one channel.
 * <p>
 * The job only reads from the caches. Arrays it computes are returned within its {@link RenderResult},
 * and only added to the caches if the result is still current when it is delivered.
 * Failures are returned as {@link RenderResult.Failure} rather than thrown.
 */
class RenderJob extends FutureTask<RenderResult> {

	private static final Logger logger = LoggerFactory.getLogger(RenderJob.class);

	private final RenderRequest request;
	private final RenderedKey key;
	private final long generation;
	private final Consumer<RenderJob> onComplete;

	RenderJob(RenderRequest request, RenderedKey key, long generation, ChannelCaches caches, Consumer<RenderJob> onComplete) {
		super(new RenderCallable(request, key, generation, caches));
		this.request = request;
		this.key = key;
		this.generation = generation;
		this.onComplete = onComplete;
	}

	RenderRequest getRequest() {
		return request;
	}

	RenderedKey getRenderedKey() {
		return key;
	}

	long getGeneration() {
		return generation;
	}

	@Override
	protected void done() {
		onComplete.accept(this);
	}

	@Override
	public String toString() {
		return "RenderJob [" + request + ", generation=" + generation + "]";
	}


	private static class RenderCallable implements Callable<RenderResult> {

		private final RenderRequest request;
		private final RenderedKey key;
		private final long generation;
		private final ChannelCaches caches;

		RenderCallable(RenderRequest request, RenderedKey key, long generation, ChannelCaches caches) {
			this.request = request;
			this.key = key;
			this.generation = generation;
			this.caches = caches;
		}

		@Override
		public RenderResult call() {
			try {
				return render();
			} catch (ChannelDecodeException e) {
				logger.warn("Unable to decode {}: {}", key.getThumbnailKey().getRawKey(), e.getLocalizedMessage());
				return new RenderResult.Failure(request, key, generation, e.getLocalizedMessage());
			} catch (RuntimeException e) {
				logger.error("Error rendering " + request + ": " + e.getLocalizedMessage(), e);
				return new RenderResult.Failure(request, key, generation, e.getLocalizedMessage());
			}
		}

		private RenderResult render() throws ChannelDecodeException {
			var thumbnailKey = key.getThumbnailKey();
			var rawKey = thumbnailKey.getRawKey();
			var file = request.getFile();
			var channel = file.getChannel(request.getChannelIndex());
			var processedKey = new ProcessedChannelKey(rawKey, channel.getUnit(), request.getPipeline().getSignature());

			ChannelArray computedRaw = null;
			ChannelArray computedProcessed = null;
			ChannelArray computedThumbnail = null;

			var thumbnail = caches.getThumbnailStore().getIfPresent(thumbnailKey).orElse(null);
			if (thumbnail == null) {
				var processed = caches.getProcessedStore().getIfPresent(processedKey).orElse(null);
				if (processed == null) {
					var raw = caches.getRawStore().getIfPresent(rawKey).orElse(null);
					if (raw == null) {
						raw = ChannelDecoder.forChannel(file, request.getChannelIndex()).decode(rawKey);
						computedRaw = raw;
					}
					processed = ProcessedChannelStore.process(processedKey, raw, request.getPipeline());
					computedProcessed = processed;
				}
				thumbnail = ThumbnailStore.downsample(processed, thumbnailKey.getWidth(), thumbnailKey.getHeight());
				computedThumbnail = thumbnail;
			}
			BufferedImage img = ChannelRenderer.render(thumbnail, key.getColorMapName());
			return new RenderResult.Success(request, key, generation, img,
					rawKey, computedRaw, processedKey, computedProcessed, computedThumbnail);
		}

	}

}
