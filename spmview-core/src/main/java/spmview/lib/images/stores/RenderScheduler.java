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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import spmview.lib.common.ThreadTools;
import spmview.lib.images.ChannelArray;
import spmview.lib.images.metadata.ScanFile;
import spmview.lib.io.ChannelDecodeException;

/**
 * Creates channel thumbnails on a pool of worker threads, and delivers them back to a single coordinating thread.
 * <p>
 * {@link #request(RenderRequest)} returns immediately, either with a cached image or with a pending outcome.
 * Pending images are computed by workers and placed on a delivery queue; the coordinating thread drains this queue
 * with {@link #processCompletions()} (or {@link #awaitCompletions(long, TimeUnit)}), which adds the new arrays and images
 * to the caches and notifies {@link RenderListener}s.
 * <p>
 * Every job records the {@link GenerationCounter} value when it is submitted. Results from an older generation
 * are discarded on delivery without touching the caches or listeners; there is no other cancellation.
 */
public class RenderScheduler implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(RenderScheduler.class);

	private final ChannelCaches caches;
	private final GenerationCounter generation;
	private final String defaultColorMapName;

	private final ExecutorService pool;

	private final BlockingQueue<RenderResult> deliveryQueue = new LinkedBlockingQueue<>();
	private final Map<InFlightKey, RenderJob> waitingMap = Collections.synchronizedMap(new HashMap<>());

	private final List<RenderListener> listeners = Collections.synchronizedList(new ArrayList<>());

	private final AtomicLong nDiscarded = new AtomicLong(0L);
	private final AtomicLong nSubmitted = new AtomicLong(0L);

	/**
	 * Constructor.
	 * @param caches caches to read from, and to update with delivered results
	 * @param generation the counter used to identify stale results
	 * @param settings settings providing the number of workers and the default colormap
	 */
	public RenderScheduler(ChannelCaches caches, GenerationCounter generation, CacheSettings settings) {
		this.caches = Objects.requireNonNull(caches);
		this.generation = Objects.requireNonNull(generation);
		this.defaultColorMapName = settings.getColorMapName();
		this.pool = Executors.newFixedThreadPool(settings.getWorkerCount(), ThreadTools.createThreadFactory("render-worker-", true));
		logger.debug("Render scheduler created with {} worker(s)", settings.getWorkerCount());
	}

	/**
	 * Add a listener to be notified of delivered results.
	 * @param listener
	 */
	public void addRenderListener(RenderListener listener) {
		listeners.add(listener);
	}

	/**
	 * Remove a listener.
	 * @param listener
	 */
	public void removeRenderListener(RenderListener listener) {
		listeners.remove(listener);
	}

	/**
	 * Create the key identifying the image for a request, using the current version of the channel's binary file.
	 * @param request
	 * @return
	 * @throws ChannelDecodeException if the channel does not reference a binary file
	 */
	public RenderedKey createRenderedKey(RenderRequest request) throws ChannelDecodeException {
		var rawKey = RawChannelKey.forChannel(request.getFile(), request.getChannelIndex());
		var thumbnailKey = new ThumbnailKey(rawKey, request.getPipeline().getSignature(), request.getWidth(), request.getHeight());
		return new RenderedKey(thumbnailKey, resolveColorMapName(request));
	}

	private String resolveColorMapName(RenderRequest request) {
		var name = request.getColorMapName();
		return name == null || name.isBlank() ? defaultColorMapName : name;
	}

	/**
	 * Request an image.
	 * <p>
	 * If the image is cached it is returned immediately. Otherwise a job is submitted (unless one is already
	 * running for the same image and generation) and the result will be delivered by a later call to
	 * {@link #processCompletions()}.
	 *
	 * @param request
	 * @return
	 */
	public RequestOutcome request(RenderRequest request) {
		long current = generation.get();
		RenderedKey key;
		try {
			key = createRenderedKey(request);
		} catch (ChannelDecodeException e) {
			logger.warn("Unable to request {}: {}", request, e.getLocalizedMessage());
			deliveryQueue.offer(new RenderResult.Failure(request, null, current, e.getLocalizedMessage()));
			return RequestOutcome.pending(null, current);
		}

		var img = caches.getThumbnailStore().getRenderedIfPresent(key).orElse(null);
		if (img != null)
			return RequestOutcome.hit(img, key, current);

		var inFlight = new InFlightKey(key, current);
		synchronized (waitingMap) {
			if (waitingMap.containsKey(inFlight)) {
				logger.trace("Request already pending for {}", key);
				return RequestOutcome.pending(key, current);
			}
			var job = new RenderJob(request, key, current, caches, this::workerComplete);
			waitingMap.put(inFlight, job);
			try {
				pool.execute(job);
				nSubmitted.incrementAndGet();
			} catch (RejectedExecutionException e) {
				waitingMap.remove(inFlight);
				throw new IllegalStateException("Render scheduler has been closed", e);
			}
		}
		return RequestOutcome.pending(key, current);
	}

	/**
	 * Create an image synchronously on the calling thread, reading from and updating the caches directly.
	 * @param request
	 * @return
	 * @throws ChannelDecodeException if the channel cannot be decoded
	 */
	public BufferedImage renderNow(RenderRequest request) throws ChannelDecodeException {
		var key = createRenderedKey(request);
		var thumbnailStore = caches.getThumbnailStore();
		var img = thumbnailStore.getRenderedIfPresent(key).orElse(null);
		if (img != null)
			return img;
		var thumbnailKey = key.getThumbnailKey();
		var thumbnail = thumbnailStore.getIfPresent(thumbnailKey).orElse(null);
		if (thumbnail == null)
			thumbnail = thumbnailStore.getOrDownsample(thumbnailKey, processNow(request), request.getWidth(), request.getHeight());
		return thumbnailStore.getOrRender(key, thumbnail);
	}

	/**
	 * Get the full-resolution processed array of a request synchronously on the calling thread,
	 * reading from and updating the raw and processed caches directly.
	 * The width, height and colormap of the request are ignored.
	 * @param request
	 * @return
	 * @throws ChannelDecodeException if the channel cannot be decoded
	 */
	public ChannelArray processNow(RenderRequest request) throws ChannelDecodeException {
		ScanFile file = request.getFile();
		int channelIndex = request.getChannelIndex();
		var rawKey = RawChannelKey.forChannel(file, channelIndex);
		var raw = caches.getRawStore().getOrDecode(rawKey, ChannelDecoder.forChannel(file, channelIndex));
		var processedKey = new ProcessedChannelKey(rawKey, file.getChannel(channelIndex).getUnit(), request.getPipeline().getSignature());
		return caches.getProcessedStore().getOrProcess(processedKey, raw, request.getPipeline());
	}

	/**
	 * Called by each job when it completes.
	 * @param job
	 */
	void workerComplete(RenderJob job) {
		if (job.isCancelled())
			return;
		RenderResult result;
		try {
			result = job.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			result = new RenderResult.Failure(job.getRequest(), job.getRenderedKey(), job.getGeneration(), "Interrupted");
		} catch (ExecutionException | CancellationException e) {
			logger.warn("Render job failed: {}", e.getLocalizedMessage());
			result = new RenderResult.Failure(job.getRequest(), job.getRenderedKey(), job.getGeneration(), e.getLocalizedMessage());
		}
		deliveryQueue.offer(result);
	}

	/**
	 * Deliver all completed results, without waiting.
	 * This should be called on the coordinating thread.
	 * @return the number of current results delivered (stale results are not counted)
	 */
	public int processCompletions() {
		List<RenderResult> results = new ArrayList<>();
		deliveryQueue.drainTo(results);
		return deliver(results);
	}

	/**
	 * Wait for at least one result to complete, then deliver all completed results.
	 * @param timeout maximum time to wait for the first result
	 * @param unit
	 * @return the number of current results delivered (stale results are not counted)
	 * @throws InterruptedException if interrupted while waiting
	 */
	public int awaitCompletions(long timeout, TimeUnit unit) throws InterruptedException {
		var first = deliveryQueue.poll(timeout, unit);
		if (first == null)
			return 0;
		List<RenderResult> results = new ArrayList<>();
		results.add(first);
		deliveryQueue.drainTo(results);
		return deliver(results);
	}

	private int deliver(List<RenderResult> results) {
		int n = 0;
		for (var result : results) {
			result.getRenderedKey().ifPresent(key -> waitingMap.remove(new InFlightKey(key, result.getGeneration())));
			if (!generation.isCurrent(result.getGeneration())) {
				nDiscarded.incrementAndGet();
				logger.debug("Discarding stale result {} (current generation {})", result, generation.get());
				continue;
			}
			if (result instanceof RenderResult.Success) {
				var success = (RenderResult.Success)result;
				commit(success);
				for (var listener : snapshotListeners())
					listener.renderAvailable(success);
			} else {
				var failure = (RenderResult.Failure)result;
				for (var listener : snapshotListeners())
					listener.renderFailed(failure);
			}
			n++;
		}
		return n;
	}

	private void commit(RenderResult.Success result) {
		result.getComputedRaw().ifPresent(a -> caches.getRawStore().put(result.getRawKey(), a));
		result.getComputedProcessed().ifPresent(a -> caches.getProcessedStore().put(result.getProcessedKey(), a));
		result.getComputedThumbnail().ifPresent(a -> caches.getThumbnailStore().put(result.getThumbnailKey(), a));
		caches.getThumbnailStore().putRendered(result.getRenderedKey().get(), result.getImage());
	}

	private List<RenderListener> snapshotListeners() {
		synchronized (listeners) {
			return new ArrayList<>(listeners);
		}
	}

	/**
	 * Number of jobs submitted and not yet delivered.
	 * @return
	 */
	public int getPendingCount() {
		return waitingMap.size();
	}

	/**
	 * Number of stale results that have been discarded.
	 * @return
	 */
	public long getDiscardedCount() {
		return nDiscarded.get();
	}

	/**
	 * Number of jobs that have been submitted.
	 * @return
	 */
	public long getSubmittedCount() {
		return nSubmitted.get();
	}

	/**
	 * The generation counter used by this scheduler.
	 * @return
	 */
	public GenerationCounter getGenerationCounter() {
		return generation;
	}

	/**
	 * The caches used by this scheduler.
	 * @return
	 */
	public ChannelCaches getCaches() {
		return caches;
	}

	/**
	 * Stop all workers. Results that have not yet been delivered are dropped.
	 */
	@Override
	public void close() {
		pool.shutdownNow();
		waitingMap.clear();
		deliveryQueue.clear();
	}


	private static class InFlightKey {

		private final RenderedKey key;
		private final long generation;

		InFlightKey(RenderedKey key, long generation) {
			this.key = key;
			this.generation = generation;
		}

		@Override
		public int hashCode() {
			return Objects.hash(key, generation);
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj)
				return true;
			if (!(obj instanceof InFlightKey))
				return false;
			var other = (InFlightKey)obj;
			return generation == other.generation && key.equals(other.key);
		}

	}

}
