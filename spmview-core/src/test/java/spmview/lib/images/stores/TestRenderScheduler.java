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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import spmview.lib.images.metadata.ChannelDescriptor;
import spmview.lib.images.metadata.ScanFile;
import spmview.lib.images.metadata.ScanHeader;
import spmview.lib.io.ChannelDecodeException;

@SuppressWarnings("javadoc")
public class TestRenderScheduler {

	private GenerationCounter generation;
	private ChannelCaches caches;
	private RenderScheduler scheduler;
	private RecordingListener listener;

	@BeforeEach
	public void setUp() {
		var settings = CacheSettings.builder().workers(2).colorMap("Gray").build();
		generation = new GenerationCounter();
		caches = new ChannelCaches(settings);
		scheduler = new RenderScheduler(caches, generation, settings);
		listener = new RecordingListener();
		scheduler.addRenderListener(listener);
	}

	@AfterEach
	public void tearDown() {
		scheduler.close();
	}

	/**
	 * Deliver results until nothing is pending, or a timeout is reached.
	 */
	private int drain() throws InterruptedException {
		int n = 0;
		long end = System.currentTimeMillis() + 10_000L;
		while (scheduler.getPendingCount() > 0 && System.currentTimeMillis() < end)
			n += scheduler.awaitCompletions(100, TimeUnit.MILLISECONDS);
		return n;
	}

	@Test
	public void test_deliverThenHit(@TempDir Path dir) throws Exception {
		var scan = ChannelFixtures.createScan(dir, "scan", 4, 4, ChannelFixtures.ramp(16, 0));
		var request = RenderRequest.create(scan, 0, 2, 2);

		var outcome = scheduler.request(request);
		assertFalse(outcome.isHit());
		assertEquals(0L, outcome.getGeneration());
		assertTrue(outcome.getRenderedKey().isPresent());
		assertEquals("Gray", outcome.getRenderedKey().get().getColorMapName());

		assertEquals(1, drain());
		assertEquals(1, listener.successes.size());
		assertTrue(listener.failures.isEmpty());
		var success = listener.successes.get(0);
		assertEquals(2, success.getImage().getWidth());
		assertEquals(2, success.getImage().getHeight());
		assertTrue(success.getComputedRaw().isPresent());

		// Everything computed by the worker is cached on delivery
		assertEquals(1, caches.getRawStore().size());
		assertEquals(1, caches.getProcessedStore().size());
		assertEquals(1, caches.getThumbnailStore().size());
		assertEquals(1, caches.getThumbnailStore().renderedSize());

		var second = scheduler.request(request);
		assertTrue(second.isHit());
		var hit = ((RequestOutcome.Hit)second).getImage();
		assertNotSame(success.getImage(), hit);
		assertEquals(success.getImage().getRGB(1, 1), hit.getRGB(1, 1));
		assertEquals(1L, scheduler.getSubmittedCount());
	}

	@Test
	public void test_drawingOnDeliveredImages(@TempDir Path dir) throws Exception {
		var scan = ChannelFixtures.createScan(dir, "scan", 4, 4, ChannelFixtures.ramp(16, 0));
		var request = RenderRequest.create(scan, 0, 4, 4);
		scheduler.request(request);
		assertEquals(1, drain());
		int original = listener.successes.get(0).getImage().getRGB(0, 0);
		assertEquals(0xff000000, original);

		// Decorate both the delivered image and a cache hit, as a viewer would
		listener.successes.get(0).getImage().setRGB(0, 0, 0xff00ff00);
		var hit = (RequestOutcome.Hit)scheduler.request(request);
		hit.getImage().setRGB(0, 0, 0xff00ff00);

		var again = (RequestOutcome.Hit)scheduler.request(request);
		assertEquals(original, again.getImage().getRGB(0, 0));
		assertEquals(original, scheduler.renderNow(request).getRGB(0, 0));
	}

	@Test
	public void test_reuseCachedRaw(@TempDir Path dir) throws Exception {
		var scan = ChannelFixtures.createScan(dir, "scan", 4, 4, ChannelFixtures.ramp(16, 0));
		scheduler.request(RenderRequest.create(scan, 0, 2, 2));
		drain();

		// A different size reuses the raw and processed arrays
		scheduler.request(RenderRequest.create(scan, 0, 3, 3));
		assertEquals(1, drain());
		var success = listener.successes.get(1);
		assertFalse(success.getComputedRaw().isPresent());
		assertFalse(success.getComputedProcessed().isPresent());
		assertTrue(success.getComputedThumbnail().isPresent());
		assertEquals(2, caches.getThumbnailStore().size());
	}

	@Test
	public void test_staleResultsDiscarded(@TempDir Path dir) throws Exception {
		var scan = ChannelFixtures.createScan(dir, "scan", 4, 4, ChannelFixtures.ramp(16, 0));
		var outcome = scheduler.request(RenderRequest.create(scan, 0, 2, 2));
		assertFalse(outcome.isHit());

		generation.advance();
		assertEquals(0, drain());
		assertEquals(0, scheduler.getPendingCount());
		assertEquals(1L, scheduler.getDiscardedCount());
		assertTrue(listener.successes.isEmpty());
		assertTrue(listener.failures.isEmpty());

		// Stale results never reach the caches
		assertEquals(0, caches.getRawStore().size());
		assertEquals(0, caches.getProcessedStore().size());
		assertEquals(0, caches.getThumbnailStore().size());
		assertEquals(0, caches.getThumbnailStore().renderedSize());
	}

	@Test
	public void test_duplicateRequests(@TempDir Path dir) throws Exception {
		var scan = ChannelFixtures.createScan(dir, "scan", 4, 4, ChannelFixtures.ramp(16, 0));
		var request = RenderRequest.create(scan, 0, 2, 2);
		var first = scheduler.request(request);
		var second = scheduler.request(request);
		assertFalse(second.isHit());
		assertEquals(first.getRenderedKey(), second.getRenderedKey());
		assertEquals(1L, scheduler.getSubmittedCount());

		assertEquals(1, drain());
		assertEquals(1, listener.successes.size());

		// After a generation change, the same image is requested again
		generation.advance();
		caches.invalidate(InvalidationScope.all());
		var third = scheduler.request(request);
		assertEquals(1L, third.getGeneration());
		assertEquals(2L, scheduler.getSubmittedCount());
		assertEquals(1, drain());
	}

	@Test
	public void test_missingBinaryFile(@TempDir Path dir) throws Exception {
		var scan = ChannelFixtures.createScan(dir, "scan", 4, 4, ChannelFixtures.ramp(16, 0));
		Files.delete(scan.getBinaryPath(0));

		var outcome = scheduler.request(RenderRequest.create(scan, 0, 2, 2));
		assertFalse(outcome.isHit());
		assertEquals(1, drain());
		assertTrue(listener.successes.isEmpty());
		assertEquals(1, listener.failures.size());
		var failure = listener.failures.get(0);
		assertEquals(scan.getHeaderPath(), failure.getHeaderPath());
		assertTrue(failure.getRenderedKey().isPresent());
		assertFalse(failure.getMessage().isEmpty());

		// Failures are not cached
		assertEquals(0, caches.getRawStore().size());
		assertEquals(0, caches.getThumbnailStore().renderedSize());
	}

	@Test
	public void test_missingFileName(@TempDir Path dir) throws Exception {
		var header = ScanHeader.fromMap(Map.of("xPixel", "4", "yPixel", "4"));
		var channel = new ChannelDescriptor(0, "Topography", null, "nm", 1.0, 0.0, null);
		var scan = new ScanFile(dir.resolve("scan.txt"), header, List.of(channel));
		var request = RenderRequest.create(scan, 0, 2, 2);

		assertThrows(ChannelDecodeException.class, () -> scheduler.createRenderedKey(request));
		var outcome = scheduler.request(request);
		assertFalse(outcome.isHit());
		assertFalse(outcome.getRenderedKey().isPresent());

		assertEquals(1, scheduler.processCompletions());
		assertEquals(1, listener.failures.size());
		assertEquals(0L, scheduler.getSubmittedCount());
	}

	@Test
	public void test_renderNow(@TempDir Path dir) throws Exception {
		var scan = ChannelFixtures.createScan(dir, "scan", 4, 4, ChannelFixtures.ramp(16, 0));
		var request = RenderRequest.create(scan, 0, 4, 4);
		var img = scheduler.renderNow(request);
		assertEquals(4, img.getWidth());
		assertEquals(1, caches.getThumbnailStore().renderedSize());

		// Lowest value is black with the gray colormap
		assertEquals(0xff000000, img.getRGB(0, 0));
		assertEquals(0xffffffff, img.getRGB(3, 3));

		var outcome = scheduler.request(request);
		assertTrue(outcome.isHit());
		assertEquals(0L, scheduler.getSubmittedCount());
	}

	@Test
	public void test_closed(@TempDir Path dir) throws Exception {
		var scan = ChannelFixtures.createScan(dir, "scan", 4, 4, ChannelFixtures.ramp(16, 0));
		scheduler.close();
		assertThrows(IllegalStateException.class, () -> scheduler.request(RenderRequest.create(scan, 0, 2, 2)));
		assertEquals(0, scheduler.getPendingCount());
	}


	private static class RecordingListener implements RenderListener {

		private final List<RenderResult.Success> successes = new ArrayList<>();
		private final List<RenderResult.Failure> failures = new ArrayList<>();

		@Override
		public void renderAvailable(RenderResult.Success result) {
			successes.add(result);
		}

		@Override
		public void renderFailed(RenderResult.Failure result) {
			failures.add(result);
		}

	}

}
