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

package spmview.lib.session;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import spmview.lib.filters.FilterPipeline;
import spmview.lib.images.ChannelArray;
import spmview.lib.images.metadata.DatasetCatalog;
import spmview.lib.images.metadata.ImageAcquisition;
import spmview.lib.images.metadata.LoadSummary;
import spmview.lib.images.metadata.ScanFile;
import spmview.lib.images.stores.CacheSettings;
import spmview.lib.images.stores.ChannelCaches;
import spmview.lib.images.stores.GenerationCounter;
import spmview.lib.images.stores.InvalidationScope;
import spmview.lib.images.stores.RenderListener;
import spmview.lib.images.stores.RenderRequest;
import spmview.lib.images.stores.RenderScheduler;
import spmview.lib.images.stores.RequestOutcome;
import spmview.lib.io.ChannelDecodeException;
import spmview.lib.io.HeaderMetadataCache;
import spmview.lib.io.HeaderParser;
import spmview.lib.spectroscopy.SpectroscopyLibrary;
import spmview.lib.spectroscopy.SpectroscopyParser;
import spmview.lib.spectroscopy.SpectroscopyRecord;
import spmview.lib.spectroscopy.TemporalAssignment;
import spmview.lib.tags.HeightDifference;
import spmview.lib.tags.ScanModeTags;

/**
 * Entry point for the presentation layer: owns the dataset catalog, the caches, the render scheduler
 * and the spectroscopy records of the current folder.
 * <p>
 * All methods other than the getters are expected to be called from a single coordinating thread
 * (e.g. the UI thread). Images are computed on worker threads and delivered by {@link #processCompletions()}.
 */
public class ViewerSession implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ViewerSession.class);

	private final HeaderParser headerParser;
	private final HeaderMetadataCache headerCache;
	private final CacheSettings settings;

	private final DatasetCatalog catalog = new DatasetCatalog();
	private final GenerationCounter generation = new GenerationCounter();
	private final ChannelCaches caches;
	private final RenderScheduler scheduler;
	private final SpectroscopyLibrary spectroscopy;
	private final ScanModeTags tags = new ScanModeTags();

	private final Map<Path, FilterPipeline> pipelines = new HashMap<>();

	private Path spectroscopyFolder;
	private List<ImageAcquisition> acquisitions = ImmutableList.of();
	private Map<Path, List<SpectroscopyRecord>> recordsByImage = ImmutableMap.of();

	/**
	 * Create a session without a persistent header cache.
	 * @param headerParser parser for scan headers
	 * @param spectroscopyParser parser for spectroscopy files
	 * @param settings cache and worker settings
	 */
	public ViewerSession(HeaderParser headerParser, SpectroscopyParser spectroscopyParser, CacheSettings settings) {
		this(headerParser, spectroscopyParser, settings, null);
	}

	/**
	 * Create a session.
	 * @param headerParser parser for scan headers
	 * @param spectroscopyParser parser for spectroscopy files
	 * @param settings cache and worker settings
	 * @param headerCache optional cache of parsed headers (may be null)
	 */
	public ViewerSession(HeaderParser headerParser, SpectroscopyParser spectroscopyParser, CacheSettings settings, HeaderMetadataCache headerCache) {
		this.headerParser = Objects.requireNonNull(headerParser);
		this.settings = Objects.requireNonNull(settings);
		this.headerCache = headerCache;
		this.caches = new ChannelCaches(settings);
		this.scheduler = new RenderScheduler(caches, generation, settings);
		this.spectroscopy = new SpectroscopyLibrary(spectroscopyParser);
	}

	/**
	 * Load (or reload) a folder of scans.
	 * <p>
	 * Results of any pending requests are discarded, all caches are cleared, headers are read, scan modes are
	 * detected and spectroscopy records are rescanned and assigned to the new images.
	 * Spectroscopy records are read from the same folder unless another has been set with
	 * {@link #setSpectroscopyFolder(Path)}.
	 *
	 * @param folder
	 * @return a summary of the headers loaded
	 * @throws IOException if the folder does not exist or cannot be read
	 */
	public LoadSummary loadFolder(Path folder) throws IOException {
		long gen = generation.advance();
		caches.invalidate(InvalidationScope.all());
		var summary = catalog.loadFolder(folder, headerParser, headerCache);
		pipelines.keySet().retainAll(catalog.getFiles());
		acquisitions = catalog.getImageAcquisitions();
		tags.autoTag(catalog.getScanFiles());
		rescanSpectroscopy();
		logger.info("Loaded {} (generation {}): {}", folder, gen, summary);
		return summary;
	}

	/**
	 * Set the folder containing spectroscopy files, then rescan and reassign records.
	 * @param folder the folder, or null to use the folder of the scans
	 * @return the number of records found
	 * @throws IOException if the folder exists but cannot be read
	 */
	public int setSpectroscopyFolder(Path folder) throws IOException {
		this.spectroscopyFolder = folder == null ? null : folder.toAbsolutePath().normalize();
		return rescanSpectroscopy();
	}

	/**
	 * Get the folder from which spectroscopy records are read.
	 * @return
	 */
	public Optional<Path> getSpectroscopyFolder() {
		if (spectroscopyFolder != null)
			return Optional.of(spectroscopyFolder);
		return catalog.getFolder();
	}

	private int rescanSpectroscopy() throws IOException {
		var folder = getSpectroscopyFolder().orElse(null);
		var records = spectroscopy.scan(folder);
		assignRecords(acquisitions, records);
		return records.size();
	}

	/**
	 * Assign spectroscopy records to images, replacing the current assignment.
	 * @param images
	 * @param records
	 * @return map of image paths to the records assigned to them
	 * @see TemporalAssignment#assign(Collection, Collection)
	 */
	public Map<Path, List<SpectroscopyRecord>> assignRecords(Collection<ImageAcquisition> images, Collection<SpectroscopyRecord> records) {
		recordsByImage = TemporalAssignment.assign(images, records);
		return recordsByImage;
	}

	/**
	 * Get the spectroscopy records assigned to an image.
	 * @param headerPath
	 * @return the records, sorted by time, or an empty list
	 */
	public List<SpectroscopyRecord> getRecordsForImage(Path headerPath) {
		return recordsByImage.getOrDefault(headerPath.toAbsolutePath().normalize(), ImmutableList.of());
	}

	/**
	 * Request an image of a channel using the filters currently applied to the file.
	 * @param headerPath
	 * @param channelIndex
	 * @param width
	 * @param height
	 * @param colorMapName colormap name, or null to use the default
	 * @return
	 * @see #requestImage(Path, int, int, int, String, FilterPipeline)
	 */
	public RequestOutcome requestImage(Path headerPath, int channelIndex, int width, int height, String colorMapName) {
		return requestImage(headerPath, channelIndex, width, height, colorMapName, getFilterPipeline(headerPath));
	}

	/**
	 * Request an image of a channel.
	 * @param headerPath the scan
	 * @param channelIndex index of the channel
	 * @param width maximum image width
	 * @param height maximum image height
	 * @param colorMapName colormap name, or null to use the default
	 * @param pipeline filters to apply, or null for none
	 * @return either the cached image, or a pending outcome that will be delivered by {@link #processCompletions()}
	 * @throws IllegalArgumentException if the file is not part of the current folder, or the channel or size is invalid
	 */
	public RequestOutcome requestImage(Path headerPath, int channelIndex, int width, int height, String colorMapName, FilterPipeline pipeline) {
		var request = RenderRequest.create(getScanFile(headerPath), channelIndex, width, height, colorMapName, pipeline);
		return scheduler.request(request);
	}

	/**
	 * Request a square thumbnail of a channel, using the default size, colormap and the filters applied to the file.
	 * @param headerPath
	 * @param channelIndex
	 * @return
	 */
	public RequestOutcome requestThumbnail(Path headerPath, int channelIndex) {
		int size = settings.getThumbnailSize();
		return requestImage(headerPath, channelIndex, size, size, null);
	}

	private ScanFile getScanFile(Path headerPath) {
		return catalog.getScanFile(headerPath)
				.orElseThrow(() -> new IllegalArgumentException(headerPath + " is not part of the current folder"));
	}

	/**
	 * Sample the processed value of a channel at a physical position, using the filters applied to the file.
	 * The processed array is computed on the calling thread if it is not already cached.
	 * @param headerPath
	 * @param channelIndex
	 * @param x physical x coordinate within the scan extent
	 * @param y physical y coordinate within the scan extent
	 * @return the value of the nearest pixel, or empty if the position is outside the scan or the value is not finite
	 * @throws ChannelDecodeException if the channel cannot be decoded
	 * @see ChannelArray#sampleValue(double, double, double[])
	 */
	public OptionalDouble sampleValue(Path headerPath, int channelIndex, double x, double y) throws ChannelDecodeException {
		var file = getScanFile(headerPath);
		var extent = file.getHeader().getExtent().orElse(null);
		if (extent == null)
			return OptionalDouble.empty();
		var request = RenderRequest.create(file, channelIndex, 1, 1, null, getFilterPipeline(headerPath));
		return scheduler.processNow(request).sampleValue(x, y, extent);
	}

	/**
	 * Get the tip height of a file relative to the most recent earlier constant-height file in the folder.
	 * @param headerPath
	 * @return
	 * @see ScanModeTags#getDifferenceToPreviousConstantHeight(List, Path)
	 */
	public Optional<HeightDifference> getDifferenceToPreviousConstantHeight(Path headerPath) {
		return tags.getDifferenceToPreviousConstantHeight(catalog.getFiles(), headerPath);
	}

	/**
	 * Get the tip height of a file relative to the most recent earlier file in the folder that is not constant height.
	 * @param headerPath
	 * @return
	 * @see ScanModeTags#getDifferenceToLastNonConstantHeight(List, Path)
	 */
	public Optional<HeightDifference> getDifferenceToLastNonConstantHeight(Path headerPath) {
		return tags.getDifferenceToLastNonConstantHeight(catalog.getFiles(), headerPath);
	}

	/**
	 * Deliver completed images to listeners. This does not block.
	 * @return the number of results delivered
	 */
	public int processCompletions() {
		return scheduler.processCompletions();
	}

	/**
	 * Wait for at least one completed image, then deliver all completed images to listeners.
	 * @param timeout
	 * @param unit
	 * @return the number of results delivered
	 * @throws InterruptedException
	 */
	public int awaitCompletions(long timeout, TimeUnit unit) throws InterruptedException {
		return scheduler.awaitCompletions(timeout, unit);
	}

	/**
	 * Apply filters to files. Cached entries of the files are removed, and pending results discarded.
	 * @param headerPaths
	 * @param pipeline
	 */
	public void applyFilter(Collection<Path> headerPaths, FilterPipeline pipeline) {
		Objects.requireNonNull(pipeline);
		for (var path : headerPaths)
			pipelines.put(path.toAbsolutePath().normalize(), pipeline);
		generation.advance();
		int n = caches.invalidate(InvalidationScope.files(headerPaths));
		logger.debug("Applied {} to {} file(s), {} cache entries removed", pipeline, headerPaths.size(), n);
	}

	/**
	 * Remove filters from files. Cached entries of the files are removed, and pending results discarded.
	 * @param headerPaths
	 */
	public void clearFilter(Collection<Path> headerPaths) {
		for (var path : headerPaths)
			pipelines.remove(path.toAbsolutePath().normalize());
		generation.advance();
		int n = caches.invalidate(InvalidationScope.files(headerPaths));
		logger.debug("Cleared filters of {} file(s), {} cache entries removed", headerPaths.size(), n);
	}

	/**
	 * Get the filters applied to a file.
	 * @param headerPath
	 * @return the pipeline, which is empty if no filters have been applied
	 */
	public FilterPipeline getFilterPipeline(Path headerPath) {
		return pipelines.getOrDefault(headerPath.toAbsolutePath().normalize(), FilterPipeline.empty());
	}

	/**
	 * Remove cached entries, e.g. because files have changed on disk.
	 * @param scope
	 * @return the number of entries removed
	 */
	public int invalidate(InvalidationScope scope) {
		return caches.invalidate(scope);
	}

	/**
	 * Add a listener to receive delivered images.
	 * @param listener
	 */
	public void addRenderListener(RenderListener listener) {
		scheduler.addRenderListener(listener);
	}

	/**
	 * Remove a listener.
	 * @param listener
	 */
	public void removeRenderListener(RenderListener listener) {
		scheduler.removeRenderListener(listener);
	}

	public DatasetCatalog getCatalog() {
		return catalog;
	}

	public ChannelCaches getCaches() {
		return caches;
	}

	public RenderScheduler getScheduler() {
		return scheduler;
	}

	public SpectroscopyLibrary getSpectroscopyLibrary() {
		return spectroscopy;
	}

	public ScanModeTags getScanModeTags() {
		return tags;
	}

	public CacheSettings getSettings() {
		return settings;
	}

	/**
	 * Current generation; this changes whenever pending results become stale.
	 * @return
	 */
	public long getGeneration() {
		return generation.get();
	}

	/**
	 * Acquisition times of the images in the current folder.
	 * @return
	 */
	public List<ImageAcquisition> getImageAcquisitions() {
		return acquisitions;
	}

	/**
	 * Stop the render workers.
	 */
	@Override
	public void close() {
		scheduler.close();
	}

}
