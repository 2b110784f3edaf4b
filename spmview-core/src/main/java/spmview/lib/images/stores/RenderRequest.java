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

import java.nio.file.Path;
import java.util.Objects;

import spmview.lib.filters.FilterPipeline;
import spmview.lib.images.metadata.ScanFile;

/**
 * Request for a color-mapped, downsampled image of one channel of a scan.
 */
public final class RenderRequest {

	private final ScanFile file;
	private final int channelIndex;
	private final int width;
	private final int height;
	private final String colorMapName;
	private final FilterPipeline pipeline;

	private RenderRequest(ScanFile file, int channelIndex, int width, int height, String colorMapName, FilterPipeline pipeline) {
		this.file = Objects.requireNonNull(file);
		if (channelIndex < 0 || channelIndex >= file.nChannels())
			throw new IllegalArgumentException("Invalid channel " + channelIndex + " for " + file);
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Image size must be > 0, but was " + width + "x" + height);
		this.channelIndex = channelIndex;
		this.width = width;
		this.height = height;
		this.colorMapName = colorMapName;
		this.pipeline = pipeline == null ? FilterPipeline.empty() : pipeline;
	}

	/**
	 * Create a request.
	 * @param file the scan
	 * @param channelIndex index of the channel
	 * @param width maximum image width
	 * @param height maximum image height
	 * @param colorMapName name of the colormap, or null to use the default
	 * @param pipeline filters to apply, or null if no filters should be applied
	 * @return
	 * @throws IllegalArgumentException if the channel index or size is invalid
	 */
	public static RenderRequest create(ScanFile file, int channelIndex, int width, int height, String colorMapName, FilterPipeline pipeline) {
		return new RenderRequest(file, channelIndex, width, height, colorMapName, pipeline);
	}

	/**
	 * Create a request using the default colormap and no filters.
	 * @param file
	 * @param channelIndex
	 * @param width
	 * @param height
	 * @return
	 */
	public static RenderRequest create(ScanFile file, int channelIndex, int width, int height) {
		return create(file, channelIndex, width, height, null, null);
	}

	/**
	 * The scan.
	 * @return
	 */
	public ScanFile getFile() {
		return file;
	}

	/**
	 * Header path of the scan.
	 * @return
	 */
	public Path getHeaderPath() {
		return file.getHeaderPath();
	}

	/**
	 * Channel index.
	 * @return
	 */
	public int getChannelIndex() {
		return channelIndex;
	}

	/**
	 * Maximum image width.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Maximum image height.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Requested colormap name, or null if the default should be used.
	 * @return
	 */
	public String getColorMapName() {
		return colorMapName;
	}

	/**
	 * Filters to apply.
	 * @return
	 */
	public FilterPipeline getPipeline() {
		return pipeline;
	}

	@Override
	public String toString() {
		return "RenderRequest [" + file.getHeaderPath().getFileName() + ", channel=" + channelIndex + ", " + width + "x" + height
				+ ", colormap=" + colorMapName + ", filters=" + pipeline.getSignature() + "]";
	}

}
