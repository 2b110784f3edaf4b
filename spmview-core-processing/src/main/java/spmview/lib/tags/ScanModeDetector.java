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

package spmview.lib.tags;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import spmview.lib.filters.UnitNormalizer;
import spmview.lib.images.metadata.ChannelDescriptor;
import spmview.lib.images.metadata.ScanFile;
import spmview.lib.images.metadata.ScanHeader;
import spmview.lib.io.BinaryChannelReader;
import spmview.lib.io.ChannelDecodeException;

/**
 * Detect whether a scan was acquired in constant-height or constant-current mode.
 * <p>
 * The header is checked for a textual description of the mode first. Otherwise a few samples of the
 * topography channel are read: if they are (almost) all equal the tip did not move, so the scan was
 * acquired at constant height.
 */
public class ScanModeDetector {

	private static final Logger logger = LoggerFactory.getLogger(ScanModeDetector.class);

	/**
	 * Number of topography samples to read.
	 */
	public static final int SAMPLE_COUNT = 16;

	/**
	 * Maximum range of topography samples (in nm) for a scan to be considered constant height.
	 */
	public static final double FLAT_TOLERANCE_NM = 0.001;

	private static final String[] CH_INDICATORS = {
			"constant-height", "constant height", "constantheight", "constheight",
			"mode: constant", "scanmode: constant", "operationmode: constant"
	};

	private static final String[] CC_INDICATORS = {
			"constant-current", "constant current", "constantcurrent",
			"feedback: current", "mode: current", "scanmode: current"
	};

	// Suppressed default constructor for non-instantiability
	private ScanModeDetector() {
		throw new AssertionError();
	}

	/**
	 * Detect the scan mode of a file.
	 * @param file
	 * @return the detected tag, or empty if the mode could not be determined
	 */
	public static Optional<ScanModeTag> detect(ScanFile file) {
		var fromHeader = getModeFromHeader(file.getHeader());
		if (fromHeader.isPresent()) {
			logger.debug("Scan mode of {} read from header: {}", file, fromHeader.get());
			return Optional.of(ScanModeTag.detected(fromHeader.get(), null));
		}
		if (file.nChannels() == 0)
			return Optional.empty();

		int ind = findTopographyChannel(file.getChannels()).orElse(0);
		double[] samples;
		try {
			samples = sampleNanometers(file, ind);
		} catch (ChannelDecodeException e) {
			logger.debug("Unable to sample topography of {}: {}", file, e.getLocalizedMessage());
			return Optional.empty();
		}
		if (samples.length == 0)
			return Optional.empty();
		return Optional.of(classify(samples));
	}

	/**
	 * Classify a scan from samples of its topography channel.
	 * @param samplesNanometers finite samples, in nm
	 * @return
	 */
	static ScanModeTag classify(double[] samplesNanometers) {
		double min = Arrays.stream(samplesNanometers).min().orElse(Double.NaN);
		double max = Arrays.stream(samplesNanometers).max().orElse(Double.NaN);
		if (max - min <= FLAT_TOLERANCE_NM) {
			double median = new Median().evaluate(samplesNanometers);
			return ScanModeTag.detected(ScanMode.CONSTANT_HEIGHT, (int)Math.round(median * 1000.0));
		}
		return ScanModeTag.detected(ScanMode.CONSTANT_CURRENT, null);
	}

	private static double[] sampleNanometers(ScanFile file, int channelIndex) throws ChannelDecodeException {
		var channel = file.getChannel(channelIndex);
		var header = file.getHeader();
		Path path;
		try {
			path = file.getBinaryPath(channelIndex);
		} catch (IllegalStateException e) {
			throw new ChannelDecodeException(e.getLocalizedMessage(), e);
		}
		double[] values = BinaryChannelReader.sampleValues(path, SAMPLE_COUNT,
				header.getPixelWidth(), header.getPixelHeight(),
				channel.getScale(), channel.getOffset(), channel.getSampleType().orElse(null));
		String unit = channel.getUnit();
		return Arrays.stream(values)
				.map(v -> UnitNormalizer.toNanometers(v, unit))
				.filter(Double::isFinite)
				.toArray();
	}

	/**
	 * Look for a description of the scan mode within the header fields.
	 * @param header
	 * @return the mode, or empty if the header does not describe it
	 */
	public static Optional<ScanMode> getModeFromHeader(ScanHeader header) {
		return getModeFromProperties(header.getProperties());
	}

	static Optional<ScanMode> getModeFromProperties(Map<String, String> properties) {
		if (properties.isEmpty())
			return Optional.empty();
		String[] entries = properties.entrySet().stream()
				.map(e -> (e.getKey() + ":" + e.getValue()).toLowerCase(Locale.ROOT))
				.toArray(String[]::new);
		String combined = String.join(" ", entries);
		if (containsAny(combined, CH_INDICATORS))
			return Optional.of(ScanMode.CONSTANT_HEIGHT);
		if (containsAny(combined, CC_INDICATORS))
			return Optional.of(ScanMode.CONSTANT_CURRENT);
		for (var entry : entries) {
			if (entry.contains("constant")) {
				if (entry.contains("height"))
					return Optional.of(ScanMode.CONSTANT_HEIGHT);
				if (entry.contains("current"))
					return Optional.of(ScanMode.CONSTANT_CURRENT);
			}
		}
		return Optional.empty();
	}

	private static boolean containsAny(String text, String... tokens) {
		for (var token : tokens) {
			if (text.contains(token))
				return true;
		}
		return false;
	}

	/**
	 * Find the channel that records the topography (tip height).
	 * <p>
	 * In order of preference: a caption containing "topo"; a file name containing "topo"; a caption containing
	 * "height" (but not a sensor, feedback or setpoint channel); a channel with a length unit.
	 *
	 * @param channels
	 * @return the channel index, or empty if no channel looks like topography
	 */
	public static Optional<Integer> findTopographyChannel(List<ChannelDescriptor> channels) {
		for (var channel : channels) {
			if (lower(channel.getCaption()).contains("topo"))
				return Optional.of(channel.getIndex());
		}
		for (var channel : channels) {
			if (lower(channel.getFileName()).contains("topo"))
				return Optional.of(channel.getIndex());
		}
		for (var channel : channels) {
			var caption = lower(channel.getCaption());
			if (caption.contains("height") && !caption.contains("sensor") && !caption.contains("feedback") && !caption.contains("setpoint"))
				return Optional.of(channel.getIndex());
		}
		for (var channel : channels) {
			if (UnitNormalizer.isLengthUnit(channel.getUnit()))
				return Optional.of(channel.getIndex());
		}
		return Optional.empty();
	}

	private static String lower(String s) {
		return s == null ? "" : s.toLowerCase(Locale.ROOT);
	}

}
