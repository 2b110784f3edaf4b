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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import spmview.lib.images.metadata.ChannelDescriptor;
import spmview.lib.images.metadata.ScanFile;
import spmview.lib.images.metadata.ScanHeader;

/**
 * Create scans with a single float32 channel for tests.
 */
class TagFixtures {

	static ScanFile createScan(Path dir, String name, String unit, Map<String, String> header, double... values) throws IOException {
		var buffer = ByteBuffer.allocate(values.length * 4).order(ByteOrder.LITTLE_ENDIAN);
		for (double v : values)
			buffer.putFloat((float)v);
		String fileName = name + "_topo.bin";
		Files.write(dir.resolve(fileName), buffer.array());
		Path headerPath = dir.resolve(name + ".txt");
		Files.writeString(headerPath, name);
		int size = (int)Math.round(Math.sqrt(values.length));
		var properties = new LinkedHashMap<String, String>(header);
		properties.put("xPixel", Integer.toString(size));
		properties.put("yPixel", Integer.toString(size));
		var channel = new ChannelDescriptor(0, "Topography", fileName, unit, 1.0, 0.0, null);
		return new ScanFile(headerPath, ScanHeader.fromMap(properties), List.of(channel));
	}

	static double[] constant(int n, double value) {
		double[] values = new double[n];
		Arrays.fill(values, value);
		return values;
	}

	static double[] ramp(int n) {
		double[] values = new double[n];
		for (int i = 0; i < n; i++)
			values[i] = i * 0.1;
		return values;
	}

}
