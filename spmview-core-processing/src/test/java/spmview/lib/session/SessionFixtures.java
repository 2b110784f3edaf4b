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
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import spmview.lib.io.HeaderParseException;
import spmview.lib.io.HeaderParser;
import spmview.lib.io.ParsedHeader;

/**
 * Write test scans, and parse their headers.
 * Headers are made of {@code key=value} lines; a line {@code [channel]} starts a new channel section.
 */
class SessionFixtures implements HeaderParser {

	@Override
	public ParsedHeader parseHeader(Path path) throws HeaderParseException {
		List<String> lines;
		try {
			lines = Files.readAllLines(path, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new HeaderParseException("Unable to read " + path, e);
		}
		Map<String, String> header = new LinkedHashMap<>();
		List<Map<String, String>> channels = new ArrayList<>();
		Map<String, String> current = header;
		for (var line : lines) {
			line = line.trim();
			if (line.isEmpty() || line.startsWith("#"))
				continue;
			if (line.equals("[channel]")) {
				current = new LinkedHashMap<>();
				channels.add(current);
				continue;
			}
			int ind = line.indexOf('=');
			if (ind <= 0)
				throw new HeaderParseException("Invalid line in " + path.getFileName() + ": " + line);
			current.put(line.substring(0, ind).trim(), line.substring(ind + 1).trim());
		}
		return new ParsedHeader(header, channels);
	}

	/**
	 * Write a 4x4 scan with a single topography channel.
	 */
	static Path writeScan(Path dir, String name, String time, double[] values) throws IOException {
		String fileName = name + "_0.bin";
		var buffer = ByteBuffer.allocate(values.length * 4).order(ByteOrder.LITTLE_ENDIAN);
		for (double v : values)
			buffer.putFloat((float)v);
		Files.write(dir.resolve(fileName), buffer.array());
		return Files.writeString(dir.resolve(name + ".txt"), String.join("\n",
				"xPixel=4", "yPixel=4", "ScanRange=10", "Date=2023-05-01", "Time=" + time,
				"[channel]", "Caption=Topography", "FileName=" + fileName, "PhysUnit=nm"));
	}

	static Path writeSpectroscopy(Path dir, String name, String time) throws IOException {
		return Files.writeString(dir.resolve(name), String.join("\n",
				"# spectroscopy", "time=" + time, "bias=-1,0,1", "current=0.1,0.2,0.3"));
	}

	static double[] flat(double value) {
		double[] values = new double[16];
		Arrays.fill(values, value);
		return values;
	}

	static double[] ramp() {
		double[] values = new double[16];
		for (int i = 0; i < values.length; i++)
			values[i] = i;
		return values;
	}

}
