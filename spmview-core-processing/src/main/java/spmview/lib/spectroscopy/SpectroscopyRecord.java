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

package spmview.lib.spectroscopy;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

import spmview.lib.images.metadata.ScanHeader;

/**
 * A single point spectroscopy measurement (or one point of a spectroscopy grid).
 * <p>
 * Instances are immutable; use {@link #builder(Path)} to create them.
 * Array values are copied on input and output.
 */
public final class SpectroscopyRecord {

	private final Path path;
	private final LocalDateTime time;
	private final Double x;
	private final Double y;
	private final Integer gridRow;
	private final Integer gridColumn;
	private final Integer gridRows;
	private final Integer gridColumns;
	private final double[] bias;
	private final Map<String, double[]> channels;
	private final Integer matrixIndex;

	private SpectroscopyRecord(Builder builder) {
		this.path = builder.path;
		this.time = builder.time;
		this.x = builder.x;
		this.y = builder.y;
		this.gridRow = builder.gridRow;
		this.gridColumn = builder.gridColumn;
		this.gridRows = builder.gridRows;
		this.gridColumns = builder.gridColumns;
		this.bias = builder.bias == null ? new double[0] : builder.bias.clone();
		var channelBuilder = ImmutableMap.<String, double[]>builder();
		for (var entry : builder.channels.entrySet())
			channelBuilder.put(entry.getKey(), entry.getValue().clone());
		this.channels = channelBuilder.build();
		this.matrixIndex = builder.matrixIndex;
	}

	/**
	 * Create a builder for a record read from the specified file.
	 * @param path
	 * @return
	 */
	public static Builder builder(Path path) {
		return new Builder(path);
	}

	/**
	 * Path of the file containing the record.
	 * @return
	 */
	public Path getPath() {
		return path;
	}

	/**
	 * Acquisition time, if known.
	 * @return
	 */
	public Optional<LocalDateTime> getTime() {
		return Optional.ofNullable(time);
	}

	/**
	 * Query whether the physical position is known.
	 * @return
	 */
	public boolean hasPosition() {
		return x != null && y != null;
	}

	/**
	 * Physical x position, or NaN if unknown.
	 * @return
	 */
	public double getX() {
		return x == null ? Double.NaN : x;
	}

	/**
	 * Physical y position, or NaN if unknown.
	 * @return
	 */
	public double getY() {
		return y == null ? Double.NaN : y;
	}

	/**
	 * Row within a spectroscopy grid, if known.
	 * @return
	 */
	public Optional<Integer> getGridRow() {
		return Optional.ofNullable(gridRow);
	}

	/**
	 * Column within a spectroscopy grid, if known.
	 * @return
	 */
	public Optional<Integer> getGridColumn() {
		return Optional.ofNullable(gridColumn);
	}

	/**
	 * Number of rows in the spectroscopy grid, if known.
	 * @return
	 */
	public Optional<Integer> getGridRows() {
		return Optional.ofNullable(gridRows);
	}

	/**
	 * Number of columns in the spectroscopy grid, if known.
	 * @return
	 */
	public Optional<Integer> getGridColumns() {
		return Optional.ofNullable(gridColumns);
	}

	/**
	 * Bias values of the sweep.
	 * @return a copy of the values
	 */
	public double[] getBias() {
		return bias.clone();
	}

	/**
	 * Names of the measured channels, in the order they were added.
	 * @return
	 */
	public Set<String> getChannelNames() {
		return channels.keySet();
	}

	/**
	 * Values of a measured channel.
	 * @param name
	 * @return a copy of the values, or empty if there is no such channel
	 */
	public Optional<double[]> getChannel(String name) {
		var values = channels.get(name);
		return values == null ? Optional.empty() : Optional.of(values.clone());
	}

	/**
	 * Index of the record within a spectroscopy matrix, if it belongs to one.
	 * @return
	 */
	public Optional<Integer> getMatrixIndex() {
		return Optional.ofNullable(matrixIndex);
	}

	/**
	 * Map the position of this record onto (fractional) pixel coordinates of a scan.
	 * <p>
	 * The physical position is used if it lies within the scan frame; otherwise the grid row and column
	 * are used as fractions of the grid size.
	 *
	 * @param header the scan header
	 * @return {@code [col, row]}, or empty if the position cannot be determined
	 */
	public Optional<double[]> toPixel(ScanHeader header) {
		if (hasPosition()) {
			var pixel = header.physicalToPixel(x, y);
			if (pixel.isPresent())
				return pixel;
		}
		if (gridRows == null || gridColumns == null || gridRows <= 0 || gridColumns <= 0)
			return Optional.empty();
		int col = gridColumn == null ? 0 : gridColumn;
		int row = gridRow == null ? 0 : gridRow;
		double colFraction = col / (double)Math.max(1, gridColumns - 1);
		double rowFraction = row / (double)Math.max(1, gridRows - 1);
		return Optional.of(new double[] {
				colFraction * Math.max(1, header.getPixelWidth() - 1),
				rowFraction * Math.max(1, header.getPixelHeight() - 1)
		});
	}

	@Override
	public String toString() {
		var sb = new StringBuilder("SpectroscopyRecord [");
		sb.append(path.getFileName());
		if (matrixIndex != null)
			sb.append(", matrix=").append(matrixIndex);
		sb.append(", time=").append(time).append("]");
		return sb.toString();
	}

	@Override
	public int hashCode() {
		return Objects.hash(path, time, matrixIndex);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof SpectroscopyRecord))
			return false;
		var other = (SpectroscopyRecord)obj;
		return path.equals(other.path) && Objects.equals(time, other.time) && Objects.equals(matrixIndex, other.matrixIndex)
				&& Objects.equals(x, other.x) && Objects.equals(y, other.y)
				&& Objects.equals(gridRow, other.gridRow) && Objects.equals(gridColumn, other.gridColumn)
				&& Arrays.equals(bias, other.bias);
	}


	/**
	 * Builder for {@link SpectroscopyRecord}.
	 */
	public static class Builder {

		private final Path path;
		private LocalDateTime time;
		private Double x;
		private Double y;
		private Integer gridRow;
		private Integer gridColumn;
		private Integer gridRows;
		private Integer gridColumns;
		private double[] bias;
		private final Map<String, double[]> channels = new LinkedHashMap<>();
		private Integer matrixIndex;

		private Builder(Path path) {
			this.path = Objects.requireNonNull(path).toAbsolutePath().normalize();
		}

		/**
		 * Set the acquisition time.
		 * @param time the time, or null if unknown
		 * @return this builder
		 */
		public Builder time(LocalDateTime time) {
			this.time = time;
			return this;
		}

		/**
		 * Set the physical position.
		 * @param x
		 * @param y
		 * @return this builder
		 */
		public Builder position(double x, double y) {
			this.x = x;
			this.y = y;
			return this;
		}

		/**
		 * Set the location within a spectroscopy grid.
		 * @param row
		 * @param column
		 * @param nRows
		 * @param nColumns
		 * @return this builder
		 */
		public Builder grid(int row, int column, int nRows, int nColumns) {
			this.gridRow = row;
			this.gridColumn = column;
			this.gridRows = nRows;
			this.gridColumns = nColumns;
			return this;
		}

		/**
		 * Set the bias values of the sweep.
		 * @param bias
		 * @return this builder
		 */
		public Builder bias(double... bias) {
			this.bias = bias == null ? null : bias.clone();
			return this;
		}

		/**
		 * Add the values of a measured channel.
		 * @param name
		 * @param values
		 * @return this builder
		 */
		public Builder channel(String name, double... values) {
			channels.put(Objects.requireNonNull(name), values.clone());
			return this;
		}

		/**
		 * Set the index within a spectroscopy matrix.
		 * @param index the index, or null if the record is not part of a matrix
		 * @return this builder
		 */
		public Builder matrixIndex(Integer index) {
			this.matrixIndex = index;
			return this;
		}

		/**
		 * Build the record.
		 * @return
		 */
		public SpectroscopyRecord build() {
			return new SpectroscopyRecord(this);
		}

	}

}
