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

package spmview.lib.filters;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableMap;

import spmview.lib.images.ChannelArray;

/**
 * Convert channel values into a small set of display units, so that channels recorded with
 * different controller settings can be compared directly.
 * <p>
 * Lengths are converted to nm, currents to pA, voltages to V and frequencies to Hz.
 * Units that are not recognized are left unchanged.
 */
public class UnitNormalizer {

	/**
	 * Target unit for lengths.
	 */
	public static final String NANOMETERS = "nm";

	/**
	 * Target unit for currents.
	 */
	public static final String PICOAMPS = "pA";

	/**
	 * Target unit for voltages.
	 */
	public static final String VOLTS = "V";

	/**
	 * Target unit for frequencies.
	 */
	public static final String HERTZ = "Hz";

	private static final Map<String, Conversion> CONVERSIONS;

	static {
		var builder = new ConversionTableBuilder();
		builder.add(NANOMETERS, 1e-3, "pm", "picometer", "picometre");
		builder.add(NANOMETERS, 1.0, "nm", "nanometer", "nanometre");
		builder.add(NANOMETERS, 1e3, "um", "µm", "μm", "micrometer", "micrometre");
		builder.add(NANOMETERS, 1e6, "mm", "millimeter", "millimetre");
		builder.add(NANOMETERS, 1e7, "cm");
		builder.add(NANOMETERS, 1e9, "m", "meter", "metre");
		builder.add(NANOMETERS, 0.1, "Å", "å", "ang", "angstrom");
		builder.add(PICOAMPS, 1e-3, "fA");
		builder.add(PICOAMPS, 1.0, "pA");
		builder.add(PICOAMPS, 1e3, "nA");
		builder.add(PICOAMPS, 1e6, "uA", "µA", "μA");
		builder.add(PICOAMPS, 1e9, "mA");
		builder.add(PICOAMPS, 1e12, "A");
		builder.add(VOLTS, 1e-6, "uV", "µV", "μV");
		builder.add(VOLTS, 1e-3, "mV");
		builder.add(VOLTS, 1.0, "V");
		builder.add(VOLTS, 1e3, "kV");
		builder.add(HERTZ, 1.0, "Hz");
		builder.add(HERTZ, 1e3, "kHz");
		builder.add(HERTZ, 1e6, "MHz");
		builder.add(HERTZ, 1e9, "GHz");
		CONVERSIONS = builder.build();
	}

	// Suppressed default constructor for non-instantiability
	private UnitNormalizer() {
		throw new AssertionError();
	}

	/**
	 * Get the conversion for a unit.
	 * The unit is looked up as written first, then in lower case.
	 * @param unit
	 * @return the conversion; this has a factor of 1 and the original unit if the unit is not recognized
	 */
	public static Conversion getConversion(String unit) {
		String key = unit == null ? "" : unit.trim();
		var conversion = CONVERSIONS.get(key);
		if (conversion == null)
			conversion = CONVERSIONS.get(key.toLowerCase(Locale.ROOT));
		return conversion == null ? new Conversion(key, 1.0, false) : conversion;
	}

	/**
	 * Get the normalized unit for a unit.
	 * @param unit
	 * @return
	 */
	public static String normalizeUnit(String unit) {
		return getConversion(unit).getUnit();
	}

	/**
	 * Query whether a unit describes a length.
	 * @param unit
	 * @return
	 */
	public static boolean isLengthUnit(String unit) {
		var conversion = getConversion(unit);
		return conversion.isRecognized() && NANOMETERS.equals(conversion.getUnit());
	}

	/**
	 * Convert a value to nanometers.
	 * @param value
	 * @param unit unit of the value; unrecognized or non-length units are assumed to be nm already
	 * @return
	 */
	public static double toNanometers(double value, String unit) {
		var conversion = getConversion(unit);
		if (conversion.isRecognized() && NANOMETERS.equals(conversion.getUnit()))
			return value * conversion.getFactor();
		return value;
	}

	/**
	 * Convert all values of an array into the normalized unit.
	 * @param array
	 * @param unit the unit of the input values
	 * @return the converted array (the input array if no conversion is needed)
	 */
	public static ChannelArray normalize(ChannelArray array, String unit) {
		return array.multiply(getConversion(unit).getFactor());
	}

	/**
	 * Conversion from a unit into its normalized unit.
	 */
	public static final class Conversion {

		private final String unit;
		private final double factor;
		private final boolean recognized;

		private Conversion(String unit, double factor, boolean recognized) {
			this.unit = unit;
			this.factor = factor;
			this.recognized = recognized;
		}

		/**
		 * The normalized unit.
		 * @return
		 */
		public String getUnit() {
			return unit;
		}

		/**
		 * The factor to multiply values by.
		 * @return
		 */
		public double getFactor() {
			return factor;
		}

		/**
		 * True if the input unit was recognized, false if it is passed through unchanged.
		 * @return
		 */
		public boolean isRecognized() {
			return recognized;
		}

		@Override
		public String toString() {
			return "x" + factor + " -> " + unit;
		}

		@Override
		public int hashCode() {
			return Objects.hash(unit, factor, recognized);
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj)
				return true;
			if (!(obj instanceof Conversion))
				return false;
			var other = (Conversion)obj;
			return unit.equals(other.unit) && Double.compare(factor, other.factor) == 0 && recognized == other.recognized;
		}

	}

	private static class ConversionTableBuilder {

		private final Map<String, Conversion> exact = new LinkedHashMap<>();
		private final Map<String, Conversion> lower = new LinkedHashMap<>();

		void add(String target, double factor, String... names) {
			var conversion = new Conversion(target, factor, true);
			for (var name : names) {
				exact.put(name, conversion);
				lower.putIfAbsent(name.toLowerCase(Locale.ROOT), conversion);
			}
		}

		Map<String, Conversion> build() {
			var builder = ImmutableMap.<String, Conversion>builder();
			builder.putAll(exact);
			for (var entry : lower.entrySet()) {
				if (!exact.containsKey(entry.getKey()))
					builder.put(entry.getKey(), entry.getValue());
			}
			return builder.build();
		}

	}

}
