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

import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

import com.google.common.collect.ImmutableSortedMap;

import spmview.lib.common.GeneralTools;

/**
 * A single named step within a {@link FilterPipeline}, with named parameters.
 * <p>
 * Parameter values are either numbers or strings. Numbers are always stored as {@code Double},
 * so that a step created with {@code sigma=2} is identical to one created with {@code sigma=2.0}.
 * Parameters are kept sorted by name.
 */
public final class FilterStep {

	private final String name;
	private final SortedMap<String, Object> params;

	private FilterStep(String name, Map<String, ?> params) {
		if (GeneralTools.blankString(name, true))
			throw new IllegalArgumentException("Filter step name must not be blank");
		this.name = name.trim();
		var builder = ImmutableSortedMap.<String, Object>naturalOrder();
		for (var entry : params.entrySet()) {
			Objects.requireNonNull(entry.getKey(), "Parameter name must not be null");
			builder.put(entry.getKey(), normalizeValue(entry.getKey(), entry.getValue()));
		}
		this.params = builder.build();
	}

	private static Object normalizeValue(String key, Object value) {
		if (value instanceof Number)
			return ((Number)value).doubleValue();
		if (value instanceof String)
			return value;
		throw new IllegalArgumentException("Parameter " + key + " must be a number or a string, but was " + value);
	}

	/**
	 * Create a step without parameters.
	 * @param name
	 * @return
	 */
	public static FilterStep of(String name) {
		return new FilterStep(name, Map.of());
	}

	/**
	 * Create a step with parameters.
	 * @param name
	 * @param params numeric or string parameter values
	 * @return
	 */
	public static FilterStep of(String name, Map<String, ?> params) {
		return new FilterStep(name, params);
	}

	/**
	 * Create a step with a single parameter.
	 * @param name
	 * @param key
	 * @param value numeric or string value
	 * @return
	 */
	public static FilterStep of(String name, String key, Object value) {
		return new FilterStep(name, Map.of(key, value));
	}

	/**
	 * Name of the filter applied by this step.
	 * @return
	 */
	public String getName() {
		return name;
	}

	/**
	 * Parameters, sorted by name.
	 * @return an immutable map
	 */
	public SortedMap<String, Object> getParameters() {
		return params;
	}

	/**
	 * Get a numeric parameter.
	 * @param key
	 * @param defaultValue value to return if the parameter is missing
	 * @return
	 * @throws IllegalArgumentException if the parameter is present but not numeric
	 */
	public double getDouble(String key, double defaultValue) {
		Object value = params.get(key);
		if (value == null)
			return defaultValue;
		if (value instanceof Double)
			return (Double)value;
		var parsed = GeneralTools.parseDouble((String)value);
		if (parsed == null)
			throw new IllegalArgumentException("Parameter " + key + " is not a number: " + value);
		return parsed;
	}

	/**
	 * Get a string parameter.
	 * @param key
	 * @param defaultValue value to return if the parameter is missing
	 * @return
	 */
	public String getString(String key, String defaultValue) {
		Object value = params.get(key);
		return value == null ? defaultValue : value.toString();
	}

	@Override
	public String toString() {
		if (params.isEmpty())
			return name;
		var sb = new StringBuilder(name).append('(');
		boolean first = true;
		for (var entry : params.entrySet()) {
			if (!first)
				sb.append(", ");
			sb.append(entry.getKey()).append('=').append(entry.getValue());
			first = false;
		}
		return sb.append(')').toString();
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, params);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FilterStep))
			return false;
		var other = (FilterStep)obj;
		return name.equals(other.name) && params.equals(other.params);
	}

}
