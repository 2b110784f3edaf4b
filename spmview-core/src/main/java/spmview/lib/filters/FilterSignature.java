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

import java.util.List;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

/**
 * Identity of a {@link FilterPipeline} for caching purposes.
 * <p>
 * Two pipelines have equal signatures if they contain equal steps in the same order,
 * regardless of how they were built. Since filters are deterministic, equal signatures imply equal output.
 */
public final class FilterSignature {

	/**
	 * Signature of a pipeline that makes no changes.
	 */
	public static final FilterSignature EMPTY = new FilterSignature(ImmutableList.of());

	private final List<FilterStep> steps;

	private FilterSignature(List<FilterStep> steps) {
		this.steps = steps;
	}

	static FilterSignature of(List<FilterStep> steps) {
		if (steps.isEmpty())
			return EMPTY;
		return new FilterSignature(ImmutableList.copyOf(steps));
	}

	/**
	 * Query whether this is the signature of an empty pipeline.
	 * @return
	 */
	public boolean isEmpty() {
		return steps.isEmpty();
	}

	/**
	 * The steps that make up the signature, in order.
	 * @return
	 */
	public List<FilterStep> getSteps() {
		return steps;
	}

	@Override
	public String toString() {
		if (steps.isEmpty())
			return "[]";
		return steps.stream().map(FilterStep::toString).collect(Collectors.joining(" | ", "[", "]"));
	}

	@Override
	public int hashCode() {
		return steps.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FilterSignature))
			return false;
		return steps.equals(((FilterSignature)obj).steps);
	}

}
