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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import spmview.lib.common.LogTools;
import spmview.lib.images.ChannelArray;

/**
 * An ordered sequence of {@link FilterStep}s applied to a channel array.
 * <p>
 * Pipelines are immutable. Steps are looked up by name in {@link ChannelFilters} when the pipeline is applied;
 * steps that are unknown or that fail are skipped, leaving the array unchanged, and the remaining steps are still applied.
 */
public final class FilterPipeline {

	private static final Logger logger = LoggerFactory.getLogger(FilterPipeline.class);

	private static final FilterPipeline EMPTY = new FilterPipeline(ImmutableList.of());

	private final List<FilterStep> steps;
	private final FilterSignature signature;

	private FilterPipeline(List<FilterStep> steps) {
		this.steps = ImmutableList.copyOf(steps);
		this.signature = FilterSignature.of(this.steps);
	}

	/**
	 * Get a pipeline without any steps.
	 * @return
	 */
	public static FilterPipeline empty() {
		return EMPTY;
	}

	/**
	 * Create a pipeline from steps.
	 * @param steps
	 * @return
	 */
	public static FilterPipeline of(FilterStep... steps) {
		return of(Arrays.asList(steps));
	}

	/**
	 * Create a pipeline from a list of steps.
	 * @param steps
	 * @return
	 */
	public static FilterPipeline of(List<FilterStep> steps) {
		if (steps.isEmpty())
			return EMPTY;
		for (var step : steps)
			Objects.requireNonNull(step, "Filter steps must not be null");
		return new FilterPipeline(steps);
	}

	/**
	 * Create a new pipeline with an extra step added at the end.
	 * @param step
	 * @return
	 */
	public FilterPipeline append(FilterStep step) {
		var list = new ArrayList<>(steps);
		list.add(Objects.requireNonNull(step));
		return new FilterPipeline(list);
	}

	/**
	 * The steps, in the order they are applied.
	 * @return
	 */
	public List<FilterStep> getSteps() {
		return steps;
	}

	/**
	 * Query whether the pipeline has no steps.
	 * @return
	 */
	public boolean isEmpty() {
		return steps.isEmpty();
	}

	/**
	 * Get the cache identity of this pipeline.
	 * @return
	 */
	public FilterSignature getSignature() {
		return signature;
	}

	/**
	 * Apply all steps in order.
	 * @param input
	 * @return the filtered array, together with the outcome of each step
	 */
	public Output apply(ChannelArray input) {
		Objects.requireNonNull(input);
		var array = input;
		var results = new ArrayList<FilterStepResult>(steps.size());
		for (var step : steps) {
			var filter = ChannelFilters.getFilter(step.getName()).orElse(null);
			if (filter == null) {
				LogTools.warnOnce(logger, "Unknown filter '" + step.getName() + "' will be skipped");
				results.add(FilterStepResult.skipped(step, "Unknown filter"));
				continue;
			}
			try {
				array = Objects.requireNonNull(filter.apply(array, step), "Filter returned null");
				results.add(FilterStepResult.applied(step));
			} catch (RuntimeException e) {
				logger.warn("Skipping filter step {}: {}", step, e.getLocalizedMessage());
				logger.debug(e.getLocalizedMessage(), e);
				results.add(FilterStepResult.skipped(step, e.getLocalizedMessage()));
			}
		}
		return new Output(array, results);
	}

	@Override
	public String toString() {
		return "FilterPipeline " + signature;
	}

	@Override
	public int hashCode() {
		return signature.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FilterPipeline))
			return false;
		return signature.equals(((FilterPipeline)obj).signature);
	}

	/**
	 * The result of applying a pipeline.
	 */
	public static final class Output {

		private final ChannelArray array;
		private final List<FilterStepResult> results;

		private Output(ChannelArray array, List<FilterStepResult> results) {
			this.array = array;
			this.results = ImmutableList.copyOf(results);
		}

		/**
		 * The filtered array.
		 * @return
		 */
		public ChannelArray getArray() {
			return array;
		}

		/**
		 * The outcome of each step, in order.
		 * @return
		 */
		public List<FilterStepResult> getStepResults() {
			return results;
		}

		/**
		 * Number of steps that were skipped.
		 * @return
		 */
		public long getSkippedCount() {
			return results.stream().filter(r -> !r.isApplied()).count();
		}

	}

}
