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

import java.util.Objects;

/**
 * Outcome of applying one {@link FilterStep}: either it was applied, or it was skipped for a reason
 * (e.g. the filter is unknown, or it failed for this particular array).
 * A skipped step leaves its input unchanged and does not stop the rest of the pipeline.
 */
public abstract class FilterStepResult {

	private final FilterStep step;

	private FilterStepResult(FilterStep step) {
		this.step = Objects.requireNonNull(step);
	}

	/**
	 * Create a result for a step that was applied.
	 * @param step
	 * @return
	 */
	public static FilterStepResult applied(FilterStep step) {
		return new Applied(step);
	}

	/**
	 * Create a result for a step that was skipped.
	 * @param step
	 * @param reason
	 * @return
	 */
	public static FilterStepResult skipped(FilterStep step, String reason) {
		return new Skipped(step, reason);
	}

	/**
	 * The step this result refers to.
	 * @return
	 */
	public FilterStep getStep() {
		return step;
	}

	/**
	 * True if the step was applied, false if it was skipped.
	 * @return
	 */
	public abstract boolean isApplied();

	/**
	 * A step that was applied successfully.
	 */
	public static final class Applied extends FilterStepResult {

		private Applied(FilterStep step) {
			super(step);
		}

		@Override
		public boolean isApplied() {
			return true;
		}

		@Override
		public String toString() {
			return "Applied[" + getStep() + "]";
		}

	}

	/**
	 * A step that was skipped, leaving its input unchanged.
	 */
	public static final class Skipped extends FilterStepResult {

		private final String reason;

		private Skipped(FilterStep step, String reason) {
			super(step);
			this.reason = reason == null ? "" : reason;
		}

		/**
		 * Reason the step was skipped.
		 * @return
		 */
		public String getReason() {
			return reason;
		}

		@Override
		public boolean isApplied() {
			return false;
		}

		@Override
		public String toString() {
			return "Skipped[" + getStep() + ": " + reason + "]";
		}

	}

}
