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

package spmview.lib.common;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static methods for creating worker threads.
 */
public class ThreadTools {

	private static final Logger logger = LoggerFactory.getLogger(ThreadTools.class);

	// Suppressed default constructor for non-instantiability
	private ThreadTools() {
		throw new AssertionError();
	}

	/**
	 * Create a thread factory for workers named {@code prefix1, prefix2...}.
	 * Exceptions that escape a worker are logged rather than printed to the console.
	 *
	 * @param prefix
	 * @param daemon true if the threads should not prevent the JVM from exiting
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon) {
		var counter = new AtomicInteger(1);
		return r -> {
			var thread = new Thread(r, prefix + counter.getAndIncrement());
			thread.setDaemon(daemon);
			thread.setUncaughtExceptionHandler((t, e) -> logger.error("Uncaught exception in " + t.getName(), e));
			return thread;
		};
	}

	/**
	 * Get the default number of render workers: the number of processors, clipped to lie between 2 and 6.
	 * @return
	 */
	public static int getDefaultWorkerCount() {
		return Math.max(2, Math.min(6, Runtime.getRuntime().availableProcessors()));
	}

}
