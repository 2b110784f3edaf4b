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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Helper class for logging.
 * <p>
 * Unknown filters and colormaps are usually requested for every file in a folder,
 * so their warnings are only logged the first time.
 */
public class LogTools {

	private static final Set<String> loggedOnce = ConcurrentHashMap.newKeySet();

	// Suppressed default constructor for non-instantiability
	private LogTools() {
		throw new AssertionError();
	}

	/**
	 * Log a message, unless the same logger has already logged it at the same level.
	 * @param logger
	 * @param level
	 * @param message
	 * @return true if the message was logged
	 */
	public static boolean logOnce(Logger logger, Level level, String message) {
		if (!loggedOnce.add(logger.getName() + "|" + level + "|" + message))
			return false;
		logger.atLevel(level).log(message);
		return true;
	}

	/**
	 * Log a warning, unless the same logger has already logged it.
	 * @param logger
	 * @param message
	 * @return true if the message was logged
	 */
	public static boolean warnOnce(Logger logger, String message) {
		return logOnce(logger, Level.WARN, message);
	}

	/**
	 * Forget which messages have been logged, so that they will be logged again.
	 */
	public static void resetLoggedOnce() {
		loggedOnce.clear();
	}

}
