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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

@SuppressWarnings("javadoc")
public class TestLogTools {

	@Test
	public void test_logOnce() {
		var logger = LoggerFactory.getLogger(TestLogTools.class);
		var other = LoggerFactory.getLogger("spmview.test.other");
		LogTools.resetLoggedOnce();
		assertTrue(LogTools.warnOnce(logger, "Unknown filter 'x'"));
		assertFalse(LogTools.warnOnce(logger, "Unknown filter 'x'"));
		assertTrue(LogTools.warnOnce(logger, "Unknown filter 'y'"));
		// Different logger or level
		assertTrue(LogTools.warnOnce(other, "Unknown filter 'x'"));
		assertTrue(LogTools.logOnce(logger, Level.DEBUG, "Unknown filter 'x'"));

		LogTools.resetLoggedOnce();
		assertTrue(LogTools.warnOnce(logger, "Unknown filter 'x'"));
	}

}
