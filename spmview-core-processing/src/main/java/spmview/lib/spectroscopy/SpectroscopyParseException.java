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

import java.io.IOException;

/**
 * Exception thrown when a spectroscopy file cannot be parsed.
 * The file is skipped; other files are unaffected.
 */
public class SpectroscopyParseException extends IOException {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor.
	 * @param message
	 */
	public SpectroscopyParseException(String message) {
		super(message);
	}

	/**
	 * Constructor.
	 * @param message
	 * @param cause
	 */
	public SpectroscopyParseException(String message, Throwable cause) {
		super(message, cause);
	}

}
