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

package spmview.lib.io;

import java.nio.file.Path;

/**
 * Parser for the text header that accompanies each scan.
 * <p>
 * The header format is owned by the acquisition software; implementations are supplied by the caller.
 */
@FunctionalInterface
public interface HeaderParser {

	/**
	 * Parse a header file.
	 * @param path path to the header
	 * @return the scan-level fields and the fields of each channel
	 * @throws HeaderParseException if the file is malformed or cannot be read
	 */
	ParsedHeader parseHeader(Path path) throws HeaderParseException;

}
