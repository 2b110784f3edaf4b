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

import java.nio.file.Path;
import java.util.List;

/**
 * Parser for spectroscopy files.
 * <p>
 * A file may contain a single sweep, or many (e.g. a spectroscopy matrix); implementations are supplied by the caller.
 */
@FunctionalInterface
public interface SpectroscopyParser {

	/**
	 * Parse all records from a file.
	 * @param path
	 * @return the records, possibly empty
	 * @throws SpectroscopyParseException if the file is malformed or cannot be read
	 */
	List<SpectroscopyRecord> parse(Path path) throws SpectroscopyParseException;

}
