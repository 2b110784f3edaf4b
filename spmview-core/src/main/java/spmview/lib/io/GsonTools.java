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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Helper class providing shared Gson instances.
 * <p>
 * Special floating point values (NaN, infinity) are serialized, and parsing is lenient
 * so that hand-edited cache files can still be read.
 */
public class GsonTools {

	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.disableHtmlEscaping()
			.setLenient();

	private static Gson gson = builder.create();

	private static Gson gsonPretty = builder.create().newBuilder().setPrettyPrinting().create();

	// Suppressed default constructor for non-instantiability
	private GsonTools() {
		throw new AssertionError();
	}

	/**
	 * Access the builder used with {@link #getInstance()}.
	 * Changes made to the builder are not reflected in existing instances;
	 * to derive a customized instance use {@code getInstance().newBuilder()}.
	 * @return
	 */
	public static GsonBuilder getDefaultBuilder() {
		return builder;
	}

	/**
	 * Get a default Gson instance.
	 * @return
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return gson;
	}

	/**
	 * Get a default Gson instance, optionally with pretty printing.
	 * @param pretty
	 * @return
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		return pretty ? gsonPretty : gson;
	}

}
