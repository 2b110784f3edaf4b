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

package spmview.lib.images.stores;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableSet;

/**
 * Defines which cache entries should be removed by an invalidation.
 * <p>
 * Entries are always matched exactly by their key; invalidating one file never removes entries belonging to another.
 */
public abstract class InvalidationScope {

	private static final InvalidationScope ALL = new AllScope();

	InvalidationScope() {}

	/**
	 * Scope covering every cache entry.
	 * @return
	 */
	public static InvalidationScope all() {
		return ALL;
	}

	/**
	 * Scope covering the entries of specific scans, identified by their header paths.
	 * @param headerPaths
	 * @return
	 */
	public static InvalidationScope files(Collection<Path> headerPaths) {
		Set<Path> paths = headerPaths.stream()
				.map(p -> p.toAbsolutePath().normalize())
				.collect(Collectors.toCollection(LinkedHashSet::new));
		return new FileScope(ImmutableSet.copyOf(paths));
	}

	/**
	 * Scope covering the entries of specific scans, identified by their header paths.
	 * @param headerPaths
	 * @return
	 */
	public static InvalidationScope files(Path... headerPaths) {
		return files(Arrays.asList(headerPaths));
	}

	/**
	 * Scope covering all entries whose binary channel file lies within a directory.
	 * @param directory
	 * @return
	 */
	public static InvalidationScope directory(Path directory) {
		return new DirectoryScope(directory.toAbsolutePath().normalize());
	}

	/**
	 * Test whether a cache entry falls within this scope.
	 * @param headerPath normalized header path of the entry
	 * @param binaryPath normalized binary file path of the entry
	 * @return
	 */
	public abstract boolean matches(Path headerPath, Path binaryPath);

	/**
	 * Test whether a raw channel key falls within this scope.
	 * @param key
	 * @return
	 */
	public boolean matches(RawChannelKey key) {
		return matches(key.getHeaderPath(), key.getBinaryPath());
	}

	/**
	 * Query whether this scope covers everything.
	 * @return
	 */
	public boolean isAll() {
		return false;
	}

	private static class AllScope extends InvalidationScope {

		@Override
		public boolean matches(Path headerPath, Path binaryPath) {
			return true;
		}

		@Override
		public boolean isAll() {
			return true;
		}

		@Override
		public String toString() {
			return "InvalidationScope[all]";
		}

	}

	private static class FileScope extends InvalidationScope {

		private final Set<Path> headerPaths;

		FileScope(Set<Path> headerPaths) {
			this.headerPaths = headerPaths;
		}

		@Override
		public boolean matches(Path headerPath, Path binaryPath) {
			return headerPaths.contains(headerPath);
		}

		@Override
		public String toString() {
			return "InvalidationScope[files=" + headerPaths + "]";
		}

	}

	private static class DirectoryScope extends InvalidationScope {

		private final Path directory;

		DirectoryScope(Path directory) {
			this.directory = Objects.requireNonNull(directory);
		}

		@Override
		public boolean matches(Path headerPath, Path binaryPath) {
			return binaryPath != null && binaryPath.startsWith(directory);
		}

		@Override
		public String toString() {
			return "InvalidationScope[directory=" + directory + "]";
		}

	}

}
