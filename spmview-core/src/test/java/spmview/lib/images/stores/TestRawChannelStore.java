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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import spmview.lib.images.ChannelArray;
import spmview.lib.io.ChannelDecodeException;

@SuppressWarnings("javadoc")
public class TestRawChannelStore {

	private static RawChannelKey key(String name, int channel, long modified) {
		Path header = Path.of("data", name + ".txt");
		Path binary = Path.of("data", name + "_" + channel + ".bin");
		return new RawChannelKey(header, binary, channel, modified, 100L);
	}

	private static ChannelDecoder countingDecoder(AtomicInteger counter) {
		return key -> {
			counter.incrementAndGet();
			return ChannelArray.wrap(new double[] {key.getChannelIndex(), key.getLastModified()}, 2, 1);
		};
	}

	@Test
	public void test_decodeOnce() throws Exception {
		var store = new RawChannelStore(4);
		var counter = new AtomicInteger();
		var key = key("scan", 0, 1000L);
		var first = store.getOrDecode(key, countingDecoder(counter));
		var second = store.getOrDecode(key, countingDecoder(counter));
		assertSame(first, second);
		assertEquals(1, counter.get());
		assertTrue(store.getIfPresent(key).isPresent());
	}

	@Test
	public void test_newVersionDecodedAgain() throws Exception {
		var store = new RawChannelStore(4);
		var counter = new AtomicInteger();
		var oldKey = key("scan", 0, 1000L);
		var newKey = key("scan", 0, 2000L);
		assertNotEquals(oldKey, newKey);
		assertTrue(oldKey.isSameChannel(newKey));

		store.getOrDecode(oldKey, countingDecoder(counter));
		var array = store.getOrDecode(newKey, countingDecoder(counter));
		assertEquals(2, counter.get());
		assertEquals(2000.0, array.getValue(1, 0));

		// Only the latest version is kept
		assertEquals(1, store.size());
		assertFalse(store.getIfPresent(oldKey).isPresent());
		assertTrue(store.getIfPresent(newKey).isPresent());
	}

	@Test
	public void test_olderVersionArrivesLate() throws Exception {
		var store = new RawChannelStore(4);
		var oldKey = key("scan", 0, 1000L);
		var newKey = key("scan", 0, 2000L);
		var newArray = ChannelArray.wrap(new double[] {2, 2}, 2, 1);

		assertTrue(store.put(newKey, newArray));
		assertFalse(store.put(oldKey, ChannelArray.wrap(new double[] {1, 1}, 2, 1)));
		assertEquals(List.of(newKey), store.getKeys());
		assertSame(newArray, store.getIfPresent(newKey).get());

		// Other channels of the same file are unaffected
		assertTrue(store.put(key("scan", 1, 1000L), newArray));
		assertEquals(2, store.size());
		assertTrue(newKey.isNewerVersionOf(oldKey));
		assertFalse(oldKey.isNewerVersionOf(newKey));
		assertFalse(newKey.isNewerVersionOf(key("scan", 1, 1000L)));
	}

	@Test
	public void test_failureNotCached() throws Exception {
		var store = new RawChannelStore(4);
		var key = key("broken", 0, 1000L);
		assertThrows(ChannelDecodeException.class, () -> store.getOrDecode(key, k -> {
			throw new ChannelDecodeException("Channel file not found");
		}));
		assertEquals(0, store.size());

		var counter = new AtomicInteger();
		store.getOrDecode(key, countingDecoder(counter));
		assertEquals(1, counter.get());
		assertEquals(1, store.size());
	}

	@Test
	public void test_lruEviction() throws Exception {
		int capacity = 3;
		var store = new RawChannelStore(capacity);
		var counter = new AtomicInteger();
		var keys = new ArrayList<RawChannelKey>();
		for (int i = 0; i < 5; i++)
			keys.add(key("scan" + i, 0, 1000L));

		store.getOrDecode(keys.get(0), countingDecoder(counter));
		store.getOrDecode(keys.get(1), countingDecoder(counter));
		store.getOrDecode(keys.get(2), countingDecoder(counter));
		// Touch the first key, so the second is least recently used
		store.getOrDecode(keys.get(0), countingDecoder(counter));
		store.getOrDecode(keys.get(3), countingDecoder(counter));
		store.getOrDecode(keys.get(4), countingDecoder(counter));

		assertEquals(capacity, store.size());
		assertEquals(5, counter.get());
		assertEquals(List.of(keys.get(0), keys.get(3), keys.get(4)), store.getKeys());
	}

	@Test
	public void test_concurrentAccess() throws Exception {
		int capacity = 4;
		int nThreads = 8;
		var store = new RawChannelStore(capacity);
		var expected = new LinkedHashMap<RawChannelKey, ChannelArray>();
		for (int i = 0; i < 12; i++)
			expected.put(key("scan" + i, i % 3, 1000L + i), ChannelArray.wrap(new double[] {i, -i, i * 0.5}, 3, 1));
		var keys = new ArrayList<>(expected.keySet());
		ChannelDecoder decoder = k -> ChannelArray.wrap(expected.get(k).getArray(false), 3, 1);

		var pool = Executors.newFixedThreadPool(nThreads);
		try {
			var futures = new ArrayList<Future<?>>();
			for (int t = 0; t < nThreads; t++) {
				int offset = t;
				futures.add(pool.submit(() -> {
					for (int i = 0; i < 500; i++) {
						var key = keys.get((i * 7 + offset) % keys.size());
						var array = store.getOrDecode(key, decoder);
						assertTrue(array.contentEquals(expected.get(key)));
						if (i % 5 == 0)
							store.put(key, decoder.decode(key));
						assertTrue(store.size() <= capacity);
					}
					return null;
				}));
			}
			for (var future : futures)
				future.get(30, TimeUnit.SECONDS);
		} finally {
			pool.shutdownNow();
		}
		assertTrue(store.size() <= capacity);
		for (var key : store.getKeys())
			assertTrue(store.getIfPresent(key).get().contentEquals(expected.get(key)));
	}

	@Test
	public void test_invalidateFile() throws Exception {
		var store = new RawChannelStore(8);
		var counter = new AtomicInteger();
		var a0 = key("a", 0, 1000L);
		var a1 = key("a", 1, 1000L);
		var b0 = key("b", 0, 1000L);
		for (var k : List.of(a0, a1, b0))
			store.getOrDecode(k, countingDecoder(counter));

		int n = store.invalidate(InvalidationScope.files(a0.getHeaderPath()));
		assertEquals(2, n);
		assertEquals(List.of(b0), store.getKeys());
	}

	@Test
	public void test_forChannel(@TempDir Path dir) throws Exception {
		var scan = ChannelFixtures.createScan(dir, "scan", 2, 2, new double[] {1, 2, 3, 4});
		var binary = scan.getBinaryPath(0);
		ChannelFixtures.touch(binary, 10_000L);
		var key1 = RawChannelKey.forChannel(scan, 0);
		assertEquals(10_000L, key1.getLastModified());
		assertEquals(16L, key1.getFileSize());
		assertEquals(binary, key1.getBinaryPath());

		ChannelFixtures.touch(binary, 20_000L);
		var key2 = RawChannelKey.forChannel(scan, 0);
		assertNotEquals(key1, key2);

		var store = new RawChannelStore(2);
		var counter = new AtomicInteger();
		store.getOrDecode(key1, countingDecoder(counter));
		store.getOrDecode(key2, countingDecoder(counter));
		assertEquals(2, counter.get());
	}

}
