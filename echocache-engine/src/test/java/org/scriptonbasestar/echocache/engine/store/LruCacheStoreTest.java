package org.scriptonbasestar.echocache.engine.store;

import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.*;

public class LruCacheStoreTest {

	@Test
	public void testEvictsLeastRecentlyUsed() {
		LruCacheStore<String> store = new LruCacheStore<>(2);
		store.set("a", "1");
		store.set("b", "2");

		// touch a so b becomes eldest
		store.get("a");
		store.set("c", "3");

		assertEquals(2, store.size());
		assertEquals(Optional.of("1"), store.get("a"));
		assertFalse(store.get("b").isPresent());
		assertEquals(Optional.of("3"), store.get("c"));
	}

	@Test
	public void testOverwriteKeepsSize() {
		LruCacheStore<String> store = new LruCacheStore<>(2);
		store.set("a", "1");
		store.set("a", "2");

		assertEquals(1, store.size());
		assertEquals(Optional.of("2"), store.get("a"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullValueRejected() {
		new LruCacheStore<String>(1).set("a", null);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testZeroSizeRejected() {
		new LruCacheStore<String>(0);
	}
}
