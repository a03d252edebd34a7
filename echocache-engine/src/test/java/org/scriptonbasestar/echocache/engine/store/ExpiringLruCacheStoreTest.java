package org.scriptonbasestar.echocache.engine.store;

import org.junit.Test;
import org.scriptonbasestar.echocache.engine.TestClock;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.Assert.*;

public class ExpiringLruCacheStoreTest {

	private final TestClock clock = new TestClock(Instant.parse("2025-01-01T00:00:00Z"));

	@Test
	public void testEntryExpiresAfterTtl() {
		ExpiringLruCacheStore<String> store = new ExpiringLruCacheStore<>(10, Duration.ofSeconds(30), clock);
		store.set("a", "1");

		clock.advance(Duration.ofSeconds(30));
		assertEquals(Optional.of("1"), store.get("a"));

		clock.advance(Duration.ofMillis(1));
		assertFalse(store.get("a").isPresent());
		assertEquals(0, store.size());
	}

	@Test
	public void testRewriteRestartsTtl() {
		ExpiringLruCacheStore<String> store = new ExpiringLruCacheStore<>(10, Duration.ofSeconds(30), clock);
		store.set("a", "1");
		clock.advance(Duration.ofSeconds(20));
		store.set("a", "2");
		clock.advance(Duration.ofSeconds(20));

		assertEquals(Optional.of("2"), store.get("a"));
	}

	@Test
	public void testSizeBound() {
		ExpiringLruCacheStore<String> store = new ExpiringLruCacheStore<>(1, Duration.ofMinutes(1), clock);
		store.set("a", "1");
		store.set("b", "2");

		assertFalse(store.get("a").isPresent());
		assertEquals(Optional.of("2"), store.get("b"));
	}
}
