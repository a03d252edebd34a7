package org.scriptonbasestar.echocache.engine;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.echocache.core.exception.SBRefreshLockException;
import org.scriptonbasestar.echocache.core.lock.ConcurrentMapLockRecordStore;
import org.scriptonbasestar.echocache.core.lock.RecordRefreshLock;
import org.scriptonbasestar.echocache.core.lock.RefreshLock;
import org.scriptonbasestar.echocache.core.store.StaleValue;
import org.scriptonbasestar.echocache.core.store.StaleWhileRevalidateStore;
import org.scriptonbasestar.echocache.engine.store.LocalStaleWhileRevalidateStore;
import org.scriptonbasestar.echocache.engine.store.MapCacheStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * LazyEchoCache stale-while-revalidate 테스트
 */
public class LazyEchoCacheTest {

	private static final Duration FRESHNESS = Duration.ofSeconds(5);

	private TestClock clock;
	private StaleWhileRevalidateStore<String> store;
	private LazyEchoCache<String> cache;

	@Before
	public void setUp() {
		clock = new TestClock(Instant.parse("2025-01-01T00:00:00Z"));
		store = MapCacheStore.staleWhileRevalidate();
		cache = newCache(store, 10);
	}

	@After
	public void tearDown() {
		cache.close();
	}

	private LazyEchoCache<String> newCache(StaleWhileRevalidateStore<String> target, int queueCapacity) {
		return LazyEchoCache.<String>builder()
			.store(target)
			.refreshTimeout(Duration.ofSeconds(2))
			.queueCapacity(queueCapacity)
			.clock(clock)
			.build();
	}

	private void putAged(String key, String value, Duration age) {
		store.set(key, StaleValue.of(value, clock.instant().minus(age)));
	}

	@Test
	public void testMissComputesSynchronously() {
		String value = cache.fetchWithLazyRefresh("k", ctx -> "computed", FRESHNESS);

		assertEquals("computed", value);
		Optional<StaleValue<String>> stored = store.get("k");
		assertTrue(stored.isPresent());
		assertEquals("computed", stored.get().getValue());
		assertEquals(clock.instant(), stored.get().getCreatedAt());
		assertEquals(1, cache.metrics().missCount());
	}

	@Test
	public void testFreshValueIsReturnedWithoutRefresh() throws Exception {
		putAged("k", "cached", Duration.ofSeconds(1));

		String value = cache.fetchWithLazyRefresh("k", ctx -> {
			throw new AssertionError("must not compute a fresh value");
		}, FRESHNESS);

		assertEquals("cached", value);
		assertEquals(1, cache.metrics().hitCount());
		assertEquals(0, cache.metrics().refreshEnqueuedCount());
	}

	@Test
	public void testValueExactlyAtFreshnessBoundaryIsFresh() {
		putAged("k", "cached", FRESHNESS);

		assertEquals("cached", cache.fetchWithLazyRefresh("k", ctx -> "new", FRESHNESS));
		assertEquals(1, cache.metrics().hitCount());
		assertEquals(0, cache.metrics().staleHitCount());
	}

	@Test(timeout = 10_000)
	public void testStaleValueIsReturnedAndRefreshedInBackground() throws Exception {
		putAged("k", "old", Duration.ofSeconds(10));
		CountDownLatch release = new CountDownLatch(1);

		String value = cache.fetchWithLazyRefresh("k", ctx -> {
			release.await();
			return "new";
		}, FRESHNESS);

		assertEquals("old", value);
		assertEquals(1, cache.metrics().staleHitCount());
		assertEquals(1, cache.metrics().refreshEnqueuedCount());

		release.countDown();
		Await.until(() -> "new".equals(store.get("k").get().getValue()), 5_000);
		assertEquals(clock.instant(), store.get("k").get().getCreatedAt());
		assertEquals("new", cache.fetchWithLazyRefresh("k", ctx -> "newer", FRESHNESS));
	}

	@Test(timeout = 10_000)
	public void testDuplicateRefreshIsNotQueued() throws Exception {
		putAged("k", "old", Duration.ofSeconds(10));
		CountDownLatch release = new CountDownLatch(1);
		AtomicInteger computeCount = new AtomicInteger();

		for (int i = 0; i < 3; i++) {
			cache.fetchWithLazyRefresh("k", ctx -> {
				computeCount.incrementAndGet();
				release.await();
				return "new";
			}, FRESHNESS);
		}
		assertEquals(1, cache.metrics().refreshEnqueuedCount());
		assertEquals(2, cache.metrics().refreshDuplicateCount());

		release.countDown();
		Await.until(() -> "new".equals(store.get("k").get().getValue()), 5_000);
		assertEquals(1, computeCount.get());
	}

	@Test(timeout = 10_000)
	public void testFullQueueDropsRefreshButServesStale() throws Exception {
		cache.close();
		cache = newCache(store, 1);
		putAged("a", "old-a", Duration.ofSeconds(10));
		putAged("b", "old-b", Duration.ofSeconds(10));
		putAged("c", "old-c", Duration.ofSeconds(10));
		CountDownLatch workerBusy = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);

		cache.fetchWithLazyRefresh("a", ctx -> {
			workerBusy.countDown();
			release.await();
			return "new-a";
		}, FRESHNESS);
		assertTrue(workerBusy.await(5, TimeUnit.SECONDS));

		assertEquals("old-b", cache.fetchWithLazyRefresh("b", ctx -> "new-b", FRESHNESS));
		assertEquals("old-c", cache.fetchWithLazyRefresh("c", ctx -> "new-c", FRESHNESS));

		assertEquals(2, cache.metrics().refreshEnqueuedCount());
		assertEquals(1, cache.metrics().refreshDroppedCount());

		release.countDown();
		Await.until(() -> "new-b".equals(store.get("b").get().getValue()), 5_000);
		assertEquals("old-c", store.get("c").get().getValue());
	}

	@Test(timeout = 10_000)
	public void testRefreshSkippedWhenLockHeldElsewhere() throws Exception {
		cache.close();
		AtomicInteger lockAttempts = new AtomicInteger();
		store = new LocalStaleWhileRevalidateStore<>(new MapCacheStore<>(), new RefreshLock() {
			@Override
			public boolean tryAcquireRefreshLock(String key, String token, Duration ttl) {
				lockAttempts.incrementAndGet();
				return false;
			}

			@Override
			public void releaseRefreshLock(String key, String token) {
				throw new AssertionError("lock was never acquired");
			}
		});
		cache = newCache(store, 10);
		putAged("k", "old", Duration.ofSeconds(10));
		AtomicInteger computeCount = new AtomicInteger();

		assertEquals("old", cache.fetchWithLazyRefresh("k", ctx -> "v" + computeCount.incrementAndGet(), FRESHNESS));

		Await.until(() -> cache.metrics().refreshLockSkipCount() == 1, 5_000);
		assertEquals(1, lockAttempts.get());
		assertEquals(0, computeCount.get());
		assertEquals("old", store.get("k").get().getValue());
	}

	@Test(timeout = 10_000)
	public void testRefreshSkippedWhenLockStoreFails() throws Exception {
		cache.close();
		store = new LocalStaleWhileRevalidateStore<>(new MapCacheStore<>(), new RefreshLock() {
			@Override
			public boolean tryAcquireRefreshLock(String key, String token, Duration ttl) {
				throw new SBRefreshLockException("lock backend unavailable");
			}

			@Override
			public void releaseRefreshLock(String key, String token) {
			}
		});
		cache = newCache(store, 10);
		putAged("k", "old", Duration.ofSeconds(10));
		AtomicInteger computeCount = new AtomicInteger();

		assertEquals("old", cache.fetchWithLazyRefresh("k", ctx -> "v" + computeCount.incrementAndGet(), FRESHNESS));

		Await.until(() -> cache.metrics().refreshLockSkipCount() == 1, 5_000);
		assertEquals(0, computeCount.get());
	}

	@Test(timeout = 10_000)
	public void testBackgroundRefreshHoldsAndReleasesLock() throws Exception {
		cache.close();
		ConcurrentMapLockRecordStore records = new ConcurrentMapLockRecordStore();
		RecordRefreshLock lock = new RecordRefreshLock(records, clock);
		store = new LocalStaleWhileRevalidateStore<>(new MapCacheStore<>(), lock);
		cache = newCache(store, 10);
		putAged("k", "old", Duration.ofSeconds(10));
		AtomicBoolean lockedDuringCompute = new AtomicBoolean();
		AtomicBoolean deadlineSet = new AtomicBoolean();

		cache.fetchWithLazyRefresh("k", ctx -> {
			lockedDuringCompute.set(records.get(RecordRefreshLock.lockKey("k")).isPresent());
			deadlineSet.set(ctx.remaining().isPresent());
			return "new";
		}, FRESHNESS);

		Await.until(() -> "new".equals(store.get("k").get().getValue()), 5_000);
		Await.until(() -> records.size() == 0, 5_000);
		assertTrue(lockedDuringCompute.get());
		assertTrue(deadlineSet.get());
	}

	@Test(timeout = 10_000)
	public void testForegroundMissDoesNotTakeLock() {
		cache.close();
		store = new LocalStaleWhileRevalidateStore<>(new MapCacheStore<>(), new RefreshLock() {
			@Override
			public boolean tryAcquireRefreshLock(String key, String token, Duration ttl) {
				throw new AssertionError("foreground path must not lock");
			}

			@Override
			public void releaseRefreshLock(String key, String token) {
				throw new AssertionError("foreground path must not lock");
			}
		});
		cache = newCache(store, 10);

		assertEquals("v", cache.fetchWithLazyRefresh("k", ctx -> "v", FRESHNESS));
	}

	@Test(timeout = 10_000)
	public void testBackgroundFailureKeepsStaleValue() throws Exception {
		putAged("k", "old", Duration.ofSeconds(10));

		cache.fetchWithLazyRefresh("k", ctx -> {
			throw new IllegalStateException("upstream 500");
		}, FRESHNESS);

		Await.until(() -> cache.metrics().refreshFailureCount() == 1, 5_000);
		assertEquals("old", store.get("k").get().getValue());

		// next stale read schedules another attempt
		Await.until(() -> {
			cache.fetchWithLazyRefresh("k", ctx -> "new", FRESHNESS);
			return "new".equals(store.get("k").get().getValue());
		}, 5_000);
	}

	@Test(timeout = 10_000)
	public void testBackgroundErrorKeepsWorkerAlive() throws Exception {
		putAged("a", "old-a", Duration.ofSeconds(10));
		putAged("b", "old-b", Duration.ofSeconds(10));

		cache.fetchWithLazyRefresh("a", ctx -> {
			throw new AssertionError("compute must fail loudly");
		}, FRESHNESS);
		Await.until(() -> cache.metrics().refreshFailureCount() == 1, 5_000);

		assertEquals("old-b", cache.fetchWithLazyRefresh("b", ctx -> "new-b", FRESHNESS));

		Await.until(() -> "new-b".equals(store.get("b").get().getValue()), 5_000);
		assertEquals("old-a", store.get("a").get().getValue());
	}

	@Test(timeout = 10_000)
	public void testShutdownStopsRefreshButKeepsServing() {
		putAged("k", "old", Duration.ofSeconds(10));
		cache.shutdownLazyRefresh();
		cache.shutdownLazyRefresh();

		assertTrue(cache.isShutdown());
		assertEquals("old", cache.fetchWithLazyRefresh("k", ctx -> "new", FRESHNESS));
		assertEquals(0, cache.metrics().refreshEnqueuedCount());
		assertEquals("computed", cache.fetchWithLazyRefresh("other", ctx -> "computed", FRESHNESS));
	}

	@Test(timeout = 10_000)
	public void testShutdownCancelsRunningRefresh() throws Exception {
		putAged("k", "old", Duration.ofSeconds(10));
		CountDownLatch started = new CountDownLatch(1);
		AtomicBoolean cancelledSeen = new AtomicBoolean();

		cache.fetchWithLazyRefresh("k", ctx -> {
			started.countDown();
			while (!ctx.isCancelled()) {
				Thread.onSpinWait();
			}
			cancelledSeen.set(true);
			ctx.throwIfCancelled();
			return "new";
		}, FRESHNESS);
		assertTrue(started.await(5, TimeUnit.SECONDS));

		cache.close();

		Await.until(cancelledSeen::get, 5_000);
		assertEquals("old", store.get("k").get().getValue());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeFreshnessRejected() {
		cache.fetchWithLazyRefresh("k", ctx -> "v", Duration.ofSeconds(-1));
	}

	@Test(expected = IllegalStateException.class)
	public void testBuilderRequiresStore() {
		LazyEchoCache.<String>builder().build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonPositiveRefreshTimeoutRejected() {
		LazyEchoCache.<String>builder().store(store).refreshTimeout(Duration.ZERO).build();
	}
}
