package org.scriptonbasestar.echocache.engine;

import org.scriptonbasestar.echocache.core.exception.SBCacheComputeException;
import org.scriptonbasestar.echocache.core.refresh.RefreshContext;
import org.scriptonbasestar.echocache.core.refresh.RefreshFunction;
import org.scriptonbasestar.echocache.core.store.StaleValue;
import org.scriptonbasestar.echocache.core.store.StaleWhileRevalidateStore;
import org.scriptonbasestar.echocache.core.util.TimeCheckerUtil;
import org.scriptonbasestar.echocache.engine.flight.SingleFlight;
import org.scriptonbasestar.echocache.engine.flight.SingleFlightResult;
import org.scriptonbasestar.echocache.engine.metrics.EngineMetrics;
import org.scriptonbasestar.echocache.engine.queue.EnqueueResult;
import org.scriptonbasestar.echocache.engine.queue.RefreshTask;
import org.scriptonbasestar.echocache.engine.queue.RefreshTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stale-while-revalidate engine.
 * <p>
 * A cached value younger than the caller's freshness window is returned as is. An older one is
 * still returned immediately, and a background refresh is queued for its key. Only a missing value
 * is computed on the caller's thread.
 * </p>
 *
 * <h3>Per-key states:</h3>
 * <pre>
 * Absent  --miss, compute synchronously-->        Fresh
 * Fresh   --age exceeds freshness window-->       Stale
 * Stale   --read: return value, enqueue task-->   Refreshing
 * Refreshing --worker writes new value-->         Fresh
 * </pre>
 *
 * <h3>Background refresh:</h3>
 * <ol>
 *   <li>the worker takes the store's refresh lock with the task's request id as token; if another
 *       process holds it (or the lock store fails) the refresh is skipped</li>
 *   <li>the value is computed under a context that expires after {@code refreshTimeout}, through the
 *       same single-flight group as foreground misses</li>
 *   <li>only the round's owner writes the result back, timestamped with the compute completion time</li>
 *   <li>the lock is released</li>
 * </ol>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * try (LazyEchoCache<Product> cache = LazyEchoCache.<Product>builder()
 *         .store(LruCacheStore.staleWhileRevalidate(10_000))
 *         .refreshTimeout(Duration.ofSeconds(5))
 *         .build()) {
 *
 *     Product p = cache.fetchWithLazyRefresh("product:" + id,
 *         ctx -> productClient.fetch(id), Duration.ofMinutes(1));
 * }
 * }</pre>
 *
 * <p>
 * Queue overflow drops the refresh and logs a warning; the caller has already got the stale value.
 * </p>
 *
 * @param <T> the value type
 * @since 2025-01
 */
public class LazyEchoCache<T> implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(LazyEchoCache.class);

	public static final Duration DEFAULT_REFRESH_TIMEOUT = Duration.ofSeconds(30);
	public static final int DEFAULT_QUEUE_CAPACITY = 1000;
	public static final int DEFAULT_WORKER_THREADS = 1;
	public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

	private final StaleWhileRevalidateStore<T> store;
	private final SingleFlight<T> singleFlight;
	private final RefreshTaskQueue<T> refreshQueue;
	private final RefreshContext engineContext;
	private final Duration refreshTimeout;
	private final Duration refreshLockTtl;
	private final Clock clock;
	private final EngineMetrics metrics;
	private final AtomicBoolean shutdown = new AtomicBoolean(false);

	public LazyEchoCache(StaleWhileRevalidateStore<T> store, Duration refreshTimeout) {
		this(store, refreshTimeout, refreshTimeout, DEFAULT_QUEUE_CAPACITY, DEFAULT_WORKER_THREADS,
			DEFAULT_SHUTDOWN_TIMEOUT, Clock.systemUTC(), new EngineMetrics());
	}

	protected LazyEchoCache(StaleWhileRevalidateStore<T> store, Duration refreshTimeout, Duration refreshLockTtl,
							int queueCapacity, int workerThreads, Duration shutdownTimeout,
							Clock clock, EngineMetrics metrics) {
		if (store == null) {
			throw new IllegalArgumentException("StaleWhileRevalidateStore must not be null");
		}
		requirePositive(refreshTimeout, "refreshTimeout");
		requirePositive(refreshLockTtl, "refreshLockTtl");
		if (clock == null) {
			throw new IllegalArgumentException("Clock must not be null");
		}
		if (metrics == null) {
			throw new IllegalArgumentException("EngineMetrics must not be null");
		}
		this.store = store;
		this.refreshTimeout = refreshTimeout;
		this.refreshLockTtl = refreshLockTtl;
		this.clock = clock;
		this.metrics = metrics;
		this.singleFlight = new SingleFlight<>(clock);
		this.engineContext = RefreshContext.background();
		this.refreshQueue = new RefreshTaskQueue<>(queueCapacity, workerThreads, shutdownTimeout, this::refreshInBackground);
		log.debug("LazyEchoCache started: refreshTimeout={}, refreshLockTtl={}", refreshTimeout, refreshLockTtl);
	}

	public static <T> Builder<T> builder() {
		return new Builder<>();
	}

	/**
	 * LazyEchoCache Builder
	 *
	 * @param <T> 값 타입
	 */
	public static class Builder<T> {
		private StaleWhileRevalidateStore<T> store;
		private Duration refreshTimeout = DEFAULT_REFRESH_TIMEOUT;
		private Duration refreshLockTtl = null; // 기본값: refreshTimeout
		private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
		private int workerThreads = DEFAULT_WORKER_THREADS;
		private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
		private Clock clock = Clock.systemUTC();
		private EngineMetrics metrics = null;

		public Builder<T> store(StaleWhileRevalidateStore<T> store) {
			this.store = store;
			return this;
		}

		/**
		 * 백그라운드 갱신 한 건에 허용되는 시간
		 */
		public Builder<T> refreshTimeout(Duration refreshTimeout) {
			this.refreshTimeout = refreshTimeout;
			return this;
		}

		/**
		 * 분산 refresh lock 의 TTL. 이 시간이 지나도록 해제되지 않은 잠금은 버려진 것으로 봅니다.
		 */
		public Builder<T> refreshLockTtl(Duration refreshLockTtl) {
			this.refreshLockTtl = refreshLockTtl;
			return this;
		}

		/**
		 * 대기 중인 갱신 작업의 최대 개수. 초과분은 버려집니다.
		 */
		public Builder<T> queueCapacity(int queueCapacity) {
			this.queueCapacity = queueCapacity;
			return this;
		}

		public Builder<T> workerThreads(int workerThreads) {
			this.workerThreads = workerThreads;
			return this;
		}

		public Builder<T> shutdownTimeout(Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		public Builder<T> clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder<T> metrics(EngineMetrics metrics) {
			this.metrics = metrics;
			return this;
		}

		public LazyEchoCache<T> build() {
			if (store == null) {
				throw new IllegalStateException("store must be set");
			}
			return new LazyEchoCache<>(store, refreshTimeout,
				refreshLockTtl != null ? refreshLockTtl : refreshTimeout,
				queueCapacity, workerThreads, shutdownTimeout, clock,
				metrics != null ? metrics : new EngineMetrics());
		}
	}

	/**
	 * 취소되지 않는 컨텍스트로 {@link #fetchWithLazyRefresh(RefreshContext, String, RefreshFunction, Duration)} 을 호출합니다.
	 */
	public T fetchWithLazyRefresh(String key, RefreshFunction<T> refreshFn, Duration freshness) {
		return fetchWithLazyRefresh(RefreshContext.background(), key, refreshFn, freshness);
	}

	/**
	 * Returns the cached value, scheduling a background refresh when it is older than {@code freshness}.
	 * A missing value is computed synchronously under {@code ctx}.
	 *
	 * @param ctx context for the synchronous computation of a missing value
	 * @param key cache key
	 * @param refreshFn computes the value
	 * @param freshness age after which a cached value is refreshed in the background
	 * @return the cached (possibly stale) or freshly computed value
	 * @throws RuntimeException unchecked failure of {@code refreshFn} on a miss, as thrown
	 * @throws SBCacheComputeException checked failure of {@code refreshFn} on a miss
	 */
	public T fetchWithLazyRefresh(RefreshContext ctx, String key, RefreshFunction<T> refreshFn, Duration freshness) {
		if (refreshFn == null) {
			throw new IllegalArgumentException("RefreshFunction must not be null");
		}
		if (freshness == null || freshness.isNegative()) {
			throw new IllegalArgumentException("freshness must not be null or negative");
		}
		log.trace("fetchWithLazyRefresh - key : {}, freshness : {}", key, freshness);

		Optional<StaleValue<T>> cached = readQuietly(key);
		if (cached.isPresent()) {
			StaleValue<T> entry = cached.get();
			if (TimeCheckerUtil.isFresh(entry.getCreatedAt(), freshness, clock)) {
				metrics.recordHit();
			} else {
				metrics.recordStaleHit();
				scheduleRefresh(key, refreshFn);
			}
			return entry.getValue();
		}
		metrics.recordMiss();

		return computeAndStore(RefreshTask.of(key, refreshFn), ctx).getValue();
	}

	private void scheduleRefresh(String key, RefreshFunction<T> refreshFn) {
		EnqueueResult result = refreshQueue.offer(RefreshTask.of(key, refreshFn));
		switch (result) {
			case ACCEPTED:
				metrics.recordRefreshEnqueued();
				log.debug("Stale value, refresh queued - key : {}", key);
				break;
			case DUPLICATE:
				metrics.recordRefreshDuplicate();
				log.trace("Refresh already pending - key : {}", key);
				break;
			case QUEUE_FULL:
				metrics.recordRefreshDropped();
				log.warn("Refresh queue is full, task dropped - key : {}", key);
				break;
			case CLOSED:
				log.debug("Refresh queue closed, serving stale value without refresh - key : {}", key);
				break;
			default:
				throw new IllegalStateException("Unknown enqueue result: " + result);
		}
	}

	private SingleFlightResult<T> computeAndStore(RefreshTask<T> task, RefreshContext ctx) {
		SingleFlightResult<T> result = singleFlight.execute(task.getKey(), task.getRequestId(), ctx,
			Computations.timed(task.getFunction(), metrics));

		if (result.isOwnedBy(task.getRequestId())) {
			writeQuietly(task.getKey(), result);
		} else {
			metrics.recordSharedResult();
		}
		return result;
	}

	/**
	 * Runs on a refresh worker thread.
	 */
	void refreshInBackground(RefreshTask<T> task) {
		String key = task.getKey();
		String token = task.getRequestId();

		boolean locked;
		try {
			locked = store.tryAcquireRefreshLock(key, token, refreshLockTtl);
		} catch (RuntimeException e) {
			metrics.recordRefreshLockSkip();
			log.warn("Cannot acquire refresh lock, skipping refresh - key : {}", key, e);
			return;
		}
		if (!locked) {
			metrics.recordRefreshLockSkip();
			log.debug("Refresh lock held elsewhere, skipping refresh - key : {}", key);
			return;
		}

		RefreshContext taskContext = engineContext.withTimeout(refreshTimeout);
		try {
			computeAndStore(task, taskContext);
			log.trace("Background refresh completed - key : {}", key);
		} catch (RuntimeException | Error e) {
			metrics.recordRefreshFailure();
			log.error("Background refresh failed - key : {}", key, e);
		} finally {
			taskContext.cancel();
			releaseQuietly(key, token);
		}
	}

	/**
	 * Stops background refreshing. Queued tasks are discarded and running ones are interrupted.
	 * Reads keep working: stale values are served without refresh, misses are still computed.
	 */
	public void shutdownLazyRefresh() {
		if (shutdown.compareAndSet(false, true)) {
			log.debug("Shutting down LazyEchoCache background refresh");
			engineContext.cancel();
			refreshQueue.shutdown();
		}
	}

	@Override
	public void close() {
		shutdownLazyRefresh();
	}

	public boolean isShutdown() {
		return shutdown.get();
	}

	public EngineMetrics metrics() {
		return metrics;
	}

	private Optional<StaleValue<T>> readQuietly(String key) {
		try {
			return store.get(key);
		} catch (RuntimeException e) {
			metrics.recordStoreReadError();
			log.warn("Cannot get value from cache, computing instead - key : {}", key, e);
			return Optional.empty();
		}
	}

	private void writeQuietly(String key, SingleFlightResult<T> result) {
		if (result.getValue() == null) {
			log.debug("Computed null value is not cached - key : {}", key);
			return;
		}
		try {
			store.set(key, StaleValue.of(result.getValue(), result.getCreatedAt()));
		} catch (RuntimeException e) {
			metrics.recordStoreWriteError();
			log.warn("Failed to store value in cache - key : {}", key, e);
		}
	}

	private void releaseQuietly(String key, String token) {
		try {
			store.releaseRefreshLock(key, token);
		} catch (RuntimeException e) {
			log.warn("Cannot release refresh lock - key : {}", key, e);
		}
	}

	private static void requirePositive(Duration duration, String name) {
		if (duration == null || duration.isNegative() || duration.isZero()) {
			throw new IllegalArgumentException(name + " must be positive");
		}
	}
}
