package org.scriptonbasestar.echocache.engine;

import org.scriptonbasestar.echocache.core.exception.SBCacheComputeException;
import org.scriptonbasestar.echocache.core.refresh.RefreshContext;
import org.scriptonbasestar.echocache.core.refresh.RefreshFunction;
import org.scriptonbasestar.echocache.core.store.CacheStore;
import org.scriptonbasestar.echocache.core.util.RequestIds;
import org.scriptonbasestar.echocache.engine.flight.SingleFlight;
import org.scriptonbasestar.echocache.engine.flight.SingleFlightResult;
import org.scriptonbasestar.echocache.engine.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 저장소 앞단의 fetch-or-compute 엔진.
 *
 * <p>캐시 히트면 계산 없이 바로 반환하고, 미스면 같은 키의 동시 호출 중 하나만 계산합니다.
 * 계산 결과는 라운드를 시작한 호출자만 저장소에 씁니다.</p>
 *
 * <pre>{@code
 * EchoCache<User> cache = new EchoCache<>(new LruCacheStore<>(10_000));
 *
 * User user = cache.fetchWithCache("user:" + id, ctx -> userRepository.findById(id));
 * }</pre>
 *
 * <p>저장소는 성능 최적화 수단일 뿐이므로 저장소 읽기/쓰기 오류는 로그만 남기고 호출자에게
 * 전파하지 않습니다. 호출자가 보는 예외는 계산 함수에서 발생한 것뿐입니다.</p>
 *
 * @param <T> 값 타입
 * @since 2025-01
 */
public class EchoCache<T> {

	private static final Logger log = LoggerFactory.getLogger(EchoCache.class);

	private final CacheStore<T> store;
	private final SingleFlight<T> singleFlight;
	private final EngineMetrics metrics;

	public EchoCache(CacheStore<T> store) {
		this(store, new EngineMetrics());
	}

	public EchoCache(CacheStore<T> store, EngineMetrics metrics) {
		if (store == null) {
			throw new IllegalArgumentException("CacheStore must not be null");
		}
		if (metrics == null) {
			throw new IllegalArgumentException("EngineMetrics must not be null");
		}
		this.store = store;
		this.metrics = metrics;
		this.singleFlight = new SingleFlight<>();
	}

	public static <T> Builder<T> builder() {
		return new Builder<>();
	}

	public static class Builder<T> {
		private CacheStore<T> store;
		private EngineMetrics metrics;

		public Builder<T> store(CacheStore<T> store) {
			this.store = store;
			return this;
		}

		/**
		 * 통계 인스턴스를 지정합니다. 지정하지 않으면 엔진 전용 인스턴스를 만듭니다.
		 */
		public Builder<T> metrics(EngineMetrics metrics) {
			this.metrics = metrics;
			return this;
		}

		public EchoCache<T> build() {
			if (store == null) {
				throw new IllegalStateException("store must be set");
			}
			return new EchoCache<>(store, metrics != null ? metrics : new EngineMetrics());
		}
	}

	/**
	 * 취소되지 않는 컨텍스트로 {@link #fetchWithCache(RefreshContext, String, RefreshFunction)} 을 호출합니다.
	 */
	public T fetchWithCache(String key, RefreshFunction<T> refreshFn) {
		return fetchWithCache(RefreshContext.background(), key, refreshFn);
	}

	/**
	 * 캐시된 값을 반환하거나, 없으면 계산해서 저장한 뒤 반환합니다.
	 *
	 * @param ctx 계산 함수에 전달할 컨텍스트
	 * @param key 캐시 키
	 * @param refreshFn 미스 시 실행할 계산 함수
	 * @return 캐시된 값 또는 계산된 값
	 * @throws RuntimeException 계산 함수가 던진 unchecked 예외 그대로
	 * @throws SBCacheComputeException 계산 함수가 checked 예외로 실패한 경우
	 */
	public T fetchWithCache(RefreshContext ctx, String key, RefreshFunction<T> refreshFn) {
		if (refreshFn == null) {
			throw new IllegalArgumentException("RefreshFunction must not be null");
		}
		log.trace("fetchWithCache - key : {}", key);

		Optional<T> cached = readQuietly(key);
		if (cached.isPresent()) {
			metrics.recordHit();
			return cached.get();
		}
		metrics.recordMiss();

		String requestId = RequestIds.next();
		SingleFlightResult<T> result = singleFlight.execute(key, requestId, ctx, Computations.timed(refreshFn, metrics));

		if (result.isOwnedBy(requestId)) {
			writeQuietly(key, result.getValue());
		} else {
			metrics.recordSharedResult();
		}
		return result.getValue();
	}

	public EngineMetrics metrics() {
		return metrics;
	}

	private Optional<T> readQuietly(String key) {
		try {
			return store.get(key);
		} catch (RuntimeException e) {
			metrics.recordStoreReadError();
			log.warn("Cannot get value from cache, computing instead - key : {}", key, e);
			return Optional.empty();
		}
	}

	private void writeQuietly(String key, T value) {
		if (value == null) {
			log.debug("Computed null value is not cached - key : {}", key);
			return;
		}
		try {
			store.set(key, value);
		} catch (RuntimeException e) {
			metrics.recordStoreWriteError();
			log.warn("Failed to store value in cache - key : {}", key, e);
		}
	}
}
