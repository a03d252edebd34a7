package org.scriptonbasestar.echocache.engine.store;

import org.scriptonbasestar.echocache.core.store.CacheStore;
import org.scriptonbasestar.echocache.core.store.StaleValue;
import org.scriptonbasestar.echocache.core.store.StaleWhileRevalidateStore;
import org.scriptonbasestar.echocache.core.util.TimeCheckerUtil;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 값 하나만 보관하는 저장소. 설정 한 벌, 토큰 하나처럼 키가 사실상 하나뿐인 경우에 씁니다.
 *
 * <p>키는 무시됩니다. 어떤 키로 쓰든 같은 슬롯을 덮어씁니다.</p>
 *
 * @param <T> 값 타입
 * @since 2025-01
 */
public class SingleEntryCacheStore<T> implements CacheStore<T> {

	public static final Duration NEVER_EXPIRE = TimeCheckerUtil.NEVER_EXPIRE;

	private final ReadWriteLock rwLock = new ReentrantReadWriteLock();
	private final Duration ttl;
	private final Clock clock;
	private T value;
	private Instant writtenAt;

	public SingleEntryCacheStore() {
		this(NEVER_EXPIRE);
	}

	public SingleEntryCacheStore(Duration ttl) {
		this(ttl, Clock.systemUTC());
	}

	public SingleEntryCacheStore(Duration ttl, Clock clock) {
		if (ttl == null || ttl.isNegative() || ttl.isZero()) {
			throw new IllegalArgumentException("ttl must be positive");
		}
		if (clock == null) {
			throw new IllegalArgumentException("Clock must not be null");
		}
		this.ttl = ttl;
		this.clock = clock;
	}

	public static <T> StaleWhileRevalidateStore<T> staleWhileRevalidate() {
		return new LocalStaleWhileRevalidateStore<>(new SingleEntryCacheStore<StaleValue<T>>());
	}

	public static <T> StaleWhileRevalidateStore<T> staleWhileRevalidate(Duration ttl, Clock clock) {
		return new LocalStaleWhileRevalidateStore<>(new SingleEntryCacheStore<StaleValue<T>>(ttl, clock));
	}

	@Override
	public Optional<T> get(String key) {
		rwLock.readLock().lock();
		try {
			if (value == null || !TimeCheckerUtil.isFresh(writtenAt, ttl, clock)) {
				return Optional.empty();
			}
			return Optional.of(value);
		} finally {
			rwLock.readLock().unlock();
		}
	}

	@Override
	public void set(String key, T value) {
		if (value == null) {
			throw new IllegalArgumentException("value must not be null");
		}
		rwLock.writeLock().lock();
		try {
			this.value = value;
			this.writtenAt = clock.instant();
		} finally {
			rwLock.writeLock().unlock();
		}
	}
}
