package org.scriptonbasestar.echocache.engine.store;

import org.scriptonbasestar.echocache.core.store.CacheStore;
import org.scriptonbasestar.echocache.core.store.StaleValue;
import org.scriptonbasestar.echocache.core.store.StaleWhileRevalidateStore;
import org.scriptonbasestar.echocache.core.util.TimeCheckerUtil;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * LRU store whose entries also expire {@code ttl} after they were written.
 * An expired entry reads as absent and is removed on that read.
 *
 * @param <T> the value type
 * @since 2025-01
 */
public class ExpiringLruCacheStore<T> implements CacheStore<T> {

	private final Object lock = new Object();
	private final int maxSize;
	private final Duration ttl;
	private final Clock clock;
	private final LinkedHashMap<String, Entry<T>> entries;

	public ExpiringLruCacheStore(int maxSize, Duration ttl) {
		this(maxSize, ttl, Clock.systemUTC());
	}

	public ExpiringLruCacheStore(int maxSize, Duration ttl, Clock clock) {
		if (maxSize < 1) {
			throw new IllegalArgumentException("maxSize must be at least 1");
		}
		if (ttl == null || ttl.isNegative() || ttl.isZero()) {
			throw new IllegalArgumentException("ttl must be positive");
		}
		if (clock == null) {
			throw new IllegalArgumentException("Clock must not be null");
		}
		this.maxSize = maxSize;
		this.ttl = ttl;
		this.clock = clock;
		this.entries = new LinkedHashMap<String, Entry<T>>(16, 0.75f, true) {
			@Override
			protected boolean removeEldestEntry(Map.Entry<String, Entry<T>> eldest) {
				return size() > ExpiringLruCacheStore.this.maxSize;
			}
		};
	}

	public static <T> StaleWhileRevalidateStore<T> staleWhileRevalidate(int maxSize, Duration ttl) {
		return new LocalStaleWhileRevalidateStore<>(new ExpiringLruCacheStore<StaleValue<T>>(maxSize, ttl));
	}

	public static <T> StaleWhileRevalidateStore<T> staleWhileRevalidate(int maxSize, Duration ttl, Clock clock) {
		return new LocalStaleWhileRevalidateStore<>(new ExpiringLruCacheStore<StaleValue<T>>(maxSize, ttl, clock));
	}

	@Override
	public Optional<T> get(String key) {
		synchronized (lock) {
			Entry<T> entry = entries.get(key);
			if (entry == null) {
				return Optional.empty();
			}
			if (!TimeCheckerUtil.isFresh(entry.writtenAt, ttl, clock)) {
				entries.remove(key);
				return Optional.empty();
			}
			return Optional.of(entry.value);
		}
	}

	@Override
	public void set(String key, T value) {
		if (value == null) {
			throw new IllegalArgumentException("value must not be null");
		}
		synchronized (lock) {
			entries.put(key, new Entry<>(value, clock.instant()));
		}
	}

	/**
	 * @return number of entries held, expired ones not yet read included
	 */
	public int size() {
		synchronized (lock) {
			return entries.size();
		}
	}

	private static final class Entry<T> {
		private final T value;
		private final Instant writtenAt;

		private Entry(T value, Instant writtenAt) {
			this.value = value;
			this.writtenAt = writtenAt;
		}
	}
}
