package org.scriptonbasestar.echocache.engine.store;

import org.scriptonbasestar.echocache.core.store.CacheStore;
import org.scriptonbasestar.echocache.core.store.StaleValue;
import org.scriptonbasestar.echocache.core.store.StaleWhileRevalidateStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Least Recently Used (LRU) bounded in-memory store.
 * <p>
 * Uses LinkedHashMap with access-order mode; inserting beyond {@code maxSize} evicts the entry
 * that has not been read or written for the longest time.
 * </p>
 *
 * @param <T> the value type
 * @since 2025-01
 */
public class LruCacheStore<T> implements CacheStore<T> {

	private final Object lock = new Object();
	private final int maxSize;
	private final LinkedHashMap<String, T> entries;

	public LruCacheStore(int maxSize) {
		if (maxSize < 1) {
			throw new IllegalArgumentException("maxSize must be at least 1");
		}
		this.maxSize = maxSize;
		// accessOrder=true for LRU behavior
		this.entries = new LinkedHashMap<String, T>(16, 0.75f, true) {
			@Override
			protected boolean removeEldestEntry(Map.Entry<String, T> eldest) {
				return size() > LruCacheStore.this.maxSize;
			}
		};
	}

	public static <T> StaleWhileRevalidateStore<T> staleWhileRevalidate(int maxSize) {
		return new LocalStaleWhileRevalidateStore<>(new LruCacheStore<StaleValue<T>>(maxSize));
	}

	@Override
	public Optional<T> get(String key) {
		synchronized (lock) {
			return Optional.ofNullable(entries.get(key));
		}
	}

	@Override
	public void set(String key, T value) {
		if (value == null) {
			throw new IllegalArgumentException("value must not be null");
		}
		synchronized (lock) {
			entries.put(key, value);
		}
	}

	public int size() {
		synchronized (lock) {
			return entries.size();
		}
	}

	public int maxSize() {
		return maxSize;
	}
}
