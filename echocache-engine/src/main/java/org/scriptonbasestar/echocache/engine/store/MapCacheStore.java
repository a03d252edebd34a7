package org.scriptonbasestar.echocache.engine.store;

import org.scriptonbasestar.echocache.core.store.CacheStore;
import org.scriptonbasestar.echocache.core.store.StaleValue;
import org.scriptonbasestar.echocache.core.store.StaleWhileRevalidateStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 크기 제한 없는 in-memory 저장소. 테스트나 키 개수가 정해진 경우에 사용합니다.
 *
 * @param <T> 값 타입
 * @since 2025-01
 */
public class MapCacheStore<T> implements CacheStore<T> {

	private final ConcurrentMap<String, T> data = new ConcurrentHashMap<>();

	public static <T> StaleWhileRevalidateStore<T> staleWhileRevalidate() {
		return new LocalStaleWhileRevalidateStore<>(new MapCacheStore<StaleValue<T>>());
	}

	@Override
	public Optional<T> get(String key) {
		return Optional.ofNullable(data.get(key));
	}

	@Override
	public void set(String key, T value) {
		if (value == null) {
			throw new IllegalArgumentException("value must not be null");
		}
		data.put(key, value);
	}

	public int size() {
		return data.size();
	}
}
