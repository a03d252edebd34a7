package org.scriptonbasestar.echocache.core.store;

import org.scriptonbasestar.echocache.core.exception.SBCacheStoreException;

import java.util.Optional;

/**
 * 엔진이 사용하는 최소 저장소 계약.
 *
 * <p>in-memory map, LRU, Redis 등 어떤 백엔드든 이 두 메서드만 구현하면 됩니다.
 * 값이 없는 경우는 예외가 아니라 {@link Optional#empty()} 입니다.</p>
 *
 * <p>구현체는 thread-safe 해야 하며, {@link #set(String, Object)} 은 호출자 입장에서 원자적이어야 합니다
 * (부분적으로 쓰여진 값이 {@link #get(String)} 으로 보이면 안 됩니다).</p>
 *
 * @param <T> 값 타입
 * @since 2025-01
 */
public interface CacheStore<T> {

	/**
	 * 키에 해당하는 값을 조회합니다.
	 *
	 * @param key 캐시 키
	 * @return 저장된 값, 없으면 empty
	 * @throws SBCacheStoreException 조회 자체가 실패한 경우 (not found 제외)
	 */
	Optional<T> get(String key) throws SBCacheStoreException;

	/**
	 * 값을 저장합니다. 기존 값은 덮어씁니다.
	 *
	 * @param key 캐시 키
	 * @param value 저장할 값
	 * @throws SBCacheStoreException 저장 실패 시
	 */
	void set(String key, T value) throws SBCacheStoreException;
}
