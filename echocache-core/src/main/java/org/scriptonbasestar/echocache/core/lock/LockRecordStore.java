package org.scriptonbasestar.echocache.core.lock;

import org.scriptonbasestar.echocache.core.exception.SBRefreshLockException;

import java.time.Duration;
import java.util.Optional;

/**
 * 잠금 레코드를 보관하는 저장소. {@link RecordRefreshLock} 의 백엔드입니다.
 *
 * <p>{@link #createIfAbsent} 만 원자적이면 됩니다. 나머지 단계는 순차적으로 수행됩니다.
 * {@code ttl} 인자는 만료 힌트이며, 지원하지 않는 저장소는 무시해도 됩니다
 * (레코드의 timestamp 로 나이를 판단하기 때문).</p>
 *
 * <p>모든 메서드는 인프라 오류 시 {@link SBRefreshLockException} 을 던집니다.</p>
 *
 * @since 2025-01
 */
public interface LockRecordStore {

	/**
	 * @return 새로 생성했으면 true, 이미 레코드가 있으면 false
	 */
	boolean createIfAbsent(String lockKey, String value, Duration ttl) throws SBRefreshLockException;

	Optional<String> get(String lockKey) throws SBRefreshLockException;

	void put(String lockKey, String value, Duration ttl) throws SBRefreshLockException;

	void delete(String lockKey) throws SBRefreshLockException;
}
