package org.scriptonbasestar.echocache.redis;

import org.scriptonbasestar.echocache.core.exception.SBRefreshLockException;
import org.scriptonbasestar.echocache.core.lock.LockRecordStore;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.Optional;

/**
 * Refresh lock 레코드를 Redis 에 보관합니다. create-if-absent 는 {@code SET NX PX} 입니다.
 * 레코드에는 TTL 이 걸리므로 잠금을 쥔 프로세스가 죽어도 Redis 가 결국 정리합니다.
 *
 * @since 2025-01
 */
public class JedisLockRecordStore implements LockRecordStore {

	private static final String OK = "OK";

	private final JedisPooled jedis;
	private final String keyPrefix;

	public JedisLockRecordStore(JedisPooled jedis, String keyPrefix) {
		if (jedis == null) {
			throw new IllegalArgumentException("JedisPooled must not be null");
		}
		this.jedis = jedis;
		this.keyPrefix = RedisKeys.requirePrefix(keyPrefix);
	}

	@Override
	public boolean createIfAbsent(String lockKey, String value, Duration ttl) throws SBRefreshLockException {
		String redisKey = RedisKeys.build(keyPrefix, lockKey);
		try {
			return OK.equals(jedis.set(redisKey, value, SetParams.setParams().nx().px(ttl.toMillis())));
		} catch (JedisException e) {
			throw new SBRefreshLockException("Failed to create lock record: " + redisKey, e);
		}
	}

	@Override
	public Optional<String> get(String lockKey) throws SBRefreshLockException {
		String redisKey = RedisKeys.build(keyPrefix, lockKey);
		try {
			return Optional.ofNullable(jedis.get(redisKey));
		} catch (JedisException e) {
			throw new SBRefreshLockException("Failed to read lock record: " + redisKey, e);
		}
	}

	@Override
	public void put(String lockKey, String value, Duration ttl) throws SBRefreshLockException {
		String redisKey = RedisKeys.build(keyPrefix, lockKey);
		try {
			jedis.set(redisKey, value, SetParams.setParams().px(ttl.toMillis()));
		} catch (JedisException e) {
			throw new SBRefreshLockException("Failed to write lock record: " + redisKey, e);
		}
	}

	@Override
	public void delete(String lockKey) throws SBRefreshLockException {
		String redisKey = RedisKeys.build(keyPrefix, lockKey);
		try {
			jedis.del(redisKey);
		} catch (JedisException e) {
			throw new SBRefreshLockException("Failed to delete lock record: " + redisKey, e);
		}
	}
}
