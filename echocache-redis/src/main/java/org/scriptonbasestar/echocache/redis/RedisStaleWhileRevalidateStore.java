package org.scriptonbasestar.echocache.redis;

import org.scriptonbasestar.echocache.core.exception.SBCacheStoreException;
import org.scriptonbasestar.echocache.core.exception.SBRefreshLockException;
import org.scriptonbasestar.echocache.core.lock.RecordRefreshLock;
import org.scriptonbasestar.echocache.core.store.StaleValue;
import org.scriptonbasestar.echocache.core.store.StaleWhileRevalidateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed store for {@code LazyEchoCache}, shareable between processes.
 * <p>
 * Values are stored at {@code <prefix>:<key>} as {@code {"value":..,"createdAt":<epoch millis>}}.
 * The refresh lock lives at {@code <prefix>:lock:<key>} as {@code token|<ISO-8601 instant>},
 * so only one process refreshes a stale key at a time.
 * </p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * JedisPooled jedis = new JedisPooled("localhost", 6379);
 * RedisStaleWhileRevalidateStore<Product> store = new RedisStaleWhileRevalidateStore<>(
 *     jedis, "products", JsonValueCodec.forClass(Product.class), Duration.ofHours(1));
 *
 * LazyEchoCache<Product> cache = LazyEchoCache.<Product>builder().store(store).build();
 * }</pre>
 *
 * <p>
 * The ttl is the Redis expiry of the stored values and should be much longer than the freshness
 * window callers pass to the engine, otherwise values vanish before they could be served stale.
 * </p>
 *
 * @param <T> the value type
 * @since 2025-01
 */
public class RedisStaleWhileRevalidateStore<T> implements StaleWhileRevalidateStore<T> {

	private static final Logger log = LoggerFactory.getLogger(RedisStaleWhileRevalidateStore.class);

	private final JedisPooled jedis;
	private final String keyPrefix;
	private final JsonValueCodec<T> codec;
	private final Duration ttl;
	private final RecordRefreshLock refreshLock;

	public RedisStaleWhileRevalidateStore(JedisPooled jedis, String keyPrefix, JsonValueCodec<T> codec, Duration ttl) {
		this(jedis, keyPrefix, codec, ttl, Clock.systemUTC());
	}

	public RedisStaleWhileRevalidateStore(JedisPooled jedis, String keyPrefix, JsonValueCodec<T> codec,
										  Duration ttl, Clock clock) {
		if (jedis == null) {
			throw new IllegalArgumentException("JedisPooled must not be null");
		}
		if (codec == null) {
			throw new IllegalArgumentException("JsonValueCodec must not be null");
		}
		if (ttl == null || ttl.isNegative()) {
			throw new IllegalArgumentException("ttl must not be null or negative");
		}
		this.jedis = jedis;
		this.keyPrefix = RedisKeys.requirePrefix(keyPrefix);
		this.codec = codec;
		this.ttl = ttl;
		this.refreshLock = new RecordRefreshLock(new JedisLockRecordStore(jedis, keyPrefix), clock);
		log.debug("RedisStaleWhileRevalidateStore initialized with prefix: {}, ttl: {}", keyPrefix, ttl);
	}

	@Override
	public Optional<StaleValue<T>> get(String key) throws SBCacheStoreException {
		String redisKey = RedisKeys.build(keyPrefix, key);
		String raw;
		try {
			raw = jedis.get(redisKey);
		} catch (JedisException e) {
			throw new SBCacheStoreException("Failed to read from Redis: " + redisKey, e);
		}
		if (raw == null) {
			log.trace("Key not found in Redis: {}", redisKey);
			return Optional.empty();
		}
		return Optional.of(codec.decodeStale(raw));
	}

	@Override
	public void set(String key, StaleValue<T> value) throws SBCacheStoreException {
		String redisKey = RedisKeys.build(keyPrefix, key);
		String data = codec.encodeStale(value);
		try {
			if (ttl.isZero()) {
				jedis.set(redisKey, data);
			} else {
				jedis.set(redisKey, data, SetParams.setParams().px(ttl.toMillis()));
			}
		} catch (JedisException e) {
			throw new SBCacheStoreException("Failed to write to Redis: " + redisKey, e);
		}
	}

	@Override
	public boolean tryAcquireRefreshLock(String key, String token, Duration lockTtl) throws SBRefreshLockException {
		return refreshLock.tryAcquireRefreshLock(key, token, lockTtl);
	}

	@Override
	public void releaseRefreshLock(String key, String token) throws SBRefreshLockException {
		refreshLock.releaseRefreshLock(key, token);
	}
}
