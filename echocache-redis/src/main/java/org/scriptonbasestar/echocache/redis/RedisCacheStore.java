package org.scriptonbasestar.echocache.redis;

import org.scriptonbasestar.echocache.core.exception.SBCacheStoreException;
import org.scriptonbasestar.echocache.core.store.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis 를 백엔드로 사용하는 {@link CacheStore}.
 *
 * <p>값은 JSON 으로 {@code <prefix>:<key>} 에 저장되고, 저장소 전체에 같은 TTL 이 적용됩니다.</p>
 *
 * 사용 예시:
 * <pre>
 * JedisPooled jedis = new JedisPooled("localhost", 6379);
 * RedisCacheStore&lt;User&gt; store = new RedisCacheStore&lt;&gt;(jedis, "users", JsonValueCodec.forClass(User.class), Duration.ofMinutes(10));
 *
 * EchoCache&lt;User&gt; cache = new EchoCache&lt;&gt;(store);
 * User user = cache.fetchWithCache("123", ctx -&gt; userRepository.findById(123L));  // Redis 키 "users:123"
 * </pre>
 *
 * @param <T> 값 타입
 * @since 2025-01
 */
public class RedisCacheStore<T> implements CacheStore<T> {

	private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);

	/**
	 * 만료 없음
	 */
	public static final Duration NO_EXPIRY = Duration.ZERO;

	private final JedisPooled jedis;
	private final String keyPrefix;
	private final JsonValueCodec<T> codec;
	private final Duration ttl;

	/**
	 * @param jedis Jedis 연결 인스턴스
	 * @param keyPrefix Redis 키 접두사 (예: "users")
	 * @param codec 값 인코더
	 * @param ttl 값의 만료 시간, {@link #NO_EXPIRY} 면 만료 없음
	 */
	public RedisCacheStore(JedisPooled jedis, String keyPrefix, JsonValueCodec<T> codec, Duration ttl) {
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
		log.debug("RedisCacheStore initialized with prefix: {}, ttl: {}", keyPrefix, ttl);
	}

	@Override
	public Optional<T> get(String key) throws SBCacheStoreException {
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
		return Optional.ofNullable(codec.decode(raw));
	}

	@Override
	public void set(String key, T value) throws SBCacheStoreException {
		String redisKey = RedisKeys.build(keyPrefix, key);
		String data = codec.encode(value);
		try {
			if (ttl.isZero()) {
				jedis.set(redisKey, data);
			} else {
				jedis.set(redisKey, data, SetParams.setParams().px(ttl.toMillis()));
			}
			log.trace("Saved to Redis: {} (ttl {})", redisKey, ttl);
		} catch (JedisException e) {
			throw new SBCacheStoreException("Failed to write to Redis: " + redisKey, e);
		}
	}
}
