/**
 * Redis 저장소 (Jedis)
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.echocache.redis.RedisCacheStore} - EchoCache 용</li>
 *   <li>{@link org.scriptonbasestar.echocache.redis.RedisStaleWhileRevalidateStore} - LazyEchoCache 용, 분산 refresh lock 포함</li>
 *   <li>{@link org.scriptonbasestar.echocache.redis.JsonValueCodec} - Jackson 직렬화</li>
 * </ul>
 *
 * @since 2025-01
 */
package org.scriptonbasestar.echocache.redis;
