/**
 * In-process 저장소 구현
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.echocache.engine.store.MapCacheStore} - 제한 없는 ConcurrentHashMap</li>
 *   <li>{@link org.scriptonbasestar.echocache.engine.store.LruCacheStore} - 크기 제한 LRU</li>
 *   <li>{@link org.scriptonbasestar.echocache.engine.store.ExpiringLruCacheStore} - LRU + TTL</li>
 *   <li>{@link org.scriptonbasestar.echocache.engine.store.SingleEntryCacheStore} - 값 하나</li>
 * </ul>
 *
 * 각 저장소의 {@code staleWhileRevalidate(...)} 팩토리는 {@link org.scriptonbasestar.echocache.engine.LazyEchoCache} 용
 * 저장소를 돌려줍니다.
 *
 * @since 2025-01
 */
package org.scriptonbasestar.echocache.engine.store;
