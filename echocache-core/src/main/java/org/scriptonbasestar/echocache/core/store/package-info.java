/**
 * 저장소 계약
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.echocache.core.store.CacheStore} - get/set 두 메서드 계약</li>
 *   <li>{@link org.scriptonbasestar.echocache.core.store.StaleWhileRevalidateStore} - 타임스탬프 값 + refresh lock</li>
 *   <li>{@link org.scriptonbasestar.echocache.core.store.StaleValue} - 값과 생성 시각</li>
 * </ul>
 *
 * @since 2025-01
 */
package org.scriptonbasestar.echocache.core.store;
