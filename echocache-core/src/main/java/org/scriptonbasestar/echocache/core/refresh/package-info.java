/**
 * 값 계산 함수와 취소 컨텍스트
 *
 * @since 2025-01
 */
package org.scriptonbasestar.echocache.core.refresh;
