/**
 * Micrometer 연동
 *
 * {@link org.scriptonbasestar.echocache.metrics.micrometer.EngineMetricsBinder} 로 엔진 통계를
 * 임의의 MeterRegistry (Prometheus, JMX 등) 에 노출합니다.
 *
 * @since 2025-01
 */
package org.scriptonbasestar.echocache.metrics.micrometer;
