package org.scriptonbasestar.echocache.metrics.micrometer;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.TimeGauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.scriptonbasestar.echocache.engine.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;

/**
 * EngineMetrics 를 Micrometer MeterRegistry 에 노출하는 바인더
 *
 * 모든 미터는 EngineMetrics 의 누적 값을 읽기만 하므로 엔진 쪽 기록 경로에는 영향이 없습니다.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * LazyEchoCache<Product> cache = LazyEchoCache.<Product>builder()
 *     .store(LruCacheStore.staleWhileRevalidate(10_000))
 *     .build();
 *
 * new EngineMetricsBinder(cache.metrics(), "product-cache").bindTo(registry);
 * }</pre>
 *
 * <h3>미터 목록 (태그 cache=이름):</h3>
 * <ul>
 *   <li>echocache.requests {result=hit|stale|miss}</li>
 *   <li>echocache.computes {result=success|failure}</li>
 *   <li>echocache.computes.shared</li>
 *   <li>echocache.store.errors {operation=read|write}</li>
 *   <li>echocache.refreshes {result=enqueued|duplicate|dropped|lock_skipped|failed}</li>
 *   <li>echocache.hit.rate, echocache.compute.average (gauge)</li>
 * </ul>
 *
 * @since 2025-01
 */
public class EngineMetricsBinder implements MeterBinder {

	private static final Logger log = LoggerFactory.getLogger(EngineMetricsBinder.class);

	private final EngineMetrics engineMetrics;
	private final String cacheName;

	/**
	 * @param engineMetrics 엔진 통계
	 * @param cacheName 캐시 이름 (태그로 사용)
	 */
	public EngineMetricsBinder(EngineMetrics engineMetrics, String cacheName) {
		if (engineMetrics == null) {
			throw new IllegalArgumentException("EngineMetrics must not be null");
		}
		if (cacheName == null || cacheName.trim().isEmpty()) {
			throw new IllegalArgumentException("Cache name must not be null or empty");
		}
		this.engineMetrics = engineMetrics;
		this.cacheName = cacheName;
	}

	@Override
	public void bindTo(MeterRegistry registry) {
		counter(registry, "echocache.requests", "result", "hit", EngineMetrics::hitCount, "Fresh cache hits");
		counter(registry, "echocache.requests", "result", "stale", EngineMetrics::staleHitCount, "Stale values served");
		counter(registry, "echocache.requests", "result", "miss", EngineMetrics::missCount, "Cache misses");

		counter(registry, "echocache.computes", "result", "success", EngineMetrics::computeSuccessCount, "Successful computations");
		counter(registry, "echocache.computes", "result", "failure", EngineMetrics::computeFailureCount, "Failed computations");

		FunctionCounter.builder("echocache.computes.shared", engineMetrics, EngineMetrics::sharedResultCount)
			.tag("cache", cacheName)
			.description("Calls that received another caller's computation")
			.register(registry);

		counter(registry, "echocache.store.errors", "operation", "read", EngineMetrics::storeReadErrorCount, "Store read failures");
		counter(registry, "echocache.store.errors", "operation", "write", EngineMetrics::storeWriteErrorCount, "Store write failures");

		counter(registry, "echocache.refreshes", "result", "enqueued", EngineMetrics::refreshEnqueuedCount, "Background refreshes queued");
		counter(registry, "echocache.refreshes", "result", "duplicate", EngineMetrics::refreshDuplicateCount, "Refreshes already pending");
		counter(registry, "echocache.refreshes", "result", "dropped", EngineMetrics::refreshDroppedCount, "Refreshes dropped on full queue");
		counter(registry, "echocache.refreshes", "result", "lock_skipped", EngineMetrics::refreshLockSkipCount, "Refreshes skipped for the refresh lock");
		counter(registry, "echocache.refreshes", "result", "failed", EngineMetrics::refreshFailureCount, "Failed background refreshes");

		Gauge.builder("echocache.hit.rate", engineMetrics, EngineMetrics::hitRate)
			.tag("cache", cacheName)
			.description("Hit rate, stale hits included")
			.register(registry);

		TimeGauge.builder("echocache.compute.average", engineMetrics, TimeUnit.NANOSECONDS, EngineMetrics::averageComputeNanos)
			.tag("cache", cacheName)
			.description("Average duration of successful computations")
			.register(registry);

		log.debug("EngineMetrics bound to {} - cache : {}", registry.getClass().getSimpleName(), cacheName);
	}

	private void counter(MeterRegistry registry, String name, String tagKey, String tagValue,
						 ToDoubleFunction<EngineMetrics> count, String description) {
		FunctionCounter.builder(name, engineMetrics, count)
			.tag("cache", cacheName)
			.tag(tagKey, tagValue)
			.description(description)
			.register(registry);
	}

	public String getCacheName() {
		return cacheName;
	}
}
