package org.scriptonbasestar.echocache.engine.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 엔진 통계.
 *
 * 스레드 안전하며 오버헤드가 거의 없도록 AtomicLong을 사용합니다.
 * 여러 엔진이 하나의 인스턴스를 공유해도 됩니다.
 *
 * @since 2025-01
 */
public class EngineMetrics {

	private final AtomicLong hitCount = new AtomicLong(0);
	private final AtomicLong staleHitCount = new AtomicLong(0);
	private final AtomicLong missCount = new AtomicLong(0);
	private final AtomicLong computeSuccessCount = new AtomicLong(0);
	private final AtomicLong computeFailureCount = new AtomicLong(0);
	private final AtomicLong totalComputeTime = new AtomicLong(0);  // 나노초
	private final AtomicLong sharedResultCount = new AtomicLong(0);
	private final AtomicLong storeReadErrorCount = new AtomicLong(0);
	private final AtomicLong storeWriteErrorCount = new AtomicLong(0);
	private final AtomicLong refreshEnqueuedCount = new AtomicLong(0);
	private final AtomicLong refreshDuplicateCount = new AtomicLong(0);
	private final AtomicLong refreshDroppedCount = new AtomicLong(0);
	private final AtomicLong refreshLockSkipCount = new AtomicLong(0);
	private final AtomicLong refreshFailureCount = new AtomicLong(0);

	/**
	 * 신선한 캐시 히트
	 */
	public void recordHit() {
		hitCount.incrementAndGet();
	}

	/**
	 * 오래된(stale) 값을 반환한 히트
	 */
	public void recordStaleHit() {
		staleHitCount.incrementAndGet();
	}

	public void recordMiss() {
		missCount.incrementAndGet();
	}

	/**
	 * 계산 함수 성공을 기록합니다.
	 *
	 * @param computeTimeNanos 계산에 걸린 시간 (나노초)
	 */
	public void recordComputeSuccess(long computeTimeNanos) {
		computeSuccessCount.incrementAndGet();
		totalComputeTime.addAndGet(computeTimeNanos);
	}

	public void recordComputeFailure() {
		computeFailureCount.incrementAndGet();
	}

	/**
	 * 다른 호출자가 계산한 결과를 공유받은 경우 (dedup)
	 */
	public void recordSharedResult() {
		sharedResultCount.incrementAndGet();
	}

	public void recordStoreReadError() {
		storeReadErrorCount.incrementAndGet();
	}

	public void recordStoreWriteError() {
		storeWriteErrorCount.incrementAndGet();
	}

	public void recordRefreshEnqueued() {
		refreshEnqueuedCount.incrementAndGet();
	}

	public void recordRefreshDuplicate() {
		refreshDuplicateCount.incrementAndGet();
	}

	/**
	 * 큐가 가득 차서 버려진 갱신 요청
	 */
	public void recordRefreshDropped() {
		refreshDroppedCount.incrementAndGet();
	}

	/**
	 * 분산 잠금을 얻지 못해 건너뛴 갱신
	 */
	public void recordRefreshLockSkip() {
		refreshLockSkipCount.incrementAndGet();
	}

	public void recordRefreshFailure() {
		refreshFailureCount.incrementAndGet();
	}

	public long hitCount() {
		return hitCount.get();
	}

	public long staleHitCount() {
		return staleHitCount.get();
	}

	public long missCount() {
		return missCount.get();
	}

	/**
	 * 총 요청 횟수를 반환합니다 (히트 + stale 히트 + 미스).
	 *
	 * @return 총 요청 횟수
	 */
	public long requestCount() {
		return hitCount.get() + staleHitCount.get() + missCount.get();
	}

	/**
	 * 캐시 히트율을 계산합니다. stale 히트도 히트로 셉니다.
	 *
	 * @return 히트율 (0.0 ~ 1.0), 요청이 없으면 0.0
	 */
	public double hitRate() {
		long requests = requestCount();
		return requests == 0 ? 0.0 : (double) (hitCount.get() + staleHitCount.get()) / requests;
	}

	public long computeSuccessCount() {
		return computeSuccessCount.get();
	}

	public long computeFailureCount() {
		return computeFailureCount.get();
	}

	public long sharedResultCount() {
		return sharedResultCount.get();
	}

	public long storeReadErrorCount() {
		return storeReadErrorCount.get();
	}

	public long storeWriteErrorCount() {
		return storeWriteErrorCount.get();
	}

	public long refreshEnqueuedCount() {
		return refreshEnqueuedCount.get();
	}

	public long refreshDuplicateCount() {
		return refreshDuplicateCount.get();
	}

	public long refreshDroppedCount() {
		return refreshDroppedCount.get();
	}

	public long refreshLockSkipCount() {
		return refreshLockSkipCount.get();
	}

	public long refreshFailureCount() {
		return refreshFailureCount.get();
	}

	/**
	 * 평균 계산 시간을 계산합니다.
	 *
	 * @return 평균 계산 시간 (나노초), 계산이 없으면 0.0
	 */
	public double averageComputeNanos() {
		long computes = computeSuccessCount.get();
		return computes == 0 ? 0.0 : (double) totalComputeTime.get() / computes;
	}

	/**
	 * 모든 통계를 초기화합니다.
	 */
	public void reset() {
		hitCount.set(0);
		staleHitCount.set(0);
		missCount.set(0);
		computeSuccessCount.set(0);
		computeFailureCount.set(0);
		totalComputeTime.set(0);
		sharedResultCount.set(0);
		storeReadErrorCount.set(0);
		storeWriteErrorCount.set(0);
		refreshEnqueuedCount.set(0);
		refreshDuplicateCount.set(0);
		refreshDroppedCount.set(0);
		refreshLockSkipCount.set(0);
		refreshFailureCount.set(0);
	}

	@Override
	public String toString() {
		return String.format(
			"EngineMetrics{requests=%d, hits=%d, staleHits=%d, misses=%d, hitRate=%.2f%%, " +
			"computeSuccess=%d, computeFailure=%d, shared=%d, avgComputeTime=%.2fμs, " +
			"storeReadErrors=%d, storeWriteErrors=%d, refreshEnqueued=%d, refreshDropped=%d, " +
			"refreshLockSkips=%d, refreshFailures=%d}",
			requestCount(),
			hitCount(),
			staleHitCount(),
			missCount(),
			hitRate() * 100,
			computeSuccessCount(),
			computeFailureCount(),
			sharedResultCount(),
			averageComputeNanos() / 1000,  // 나노초 → 마이크로초
			storeReadErrorCount(),
			storeWriteErrorCount(),
			refreshEnqueuedCount(),
			refreshDroppedCount(),
			refreshLockSkipCount(),
			refreshFailureCount()
		);
	}
}
