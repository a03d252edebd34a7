package org.scriptonbasestar.echocache.engine;

import org.scriptonbasestar.echocache.core.refresh.RefreshFunction;
import org.scriptonbasestar.echocache.engine.metrics.EngineMetrics;

/**
 * 계산 함수 래퍼
 */
final class Computations {

	private Computations() {
	}

	/**
	 * 계산 시간과 성공/실패를 기록하는 함수로 감쌉니다. dedup leader 만 실행하므로 라운드당 한 번 기록됩니다.
	 */
	static <T> RefreshFunction<T> timed(RefreshFunction<T> fn, EngineMetrics metrics) {
		return ctx -> {
			long start = System.nanoTime();
			try {
				T value = fn.compute(ctx);
				metrics.recordComputeSuccess(System.nanoTime() - start);
				return value;
			} catch (Exception | Error e) {
				metrics.recordComputeFailure();
				throw e;
			}
		};
	}
}
