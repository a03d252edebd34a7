package org.scriptonbasestar.echocache.engine.flight;

import org.scriptonbasestar.echocache.core.exception.SBCacheComputeException;
import org.scriptonbasestar.echocache.core.refresh.RefreshContext;
import org.scriptonbasestar.echocache.core.refresh.RefreshFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;

/**
 * 키 단위 중복 계산 제거 그룹.
 *
 * <p>같은 키로 동시에 들어온 호출 중 첫 호출(leader)만 계산 함수를 실행하고,
 * 나머지는 그 결과(값 또는 예외)를 그대로 공유받습니다. 계산이 끝나면 키는 즉시 해제되어
 * 다음 미스는 새 라운드를 시작합니다 (실패 결과를 캐시하지 않음).</p>
 *
 * <p>엔진 인스턴스마다 하나씩 소유합니다. 프로세스 전역 상태가 아닙니다.</p>
 *
 * @param <T> 결과 타입
 * @since 2025-01
 */
public class SingleFlight<T> {

	private static final Logger log = LoggerFactory.getLogger(SingleFlight.class);

	private final ConcurrentMap<String, CompletableFuture<SingleFlightResult<T>>> calls = new ConcurrentHashMap<>();
	private final Clock clock;

	public SingleFlight() {
		this(Clock.systemUTC());
	}

	public SingleFlight(Clock clock) {
		if (clock == null) {
			throw new IllegalArgumentException("Clock must not be null");
		}
		this.clock = clock;
	}

	/**
	 * 계산을 실행하거나, 진행 중인 같은 키의 계산에 합류합니다.
	 *
	 * @param key dedup 키
	 * @param requestId 이 호출의 요청 식별자. leader 가 되면 결과에 기록됩니다
	 * @param ctx 계산 함수에 전달할 컨텍스트 (leader 일 때만 사용)
	 * @param fn 계산 함수
	 * @return 이번 라운드의 결과
	 * @throws SBCacheComputeException checked 예외로 실패했거나 대기 중 인터럽트된 경우
	 */
	public SingleFlightResult<T> execute(String key, String requestId, RefreshContext ctx, RefreshFunction<T> fn) {
		CompletableFuture<SingleFlightResult<T>> call = new CompletableFuture<>();
		CompletableFuture<SingleFlightResult<T>> inFlight = calls.putIfAbsent(key, call);

		if (inFlight != null) {
			log.trace("Joining in-flight computation - key : {}, requestId : {}", key, requestId);
			return await(key, inFlight).asShared();
		}

		try {
			T value = fn.compute(ctx);
			call.complete(new SingleFlightResult<>(value, clock.instant(), requestId, false));
		} catch (Exception | Error e) {
			call.completeExceptionally(e);
		} finally {
			calls.remove(key, call);
		}
		return await(key, call);
	}

	/**
	 * @return 현재 계산 중인 키의 수
	 */
	public int inFlightCount() {
		return calls.size();
	}

	private SingleFlightResult<T> await(String key, CompletableFuture<SingleFlightResult<T>> call) {
		try {
			return call.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new SBCacheComputeException("Interrupted while waiting for computation of key: " + key, e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new SBCacheComputeException("Computation failed for key: " + key, cause);
		}
	}
}
