package org.scriptonbasestar.echocache.engine.queue;

import org.scriptonbasestar.echocache.core.refresh.RefreshFunction;
import org.scriptonbasestar.echocache.core.util.RequestIds;

/**
 * 백그라운드 갱신 요청. 한 번만 시도되며 재시도하지 않습니다.
 *
 * @param <T> 값 타입
 * @since 2025-01
 */
public final class RefreshTask<T> {

	private final String key;
	private final RefreshFunction<T> function;
	private final String requestId;

	public RefreshTask(String key, RefreshFunction<T> function, String requestId) {
		if (key == null) {
			throw new IllegalArgumentException("key must not be null");
		}
		if (function == null) {
			throw new IllegalArgumentException("RefreshFunction must not be null");
		}
		if (requestId == null || requestId.isEmpty()) {
			throw new IllegalArgumentException("requestId must not be null or empty");
		}
		this.key = key;
		this.function = function;
		this.requestId = requestId;
	}

	/**
	 * 새 요청 식별자로 작업을 만듭니다.
	 */
	public static <T> RefreshTask<T> of(String key, RefreshFunction<T> function) {
		return new RefreshTask<>(key, function, RequestIds.next());
	}

	public String getKey() {
		return key;
	}

	public RefreshFunction<T> getFunction() {
		return function;
	}

	public String getRequestId() {
		return requestId;
	}

	@Override
	public String toString() {
		return "RefreshTask{key=" + key + ", requestId=" + requestId + '}';
	}
}
