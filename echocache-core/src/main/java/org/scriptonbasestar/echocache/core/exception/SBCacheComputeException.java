package org.scriptonbasestar.echocache.core.exception;

/**
 * 사용자 계산 함수가 checked 예외로 실패했을 때 한 번 감싸서 전달합니다.
 *
 * @since 2025-01
 */
public class SBCacheComputeException extends SBCacheException {

	public SBCacheComputeException() {
		super();
	}

	public SBCacheComputeException(String message) {
		super(message);
	}

	public SBCacheComputeException(String message, Throwable cause) {
		super(message, cause);
	}

	public SBCacheComputeException(Throwable cause) {
		super(cause);
	}
}
