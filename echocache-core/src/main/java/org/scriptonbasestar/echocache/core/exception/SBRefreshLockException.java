package org.scriptonbasestar.echocache.core.exception;

/**
 * refresh lock 레코드를 읽거나 쓰거나 지우지 못한 인프라 오류. 잠금 획득 실패(false)와는 구분됩니다.
 *
 * @since 2025-01
 */
public class SBRefreshLockException extends SBCacheException {

	public SBRefreshLockException() {
		super();
	}

	public SBRefreshLockException(String message) {
		super(message);
	}

	public SBRefreshLockException(String message, Throwable cause) {
		super(message, cause);
	}

	public SBRefreshLockException(Throwable cause) {
		super(cause);
	}
}
