package org.scriptonbasestar.echocache.core.exception;

/**
 * echo-cache 계층의 모든 예외의 상위 타입.
 *
 * @since 2025-01
 */
public class SBCacheException extends RuntimeException {

	public SBCacheException() {
		super();
	}

	public SBCacheException(String message) {
		super(message);
	}

	public SBCacheException(String message, Throwable cause) {
		super(message, cause);
	}

	public SBCacheException(Throwable cause) {
		super(cause);
	}
}
