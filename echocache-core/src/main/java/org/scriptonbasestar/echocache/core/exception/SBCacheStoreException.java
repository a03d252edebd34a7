package org.scriptonbasestar.echocache.core.exception;

/**
 * 백엔드 저장소 읽기/쓰기 실패 (not found 는 예외가 아님).
 *
 * @since 2025-01
 */
public class SBCacheStoreException extends SBCacheException {

	public SBCacheStoreException() {
		super();
	}

	public SBCacheStoreException(String message) {
		super(message);
	}

	public SBCacheStoreException(String message, Throwable cause) {
		super(message, cause);
	}

	public SBCacheStoreException(Throwable cause) {
		super(cause);
	}
}
