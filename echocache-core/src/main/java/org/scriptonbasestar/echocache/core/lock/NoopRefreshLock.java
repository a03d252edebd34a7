package org.scriptonbasestar.echocache.core.lock;

import java.time.Duration;

/**
 * Always grants the lock. For stores living in a single process, where the engine's
 * in-process deduplication already provides exclusion.
 *
 * @since 2025-01
 */
public enum NoopRefreshLock implements RefreshLock {
	INSTANCE;

	@Override
	public boolean tryAcquireRefreshLock(String key, String token, Duration ttl) {
		return true;
	}

	@Override
	public void releaseRefreshLock(String key, String token) {
		// nothing held
	}
}
