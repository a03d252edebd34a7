package org.scriptonbasestar.echocache.core.lock;

import org.scriptonbasestar.echocache.core.exception.SBRefreshLockException;

import java.time.Duration;

/**
 * Cross-process mutual exclusion for background refreshes of a single key.
 * <p>
 * This is a best-effort mutex keyed by an owner token with a TTL, not a consensus primitive.
 * Re-acquiring with the token that already owns the lock always succeeds and renews it.
 * </p>
 *
 * @since 2025-01
 */
public interface RefreshLock {

	/**
	 * Tries to take the refresh lock of {@code key} for the owner {@code token}.
	 *
	 * @param key cache key being refreshed
	 * @param token owner token, usually the refresh request identifier
	 * @param ttl time after which an unreleased lock counts as abandoned
	 * @return true if the caller now owns the lock, false if another owner holds it
	 * @throws SBRefreshLockException if the lock record cannot be read or written
	 */
	boolean tryAcquireRefreshLock(String key, String token, Duration ttl) throws SBRefreshLockException;

	/**
	 * Releases the lock of {@code key} if it is owned by {@code token}. Releasing an absent lock,
	 * or one owned by somebody else, is a silent no-op.
	 *
	 * @param key cache key
	 * @param token owner token used to acquire
	 * @throws SBRefreshLockException if the lock record cannot be read or deleted
	 */
	void releaseRefreshLock(String key, String token) throws SBRefreshLockException;
}
