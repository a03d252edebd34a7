/**
 * Distributed refresh lock.
 * <p>
 * Keeps several processes sharing one remote store from recomputing the same key at the same time.
 * This is separate from the in-process deduplication done by the engines.
 * </p>
 *
 * <h2>Key Components:</h2>
 * <ul>
 *   <li>{@link org.scriptonbasestar.echocache.core.lock.RefreshLock} - acquire/release contract</li>
 *   <li>{@link org.scriptonbasestar.echocache.core.lock.RecordRefreshLock} - token + TTL record protocol</li>
 *   <li>{@link org.scriptonbasestar.echocache.core.lock.LockRecordStore} - where the records live</li>
 *   <li>{@link org.scriptonbasestar.echocache.core.lock.NoopRefreshLock} - single-process stores</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * RefreshLock lock = new RecordRefreshLock(new ConcurrentMapLockRecordStore());
 * String token = RequestIds.next();
 * if (lock.tryAcquireRefreshLock("user:42", token, Duration.ofSeconds(10))) {
 *     try {
 *         // recompute and store
 *     } finally {
 *         lock.releaseRefreshLock("user:42", token);
 *     }
 * }
 * }</pre>
 *
 * @since 2025-01
 */
package org.scriptonbasestar.echocache.core.lock;
