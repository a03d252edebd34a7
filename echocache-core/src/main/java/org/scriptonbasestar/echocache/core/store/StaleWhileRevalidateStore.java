package org.scriptonbasestar.echocache.core.store;

import org.scriptonbasestar.echocache.core.lock.RefreshLock;

/**
 * Store contract required by the lazy (stale-while-revalidate) engine.
 * <p>
 * Values are wrapped in {@link StaleValue} so the engine can compute their age at read time.
 * Stores shared between processes must implement the refresh lock for real; in-process stores
 * may grant it unconditionally (see {@link org.scriptonbasestar.echocache.core.lock.NoopRefreshLock}).
 * </p>
 *
 * @param <T> the type of the wrapped values
 * @since 2025-01
 */
public interface StaleWhileRevalidateStore<T> extends CacheStore<StaleValue<T>>, RefreshLock {
}
