package org.scriptonbasestar.echocache.engine.store;

import org.scriptonbasestar.echocache.core.lock.NoopRefreshLock;
import org.scriptonbasestar.echocache.core.lock.RefreshLock;
import org.scriptonbasestar.echocache.core.store.CacheStore;
import org.scriptonbasestar.echocache.core.store.StaleValue;
import org.scriptonbasestar.echocache.core.store.StaleWhileRevalidateStore;

import java.time.Duration;
import java.util.Optional;

/**
 * Adapts an in-process {@link CacheStore} of {@link StaleValue}s to {@link StaleWhileRevalidateStore}.
 * <p>
 * The refresh lock defaults to {@link NoopRefreshLock}: inside one process the engine's refresh queue
 * already keeps a key from being refreshed twice at once.
 * </p>
 *
 * @param <T> the value type
 * @since 2025-01
 */
public class LocalStaleWhileRevalidateStore<T> implements StaleWhileRevalidateStore<T> {

	private final CacheStore<StaleValue<T>> delegate;
	private final RefreshLock refreshLock;

	public LocalStaleWhileRevalidateStore(CacheStore<StaleValue<T>> delegate) {
		this(delegate, NoopRefreshLock.INSTANCE);
	}

	public LocalStaleWhileRevalidateStore(CacheStore<StaleValue<T>> delegate, RefreshLock refreshLock) {
		if (delegate == null) {
			throw new IllegalArgumentException("delegate store must not be null");
		}
		if (refreshLock == null) {
			throw new IllegalArgumentException("RefreshLock must not be null");
		}
		this.delegate = delegate;
		this.refreshLock = refreshLock;
	}

	@Override
	public Optional<StaleValue<T>> get(String key) {
		return delegate.get(key);
	}

	@Override
	public void set(String key, StaleValue<T> value) {
		delegate.set(key, value);
	}

	@Override
	public boolean tryAcquireRefreshLock(String key, String token, Duration ttl) {
		return refreshLock.tryAcquireRefreshLock(key, token, ttl);
	}

	@Override
	public void releaseRefreshLock(String key, String token) {
		refreshLock.releaseRefreshLock(key, token);
	}
}
