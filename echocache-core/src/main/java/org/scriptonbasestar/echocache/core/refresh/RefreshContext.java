package org.scriptonbasestar.echocache.core.refresh;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation handle passed to a {@link RefreshFunction}.
 * <p>
 * A context is cancelled when {@link #cancel()} is called on it or on any ancestor,
 * or when its deadline passes. Children never outlive their parent's deadline.
 * </p>
 *
 * <pre>{@code
 * RefreshContext root = RefreshContext.background();
 * RefreshContext task = root.withTimeout(Duration.ofSeconds(5));
 * ...
 * root.cancel();  // task.isCancelled() == true
 * }</pre>
 *
 * @since 2025-01
 */
public final class RefreshContext {

	private static final long NO_DEADLINE = Long.MAX_VALUE;

	private final RefreshContext parent;
	private final long deadlineNanos;
	private volatile boolean cancelled;

	private RefreshContext(RefreshContext parent, long deadlineNanos) {
		this.parent = parent;
		this.deadlineNanos = deadlineNanos;
	}

	/**
	 * Creates a new root context with no deadline.
	 */
	public static RefreshContext background() {
		return new RefreshContext(null, NO_DEADLINE);
	}

	/**
	 * Creates a new root context that expires after {@code timeout}.
	 */
	public static RefreshContext timeout(Duration timeout) {
		return background().withTimeout(timeout);
	}

	/**
	 * Derives a child context expiring after {@code timeout} or at this context's deadline,
	 * whichever comes first.
	 *
	 * @param timeout positive timeout
	 * @return child context
	 */
	public RefreshContext withTimeout(Duration timeout) {
		if (timeout == null || timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
		long now = System.nanoTime();
		long timeoutNanos = saturatedNanos(timeout);
		long candidate = now + timeoutNanos;
		if (candidate == NO_DEADLINE) {
			candidate--;
		}
		long deadline = deadlineNanos == NO_DEADLINE ? candidate : earlier(deadlineNanos, candidate);
		return new RefreshContext(this, deadline);
	}

	public void cancel() {
		cancelled = true;
	}

	public boolean isCancelled() {
		if (cancelled) {
			return true;
		}
		if (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0) {
			return true;
		}
		return parent != null && parent.isCancelled();
	}

	/**
	 * @return time left before the deadline, empty when the context has none
	 */
	public Optional<Duration> remaining() {
		if (deadlineNanos == NO_DEADLINE) {
			return Optional.empty();
		}
		long left = deadlineNanos - System.nanoTime();
		return Optional.of(Duration.ofNanos(Math.max(0L, left)));
	}

	/**
	 * @throws CancellationException if this context has been cancelled or has expired
	 */
	public void throwIfCancelled() {
		if (isCancelled()) {
			throw new CancellationException(deadlineExceeded() ? "refresh deadline exceeded" : "refresh cancelled");
		}
	}

	private boolean deadlineExceeded() {
		return deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0;
	}

	private static long earlier(long a, long b) {
		return a - b < 0 ? a : b;
	}

	private static long saturatedNanos(Duration duration) {
		try {
			return duration.toNanos();
		} catch (ArithmeticException e) {
			return Long.MAX_VALUE / 2;
		}
	}
}
