package org.scriptonbasestar.echocache.engine.flight;

import java.time.Instant;

/**
 * Outcome of one dedup round, shared by every caller that joined it.
 * <p>
 * {@code requestId} is the identifier of the caller whose computation produced the value.
 * Only that caller may write the value back to the store.
 * </p>
 *
 * @param <T> the value type
 * @since 2025-01
 */
public final class SingleFlightResult<T> {

	private final T value;
	private final Instant createdAt;
	private final String requestId;
	private final boolean shared;

	SingleFlightResult(T value, Instant createdAt, String requestId, boolean shared) {
		this.value = value;
		this.createdAt = createdAt;
		this.requestId = requestId;
		this.shared = shared;
	}

	SingleFlightResult<T> asShared() {
		return shared ? this : new SingleFlightResult<>(value, createdAt, requestId, true);
	}

	public T getValue() {
		return value;
	}

	/**
	 * @return when the computation finished
	 */
	public Instant getCreatedAt() {
		return createdAt;
	}

	public String getRequestId() {
		return requestId;
	}

	/**
	 * @return true if the caller received a result computed for another caller
	 */
	public boolean isShared() {
		return shared;
	}

	public boolean isOwnedBy(String candidateRequestId) {
		return requestId.equals(candidateRequestId);
	}
}
