package org.scriptonbasestar.echocache.core.store;

import java.time.Instant;
import java.util.Objects;

/**
 * 생성 시각이 붙은 캐시 값. stale-while-revalidate 저장소가 보관하는 단위입니다.
 *
 * @param <T> 값 타입
 * @since 2025-01
 */
public final class StaleValue<T> {

	private final T value;
	private final Instant createdAt;

	public StaleValue(T value, Instant createdAt) {
		if (createdAt == null) {
			throw new IllegalArgumentException("createdAt must not be null");
		}
		this.value = value;
		this.createdAt = createdAt;
	}

	public static <T> StaleValue<T> of(T value, Instant createdAt) {
		return new StaleValue<>(value, createdAt);
	}

	public T getValue() {
		return value;
	}

	public Instant getCreatedAt() {
		return createdAt;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof StaleValue)) {
			return false;
		}
		StaleValue<?> that = (StaleValue<?>) o;
		return Objects.equals(value, that.value) && createdAt.equals(that.createdAt);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, createdAt);
	}

	@Override
	public String toString() {
		return "StaleValue{value=" + value + ", createdAt=" + createdAt + '}';
	}
}
