package org.scriptonbasestar.echocache.core.lock;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.Optional;

/**
 * 잠금 레코드 값: {@code token|timestamp} (timestamp 는 ISO-8601 instant).
 *
 * @since 2025-01
 */
public final class LockRecord {

	static final char SEPARATOR = '|';

	private final String token;
	private final Instant timestamp;

	LockRecord(String token, Instant timestamp) {
		this.token = token;
		this.timestamp = timestamp;
	}

	public static LockRecord of(String token, Instant timestamp) {
		if (token == null || token.isEmpty()) {
			throw new IllegalArgumentException("token must not be null or empty");
		}
		if (token.indexOf(SEPARATOR) >= 0) {
			throw new IllegalArgumentException("token must not contain '" + SEPARATOR + "'");
		}
		if (timestamp == null) {
			throw new IllegalArgumentException("timestamp must not be null");
		}
		return new LockRecord(token, timestamp);
	}

	/**
	 * 저장된 문자열을 해석합니다.
	 *
	 * @param raw 저장소에서 읽은 값
	 * @return 형식이 맞지 않으면 empty
	 */
	public static Optional<LockRecord> parse(String raw) {
		if (raw == null || raw.isEmpty()) {
			return Optional.empty();
		}
		String[] parts = raw.split("\\|", -1);
		if (parts.length != 2 || parts[0].isEmpty()) {
			return Optional.empty();
		}
		try {
			return Optional.of(new LockRecord(parts[0], Instant.parse(parts[1])));
		} catch (DateTimeException e) {
			return Optional.empty();
		}
	}

	public String encode() {
		return token + SEPARATOR + timestamp;
	}

	public String getToken() {
		return token;
	}

	public Instant getTimestamp() {
		return timestamp;
	}

	public boolean isOwnedBy(String candidate) {
		return token.equals(candidate);
	}

	@Override
	public String toString() {
		return encode();
	}
}
