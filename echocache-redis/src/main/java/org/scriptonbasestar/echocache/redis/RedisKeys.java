package org.scriptonbasestar.echocache.redis;

/**
 * Redis 키 규칙: {@code <prefix>:<key>}
 */
final class RedisKeys {

	private RedisKeys() {
	}

	static String build(String prefix, String key) {
		return prefix + ":" + key;
	}

	static String requirePrefix(String prefix) {
		if (prefix == null || prefix.isEmpty()) {
			throw new IllegalArgumentException("key prefix must not be null or empty");
		}
		return prefix;
	}
}
