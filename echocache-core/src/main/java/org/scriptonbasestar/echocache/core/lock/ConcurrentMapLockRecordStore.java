package org.scriptonbasestar.echocache.core.lock;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process lock record store backed by a {@link ConcurrentHashMap}.
 * <p>
 * Lets several engines inside one JVM share refresh locks. The ttl hint is ignored;
 * record age is taken from the record timestamp.
 * </p>
 *
 * @since 2025-01
 */
public class ConcurrentMapLockRecordStore implements LockRecordStore {

	private final ConcurrentMap<String, String> records = new ConcurrentHashMap<>();

	@Override
	public boolean createIfAbsent(String lockKey, String value, Duration ttl) {
		return records.putIfAbsent(lockKey, value) == null;
	}

	@Override
	public Optional<String> get(String lockKey) {
		return Optional.ofNullable(records.get(lockKey));
	}

	@Override
	public void put(String lockKey, String value, Duration ttl) {
		records.put(lockKey, value);
	}

	@Override
	public void delete(String lockKey) {
		records.remove(lockKey);
	}

	public int size() {
		return records.size();
	}
}
