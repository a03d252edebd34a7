package org.scriptonbasestar.echocache.core.lock;

import org.scriptonbasestar.echocache.core.exception.SBRefreshLockException;
import org.scriptonbasestar.echocache.core.util.TimeCheckerUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Refresh lock implemented as a {@code token|timestamp} record in a shared {@link LockRecordStore}.
 *
 * <h3>Acquire:</h3>
 * <ol>
 *   <li>create-if-absent {@code lock:<key>}; success means acquired</li>
 *   <li>otherwise read the record
 *     <ul>
 *       <li>gone or malformed: delete it and start over</li>
 *       <li>same token: renew the timestamp, acquired</li>
 *       <li>other token, younger than ttl: not acquired, nothing changed</li>
 *       <li>other token, older than ttl: abandoned, delete and start over</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <h3>Release:</h3>
 * <p>
 * Absent record or a foreign token: no-op. Own token or malformed record: delete.
 * </p>
 *
 * <p>
 * Concurrent acquirers of an absent key are serialized by the store's atomic create only.
 * An abandoned lock may briefly be claimed by two processes; that window is bounded by the ttl.
 * </p>
 *
 * @since 2025-01
 */
public class RecordRefreshLock implements RefreshLock {

	private static final Logger log = LoggerFactory.getLogger(RecordRefreshLock.class);

	public static final String LOCK_KEY_PREFIX = "lock:";
	public static final int DEFAULT_MAX_ATTEMPTS = 5;

	private final LockRecordStore records;
	private final Clock clock;
	private final int maxAttempts;

	public RecordRefreshLock(LockRecordStore records) {
		this(records, Clock.systemUTC(), DEFAULT_MAX_ATTEMPTS);
	}

	public RecordRefreshLock(LockRecordStore records, Clock clock) {
		this(records, clock, DEFAULT_MAX_ATTEMPTS);
	}

	public RecordRefreshLock(LockRecordStore records, Clock clock, int maxAttempts) {
		if (records == null) {
			throw new IllegalArgumentException("LockRecordStore must not be null");
		}
		if (clock == null) {
			throw new IllegalArgumentException("Clock must not be null");
		}
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		this.records = records;
		this.clock = clock;
		this.maxAttempts = maxAttempts;
	}

	public static String lockKey(String key) {
		return LOCK_KEY_PREFIX + key;
	}

	@Override
	public boolean tryAcquireRefreshLock(String key, String token, Duration ttl) throws SBRefreshLockException {
		if (ttl == null || ttl.isNegative() || ttl.isZero()) {
			throw new IllegalArgumentException("ttl must be positive");
		}
		String lockKey = lockKey(key);

		for (int attempt = 1; attempt <= maxAttempts; attempt++) {
			Instant now = clock.instant();
			String record = LockRecord.of(token, now).encode();

			if (records.createIfAbsent(lockKey, record, ttl)) {
				log.trace("Refresh lock acquired - key : {}, token : {}", lockKey, token);
				return true;
			}

			Optional<String> stored = records.get(lockKey);
			if (!stored.isPresent()) {
				log.trace("Refresh lock vanished before read, retrying - key : {}", lockKey);
				continue;
			}

			Optional<LockRecord> current = LockRecord.parse(stored.get());
			if (!current.isPresent()) {
				log.warn("Malformed refresh lock record, deleting - key : {}, value : {}", lockKey, stored.get());
				records.delete(lockKey);
				continue;
			}

			LockRecord holder = current.get();
			if (holder.isOwnedBy(token)) {
				records.put(lockKey, record, ttl);
				log.trace("Refresh lock renewed - key : {}, token : {}", lockKey, token);
				return true;
			}

			if (!TimeCheckerUtil.isOlderThan(holder.getTimestamp(), ttl, clock)) {
				log.trace("Refresh lock held by another owner - key : {}, holder : {}", lockKey, holder.getToken());
				return false;
			}

			log.debug("Refresh lock abandoned, taking over - key : {}, holder : {}, since : {}",
				lockKey, holder.getToken(), holder.getTimestamp());
			records.delete(lockKey);
		}

		log.warn("Refresh lock not acquired after {} attempts - key : {}", maxAttempts, lockKey);
		return false;
	}

	@Override
	public void releaseRefreshLock(String key, String token) throws SBRefreshLockException {
		String lockKey = lockKey(key);
		Optional<String> stored = records.get(lockKey);
		if (!stored.isPresent()) {
			return;
		}

		Optional<LockRecord> current = LockRecord.parse(stored.get());
		if (!current.isPresent()) {
			log.warn("Malformed refresh lock record on release, deleting - key : {}", lockKey);
			records.delete(lockKey);
			return;
		}
		if (!current.get().isOwnedBy(token)) {
			log.trace("Refresh lock not owned by caller, leaving it - key : {}, token : {}", lockKey, token);
			return;
		}
		records.delete(lockKey);
		log.trace("Refresh lock released - key : {}, token : {}", lockKey, token);
	}
}
