package org.scriptonbasestar.echocache.core.lock;

import org.junit.Test;

import java.time.Instant;

import static org.junit.Assert.*;

public class LockRecordTest {

	@Test
	public void testEncodeAndParse() {
		Instant ts = Instant.parse("2025-01-01T10:15:30.123Z");
		LockRecord record = LockRecord.of("abc", ts);

		assertEquals("abc|2025-01-01T10:15:30.123Z", record.encode());

		LockRecord parsed = LockRecord.parse(record.encode()).get();
		assertEquals("abc", parsed.getToken());
		assertEquals(ts, parsed.getTimestamp());
		assertTrue(parsed.isOwnedBy("abc"));
		assertFalse(parsed.isOwnedBy("abd"));
	}

	@Test
	public void testMalformedValues() {
		assertFalse(LockRecord.parse(null).isPresent());
		assertFalse(LockRecord.parse("").isPresent());
		assertFalse(LockRecord.parse("token").isPresent());
		assertFalse(LockRecord.parse("token|").isPresent());
		assertFalse(LockRecord.parse("|2025-01-01T00:00:00Z").isPresent());
		assertFalse(LockRecord.parse("a|b|c").isPresent());
		assertFalse(LockRecord.parse("token|yesterday").isPresent());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyTokenRejected() {
		LockRecord.of("", Instant.now());
	}
}
