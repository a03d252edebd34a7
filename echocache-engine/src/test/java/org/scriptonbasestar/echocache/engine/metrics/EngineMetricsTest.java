package org.scriptonbasestar.echocache.engine.metrics;

import org.junit.Test;

import static org.junit.Assert.*;

public class EngineMetricsTest {

	@Test
	public void testHitRateCountsStaleHits() {
		EngineMetrics metrics = new EngineMetrics();
		assertEquals(0.0, metrics.hitRate(), 0.0);

		metrics.recordHit();
		metrics.recordStaleHit();
		metrics.recordMiss();
		metrics.recordMiss();

		assertEquals(4, metrics.requestCount());
		assertEquals(0.5, metrics.hitRate(), 0.0001);
	}

	@Test
	public void testAverageComputeTime() {
		EngineMetrics metrics = new EngineMetrics();
		metrics.recordComputeSuccess(1_000);
		metrics.recordComputeSuccess(3_000);
		metrics.recordComputeFailure();

		assertEquals(2_000.0, metrics.averageComputeNanos(), 0.0001);
		assertEquals(1, metrics.computeFailureCount());
	}

	@Test
	public void testReset() {
		EngineMetrics metrics = new EngineMetrics();
		metrics.recordHit();
		metrics.recordRefreshDropped();
		metrics.recordRefreshLockSkip();
		metrics.reset();

		assertEquals(0, metrics.requestCount());
		assertEquals(0, metrics.refreshDroppedCount());
		assertEquals(0, metrics.refreshLockSkipCount());
		assertTrue(metrics.toString().startsWith("EngineMetrics{requests=0"));
	}
}
