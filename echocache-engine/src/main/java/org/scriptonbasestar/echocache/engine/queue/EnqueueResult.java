package org.scriptonbasestar.echocache.engine.queue;

/**
 * Outcome of a non-blocking {@link RefreshTaskQueue#offer(RefreshTask)}.
 *
 * @since 2025-01
 */
public enum EnqueueResult {
	/**
	 * Task queued for a worker.
	 */
	ACCEPTED,
	/**
	 * A task for the same key is already queued or running; this one was discarded.
	 */
	DUPLICATE,
	/**
	 * Queue at capacity; task dropped.
	 */
	QUEUE_FULL,
	/**
	 * Queue shut down; task discarded.
	 */
	CLOSED
}
