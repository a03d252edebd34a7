package org.scriptonbasestar.echocache.engine.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Bounded background queue for refresh tasks.
 * <p>
 * {@link #offer(RefreshTask)} never blocks: when the queue is full the task is dropped.
 * A key has at most one task queued or running at a time, so several workers never
 * refresh the same key concurrently.
 * </p>
 *
 * <h3>Lifecycle:</h3>
 * <p>
 * Workers start in the constructor. {@link #shutdown()} stops accepting tasks, discards queued ones
 * and interrupts the workers. Running tasks are not waited for beyond the shutdown timeout.
 * </p>
 *
 * @param <T> the value type of the tasks
 * @since 2025-01
 */
public class RefreshTaskQueue<T> implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(RefreshTaskQueue.class);

	private static final AtomicInteger QUEUE_SEQUENCE = new AtomicInteger();

	private final BlockingQueue<RefreshTask<T>> queue;
	private final Set<String> pendingKeys = ConcurrentHashMap.newKeySet();
	private final Consumer<RefreshTask<T>> processor;
	private final ExecutorService workers;
	private final AtomicBoolean closed = new AtomicBoolean(false);
	private final int capacity;
	private final Duration shutdownTimeout;

	/**
	 * @param capacity maximum number of queued tasks
	 * @param workerThreads number of consumer threads
	 * @param shutdownTimeout how long {@link #shutdown()} waits for workers to stop
	 * @param processor runs one task; exceptions are logged and do not stop the worker
	 */
	public RefreshTaskQueue(int capacity, int workerThreads, Duration shutdownTimeout,
							Consumer<RefreshTask<T>> processor) {
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be at least 1");
		}
		if (workerThreads < 1) {
			throw new IllegalArgumentException("workerThreads must be at least 1");
		}
		if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
			throw new IllegalArgumentException("shutdownTimeout must not be null or negative");
		}
		if (processor == null) {
			throw new IllegalArgumentException("processor must not be null");
		}
		this.capacity = capacity;
		this.shutdownTimeout = shutdownTimeout;
		this.processor = processor;
		this.queue = new ArrayBlockingQueue<>(capacity);

		int queueId = QUEUE_SEQUENCE.incrementAndGet();
		AtomicInteger threadSequence = new AtomicInteger();
		this.workers = Executors.newFixedThreadPool(workerThreads, r -> {
			Thread t = new Thread(r, "EchoCache-Refresh-" + queueId + "-" + threadSequence.incrementAndGet());
			t.setDaemon(true);
			return t;
		});
		for (int i = 0; i < workerThreads; i++) {
			workers.submit(this::drain);
		}
		log.debug("Refresh task queue started: capacity={}, workers={}", capacity, workerThreads);
	}

	/**
	 * Enqueues without blocking.
	 *
	 * @param task task to run
	 * @return what happened to the task
	 */
	public EnqueueResult offer(RefreshTask<T> task) {
		if (closed.get()) {
			return EnqueueResult.CLOSED;
		}
		if (!pendingKeys.add(task.getKey())) {
			return EnqueueResult.DUPLICATE;
		}
		if (!queue.offer(task)) {
			pendingKeys.remove(task.getKey());
			return EnqueueResult.QUEUE_FULL;
		}
		return EnqueueResult.ACCEPTED;
	}

	private void drain() {
		while (!closed.get()) {
			RefreshTask<T> task;
			try {
				task = queue.take();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return;
			}
			try {
				processor.accept(task);
			} catch (RuntimeException | Error e) {
				log.error("Refresh task failed - key : {}", task.getKey(), e);
			} finally {
				pendingKeys.remove(task.getKey());
			}
		}
	}

	/**
	 * @return number of tasks waiting for a worker
	 */
	public int size() {
		return queue.size();
	}

	public int capacity() {
		return capacity;
	}

	public boolean isClosed() {
		return closed.get();
	}

	/**
	 * Stops the workers. Idempotent.
	 */
	public void shutdown() {
		if (!closed.compareAndSet(false, true)) {
			return;
		}
		int discarded = queue.size();
		queue.clear();
		log.debug("Shutting down refresh task queue, discarding {} queued task(s)", discarded);

		workers.shutdownNow();
		try {
			if (!workers.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
				log.warn("Refresh workers did not terminate within {}", shutdownTimeout);
			}
		} catch (InterruptedException e) {
			log.warn("Interrupted while waiting for refresh workers termination", e);
			Thread.currentThread().interrupt();
		}
		pendingKeys.clear();
	}

	@Override
	public void close() {
		shutdown();
	}
}
