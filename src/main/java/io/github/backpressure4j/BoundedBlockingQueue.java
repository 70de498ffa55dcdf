package io.github.backpressure4j;


import io.github.backpressure4j.internal.QueueUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * BoundedBlockingQueue is a fixed-capacity FIFO buffer which provides backpressure between producers and consumers:
 * producers wait while it is full, consumers wait while it is empty.
 * <p>
 * Every operation exists in two forms:
 * <ul><li> blocking ({@link #put}, {@link #take}, {@link #offer}, {@link #poll}) for code that owns its thread
 * <li> async ({@link #putAsync}, {@link #takeAsync}, {@link #offerAsync}, {@link #pollAsync}) for tasks sharing a small pool,
 * these never park a thread
 * </ul>
 * Both forms share the same buffer and the same wake signal, so they can be mixed freely on one instance. <p>
 * Waiters are not queued: every committed insertion or removal wakes all of them, and each one re-checks the buffer.
 * There is no ordering among waiters of the same kind. <p>
 * The timed forms are all-or-nothing: either the element was inserted (removed) or the queue is unchanged. <p>
 * Null elements are not permitted.
 *
 * @param <T> type of queue items
 */
@SuppressWarnings("WeakerAccess")
public final class BoundedBlockingQueue<T> {
	private static final Logger log = LoggerFactory.getLogger(BoundedBlockingQueue.class);

	private final ReentrantLock lock = new ReentrantLock();
	private final WakeSignal wakeSignal = new WakeSignal(lock);
	private final ArrayDeque<T> buffer;
	private final int capacity;
	private final Object id;
	private final Executor threadPool;
	private final Timer timer;
	private final LongAdder expiredOffers = new LongAdder();
	private final LongAdder expiredPolls = new LongAdder();
	private final QueueStats stats = new Stats();

	public static Conf newConf() {
		return new Conf();
	}

	public BoundedBlockingQueue(Conf config) {
		if (config.capacity <= 0) {
			throw new IllegalArgumentException("capacity is not set, see Conf.setCapacity(int)");
		}
		this.capacity = config.capacity;
		this.buffer = QueueUtil.newBuffer(capacity);
		this.id = config.id;
		this.threadPool = config.threadPool;
		this.timer = config.timer;
		log.trace("{} created, capacity={}", this, capacity);
	}

	public BoundedBlockingQueue(int capacity) {
		this(QueueUtil.with(newConf(), c -> c.setCapacity(capacity)));
	}

	/**
	 * This form of constructor can save you a few lines of code: you don't need to create configuration object yourself.
	 */
	public BoundedBlockingQueue(Consumer<Conf> configInit) {
		this(QueueUtil.with(newConf(), configInit));
	}

	/**
	 * Appends the item to the tail, waiting for free space as long as necessary.
	 *
	 * @throws InterruptedException if interrupted while waiting, the item is not inserted then
	 */
	public void put(T item) throws InterruptedException {
		requireNonNull(item);
		List<Runnable> woken;
		lock.lockInterruptibly();
		try {
			while (buffer.size() >= capacity) {
				wakeSignal.await();
			}
			buffer.addLast(item);
			woken = wakeSignal.fire();
		} finally {
			lock.unlock();
		}
		dispatch(woken);
	}

	/**
	 * Removes the head, waiting for an element as long as necessary.
	 *
	 * @throws InterruptedException if interrupted while waiting, nothing is removed then
	 */
	public T take() throws InterruptedException {
		T item;
		List<Runnable> woken;
		lock.lockInterruptibly();
		try {
			while (buffer.isEmpty()) {
				wakeSignal.await();
			}
			item = buffer.pollFirst();
			woken = wakeSignal.fire();
		} finally {
			lock.unlock();
		}
		dispatch(woken);
		return item;
	}

	/**
	 * Like {@link #put(Object)}, but gives up when the timeout elapses.
	 * Zero or negative timeout still checks for free space once.
	 *
	 * @return false if the timeout elapsed, the item is not inserted in that case
	 */
	public boolean offer(T item, Duration timeout) throws InterruptedException {
		return offerNanos(item, TimeUnit.NANOSECONDS.convert(requireNonNull(timeout)));
	}

	/**
	 * @see #offer(Object, Duration)
	 */
	public boolean offer(T item, long timeout, TimeUnit unit) throws InterruptedException {
		return offerNanos(item, unit.toNanos(timeout));
	}

	/**
	 * Like {@link #take()}, but gives up when the timeout elapses.
	 * Zero or negative timeout still checks for an element once.
	 *
	 * @return Optional.empty if the timeout elapsed
	 */
	public Optional<T> poll(Duration timeout) throws InterruptedException {
		return pollNanos(TimeUnit.NANOSECONDS.convert(requireNonNull(timeout)));
	}

	/**
	 * @see #poll(Duration)
	 */
	public Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException {
		return pollNanos(unit.toNanos(timeout));
	}

	private boolean offerNanos(T item, long nanos) throws InterruptedException {
		requireNonNull(item);
		List<Runnable> woken = null;
		lock.lockInterruptibly();
		try {
			while (buffer.size() >= capacity && nanos > 0L) {
				nanos = wakeSignal.awaitNanos(nanos);
			}
			if (buffer.size() < capacity) {
				buffer.addLast(item);
				woken = wakeSignal.fire();
			}
		} finally {
			lock.unlock();
		}
		if (woken == null) {
			expiredOffers.increment();
			log.debug("{} : offer timed out", this);
			return false;
		}
		dispatch(woken);
		return true;
	}

	private Optional<T> pollNanos(long nanos) throws InterruptedException {
		T item;
		List<Runnable> woken = null;
		lock.lockInterruptibly();
		try {
			while (buffer.isEmpty() && nanos > 0L) {
				nanos = wakeSignal.awaitNanos(nanos);
			}
			item = buffer.pollFirst();
			if (item != null) {
				woken = wakeSignal.fire();
			}
		} finally {
			lock.unlock();
		}
		if (woken == null) {
			expiredPolls.increment();
			log.debug("{} : poll timed out", this);
			return Optional.empty();
		}
		dispatch(woken);
		return Optional.of(item);
	}

	/**
	 * Async form of {@link #put(Object)}, the resultant stage completes once the item is inserted.
	 */
	public CompletionStage<Void> putAsync(T item) {
		return new Insertion(requireNonNull(item)).start().thenApply(ignored -> null);
	}

	/**
	 * Async form of {@link #take()}.
	 */
	public CompletionStage<T> takeAsync() {
		return new Removal().start().thenApply(Optional::get);
	}

	/**
	 * Async form of {@link #offer(Object, Duration)}, the timeout is driven by the configured {@link Timer}.
	 *
	 * @return stage completed with false if the timeout elapsed, the item is not inserted in that case
	 */
	public CompletionStage<Boolean> offerAsync(T item, Duration timeout) {
		return new Insertion(requireNonNull(item)).start(TimeUnit.NANOSECONDS.convert(requireNonNull(timeout)));
	}

	/**
	 * Async form of {@link #poll(Duration)}, the timeout is driven by the configured {@link Timer}.
	 */
	public CompletionStage<Optional<T>> pollAsync(Duration timeout) {
		return new Removal().start(TimeUnit.NANOSECONDS.convert(requireNonNull(timeout)));
	}

	public int size() {
		lock.lock();
		try {
			return buffer.size();
		} finally {
			lock.unlock();
		}
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	public int remainingCapacity() {
		return capacity - size();
	}

	public int capacity() {
		return capacity;
	}

	/**
	 * Optional user associated id, it is used for logging, and in toString()
	 */
	public Object associatedId() {
		return id;
	}

	public QueueStats stats() {
		return stats;
	}

	private void dispatch(List<Runnable> woken) {
		for (Runnable attempt : woken) {
			try {
				threadPool.execute(attempt);
			} catch (RejectedExecutionException err) {
				log.error(errorMessage("thread pool rejected async wake-up, running it in place"), err);
				attempt.run();
			}
		}
	}

	private String errorMessage(String err) {
		return toString() + " : " + err;
	}

	@Override
	public String toString() {
		if (id != null) {
			return getClass().getSimpleName() + "@" + id;
		}
		return super.toString();
	}

	/**
	 * Async counterpart of the blocking wait loop: checks the buffer under the lock and either mutates it
	 * or registers itself on the wake signal, to be run again after the next fire.
	 * <p>
	 * Success and expiry are both decided under the lock, so exactly one of them settles the attempt.
	 */
	private abstract class Attempt<R> implements Runnable {
		private final CompletableFuture<R> result = new CompletableFuture<>();
		private boolean settled; // guarded by lock
		private volatile Future<?> expiry;

		/**
		 * Called under the lock.
		 *
		 * @return false if the attempt has to keep waiting
		 */
		abstract boolean tryMutate();

		abstract R outcome();

		abstract R expiredOutcome();

		/**
		 * Returns a minimal stage, so that callers can't complete or cancel the attempt.
		 */
		final CompletionStage<R> start() {
			run();
			return result.minimalCompletionStage();
		}

		final CompletionStage<R> start(long timeoutNanos) {
			run();
			if (!result.isDone()) {
				if (timeoutNanos <= 0L) {
					expire();
				} else {
					Future<?> f = timer.delay(this::expire, timeoutNanos, TimeUnit.NANOSECONDS);
					expiry = f;
					// settled by a wake-up before the handle was published
					if (f != null && result.isDone()) {
						f.cancel(false);
					}
				}
			}
			return result.minimalCompletionStage();
		}

		@Override
		public final void run() {
			List<Runnable> woken;
			lock.lock();
			try {
				if (settled) {
					return;
				}
				if (!tryMutate()) {
					wakeSignal.register(this);
					return;
				}
				settled = true;
				woken = wakeSignal.fire();
			} finally {
				lock.unlock();
			}
			dispatch(woken);
			Future<?> f = expiry;
			if (f != null) {
				f.cancel(false);
			}
			result.complete(outcome());
		}

		private void expire() {
			lock.lock();
			try {
				if (settled) {
					return;
				}
				settled = true;
				wakeSignal.unregister(this);
			} finally {
				lock.unlock();
			}
			result.complete(expiredOutcome());
		}
	}

	private final class Insertion extends Attempt<Boolean> {
		private final T item;

		Insertion(T item) {
			this.item = item;
		}

		@Override
		boolean tryMutate() {
			if (buffer.size() >= capacity) {
				return false;
			}
			buffer.addLast(item);
			return true;
		}

		@Override
		Boolean outcome() {
			return Boolean.TRUE;
		}

		@Override
		Boolean expiredOutcome() {
			expiredOffers.increment();
			log.debug("{} : async offer timed out", BoundedBlockingQueue.this);
			return Boolean.FALSE;
		}
	}

	private final class Removal extends Attempt<Optional<T>> {
		private T item;

		@Override
		boolean tryMutate() {
			item = buffer.pollFirst();
			return item != null;
		}

		@Override
		Optional<T> outcome() {
			return Optional.of(item);
		}

		@Override
		Optional<T> expiredOutcome() {
			expiredPolls.increment();
			log.debug("{} : async poll timed out", BoundedBlockingQueue.this);
			return Optional.empty();
		}
	}

	private final class Stats extends QueueStats {

		@Override
		public int queueSize() {
			return size();
		}

		@Override
		public int capacity() {
			return capacity;
		}

		@Override
		public int waitingAsync() {
			lock.lock();
			try {
				return wakeSignal.registered();
			} finally {
				lock.unlock();
			}
		}

		@Override
		public long expiredOffers() {
			return expiredOffers.sum();
		}

		@Override
		public long expiredPolls() {
			return expiredPolls.sum();
		}

		@Override
		public Object associatedId() {
			return id;
		}
	}

	/**
	 * Configuration object.
	 * The capacity is mandatory, everything else has a default.
	 */
	public static class Conf {
		private int capacity;
		private Object id;
		private Executor threadPool = ForkJoinPool.commonPool();
		private Timer timer = Timer.defaultInstance();

		/**
		 * @param capacity max queue size, fixed for the life of the queue.
		 */
		public void setCapacity(int capacity) {
			if (capacity <= 0) {
				throw new IllegalArgumentException("capacity must be positive: " + capacity);
			}
			this.capacity = capacity;
		}

		/**
		 * Optional user associated id, it is used for logging, and in toString()
		 *
		 * @param id must have good readable toString() representation
		 */
		public void setAssociatedId(Object id) {
			this.id = Objects.requireNonNull(id);
		}

		/**
		 * Pool which re-runs suspended async operations after a wake-up. Default pool is FJP.
		 * Blocking operations never use it.
		 */
		public void setThreadPool(Executor threadPool) {
			this.threadPool = Objects.requireNonNull(threadPool);
		}

		/**
		 * Timer driving the timeouts of {@link BoundedBlockingQueue#offerAsync} and {@link BoundedBlockingQueue#pollAsync}.
		 */
		public void setTimer(Timer timer) {
			this.timer = Objects.requireNonNull(timer);
		}
	}
}
