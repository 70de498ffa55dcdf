package io.github.backpressure4j;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

import static org.testng.Assert.*;


public class BoundedBlockingQueueTest {

	@Test
	public void testCapacityOneScenario() throws Exception {
		BoundedBlockingQueue<Integer> q = new BoundedBlockingQueue<>(1);
		q.put(1);
		assertEquals(q.size(), 1);

		long start = System.nanoTime();
		assertFalse(q.offer(2, Duration.ofMillis(100)));
		long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
		assertTrue(elapsedMs >= 90, "offer gave up too early: " + elapsedMs);
		assertTrue(elapsedMs < 2000, "offer gave up too late: " + elapsedMs);
		assertEquals(q.size(), 1);

		assertEquals(q.take().intValue(), 1);
		assertTrue(q.isEmpty());

		start = System.nanoTime();
		assertEquals(q.poll(Duration.ofMillis(100)), Optional.empty());
		elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
		assertTrue(elapsedMs >= 90, "poll gave up too early: " + elapsedMs);
		assertEquals(q.stats().expiredOffers(), 1);
		assertEquals(q.stats().expiredPolls(), 1);
	}

	@Test
	public void testFifoOrder() throws Exception {
		int n = 100;
		BoundedBlockingQueue<Integer> q = new BoundedBlockingQueue<>(n);
		for (int i = 0; i < n; i++) {
			q.put(i);
		}
		assertEquals(q.remainingCapacity(), 0);
		for (int i = 0; i < n; i++) {
			assertEquals(q.take().intValue(), i);
		}
		assertTrue(q.isEmpty());
	}

	@Test
	public void testRoundTrip() throws Exception {
		BoundedBlockingQueue<String> q = new BoundedBlockingQueue<>(3);
		q.put("x");
		assertEquals(q.take(), "x");
		assertTrue(q.offer("y", Duration.ZERO));
		assertEquals(q.poll(0, TimeUnit.SECONDS), Optional.of("y"));
		assertTrue(q.offer("z", 10, TimeUnit.MILLISECONDS));
		assertEquals(q.take(), "z");
	}

	@Test
	public void testTakeWaitsForPut() throws Exception {
		BoundedBlockingQueue<String> q = new BoundedBlockingQueue<>(2);
		AtomicReference<String> taken = new AtomicReference<>();
		Thread consumer = new Thread(() -> {
			try {
				taken.set(q.take());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		});
		consumer.start();
		awaitWaiting(consumer);
		assertNull(taken.get());

		q.put("hello");
		consumer.join(5000);
		assertFalse(consumer.isAlive());
		assertEquals(taken.get(), "hello");
		assertTrue(q.isEmpty());
	}

	@Test
	public void testPutWaitsForFreeSpace() throws Exception {
		BoundedBlockingQueue<Integer> q = new BoundedBlockingQueue<>(1);
		q.put(111);
		Thread producer = new Thread(() -> {
			try {
				q.put(222);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		});
		producer.start();
		awaitWaiting(producer);
		assertEquals(q.size(), 1);

		assertEquals(q.take().intValue(), 111);
		producer.join(5000);
		assertFalse(producer.isAlive());
		assertEquals(q.take().intValue(), 222);
	}

	@Test
	public void testOfferSucceedsWhenSpaceIsFreedBeforeDeadline() throws Exception {
		BoundedBlockingQueue<Integer> q = new BoundedBlockingQueue<>(1);
		q.put(1);
		Thread consumer = new Thread(() -> {
			try {
				Thread.sleep(50);
				q.take();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		});
		consumer.start();
		assertTrue(q.offer(2, Duration.ofSeconds(5)));
		consumer.join(5000);
		assertEquals(q.take().intValue(), 2);
	}

	@Test
	public void testZeroTimeoutProbesOnce() throws Exception {
		BoundedBlockingQueue<Integer> q = new BoundedBlockingQueue<>(2);
		assertTrue(q.offer(1, Duration.ZERO));
		assertTrue(q.offer(2, Duration.ofMillis(-5)));
		assertFalse(q.offer(3, Duration.ZERO));
		assertEquals(q.poll(Duration.ZERO), Optional.of(1));
		assertEquals(q.poll(Duration.ZERO), Optional.of(2));
		assertEquals(q.poll(Duration.ZERO), Optional.empty());
	}

	@Test
	public void testInterruptedTakeLeavesQueueUnchanged() throws Exception {
		BoundedBlockingQueue<Integer> q = new BoundedBlockingQueue<>(1);
		AtomicReference<Throwable> err = new AtomicReference<>();
		Thread consumer = new Thread(() -> {
			try {
				q.take();
			} catch (Throwable e) {
				err.set(e);
			}
		});
		consumer.start();
		awaitWaiting(consumer);
		consumer.interrupt();
		consumer.join(5000);

		assertTrue(err.get() instanceof InterruptedException, "unexpected: " + err.get());
		q.put(5);
		assertEquals(q.size(), 1);
		assertEquals(q.take().intValue(), 5);
	}

	@Test
	public void testInvalidConstruction() {
		assertThrows(IllegalArgumentException.class, () -> new BoundedBlockingQueue<>(0));
		assertThrows(IllegalArgumentException.class, () -> new BoundedBlockingQueue<>(-1));
		assertThrows(IllegalArgumentException.class, () -> new BoundedBlockingQueue<>(c -> c.setAssociatedId("no-capacity")));
		assertThrows(IllegalArgumentException.class, () -> BoundedBlockingQueue.newConf().setCapacity(0));
		assertThrows(NullPointerException.class, () -> BoundedBlockingQueue.newConf().setThreadPool(null));
		assertThrows(NullPointerException.class, () -> BoundedBlockingQueue.newConf().setTimer(null));
	}

	@Test
	public void testNullsRejected() throws Exception {
		BoundedBlockingQueue<String> q = new BoundedBlockingQueue<>(1);
		assertThrows(NullPointerException.class, () -> q.put(null));
		assertThrows(NullPointerException.class, () -> q.offer(null, Duration.ZERO));
		assertThrows(NullPointerException.class, () -> q.offer("x", null));
		assertThrows(NullPointerException.class, () -> q.putAsync(null));
		assertTrue(q.isEmpty());
	}

	@Test
	public void testAssociatedId() {
		BoundedBlockingQueue<Object> q = new BoundedBlockingQueue<>(c -> {
			c.setCapacity(4);
			c.setAssociatedId("dispatch");
		});
		assertEquals(q.associatedId(), "dispatch");
		assertEquals(q.toString(), "BoundedBlockingQueue@dispatch");
		assertEquals(q.capacity(), 4);
		assertEquals(q.stats().toString(),
				"QueueStats@dispatch{size=0/4, waitingAsync=0, expiredOffers=0, expiredPolls=0}");
	}

	@Test
	public void testLargeCapacityIsNotPreallocatedUpFront() throws Exception {
		BoundedBlockingQueue<Integer> q = new BoundedBlockingQueue<>(Integer.MAX_VALUE);
		IntStream.range(0, 5000).forEach(i -> assertTrue(q.offerAsync(i, Duration.ZERO).toCompletableFuture().join()));
		assertEquals(q.size(), 5000);
		assertEquals(q.remainingCapacity(), Integer.MAX_VALUE - 5000);
	}

	static void awaitWaiting(Thread t) throws InterruptedException {
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
		while (t.getState() != Thread.State.WAITING && t.getState() != Thread.State.TIMED_WAITING) {
			assertTrue(System.nanoTime() < deadline, t + " never started waiting, state=" + t.getState());
			Thread.sleep(1);
		}
	}
}
