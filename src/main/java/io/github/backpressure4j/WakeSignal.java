package io.github.backpressure4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;

/**
 * Broadcast wake signal shared by producers and consumers, it carries no payload.
 * <p>
 * Threads park on a {@link Condition} of the owner's lock, async attempts leave a one-shot registration instead.
 * Every method must be called while holding that lock, so a check followed by await() or register() can't miss a fire().
 */
final class WakeSignal {

	private final Condition parked;
	private final Set<Runnable> registrations = new LinkedHashSet<>();

	WakeSignal(Lock lock) {
		this.parked = lock.newCondition();
	}

	void await() throws InterruptedException {
		parked.await();
	}

	/**
	 * @see Condition#awaitNanos(long)
	 */
	long awaitNanos(long nanos) throws InterruptedException {
		return parked.awaitNanos(nanos);
	}

	void register(Runnable attempt) {
		registrations.add(attempt);
	}

	boolean unregister(Runnable attempt) {
		return registrations.remove(attempt);
	}

	int registered() {
		return registrations.size();
	}

	/**
	 * Wakes all parked threads and drains the registrations.
	 *
	 * @return registrations to run after the lock is released, never null
	 */
	List<Runnable> fire() {
		parked.signalAll();
		if (registrations.isEmpty()) {
			return Collections.emptyList();
		}
		List<Runnable> woken = new ArrayList<>(registrations);
		registrations.clear();
		return woken;
	}
}
