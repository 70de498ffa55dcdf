package io.github.backpressure4j;


import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Schedules expiry of the timed async operations of {@link BoundedBlockingQueue}.
 */
@FunctionalInterface
public interface Timer {

	/**
	 * @return handle that is cancelled once the delayed action becomes pointless, implementations may return null
	 * if they don't support cancellation
	 */
	Future<?> delay(Runnable r, long timeout, TimeUnit unit);

	/**
	 * If you use Netty, it's good idea to implement Timer interface on top of HashWheelTimer, so avoid defaultInstance() in that case.
	 */
	static Timer defaultInstance() {
		return DefaultImpl.timer;
	}


	final class DefaultImpl {
		private static final ScheduledExecutorService sched = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, "backpressure4j-timer");
			t.setDaemon(true);
			return t;
		});
		private static final Timer timer = (r, t, u) -> sched.schedule(r, t, u);

		private DefaultImpl() {
		}
	}
}
