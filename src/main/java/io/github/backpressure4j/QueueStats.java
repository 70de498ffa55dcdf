package io.github.backpressure4j;

/**
 * API for reporting/monitoring usage.
 * Stats usage only, never use it for the logic of your App.
 */
public abstract class QueueStats {

	public abstract int queueSize();

	public abstract int capacity();

	/**
	 * Async operations currently suspended on the wake signal.
	 */
	public abstract int waitingAsync();

	/**
	 * Offers (blocking or async) that gave up because their timeout elapsed.
	 */
	public abstract long expiredOffers();

	public abstract long expiredPolls();

	/**
	 * user associated id.
	 */
	public abstract Object associatedId();

	@Override
	public String toString() {
		Object id = associatedId();
		return "QueueStats" + (id != null ? "@" + id : "") +
				"{size=" + queueSize() + "/" + capacity() +
				", waitingAsync=" + waitingAsync() +
				", expiredOffers=" + expiredOffers() +
				", expiredPolls=" + expiredPolls() + '}';
	}
}
