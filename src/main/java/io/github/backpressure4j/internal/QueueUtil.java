package io.github.backpressure4j.internal;


import java.util.ArrayDeque;
import java.util.function.Consumer;

public final class QueueUtil {

	/**
	 * Buffers are never preallocated beyond this many slots, large capacities grow on demand.
	 */
	private static final int preallocLimit = Integer.getInteger("backpressure4j.preallocLimit", 1024);

	static {
		if (preallocLimit < 1) {
			throw new IllegalStateException("backpressure4j.preallocLimit must be positive: " + preallocLimit);
		}
	}

	private QueueUtil() {
	}

	public static <T> T with(T t, Consumer<? super T> scope) {
		scope.accept(t);
		return t;
	}

	public static <T> ArrayDeque<T> newBuffer(int capacity) {
		assert capacity > 0;
		return new ArrayDeque<>(Math.min(capacity, preallocLimit));
	}
}
