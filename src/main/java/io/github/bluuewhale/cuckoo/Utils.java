package io.github.bluuewhale.cuckoo;

/**
 * Shared argument checks and capacity arithmetic.
 */
final class Utils {
	private Utils() {}

	static int validateCapacity(int initialCapacity, int defaultCapacity, int maxCapacity) {
		if (initialCapacity < 0) {
			throw new IllegalArgumentException("initialCapacity must be >= 0: " + initialCapacity);
		}
		int cap = (initialCapacity == 0) ? defaultCapacity : initialCapacity;
		if (cap > maxCapacity) {
			throw new IllegalArgumentException("initialCapacity exceeds maximum " + maxCapacity + ": " + cap);
		}
		return cap;
	}

	static int validateStripeCount(int stripeCount) {
		if (stripeCount <= 0) throw new IllegalArgumentException("stripeCount must be > 0: " + stripeCount);
		return stripeCount;
	}

	static int validateMaxKicks(int maxKicks) {
		if (maxKicks <= 0) throw new IllegalArgumentException("maxKicks must be > 0: " + maxKicks);
		return maxKicks;
	}

	/**
	 * Doubled capacity, or -1 when doubling would pass {@code maxCapacity}.
	 */
	static int doubled(int capacity, int maxCapacity) {
		if (capacity > (maxCapacity >>> 1)) return -1;
		return Math.max(1, capacity << 1);
	}
}
