package io.github.bluuewhale.cuckoo;

import java.util.concurrent.locks.StampedLock;

/**
 * Fixed-size array of {@link StampedLock}s guarding bucket positions.
 *
 * <p>Lock order:
 * <ul>
 *   <li>Bucket index {@code i} (in either table) is guarded by stripe {@code i % count()}.</li>
 *   <li>An element needs the stripes of both candidate slots; they are taken lowest index first, and
 *   only once when both slots share a stripe.</li>
 *   <li>{@link #lockAll()} takes every stripe in ascending order.</li>
 * </ul>
 * Since every acquirer climbs the same ascending order, the wait-for graph has no cycle.
 */
final class LockStripe {

	private final StampedLock[] locks;

	LockStripe(int stripeCount) {
		Utils.validateStripeCount(stripeCount);
		StampedLock[] locks = new StampedLock[stripeCount];
		for (int i = 0; i < stripeCount; i++) {
			locks[i] = new StampedLock();
		}
		this.locks = locks;
	}

	int count() {
		return locks.length;
	}

	int stripeOf(int bucketIndex) {
		return bucketIndex % locks.length;
	}

	/** Stripes guarding both candidate slots of {@code x} at {@code capacity}, ordered ascending. */
	StripePair indicesOf(Object x, int capacity) {
		int s0 = stripeOf(Hashing.index0(x, capacity));
		int s1 = stripeOf(Hashing.index1(x, capacity));
		return new StripePair(Math.min(s0, s1), Math.max(s0, s1));
	}

	Guard lockWrite(StripePair p) {
		if (p.isSingle()) {
			StampedLock l = locks[p.low()];
			return new Guard(new StampedLock[] { l }, new long[] { l.writeLock() }, true);
		}
		StampedLock lo = locks[p.low()];
		StampedLock hi = locks[p.high()];
		long loStamp = lo.writeLock();
		long hiStamp = hi.writeLock();
		return new Guard(new StampedLock[] { lo, hi }, new long[] { loStamp, hiStamp }, true);
	}

	Guard lockRead(StripePair p) {
		if (p.isSingle()) {
			StampedLock l = locks[p.low()];
			return new Guard(new StampedLock[] { l }, new long[] { l.readLock() }, false);
		}
		StampedLock lo = locks[p.low()];
		StampedLock hi = locks[p.high()];
		long loStamp = lo.readLock();
		long hiStamp = hi.readLock();
		return new Guard(new StampedLock[] { lo, hi }, new long[] { loStamp, hiStamp }, false);
	}

	/** Quiescence: every stripe in write mode. */
	Guard lockAll() {
		long[] stamps = new long[locks.length];
		for (int i = 0; i < locks.length; i++) {
			stamps[i] = locks[i].writeLock();
		}
		return new Guard(locks, stamps, true);
	}

	/** Every stripe in read mode; excludes writers but not other readers. */
	Guard lockAllRead() {
		long[] stamps = new long[locks.length];
		for (int i = 0; i < locks.length; i++) {
			stamps[i] = locks[i].readLock();
		}
		return new Guard(locks, stamps, false);
	}

	long tryOptimisticRead(int stripe) {
		return locks[stripe].tryOptimisticRead();
	}

	boolean validate(int stripe, long stamp) {
		return locks[stripe].validate(stamp);
	}

	/** Ordered stripe indices; {@code low <= high}. */
	record StripePair(int low, int high) {
		boolean isSingle() {
			return low == high;
		}
	}

	/**
	 * Scoped hold on one or more stripes. Releases in reverse acquisition order.
	 */
	static final class Guard implements AutoCloseable {
		private final StampedLock[] held;
		private final long[] stamps;
		private final boolean write;
		private boolean released;

		private Guard(StampedLock[] held, long[] stamps, boolean write) {
			this.held = held;
			this.stamps = stamps;
			this.write = write;
		}

		@Override
		public void close() {
			if (released) return;
			released = true;
			for (int i = held.length - 1; i >= 0; i--) {
				if (write) {
					held[i].unlockWrite(stamps[i]);
				} else {
					held[i].unlockRead(stamps[i]);
				}
			}
		}
	}
}
