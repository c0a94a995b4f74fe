package io.github.bluuewhale.cuckoo;

/**
 * The two candidate-position hash functions.
 *
 * <p>{@link #index0} and {@link #index1} mix the base hash differently so that the two candidate
 * slots of an element are effectively independent.
 */
final class Hashing {
	private Hashing() {}

	/* Murmur3 constants */
	private static final int C1 = 0xcc9e2d51;
	private static final int C2 = 0x1b873593;
	private static final int SEED1 = 0x85ebca6b;

	static int smearedHash(Object o) {
		return C2 * Integer.rotateLeft(o.hashCode() * C1, 15);
	}

	/** Slot of {@code x} in table 0, in {@code [0, capacity)}. */
	static int index0(Object x, int capacity) {
		if (capacity == 0) return 0;
		return (smearedHash(x) & Integer.MAX_VALUE) % capacity;
	}

	/** Slot of {@code x} in table 1, in {@code [0, capacity)}. */
	static int index1(Object x, int capacity) {
		if (capacity == 0) return 0;
		return (fmix(x.hashCode() ^ SEED1) & Integer.MAX_VALUE) % capacity;
	}

	/** Murmur3 32-bit finalizer. */
	static int fmix(int h) {
		h ^= h >>> 16;
		h *= 0x85ebca6b;
		h ^= h >>> 13;
		h *= 0xc2b2ae35;
		h ^= h >>> 16;
		return h;
	}
}
