package io.github.bluuewhale.cuckoo;

import java.util.ArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jspecify.annotations.Nullable;

/**
 * Builds a grown replacement for a {@link BucketTable}.
 *
 * <p>Elements are re-placed with the same {@link CuckooInserter} into a private candidate table. If
 * any element cannot be placed, the candidate is dropped and the next doubling is tried, at most
 * {@value #MAX_GROWTH_STEPS} doublings per call. Elements whose hash codes collide outright share both
 * candidate slots at every capacity, so further doubling cannot separate them. Nothing is visible to other threads until the caller publishes the returned table, so a failed grow leaves the
 * old table as the last consistent state.
 *
 * <p>Callers hold every stripe while this runs.
 */
final class Rehasher {

	private static final Logger LOGGER = Logger.getLogger(Rehasher.class.getName());

	/** Doublings one call may try, the first included. */
	static final int MAX_GROWTH_STEPS = 3;

	private final CuckooInserter inserter;
	private final int maxCapacity;

	Rehasher(CuckooInserter inserter, int maxCapacity) {
		this.inserter = inserter;
		this.maxCapacity = maxCapacity;
	}

	/**
	 * Rehashes every element of {@code old}, plus {@code extra} if non-null, into the smallest doubling
	 * that holds them all, trying at most {@value #MAX_GROWTH_STEPS} doublings.
	 *
	 * @return the grown table, or {@code null} if the growth steps ran out, the capacity ceiling was
	 *         reached or allocation failed
	 */
	<E> @Nullable BucketTable<E> grow(BucketTable<E> old, @Nullable E extra) {
		ArrayList<E> elements;
		try {
			elements = old.snapshot();
			if (extra != null) elements.add(extra);
		} catch (OutOfMemoryError e) {
			LOGGER.log(Level.SEVERE, "Allocation failed collecting elements for resize at " + old.capacity, e);
			return null;
		}

		int cap = old.capacity;
		for (int step = 0; step < MAX_GROWTH_STEPS; step++) {
			int newCap = Utils.doubled(cap, maxCapacity);
			if (newCap < 0) {
				LOGGER.severe("Capacity ceiling " + maxCapacity + " reached; cannot grow past " + cap
					+ " holding " + elements.size() + " elements");
				return null;
			}

			BucketTable<E> fresh;
			try {
				fresh = new BucketTable<>(newCap);
			} catch (OutOfMemoryError e) {
				LOGGER.log(Level.SEVERE, "Allocation failed growing " + old.capacity + " -> " + newCap, e);
				return null;
			}

			if (rehashInto(fresh, elements)) {
				if (LOGGER.isLoggable(Level.FINE)) {
					LOGGER.fine("Resized " + old.capacity + " -> " + newCap + " (" + elements.size() + " elements)");
				}
				return fresh;
			}
			LOGGER.warning("Rehash into capacity " + newCap + " exhausted the kick budget");
			cap = newCap;
		}
		LOGGER.severe("Gave up growing " + old.capacity + " after " + MAX_GROWTH_STEPS + " doublings (last tried "
			+ cap + ") holding " + elements.size() + " elements");
		return null;
	}

	private <E> boolean rehashInto(BucketTable<E> fresh, ArrayList<E> elements) {
		for (E e : elements) {
			if (!inserter.place(fresh, e).succeeded()) return false;
		}
		return true;
	}
}
