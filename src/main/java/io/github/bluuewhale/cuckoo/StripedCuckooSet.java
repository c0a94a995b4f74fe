package io.github.bluuewhale.cuckoo;

import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.logging.Logger;

import org.jspecify.annotations.Nullable;

/**
 * A thread-safe cuckoo hash set with lock striping and online resize.
 * Null elements are not supported.
 *
 * <p>Concurrency model:
 * <ul>
 *   <li><b>Layout</b>: two slot arrays of equal capacity; an element lives in table 0 at {@code index0}
 *   or table 1 at {@code index1}. Both arrays and their capacity are one {@link BucketTable}, published
 *   through a volatile field.</li>
 *   <li><b>Stripes</b>: slot {@code i} of either table is guarded by stripe {@code i % stripeCount}.
 *   An operation locks the stripes of its element's two candidate slots, lowest first.</li>
 *   <li><b>Reads</b>: {@code contains} tries an optimistic read of both stripes first, falling back to
 *   read locks.</li>
 *   <li><b>Re-validation</b>: after locking, an operation checks the published table is still the one
 *   it derived its indices from; otherwise it retries against the new one.</li>
 *   <li><b>Displacement and resize</b>: an add whose two candidate slots are full escalates to every
 *   stripe, runs the kick engine and, if that runs out of kicks, grows the table before releasing.</li>
 * </ul>
 *
 * <p>{@link #size()} is an atomic counter. It matches the number of stored elements whenever no add or
 * remove is in flight.
 */
public final class StripedCuckooSet<E> extends AbstractSet<E> {

	private static final Logger LOGGER = Logger.getLogger(StripedCuckooSet.class.getName());

	static final int DEFAULT_INITIAL_CAPACITY = 16;
	static final int DEFAULT_STRIPE_COUNT = 32;
	static final int DEFAULT_MAX_KICKS = 100;
	/** Ceiling for the capacity of each of the two tables. */
	static final int MAX_CAPACITY = 1 << 28;

	/** Add attempts that may end in a failed resize before giving up, if the table changes between them. */
	private static final int MAX_ADD_ATTEMPTS = 2;
	/** Stale-table retries for contains/remove before answering "not found". */
	private static final int MAX_STALE_RETRIES = 4;

	private final LockStripe stripes;
	private final CuckooInserter inserter;
	private final Rehasher rehasher;
	private final AtomicInteger size = new AtomicInteger();
	private volatile BucketTable<E> table;

	public StripedCuckooSet() {
		this(DEFAULT_INITIAL_CAPACITY, DEFAULT_STRIPE_COUNT);
	}

	public StripedCuckooSet(int initialCapacity) {
		this(initialCapacity, DEFAULT_STRIPE_COUNT);
	}

	/**
	 * @param initialCapacity slots per table; 0 selects the default of 16
	 * @param stripeCount number of locks, fixed for the life of the set
	 */
	public StripedCuckooSet(int initialCapacity, int stripeCount) {
		this(initialCapacity, stripeCount, DEFAULT_MAX_KICKS, MAX_CAPACITY);
	}

	StripedCuckooSet(int initialCapacity, int stripeCount, int maxKicks, int maxCapacity) {
		if (maxCapacity <= 0 || maxCapacity > MAX_CAPACITY) {
			throw new IllegalArgumentException("maxCapacity must be in (0, " + MAX_CAPACITY + "]: " + maxCapacity);
		}
		int cap = Utils.validateCapacity(initialCapacity, Math.min(DEFAULT_INITIAL_CAPACITY, maxCapacity), maxCapacity);
		this.stripes = new LockStripe(stripeCount);
		this.inserter = new CuckooInserter(maxKicks);
		this.rehasher = new Rehasher(inserter, maxCapacity);
		this.table = new BucketTable<>(cap);
	}

	/* Public API */

	/**
	 * Adds {@code e} following the {@link java.util.Set} contract.
	 *
	 * @throws IllegalStateException if the set could not make room for {@code e}
	 * @see #insert(Object)
	 */
	@Override
	public boolean add(E e) {
		AddResult r = insert(e);
		if (r == AddResult.FAILED_OVERLOADED) {
			throw new IllegalStateException("No room for element at capacity " + capacity());
		}
		return r == AddResult.ADDED;
	}

	/**
	 * Adds {@code e}, reporting every outcome. A {@link AddResult#FAILED_OVERLOADED} result leaves the
	 * set exactly as it was.
	 */
	public AddResult insert(E e) {
		Objects.requireNonNull(e, "Null elements not supported");
		int failures = 0;
		for (;;) {
			BucketTable<E> t = table;
			try (LockStripe.Guard g = stripes.lockWrite(stripes.indicesOf(e, t.capacity))) {
				if (t != table) continue;
				if (t.containsUnsafe(e)) return AddResult.ALREADY_PRESENT;
				if (t.placeDirect(e)) {
					size.incrementAndGet();
					return AddResult.ADDED;
				}
			}

			AddResult r = insertQuiescent(e, t);
			if (r == null) continue;
			if (r != AddResult.FAILED_OVERLOADED) return r;
			// Same table: another attempt would fail the same way.
			if (table == t || ++failures >= MAX_ADD_ATTEMPTS) return r;
		}
	}

	@Override
	public boolean remove(@Nullable Object o) {
		if (o == null) return false;
		for (int attempt = 0; attempt < MAX_STALE_RETRIES; attempt++) {
			BucketTable<E> t = table;
			try (LockStripe.Guard g = stripes.lockWrite(stripes.indicesOf(o, t.capacity))) {
				if (t != table) continue;
				if (!t.removeUnsafe(o)) return false;
				size.decrementAndGet();
				return true;
			}
		}
		return false;
	}

	@Override
	public boolean contains(@Nullable Object o) {
		if (o == null) return false;
		for (int attempt = 0; attempt < MAX_STALE_RETRIES; attempt++) {
			BucketTable<E> t = table;
			LockStripe.StripePair p = stripes.indicesOf(o, t.capacity);
			int i0 = t.index(0, o);
			int i1 = t.index(1, o);

			long lo = stripes.tryOptimisticRead(p.low());
			long hi = p.isSingle() ? lo : stripes.tryOptimisticRead(p.high());
			if (lo != 0L && hi != 0L) {
				E e0 = t.get(0, i0);
				E e1 = t.get(1, i1);
				// Compare only after validation: a valid stamp also makes e0/e1 safely published.
				if (stripes.validate(p.low(), lo) && stripes.validate(p.high(), hi) && t == table) {
					return o.equals(e0) || o.equals(e1);
				}
			}

			// Fallback to read locks.
			try (LockStripe.Guard g = stripes.lockRead(p)) {
				if (t == table) return t.containsUnsafe(o);
			}
		}
		return false;
	}

	@Override
	public int size() {
		return size.get();
	}

	@Override
	public boolean isEmpty() {
		return size.get() == 0;
	}

	@Override
	public void clear() {
		try (LockStripe.Guard all = stripes.lockAll()) {
			table = new BucketTable<>(table.capacity);
			size.set(0);
		}
	}

	/**
	 * Weakly consistent iterator over a snapshot taken with every stripe read-locked.
	 * {@code Iterator.remove} delegates to {@link #remove(Object)}.
	 */
	@Override
	public Iterator<E> iterator() {
		ArrayList<E> snap;
		try (LockStripe.Guard g = stripes.lockAllRead()) {
			snap = table.snapshot();
		}
		return new SnapshotIterator(snap);
	}

	/** Current slots per table. */
	public int capacity() {
		return table.capacity;
	}

	public int stripeCount() {
		return stripes.count();
	}

	/**
	 * Adds up to {@code count} values drawn from {@code values}. Duplicates and failed adds are retried
	 * until {@code 4 * count} values have been drawn.
	 *
	 * @return the number of values actually added
	 */
	public int populate(int count, Supplier<? extends E> values) {
		if (count < 0) throw new IllegalArgumentException("count must be >= 0: " + count);
		long ceiling = 4L * count;
		int added = 0;
		for (long drawn = 0; drawn < ceiling && added < count; drawn++) {
			if (insert(values.get()) == AddResult.ADDED) added++;
		}
		if (added < count) {
			LOGGER.warning("populate added " + added + " of " + count + " values within " + ceiling + " draws");
		}
		return added;
	}

	/* Internals */

	/**
	 * Slow path of {@link #insert}: both candidate slots were full. Runs under every stripe.
	 *
	 * @return {@code null} if {@code observed} is no longer the published table
	 */
	private @Nullable AddResult insertQuiescent(E e, BucketTable<E> observed) {
		try (LockStripe.Guard all = stripes.lockAll()) {
			BucketTable<E> t = table;
			if (t != observed) return null;
			if (t.containsUnsafe(e)) return AddResult.ALREADY_PRESENT;
			if (t.placeDirect(e)) {
				size.incrementAndGet();
				return AddResult.ADDED;
			}

			CuckooInserter.Placement<E> placement = inserter.place(t, e);
			if (placement.succeeded()) {
				size.incrementAndGet();
				return AddResult.ADDED;
			}

			BucketTable<E> grown = rehasher.grow(t, placement.orphan());
			if (grown == null) {
				placement.revert();
				return AddResult.FAILED_OVERLOADED;
			}
			table = grown;
			size.incrementAndGet();
			return AddResult.ADDED;
		}
	}

	BucketTable<E> table() {
		return table;
	}

	LockStripe stripes() {
		return stripes;
	}

	private final class SnapshotIterator implements Iterator<E> {
		private final ArrayList<E> snap;
		private int idx = 0;
		private @Nullable E last;

		SnapshotIterator(ArrayList<E> snap) {
			this.snap = snap;
		}

		@Override
		public boolean hasNext() {
			return idx < snap.size();
		}

		@Override
		public E next() {
			if (!hasNext()) throw new NoSuchElementException();
			E e = snap.get(idx++);
			last = e;
			return e;
		}

		@Override
		public void remove() {
			E e = last;
			if (e == null) throw new IllegalStateException();
			StripedCuckooSet.this.remove(e);
			last = null;
		}
	}
}
