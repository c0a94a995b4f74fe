package io.github.bluuewhale.cuckoo;

import java.util.ArrayList;
import java.util.Objects;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;

/**
 * Two parallel slot arrays of one fixed capacity.
 *
 * <p>Invariant: a present element {@code x} sits in table 0 at {@code index0(x)} or in table 1 at
 * {@code index1(x)}, never both. There is no locking here; callers hold the stripes of every slot they
 * touch. A table never changes capacity, so indices derived from {@link #capacity} are always in
 * bounds for its own arrays.
 */
final class BucketTable<E> {

	final int capacity;
	private final Object[] table0;
	private final Object[] table1;

	BucketTable(int capacity) {
		this.capacity = capacity;
		this.table0 = new Object[capacity];
		this.table1 = new Object[capacity];
	}

	int index(int table, Object x) {
		return (table == 0) ? Hashing.index0(x, capacity) : Hashing.index1(x, capacity);
	}

	@SuppressWarnings("unchecked")
	@Nullable E get(int table, int idx) {
		return (E) slots(table)[idx];
	}

	void set(int table, int idx, @Nullable E value) {
		slots(table)[idx] = value;
	}

	private Object[] slots(int table) {
		return (table == 0) ? table0 : table1;
	}

	/* Unsafe operations: caller holds the stripes of both candidate slots */

	boolean containsUnsafe(Object x) {
		return Objects.equals(table0[Hashing.index0(x, capacity)], x)
			|| Objects.equals(table1[Hashing.index1(x, capacity)], x);
	}

	/** Places {@code x} in an empty candidate slot, table 0 first. */
	boolean placeDirect(E x) {
		int i0 = Hashing.index0(x, capacity);
		if (table0[i0] == null) {
			table0[i0] = x;
			return true;
		}
		int i1 = Hashing.index1(x, capacity);
		if (table1[i1] == null) {
			table1[i1] = x;
			return true;
		}
		return false;
	}

	boolean removeUnsafe(Object x) {
		int i0 = Hashing.index0(x, capacity);
		if (Objects.equals(table0[i0], x)) {
			table0[i0] = null;
			return true;
		}
		int i1 = Hashing.index1(x, capacity);
		if (Objects.equals(table1[i1], x)) {
			table1[i1] = null;
			return true;
		}
		return false;
	}

	/* Whole-table scans: caller holds every stripe */

	@SuppressWarnings("unchecked")
	void forEach(Consumer<? super E> action) {
		for (Object o : table0) {
			if (o != null) action.accept((E) o);
		}
		for (Object o : table1) {
			if (o != null) action.accept((E) o);
		}
	}

	int occupied() {
		int n = 0;
		for (Object o : table0) if (o != null) n++;
		for (Object o : table1) if (o != null) n++;
		return n;
	}

	ArrayList<E> snapshot() {
		ArrayList<E> out = new ArrayList<>();
		forEach(out::add);
		return out;
	}
}
