package io.github.bluuewhale.cuckoo;

import org.jspecify.annotations.Nullable;

/**
 * Bounded cuckoo displacement.
 *
 * <p>Starting at table 0, the carried value takes its slot; an evicted occupant becomes the carried
 * value and moves to its slot in the other table. After {@code maxKicks} evictions without finding an
 * empty slot the placement fails and the last evicted value is handed back as the orphan, so no
 * element ever resident in the table is dropped.
 *
 * <p>The caller must hold every stripe the walk can reach, which in a live table means all of them.
 */
final class CuckooInserter {

	private final int maxKicks;

	CuckooInserter(int maxKicks) {
		this.maxKicks = Utils.validateMaxKicks(maxKicks);
	}

	<E> Placement<E> place(BucketTable<E> t, E x) {
		int[] trail = new int[maxKicks];
		E carried = x;
		int table = 0;
		for (int kick = 0; kick < maxKicks; kick++) {
			int idx = t.index(table, carried);
			E occupant = t.get(table, idx);
			t.set(table, idx, carried);
			if (occupant == null) {
				return new Placement<>(t, x, null, trail, kick + 1);
			}
			trail[kick] = idx;
			carried = occupant;
			table = 1 - table;
		}
		return new Placement<>(t, x, carried, trail, maxKicks);
	}

	/**
	 * Outcome of {@link #place}. A failed placement has moved elements around; {@link #revert()} undoes
	 * those moves so the table is exactly as before and the placed value is out again.
	 */
	static final class Placement<E> {
		private final BucketTable<E> table;
		private final E value;
		private final @Nullable E orphan;
		private final int[] trail;
		private final int steps;
		private boolean reverted;

		private Placement(BucketTable<E> table, E value, @Nullable E orphan, int[] trail, int steps) {
			this.table = table;
			this.value = value;
			this.orphan = orphan;
			this.trail = trail;
			this.steps = steps;
		}

		boolean succeeded() {
			return orphan == null;
		}

		/** The value left without a slot; {@code null} on success. */
		@Nullable E orphan() {
			return orphan;
		}

		int steps() {
			return steps;
		}

		/**
		 * Replays the evictions backwards. Only valid for a failed placement whose table nobody else has
		 * touched since.
		 */
		E revert() {
			if (orphan == null) throw new IllegalStateException("placement succeeded");
			if (reverted) throw new IllegalStateException("already reverted");
			reverted = true;
			E carried = orphan;
			for (int kick = steps - 1; kick >= 0; kick--) {
				int t = kick & 1;
				int idx = trail[kick];
				E displaced = table.get(t, idx);
				table.set(t, idx, carried);
				carried = displaced;
			}
			if (carried != value) throw new IllegalStateException("table changed since placement");
			return carried;
		}
	}
}
