package io.github.bluuewhale.cuckoo;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

class CuckooInserterTest {

	record Fixed(int val) {
		@Override public int hashCode() { return 0x1234_5601; }
	}

	@Test
	void emptySlotTakesOneStep() {
		var t = new BucketTable<Integer>(16);
		var p = new CuckooInserter(8).place(t, 5);
		assertTrue(p.succeeded());
		assertNull(p.orphan());
		assertEquals(1, p.steps());
		assertEquals(5, t.get(0, t.index(0, 5)));
	}

	@Test
	void occupantMovesToOtherTable() {
		var t = new BucketTable<Fixed>(4);
		var inserter = new CuckooInserter(8);
		var a = new Fixed(1);
		var b = new Fixed(2);
		assertTrue(inserter.place(t, a).succeeded());
		var p = inserter.place(t, b);

		assertTrue(p.succeeded());
		assertEquals(2, p.steps());
		assertEquals(b, t.get(0, t.index(0, b)));
		assertEquals(a, t.get(1, t.index(1, a)));
	}

	@Test
	void exhaustionReturnsOrphanInsteadOfDroppingIt() {
		var t = new BucketTable<Fixed>(4);
		var inserter = new CuckooInserter(5);
		var a = new Fixed(1);
		var b = new Fixed(2);
		var c = new Fixed(3);
		inserter.place(t, a);
		inserter.place(t, b);

		var p = inserter.place(t, c);

		assertFalse(p.succeeded());
		assertEquals(5, p.steps());
		Set<Fixed> seen = new HashSet<>(t.snapshot());
		seen.add(p.orphan());
		assertEquals(Set.of(a, b, c), seen, "every value must be in the table or be the orphan");
	}

	@Test
	void revertRestoresTable() {
		var t = new BucketTable<Fixed>(4);
		var inserter = new CuckooInserter(7);
		var a = new Fixed(1);
		var b = new Fixed(2);
		var c = new Fixed(3);
		inserter.place(t, a);
		inserter.place(t, b);
		var before = t.snapshot();

		var p = inserter.place(t, c);
		assertEquals(c, p.revert());

		assertEquals(before, t.snapshot());
		assertThrows(IllegalStateException.class, p::revert);
	}

	@Test
	void revertRejectsTouchedTable() {
		var t = new BucketTable<Fixed>(4);
		var inserter = new CuckooInserter(7);
		inserter.place(t, new Fixed(1));
		inserter.place(t, new Fixed(2));
		var p = inserter.place(t, new Fixed(3));
		assertFalse(p.succeeded());

		for (int i = 0; i < 4; i++) {
			t.set(0, i, null);
			t.set(1, i, null);
		}
		assertThrows(IllegalStateException.class, p::revert);
	}

	@Test
	void revertOfSuccessRejected() {
		var t = new BucketTable<Integer>(4);
		var p = new CuckooInserter(3).place(t, 1);
		assertThrows(IllegalStateException.class, p::revert);
	}

	@Test
	void rejectsNonPositiveBudget() {
		assertThrows(IllegalArgumentException.class, () -> new CuckooInserter(0));
	}
}
