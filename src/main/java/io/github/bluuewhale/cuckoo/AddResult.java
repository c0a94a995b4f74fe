package io.github.bluuewhale.cuckoo;

/**
 * Outcome of {@link StripedCuckooSet#insert(Object)}.
 */
public enum AddResult {
	/** The element was placed and counted. */
	ADDED,
	/** An equal element is already present; nothing changed. */
	ALREADY_PRESENT,
	/**
	 * No slot could be found even after resizing (capacity ceiling or allocation failure). The set is
	 * unchanged and the element was not added.
	 */
	FAILED_OVERLOADED
}
