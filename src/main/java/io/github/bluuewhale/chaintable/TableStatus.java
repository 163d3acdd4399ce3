package io.github.bluuewhale.chaintable;

/**
 * Outcome of a mutating {@link ChainedHashTable} operation.
 */
public enum TableStatus {
	OK,
	/** Rejected before any mutation, e.g. a {@code null} value. */
	INVALID_ARGUMENT,
	/** Storage for a new entry could not be obtained; the table is unchanged. */
	ALLOCATION_FAILURE,
	/** No entry with an equal key exists; the table is unchanged. */
	NOT_FOUND;

	public boolean isOk() {
		return this == OK;
	}
}
