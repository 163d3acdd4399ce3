package io.github.bluuewhale.chaintable;

/**
 * Thrown when the bucket array of a new {@link ChainedHashTable} cannot be allocated.
 */
public class TableAllocationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public TableAllocationException(String message, Throwable cause) {
		super(message, cause);
	}
}
