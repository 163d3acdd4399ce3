package io.github.bluuewhale.chaintable;

/**
 * Caller-supplied key equality, in comparator convention: {@code 0} means the keys are equal,
 * any other result means they are distinct. The sign of a non-zero result is ignored.
 *
 * @param <K> key type
 */
@FunctionalInterface
public interface KeyComparator<K> {

	int compare(K a, K b);

	default boolean matches(K a, K b) {
		return compare(a, b) == 0;
	}
}
