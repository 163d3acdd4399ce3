package io.github.bluuewhale.chaintable;

/**
 * Caller-supplied hash function for table keys.
 *
 * <p>The result is read as an unsigned 64-bit value. It must be a pure function of the key's
 * content: the same key has to produce the same hash for as long as it is stored in a table.
 * Distribution quality is not enforced, but a skewed hash lengthens bucket chains.
 *
 * @param <K> key type
 */
@FunctionalInterface
public interface KeyHasher<K> {

	long hash(K key);
}
