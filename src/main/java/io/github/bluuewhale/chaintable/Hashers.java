package io.github.bluuewhale.chaintable;

/**
 * Ready-made {@link KeyHasher}s for common key types.
 */
public final class Hashers {

	private Hashers() {}

	/** djb2 (xor variant) over the characters of the key. */
	public static <K extends CharSequence> KeyHasher<K> djb2() {
		return Hashing::djb2;
	}

	/** The key's own numeric value, so key {@code n} lands in bucket {@code n mod capacity}. */
	public static <K extends Number> KeyHasher<K> identity() {
		return Number::longValue;
	}

	/** {@link Object#hashCode()} passed through the MurmurHash3 smear step. */
	public static <K> KeyHasher<K> smeared() {
		return key -> Hashing.unsigned(Hashing.smearedHash(key));
	}
}
