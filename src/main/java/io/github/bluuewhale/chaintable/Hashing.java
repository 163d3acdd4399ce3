package io.github.bluuewhale.chaintable;

/**
 * Static hash helpers. The smear step is based on the hash utilities authored by Guava contributors
 * (Kevin Bourrillion, Jesse Wilson, and Austin Appleby), derived from the MurmurHash3 intermediate
 * step (public domain).
 */
final class Hashing {

	private Hashing() {}

	/*
	 * Use longs to preserve precision (mirrors the Guava implementation).
	 */
	private static final long C1 = 0xcc9e2d51L;
	private static final long C2 = 0x1b873593L;

	private static final long DJB2_SEED = 5381L;

	/*
	 * This method was rewritten in Java from an intermediate step of the Murmur hash function in
	 * http://code.google.com/p/smhasher/source/browse/trunk/MurmurHash3.cpp, which contained the
	 * following header:
	 *
	 * MurmurHash3 was written by Austin Appleby, and is placed in the public domain. The author
	 * hereby disclaims copyright to this source code.
	 */
	static int smear(int hashCode) {
		return (int) (C2 * Integer.rotateLeft((int) (hashCode * C1), 15));
	}

	static int smearedHash(Object o) {
		return smear((o == null) ? 0 : o.hashCode());
	}

	/** Widen a 32-bit hash to a non-negative long, so it reads as an unsigned value. */
	static long unsigned(int hash) {
		return hash & 0xFFFF_FFFFL;
	}

	/** djb2, xor variant: {@code h = h * 33 ^ c}, seeded with 5381. */
	static long djb2(CharSequence s) {
		long h = DJB2_SEED;
		for (int i = 0; i < s.length(); i++) {
			h = ((h << 5) + h) ^ s.charAt(i);
		}
		return h;
	}

	/** Bucket selection: the hash read as unsigned, modulo the table capacity. */
	static int bucketIndex(long hash, int capacity) {
		return (int) Long.remainderUnsigned(hash, capacity);
	}
}
