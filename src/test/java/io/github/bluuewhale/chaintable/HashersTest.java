package io.github.bluuewhale.chaintable;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HashersTest {

	@Test
	void djb2MatchesHandComputedValues() {
		KeyHasher<String> h = Hashers.djb2();

		assertEquals(5381L, h.hash(""));
		// 5381 * 33 = 177573 = 0x2B5A5; 0x2B5A5 ^ 'a' (0x61) = 0x2B5C4
		assertEquals(0x2B5C4L, h.hash("a"));
		assertEquals(h.hash("hello"), h.hash(new String("hello")));
		assertNotEquals(h.hash("hello"), h.hash("world"));
	}

	@Test
	void djb2AcceptsAnyCharSequence() {
		KeyHasher<StringBuilder> sb = Hashers.djb2();
		KeyHasher<String> str = Hashers.djb2();

		assertEquals(str.hash("chain"), sb.hash(new StringBuilder("chain")));
	}

	@Test
	void identityUsesNumericValue() {
		KeyHasher<Integer> ints = Hashers.identity();
		KeyHasher<Long> longs = Hashers.identity();

		assertEquals(3L, ints.hash(3));
		assertEquals(-1L, ints.hash(-1));
		assertEquals(Long.MAX_VALUE, longs.hash(Long.MAX_VALUE));
	}

	@Test
	void smearedIsNonNegativeAndStable() {
		KeyHasher<Object> h = Hashers.smeared();

		for (int i = -1000; i < 1000; i++) {
			long v = h.hash(i);
			assertTrue(v >= 0 && v <= 0xFFFF_FFFFL);
			assertEquals(v, h.hash(Integer.valueOf(i)));
		}
		assertEquals(0L, h.hash(null));
	}

	@Test
	void smearedSpreadsSequentialKeys() {
		var t = ChainedHashTable.<Integer, Integer>create(16, Hashers.smeared(), KeyComparators.natural());
		for (int i = 0; i < 1600; i++) t.insert(i * 16, i);

		// identity would put all of these in bucket 0
		int used = 0;
		for (int b = 0; b < 16; b++) {
			if (t.chainLength(b) > 0) used++;
		}
		assertTrue(used > 8, "smeared hash should use most buckets, used=" + used);
	}

	@Test
	void bucketIndexIsUnsignedModulo() {
		assertEquals(0, Hashing.bucketIndex(0L, 5));
		assertEquals(4, Hashing.bucketIndex(9L, 5));
		assertEquals((int) Long.remainderUnsigned(-1L, 5), Hashing.bucketIndex(-1L, 5));
		assertEquals(0, Hashing.bucketIndex(Long.MIN_VALUE, 1));
	}

	@Test
	void naturalAndByEqualsComparators() {
		KeyComparator<String> natural = KeyComparators.natural();
		KeyComparator<String> byEquals = KeyComparators.byEquals();

		assertTrue(natural.matches("x", "x"));
		assertFalse(natural.matches("x", "y"));
		assertTrue(natural.matches(null, null));
		assertFalse(natural.matches("x", null));
		assertFalse(natural.matches(null, "x"));

		assertEquals(0, byEquals.compare("x", new String("x")));
		assertNotEquals(0, byEquals.compare("x", "y"));
		assertTrue(byEquals.matches(null, null));
	}
}
