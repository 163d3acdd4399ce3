package io.github.bluuewhale.chaintable;

import java.util.Arrays;
import java.util.function.BiConsumer;

/**
 * One bucket's chain, stored as parallel key/value slot arrays in insertion order.
 * Slots {@code [0, size)} are live; removal shifts the tail left so the order is kept.
 */
final class Chain<K, V> {

	private static final int INITIAL_SLOTS = 2;

	/* Storage */
	private Object[] keys;
	private Object[] vals;
	private int size;

	Chain() {
		this.keys = new Object[INITIAL_SLOTS];
		this.vals = new Object[INITIAL_SLOTS];
	}

	int size() {
		return size;
	}

	/** Slot of the first key equal to {@code key}, or -1. */
	int indexOf(K key, KeyComparator<K> comparator) {
		for (int i = 0; i < size; i++) {
			if (comparator.matches(castKey(keys[i]), key)) return i;
		}
		return -1;
	}

	K keyAt(int idx) {
		return castKey(keys[idx]);
	}

	V valueAt(int idx) {
		return castValue(vals[idx]);
	}

	/** Replace the value in a live slot, returning the one it held. */
	V setValue(int idx, V value) {
		V old = castValue(vals[idx]);
		vals[idx] = value;
		return old;
	}

	/**
	 * Append at the tail. Grows the slot arrays first, so an {@link OutOfMemoryError}
	 * leaves the chain as it was.
	 */
	void append(K key, V value) {
		if (size == keys.length) {
			int newLen = keys.length << 1;
			Object[] newKeys = Arrays.copyOf(keys, newLen);
			Object[] newVals = Arrays.copyOf(vals, newLen);
			keys = newKeys;
			vals = newVals;
		}
		keys[size] = key;
		vals[size] = value;
		size++;
	}

	/** Unlink the slot at {@code idx}; later slots move one to the left. */
	void removeAt(int idx) {
		int tail = size - idx - 1;
		if (tail > 0) {
			System.arraycopy(keys, idx + 1, keys, idx, tail);
			System.arraycopy(vals, idx + 1, vals, idx, tail);
		}
		size--;
		keys[size] = null;
		vals[size] = null;
	}

	void forEach(BiConsumer<? super K, ? super V> action) {
		for (int i = 0; i < size; i++) {
			action.accept(castKey(keys[i]), castValue(vals[i]));
		}
	}

	void clear() {
		Arrays.fill(keys, 0, size, null);
		Arrays.fill(vals, 0, size, null);
		size = 0;
	}

	@SuppressWarnings("unchecked")
	private K castKey(Object key) {
		return (K) key;
	}

	@SuppressWarnings("unchecked")
	private V castValue(Object value) {
		return (V) value;
	}
}
