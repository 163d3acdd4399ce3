package io.github.bluuewhale.chaintable;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Objects;
import java.util.function.BiConsumer;

import org.jetbrains.annotations.Nullable;

/**
 * Separate-chaining hash table with a fixed number of buckets.
 *
 * <p>Keys are addressed to bucket {@code hash(key) mod capacity} using the caller's {@link KeyHasher},
 * and matched inside a bucket with the caller's {@link KeyComparator} (zero means equal). The table never
 * resizes. An {@link OwnershipPolicy} decides whether stored keys and values are private copies the table
 * releases, or borrowed references ({@link OwnershipPolicy#passthrough()}, the default).
 *
 * <p>Null keys are passed to the hasher and comparator like any other key. Null values are rejected, so
 * {@link #get} returning {@code null} always means "no entry".
 *
 * <p>A table is live from {@link #create} until {@link #destroy()}; every operation on a destroyed table
 * throws {@link IllegalStateException}. Not thread-safe: callers sharing a table across threads must guard
 * it externally.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class ChainedHashTable<K, V> implements AutoCloseable {

	private static final Logger DEFAULT_LOGGER = System.getLogger(ChainedHashTable.class.getName());

	/* Configuration */
	private final int capacity;
	private final KeyHasher<K> hasher;
	private final KeyComparator<K> comparator;
	private final OwnershipPolicy<K, V> policy;
	private final Logger logger;

	/* Storage: null slot = empty bucket */
	private Chain<K, V>[] buckets;
	private int size;
	private boolean destroyed;

	private ChainedHashTable(
		Chain<K, V>[] buckets,
		KeyHasher<K> hasher,
		KeyComparator<K> comparator,
		OwnershipPolicy<K, V> policy,
		Logger logger
	) {
		this.buckets = buckets;
		this.capacity = buckets.length;
		this.hasher = hasher;
		this.comparator = comparator;
		this.policy = policy;
		this.logger = logger;
	}

	/** Passthrough ownership: the table stores and returns the caller's own references. */
	public static <K, V> ChainedHashTable<K, V> create(int capacity, KeyHasher<K> hasher, KeyComparator<K> comparator) {
		return create(capacity, hasher, comparator, null, null);
	}

	public static <K, V> ChainedHashTable<K, V> create(
		int capacity,
		KeyHasher<K> hasher,
		KeyComparator<K> comparator,
		@Nullable OwnershipPolicy<K, V> policy
	) {
		return create(capacity, hasher, comparator, policy, null);
	}

	/**
	 * Create an empty table with {@code capacity} buckets.
	 *
	 * @param policy ownership hooks; {@code null} means {@link OwnershipPolicy#passthrough()}
	 * @param logger sink for error diagnostics; {@code null} means the class logger
	 * @throws IllegalArgumentException if {@code capacity < 1}
	 * @throws NullPointerException if {@code hasher} or {@code comparator} is null
	 * @throws TableAllocationException if the bucket array cannot be allocated
	 */
	public static <K, V> ChainedHashTable<K, V> create(
		int capacity,
		KeyHasher<K> hasher,
		KeyComparator<K> comparator,
		@Nullable OwnershipPolicy<K, V> policy,
		@Nullable Logger logger
	) {
		Logger log = (logger == null) ? DEFAULT_LOGGER : logger;
		if (capacity < 1) {
			log.log(Level.ERROR, "Error creating hash table: capacity must be >= 1, was {0}", capacity);
			throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
		}
		if (hasher == null || comparator == null) {
			log.log(Level.ERROR, "Error creating hash table: hasher and comparator are required");
		}
		Objects.requireNonNull(hasher, "hasher");
		Objects.requireNonNull(comparator, "comparator");

		Chain<K, V>[] buckets;
		try {
			buckets = newBuckets(capacity);
		} catch (OutOfMemoryError e) {
			log.log(Level.ERROR, "Error creating hash table: memory allocation failed for {0} buckets", capacity);
			throw new TableAllocationException("Cannot allocate " + capacity + " buckets", e);
		}

		var table = new ChainedHashTable<>(
			buckets,
			hasher,
			comparator,
			(policy == null) ? OwnershipPolicy.<K, V>passthrough() : policy,
			log
		);
		log.log(Level.DEBUG, "Created hash table with {0} buckets", capacity);
		return table;
	}

	@SuppressWarnings("unchecked")
	private static <K, V> Chain<K, V>[] newBuckets(int capacity) {
		return (Chain<K, V>[]) new Chain<?, ?>[capacity];
	}

	/* ------------ Table API ------------ */

	/**
	 * Insert {@code key -> value}, or replace the value of the entry whose key is equal to {@code key}.
	 *
	 * <p>On replace, the new value is copied first, then the old value is released; the stored key is kept.
	 * On a new entry, key and value are copied and appended to the tail of the bucket chain. Whenever the
	 * entry is not linked in the end, every copy made so far is released again (value, then key).
	 *
	 * @return {@link TableStatus#OK}; {@link TableStatus#INVALID_ARGUMENT} for a null value or a null copy of it;
	 *         {@link TableStatus#ALLOCATION_FAILURE} if copying or growing the chain ran out of memory.
	 *         The table is unchanged on every non-OK result.
	 */
	public TableStatus insert(K key, V value) {
		ensureLive();
		if (value == null) {
			logger.log(Level.ERROR, "Error inserting key-value pair: value is null");
			return TableStatus.INVALID_ARGUMENT;
		}

		int idx = bucketIndexOf(key);
		Chain<K, V> chain = buckets[idx];

		if (chain != null) {
			int slot = chain.indexOf(key, comparator);
			if (slot >= 0) return replaceValue(chain, slot, value);
		}
		return appendEntry(idx, chain, key, value);
	}

	private TableStatus replaceValue(Chain<K, V> chain, int slot, V value) {
		V copy;
		try {
			copy = policy.copyValue(value);
		} catch (OutOfMemoryError e) {
			logger.log(Level.ERROR, "Error updating value: memory allocation failed");
			return TableStatus.ALLOCATION_FAILURE;
		}
		if (copy == null) {
			logger.log(Level.ERROR, "Error updating value: value copy is null");
			return TableStatus.INVALID_ARGUMENT;
		}
		V old = chain.setValue(slot, copy);
		policy.freeValue(old);
		return TableStatus.OK;
	}

	private TableStatus appendEntry(int idx, @Nullable Chain<K, V> chain, K key, V value) {
		K storedKey = null;
		V storedValue = null;
		boolean keyCopied = false;
		boolean linked = false;
		try {
			storedKey = policy.copyKey(key);
			keyCopied = true;
			storedValue = policy.copyValue(value);
			if (storedValue == null) {
				logger.log(Level.ERROR, "Error inserting key-value pair: value copy is null");
				return TableStatus.INVALID_ARGUMENT;
			}
			if (chain == null) {
				chain = new Chain<>();
				chain.append(storedKey, storedValue);
				buckets[idx] = chain;
			} else {
				chain.append(storedKey, storedValue);
			}
			linked = true;
		} catch (OutOfMemoryError e) {
			logger.log(Level.ERROR, "Error inserting key-value pair: memory allocation failed");
			return TableStatus.ALLOCATION_FAILURE;
		} finally {
			// Copies of an entry that never got linked belong to nobody else.
			if (!linked) {
				if (storedValue != null) policy.freeValue(storedValue);
				if (keyCopied) policy.freeKey(storedKey);
			}
		}
		size++;
		return TableStatus.OK;
	}

	/**
	 * Unlink the entry whose key is equal to {@code key} and release its value, then its key.
	 *
	 * @return {@link TableStatus#OK}, or {@link TableStatus#NOT_FOUND} if no such entry exists
	 */
	public TableStatus remove(K key) {
		ensureLive();
		int idx = bucketIndexOf(key);
		Chain<K, V> chain = buckets[idx];
		if (chain == null) return TableStatus.NOT_FOUND;

		int slot = chain.indexOf(key, comparator);
		if (slot < 0) return TableStatus.NOT_FOUND;

		K storedKey = chain.keyAt(slot);
		V storedValue = chain.valueAt(slot);
		chain.removeAt(slot);
		if (chain.size() == 0) buckets[idx] = null;
		size--;

		policy.freeValue(storedValue);
		policy.freeKey(storedKey);
		return TableStatus.OK;
	}

	/**
	 * The stored value for {@code key}, or {@code null} if absent. The reference stays owned by the table
	 * and is valid until the entry is replaced, removed or the table is destroyed.
	 */
	public @Nullable V get(K key) {
		ensureLive();
		Chain<K, V> chain = buckets[bucketIndexOf(key)];
		if (chain == null) return null;
		int slot = chain.indexOf(key, comparator);
		return (slot < 0) ? null : chain.valueAt(slot);
	}

	public boolean containsKey(K key) {
		return get(key) != null;
	}

	/**
	 * Release every entry (value, then key, through the ownership policy) and drop the bucket array.
	 * The table is unusable afterwards.
	 *
	 * @throws IllegalStateException if the table was already destroyed
	 */
	public void destroy() {
		ensureLive();
		int released = 0;
		try {
			for (Chain<K, V> chain : buckets) {
				if (chain == null) continue;
				for (int i = 0; i < chain.size(); i++) {
					policy.freeValue(chain.valueAt(i));
					policy.freeKey(chain.keyAt(i));
					released++;
				}
				chain.clear();
			}
		} finally {
			buckets = null;
			size = 0;
			destroyed = true;
		}
		logger.log(Level.DEBUG, "Destroyed hash table with {0} buckets, released {1} entries", capacity, released);
	}

	/** Destroys a live table; does nothing on a destroyed one. */
	@Override
	public void close() {
		if (!destroyed) destroy();
	}

	public boolean isDestroyed() {
		return destroyed;
	}

	/* ------------ Introspection ------------ */

	public int size() {
		ensureLive();
		return size;
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	public int capacity() {
		return capacity;
	}

	/** The bucket {@code key} is addressed to: {@code hash(key) mod capacity}, hash read as unsigned. */
	public int bucketIndexOf(K key) {
		return Hashing.bucketIndex(hasher.hash(key), capacity);
	}

	/** Number of entries chained in one bucket. */
	public int chainLength(int bucketIndex) {
		ensureLive();
		Objects.checkIndex(bucketIndex, capacity);
		Chain<K, V> chain = buckets[bucketIndex];
		return (chain == null) ? 0 : chain.size();
	}

	/** Visit every entry once: buckets in index order, each chain in insertion order. */
	public void forEach(BiConsumer<? super K, ? super V> action) {
		ensureLive();
		Objects.requireNonNull(action, "action");
		for (Chain<K, V> chain : buckets) {
			if (chain != null) chain.forEach(action);
		}
	}

	private void ensureLive() {
		if (destroyed) {
			logger.log(Level.ERROR, "Error accessing hash table: table is destroyed");
			throw new IllegalStateException("Hash table is destroyed");
		}
	}

	@Override
	public String toString() {
		return destroyed
			? "ChainedHashTable{destroyed}"
			: "ChainedHashTable{capacity=" + capacity + ", size=" + size + ", policy=" + policy + "}";
	}
}
