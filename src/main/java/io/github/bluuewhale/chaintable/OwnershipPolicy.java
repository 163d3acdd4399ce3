package io.github.bluuewhale.chaintable;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Decides who owns the keys and values stored in a {@link ChainedHashTable}.
 *
 * <p>On insert the table stores {@link #copyKey}/{@link #copyValue} of what the caller passed in.
 * Whenever a stored key or value leaves the table (value replaced, entry removed, table destroyed)
 * it is handed to {@link #freeKey}/{@link #freeValue}.
 *
 * <p>{@link #passthrough()} stores caller references verbatim and never releases them: the caller keeps
 * ownership and must keep the referenced objects valid while they are reachable from the table.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface OwnershipPolicy<K, V> {

	K copyKey(K key);

	V copyValue(V value);

	void freeKey(K key);

	void freeValue(V value);

	@SuppressWarnings("unchecked")
	static <K, V> OwnershipPolicy<K, V> passthrough() {
		return (OwnershipPolicy<K, V>) (OwnershipPolicy<?, ?>) Passthrough.INSTANCE;
	}

	static <K, V> Builder<K, V> builder() {
		return new Builder<>();
	}

	/**
	 * Builds a policy hook by hook. Hooks left unset behave like {@link #passthrough()}.
	 */
	final class Builder<K, V> {
		private UnaryOperator<K> keyCopy = UnaryOperator.identity();
		private UnaryOperator<V> valueCopy = UnaryOperator.identity();
		private Consumer<K> keyFree = k -> {};
		private Consumer<V> valueFree = v -> {};

		private Builder() {}

		public Builder<K, V> keyCopy(UnaryOperator<K> keyCopy) {
			this.keyCopy = Objects.requireNonNull(keyCopy, "keyCopy");
			return this;
		}

		public Builder<K, V> valueCopy(UnaryOperator<V> valueCopy) {
			this.valueCopy = Objects.requireNonNull(valueCopy, "valueCopy");
			return this;
		}

		public Builder<K, V> keyFree(Consumer<K> keyFree) {
			this.keyFree = Objects.requireNonNull(keyFree, "keyFree");
			return this;
		}

		public Builder<K, V> valueFree(Consumer<V> valueFree) {
			this.valueFree = Objects.requireNonNull(valueFree, "valueFree");
			return this;
		}

		public OwnershipPolicy<K, V> build() {
			return new Hooks<>(keyCopy, valueCopy, keyFree, valueFree);
		}
	}

	/* Policy backed by the four hooks collected in a Builder */
	record Hooks<K, V>(
		UnaryOperator<K> keyCopy,
		UnaryOperator<V> valueCopy,
		Consumer<K> keyFree,
		Consumer<V> valueFree
	) implements OwnershipPolicy<K, V> {
		@Override public K copyKey(K key) { return keyCopy.apply(key); }
		@Override public V copyValue(V value) { return valueCopy.apply(value); }
		@Override public void freeKey(K key) { keyFree.accept(key); }
		@Override public void freeValue(V value) { valueFree.accept(value); }
	}

	final class Passthrough implements OwnershipPolicy<Object, Object> {
		private static final Passthrough INSTANCE = new Passthrough();

		private Passthrough() {}

		@Override public Object copyKey(Object key) { return key; }
		@Override public Object copyValue(Object value) { return value; }
		@Override public void freeKey(Object key) {}
		@Override public void freeValue(Object value) {}

		@Override public String toString() { return "passthrough"; }
	}
}
