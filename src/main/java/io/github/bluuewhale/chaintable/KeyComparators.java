package io.github.bluuewhale.chaintable;

import java.util.Objects;

/**
 * Ready-made {@link KeyComparator}s.
 */
public final class KeyComparators {

	private KeyComparators() {}

	public static <K extends Comparable<? super K>> KeyComparator<K> natural() {
		return (a, b) -> {
			if (a == b) return 0;
			if (a == null || b == null) return 1;
			return a.compareTo(b);
		};
	}

	public static <K> KeyComparator<K> byEquals() {
		return (a, b) -> Objects.equals(a, b) ? 0 : 1;
	}
}
