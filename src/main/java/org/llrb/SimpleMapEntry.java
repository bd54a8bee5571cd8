package org.llrb;

import java.util.Map;
import java.util.Objects;

/**
 * An immutable key/value pair, following the {@link Map.Entry} contract for equality and hashing
 *
 * @param <K> The key-type of the entry
 * @param <V> The value-type of the entry
 */
public class SimpleMapEntry<K, V> implements Map.Entry<K, V> {
	private final K theKey;
	private final V theValue;

	/**
	 * @param key The key for the entry
	 * @param value The value for the entry
	 */
	public SimpleMapEntry(K key, V value) {
		theKey = key;
		theValue = value;
	}

	@Override
	public K getKey() {
		return theKey;
	}

	@Override
	public V getValue() {
		return theValue;
	}

	/** Not supported. Entries are snapshots of the map at the time they were produced. */
	@Override
	public V setValue(V value) {
		throw new UnsupportedOperationException();
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(theKey) ^ Objects.hashCode(theValue);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Map.Entry))
			return false;
		Map.Entry<?, ?> other = (Map.Entry<?, ?>) o;
		return Objects.equals(theKey, other.getKey()) && Objects.equals(theValue, other.getValue());
	}

	@Override
	public String toString() {
		return new StringBuilder().append(theKey).append('=').append(theValue).toString();
	}
}
