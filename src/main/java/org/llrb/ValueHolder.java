package org.llrb;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * The result of a lookup: either a value (which may be null) or nothing. Unlike {@link java.util.Optional}, a present null value is
 * distinguishable from an absent one.
 *
 * @param <T> The type of the value
 */
public final class ValueHolder<T> implements Supplier<T> {
	private static final ValueHolder<?> EMPTY = new ValueHolder<>(false, null);

	private final boolean isSet;
	private final T theValue;

	private ValueHolder(boolean set, T value) {
		isSet = set;
		theValue = value;
	}

	/**
	 * @param <T> The type of the value
	 * @param value The value for the holder
	 * @return A present holder for the value
	 */
	public static <T> ValueHolder<T> of(T value) {
		return new ValueHolder<>(true, value);
	}

	/**
	 * @param <T> The type of the value
	 * @return An absent holder
	 */
	@SuppressWarnings("unchecked")
	public static <T> ValueHolder<T> empty() {
		return (ValueHolder<T>) EMPTY;
	}

	/** @return Whether this holder has a value */
	public boolean isPresent() {
		return isSet;
	}

	/**
	 * @return The value in this holder
	 * @throws NoSuchElementException If this holder is {@link #isPresent() absent}
	 */
	@Override
	public T get() throws NoSuchElementException {
		if (!isSet)
			throw new NoSuchElementException("No value present");
		return theValue;
	}

	/**
	 * @param other The value to return if this holder is absent
	 * @return This holder's value if present, or the given value otherwise
	 */
	public T orElse(T other) {
		return isSet ? theValue : other;
	}

	@Override
	public int hashCode() {
		return isSet ? Objects.hashCode(theValue) + 1 : 0;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		else if (!(obj instanceof ValueHolder))
			return false;
		ValueHolder<?> other = (ValueHolder<?>) obj;
		return isSet == other.isSet && Objects.equals(theValue, other.theValue);
	}

	@Override
	public String toString() {
		if (!isSet)
			return "(empty)";
		else
			return String.valueOf(theValue);
	}
}
