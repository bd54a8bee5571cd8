package org.llrb.tree;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

import org.apache.log4j.Logger;
import org.llrb.SimpleMapEntry;
import org.llrb.ValueHolder;

import com.google.common.base.Preconditions;

/**
 * An ordered key/value map backed by a left-leaning red/black tree. Insertion, lookup and deletion take logarithmic time, and every
 * traversal produces entries in ascending key order.
 *
 * <p>
 * A freshly constructed map is empty and ready for use. Keys are ordered by the comparator given at construction, or by their natural
 * {@link Comparable} order. Null keys are not permitted; null values are.
 * </p>
 *
 * <p>
 * This class is not thread-safe. Callers sharing an instance across threads must synchronize externally. Modifying the map while any
 * traversal ({@link #all()}, {@link #keys()}, {@link #values()} or the <code>forEach</code> methods) is in progress is not allowed, and
 * the results of doing so are undefined. No attempt is made to detect it.
 * </p>
 *
 * @param <K> The type of keys in the map
 * @param <V> The type of values in the map
 */
public class OrderedTreeMap<K, V> implements Iterable<Map.Entry<K, V>> {
	private static final Logger log = Logger.getLogger(OrderedTreeMap.class);

	private final Comparator<? super K> theCompare;
	private RedBlackNode<K, V> theRoot;
	private int theSize;

	/** Creates an empty map that orders its keys by their natural {@link Comparable} order */
	@SuppressWarnings({ "unchecked", "rawtypes" })
	public OrderedTreeMap() {
		this((Comparator<? super K>) (Comparator) Comparator.naturalOrder());
	}

	/** @param compare The ordering for the map's keys. Must be a total order. */
	public OrderedTreeMap(Comparator<? super K> compare) {
		theCompare = Preconditions.checkNotNull(compare, "compare");
	}

	/** @return The ordering of this map's keys */
	public Comparator<? super K> comparator() {
		return theCompare;
	}

	/** @return The number of entries in this map */
	public int size() {
		return theSize;
	}

	/** @return Whether this map has no entries */
	public boolean isEmpty() {
		return theSize == 0;
	}

	/**
	 * Inserts a new key/value entry, or replaces the value of the entry with the given key if there is one
	 *
	 * @param key The key to insert
	 * @param value The value for the key
	 * @return True if a new entry was added, false if an existing entry's value was replaced
	 */
	public boolean insert(K key, V value) {
		Preconditions.checkNotNull(key, "key");
		int preSize = theSize;
		theRoot = RedBlackNode.insert(theRoot, key, value, theCompare, () -> theSize++);
		theRoot.setBlack();
		return theSize != preSize;
	}

	/**
	 * @param key The key to look up
	 * @return A holder with the value stored for the key, or an empty holder if the key is not in this map
	 */
	public ValueHolder<V> find(K key) {
		Preconditions.checkNotNull(key, "key");
		RedBlackNode<K, V> node = RedBlackNode.find(theRoot, key, theCompare);
		return node == null ? ValueHolder.empty() : ValueHolder.of(node.getValue());
	}

	/**
	 * @param key The key to look up
	 * @return The value stored for the key, or null if the key is not in this map
	 */
	public V get(K key) {
		return find(key).orElse(null);
	}

	/**
	 * @param key The key to look for
	 * @return Whether this map has an entry for the key
	 */
	public boolean contains(K key) {
		return find(key).isPresent();
	}

	/**
	 * Removes the entry with the given key. Does nothing if there is no such entry.
	 *
	 * @param key The key to remove
	 * @return True if an entry was removed, false if the key was not in this map
	 */
	public boolean delete(K key) {
		if (!contains(key))
			return false;
		theRoot = RedBlackNode.delete(theRoot, key, theCompare);
		if (theRoot != null)
			theRoot.setBlack();
		theSize--;
		return true;
	}

	/** Removes all entries from this map */
	public void clear() {
		if (log.isDebugEnabled())
			log.debug("Clearing " + theSize + " entries");
		theRoot = null;
		theSize = 0;
	}

	/** @return The entries of this map in ascending key order */
	public Iterable<Map.Entry<K, V>> all() {
		return this;
	}

	/** @return The keys of this map in ascending order */
	public Iterable<K> keys() {
		return () -> new InOrderIterator<>(theRoot, RedBlackNode::getKey);
	}

	/** @return The values of this map, in ascending order of their keys */
	public Iterable<V> values() {
		return () -> new InOrderIterator<>(theRoot, RedBlackNode::getValue);
	}

	@Override
	public Iterator<Map.Entry<K, V>> iterator() {
		return new InOrderIterator<>(theRoot, node -> new SimpleMapEntry<>(node.getKey(), node.getValue()));
	}

	/**
	 * Visits each entry in ascending key order
	 *
	 * @param visitor Accepts each key/value pair and returns whether to continue to the next one
	 * @return True if every entry was visited, false if the visitor stopped the walk
	 */
	public boolean forEachEntry(BiPredicate<? super K, ? super V> visitor) {
		return RedBlackNode.forEach(theRoot, visitor);
	}

	/**
	 * Visits each key in ascending order
	 *
	 * @param visitor Accepts each key and returns whether to continue to the next one
	 * @return True if every key was visited, false if the visitor stopped the walk
	 */
	public boolean forEachKey(Predicate<? super K> visitor) {
		return RedBlackNode.forEach(theRoot, (k, v) -> visitor.test(k));
	}

	/**
	 * Visits each value in ascending order of their keys
	 *
	 * @param visitor Accepts each value and returns whether to continue to the next one
	 * @return True if every value was visited, false if the visitor stopped the walk
	 */
	public boolean forEachValue(Predicate<? super V> visitor) {
		return RedBlackNode.forEach(theRoot, (k, v) -> visitor.test(v));
	}

	/** @return The root of this map's tree structure, or null if the map is empty */
	public RedBlackNode<K, V> getRoot() {
		return theRoot;
	}

	/** @return The number of black links on every path from the root to an empty child position */
	public int blackHeight() {
		return RedBlackNode.blackHeight(theRoot);
	}

	/** @return The number of nodes on the longest path from the root to a leaf */
	public int height() {
		return RedBlackNode.height(theRoot);
	}

	/**
	 * Runs debugging checks on this map's tree structure and its cached size
	 *
	 * @throws IllegalStateException If any constraint is violated
	 */
	public void checkValid() throws IllegalStateException {
		int count = RedBlackNode.checkValid(theRoot, theCompare);
		if (count != theSize)
			throw new IllegalStateException("Size is incorrect: " + theSize + " recorded, but " + count + " nodes in the tree");
	}

	/** @return A representation of this map's tree structure, for debugging */
	public String print() {
		return RedBlackNode.print(theRoot);
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder().append('{');
		forEachEntry((k, v) -> {
			if (str.length() > 1)
				str.append(", ");
			str.append(k).append('=').append(v);
			return true;
		});
		return str.append('}').toString();
	}
}
