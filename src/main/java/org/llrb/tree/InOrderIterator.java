package org.llrb.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Function;

import com.google.common.collect.AbstractIterator;

/**
 * Walks a {@link RedBlackNode} tree in key order. The nodes whose right sub-trees are still pending are kept on an explicit stack, so
 * the walk is lazy and costs no more than the height of the tree in memory.
 *
 * @param <K> The key type of the tree
 * @param <V> The value type of the tree
 * @param <T> The type of element produced for each node
 */
class InOrderIterator<K, V, T> extends AbstractIterator<T> {
	private final Deque<RedBlackNode<K, V>> thePending;
	private final Function<? super RedBlackNode<K, V>, ? extends T> theMap;

	/**
	 * @param root The root of the tree to walk (may be null)
	 * @param map Produces the element to return for each node
	 */
	InOrderIterator(RedBlackNode<K, V> root, Function<? super RedBlackNode<K, V>, ? extends T> map) {
		thePending = new ArrayDeque<>();
		theMap = map;
		descendLeft(root);
	}

	private void descendLeft(RedBlackNode<K, V> node) {
		for (; node != null; node = node.getLeft())
			thePending.push(node);
	}

	@Override
	protected T computeNext() {
		RedBlackNode<K, V> node = thePending.poll();
		if (node == null)
			return endOfData();
		descendLeft(node.getRight());
		return theMap.apply(node);
	}
}
