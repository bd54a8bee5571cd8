package org.llrb.tree;

import java.util.Comparator;
import java.util.function.BiPredicate;

import org.apache.log4j.Logger;

/**
 * A node in a left-leaning red/black binary tree structure.
 *
 * <p>
 * This class does all the work of keeping the structure balanced. Every structural operation is a function of a sub-tree that returns
 * the (possibly rotated) replacement for that sub-tree, so nodes need no parent links. A node exclusively owns its two children.
 * </p>
 *
 * <p>
 * A node's color describes the link from its parent: a red node is joined to its parent by a red link. Between public operations of
 * {@link OrderedTreeMap} the structure obeys these constraints:
 * <ul>
 * <li>Keys in a node's left sub-tree are less than the node's key, and keys in its right sub-tree are greater</li>
 * <li>No red link leans right, so a node has at most one red child and that child is on the left</li>
 * <li>A red node has no red children</li>
 * <li>Every path from the root to an empty child position passes the same number of black nodes</li>
 * <li>The root is black</li>
 * </ul>
 * {@link #checkValid(RedBlackNode, Comparator)} verifies all of these.
 * </p>
 *
 * @param <K> The type of key that the node holds
 * @param <V> The type of value that the node holds
 */
public final class RedBlackNode<K, V> {
	private static final Logger log = Logger.getLogger(RedBlackNode.class);

	private K theKey;
	private V theValue;
	private boolean isRed;

	private RedBlackNode<K, V> theLeft;
	private RedBlackNode<K, V> theRight;

	/**
	 * New nodes are always red with no children
	 *
	 * @param key The key for this node
	 * @param value The value for this node
	 */
	RedBlackNode(K key, V value) {
		theKey = key;
		theValue = value;
		isRed = true;
	}

	/** @return This node's key */
	public K getKey() {
		return theKey;
	}

	/** @return This node's value */
	public V getValue() {
		return theValue;
	}

	/** @return Whether the link from this node's parent is red */
	public boolean isRed() {
		return isRed;
	}

	/** @return The child node that is on the left of this node */
	public RedBlackNode<K, V> getLeft() {
		return theLeft;
	}

	/** @return The child node that is on the right of this node */
	public RedBlackNode<K, V> getRight() {
		return theRight;
	}

	/**
	 * @param left Whether to get the left or right child
	 * @return The left or right child of this node
	 */
	public RedBlackNode<K, V> getChild(boolean left) {
		return left ? theLeft : theRight;
	}

	private void setChild(RedBlackNode<K, V> child, boolean left) {
		if (child == this)
			throw new IllegalArgumentException(
				"A tree node cannot have itself as a child: " + this + " (" + (left ? "left" : "right") + ")");
		if (left)
			theLeft = child;
		else
			theRight = child;
	}

	/** Colors this node black. Used on the root after each mutation. */
	void setBlack() {
		isRed = false;
	}

	/**
	 * @param node The node to test
	 * @return Whether the node is present and red
	 */
	static boolean isRed(RedBlackNode<?, ?> node) {
		return node != null && node.isRed;
	}

	/** Toggles the color of this node and both of its children */
	private void flipColors() {
		if (log.isTraceEnabled())
			log.trace("Flip colors at " + this);
		isRed = !isRed;
		if (theLeft != null)
			theLeft.isRed = !theLeft.isRed;
		if (theRight != null)
			theRight.isRed = !theRight.isRed;
	}

	/**
	 * Performs a rotation for balancing. The child on the side opposite <code>left</code> takes this node's place and color, and this
	 * node becomes its red child.
	 *
	 * @param left Whether to rotate left or right
	 * @return The new root of this sub-tree
	 */
	private RedBlackNode<K, V> rotate(boolean left) {
		if (log.isTraceEnabled())
			log.trace("Rotate " + (left ? "left" : "right") + " at " + this);
		RedBlackNode<K, V> oldChild = getChild(!left);
		setChild(oldChild.getChild(left), !left);
		oldChild.setChild(this, left);
		oldChild.isRed = isRed;
		isRed = true;
		return oldChild;
	}

	/**
	 * The rebalancing step applied on the way back up an insertion path. Leans a right-leaning red link left, splits a left-left red
	 * chain and then splits the resulting 4-node, so that no red link is left leaning right.
	 *
	 * @return The new root of this sub-tree
	 */
	private RedBlackNode<K, V> rotateAfterInsert() {
		RedBlackNode<K, V> node = this;
		if (isRed(node.theRight) && !isRed(node.theLeft))
			node = node.rotate(true);
		if (isRed(node.theLeft) && isRed(node.theLeft.theLeft))
			node = node.rotate(false);
		if (isRed(node.theLeft) && isRed(node.theRight))
			node.flipColors();
		return node;
	}

	/**
	 * Restores the left-leaning and no-double-red constraints at this level after a deletion step
	 *
	 * @return The new root of this sub-tree
	 */
	private RedBlackNode<K, V> fixUp() {
		RedBlackNode<K, V> node = this;
		if (isRed(node.theRight))
			node = node.rotate(true);
		if (isRed(node.theLeft) && isRed(node.theLeft.theLeft))
			node = node.rotate(false);
		if (isRed(node.theLeft) && isRed(node.theRight))
			node.flipColors();
		return node;
	}

	/**
	 * Pushes a red link down the left side, assuming this node is red (or the root) and both its left child and left grandchild are black
	 *
	 * @return The new root of this sub-tree
	 */
	private RedBlackNode<K, V> moveRedLeft() {
		flipColors();
		if (theRight != null && isRed(theRight.theLeft)) {
			theRight = theRight.rotate(false);
			RedBlackNode<K, V> node = rotate(true);
			node.flipColors();
			return node;
		}
		return this;
	}

	/**
	 * Pushes a red link down the right side, assuming this node is red (or the root) and both its right child and the right child's left
	 * child are black
	 *
	 * @return The new root of this sub-tree
	 */
	private RedBlackNode<K, V> moveRedRight() {
		flipColors();
		if (theLeft != null && isRed(theLeft.theLeft)) {
			RedBlackNode<K, V> node = rotate(false);
			node.flipColors();
			return node;
		}
		return this;
	}

	/**
	 * Inserts a key/value pair into a sub-tree, or replaces the value of the node with an equal key
	 *
	 * @param <K> The key type of the tree
	 * @param <V> The value type of the tree
	 * @param node The root of the sub-tree to insert into (may be null)
	 * @param key The key to insert
	 * @param value The value to insert
	 * @param compare The key ordering of the tree
	 * @param added Run when a new node is created for the key
	 * @return The new root of the sub-tree
	 */
	static <K, V> RedBlackNode<K, V> insert(RedBlackNode<K, V> node, K key, V value, Comparator<? super K> compare, Runnable added) {
		if (node == null) {
			added.run();
			return new RedBlackNode<>(key, value);
		}
		if (isRed(node.theLeft) && isRed(node.theRight))
			node.flipColors();
		int comp = compare.compare(key, node.theKey);
		if (comp < 0)
			node.theLeft = insert(node.theLeft, key, value, compare, added);
		else if (comp > 0)
			node.theRight = insert(node.theRight, key, value, compare, added);
		else
			node.theValue = value;
		return node.rotateAfterInsert();
	}

	/**
	 * Removes the node with the given key from a sub-tree. The caller must ensure the key is present; the move-red steps restructure the
	 * path regardless of whether the key is found.
	 *
	 * @param <K> The key type of the tree
	 * @param <V> The value type of the tree
	 * @param node The root of the sub-tree to delete from
	 * @param key The key to delete
	 * @param compare The key ordering of the tree
	 * @return The new root of the sub-tree, or null if the sub-tree is now empty
	 */
	static <K, V> RedBlackNode<K, V> delete(RedBlackNode<K, V> node, K key, Comparator<? super K> compare) {
		if (compare.compare(key, node.theKey) < 0) {
			if (node.theLeft != null) {
				if (!isRed(node.theLeft) && !isRed(node.theLeft.theLeft))
					node = node.moveRedLeft();
				node.theLeft = delete(node.theLeft, key, compare);
			}
		} else {
			if (isRed(node.theLeft))
				node = node.rotate(false);
			if (node.theRight == null && compare.compare(key, node.theKey) == 0)
				return null;
			if (node.theRight != null) {
				if (!isRed(node.theRight) && !isRed(node.theRight.theLeft))
					node = node.moveRedRight();
				if (compare.compare(key, node.theKey) == 0) {
					RedBlackNode<K, V> successor = node.theRight.getTerminal(true);
					if (log.isTraceEnabled())
						log.trace("Replacing " + node + " with successor " + successor);
					node.theKey = successor.theKey;
					node.theValue = successor.theValue;
					node.theRight = deleteMinimum(node.theRight);
				} else
					node.theRight = delete(node.theRight, key, compare);
			}
		}
		return node.fixUp();
	}

	/**
	 * Removes the left-most node of a sub-tree. Purely structural; no keys are compared.
	 *
	 * @param <K> The key type of the tree
	 * @param <V> The value type of the tree
	 * @param node The root of the sub-tree
	 * @return The new root of the sub-tree, or null if the sub-tree is now empty
	 */
	static <K, V> RedBlackNode<K, V> deleteMinimum(RedBlackNode<K, V> node) {
		if (node.theLeft == null)
			return null;
		if (!isRed(node.theLeft) && !isRed(node.theLeft.theLeft))
			node = node.moveRedLeft();
		node.theLeft = deleteMinimum(node.theLeft);
		return node.fixUp();
	}

	/**
	 * @param left Whether to get the first node or the last node
	 * @return The first or last node in this sub-tree
	 */
	public RedBlackNode<K, V> getTerminal(boolean left) {
		RedBlackNode<K, V> parent = this;
		RedBlackNode<K, V> child = parent.getChild(left);
		while (child != null) {
			parent = child;
			child = parent.getChild(left);
		}
		return parent;
	}

	/**
	 * @param <K> The key type of the tree
	 * @param <V> The value type of the tree
	 * @param node The root of the sub-tree to search
	 * @param key The key to search for
	 * @param compare The key ordering of the tree
	 * @return The node in the sub-tree with the given key, or null if there is no such node
	 */
	static <K, V> RedBlackNode<K, V> find(RedBlackNode<K, V> node, K key, Comparator<? super K> compare) {
		while (node != null) {
			int comp = compare.compare(key, node.theKey);
			if (comp == 0)
				return node;
			node = node.getChild(comp < 0);
		}
		return null;
	}

	/**
	 * Walks a sub-tree in key order, stopping as soon as the visitor returns false
	 *
	 * @param <K> The key type of the tree
	 * @param <V> The value type of the tree
	 * @param node The root of the sub-tree to walk (may be null)
	 * @param visitor The visitor to give each key/value pair to. Returns whether to continue.
	 * @return False if the visitor stopped the walk, true if every node in the sub-tree was visited
	 */
	static <K, V> boolean forEach(RedBlackNode<K, V> node, BiPredicate<? super K, ? super V> visitor) {
		if (node == null)
			return true;
		return forEach(node.theLeft, visitor)//
			&& visitor.test(node.theKey, node.theValue)//
			&& forEach(node.theRight, visitor);
	}

	/**
	 * @param node The root of the sub-tree
	 * @return The number of black links on the left-most path of the sub-tree, which for a valid tree is the same for every path
	 */
	public static int blackHeight(RedBlackNode<?, ?> node) {
		int height = 0;
		for (; node != null; node = node.theLeft) {
			if (!node.isRed)
				height++;
		}
		return height;
	}

	/**
	 * @param node The root of the sub-tree
	 * @return The number of nodes on the longest path from the root of the sub-tree to a leaf
	 */
	public static int height(RedBlackNode<?, ?> node) {
		if (node == null)
			return 0;
		return Math.max(height(node.theLeft), height(node.theRight)) + 1;
	}

	/**
	 * Runs debugging checks on a tree structure to assure that all internal constraints are currently met
	 *
	 * @param <K> The key type of the tree
	 * @param root The root of the tree (may be null)
	 * @param compare The key ordering of the tree
	 * @return The number of nodes in the tree
	 * @throws IllegalStateException If any constraint is violated
	 */
	public static <K> int checkValid(RedBlackNode<K, ?> root, Comparator<? super K> compare) throws IllegalStateException {
		if (root == null)
			return 0;
		if (root.isRed)
			throw new IllegalStateException("The root is red!");
		int[] count = new int[1];
		checkValid(root, null, null, compare, count);
		return count[0];
	}

	/** @return The black height of the sub-tree */
	private static <K> int checkValid(RedBlackNode<K, ?> node, K lowerBound, K upperBound, Comparator<? super K> compare, int[] count) {
		if (node == null)
			return 0;
		count[0]++;
		if (lowerBound != null && compare.compare(node.theKey, lowerBound) <= 0)
			throw new IllegalStateException("(" + node + "): key is not greater than " + lowerBound);
		if (upperBound != null && compare.compare(node.theKey, upperBound) >= 0)
			throw new IllegalStateException("(" + node + "): key is not less than " + upperBound);
		if (isRed(node.theRight))
			throw new IllegalStateException("(" + node + "): right child (" + node.theRight + ") is red");
		if (node.isRed && isRed(node.theLeft))
			throw new IllegalStateException("Red node (" + node + ") has red children");
		int leftBlackHeight = checkValid(node.theLeft, lowerBound, node.theKey, compare, count);
		int rightBlackHeight = checkValid(node.theRight, node.theKey, upperBound, compare, count);
		if (leftBlackHeight != rightBlackHeight)
			throw new IllegalStateException(
				"(" + node + "): different black heights: " + leftBlackHeight + " on the left and " + rightBlackHeight + " on the right");
		return leftBlackHeight + (node.isRed ? 0 : 1);
	}

	/**
	 * Prints a tree in a way that indicates the position of each node in the tree
	 *
	 * @param tree The tree node to print
	 * @return The printed representation of the node
	 */
	public static String print(RedBlackNode<?, ?> tree) {
		StringBuilder ret = new StringBuilder();
		print(tree, ret, 0);
		return ret.toString();
	}

	/**
	 * Prints a tree in a way that indicates the position of each node in the tree
	 *
	 * @param tree The tree node to print
	 * @param str The string builder to append the printed tree representation to
	 * @param indent The amount of indentation with which to indent the root of the tree
	 */
	public static void print(RedBlackNode<?, ?> tree, StringBuilder str, int indent) {
		if (tree == null) {
			for (int i = 0; i < indent; i++)
				str.append('\t');
			str.append(tree).append('\n');
			return;
		}

		RedBlackNode<?, ?> right = tree.getRight();
		if (right != null)
			print(right, str, indent + 1);

		for (int i = 0; i < indent; i++)
			str.append('\t');
		str.append(tree).append('\n');

		RedBlackNode<?, ?> left = tree.getLeft();
		if (left != null)
			print(left, str, indent + 1);
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder().append(theKey).append('=').append(theValue);
		return str.append(" (").append(isRed ? "red" : "black").append(')').toString();
	}
}
