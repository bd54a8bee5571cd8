package org.llrb.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

/** Tests the ordered traversals of {@link OrderedTreeMap}, both the iterators and the visitor walks */
public class TraversalTest {
	private OrderedTreeMap<Integer, String> theMap;

	/** Fills a map with the keys 0-99 inserted out of order */
	@Before
	public void fill() {
		theMap = new OrderedTreeMap<>();
		for (int i = 0; i < 100; i++) {
			int key = (i * 43) % 100;
			theMap.insert(key, "v" + key);
		}
		Assert.assertEquals(100, theMap.size());
	}

	/** Every traversal flavor produces ascending keys */
	@Test
	public void testAscending() {
		List<Integer> keys = ImmutableList.copyOf(theMap.keys());
		Assert.assertEquals(100, keys.size());
		for (int i = 0; i < keys.size(); i++)
			Assert.assertEquals(i, keys.get(i).intValue());

		int i = 0;
		for (Map.Entry<Integer, String> entry : theMap.all()) {
			Assert.assertEquals(i, entry.getKey().intValue());
			Assert.assertEquals("v" + i, entry.getValue());
			i++;
		}
		i = 0;
		for (String value : theMap.values())
			Assert.assertEquals("v" + (i++), value);

		List<Integer> visited = new ArrayList<>();
		Assert.assertTrue(theMap.forEachEntry((k, v) -> {
			Assert.assertEquals("v" + k, v);
			return visited.add(k);
		}));
		Assert.assertEquals(keys, visited);
	}

	/** Stopping a walk at the minimum, deep in the left side of the tree, must skip everything else */
	@Test
	public void testStopAtFirst() {
		List<Integer> visited = new ArrayList<>();
		Assert.assertFalse(theMap.forEachKey(k -> {
			visited.add(k);
			return false;
		}));
		Assert.assertEquals(Arrays.asList(0), visited);
	}

	/** Stopping a walk partway visits exactly a prefix of the keys */
	@Test
	public void testStopPartway() {
		for (int stop : new int[] { 3, 17, 50, 98, 99 }) {
			List<Integer> visited = new ArrayList<>();
			boolean completed = theMap.forEachEntry((k, v) -> {
				visited.add(k);
				return k < stop;
			});
			Assert.assertFalse(completed);
			Assert.assertEquals(stop + 1, visited.size());
			for (int i = 0; i <= stop; i++)
				Assert.assertEquals(i, visited.get(i).intValue());
		}

		List<String> values = new ArrayList<>();
		Assert.assertFalse(theMap.forEachValue(v -> {
			values.add(v);
			return !v.equals("v5");
		}));
		Assert.assertEquals(Arrays.asList("v0", "v1", "v2", "v3", "v4", "v5"), values);
	}

	/** Breaking out of the iterators consumes only a prefix */
	@Test
	public void testIteratorBreak() {
		List<Integer> keys = new ArrayList<>();
		for (Integer key : theMap.keys()) {
			if (key == 5)
				break;
			keys.add(key);
		}
		Assert.assertEquals(Arrays.asList(0, 1, 2, 3, 4), keys);

		List<String> values = new ArrayList<>();
		for (String value : theMap.values()) {
			values.add(value);
			if (value.equals("v2"))
				break;
		}
		Assert.assertEquals(Arrays.asList("v0", "v1", "v2"), values);
	}

	/** Each call starts an independent traversal at the minimum */
	@Test
	public void testIndependentIterators() {
		Iterator<Integer> first = theMap.keys().iterator();
		Assert.assertEquals(0, first.next().intValue());
		Assert.assertEquals(1, first.next().intValue());
		Iterator<Integer> second = theMap.keys().iterator();
		Assert.assertEquals(0, second.next().intValue());
		Assert.assertEquals(2, first.next().intValue());
		Assert.assertEquals(1, second.next().intValue());

		Iterable<Map.Entry<Integer, String>> all = theMap.all();
		Assert.assertEquals(0, all.iterator().next().getKey().intValue());
		Assert.assertEquals(0, all.iterator().next().getKey().intValue());
	}

	/** Iterators follow the {@link Iterator} contract at their end and do not support removal */
	@Test
	public void testIteratorContract() {
		Iterator<Map.Entry<Integer, String>> iter = theMap.iterator();
		int count = 0;
		while (iter.hasNext()) {
			iter.next();
			count++;
		}
		Assert.assertEquals(theMap.size(), count);
		Assert.assertFalse(iter.hasNext());
		try {
			iter.next();
			Assert.fail("Expected NoSuchElementException");
		} catch (NoSuchElementException e) {
			// Expected
		}

		Iterator<Integer> keys = theMap.keys().iterator();
		keys.next();
		try {
			keys.remove();
			Assert.fail("Expected UnsupportedOperationException");
		} catch (UnsupportedOperationException e) {
			// Expected
		}
		Assert.assertEquals(100, theMap.size());
	}

	/** Traversals of an empty map produce nothing and complete */
	@Test
	@SuppressWarnings("static-method")
	public void testEmpty() {
		OrderedTreeMap<Integer, String> empty = new OrderedTreeMap<>();
		Assert.assertFalse(empty.iterator().hasNext());
		Assert.assertFalse(empty.keys().iterator().hasNext());
		Assert.assertFalse(empty.values().iterator().hasNext());
		Assert.assertTrue(empty.forEachEntry((k, v) -> {
			throw new AssertionError("Visited " + k);
		}));
		Assert.assertEquals("{}", empty.toString());
	}

	/** A traversal started after a mutation sees the mutation */
	@Test
	public void testRestartAfterMutation() {
		Assert.assertTrue(theMap.delete(0));
		Assert.assertTrue(theMap.insert(-5, "neg"));
		Iterator<Map.Entry<Integer, String>> iter = theMap.iterator();
		Map.Entry<Integer, String> entry = iter.next();
		Assert.assertEquals(-5, entry.getKey().intValue());
		Assert.assertEquals("neg", entry.getValue());
		Assert.assertEquals(1, iter.next().getKey().intValue());
	}
}
