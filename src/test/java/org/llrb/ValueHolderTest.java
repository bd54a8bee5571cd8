package org.llrb;

import java.util.NoSuchElementException;

import org.junit.Assert;
import org.junit.Test;

/** Tests {@link ValueHolder} */
public class ValueHolderTest {
	/** A present null value is different from an absent value */
	@Test
	@SuppressWarnings("static-method")
	public void testPresentNull() {
		ValueHolder<String> present = ValueHolder.of(null);
		ValueHolder<String> absent = ValueHolder.empty();
		Assert.assertTrue(present.isPresent());
		Assert.assertNull(present.get());
		Assert.assertFalse(absent.isPresent());
		Assert.assertNotEquals(present, absent);
		Assert.assertEquals("x", absent.orElse("x"));
		Assert.assertNull(present.orElse("x"));
		Assert.assertEquals("(empty)", absent.toString());
		Assert.assertEquals("null", present.toString());
	}

	/** {@link ValueHolder#get()} on an absent holder throws */
	@Test(expected = NoSuchElementException.class)
	@SuppressWarnings("static-method")
	public void testGetAbsent() {
		ValueHolder.empty().get();
	}
}
