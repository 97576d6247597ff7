/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.fastutil.longs.LongIterators;

public class TestCountingMergedLongIterator {

	protected static Logger LOG = LoggerFactory.getLogger(TestCountingMergedLongIterator.class);

	@Test
	void testSimple() {
		CountingMergedLongIterator iter = new CountingMergedLongIterator(LongIterators.EMPTY_ITERATOR);
		assertFalse(iter.hasNext());

		long[][][] testArrays = { //
				{ { 0, 1 } }, //
				{ { 0 }, { 1 } }, //
				{ { 1 }, { 0 } }, //
				{ { 1 }, { 0 }, {} }, //
				{ { 1 }, { 0 }, {}, { 0 }, { 0 } }, //
				{ { 1 }, { 0 }, {}, { 0 }, { 0, 1 } }, //
				// input arrays with repeating numbers
				{ { 1, 1 }, { 0, 0 }, {}, { 0, 0 }, { 0, 0 } }, //
				{ { 1, 1 }, { 0, 0 }, {}, { 0 }, { 0, 1 } } //
		};

		for (long[][] tArrays : testArrays) {
			LongIterator[] tIters = new LongIterator[tArrays.length];
			int totalCountExpected = 0;
			for (int i = 0; i < tArrays.length; i++) {
				tIters[i] = LongIterators.wrap(tArrays[i]);
				totalCountExpected += tArrays[i].length;
			}
			int totalCount = 0;
			iter = new CountingMergedLongIterator(tIters);
			assertTrue(iter.hasNext());

			assertEquals(0, iter.nextLong());
			assertTrue(iter.getCount() > 0);
			totalCount += iter.getCount();
			assertTrue(iter.hasNext());
			assertEquals(1, iter.nextLong());
			assertTrue(iter.getCount() > 0);
			totalCount += iter.getCount();
			assertFalse(iter.hasNext());
			assertEquals(totalCountExpected, totalCount,
					"expected total count for input " + Arrays.deepToString(tArrays) + " is " + totalCountExpected);
		}
	}

	@Test
	void testPackedArcs() {
		// arcs packed into longs keep the order (source, target)
		long[] run1 = { ArcSorter.arc(0, 3), ArcSorter.arc(2, 0) };
		long[] run2 = { ArcSorter.arc(0, 1), ArcSorter.arc(0, 3), ArcSorter.arc(1, Integer.MAX_VALUE) };
		CountingMergedLongIterator iter = new CountingMergedLongIterator(LongIterators.wrap(run1),
				LongIterators.wrap(run2));
		long[] expected = { ArcSorter.arc(0, 1), ArcSorter.arc(0, 3), ArcSorter.arc(1, Integer.MAX_VALUE),
				ArcSorter.arc(2, 0) };
		int[] expectedCounts = { 1, 2, 1, 1 };
		for (int i = 0; i < expected.length; i++) {
			assertTrue(iter.hasNext());
			long arc = iter.nextLong();
			assertEquals(expected[i], arc);
			assertEquals(expectedCounts[i], iter.getCount());
		}
		assertFalse(iter.hasNext());
		assertEquals(1, ArcSorter.source(expected[2]));
		assertEquals(Integer.MAX_VALUE, ArcSorter.target(expected[2]));
		assertEquals(ArcSorter.arc(Integer.MAX_VALUE, 1), ArcSorter.transpose(expected[2]));
	}
}
