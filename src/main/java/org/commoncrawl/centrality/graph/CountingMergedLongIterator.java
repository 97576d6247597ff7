/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

import java.util.PriorityQueue;

import it.unimi.dsi.fastutil.longs.LongIterator;

/**
 * An iterator merging and counting the longs returned by multiple
 * {@link LongIterator}s. The input iterators must return longs in a
 * monotonically non-decreasing order. The resulting iterator returns the
 * unified input longs in strictly increasing order. The method
 * {@link #getCount()} is used to access the count of the long returned last by
 * {@link #nextLong()}. The count equals the number of times any of the
 * iterators returned the current value.
 * 
 * Used to merge sorted runs of packed arcs, see {@link ArcSorter}.
 */
public class CountingMergedLongIterator implements LongIterator {

	protected static class QueuedIterator implements Comparable<QueuedIterator> {
		LongIterator iter;
		long value;

		public QueuedIterator(LongIterator iterator) {
			iter = iterator;
			value = iterator.nextLong();
		}

		@Override
		public int compareTo(QueuedIterator o) {
			return Long.compare(value, o.value);
		}
	}

	private final PriorityQueue<QueuedIterator> iters = new PriorityQueue<>();
	private int currentCount = 0;

	/**
	 * @param iterators input iterators
	 */
	public CountingMergedLongIterator(LongIterator... iterators) {
		for (final LongIterator iter : iterators) {
			if (iter.hasNext()) {
				iters.add(new QueuedIterator(iter));
			}
		}
	}

	@Override
	public boolean hasNext() {
		return iters.size() > 0;
	}

	/**
	 * {@inheritDoc}
	 * 
	 * @deprecated Please use {@link #nextLong()} instead.
	 */
	@Deprecated
	@Override
	public Long next() {
		return Long.valueOf(nextLong());
	}

	@Override
	public long nextLong() {
		QueuedIterator qiter = iters.peek();
		final long value = qiter.value;
		int count = 0;
		while (qiter != null && qiter.value == value) {
			iters.remove();
			count++;
			boolean more = false;
			while (qiter.iter.hasNext()) {
				long val = qiter.iter.nextLong();
				if (val == value) {
					count++;
				} else {
					qiter.value = val;
					more = true;
					break;
				}
			}
			if (more) {
				iters.add(qiter);
			}
			qiter = iters.peek();
		}
		currentCount = count;
		return value;
	}

	/**
	 * @return the count how often the last value (returned by
	 *         {@link #nextLong()}) was seen in the input iterators
	 */
	public int getCount() {
		return currentCount;
	}
}
