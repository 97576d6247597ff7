/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.sketch;

import java.util.Arrays;

import it.unimi.dsi.util.HyperLogLogCounterArray;

/**
 * HyperLogLog counters of all nodes of a graph, one generation (round) of the
 * reachability sketches, held in a {@link HyperLogLogCounterArray}. Counter
 * <i>x</i> belongs to node <i>x</i>. Elements are hashed by the counter array
 * using the seed of the registry.
 *
 * <p>
 * Counters are moved in and out of the array as packed longword arrays of
 * {@link #longwordsPerCounter()} elements (see {@link #readCounter(int, long[])}
 * and {@link #writeCounter(long[], int)}), register <i>i</i> occupying the bits
 * <code>[i &middot; registerSize, (i + 1) &middot; registerSize)</code>.
 * </p>
 *
 * <p>
 * A registry is written by at most one thread per node and only the counters
 * of 64 consecutive nodes starting at a multiple of 64 are guaranteed to fill
 * whole longwords: threads writing concurrently into the same registry must
 * operate on such blocks of nodes.
 * </p>
 */
public class SketchRegistry extends HyperLogLogCounterArray {

	private static final long serialVersionUID = 1L;

	/**
	 * Upper bound of the number of distinct elements passed to the counter array.
	 * Elements are node IDs, so all registries share the same register size.
	 */
	static final long MAX_ELEMENTS = Integer.MAX_VALUE;

	/** Block of nodes whose counters always start and end at longword boundaries */
	public static final int ALIGNED_BLOCK = Long.SIZE;

	/** 2<sup>-k</sup> for all possible register values */
	private static final double[] INV_POW2 = new double[Long.SIZE + 2];
	static {
		for (int k = 0; k < INV_POW2.length; k++) {
			INV_POW2[k] = Math.scalb(1.0, -k);
		}
	}

	private final int numNodes;
	private final long hashSeed;
	private final int longwords;
	private final long registerMask;

	/**
	 * Create a registry with empty counters.
	 */
	public SketchRegistry(int numNodes, int log2m, long seed) {
		super(numNodes, MAX_ELEMENTS, HyperLogLogSketch.checkLog2m(log2m), seed);
		this.numNodes = numNodes;
		this.hashSeed = seed;
		this.longwords = (int) ((((long) registerSize << log2m) + Long.SIZE - 1) / Long.SIZE);
		this.registerMask = (1L << registerSize) - 1;
	}

	/**
	 * @return a new registry with empty counters and the same parameters
	 */
	public SketchRegistry newGeneration() {
		return new SketchRegistry(numNodes, log2m, hashSeed);
	}

	public int numNodes() {
		return numNodes;
	}

	public int log2m() {
		return log2m;
	}

	public long seed() {
		return hashSeed;
	}

	/**
	 * @return the number of bits of a register
	 */
	public int registerSize() {
		return registerSize;
	}

	/**
	 * @return the length of the longword arrays holding a single counter
	 */
	public int longwordsPerCounter() {
		return longwords;
	}

	/**
	 * @return an empty counter to be used with {@link #readCounter(int, long[])}
	 */
	public long[] newCounter() {
		return new long[longwords];
	}

	/**
	 * Copy the counter of a node into a buffer.
	 */
	public void readCounter(int node, long[] counter) {
		checkNode(node);
		getCounter(node, counter);
	}

	/**
	 * Overwrite the counter of a node.
	 */
	public void writeCounter(long[] counter, int node) {
		checkNode(node);
		setCounter(counter, node);
	}

	private void checkNode(long node) {
		if (node < 0 || node >= numNodes) {
			throw new IndexOutOfBoundsException("Node " + node + " not in [0, " + numNodes + ")");
		}
	}

	/**
	 * Add the node's own ID to its counter.
	 */
	public void seed(int node) {
		checkNode(node);
		add(node, node);
	}

	/**
	 * Seed the counters of all nodes.
	 */
	public void seedAll() {
		for (int node = 0; node < numNodes; node++) {
			add(node, node);
		}
	}

	/**
	 * Merge the counter of a node of a (possibly different) registry into the
	 * counter of a target node.
	 *
	 * @return true if the target counter has changed
	 */
	public boolean mergeInto(int target, SketchRegistry source, int sourceNode) {
		checkNode(target);
		source.checkNode(sourceNode);
		checkCompatible(source.log2m, source.registerSize, source.hashSeed);
		final long[] counter = newCounter();
		final long[] other = newCounter();
		getCounter(target, counter);
		source.getCounter(sourceNode, other);
		if (mergeCounters(counter, other)) {
			setCounter(counter, target);
			return true;
		}
		return false;
	}

	/**
	 * Merge a standalone counter into the counter of a node.
	 *
	 * @return true if the target counter has changed
	 */
	public boolean mergeInto(int target, HyperLogLogSketch sketch) {
		return mergeInto(target, sketch.counters(), 0);
	}

	/**
	 * Register-wise maximum of two packed counters of this registry.
	 *
	 * @param counter the counter updated in place
	 * @param other   the counter merged into <code>counter</code>
	 * @return true if <code>counter</code> has changed
	 */
	public boolean mergeCounters(long[] counter, long[] other) {
		final long[] before = counter.clone();
		max(counter, other);
		return !Arrays.equals(before, counter);
	}

	/**
	 * Overwrite the counter of a node with the counter of the same node in
	 * another registry.
	 */
	public void copyFrom(SketchRegistry source, int node) {
		checkNode(node);
		checkCompatible(source.log2m, source.registerSize, source.hashSeed);
		final long[] counter = newCounter();
		source.getCounter(node, counter);
		setCounter(counter, node);
	}

	/**
	 * @return the value of register <code>i</code> of a packed counter
	 */
	public int register(long[] counter, int i) {
		final long bit = (long) i * registerSize;
		final int word = (int) (bit >>> 6);
		final int shift = (int) (bit & (Long.SIZE - 1));
		long value = counter[word] >>> shift;
		if (shift + registerSize > Long.SIZE) {
			value |= counter[word + 1] << (Long.SIZE - shift);
		}
		return (int) (value & registerMask);
	}

	public double estimate(int node) {
		checkNode(node);
		final long[] counter = newCounter();
		getCounter(node, counter);
		return estimate(counter);
	}

	/**
	 * Estimate the cardinality of a packed counter. For small cardinalities (some
	 * registers are still zero) the linear counting estimate is used as long as
	 * it does not exceed 2.5 <i>m</i>, otherwise the raw HyperLogLog estimate,
	 * bounded from below by 2.5 <i>m</i>. Both estimates grow with the register
	 * values and linear counting is never resumed once left, so the estimate
	 * never decreases when counters are merged.
	 */
	public double estimate(long[] counter) {
		double sum = 0;
		int zeros = 0;
		for (int i = 0; i < m; i++) {
			final int r = register(counter, i);
			sum += INV_POW2[r];
			if (r == 0) {
				zeros++;
			}
		}
		final double threshold = 2.5 * m;
		if (zeros > 0) {
			final double linearCounting = m * Math.log((double) m / zeros);
			if (linearCounting <= threshold) {
				return linearCounting;
			}
		}
		final double raw = alpha(m) * m * (double) m / sum;
		return Math.max(raw, threshold);
	}

	private static double alpha(int m) {
		switch (m) {
		case 16:
			return 0.673;
		case 32:
			return 0.697;
		case 64:
			return 0.709;
		default:
			return 0.7213 / (1 + 1.079 / m);
		}
	}

	/**
	 * @return a copy of the counter of a node
	 */
	public HyperLogLogSketch get(int node) {
		checkNode(node);
		final long[] counter = newCounter();
		getCounter(node, counter);
		HyperLogLogSketch sketch = new HyperLogLogSketch(log2m, hashSeed);
		sketch.counters().setCounter(counter, 0);
		return sketch;
	}

	void checkCompatible(int otherLog2m, int otherRegisterSize, long otherSeed) {
		if (otherLog2m != log2m || otherRegisterSize != registerSize || otherSeed != hashSeed) {
			throw new IllegalArgumentException("Cannot merge HyperLogLog counters with different parameters");
		}
	}
}
