/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.sketch;

import it.unimi.dsi.util.HyperLogLogCounterArray;

/**
 * A single HyperLogLog counter estimating the number of distinct elements
 * (node IDs) added to it. See Philippe Flajolet, &Eacute;ric Fusy, Olivier
 * Gandouet and Fr&eacute;d&eacute;ric Meunier, &ldquo;HyperLogLog: the
 * analysis of a near-optimal cardinality estimation algorithm&rdquo;, AofA
 * 2007.
 *
 * <p>
 * The counter uses <i>m</i> = 2<sup>log2m</sup> registers. The relative
 * standard deviation of the estimate is about 1.04 / &radic;<i>m</i>. Counters
 * are merged by taking the register-wise maximum, which makes merging
 * duplicate-insensitive, idempotent, commutative and associative. Counters can
 * only be merged if they share the number of registers and the hash seed.
 * </p>
 *
 * <p>
 * The counter is a one-element {@link SketchRegistry} and can be merged with
 * the counters of the nodes of any registry with the same parameters.
 * </p>
 */
public class HyperLogLogSketch {

	public static final int MIN_LOG2M = 4;
	public static final int MAX_LOG2M = 16;

	private final SketchRegistry counters;

	public HyperLogLogSketch(int log2m, long seed) {
		counters = new SketchRegistry(1, log2m, seed);
	}

	/**
	 * @return the argument
	 * @throws IllegalArgumentException if the number of registers is out of the
	 *                                  supported range
	 */
	public static int checkLog2m(int log2m) {
		if (log2m < MIN_LOG2M || log2m > MAX_LOG2M) {
			throw new IllegalArgumentException(
					"Number of registers must be 2^" + MIN_LOG2M + " to 2^" + MAX_LOG2M + ", got 2^" + log2m);
		}
		return log2m;
	}

	/**
	 * @param rsd relative standard deviation
	 * @return the logarithm of the number of registers needed to obtain the given
	 *         relative standard deviation, clamped to the supported range
	 */
	public static int log2NumberOfRegisters(double rsd) {
		int log2m = HyperLogLogCounterArray.log2NumberOfRegisters(rsd);
		return Math.max(MIN_LOG2M, Math.min(MAX_LOG2M, log2m));
	}

	/**
	 * @return the relative standard deviation of counters with
	 *         2<sup>log2m</sup> registers
	 */
	public static double relativeStandardDeviation(int log2m) {
		return HyperLogLogCounterArray.relativeStandardDeviation(log2m);
	}

	public int log2m() {
		return counters.log2m();
	}

	public long seed() {
		return counters.seed();
	}

	SketchRegistry counters() {
		return counters;
	}

	/**
	 * @return the register values, unpacked
	 */
	public int[] registers() {
		final long[] counter = counters.newCounter();
		counters.readCounter(0, counter);
		final int[] registers = new int[1 << counters.log2m()];
		for (int i = 0; i < registers.length; i++) {
			registers[i] = counters.register(counter, i);
		}
		return registers;
	}

	public void add(long element) {
		counters.add(0, element);
	}

	/**
	 * Merge another counter into this one.
	 *
	 * @return true if this counter has changed
	 */
	public boolean merge(HyperLogLogSketch other) {
		return counters.mergeInto(0, other.counters, 0);
	}

	public double estimate() {
		return counters.estimate(0);
	}

	public HyperLogLogSketch copy() {
		HyperLogLogSketch copy = new HyperLogLogSketch(log2m(), seed());
		copy.counters.copyFrom(counters, 0);
		return copy;
	}
}
