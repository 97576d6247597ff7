/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.output;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

import org.commoncrawl.centrality.engine.CentralityResult;
import org.commoncrawl.centrality.graph.NodeIdentityTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.Arrays;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.io.BinIO;
import it.unimi.dsi.fastutil.objects.Object2DoubleLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMap;

/**
 * Write final harmonic centrality scores keyed by node label. Scores can only
 * be written once the computation has terminated (converged or reached the
 * round limit).
 * 
 * <p>
 * Output formats:
 * <dl>
 * <dt>scores</dt>
 * <dd>&langle;label, score&rangle;, tab-separated, in order of node IDs</dd>
 * <dt>ranked</dt>
 * <dd>&langle;rank, score, label&rangle;, sorted by decreasing score, ties are
 * ordered by node ID</dd>
 * <dt>binary</dt>
 * <dd>scores as binary floats indexed by node ID, the format of the LAW
 * ranking tools</dd>
 * </dl>
 * </p>
 */
public class ScoreWriter {

	protected static Logger LOG = LoggerFactory.getLogger(ScoreWriter.class);

	private final NodeIdentityTable identityTable;

	private double[] values;
	private int[] indirectSortPerm;

	public ScoreWriter(NodeIdentityTable identityTable) {
		this.identityTable = identityTable;
	}

	private double[] checkTerminal(CentralityResult result) {
		if (!result.isTerminal()) {
			throw new IncompleteRunException(result.getRounds());
		}
		if (result.numNodes() != identityTable.size()) {
			throw new IllegalStateException("Number of scores (" + result.numNodes()
					+ ") differs from number of nodes (" + identityTable.size() + ")");
		}
		return result.getScores();
	}

	/**
	 * Write &langle;label, score&rangle; pairs in order of node IDs.
	 * 
	 * @throws IncompleteRunException if the computation has not terminated
	 */
	public void emit(CentralityResult result, PrintStream out) {
		double[] scores = checkTerminal(result);
		for (int i = 0; i < scores.length; i++) {
			out.print(identityTable.resolve(i));
			out.print('\t');
			out.print(scores[i]);
			out.print('\n');
		}
		out.flush();
		LOG.info("Wrote scores of {} nodes", scores.length);
	}

	/**
	 * @return map from node label to score
	 * @throws IncompleteRunException if the computation has not terminated
	 */
	public Object2DoubleMap<String> toMap(CentralityResult result) {
		double[] scores = checkTerminal(result);
		Object2DoubleMap<String> map = new Object2DoubleLinkedOpenHashMap<>(scores.length);
		for (int i = 0; i < scores.length; i++) {
			map.put(identityTable.resolve(i), scores[i]);
		}
		return map;
	}

	/**
	 * Store scores as binary floats.
	 * 
	 * @throws IncompleteRunException if the computation has not terminated
	 */
	public void storeBinary(CentralityResult result, Path file) throws IOException {
		double[] scores = checkTerminal(result);
		float[] floats = new float[scores.length];
		for (int i = 0; i < scores.length; i++) {
			floats[i] = (float) scores[i];
		}
		BinIO.storeFloats(floats, file.toString());
		LOG.info("Stored scores of {} nodes as binary floats in {}", floats.length, file);
	}

	private int compareIndirect(int k1, int k2) {
		k1 = indirectSortPerm[k1];
		k2 = indirectSortPerm[k2];
		double f1 = values[k1];
		double f2 = values[k2];
		// sort in reverse order, higher values first
		if (f1 < f2) {
			return 1;
		}
		if (f1 > f2) {
			return -1;
		}
		// secondary sorting by node ID
		return Integer.compare(k1, k2);
	}

	private void swapIndirect(int k1, int k2) {
		IntArrays.swap(indirectSortPerm, k1, k2);
	}

	/**
	 * @return node IDs sorted by decreasing score
	 * @throws IncompleteRunException if the computation has not terminated
	 */
	public int[] rankOrder(CentralityResult result) {
		values = checkTerminal(result);
		int length = values.length;
		indirectSortPerm = new int[length];
		for (int i = 0; i < length; i++) {
			indirectSortPerm[i] = i;
		}
		Arrays.parallelQuickSort(0, length, this::compareIndirect, this::swapIndirect);
		int[] order = indirectSortPerm;
		indirectSortPerm = null;
		values = null;
		return order;
	}

	/**
	 * Write &langle;rank, score, label&rangle; sorted by decreasing score.
	 * 
	 * @throws IncompleteRunException if the computation has not terminated
	 */
	public void emitRanked(CentralityResult result, PrintStream out) {
		int[] order = rankOrder(result);
		for (int i = 0; i < order.length; i++) {
			out.print(i + 1);
			out.print('\t');
			out.print(result.getScore(order[i]));
			out.print('\t');
			out.print(identityTable.resolve(order[i]));
			out.print('\n');
		}
		out.flush();
		LOG.info("Wrote ranked scores of {} nodes", order.length);
	}
}
