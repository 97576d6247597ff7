/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.engine;

import java.util.Arrays;

/**
 * Harmonic centrality accumulators of all nodes after the last completed round
 * of a computation. The result is final only if the computation has reached a
 * terminal state, see {@link #isTerminal()}.
 */
public class CentralityResult {

	private final int rounds;
	private final double[] scores;
	private final TerminationReason termination;

	public CentralityResult(int rounds, double[] scores, TerminationReason termination) {
		this.rounds = rounds;
		this.scores = scores;
		this.termination = termination;
	}

	/**
	 * @return number of completed rounds
	 */
	public int getRounds() {
		return rounds;
	}

	public boolean isTerminal() {
		return termination != null;
	}

	/**
	 * @return termination reason or null if the computation has not terminated
	 */
	public TerminationReason getTermination() {
		return termination;
	}

	public int numNodes() {
		return scores.length;
	}

	public double getScore(int node) {
		return scores[node];
	}

	/**
	 * @return a copy of the scores, indexed by node ID
	 */
	public double[] getScores() {
		return Arrays.copyOf(scores, scores.length);
	}

	@Override
	public String toString() {
		return "harmonic centrality of " + scores.length + " nodes after " + rounds + " rounds"
				+ (isTerminal() ? " (" + termination + ")" : " (not terminated)");
	}
}
