/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.checkpoint;

import org.commoncrawl.centrality.sketch.SketchRegistry;

/**
 * State of a centrality computation after a completed round: the reachability
 * sketches and harmonic centrality accumulators of all nodes, plus the
 * parameters required to verify that a resumed computation continues the same
 * run.
 */
public class Checkpoint {

	private final int round;
	private final SketchRegistry sketches;
	private final double[] accumulators;
	private final String termination;
	private final long graphVersion;
	private final String direction;
	private final long modifiedNodes;
	private final double newReachable;

	/**
	 * @param round         last completed round
	 * @param sketches      sketches after the round
	 * @param accumulators  harmonic centrality accumulators after the round
	 * @param termination   reason why the computation has terminated, null if
	 *                      not terminated
	 * @param graphVersion  version of the graph snapshot
	 * @param direction     direction of the expansion
	 * @param modifiedNodes number of nodes whose sketch changed in the round
	 * @param newReachable  estimated number of newly reached nodes in the round
	 */
	public Checkpoint(int round, SketchRegistry sketches, double[] accumulators, String termination, long graphVersion,
			String direction, long modifiedNodes, double newReachable) {
		if (accumulators.length != sketches.numNodes()) {
			throw new IllegalArgumentException("Number of accumulators (" + accumulators.length
					+ ") differs from number of sketches (" + sketches.numNodes() + ")");
		}
		this.round = round;
		this.sketches = sketches;
		this.accumulators = accumulators;
		this.termination = termination;
		this.graphVersion = graphVersion;
		this.direction = direction;
		this.modifiedNodes = modifiedNodes;
		this.newReachable = newReachable;
	}

	public int getRound() {
		return round;
	}

	public SketchRegistry getSketches() {
		return sketches;
	}

	public double[] getAccumulators() {
		return accumulators;
	}

	public boolean isTerminal() {
		return termination != null;
	}

	public String getTermination() {
		return termination;
	}

	public long getGraphVersion() {
		return graphVersion;
	}

	public String getDirection() {
		return direction;
	}

	public int numNodes() {
		return sketches.numNodes();
	}

	public long getModifiedNodes() {
		return modifiedNodes;
	}

	public double getNewReachable() {
		return newReachable;
	}

	@Override
	public String toString() {
		return "checkpoint of round " + round + (isTerminal() ? " (terminal: " + termination + ")" : "");
	}
}
