/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.engine;

/**
 * Statistics of one completed round.
 */
public class RoundStatistics {

	private final int round;
	private final long modifiedNodes;
	private final double newReachable;
	private final long elapsedMillis;

	public RoundStatistics(int round, long modifiedNodes, double newReachable, long elapsedMillis) {
		this.round = round;
		this.modifiedNodes = modifiedNodes;
		this.newReachable = newReachable;
		this.elapsedMillis = elapsedMillis;
	}

	public int getRound() {
		return round;
	}

	/**
	 * @return number of nodes whose sketch changed in this round
	 */
	public long getModifiedNodes() {
		return modifiedNodes;
	}

	/**
	 * @return estimated number of node pairs at distance equal to the round
	 *         number, summed over all nodes
	 */
	public double getNewReachable() {
		return newReachable;
	}

	public long getElapsedMillis() {
		return elapsedMillis;
	}

	@Override
	public String toString() {
		return String.format("round %d: %d nodes modified, %.1f newly reachable, %d ms", round, modifiedNodes,
				newReachable, elapsedMillis);
	}
}
