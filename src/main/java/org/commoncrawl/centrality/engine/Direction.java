/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.engine;

/**
 * Adjacency direction along which reachability sketches are expanded.
 */
public enum Direction {
	/**
	 * Expand over incoming links: the sketch of a node holds the nodes from which
	 * it is reachable, the score is the harmonic centrality
	 * &sum;<sub>u&ne;v</sub> 1/d(u,v) measuring how well a node is reachable.
	 */
	INBOUND,
	/**
	 * Expand over outgoing links: the sketch of a node holds the nodes it can
	 * reach, the score is &sum;<sub>u&ne;v</sub> 1/d(v,u).
	 */
	OUTBOUND
}
