/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.engine;

/**
 * Why a centrality computation has terminated.
 */
public enum TerminationReason {
	/** no sketch changed in the last round, all reachable nodes are counted */
	STABLE,
	/** newly reached nodes in the last round below the convergence threshold */
	CONVERGED,
	/** maximum number of rounds reached */
	ROUND_LIMIT
}
