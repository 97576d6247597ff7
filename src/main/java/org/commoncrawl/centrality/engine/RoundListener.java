/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.engine;

/**
 * Notified after every committed round of a centrality computation.
 */
@FunctionalInterface
public interface RoundListener {

	/**
	 * @param statistics  statistics of the completed round
	 * @param termination reason if the computation terminates after this round,
	 *                    or null
	 */
	void roundCompleted(RoundStatistics statistics, TerminationReason termination);
}
