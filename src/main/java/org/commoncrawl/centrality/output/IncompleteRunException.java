/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.output;

/**
 * Thrown if scores are requested from a centrality run which has not reached a
 * terminal state. Re-run the computation (resuming from the last checkpoint)
 * until it converges or hits the round limit.
 */
public class IncompleteRunException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final int round;

	public IncompleteRunException(int round) {
		super("Centrality computation not finished, last completed round: " + round);
		this.round = round;
	}

	/**
	 * @return the last completed round
	 */
	public int getRound() {
		return round;
	}
}
