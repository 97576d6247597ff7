/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

import java.util.NoSuchElementException;

/**
 * Thrown on lookup of a node ID outside the range of assigned IDs, or of a node
 * label which is not contained in the node identity table.
 */
public class UnknownNodeException extends NoSuchElementException {

	private static final long serialVersionUID = 1L;

	public UnknownNodeException(long nodeId, int numNodes) {
		super("Unknown node ID " + nodeId + ", valid IDs are [0, " + numNodes + ")");
	}

	public UnknownNodeException(String label) {
		super("Unknown node label: " + label);
	}
}
