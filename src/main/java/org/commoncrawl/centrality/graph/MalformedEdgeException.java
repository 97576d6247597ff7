/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

/**
 * Thrown if an edge cannot be added to a graph: the input record cannot be
 * parsed or one of its endpoints is not an interned node.
 */
public class MalformedEdgeException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final String record;

	public MalformedEdgeException(String message, String record) {
		super(message + ": <" + record + ">");
		this.record = record;
	}

	public MalformedEdgeException(long source, long target, int numNodes) {
		this("Edge endpoint not in node range [0, " + numNodes + ")", source + "\t" + target);
	}

	/**
	 * @return the offending input record
	 */
	public String getRecord() {
		return record;
	}
}
