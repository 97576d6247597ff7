/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.NoSuchElementException;

import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.webgraph.ImmutableGraph;
import it.unimi.dsi.webgraph.ImmutableSequentialGraph;
import it.unimi.dsi.webgraph.NodeIterator;

/**
 * A sequential-only graph backed by a file of packed arcs sorted by source and
 * target node (see {@link ArcSorter}). Used to feed the arcs into
 * {@link it.unimi.dsi.webgraph.BVGraph#store(ImmutableGraph, CharSequence)}
 * without holding them in memory. Nodes without outgoing arcs are enumerated
 * with an empty successor list, so that the graph has exactly
 * <code>numNodes</code> nodes.
 */
public class ArcListGraph extends ImmutableSequentialGraph {

	/** not a valid arc, node IDs are never negative */
	private static final long NO_ARC = Long.MIN_VALUE;

	private final int numNodes;
	private final long numArcs;
	private final Path arcs;

	public ArcListGraph(int numNodes, long numArcs, Path arcs) {
		this.numNodes = numNodes;
		this.numArcs = numArcs;
		this.arcs = arcs;
	}

	@Override
	public int numNodes() {
		return numNodes;
	}

	@Override
	public long numArcs() {
		return numArcs;
	}

	@Override
	public boolean randomAccess() {
		return false;
	}

	@Override
	public int outdegree(int x) {
		throw new UnsupportedOperationException("Sequential access only");
	}

	@Override
	public ImmutableGraph copy() {
		throw new UnsupportedOperationException("Sequential access only");
	}

	@Override
	public NodeIterator nodeIterator() {
		final ArcSorter.ArcFileIterator iter;
		try {
			iter = new ArcSorter.ArcFileIterator(arcs);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		return new NodeIterator() {
			private int curr = -1;
			private int outdegree = 0;
			private int[] successors = IntArrays.EMPTY_ARRAY;
			/** first arc of the next node with successors, or NO_ARC */
			private long pending = NO_ARC;

			@Override
			public boolean hasNext() {
				if (curr < numNodes - 1) {
					return true;
				}
				try {
					iter.close();
				} catch (IOException e) {
					throw new UncheckedIOException(e);
				}
				return false;
			}

			@Override
			public int nextInt() {
				if (curr >= numNodes - 1) {
					throw new NoSuchElementException();
				}
				curr++;
				outdegree = 0;
				while (pending != NO_ARC || iter.hasNext()) {
					long arc = (pending != NO_ARC) ? pending : iter.nextLong();
					pending = NO_ARC;
					if (ArcSorter.source(arc) != curr) {
						pending = arc;
						break;
					}
					successors = IntArrays.grow(successors, outdegree + 1);
					successors[outdegree++] = ArcSorter.target(arc);
				}
				if (curr == numNodes - 1) {
					// consumers may stop after the last node without calling hasNext()
					try {
						iter.close();
					} catch (IOException e) {
						throw new UncheckedIOException(e);
					}
				}
				return curr;
			}

			@Override
			public int outdegree() {
				return outdegree;
			}

			@Override
			public int[] successorArray() {
				return successors;
			}
		};
	}
}
