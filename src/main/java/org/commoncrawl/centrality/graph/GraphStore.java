/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.logging.ProgressLogger;
import it.unimi.dsi.webgraph.BVGraph;
import it.unimi.dsi.webgraph.ImmutableGraph;
import it.unimi.dsi.webgraph.LazyIntIterator;

/**
 * Immutable adjacency of a link graph: the graph (outgoing links) and its
 * transpose (incoming links), both stored in the compressed
 * {@link BVGraph} format and memory-mapped when loaded, so that the arcs are
 * never loaded into the Java heap.
 * 
 * <p>
 * Successor lists are sorted by node ID and contain no duplicates. Self-loops
 * are kept. All read methods are safe to be called concurrently: every thread
 * accesses the graphs through its own lightweight copy (see
 * {@link ImmutableGraph#copy()}).
 * </p>
 */
public class GraphStore {

	protected static Logger LOG = LoggerFactory.getLogger(GraphStore.class);

	/** The base name of the graph */
	public final String basename;
	/** The graph */
	protected final ImmutableGraph graph;
	/** The transpose of the graph */
	protected final ImmutableGraph graphT;

	private final ThreadLocal<ImmutableGraph> localGraph;
	private final ThreadLocal<ImmutableGraph> localGraphT;

	private GraphStore(String basename, ImmutableGraph graph, ImmutableGraph graphT) {
		this.basename = basename;
		this.graph = graph;
		this.graphT = graphT;
		if (graph.numNodes() != graphT.numNodes()) {
			throw new IllegalStateException("Graph " + basename + " and its transpose differ in the number of nodes: "
					+ graph.numNodes() + " <> " + graphT.numNodes());
		}
		localGraph = ThreadLocal.withInitial(graph::copy);
		localGraphT = ThreadLocal.withInitial(graphT::copy);
	}

	/**
	 * Load graph and transpose (<code>basename.graph</code> and
	 * <code>basename-t.graph</code>) memory-mapped.
	 */
	public static GraphStore load(String basename) throws IOException {
		try {
			LOG.info("Loading graph {}.graph", basename);
			ImmutableGraph graph = ImmutableGraph.loadMapped(basename);
			LOG.info("Loading transpose of the graph {}-t.graph", basename);
			ImmutableGraph graphT = ImmutableGraph.loadMapped(basename + "-t");
			GraphStore store = new GraphStore(basename, graph, graphT);
			LOG.info("Loaded graph {} with {} nodes and {} arcs", basename, store.numNodes(), store.numArcs());
			return store;
		} catch (IOException e) {
			LOG.error("Failed to load graph {}:", basename, e);
			throw e;
		}
	}

	/**
	 * Build graph and transpose from the arcs collected by an {@link ArcSorter}.
	 * Arcs are deduplicated.
	 * 
	 * @param numNodes number of nodes, node IDs are <code>[0, numNodes)</code>
	 * @param arcs     collected arcs
	 * @param basename base name of the graph files to write
	 * @return the stored graph, loaded memory-mapped
	 * @throws MalformedEdgeException if any arc points from or to a node outside
	 *                                the node range
	 */
	public static GraphStore build(int numNodes, ArcSorter arcs, String basename) throws IOException {
		Path arcsFile = Paths.get(basename + ".arcs");
		Path arcsFileT = Paths.get(basename + "-t.arcs");
		try {
			LOG.info("Sorting {} arcs of graph with {} nodes", arcs.numArcsAdded(), numNodes);
			long numArcs = arcs.finish(arcsFile, arcsFileT, numNodes);
			store(new ArcListGraph(numNodes, numArcs, arcsFile), basename);
			store(new ArcListGraph(numNodes, numArcs, arcsFileT), basename + "-t");
		} finally {
			Files.deleteIfExists(arcsFile);
			Files.deleteIfExists(arcsFileT);
		}
		return load(basename);
	}

	private static void store(ImmutableGraph graph, String basename) throws IOException {
		ProgressLogger pl = new ProgressLogger(LOG, "nodes");
		pl.logInterval = 30000;
		LOG.info("Compressing graph {} ({} nodes, {} arcs)", basename, graph.numNodes(), graph.numArcs());
		BVGraph.store(graph, basename, pl);
	}

	public int numNodes() {
		return graph.numNodes();
	}

	public long numArcs() {
		return graph.numArcs();
	}

	private void checkNode(int node) {
		if (node < 0 || node >= graph.numNodes()) {
			throw new UnknownNodeException(node, graph.numNodes());
		}
	}

	public int outdegree(int node) {
		checkNode(node);
		return localGraph.get().outdegree(node);
	}

	public int indegree(int node) {
		checkNode(node);
		return localGraphT.get().outdegree(node);
	}

	/**
	 * @return iterator over the successors of a node, valid only in the calling
	 *         thread
	 */
	public LazyIntIterator outNeighborIterator(int node) {
		checkNode(node);
		return localGraph.get().successors(node);
	}

	/**
	 * @return iterator over the predecessors of a node, valid only in the calling
	 *         thread
	 */
	public LazyIntIterator inNeighborIterator(int node) {
		checkNode(node);
		return localGraphT.get().successors(node);
	}

	/**
	 * @return the successors (link targets) of a node in increasing order
	 */
	public int[] outNeighbors(int node) {
		checkNode(node);
		return toArray(localGraph.get(), node);
	}

	/**
	 * @return the predecessors (nodes linking to the node) in increasing order
	 */
	public int[] inNeighbors(int node) {
		checkNode(node);
		return toArray(localGraphT.get(), node);
	}

	private static int[] toArray(ImmutableGraph g, int node) {
		int[] res = new int[g.outdegree(node)];
		LazyIntIterator iter = g.successors(node);
		for (int i = 0; i < res.length; i++) {
			res[i] = iter.nextInt();
		}
		return res;
	}
}
