/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.commoncrawl.centrality.io.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable, versioned link graph: node identity table, graph and
 * transpose. Snapshots are kept in a graph directory, one subdirectory per
 * version:
 * 
 * <pre>
 * graph_dir/
 *   LATEST                    version of the latest complete snapshot
 *   snapshot-000001/
 *     nodes.tsv               node identity table
 *     graph.{graph,offsets,properties}
 *     graph-t.{graph,offsets,properties}
 *     snapshot.properties     version, number of nodes and arcs
 * </pre>
 * 
 * A new snapshot is written into a temporary directory and only published if
 * the build succeeds. Published snapshots are never modified.
 */
public class GraphSnapshot {

	protected static Logger LOG = LoggerFactory.getLogger(GraphSnapshot.class);

	public static final String LATEST = "LATEST";
	public static final String NODES_FILE = "nodes.tsv";
	public static final String GRAPH_NAME = "graph";
	public static final String PROPERTIES_FILE = "snapshot.properties";

	private static final Pattern SNAPSHOT_DIR_PATTERN = Pattern.compile("snapshot-(\\d+)");

	private final long version;
	private final Path directory;
	private final NodeIdentityTable identityTable;
	private final GraphStore graphStore;

	private GraphSnapshot(long version, Path directory, NodeIdentityTable identityTable, GraphStore graphStore) {
		this.version = version;
		this.directory = directory;
		this.identityTable = identityTable;
		this.graphStore = graphStore;
	}

	public long getVersion() {
		return version;
	}

	public Path getDirectory() {
		return directory;
	}

	public NodeIdentityTable getIdentityTable() {
		return identityTable;
	}

	public GraphStore getGraphStore() {
		return graphStore;
	}

	public int numNodes() {
		return graphStore.numNodes();
	}

	public static Path snapshotDirectory(Path graphDir, long version) {
		return graphDir.resolve(String.format("snapshot-%06d", version));
	}

	/**
	 * @return the version of the latest published snapshot, empty if there is
	 *         none
	 */
	public static OptionalLong latestVersion(Path graphDir) throws IOException {
		return AtomicFiles.readPointer(graphDir.resolve(LATEST));
	}

	/**
	 * @return the next free version, also considering snapshot directories not
	 *         referenced by the pointer
	 */
	private static long nextVersion(Path graphDir) throws IOException {
		long max = latestVersion(graphDir).orElse(0);
		try (Stream<Path> dirs = Files.list(graphDir)) {
			for (Path dir : (Iterable<Path>) dirs::iterator) {
				Matcher m = SNAPSHOT_DIR_PATTERN.matcher(dir.getFileName().toString());
				if (m.matches()) {
					max = Math.max(max, Long.parseLong(m.group(1)));
				}
			}
		}
		return max + 1;
	}

	/**
	 * Build and publish a new snapshot.
	 * 
	 * @param graphDir      graph directory
	 * @param identityTable node identity table, all arcs must refer to interned
	 *                      nodes
	 * @param arcs          arcs of the graph
	 * @return the published snapshot
	 * @throws MalformedEdgeException if an arc refers to a node not in the
	 *                                identity table, no snapshot is published in
	 *                                this case
	 */
	public static GraphSnapshot build(Path graphDir, NodeIdentityTable identityTable, ArcSorter arcs)
			throws IOException {
		Files.createDirectories(graphDir);
		long version = nextVersion(graphDir);
		Path target = snapshotDirectory(graphDir, version);
		Path temp = target.resolveSibling(target.getFileName() + ".tmp");
		AtomicFiles.deleteRecursively(temp);
		Files.createDirectories(temp);
		LOG.info("Building graph snapshot {} in {}", version, temp);
		try {
			identityTable.store(temp.resolve(NODES_FILE));
			GraphStore store = GraphStore.build(identityTable.size(), arcs,
					temp.resolve(GRAPH_NAME).toString());
			Properties props = new Properties();
			props.setProperty("version", Long.toString(version));
			props.setProperty("nodes", Integer.toString(store.numNodes()));
			props.setProperty("arcs", Long.toString(store.numArcs()));
			props.setProperty("created", Long.toString(System.currentTimeMillis()));
			AtomicFiles.storeProperties(props, temp.resolve(PROPERTIES_FILE), "graph snapshot");
			AtomicFiles.publish(temp, target);
		} catch (IOException | RuntimeException e) {
			LOG.error("Failed to build graph snapshot {}, nothing is published", version);
			AtomicFiles.deleteRecursively(temp);
			throw e;
		}
		AtomicFiles.writePointer(graphDir.resolve(LATEST), version);
		LOG.info("Published graph snapshot {}", target);
		return load(graphDir, version);
	}

	public static GraphSnapshot load(Path graphDir, long version) throws IOException {
		Path dir = snapshotDirectory(graphDir, version);
		if (!Files.isDirectory(dir)) {
			throw new IOException("Graph snapshot " + version + " not found in " + graphDir);
		}
		Properties props = AtomicFiles.loadProperties(dir.resolve(PROPERTIES_FILE));
		NodeIdentityTable table = NodeIdentityTable.load(dir.resolve(NODES_FILE));
		GraphStore store = GraphStore.load(dir.resolve(GRAPH_NAME).toString());
		int numNodes = Integer.parseInt(props.getProperty("nodes"));
		if (table.size() != numNodes || store.numNodes() != numNodes) {
			throw new IOException("Inconsistent graph snapshot " + dir + ": " + numNodes + " nodes expected, "
					+ table.size() + " labels, " + store.numNodes() + " graph nodes");
		}
		return new GraphSnapshot(version, dir, table, store);
	}

	/**
	 * Load the latest published snapshot.
	 * 
	 * @throws IOException if there is no published snapshot in the directory
	 */
	public static GraphSnapshot loadLatest(Path graphDir) throws IOException {
		OptionalLong version = latestVersion(graphDir);
		if (!version.isPresent()) {
			throw new IOException("No graph snapshot found in " + graphDir);
		}
		return load(graphDir, version.getAsLong());
	}
}
