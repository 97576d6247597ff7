/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Build a new graph snapshot from lists of edges. If the graph directory
 * already holds a snapshot, its node identity table is reused, so that nodes
 * keep their IDs and new nodes get IDs assigned after the existing ones.
 */
public class BuildGraph {

	protected static Logger LOG = LoggerFactory.getLogger(BuildGraph.class);

	private NodeIdentityTable identityTable = new NodeIdentityTable();
	private LabelNormalizer normalizer = new LabelNormalizer(LabelNormalizer.Level.PAGE);
	private int batchSize = ArcSorter.DEFAULT_BATCH_SIZE;

	public void setIdentityTable(NodeIdentityTable identityTable) {
		this.identityTable = identityTable;
	}

	public void setNormalizer(LabelNormalizer normalizer) {
		this.normalizer = normalizer;
	}

	public void setBatchSize(int batchSize) {
		this.batchSize = batchSize;
	}

	/**
	 * Reuse the node identity table of the latest snapshot in the graph
	 * directory, if any.
	 */
	public void reuseLatestIdentityTable(Path graphDir) throws IOException {
		if (!Files.isDirectory(graphDir)) {
			return;
		}
		OptionalLong version = GraphSnapshot.latestVersion(graphDir);
		if (version.isPresent()) {
			Path nodes = GraphSnapshot.snapshotDirectory(graphDir, version.getAsLong())
					.resolve(GraphSnapshot.NODES_FILE);
			LOG.info("Reusing node identity table of snapshot {}", version.getAsLong());
			identityTable = NodeIdentityTable.load(nodes);
		}
	}

	public GraphSnapshot build(Path graphDir, List<Path> edgeFiles) throws IOException {
		Files.createDirectories(graphDir);
		try (ArcSorter arcs = new ArcSorter(graphDir, batchSize)) {
			EdgeListReader reader = new EdgeListReader(identityTable, normalizer, arcs);
			for (Path edgeFile : edgeFiles) {
				reader.read(edgeFile);
			}
			reader.logStatistics();
			return GraphSnapshot.build(graphDir, identityTable, arcs);
		}
	}

	private static void showHelp() {
		System.err.println("BuildGraph [options]... <graph_dir> <edges>...");
		System.err.println("");
		System.err.println("Build a graph snapshot from edge lists. Edges are given as lines");
		System.err.println("<source> \\t <target>, files must be UTF-8, optionally gzipped (.gz).");
		System.err.println("The snapshot is published in <graph_dir> as new version.");
		System.err.println("");
		System.err.println("Options:");
		System.err.println(" -h\t(also -? or --help) show usage message and exit");
		System.err.println(" --normalize <level>\tnode level: page (default), host or domain.");
		System.err.println("                    \t`host' maps URLs to host names, `domain' to registered");
		System.err.println("                    \tdomain names (ICANN section of the public suffix list)");
		System.err.println(" --reverse-names\twrite host and domain names in reverse domain name notation");
		System.err.println(" --node-map <file>\treuse node identity table <id> \\t <label>");
		System.err.println("                  \t(default: table of latest snapshot in <graph_dir>)");
		System.err.println(" --fresh\tdo not reuse any node identity table");
		System.err.println(" --batch-size <n>\tnumber of arcs sorted in memory (default: " + ArcSorter.DEFAULT_BATCH_SIZE
				+ ")");
	}

	public static void main(String[] args) {
		LabelNormalizer.Level level = LabelNormalizer.Level.PAGE;
		boolean reverseNames = false;
		boolean fresh = false;
		String nodeMap = null;
		int batchSize = ArcSorter.DEFAULT_BATCH_SIZE;
		int argpos = 0;
		while (argpos < args.length && args[argpos].startsWith("-")) {
			switch (args[argpos]) {
			case "-?":
			case "-h":
			case "--help":
				showHelp();
				System.exit(0);
			case "--normalize":
				try {
					level = LabelNormalizer.Level.valueOf(args[++argpos].toUpperCase(Locale.ROOT));
				} catch (IllegalArgumentException | ArrayIndexOutOfBoundsException e) {
					System.err.println("Invalid or missing level for --normalize");
					showHelp();
					System.exit(1);
				}
				break;
			case "--reverse-names":
				reverseNames = true;
				break;
			case "--node-map":
				if (argpos + 1 == args.length) {
					System.err.println("Missing file for --node-map");
					showHelp();
					System.exit(1);
				}
				nodeMap = args[++argpos];
				break;
			case "--fresh":
				fresh = true;
				break;
			case "--batch-size":
				try {
					batchSize = Integer.parseInt(args[++argpos]);
				} catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
					LOG.error("Invalid or missing number for --batch-size");
					System.exit(1);
				}
				break;
			default:
				System.err.println("Unknown option " + args[argpos]);
				showHelp();
				System.exit(1);
			}
			argpos++;
		}
		if ((args.length - argpos) < 2) {
			showHelp();
			System.exit(1);
		}
		Path graphDir = Paths.get(args[argpos++]);
		List<Path> edgeFiles = new ArrayList<>();
		while (argpos < args.length) {
			edgeFiles.add(Paths.get(args[argpos++]));
		}
		BuildGraph builder = new BuildGraph();
		builder.setNormalizer(new LabelNormalizer(level, reverseNames));
		builder.setBatchSize(batchSize);
		LOG.info("{} with {} level nodes, {} edge files", BuildGraph.class.getSimpleName(), level, edgeFiles.size());
		try {
			if (nodeMap != null) {
				builder.setIdentityTable(NodeIdentityTable.load(Paths.get(nodeMap)));
			} else if (!fresh) {
				builder.reuseLatestIdentityTable(graphDir);
			}
			GraphSnapshot snapshot = builder.build(graphDir, edgeFiles);
			LOG.info("Built graph snapshot {} with {} nodes and {} arcs", snapshot.getVersion(), snapshot.numNodes(),
					snapshot.getGraphStore().numArcs());
		} catch (MalformedEdgeException e) {
			LOG.error("Malformed edge, no snapshot published: {}", e.getMessage());
			System.exit(1);
		} catch (IOException e) {
			LOG.error("Failed to build graph:", e);
			System.exit(1);
		}
	}
}
