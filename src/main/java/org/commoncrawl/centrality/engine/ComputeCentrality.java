/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.engine;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

import org.commoncrawl.centrality.checkpoint.CheckpointManager;
import org.commoncrawl.centrality.graph.GraphSnapshot;
import org.commoncrawl.centrality.output.ScoreWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compute harmonic centrality over the latest graph snapshot, resuming from the
 * latest checkpoint if there is one, and write the scores.
 */
public class ComputeCentrality {

	protected static Logger LOG = LoggerFactory.getLogger(ComputeCentrality.class);

	/** Exit code if the computation was stopped before termination */
	public static final int EXIT_STOPPED = 3;

	private static void showHelp() {
		System.err.println("ComputeCentrality [options]... <graph_dir> <checkpoint_dir> <scores_out>");
		System.err.println("");
		System.err.println("Compute approximate harmonic centrality over the latest graph snapshot");
		System.err.println("in <graph_dir>. After every round a checkpoint is written to <checkpoint_dir>,");
		System.err.println("an interrupted computation is resumed from the latest checkpoint.");
		System.err.println("Scores are written as <label> \\t <score> to <scores_out> (`-' for stdout).");
		System.err.println("");
		System.err.println("Options:");
		System.err.println(" -h\t(also -? or --help) show usage message and exit");
		System.err.println(" --config <file>\tread parameters from properties file, options given");
		System.err.println("                \ton the command line take precedence");
		System.err.println(" --log2m <n>\tlog2 of number of registers per HyperLogLog counter (default: "
				+ CentralityConfig.DEFAULT_LOG2M + ")");
		System.err.println(" --rsd <x>\trelative standard deviation, alternative to --log2m");
		System.err.println(" --max-rounds <n>\tmax. number of rounds (default: " + CentralityConfig.DEFAULT_MAX_ROUNDS
				+ ")");
		System.err.println(" --threshold <x>\tstop when newly reached nodes in a round fall below");
		System.err.println("                \tthis fraction of all nodes (default: 0.0)");
		System.err.println(" --direction <d>\tinbound (default): score how well a node is reachable,");
		System.err.println("                \toutbound: score how well a node reaches others");
		System.err.println(" --threads <n>\tnumber of worker threads (default: number of processors)");
		System.err.println(" --granularity <n>\tnodes per task (default: " + CentralityConfig.DEFAULT_GRANULARITY
				+ ")");
		System.err.println(" --seed <n>\thash seed");
		System.err.println(" --keep-checkpoints <n>\tnumber of checkpoints to keep (default: 1)");
		System.err.println(" --no-resume\tremove existing checkpoints and start from scratch");
		System.err.println(" --snapshot <version>\tuse the given graph snapshot version instead of the latest");
		System.err.println(" --ranked\twrite <rank> \\t <score> \\t <label> sorted by decreasing score");
		System.err.println(" --binary <file>\tadditionally store scores as binary floats");
	}

	public static void main(String[] args) {
		CentralityConfig config = new CentralityConfig();
		Properties overrides = new Properties();
		String configFile = null;
		String binaryOut = null;
		boolean ranked = false;
		long snapshotVersion = -1;
		int argpos = 0;
		try {
			while (argpos < args.length && args[argpos].startsWith("-") && args[argpos].length() > 1) {
				switch (args[argpos]) {
				case "-?":
				case "-h":
				case "--help":
					showHelp();
					System.exit(0);
				case "--config":
					configFile = args[++argpos];
					break;
				case "--log2m":
					overrides.setProperty("log2m", args[++argpos]);
					break;
				case "--rsd":
					overrides.setProperty("rsd", args[++argpos]);
					break;
				case "--max-rounds":
					overrides.setProperty("maxRounds", args[++argpos]);
					break;
				case "--threshold":
					overrides.setProperty("convergenceThreshold", args[++argpos]);
					break;
				case "--direction":
					overrides.setProperty("direction", args[++argpos].toUpperCase(Locale.ROOT));
					break;
				case "--threads":
					overrides.setProperty("threads", args[++argpos]);
					break;
				case "--granularity":
					overrides.setProperty("granularity", args[++argpos]);
					break;
				case "--seed":
					overrides.setProperty("seed", args[++argpos]);
					break;
				case "--keep-checkpoints":
					overrides.setProperty("keepCheckpoints", args[++argpos]);
					break;
				case "--no-resume":
					overrides.setProperty("resume", "false");
					break;
				case "--snapshot":
					snapshotVersion = Long.parseLong(args[++argpos]);
					break;
				case "--ranked":
					ranked = true;
					break;
				case "--binary":
					binaryOut = args[++argpos];
					break;
				default:
					System.err.println("Unknown option " + args[argpos]);
					showHelp();
					System.exit(1);
				}
				argpos++;
			}
			if (configFile != null) {
				config.load(Paths.get(configFile));
			}
			config.load(overrides);
		} catch (ArrayIndexOutOfBoundsException e) {
			System.err.println("Missing value for option " + args[argpos - 1]);
			showHelp();
			System.exit(1);
		} catch (IllegalArgumentException e) {
			LOG.error("Invalid parameter: {}", e.getMessage());
			System.exit(1);
		} catch (IOException e) {
			LOG.error("Failed to read configuration {}:", configFile, e);
			System.exit(1);
		}
		if ((args.length - argpos) < 3) {
			showHelp();
			System.exit(1);
		}
		Path graphDir = Paths.get(args[argpos++]);
		Path checkpointDir = Paths.get(args[argpos++]);
		String scoresOut = args[argpos++];

		config.report(LOG);
		CentralityResult result = null;
		GraphSnapshot snapshot = null;
		Thread stopHook = null;
		try {
			if (snapshotVersion >= 0) {
				snapshot = GraphSnapshot.load(graphDir, snapshotVersion);
			} else {
				snapshot = GraphSnapshot.loadLatest(graphDir);
			}
			LOG.info("Using graph snapshot {} with {} nodes", snapshot.getVersion(), snapshot.numNodes());
			CheckpointManager checkpoints = new CheckpointManager(checkpointDir, config.getKeepCheckpoints());
			final CentralityEngine engine = new CentralityEngine(snapshot.getGraphStore(), snapshot.getVersion(),
					config, checkpoints);
			stopHook = new Thread(() -> {
				LOG.warn("Shutdown requested, stopping after the current round is committed");
				engine.requestStop();
				try {
					engine.awaitFinished();
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			}, "centrality-shutdown");
			Runtime.getRuntime().addShutdownHook(stopHook);
			result = engine.run();
		} catch (IOException | IllegalStateException e) {
			LOG.error("Failed to compute harmonic centrality:", e);
			System.exit(1);
		}
		try {
			Runtime.getRuntime().removeShutdownHook(stopHook);
		} catch (IllegalStateException e) {
			LOG.info("JVM is shutting down, last completed round: {}", result.getRounds());
		}
		if (!result.isTerminal()) {
			LOG.warn("Computation stopped after round {}, run again to resume", result.getRounds());
			System.exit(EXIT_STOPPED);
		}
		LOG.info("Finished: {}", result);

		ScoreWriter writer = new ScoreWriter(snapshot.getIdentityTable());
		try {
			OutputStream scoresOutStream;
			if (scoresOut.equals("-")) {
				scoresOutStream = System.out;
			} else {
				scoresOutStream = Files.newOutputStream(Paths.get(scoresOut));
			}
			try (PrintStream out = new PrintStream(scoresOutStream, false, StandardCharsets.UTF_8)) {
				if (ranked) {
					writer.emitRanked(result, out);
				} else {
					writer.emit(result, out);
				}
			}
			if (binaryOut != null) {
				writer.storeBinary(result, Paths.get(binaryOut));
			}
		} catch (IOException e) {
			LOG.error("Failed to write scores:", e);
			System.exit(1);
		}
	}
}
