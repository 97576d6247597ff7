/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.checkpoint;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.commoncrawl.centrality.io.AtomicFiles;
import org.commoncrawl.centrality.sketch.SketchRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.io.BinIO;
import it.unimi.dsi.fastutil.io.FastBufferedInputStream;
import it.unimi.dsi.fastutil.io.FastBufferedOutputStream;

/**
 * Durable, versioned checkpoints of a centrality computation. Every round is
 * written into its own directory:
 * 
 * <pre>
 * checkpoint_dir/
 *   LATEST                  number of the latest committed round
 *   round-000003/
 *     registers.bin         HyperLogLog counters of all nodes, packed longwords
 *     harmonic.bin          accumulators, binary doubles
 *     checkpoint.properties round, parameters, statistics
 * </pre>
 * 
 * A checkpoint is written into a temporary directory, synced to disk and
 * renamed, only then the pointer <code>LATEST</code> is advanced. A checkpoint
 * is committed once the pointer refers to it. Committed checkpoints are never
 * modified. A failure while writing leaves the previously committed checkpoint
 * intact, the commit can be simply retried.
 */
public class CheckpointManager {

	protected static Logger LOG = LoggerFactory.getLogger(CheckpointManager.class);

	public static final String LATEST = "LATEST";
	public static final String REGISTERS_FILE = "registers.bin";
	public static final String ACCUMULATORS_FILE = "harmonic.bin";
	public static final String PROPERTIES_FILE = "checkpoint.properties";

	private static final Pattern ROUND_DIR_PATTERN = Pattern.compile("round-(\\d+)(\\.tmp)?");

	private final Path directory;
	private final int keep;

	/**
	 * @param directory checkpoint directory, created if it does not exist
	 * @param keep      number of committed checkpoints to keep (at least one)
	 */
	public CheckpointManager(Path directory, int keep) throws IOException {
		if (keep < 1) {
			throw new IllegalArgumentException("At least one checkpoint must be kept");
		}
		this.directory = directory;
		this.keep = keep;
		Files.createDirectories(directory);
	}

	public CheckpointManager(Path directory) throws IOException {
		this(directory, 1);
	}

	public Path getDirectory() {
		return directory;
	}

	public Path roundDirectory(int round) {
		return directory.resolve(String.format("round-%06d", round));
	}

	/**
	 * @return the latest committed round, empty if no checkpoint is committed
	 */
	public OptionalLong latestRound() throws IOException {
		return AtomicFiles.readPointer(directory.resolve(LATEST));
	}

	/**
	 * Write a new checkpoint and advance the pointer to it.
	 * 
	 * @throws IllegalStateException if the round is not newer than the latest
	 *                               committed round
	 */
	public void commit(Checkpoint checkpoint) throws IOException {
		int round = checkpoint.getRound();
		OptionalLong latest = latestRound();
		if (latest.isPresent() && round <= latest.getAsLong()) {
			throw new IllegalStateException(
					"Round " + round + " is not newer than committed round " + latest.getAsLong());
		}
		Path target = roundDirectory(round);
		Path temp = target.resolveSibling(target.getFileName() + ".tmp");
		// left over by a commit which failed before advancing the pointer
		AtomicFiles.deleteRecursively(temp);
		AtomicFiles.deleteRecursively(target);
		Files.createDirectories(temp);
		long start = System.currentTimeMillis();
		try {
			write(checkpoint, temp);
			AtomicFiles.publish(temp, target);
		} catch (IOException | RuntimeException e) {
			LOG.error("Failed to write checkpoint of round {}", round, e);
			AtomicFiles.deleteRecursively(temp);
			throw e;
		}
		AtomicFiles.writePointer(directory.resolve(LATEST), round);
		LOG.info("Committed {} in {} ms", checkpoint, System.currentTimeMillis() - start);
		prune(round);
	}

	private static void write(Checkpoint checkpoint, Path dir) throws IOException {
		SketchRegistry sketches = checkpoint.getSketches();
		writeCounters(sketches, dir.resolve(REGISTERS_FILE));
		BinIO.storeDoubles(checkpoint.getAccumulators(), dir.resolve(ACCUMULATORS_FILE).toString());
		Properties props = new Properties();
		props.setProperty("round", Integer.toString(checkpoint.getRound()));
		props.setProperty("nodes", Integer.toString(sketches.numNodes()));
		props.setProperty("log2m", Integer.toString(sketches.log2m()));
		props.setProperty("seed", Long.toString(sketches.seed()));
		props.setProperty("registerSize", Integer.toString(sketches.registerSize()));
		props.setProperty("graphVersion", Long.toString(checkpoint.getGraphVersion()));
		props.setProperty("direction", checkpoint.getDirection());
		props.setProperty("modifiedNodes", Long.toString(checkpoint.getModifiedNodes()));
		props.setProperty("newReachable", Double.toString(checkpoint.getNewReachable()));
		if (checkpoint.isTerminal()) {
			props.setProperty("termination", checkpoint.getTermination());
		}
		AtomicFiles.storeProperties(props, dir.resolve(PROPERTIES_FILE), "centrality checkpoint");
	}

	/**
	 * Load the latest committed checkpoint.
	 * 
	 * @return the checkpoint or empty if no checkpoint has been committed
	 * @throws IOException if the checkpoint cannot be read or is incomplete
	 */
	public Optional<Checkpoint> resume() throws IOException {
		OptionalLong latest = latestRound();
		if (!latest.isPresent()) {
			LOG.info("No checkpoint found in {}", directory);
			return Optional.empty();
		}
		Path dir = roundDirectory((int) latest.getAsLong());
		LOG.info("Loading checkpoint {}", dir);
		Properties props = AtomicFiles.loadProperties(dir.resolve(PROPERTIES_FILE));
		final int round, numNodes, log2m, registerSize;
		final long seed, graphVersion, modifiedNodes;
		final double newReachable;
		final SketchRegistry sketches;
		try {
			round = Integer.parseInt(required(props, "round"));
			numNodes = Integer.parseInt(required(props, "nodes"));
			log2m = Integer.parseInt(required(props, "log2m"));
			seed = Long.parseLong(required(props, "seed"));
			registerSize = Integer.parseInt(required(props, "registerSize"));
			graphVersion = Long.parseLong(required(props, "graphVersion"));
			required(props, "direction");
			modifiedNodes = Long.parseLong(props.getProperty("modifiedNodes", "0"));
			newReachable = Double.parseDouble(props.getProperty("newReachable", "0"));
			if (numNodes < 0) {
				throw new IllegalArgumentException("Negative number of nodes: " + numNodes);
			}
			sketches = new SketchRegistry(numNodes, log2m, seed);
		} catch (IllegalArgumentException e) {
			// includes NumberFormatException
			throw new IOException("Checkpoint " + dir + " has invalid properties: " + e.getMessage(), e);
		}
		if (round != latest.getAsLong()) {
			throw new IOException("Checkpoint " + dir + " holds round " + round);
		}
		if (registerSize != sketches.registerSize()) {
			throw new IOException("Checkpoint " + dir + " uses registers of " + registerSize + " bits, expected "
					+ sketches.registerSize());
		}
		Path registersFile = dir.resolve(REGISTERS_FILE);
		Path accumulatorsFile = dir.resolve(ACCUMULATORS_FILE);
		long expectedSize = (long) numNodes * sketches.longwordsPerCounter() * Long.BYTES;
		if (Files.size(registersFile) != expectedSize
				|| Files.size(accumulatorsFile) != (long) numNodes * Double.BYTES) {
			throw new IOException("Checkpoint " + dir + " is incomplete: unexpected file sizes");
		}
		readCounters(sketches, registersFile);
		double[] accumulators = BinIO.loadDoubles(accumulatorsFile.toString());
		Checkpoint checkpoint = new Checkpoint(round, sketches, accumulators, props.getProperty("termination"),
				graphVersion, props.getProperty("direction"), modifiedNodes, newReachable);
		LOG.info("Loaded {}", checkpoint);
		return Optional.of(checkpoint);
	}

	private static String required(Properties props, String key) {
		String value = props.getProperty(key);
		if (value == null) {
			throw new IllegalArgumentException("Missing property " + key);
		}
		return value.trim();
	}

	private static void writeCounters(SketchRegistry sketches, Path file) throws IOException {
		final long[] counter = sketches.newCounter();
		try (DataOutputStream out = new DataOutputStream(new FastBufferedOutputStream(Files.newOutputStream(file)))) {
			for (int node = 0; node < sketches.numNodes(); node++) {
				sketches.readCounter(node, counter);
				for (long word : counter) {
					out.writeLong(word);
				}
			}
		}
	}

	private static void readCounters(SketchRegistry sketches, Path file) throws IOException {
		final long[] counter = sketches.newCounter();
		try (DataInputStream in = new DataInputStream(new FastBufferedInputStream(Files.newInputStream(file)))) {
			for (int node = 0; node < sketches.numNodes(); node++) {
				for (int i = 0; i < counter.length; i++) {
					counter[i] = in.readLong();
				}
				sketches.writeCounter(counter, node);
			}
		} catch (EOFException e) {
			throw new IOException("Truncated counters file " + file, e);
		}
	}

	/**
	 * @return rounds of all complete checkpoint directories, ascending
	 */
	public List<Integer> listRounds() throws IOException {
		List<Integer> rounds = new ArrayList<>();
		try (Stream<Path> dirs = Files.list(directory)) {
			for (Path dir : (Iterable<Path>) dirs::iterator) {
				Matcher m = ROUND_DIR_PATTERN.matcher(dir.getFileName().toString());
				if (m.matches() && m.group(2) == null) {
					rounds.add(Integer.parseInt(m.group(1)));
				}
			}
		}
		Collections.sort(rounds);
		return rounds;
	}

	/**
	 * Delete checkpoints older than the newest {@link #keep} committed ones,
	 * temporary directories and uncommitted rounds.
	 */
	private void prune(int latest) throws IOException {
		List<Integer> committed = new ArrayList<>();
		try (Stream<Path> dirs = Files.list(directory)) {
			for (Path dir : (Iterable<Path>) dirs::iterator) {
				Matcher m = ROUND_DIR_PATTERN.matcher(dir.getFileName().toString());
				if (!m.matches()) {
					continue;
				}
				int round = Integer.parseInt(m.group(1));
				if (m.group(2) != null || round > latest) {
					LOG.info("Removing incomplete checkpoint directory {}", dir);
					AtomicFiles.deleteRecursively(dir);
				} else {
					committed.add(round);
				}
			}
		}
		Collections.sort(committed);
		for (int i = 0; i < committed.size() - keep; i++) {
			Path dir = roundDirectory(committed.get(i));
			LOG.info("Removing checkpoint {}", dir);
			AtomicFiles.deleteRecursively(dir);
		}
	}

	/**
	 * Remove all checkpoints, e.g., to start a computation from scratch.
	 */
	public void clear() throws IOException {
		Files.deleteIfExists(directory.resolve(LATEST));
		try (Stream<Path> dirs = Files.list(directory)) {
			for (Path dir : (Iterable<Path>) dirs::iterator) {
				if (ROUND_DIR_PATTERN.matcher(dir.getFileName().toString()).matches()) {
					AtomicFiles.deleteRecursively(dir);
				}
			}
		}
		LOG.info("Removed all checkpoints in {}", directory);
	}
}
