/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.engine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.commoncrawl.centrality.checkpoint.Checkpoint;
import org.commoncrawl.centrality.checkpoint.CheckpointManager;
import org.commoncrawl.centrality.graph.GraphStore;
import org.commoncrawl.centrality.sketch.SketchRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.webgraph.LazyIntIterator;
import it.unimi.dsi.webgraph.LazyIntIterators;

/**
 * Approximate harmonic centrality using HyperLogLog counters, following
 * HyperBall (Paolo Boldi and Sebastiano Vigna, &ldquo;In-Core Computation of
 * Geometric Centralities with HyperBall: A Hundred Billion Nodes and
 * Beyond&rdquo;, ICDMW 2013).
 * 
 * <p>
 * Before round 1 the counter of every node holds the node itself. In round
 * <i>r</i> the counter of each node is merged with the counters of its
 * neighbours (predecessors for {@link Direction#INBOUND}, successors for
 * {@link Direction#OUTBOUND}) as of round <i>r</i>-1. The counter then
 * approximates the set of nodes within distance <i>r</i>, and the increase of
 * its estimate is the number of nodes at distance exactly <i>r</i>, which
 * contributes with weight 1/<i>r</i> to the harmonic centrality of the node.
 * </p>
 * 
 * <p>
 * Every round reads the counters of the previous round and writes into a
 * freshly allocated generation of counters and accumulators, each node is
 * written by exactly one task. The result does not depend on the number of
 * threads or the scheduling order. After each round, a checkpoint is committed
 * if a {@link CheckpointManager} is given; an interrupted computation resumes
 * from the last committed round.
 * </p>
 */
public class CentralityEngine {

	protected static Logger LOG = LoggerFactory.getLogger(CentralityEngine.class);

	private static int LAZY_INT_ITERATOR_EMPTY_VALUE = LazyIntIterators.EMPTY_ITERATOR.nextInt();

	private final GraphStore graph;
	private final long graphVersion;
	private final CentralityConfig config;
	private final CheckpointManager checkpoints;
	private final List<RoundListener> listeners = new ArrayList<>();

	private volatile boolean stopRequested = false;
	private final CountDownLatch finished = new CountDownLatch(1);

	/**
	 * @param graph        the graph
	 * @param graphVersion version of the graph snapshot, stored in checkpoints to
	 *                     verify that a resumed computation runs on the same
	 *                     graph
	 * @param config       parameters of the computation
	 * @param checkpoints  checkpoint manager, or null to run without checkpoints
	 */
	public CentralityEngine(GraphStore graph, long graphVersion, CentralityConfig config,
			CheckpointManager checkpoints) {
		this.graph = graph;
		this.graphVersion = graphVersion;
		this.config = config;
		this.checkpoints = checkpoints;
	}

	public void addListener(RoundListener listener) {
		listeners.add(listener);
	}

	/**
	 * Ask the computation to stop after the current round has been committed.
	 * The result returned by {@link #run()} is then not terminal.
	 */
	public void requestStop() {
		stopRequested = true;
	}

	/**
	 * Wait until {@link #run()} has returned.
	 */
	public void awaitFinished() throws InterruptedException {
		finished.await();
	}

	/** Per-node state after a completed round. */
	private static class State {
		int round;
		SketchRegistry sketches;
		double[] accumulators;
		TerminationReason termination;

		State(int round, SketchRegistry sketches, double[] accumulators, TerminationReason termination) {
			this.round = round;
			this.sketches = sketches;
			this.accumulators = accumulators;
			this.termination = termination;
		}
	}

	private State initialState() throws IOException {
		if (checkpoints != null) {
			if (config.isResume()) {
				Optional<Checkpoint> checkpoint = checkpoints.resume();
				if (checkpoint.isPresent()) {
					return restore(checkpoint.get());
				}
			} else {
				LOG.warn("Starting from scratch, removing existing checkpoints");
				checkpoints.clear();
			}
		}
		LOG.info("Cold start: seeding counters of {} nodes", graph.numNodes());
		SketchRegistry sketches = new SketchRegistry(graph.numNodes(), config.getLog2m(), config.getSeed());
		sketches.seedAll();
		return new State(0, sketches, new double[graph.numNodes()], null);
	}

	private State restore(Checkpoint checkpoint) {
		SketchRegistry sketches = checkpoint.getSketches();
		if (checkpoint.numNodes() != graph.numNodes() || checkpoint.getGraphVersion() != graphVersion) {
			throw new IllegalStateException("Checkpoint does not match graph: " + checkpoint.numNodes()
					+ " nodes of graph version " + checkpoint.getGraphVersion() + ", expected " + graph.numNodes()
					+ " nodes of version " + graphVersion);
		}
		if (sketches.log2m() != config.getLog2m() || sketches.seed() != config.getSeed()
				|| !config.getDirection().name().equals(checkpoint.getDirection())) {
			throw new IllegalStateException("Checkpoint parameters (log2m = " + sketches.log2m() + ", seed = "
					+ sketches.seed() + ", direction = " + checkpoint.getDirection()
					+ ") differ from the configured ones");
		}
		TerminationReason termination = null;
		if (checkpoint.isTerminal()) {
			try {
				termination = TerminationReason.valueOf(checkpoint.getTermination());
			} catch (IllegalArgumentException e) {
				throw new IllegalStateException("Unknown termination reason in checkpoint: "
						+ checkpoint.getTermination(), e);
			}
		}
		LOG.info("Resuming after round {}", checkpoint.getRound());
		return new State(checkpoint.getRound(), sketches, checkpoint.getAccumulators(), termination);
	}

	/**
	 * Run (or resume) the computation until it terminates, or until a stop is
	 * requested.
	 * 
	 * @return the accumulated scores, terminal unless the computation was
	 *         stopped
	 * @throws IOException if a checkpoint cannot be read or written
	 */
	public CentralityResult run() throws IOException {
		ExecutorService executor = null;
		try {
			State state = initialState();
			if (state.termination != null) {
				LOG.info("Computation already terminated after round {} ({})", state.round, state.termination);
				return new CentralityResult(state.round, state.accumulators, state.termination);
			}
			executor = Executors.newFixedThreadPool(config.getThreads(), new WorkerThreadFactory());
			while (true) {
				if (stopRequested) {
					LOG.info("Stop requested, last completed round: {}", state.round);
					return new CentralityResult(state.round, state.accumulators, null);
				}
				state = iterate(executor, state);
				if (state.termination != null) {
					LOG.info("Computation terminated after round {} ({})", state.round, state.termination);
					return new CentralityResult(state.round, state.accumulators, state.termination);
				}
			}
		} finally {
			if (executor != null) {
				executor.shutdownNow();
			}
			finished.countDown();
		}
	}

	private State iterate(ExecutorService executor, State previous) throws IOException {
		final int round = previous.round + 1;
		final long start = System.currentTimeMillis();
		final int numNodes = graph.numNodes();
		// counters of different chunks must not share longwords
		final int granularity = (int) Math.min(Integer.MAX_VALUE,
				((config.getGranularity() + (long) SketchRegistry.ALIGNED_BLOCK - 1) / SketchRegistry.ALIGNED_BLOCK)
						* SketchRegistry.ALIGNED_BLOCK);
		final int numChunks = (int) ((numNodes + (long) granularity - 1) / granularity);
		final SketchRegistry current = previous.sketches;
		final SketchRegistry next = current.newGeneration();
		final double[] accumulators = previous.accumulators;
		final double[] nextAccumulators = new double[numNodes];
		final double[] chunkNewReachable = new double[numChunks];
		final AtomicInteger nextChunk = new AtomicInteger();
		final boolean inbound = config.getDirection() == Direction.INBOUND;
		final double weight = 1.0 / round;

		LOG.info("Starting round {}", round);
		List<Callable<Long>> tasks = new ArrayList<>();
		for (int i = 0; i < config.getThreads(); i++) {
			tasks.add(() -> {
				long modified = 0;
				final long[] counter = current.newCounter();
				final long[] neighbor = current.newCounter();
				int chunk;
				while ((chunk = nextChunk.getAndIncrement()) < numChunks) {
					final int from = chunk * granularity;
					final int to = (int) Math.min(numNodes, (long) from + granularity);
					double newReachable = 0;
					for (int x = from; x < to; x++) {
						current.readCounter(x, counter);
						final double before = current.estimate(counter);
						LazyIntIterator neighbors = inbound ? graph.inNeighborIterator(x)
								: graph.outNeighborIterator(x);
						boolean changed = false;
						int y;
						while ((y = neighbors.nextInt()) != LAZY_INT_ITERATOR_EMPTY_VALUE) {
							if (y != x) {
								current.readCounter(y, neighbor);
								if (current.mergeCounters(counter, neighbor)) {
									changed = true;
								}
							}
						}
						next.writeCounter(counter, x);
						double delta = 0;
						if (changed) {
							modified++;
							delta = Math.max(0.0, current.estimate(counter) - before);
						}
						nextAccumulators[x] = accumulators[x] + delta * weight;
						newReachable += delta;
					}
					chunkNewReachable[chunk] = newReachable;
				}
				return modified;
			});
		}

		long modified = 0;
		try {
			for (Future<Long> result : executor.invokeAll(tasks)) {
				modified += result.get();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted in round " + round, e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new IllegalStateException("Failed to compute round " + round, cause);
		}
		// summed in chunk order, independent of the scheduling
		double newReachable = 0;
		for (double d : chunkNewReachable) {
			newReachable += d;
		}

		TerminationReason termination = null;
		if (modified == 0) {
			termination = TerminationReason.STABLE;
		} else if (newReachable < config.getConvergenceThreshold() * numNodes) {
			termination = TerminationReason.CONVERGED;
		} else if (round >= config.getMaxRounds()) {
			termination = TerminationReason.ROUND_LIMIT;
		}
		RoundStatistics stats = new RoundStatistics(round, modified, newReachable,
				System.currentTimeMillis() - start);
		LOG.info("Finished {}", stats);

		if (checkpoints != null) {
			checkpoints.commit(new Checkpoint(round, next, nextAccumulators,
					(termination == null ? null : termination.name()), graphVersion, config.getDirection().name(),
					modified, newReachable));
		}
		for (RoundListener listener : listeners) {
			listener.roundCompleted(stats, termination);
		}
		return new State(round, next, nextAccumulators, termination);
	}

	private static class WorkerThreadFactory implements ThreadFactory {
		private final AtomicInteger count = new AtomicInteger();

		@Override
		public Thread newThread(Runnable r) {
			Thread t = new Thread(r, "centrality-worker-" + count.incrementAndGet());
			t.setDaemon(true);
			return t;
		}
	}
}
