/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

import java.io.Closeable;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.io.FastBufferedInputStream;
import it.unimi.dsi.fastutil.io.FastBufferedOutputStream;
import it.unimi.dsi.fastutil.longs.LongArrays;
import it.unimi.dsi.fastutil.longs.LongIterator;

/**
 * Collects arcs <code>(source, target)</code> of a graph, sorts and
 * deduplicates them with bounded memory. Arcs are packed into longs (source in
 * the upper, target in the lower 32 bits) and buffered in a batch. A full batch
 * is sorted, deduplicated and written to a temporary run file, once in
 * forward order and once transposed (arcs reversed). Finally, all runs are
 * merged into one sorted, duplicate-free arc file per direction.
 */
public class ArcSorter implements Closeable {

	protected static Logger LOG = LoggerFactory.getLogger(ArcSorter.class);

	public static final int DEFAULT_BATCH_SIZE = 1 << 24;

	private final Path tempDir;
	private final long[] batch;
	private int batchLength = 0;
	private long numArcsAdded = 0;
	private final List<Path> forwardRuns = new ArrayList<>();
	private final List<Path> transposedRuns = new ArrayList<>();

	/**
	 * @param tempDir   directory to hold temporary files
	 * @param batchSize number of arcs sorted in memory
	 */
	public ArcSorter(Path tempDir, int batchSize) {
		if (batchSize < 1) {
			throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
		}
		this.tempDir = tempDir;
		batch = new long[batchSize];
	}

	public ArcSorter(Path tempDir) {
		this(tempDir, DEFAULT_BATCH_SIZE);
	}

	public static long arc(int source, int target) {
		return ((long) source << 32) | (target & 0xFFFFFFFFL);
	}

	public static int source(long arc) {
		return (int) (arc >>> 32);
	}

	public static int target(long arc) {
		return (int) arc;
	}

	public static long transpose(long arc) {
		return arc(target(arc), source(arc));
	}

	/**
	 * Add an arc.
	 * 
	 * @throws MalformedEdgeException if one of the node IDs is negative
	 */
	public void add(int source, int target) throws IOException {
		if (source < 0 || target < 0) {
			throw new MalformedEdgeException("Negative node ID", source + "\t" + target);
		}
		if (batchLength == batch.length) {
			spill();
		}
		batch[batchLength++] = arc(source, target);
		numArcsAdded++;
	}

	/**
	 * @return number of arcs added, including duplicates
	 */
	public long numArcsAdded() {
		return numArcsAdded;
	}

	private static int unique(long[] a, int length) {
		if (length == 0) {
			return 0;
		}
		int j = 0;
		for (int i = 1; i < length; i++) {
			if (a[i] != a[j]) {
				a[++j] = a[i];
			}
		}
		return j + 1;
	}

	private void spill() throws IOException {
		if (batchLength == 0) {
			return;
		}
		LongArrays.parallelQuickSort(batch, 0, batchLength);
		int length = unique(batch, batchLength);
		forwardRuns.add(writeRun(batch, length, "arcs-"));
		for (int i = 0; i < length; i++) {
			batch[i] = transpose(batch[i]);
		}
		LongArrays.parallelQuickSort(batch, 0, length);
		transposedRuns.add(writeRun(batch, length, "arcs-t-"));
		LOG.info("Wrote sorted run of {} arcs ({} before deduplication), {} runs written", length, batchLength,
				forwardRuns.size());
		batchLength = 0;
	}

	private Path writeRun(long[] arcs, int length, String prefix) throws IOException {
		Path run = Files.createTempFile(tempDir, prefix, ".run");
		writeArcs(run, arcs, length);
		return run;
	}

	private static void writeArcs(Path file, long[] arcs, int length) throws IOException {
		try (DataOutputStream out = new DataOutputStream(new FastBufferedOutputStream(Files.newOutputStream(file)))) {
			for (int i = 0; i < length; i++) {
				out.writeLong(arcs[i]);
			}
		}
	}

	/**
	 * Sequential reader of a file of packed arcs.
	 */
	public static class ArcFileIterator implements LongIterator, Closeable {
		private final DataInputStream in;
		private long next;
		private boolean hasNext;

		public ArcFileIterator(Path file) throws IOException {
			in = new DataInputStream(new FastBufferedInputStream(Files.newInputStream(file)));
			advance();
		}

		private void advance() {
			try {
				next = in.readLong();
				hasNext = true;
			} catch (EOFException e) {
				hasNext = false;
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		}

		@Override
		public boolean hasNext() {
			return hasNext;
		}

		@Override
		public long nextLong() {
			if (!hasNext) {
				throw new NoSuchElementException();
			}
			long res = next;
			advance();
			return res;
		}

		@Override
		public void close() throws IOException {
			in.close();
		}
	}

	/**
	 * Merge all runs of one direction into a single sorted file of unique arcs,
	 * verifying that all node IDs are lower than <code>numNodes</code>.
	 * 
	 * @return number of unique arcs
	 * @throws MalformedEdgeException if an arc points to or from a node ID not in
	 *                                <code>[0, numNodes)</code>
	 */
	private long merge(List<Path> runs, Path output, int numNodes) throws IOException {
		List<ArcFileIterator> iters = new ArrayList<>();
		long numArcs = 0;
		long duplicates = 0;
		try (DataOutputStream out = new DataOutputStream(
				new FastBufferedOutputStream(Files.newOutputStream(output)))) {
			for (Path run : runs) {
				iters.add(new ArcFileIterator(run));
			}
			CountingMergedLongIterator merged = new CountingMergedLongIterator(
					iters.toArray(new LongIterator[iters.size()]));
			while (merged.hasNext()) {
				long arc = merged.nextLong();
				int source = source(arc);
				int target = target(arc);
				if (source >= numNodes || target >= numNodes) {
					throw new MalformedEdgeException(source, target, numNodes);
				}
				duplicates += merged.getCount() - 1;
				out.writeLong(arc);
				numArcs++;
			}
		} finally {
			for (ArcFileIterator iter : iters) {
				iter.close();
			}
		}
		LOG.info("Merged {} runs into {}: {} unique arcs, {} duplicates across runs", runs.size(), output, numArcs,
				duplicates);
		return numArcs;
	}

	/**
	 * Sort and deduplicate all arcs added so far.
	 * 
	 * @param forward    output file, arcs sorted by source and target
	 * @param transposed output file, transposed arcs sorted by target and source
	 * @param numNodes   number of nodes
	 * @return number of unique arcs
	 * @throws MalformedEdgeException if any node ID is not lower than
	 *                                <code>numNodes</code>
	 */
	public long finish(Path forward, Path transposed, int numNodes) throws IOException {
		spill();
		long numArcs = merge(forwardRuns, forward, numNodes);
		long numArcsT = merge(transposedRuns, transposed, numNodes);
		if (numArcs != numArcsT) {
			throw new IllegalStateException(
					"Number of arcs differs between graph and transpose: " + numArcs + " <> " + numArcsT);
		}
		return numArcs;
	}

	/**
	 * Delete all temporary run files.
	 */
	@Override
	public void close() throws IOException {
		for (Path run : forwardRuns) {
			Files.deleteIfExists(run);
		}
		for (Path run : transposedRuns) {
			Files.deleteIfExists(run);
		}
		forwardRuns.clear();
		transposedRuns.clear();
	}
}
