/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read raw edges, intern their endpoints into a {@link NodeIdentityTable} and
 * collect the resulting arcs in an {@link ArcSorter}. Input lines hold two
 * tab-separated columns &langle;source, target&rangle; (further columns are
 * ignored). Empty lines and lines starting with <code>#</code> are skipped.
 * Input files ending in <code>.gz</code> are decompressed.
 */
public class EdgeListReader {

	protected static Logger LOG = LoggerFactory.getLogger(EdgeListReader.class);

	private final NodeIdentityTable identityTable;
	private final LabelNormalizer normalizer;
	private final ArcSorter arcs;

	private long numInputLines = 0;
	private long numEdges = 0;
	private long numSkipped = 0;

	private final Consumer<? super String> reporter;

	public EdgeListReader(NodeIdentityTable identityTable, LabelNormalizer normalizer, ArcSorter arcs) {
		this.identityTable = identityTable;
		this.normalizer = normalizer;
		this.arcs = arcs;
		reporter = (String line) -> {
			if ((numInputLines % 5000000) != 0 || numInputLines == 0) {
				return;
			}
			LOG.info("Processed {} edge input lines, {} nodes", numInputLines, identityTable.size());
		};
	}

	/**
	 * Parse one input line and add the edge.
	 * 
	 * @throws MalformedEdgeException if the line does not contain two columns
	 */
	public void readEdge(String line) throws IOException {
		numInputLines++;
		if (line.isEmpty() || line.charAt(0) == '#') {
			return;
		}
		int sep = line.indexOf('\t');
		if (sep == -1) {
			throw new MalformedEdgeException("Invalid edge in input line " + numInputLines, line);
		}
		int end = line.indexOf('\t', sep + 1);
		if (end == -1) {
			end = line.length();
		}
		String source = line.substring(0, sep);
		String target = line.substring(sep + 1, end);
		if (source.isEmpty() || target.isEmpty()) {
			throw new MalformedEdgeException("Empty edge endpoint in input line " + numInputLines, line);
		}
		String sourceLabel = normalizer.normalize(source);
		String targetLabel = normalizer.normalize(target);
		if (sourceLabel == null || targetLabel == null) {
			LOG.warn("Skipping edge, no {} label for endpoint: <{}>", normalizer.getLevel(), line);
			numSkipped++;
			return;
		}
		arcs.add(identityTable.intern(sourceLabel), identityTable.intern(targetLabel));
		numEdges++;
	}

	public void read(Stream<String> lines) {
		lines.peek(reporter).forEach(line -> {
			try {
				readEdge(line);
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
		});
	}

	public void read(Path file) throws IOException {
		LOG.info("Reading edges from {}", file);
		boolean gzipped = file.getFileName().toString().endsWith(".gz");
		try (InputStream raw = Files.newInputStream(file);
				InputStream in = gzipped ? new GZIPInputStream(raw) : raw;
				BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
			read(reader.lines());
		} catch (UncheckedIOException e) {
			throw e.getCause();
		}
	}

	public long getNumInputLines() {
		return numInputLines;
	}

	public long getNumEdges() {
		return numEdges;
	}

	public long getNumSkipped() {
		return numSkipped;
	}

	public void logStatistics() {
		LOG.info("Number of input lines: {}", numInputLines);
		LOG.info("Number of edges: {}", numEdges);
		LOG.info("Number of edges skipped: {}", numSkipped);
		LOG.info("Number of nodes: {}", identityTable.size());
	}
}
