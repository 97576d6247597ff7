/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.output;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.function.Consumer;

import org.commoncrawl.centrality.engine.CentralityResult;
import org.commoncrawl.centrality.engine.TerminationReason;
import org.commoncrawl.centrality.graph.NodeIdentityTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import it.unimi.dsi.fastutil.io.BinIO;
import it.unimi.dsi.fastutil.objects.Object2DoubleMap;

public class TestScoreWriter {

	@TempDir
	Path tempDir;

	private NodeIdentityTable table;
	private ScoreWriter writer;
	private CentralityResult result;

	@BeforeEach
	void setUp() {
		table = new NodeIdentityTable();
		for (String label : new String[] { "p1", "p2", "p3", "p4" }) {
			table.intern(label);
		}
		writer = new ScoreWriter(table);
		result = new CentralityResult(4, new double[] { 2.5, 2.0, 2.5, 0.0 }, TerminationReason.STABLE);
	}

	private static String print(Consumer<PrintStream> emitter) {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, false, StandardCharsets.UTF_8);
		emitter.accept(out);
		return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	void testIncompleteRun() {
		CentralityResult stopped = new CentralityResult(2, new double[] { 2.0, 1.5, 1.5, 0.0 }, null);
		IncompleteRunException e = assertThrows(IncompleteRunException.class,
				() -> writer.emit(stopped, new PrintStream(new ByteArrayOutputStream())));
		assertEquals(2, e.getRound());
		assertThrows(IncompleteRunException.class, () -> writer.toMap(stopped));
		assertThrows(IncompleteRunException.class, () -> writer.rankOrder(stopped));
		assertThrows(IncompleteRunException.class, () -> writer.storeBinary(stopped, tempDir.resolve("s.bin")));
	}

	@Test
	void testSizeMismatch() {
		CentralityResult other = new CentralityResult(1, new double[] { 1.0 }, TerminationReason.ROUND_LIMIT);
		assertThrows(IllegalStateException.class, () -> writer.toMap(other));
	}

	@Test
	void testEmit() {
		String output = print(out -> writer.emit(result, out));
		assertEquals("p1\t2.5\np2\t2.0\np3\t2.5\np4\t0.0\n", output);
	}

	@Test
	void testToMap() {
		Object2DoubleMap<String> scores = writer.toMap(result);
		assertEquals(4, scores.size());
		assertEquals(2.5, scores.getDouble("p1"));
		assertEquals(0.0, scores.getDouble("p4"));
		assertEquals(table.labels(), new ArrayList<>(scores.keySet()));
	}

	@Test
	void testRanked() {
		// ties are ordered by node ID
		assertArrayEquals(new int[] { 0, 2, 1, 3 }, writer.rankOrder(result));
		String output = print(out -> writer.emitRanked(result, out));
		assertEquals("1\t2.5\tp1\n2\t2.5\tp3\n3\t2.0\tp2\n4\t0.0\tp4\n", output);
	}

	@Test
	void testStoreBinary() throws IOException {
		Path file = tempDir.resolve("scores.bin");
		writer.storeBinary(result, file);
		assertArrayEquals(new float[] { 2.5f, 2.0f, 2.5f, 0.0f }, BinIO.loadFloats(file.toString()));
	}
}
