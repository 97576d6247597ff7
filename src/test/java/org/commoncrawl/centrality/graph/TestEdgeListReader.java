/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;

import org.commoncrawl.centrality.graph.LabelNormalizer.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestEdgeListReader {

	@TempDir
	Path tempDir;

	@Test
	void testReadPageEdges() throws IOException {
		NodeIdentityTable table = new NodeIdentityTable();
		try (ArcSorter arcs = new ArcSorter(tempDir, 16)) {
			EdgeListReader reader = new EdgeListReader(table, new LabelNormalizer(Level.PAGE), arcs);
			reader.read(Stream.of( //
					"# comment", //
					"", //
					"https://a.example/\thttps://b.example/", //
					"https://b.example/\thttps://c.example/\textra column", //
					"https://a.example/\thttps://b.example/"));
			assertEquals(5, reader.getNumInputLines());
			assertEquals(3, reader.getNumEdges());
			assertEquals(0, reader.getNumSkipped());
			assertEquals(3, arcs.numArcsAdded());
		}
		assertEquals(Arrays.asList("https://a.example/", "https://b.example/", "https://c.example/"), table.labels());
	}

	@Test
	void testMalformedEdge() throws IOException {
		NodeIdentityTable table = new NodeIdentityTable();
		try (ArcSorter arcs = new ArcSorter(tempDir, 16)) {
			EdgeListReader reader = new EdgeListReader(table, new LabelNormalizer(Level.PAGE), arcs);
			reader.readEdge("a\tb");
			MalformedEdgeException e = assertThrows(MalformedEdgeException.class, () -> reader.readEdge("a b"));
			assertEquals("a b", e.getRecord());
			assertThrows(MalformedEdgeException.class, () -> reader.readEdge("a\t"));
			assertThrows(MalformedEdgeException.class, () -> reader.readEdge("\tb"));
			assertThrows(MalformedEdgeException.class, () -> reader.read(Stream.of("x\ty", "no separator")));
		}
	}

	@Test
	void testHostLevel() throws IOException {
		NodeIdentityTable table = new NodeIdentityTable();
		try (ArcSorter arcs = new ArcSorter(tempDir, 16)) {
			EdgeListReader reader = new EdgeListReader(table, new LabelNormalizer(Level.HOST, true), arcs);
			reader.read(Stream.of( //
					"https://www.example.com/a\thttps://www.example.org/", //
					"https://www.example.com/b\thttp://WWW.example.org:8080/x", //
					"file:///tmp/x\thttps://www.example.org/"));
			assertEquals(2, reader.getNumEdges());
			assertEquals(1, reader.getNumSkipped());
		}
		assertEquals(Arrays.asList("com.example.www", "org.example.www"), table.labels());
	}

	@Test
	void testReadGzipFile() throws IOException {
		Path file = tempDir.resolve("edges.txt.gz");
		try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file));
				Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
			writer.write("a\tb\nb\tc\nc\ta\n");
		}
		NodeIdentityTable table = new NodeIdentityTable();
		try (ArcSorter arcs = new ArcSorter(tempDir, 16)) {
			EdgeListReader reader = new EdgeListReader(table, new LabelNormalizer(Level.PAGE), arcs);
			reader.read(file);
			assertEquals(3, reader.getNumEdges());
		}
		assertEquals(3, table.size());
	}

	@Test
	void testReadInvalidGzipFile() throws IOException {
		Path file = tempDir.resolve("edges.gz");
		Files.write(file, "a\tb\n".getBytes(StandardCharsets.UTF_8));
		NodeIdentityTable table = new NodeIdentityTable();
		try (ArcSorter arcs = new ArcSorter(tempDir, 16)) {
			EdgeListReader reader = new EdgeListReader(table, new LabelNormalizer(Level.PAGE), arcs);
			assertThrows(IOException.class, () -> reader.read(file));
			assertEquals(0, reader.getNumEdges());
		}
		Files.delete(file);
	}
}
