/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Bidirectional mapping between external node labels (URLs, host or domain
 * names) and dense node IDs <code>0, 1, ..., n-1</code>. IDs are assigned in
 * the order labels are seen first and are never reassigned or recycled.
 * 
 * <p>
 * The table is stored as a text file with tab-separated columns
 * <code>&langle;id, label&rangle;</code>, one node per line in ascending order
 * of IDs. Loading an existing table before interning the labels of a new edge
 * list makes the ID assignment reproducible across rebuilds.
 * </p>
 */
public class NodeIdentityTable {

	protected static Logger LOG = LoggerFactory.getLogger(NodeIdentityTable.class);

	private final Object2IntOpenHashMap<String> ids = new Object2IntOpenHashMap<>();
	private final ObjectArrayList<String> labels = new ObjectArrayList<>();

	public NodeIdentityTable() {
		ids.defaultReturnValue(-1);
	}

	/**
	 * Get the ID of a label, assigning the next free ID if the label is seen for
	 * the first time.
	 * 
	 * @param label external identifier, must not contain tabs or line breaks
	 * @return node ID
	 */
	public int intern(String label) {
		int id = ids.getInt(label);
		if (id != -1) {
			return id;
		}
		if (label.indexOf('\t') != -1 || label.indexOf('\n') != -1 || label.indexOf('\r') != -1) {
			throw new IllegalArgumentException("Node label must not contain tabs or line breaks: <" + label + ">");
		}
		if (labels.size() == Integer.MAX_VALUE) {
			throw new IllegalStateException("Number of nodes exceeds " + Integer.MAX_VALUE);
		}
		id = labels.size();
		labels.add(label);
		ids.put(label, id);
		return id;
	}

	/**
	 * @param nodeId node ID
	 * @return the label of the node
	 * @throws UnknownNodeException if the ID has not been assigned
	 */
	public String resolve(long nodeId) {
		if (nodeId < 0 || nodeId >= labels.size()) {
			throw new UnknownNodeException(nodeId, labels.size());
		}
		return labels.get((int) nodeId);
	}

	/**
	 * @param label node label
	 * @return the ID of the label or -1 if the label is unknown
	 */
	public int lookup(String label) {
		return ids.getInt(label);
	}

	/**
	 * @param label node label
	 * @return the ID of the label
	 * @throws UnknownNodeException if the label is unknown
	 */
	public int getId(String label) {
		int id = ids.getInt(label);
		if (id == -1) {
			throw new UnknownNodeException(label);
		}
		return id;
	}

	public int size() {
		return labels.size();
	}

	/**
	 * @return read-only view on all labels, indexed by node ID
	 */
	public List<String> labels() {
		return Collections.unmodifiableList(labels);
	}

	public void store(Path file) throws IOException {
		try (PrintStream out = new PrintStream(Files.newOutputStream(file), false, StandardCharsets.UTF_8)) {
			for (int i = 0; i < labels.size(); i++) {
				out.print(i);
				out.print('\t');
				out.print(labels.get(i));
				out.print('\n');
			}
			out.flush();
			if (out.checkError()) {
				throw new IOException("Failed to write node identity table " + file);
			}
		}
		LOG.info("Stored {} node labels in {}", labels.size(), file);
	}

	/**
	 * Load a node identity table. The IDs in the file must be sequential
	 * (0,1,...,n-1).
	 * 
	 * @param file table written by {@link #store(Path)}
	 * @return node identity table
	 * @throws IOException if the file cannot be read or is not a valid table
	 */
	public static NodeIdentityTable load(Path file) throws IOException {
		NodeIdentityTable table = new NodeIdentityTable();
		long lineNumber = 0;
		try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			String line;
			while ((line = in.readLine()) != null) {
				lineNumber++;
				int sep = line.indexOf('\t');
				if (sep == -1) {
					throw new IOException("Invalid line " + lineNumber + " in " + file + ": <" + line + ">");
				}
				long id;
				try {
					id = Long.parseLong(line.substring(0, sep));
				} catch (NumberFormatException e) {
					throw new IOException("Invalid node ID in line " + lineNumber + " in " + file, e);
				}
				if (id != table.size()) {
					throw new IOException("Node IDs in " + file + " not sequential: expected " + table.size()
							+ ", got " + id);
				}
				String label = line.substring(sep + 1);
				if (table.intern(label) != id) {
					throw new IOException("Duplicate node label in " + file + ": " + label);
				}
			}
		}
		LOG.info("Loaded {} node labels from {}", table.size(), file);
		return table;
	}
}
