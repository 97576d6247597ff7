/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.OptionalLong;
import java.util.Properties;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File system operations used to publish immutable, versioned directories
 * (graph snapshots, checkpoints): a version is written into a temporary
 * directory, synced and renamed atomically, then a pointer file naming the
 * latest complete version is replaced atomically. Readers only follow the
 * pointer, so they never see a partially written version.
 */
public class AtomicFiles {

	protected static Logger LOG = LoggerFactory.getLogger(AtomicFiles.class);

	private AtomicFiles() {
	}

	/**
	 * Force file content (or directory entries) to disk.
	 */
	public static void sync(Path path) throws IOException {
		if (Files.isDirectory(path)) {
			try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
				channel.force(true);
			} catch (IOException e) {
				// not all platforms allow to open directories
				LOG.debug("Cannot sync directory {}: {}", path, e.getMessage());
			}
			return;
		}
		try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
			channel.force(true);
		}
	}

	/**
	 * Sync all files in a directory and the directory itself.
	 */
	public static void syncTree(Path dir) throws IOException {
		try (Stream<Path> files = Files.list(dir)) {
			for (Path file : (Iterable<Path>) files::iterator) {
				if (Files.isRegularFile(file)) {
					sync(file);
				}
			}
		}
		sync(dir);
	}

	/**
	 * Rename a completely written temporary directory to its final name.
	 */
	public static void publish(Path tempDir, Path target) throws IOException {
		syncTree(tempDir);
		Files.move(tempDir, target, StandardCopyOption.ATOMIC_MOVE);
		sync(target.getParent());
	}

	/**
	 * Atomically replace the content of a pointer file.
	 */
	public static void writePointer(Path pointer, long version) throws IOException {
		Path temp = pointer.resolveSibling(pointer.getFileName() + ".tmp");
		try (OutputStream out = Files.newOutputStream(temp)) {
			out.write((Long.toString(version) + "\n").getBytes(StandardCharsets.UTF_8));
		}
		sync(temp);
		Files.move(temp, pointer, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		sync(pointer.getParent());
	}

	/**
	 * @return the version stored in a pointer file or empty if the file does not
	 *         exist
	 * @throws IOException if the pointer file cannot be read or parsed
	 */
	public static OptionalLong readPointer(Path pointer) throws IOException {
		if (!Files.exists(pointer)) {
			return OptionalLong.empty();
		}
		String content = new String(Files.readAllBytes(pointer), StandardCharsets.UTF_8).trim();
		try {
			return OptionalLong.of(Long.parseLong(content));
		} catch (NumberFormatException e) {
			throw new IOException("Invalid pointer file " + pointer + ": <" + content + ">", e);
		}
	}

	public static void deleteRecursively(Path path) throws IOException {
		if (!Files.exists(path)) {
			return;
		}
		try (Stream<Path> walk = Files.walk(path)) {
			for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
				Files.delete(p);
			}
		}
	}

	public static Properties loadProperties(Path file) throws IOException {
		Properties props = new Properties();
		try (InputStream in = Files.newInputStream(file)) {
			props.load(in);
		}
		return props;
	}

	public static void storeProperties(Properties props, Path file, String comment) throws IOException {
		try (OutputStream out = Files.newOutputStream(file)) {
			props.store(out, comment);
		}
	}
}
