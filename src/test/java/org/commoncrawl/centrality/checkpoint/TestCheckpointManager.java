/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.checkpoint;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Optional;
import java.util.Properties;

import org.commoncrawl.centrality.io.AtomicFiles;
import org.commoncrawl.centrality.sketch.SketchRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TestCheckpointManager {

	protected static Logger LOG = LoggerFactory.getLogger(TestCheckpointManager.class);

	@TempDir
	Path tempDir;

	private static Checkpoint checkpoint(int round, String termination) {
		SketchRegistry sketches = new SketchRegistry(3, 6, 7L);
		sketches.seedAll();
		for (int r = 1; r < round; r++) {
			sketches.mergeInto(0, sketches, r % 3);
		}
		double[] accumulators = { round, 0.5 * round, 0.0 };
		return new Checkpoint(round, sketches, accumulators, termination, 1L, "INBOUND", 2L, 1.5);
	}

	@Test
	void testNoCheckpoint() throws IOException {
		CheckpointManager manager = new CheckpointManager(tempDir.resolve("checkpoints"));
		assertFalse(manager.resume().isPresent());
		assertFalse(manager.latestRound().isPresent());
		assertTrue(manager.listRounds().isEmpty());
	}

	@Test
	void testCommitResume() throws IOException {
		CheckpointManager manager = new CheckpointManager(tempDir);
		Checkpoint written = checkpoint(3, null);
		manager.commit(written);
		assertEquals(3, manager.latestRound().getAsLong());

		Optional<Checkpoint> resumed = new CheckpointManager(tempDir).resume();
		assertTrue(resumed.isPresent());
		Checkpoint read = resumed.get();
		assertEquals(3, read.getRound());
		assertFalse(read.isTerminal());
		assertNull(read.getTermination());
		assertEquals(1L, read.getGraphVersion());
		assertEquals("INBOUND", read.getDirection());
		assertEquals(2L, read.getModifiedNodes());
		assertEquals(1.5, read.getNewReachable());
		assertEquals(3, read.numNodes());
		assertArrayEquals(written.getAccumulators(), read.getAccumulators());
		SketchRegistry sketches = read.getSketches();
		assertEquals(6, sketches.log2m());
		assertEquals(7L, sketches.seed());
		for (int x = 0; x < 3; x++) {
			assertArrayEquals(written.getSketches().get(x).registers(), sketches.get(x).registers());
		}
	}

	@Test
	void testTerminalCheckpoint() throws IOException {
		CheckpointManager manager = new CheckpointManager(tempDir);
		manager.commit(checkpoint(1, null));
		manager.commit(checkpoint(2, "STABLE"));
		Checkpoint read = manager.resume().get();
		assertTrue(read.isTerminal());
		assertEquals("STABLE", read.getTermination());
	}

	@Test
	void testRoundMustIncrease() throws IOException {
		CheckpointManager manager = new CheckpointManager(tempDir);
		manager.commit(checkpoint(2, null));
		assertThrows(IllegalStateException.class, () -> manager.commit(checkpoint(2, null)));
		assertThrows(IllegalStateException.class, () -> manager.commit(checkpoint(1, null)));
		assertEquals(2, manager.latestRound().getAsLong());
	}

	@Test
	void testPruning() throws IOException {
		CheckpointManager manager = new CheckpointManager(tempDir, 2);
		for (int round = 1; round <= 4; round++) {
			manager.commit(checkpoint(round, null));
		}
		assertEquals(Arrays.asList(3, 4), manager.listRounds());

		CheckpointManager keepOne = new CheckpointManager(tempDir);
		keepOne.commit(checkpoint(5, null));
		assertEquals(Arrays.asList(5), keepOne.listRounds());
		assertEquals(5, keepOne.resume().get().getRound());

		assertThrows(IllegalArgumentException.class, () -> new CheckpointManager(tempDir, 0));
	}

	@Test
	void testInterruptedCommit() throws IOException {
		CheckpointManager manager = new CheckpointManager(tempDir);
		manager.commit(checkpoint(1, null));

		// a crash while writing round 2 leaves a temporary directory and a
		// renamed but not yet referenced one
		Path temp = tempDir.resolve("round-000002.tmp");
		Files.createDirectories(temp);
		Files.write(temp.resolve(CheckpointManager.REGISTERS_FILE), new byte[] { 1, 2, 3 });
		Path unreferenced = manager.roundDirectory(3);
		Files.createDirectories(unreferenced);

		Checkpoint read = manager.resume().get();
		assertEquals(1, read.getRound());

		manager.commit(checkpoint(2, null));
		assertEquals(2, manager.resume().get().getRound());
		assertFalse(Files.exists(temp));
		assertFalse(Files.exists(unreferenced));
		assertEquals(Arrays.asList(2), manager.listRounds());
	}

	@Test
	void testIncompleteCheckpoint() throws IOException {
		CheckpointManager manager = new CheckpointManager(tempDir);
		manager.commit(checkpoint(1, null));
		Path registers = manager.roundDirectory(1).resolve(CheckpointManager.REGISTERS_FILE);
		try (FileChannel channel = FileChannel.open(registers, StandardOpenOption.WRITE)) {
			channel.truncate(10);
		}
		assertThrows(IOException.class, () -> manager.resume());
	}

	@Test
	void testInvalidProperties() throws IOException {
		String[][] edits = { { "nodes", "three" }, { "seed", null }, { "log2m", "40" }, { "round", "" },
				{ "registerSize", "4" } };
		for (String[] edit : edits) {
			CheckpointManager manager = new CheckpointManager(tempDir.resolve(edit[0]));
			manager.commit(checkpoint(1, null));
			Path file = manager.roundDirectory(1).resolve(CheckpointManager.PROPERTIES_FILE);
			Properties props = AtomicFiles.loadProperties(file);
			if (edit[1] == null) {
				props.remove(edit[0]);
			} else {
				props.setProperty(edit[0], edit[1]);
			}
			AtomicFiles.storeProperties(props, file, "edited");
			IOException e = assertThrows(IOException.class, () -> manager.resume(), "property " + edit[0]);
			LOG.debug("Expected failure: {}", e.getMessage());
		}
	}

	@Test
	void testClear() throws IOException {
		CheckpointManager manager = new CheckpointManager(tempDir, 3);
		manager.commit(checkpoint(1, null));
		manager.commit(checkpoint(2, null));
		manager.clear();
		assertFalse(manager.resume().isPresent());
		assertTrue(manager.listRounds().isEmpty());
		manager.commit(checkpoint(1, null));
		assertEquals(1, manager.latestRound().getAsLong());
	}
}
