/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;

import org.commoncrawl.centrality.sketch.HyperLogLogSketch;
import org.junit.jupiter.api.Test;

public class TestCentralityConfig {

	@Test
	void testDefaults() {
		CentralityConfig config = new CentralityConfig();
		assertEquals(CentralityConfig.DEFAULT_LOG2M, config.getLog2m());
		assertEquals(CentralityConfig.DEFAULT_MAX_ROUNDS, config.getMaxRounds());
		assertEquals(0.0, config.getConvergenceThreshold());
		assertEquals(Direction.INBOUND, config.getDirection());
		assertTrue(config.getThreads() >= 1);
		assertEquals(1, config.getKeepCheckpoints());
		assertTrue(config.isResume());
	}

	@Test
	void testLoadProperties() {
		Properties props = new Properties();
		props.setProperty("log2m", "12");
		props.setProperty("maxRounds", " 10 ");
		props.setProperty("convergenceThreshold", "0.001");
		props.setProperty("direction", "outbound");
		props.setProperty("threads", "3");
		props.setProperty("granularity", "64");
		props.setProperty("seed", "0xCAFE");
		props.setProperty("keepCheckpoints", "2");
		props.setProperty("resume", "false");
		CentralityConfig config = new CentralityConfig();
		config.load(props);
		assertEquals(12, config.getLog2m());
		assertEquals(10, config.getMaxRounds());
		assertEquals(0.001, config.getConvergenceThreshold());
		assertEquals(Direction.OUTBOUND, config.getDirection());
		assertEquals(3, config.getThreads());
		assertEquals(64, config.getGranularity());
		assertEquals(0xCAFEL, config.getSeed());
		assertEquals(2, config.getKeepCheckpoints());
		assertFalse(config.isResume());
	}

	@Test
	void testRsd() {
		CentralityConfig config = new CentralityConfig();
		config.setRsd(0.02);
		assertTrue(HyperLogLogSketch.relativeStandardDeviation(config.getLog2m()) <= 0.02);
		assertThrows(IllegalArgumentException.class, () -> config.setRsd(0.0));
	}

	@Test
	void testInvalidValues() {
		CentralityConfig config = new CentralityConfig();
		assertThrows(IllegalArgumentException.class, () -> config.setLog2m(20));
		assertThrows(IllegalArgumentException.class, () -> config.setMaxRounds(0));
		assertThrows(IllegalArgumentException.class, () -> config.setConvergenceThreshold(-0.1));
		assertThrows(IllegalArgumentException.class, () -> config.setThreads(0));
		assertThrows(IllegalArgumentException.class, () -> config.setGranularity(0));
		assertThrows(IllegalArgumentException.class, () -> config.setKeepCheckpoints(0));
		Properties props = new Properties();
		props.setProperty("direction", "sideways");
		assertThrows(IllegalArgumentException.class, () -> config.load(props));
	}
}
