/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

import org.commoncrawl.centrality.io.AtomicFiles;
import org.commoncrawl.centrality.sketch.HyperLogLogSketch;
import org.slf4j.Logger;

/**
 * Parameters of a harmonic centrality computation. The error budget
 * (<code>log2m</code>, number of registers per HyperLogLog counter) and the
 * hash seed must stay the same for all rounds of a run, including resumed
 * ones.
 * 
 * <p>
 * Parameters can be read from a properties file, the keys are the names of
 * the setters without the prefix <code>set</code>, e.g.
 * <code>maxRounds=32</code>. Instead of <code>log2m</code> the relative
 * standard deviation (<code>rsd</code>) may be given.
 * </p>
 */
public class CentralityConfig {

	public static final int DEFAULT_LOG2M = 8;
	public static final int DEFAULT_MAX_ROUNDS = 64;
	public static final int DEFAULT_GRANULARITY = 1024;
	public static final long DEFAULT_SEED = 0x2545F4914F6CDD1DL;

	private int log2m = DEFAULT_LOG2M;
	private int maxRounds = DEFAULT_MAX_ROUNDS;
	private double convergenceThreshold = 0.0;
	private Direction direction = Direction.INBOUND;
	private int threads = Runtime.getRuntime().availableProcessors();
	private int granularity = DEFAULT_GRANULARITY;
	private long seed = DEFAULT_SEED;
	private int keepCheckpoints = 1;
	private boolean resume = true;

	public int getLog2m() {
		return log2m;
	}

	/**
	 * @param log2m logarithm of the number of registers per counter
	 */
	public void setLog2m(int log2m) {
		HyperLogLogSketch.checkLog2m(log2m);
		this.log2m = log2m;
	}

	/**
	 * Choose the number of registers per counter to obtain the given relative
	 * standard deviation.
	 */
	public void setRsd(double rsd) {
		if (!(rsd > 0.0 && rsd < 1.0)) {
			throw new IllegalArgumentException("Relative standard deviation must be in (0, 1): " + rsd);
		}
		this.log2m = HyperLogLogSketch.log2NumberOfRegisters(rsd);
	}

	public int getMaxRounds() {
		return maxRounds;
	}

	public void setMaxRounds(int maxRounds) {
		if (maxRounds < 1) {
			throw new IllegalArgumentException("Max. rounds must be positive: " + maxRounds);
		}
		this.maxRounds = maxRounds;
	}

	public double getConvergenceThreshold() {
		return convergenceThreshold;
	}

	/**
	 * @param convergenceThreshold stop if the number of newly reached nodes in a
	 *                             round falls below this fraction of the number
	 *                             of nodes. With 0.0 the computation stops only
	 *                             if no sketch changes or the round limit is hit.
	 */
	public void setConvergenceThreshold(double convergenceThreshold) {
		if (convergenceThreshold < 0.0) {
			throw new IllegalArgumentException("Convergence threshold must not be negative");
		}
		this.convergenceThreshold = convergenceThreshold;
	}

	public Direction getDirection() {
		return direction;
	}

	public void setDirection(Direction direction) {
		this.direction = direction;
	}

	public int getThreads() {
		return threads;
	}

	public void setThreads(int threads) {
		if (threads < 1) {
			throw new IllegalArgumentException("Number of threads must be positive: " + threads);
		}
		this.threads = threads;
	}

	public int getGranularity() {
		return granularity;
	}

	/**
	 * @param granularity number of nodes processed by one task, rounded up to a
	 *                    multiple of 64 by the engine
	 */
	public void setGranularity(int granularity) {
		if (granularity < 1) {
			throw new IllegalArgumentException("Granularity must be positive: " + granularity);
		}
		this.granularity = granularity;
	}

	public long getSeed() {
		return seed;
	}

	public void setSeed(long seed) {
		this.seed = seed;
	}

	public int getKeepCheckpoints() {
		return keepCheckpoints;
	}

	public void setKeepCheckpoints(int keepCheckpoints) {
		if (keepCheckpoints < 1) {
			throw new IllegalArgumentException("At least one checkpoint must be kept");
		}
		this.keepCheckpoints = keepCheckpoints;
	}

	public boolean isResume() {
		return resume;
	}

	/**
	 * @param resume if true continue from the latest checkpoint, otherwise
	 *               remove existing checkpoints and start from scratch
	 */
	public void setResume(boolean resume) {
		this.resume = resume;
	}

	/**
	 * Override parameters by the values of properties.
	 */
	public void load(Properties props) {
		String value;
		if ((value = props.getProperty("rsd")) != null) {
			setRsd(Double.parseDouble(value.trim()));
		}
		if ((value = props.getProperty("log2m")) != null) {
			setLog2m(Integer.parseInt(value.trim()));
		}
		if ((value = props.getProperty("maxRounds")) != null) {
			setMaxRounds(Integer.parseInt(value.trim()));
		}
		if ((value = props.getProperty("convergenceThreshold")) != null) {
			setConvergenceThreshold(Double.parseDouble(value.trim()));
		}
		if ((value = props.getProperty("direction")) != null) {
			setDirection(Direction.valueOf(value.trim().toUpperCase(Locale.ROOT)));
		}
		if ((value = props.getProperty("threads")) != null) {
			setThreads(Integer.parseInt(value.trim()));
		}
		if ((value = props.getProperty("granularity")) != null) {
			setGranularity(Integer.parseInt(value.trim()));
		}
		if ((value = props.getProperty("seed")) != null) {
			setSeed(Long.decode(value.trim()));
		}
		if ((value = props.getProperty("keepCheckpoints")) != null) {
			setKeepCheckpoints(Integer.parseInt(value.trim()));
		}
		if ((value = props.getProperty("resume")) != null) {
			setResume(Boolean.parseBoolean(value.trim()));
		}
	}

	public void load(Path propertiesFile) throws IOException {
		load(AtomicFiles.loadProperties(propertiesFile));
	}

	public void report(Logger log) {
		log.info("Harmonic centrality with:");
		log.info(" - {} registers per HyperLogLog counter (relative standard deviation {})", (1 << log2m),
				String.format("%.4f", HyperLogLogSketch.relativeStandardDeviation(log2m)));
		log.info(" - max. {} rounds, convergence threshold {}", maxRounds, convergenceThreshold);
		log.info(" - {} expansion", direction);
		log.info(" - {} threads, {} nodes per task", threads, granularity);
		log.info(" - {}resume from checkpoint", (resume ? "" : "no "));
	}
}
