/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.commoncrawl.centrality.graph.LabelNormalizer.Level;
import org.junit.jupiter.api.Test;

public class TestLabelNormalizer {

	@Test
	void testGetHost() {
		assertEquals("www.example.com", LabelNormalizer.getHost("https://www.example.com/path?q=1"));
		assertEquals("www.example.com", LabelNormalizer.getHost("https://user:pw@WWW.Example.com:8443/"));
		assertEquals("www.example.com", LabelNormalizer.getHost("http://www.example.com."));
		assertEquals("www.example.com", LabelNormalizer.getHost("http://www.example.com#frag"));
		assertEquals("example.org", LabelNormalizer.getHost("example.org"));
		assertEquals("[::1]", LabelNormalizer.getHost("http://[::1]:8080/index.html"));
		assertNull(LabelNormalizer.getHost("file:///etc/hosts"));
	}

	@Test
	void testReverseHost() {
		assertEquals("com.example.www", LabelNormalizer.reverseHost("www.example.com"));
		assertEquals("www.example.com", LabelNormalizer.reverseHost("com.example.www"));
		assertEquals("localhost", LabelNormalizer.reverseHost("localhost"));
	}

	@Test
	void testNormalize() {
		String url = "https://www.bbc.co.uk/news";
		assertEquals(url, new LabelNormalizer(Level.PAGE).normalize(url));
		assertEquals("www.bbc.co.uk", new LabelNormalizer(Level.HOST).normalize(url));
		assertEquals("uk.co.bbc.www", new LabelNormalizer(Level.HOST, true).normalize(url));
		assertEquals("bbc.co.uk", new LabelNormalizer(Level.DOMAIN).normalize(url));
		assertEquals("uk.co.bbc", new LabelNormalizer(Level.DOMAIN, true).normalize(url));
		// public suffix only, no registered domain
		assertNull(new LabelNormalizer(Level.DOMAIN).normalize("https://co.uk/"));
	}
}
