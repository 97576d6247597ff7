/*
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (C) 2024 Common Crawl and contributors
 */
package org.commoncrawl.centrality.graph;

import java.util.Locale;
import java.util.regex.Pattern;

import crawlercommons.domains.EffectiveTldFinder;

/**
 * Map external identifiers of link endpoints to node labels. Page-level links
 * can be folded into a host-level or domain-level graph by mapping each URL to
 * its host name or registered domain name. Optionally, host and domain names
 * are written in <a href=
 * "https://en.wikipedia.org/wiki/Reverse_domain_name_notation">reverse domain
 * name notation</a> (<code>www.example.com</code> becomes
 * <code>com.example.www</code>), as used by the Common Crawl host and domain
 * graphs.
 */
public class LabelNormalizer {

	public enum Level {
		/** use identifiers as they are */
		PAGE,
		/** map URLs to host names */
		HOST,
		/**
		 * map URLs to registered domain names, based on the ICANN section of the
		 * public suffix list
		 */
		DOMAIN
	}

	private static Pattern SPLIT_HOST_PATTERN = Pattern.compile("\\.");

	private final Level level;
	private final boolean reverseNames;

	public LabelNormalizer(Level level, boolean reverseNames) {
		this.level = level;
		this.reverseNames = reverseNames;
	}

	public LabelNormalizer(Level level) {
		this(level, false);
	}

	public Level getLevel() {
		return level;
	}

	/**
	 * @param identifier external identifier (URL or host name)
	 * @return normalized node label or null if no label can be derived (e.g., no
	 *         registered domain for a host name)
	 */
	public String normalize(String identifier) {
		switch (level) {
		case PAGE:
			return identifier;
		case HOST: {
			String host = getHost(identifier);
			if (host == null) {
				return null;
			}
			return reverseNames ? reverseHost(host) : host;
		}
		case DOMAIN: {
			String host = getHost(identifier);
			if (host == null) {
				return null;
			}
			String domain = EffectiveTldFinder.getAssignedDomain(host, true, true);
			if (domain == null) {
				return null;
			}
			return reverseNames ? reverseHost(domain) : domain;
		}
		}
		throw new IllegalStateException("Unsupported level " + level);
	}

	/**
	 * Extract the lower-cased host name from a URL. Identifiers without scheme are
	 * taken as host names.
	 * 
	 * @param url URL, e.g. <code>https://user@www.Example.com:8443/path</code>
	 * @return host name (<code>www.example.com</code>) or null if empty
	 */
	public static String getHost(String url) {
		int start = url.indexOf("://");
		start = (start == -1) ? 0 : start + 3;
		int end = url.length();
		for (int i = start; i < url.length(); i++) {
			char c = url.charAt(i);
			if (c == '/' || c == '?' || c == '#') {
				end = i;
				break;
			}
		}
		int at = url.lastIndexOf('@', end - 1);
		if (at >= start) {
			start = at + 1;
		}
		int port = url.lastIndexOf(':', end - 1);
		if (port >= start && url.indexOf(']', start) < port) {
			end = port;
		}
		String host = url.substring(start, end);
		if (host.endsWith(".")) {
			host = host.substring(0, host.length() - 1);
		}
		if (host.isEmpty()) {
			return null;
		}
		return host.toLowerCase(Locale.ROOT);
	}

	/**
	 * Reverse host name, eg. <code>www.example.com</code> is reversed to
	 * <code>com.example.www</code>. Can be also used to "unreverse" a reversed host
	 * name.
	 * 
	 * @param host name
	 * @return host in reverse domain name notation
	 */
	public static String reverseHost(String host) {
		String[] rev = SPLIT_HOST_PATTERN.split(host);
		for (int i = 0; i < (rev.length / 2); i++) {
			String temp = rev[i];
			rev[i] = rev[rev.length - i - 1];
			rev[rev.length - i - 1] = temp;
		}
		return String.join(".", rev);
	}
}
