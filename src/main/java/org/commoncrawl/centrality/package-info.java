/**
 * Build compressed link graphs and compute approximate harmonic centrality on
 * them. Built on software from the Laboratory for Web Algorithmics (LAW) at the
 * University of Milano, namely the
 * <a href="https://webgraph.di.unimi.it/">WebGraph framework</a> and
 * <a href="https://fastutil.di.unimi.it/">fastutil</a>. The centrality
 * computation follows the HyperBall approach: HyperLogLog counters of the
 * nodes reachable within <i>r</i> hops are grown by one hop per round.
 */
package org.commoncrawl.centrality;
