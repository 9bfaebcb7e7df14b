/*
 * Gating.java - Statistical gating and clustering.
 * Copyright (C) 2019 University of Texas
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.astria.trackdet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;
import org.hipparchus.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Gating
{
    private static final Logger log = LoggerFactory.getLogger(Gating.class);

    private final double threshold;
    private final RealMatrix covinv;
    private final String policy;

    public Gating(double probability, RealMatrix covariance, String policy)
    {
	this.threshold = Utilities.chiSquareGate(probability, Utilities.POSITION_DIM);
	this.covinv = MatrixUtils.inverse(covariance);
	this.policy = policy;
    }

    public Gating(Settings cfg)
    {
	this(cfg.Association.GateProbability, Utilities.diagonal(cfg.Association.GateCovariance),
	     cfg.Association.ClusterPolicy);
    }

    public double getThreshold()
    {
	return(threshold);
    }

    /**
     * @return squared Mahalanobis distances indexed [track][report]
     */
    public double[][] distances(List<RealVector> tracks, List<Measurement> reports)
    {
	double[][] d2 = new double[tracks.size()][reports.size()];
	for (int t = 0; t < tracks.size(); t++)
	{
	    for (int r = 0; r < reports.size(); r++)
		d2[t][r] = Utilities.mahalanobisSquared(tracks.get(t), reports.get(r).getPosition(), covinv);
	}

	return(d2);
    }

    public boolean[][] validate(double[][] d2)
    {
	boolean[][] gated = new boolean[d2.length][];
	for (int t = 0; t < d2.length; t++)
	{
	    gated[t] = new boolean[d2[t].length];
	    for (int r = 0; r < d2[t].length; r++)
		gated[t][r] = d2[t][r] < threshold;
	}

	return(gated);
    }

    public List<Cluster> cluster(double[][] d2)
    {
	int numReports = d2.length == 0 ? 0 : d2[0].length;
	List<Cluster> out;
	if (Settings.CLUSTER_GATED.equals(policy))
	    out = clusterGated(d2, numReports);
	else
	    out = clusterNearest(d2, numReports);

	log.debug("Formed {} clusters: {}", out.size(), out);
	return(out);
    }

    // Each report joins the nearest track inside the gate.
    private List<Cluster> clusterNearest(double[][] d2, int numReports)
    {
	Map<Integer, TreeSet<Integer>> links = new LinkedHashMap<Integer, TreeSet<Integer>>();
	for (int r = 0; r < numReports; r++)
	{
	    int best = -1;
	    for (int t = 0; t < d2.length; t++)
	    {
		if (best == -1 || d2[t][r] < d2[best][r])
		    best = t;
	    }

	    if (best != -1 && d2[best][r] < threshold)
		links.computeIfAbsent(best, k -> new TreeSet<Integer>()).add(r);
	}

	ArrayList<Cluster> out = new ArrayList<Cluster>();
	for (Map.Entry<Integer, TreeSet<Integer>> e : links.entrySet())
	    out.add(new Cluster(new int[]{e.getKey()}, toArray(e.getValue())));
	return(out);
    }

    // Tracks sharing any report inside the gate are merged.
    private List<Cluster> clusterGated(double[][] d2, int numReports)
    {
	int[] parent = new int[d2.length];
	for (int t = 0; t < parent.length; t++)
	    parent[t] = t;

	boolean[] linked = new boolean[d2.length];
	for (int r = 0; r < numReports; r++)
	{
	    int first = -1;
	    for (int t = 0; t < d2.length; t++)
	    {
		if (d2[t][r] >= threshold)
		    continue;
		linked[t] = true;
		if (first == -1)
		    first = t;
		else
		    parent[find(parent, t)] = find(parent, first);
	    }
	}

	Map<Integer, TreeSet<Integer>> members = new LinkedHashMap<Integer, TreeSet<Integer>>();
	Map<Integer, TreeSet<Integer>> reports = new LinkedHashMap<Integer, TreeSet<Integer>>();
	for (int t = 0; t < d2.length; t++)
	{
	    if (!linked[t])
		continue;
	    int root = find(parent, t);
	    members.computeIfAbsent(root, k -> new TreeSet<Integer>()).add(t);
	    TreeSet<Integer> rs = reports.computeIfAbsent(root, k -> new TreeSet<Integer>());
	    for (int r = 0; r < numReports; r++)
	    {
		if (d2[t][r] < threshold)
		    rs.add(r);
	    }
	}

	ArrayList<Cluster> out = new ArrayList<Cluster>();
	for (Map.Entry<Integer, TreeSet<Integer>> e : members.entrySet())
	    out.add(new Cluster(toArray(e.getValue()), toArray(reports.get(e.getKey()))));
	return(out);
    }

    private static int find(int[] parent, int i)
    {
	while (parent[i] != i)
	{
	    parent[i] = parent[parent[i]];
	    i = parent[i];
	}

	return(i);
    }

    private static int[] toArray(TreeSet<Integer> set)
    {
	int[] out = new int[set.size()];
	int i = 0;
	for (Integer v : set)
	    out[i++] = v;
	return(out);
    }
}
