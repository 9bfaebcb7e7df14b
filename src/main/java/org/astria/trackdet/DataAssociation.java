/*
 * DataAssociation.java - Association of reports with active tracks.
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
import java.util.Collections;
import java.util.List;
import org.hipparchus.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gates every active track against every newly arrived report, enumerates the
 * hypotheses of each cluster, normalises their probabilities over the whole
 * batch and resolves the most likely track per report.
 */
public class DataAssociation
{
    private static final Logger log = LoggerFactory.getLogger(DataAssociation.class);

    public static class Result
    {
	private final List<Cluster> clusters;
	private final List<Hypothesis> hypotheses;
	private final double[] probabilities;
	private final List<Association> associations;

	Result(List<Cluster> clusters, List<Hypothesis> hypotheses, double[] probabilities,
	       List<Association> associations)
	{
	    this.clusters = Collections.unmodifiableList(clusters);
	    this.hypotheses = Collections.unmodifiableList(hypotheses);
	    this.probabilities = probabilities;
	    this.associations = Collections.unmodifiableList(associations);
	}

	public List<Cluster> getClusters()
	{
	    return(clusters);
	}

	public List<Hypothesis> getHypotheses()
	{
	    return(hypotheses);
	}

	public double[] getProbabilities()
	{
	    return(probabilities.clone());
	}

	public List<Association> getAssociations()
	{
	    return(associations);
	}
    }

    private final Gating gating;
    private final int maxClusterSize;
    private final long maxHypotheses;
    private final String oversizePolicy;

    public DataAssociation(Gating gating, int maxClusterSize, long maxHypotheses, String oversizePolicy)
    {
	this.gating = gating;
	this.maxClusterSize = maxClusterSize;
	this.maxHypotheses = maxHypotheses;
	this.oversizePolicy = oversizePolicy;
    }

    public DataAssociation(Settings cfg)
    {
	this(new Gating(cfg), cfg.Association.MaxClusterSize, cfg.Association.MaxHypotheses,
	     cfg.Association.OversizePolicy);
    }

    public Gating getGating()
    {
	return(gating);
    }

    public Result associate(List<RealVector> tracks, List<Measurement> reports)
    {
	List<RealVector> trackSnapshot = new ArrayList<RealVector>(tracks.size());
	for (RealVector v : tracks)
	    trackSnapshot.add(v.copy());
	List<Measurement> reportSnapshot = new ArrayList<Measurement>(reports);

	double[][] d2 = gating.distances(trackSnapshot, reportSnapshot);
	boolean[][] gated = gating.validate(d2);
	List<Cluster> clusters = gating.cluster(d2);

	ArrayList<Hypothesis> hyps = new ArrayList<Hypothesis>();
	for (Cluster c : clusters)
	{
	    HypothesisGenerator gen = new HypothesisGenerator(c, reportSnapshot.size(), gated);
	    long bound = gen.countUpperBound();
	    if (c.size() > maxClusterSize || bound > maxHypotheses)
	    {
		if (Settings.OVERSIZE_FAIL.equals(oversizePolicy))
		{
		    if (c.size() > maxClusterSize)
			throw(new ClusterTooLargeException(c.size(), maxClusterSize));
		    throw(new ClusterTooLargeException(c.size(), bound, maxHypotheses));
		}

		log.warn("{} exceeds the enumeration limits ({} tracks, up to {} hypotheses), using nearest-first assignment",
			 c, c.size(), bound);
		Hypothesis h = HypothesisGenerator.greedy(c, d2, gated);
		if (h != null)
		    hyps.add(h);
		continue;
	    }

	    hyps.ensureCapacity(hyps.size() + (int)Math.min(bound, 1 << 16));
	    for (Hypothesis h : gen)
		hyps.add(h);
	}

	double[] probs = new ProbabilityScorer(d2).scoreAll(hyps);
	List<Association> assoc = AssociationResolver.resolve(hyps, probs, reportSnapshot.size());

	if (log.isDebugEnabled())
	{
	    for (int i = 0; i < hyps.size(); i++)
		log.debug("Hypothesis {}: {}, Probability: {}", i + 1, hyps.get(i), probs[i]);
	}
	log.info("Associated {} reports with {} tracks: {} clusters, {} hypotheses",
		 reportSnapshot.size(), trackSnapshot.size(), clusters.size(), hyps.size());

	return(new Result(clusters, hyps, probs, assoc));
    }
}
