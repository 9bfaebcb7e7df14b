/*
 * ProbabilityScorer.java - Gaussian likelihood scoring of hypotheses.
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

import java.util.List;
import org.hipparchus.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProbabilityScorer
{
    private static final Logger log = LoggerFactory.getLogger(ProbabilityScorer.class);

    private final double[][] d2;

    /**
     * @param d2 squared Mahalanobis distances indexed [track][report]
     */
    public ProbabilityScorer(double[][] d2)
    {
	this.d2 = d2;
    }

    // Unassigned tracks contribute a factor of one.
    public double score(Hypothesis h)
    {
	double prob = 1.0;
	for (int i = 0; i < h.size(); i++)
	{
	    if (h.isAssigned(i))
		prob *= FastMath.exp(-0.5*d2[h.getTrack(i)][h.getReport(i)]);
	}

	return(prob);
    }

    public double[] scoreAll(List<Hypothesis> hyps)
    {
	double[] weights = new double[hyps.size()];
	for (int i = 0; i < weights.length; i++)
	    weights[i] = score(hyps.get(i));
	return(normalize(weights));
    }

    /**
     * Scales the weights to sum to one. A zero or non-finite total leaves every
     * probability at zero.
     */
    public static double[] normalize(double[] weights)
    {
	double sum = 0.0;
	for (double w : weights)
	    sum += w;

	double[] out = new double[weights.length];
	if (weights.length == 0)
	    return(out);

	if (!(sum > 0.0) || Double.isInfinite(sum))
	{
	    log.warn("Degenerate hypothesis probabilities (total {}) over {} hypotheses, reporting zero confidence",
		     sum, weights.length);
	    return(out);
	}

	for (int i = 0; i < weights.length; i++)
	    out[i] = weights[i]/sum;
	return(out);
    }
}
