/*
 * AssociationResolver.java - Most likely track per report.
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
import java.util.List;

public class AssociationResolver
{
    private AssociationResolver()
    {
    }

    /**
     * For every report, picks the track of the most probable hypothesis in which
     * that report is assigned. Reports no hypothesis claims with a positive
     * probability are not associated.
     */
    public static List<Association> resolve(List<Hypothesis> hyps, double[] probs, int numReports)
    {
	if (hyps.size() != probs.length)
	    throw(new IllegalArgumentException(String.format("%d hypotheses but %d probabilities",
							     hyps.size(), probs.length)));

	int[] maxAssoc = new int[numReports];
	double[] maxProb = new double[numReports];
	for (int r = 0; r < numReports; r++)
	    maxAssoc[r] = Association.NONE;

	for (int i = 0; i < hyps.size(); i++)
	{
	    Hypothesis h = hyps.get(i);
	    for (int j = 0; j < h.size(); j++)
	    {
		int r = h.getReport(j);
		if (r != Hypothesis.UNASSIGNED && probs[i] > maxProb[r])
		{
		    maxProb[r] = probs[i];
		    maxAssoc[r] = h.getTrack(j);
		}
	    }
	}

	ArrayList<Association> out = new ArrayList<Association>(numReports);
	for (int r = 0; r < numReports; r++)
	{
	    if (maxAssoc[r] == Association.NONE)
		out.add(Association.none(r));
	    else
		out.add(new Association(r, maxAssoc[r], maxProb[r]));
	}

	return(out);
    }
}
