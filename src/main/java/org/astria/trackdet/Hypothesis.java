/*
 * Hypothesis.java - Joint report-to-track assignment.
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

/**
 * One candidate assignment for a cluster: a (track, report) pair per track,
 * where the report is {@link #UNASSIGNED} when the track takes none.
 */
public final class Hypothesis
{
    public final static int UNASSIGNED = -1;

    private final int[] tracks;
    private final int[] reports;

    public Hypothesis(int[] tracks, int[] reports)
    {
	if (tracks.length != reports.length)
	    throw(new IllegalArgumentException("Track and report lists differ in length"));
	this.tracks = tracks.clone();
	this.reports = reports.clone();
    }

    public int size()
    {
	return(tracks.length);
    }

    public int getTrack(int i)
    {
	return(tracks[i]);
    }

    public int getReport(int i)
    {
	return(reports[i]);
    }

    public boolean isAssigned(int i)
    {
	return(reports[i] != UNASSIGNED);
    }

    public int[][] toPairs()
    {
	int[][] out = new int[tracks.length][];
	for (int i = 0; i < tracks.length; i++)
	    out[i] = new int[]{tracks[i], reports[i]};
	return(out);
    }

    @Override
    public String toString()
    {
	StringBuilder sb = new StringBuilder("[");
	for (int i = 0; i < tracks.length; i++)
	{
	    if (i > 0)
		sb.append(", ");
	    sb.append('(').append(tracks[i]).append(", ");
	    if (reports[i] == UNASSIGNED)
		sb.append('-');
	    else
		sb.append(reports[i]);
	    sb.append(')');
	}

	return(sb.append(']').toString());
    }
}
