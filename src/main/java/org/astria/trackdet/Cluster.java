/*
 * Cluster.java - Set of tracks reachable from reports.
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

import java.util.Arrays;

/**
 * Track indices that can share reports, in ascending order, together with the
 * indices of the reports that link them.
 */
public final class Cluster
{
    private final int[] tracks;
    private final int[] reports;

    public Cluster(int[] tracks, int[] reports)
    {
	this.tracks = tracks.clone();
	this.reports = reports.clone();
	Arrays.sort(this.tracks);
	Arrays.sort(this.reports);
    }

    public int size()
    {
	return(tracks.length);
    }

    public int getTrack(int i)
    {
	return(tracks[i]);
    }

    public int[] getTracks()
    {
	return(tracks.clone());
    }

    public int[] getReports()
    {
	return(reports.clone());
    }

    @Override
    public boolean equals(Object o)
    {
	if (this == o)
	    return(true);
	if (!(o instanceof Cluster))
	    return(false);
	Cluster c = (Cluster)o;
	return(Arrays.equals(tracks, c.tracks) && Arrays.equals(reports, c.reports));
    }

    @Override
    public int hashCode()
    {
	return(31*Arrays.hashCode(tracks) + Arrays.hashCode(reports));
    }

    @Override
    public String toString()
    {
	return(String.format("Cluster[tracks=%s, reports=%s]", Arrays.toString(tracks), Arrays.toString(reports)));
    }
}
