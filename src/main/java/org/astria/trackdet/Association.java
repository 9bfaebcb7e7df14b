/*
 * Association.java - Resolved report-to-track association.
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

public final class Association
{
    public final static int NONE = -1;

    private final int report;
    private final int track;
    private final double probability;

    public Association(int report, int track, double probability)
    {
	this.report = report;
	this.track = track;
	this.probability = probability;
    }

    public static Association none(int report)
    {
	return(new Association(report, NONE, 0.0));
    }

    public int getReport()
    {
	return(report);
    }

    // Track index, or NONE.
    public int getTrack()
    {
	return(track);
    }

    public double getProbability()
    {
	return(probability);
    }

    public boolean isAssociated()
    {
	return(track != NONE);
    }

    @Override
    public String toString()
    {
	if (track == NONE)
	    return(String.format("Report %d not associated", report));
	return(String.format("Report %d associated with Track %d, Probability: %s", report, track, probability));
    }
}
