/*
 * TrackGrouper.java - Groups measurements by time.
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
import java.util.Comparator;
import java.util.List;

/**
 * Splits a measurement stream into per-target groups. Measurements are swept in
 * time order; each group starts at a seed measurement and takes every following
 * measurement less than the time window after the seed.
 */
public class TrackGrouper
{
    private final double window;

    public TrackGrouper(double window)
    {
	if (!(window > 0.0))
	    throw(new IllegalArgumentException(String.format("Invalid time window %f", window)));
	this.window = window;
    }

    public List<List<Measurement>> group(List<Measurement> measurements)
    {
	ArrayList<Measurement> sorted = new ArrayList<Measurement>(measurements);
	sorted.sort(Comparator.comparingDouble(Measurement::getTime));

	ArrayList<List<Measurement>> groups = new ArrayList<List<Measurement>>();
	ArrayList<Measurement> current = null;
	double seed = 0.0;
	for (Measurement m : sorted)
	{
	    if (current == null || Math.abs(m.getTime() - seed) >= window)
	    {
		current = new ArrayList<Measurement>();
		groups.add(current);
		seed = m.getTime();
	    }
	    current.add(m);
	}

	return(groups);
    }

    public double getWindow()
    {
	return(window);
    }
}
