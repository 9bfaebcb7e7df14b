/*
 * ClusterTooLargeException.java - Cluster exceeds the hypothesis enumeration limit.
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

public class ClusterTooLargeException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private final int size;
    private final long hypotheses;
    private final long limit;

    public ClusterTooLargeException(int size, int limit)
    {
	super(String.format("Cluster of %d tracks exceeds the maximum of %d", size, limit));
	this.size = size;
	this.hypotheses = -1;
	this.limit = limit;
    }

    public ClusterTooLargeException(int size, long hypotheses, long limit)
    {
	super(String.format("Cluster of %d tracks admits up to %d hypotheses, above the maximum of %d",
			    size, hypotheses, limit));
	this.size = size;
	this.hypotheses = hypotheses;
	this.limit = limit;
    }

    public int getSize()
    {
	return(size);
    }

    // Hypothesis bound that was exceeded, or -1 when the track count was.
    public long getHypotheses()
    {
	return(hypotheses);
    }

    public long getLimit()
    {
	return(limit);
    }
}
