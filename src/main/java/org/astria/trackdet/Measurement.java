/*
 * Measurement.java - Cartesian position report.
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

import org.hipparchus.linear.ArrayRealVector;
import org.hipparchus.linear.RealVector;

public final class Measurement
{
    private final double x;
    private final double y;
    private final double z;
    private final double time;

    public Measurement(double x, double y, double z, double time)
    {
	this.x = x;
	this.y = y;
	this.z = z;
	this.time = time;
    }

    public double getX()
    {
	return(x);
    }

    public double getY()
    {
	return(y);
    }

    public double getZ()
    {
	return(z);
    }

    public double getTime()
    {
	return(time);
    }

    public RealVector getPosition()
    {
	return(new ArrayRealVector(new double[]{x, y, z}));
    }

    @Override
    public String toString()
    {
	return(String.format("Measurement[t=%s, x=%s, y=%s, z=%s]", time, x, y, z));
    }
}
