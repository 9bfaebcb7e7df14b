/*
 * Utilities.java - Various utility functions.
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

import org.hipparchus.distribution.continuous.ChiSquaredDistribution;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;
import org.hipparchus.linear.RealVector;
import org.hipparchus.util.FastMath;

public class Utilities
{
    public final static int POSITION_DIM = 3;

    private Utilities()
    {
    }

    /**
     * Converts a sensor reading to Cartesian coordinates. Azimuth is measured
     * from the +y axis toward +x and elevation from the x-y plane, both in degrees.
     *
     * @return {x, y, z}
     */
    public static double[] sph2cart(double az, double el, double r)
    {
	double azr = FastMath.toRadians(az);
	double elr = FastMath.toRadians(el);

	double x = r*FastMath.cos(elr)*FastMath.sin(azr);
	double y = r*FastMath.cos(elr)*FastMath.cos(azr);
	double z = r*FastMath.sin(elr);
	return(new double[]{x, y, z});
    }

    /**
     * Inverse of {@link #sph2cart}.
     *
     * @return {range, azimuth, elevation}, azimuth in [0, 360)
     */
    public static double[] cart2sph(double x, double y, double z)
    {
	double r = FastMath.sqrt(x*x + y*y + z*z);
	double el = FastMath.toDegrees(FastMath.atan2(z, FastMath.sqrt(x*x + y*y)));
	double az = FastMath.toDegrees(FastMath.atan2(x, y));

	if (az < 0.0)
	    az += 360.0;
	if (az >= 360.0)
	    az -= 360.0;

	return(new double[]{r, az, el});
    }

    public static RealVector position(RealVector state)
    {
	return(state.getSubVector(0, POSITION_DIM));
    }

    public static double mahalanobis(RealVector x, RealVector y, RealMatrix covinv)
    {
	return(FastMath.sqrt(mahalanobisSquared(x, y, covinv)));
    }

    // Only the position components of x and y take part.
    public static double mahalanobisSquared(RealVector x, RealVector y, RealMatrix covinv)
    {
	RealVector delta = position(y).subtract(position(x));
	return(covinv.preMultiply(delta).dotProduct(delta));
    }

    /**
     * Returns the gating threshold on the squared Mahalanobis distance: the
     * chi-square quantile at the given probability.
     */
    public static double chiSquareGate(double probability, int dof)
    {
	if (!(probability > 0.0 && probability < 1.0))
	    throw(new IllegalArgumentException(String.format("Invalid gate probability %f", probability)));

	return(new ChiSquaredDistribution(dof).inverseCumulativeProbability(probability));
    }

    public static RealMatrix diagonal(double[] diag)
    {
	return(MatrixUtils.createRealDiagonalMatrix(diag));
    }

    // (P + P')/2 with negative diagonal drift clamped to zero.
    public static RealMatrix symmetrize(RealMatrix P)
    {
	RealMatrix out = P.add(P.transpose()).scalarMultiply(0.5);
	for (int i = 0; i < out.getRowDimension(); i++)
	{
	    if (out.getEntry(i, i) < 0.0)
		out.setEntry(i, i, 0.0);
	}

	return(out);
    }

    public static boolean isFinite(RealMatrix m)
    {
	for (double[] row : m.getData())
	{
	    for (double v : row)
	    {
		if (Double.isNaN(v) || Double.isInfinite(v))
		    return(false);
	    }
	}

	return(true);
    }
}
