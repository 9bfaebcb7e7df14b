/*
 * CVFilter.java - Constant-velocity Kalman filter.
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

import org.hipparchus.exception.MathIllegalArgumentException;
import org.hipparchus.linear.Array2DRowRealMatrix;
import org.hipparchus.linear.ArrayRealVector;
import org.hipparchus.linear.LUDecomposition;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;
import org.hipparchus.linear.RealVector;
import org.hipparchus.linear.SingularValueDecomposition;

/**
 * Kalman filter over a 6-element state (x, y, z, vx, vy, vz) with a
 * constant-velocity transition and position-only measurements.
 *
 * {@link #predict(double)} does not commit anything: it leaves the propagated
 * state in {@link #getPredictedState()} and the propagated covariance in
 * {@link #getCovariance()}. A following {@link #update(RealVector)} or
 * {@link #acceptPrediction()} moves the filter to the predicted time.
 */
public class CVFilter
{
    public final static int STATE_DIM = 6;
    public final static int MEAS_DIM = 3;

    private final double plantNoise;
    private final RealMatrix H;
    private final RealMatrix R;
    private final RealMatrix Q;
    private final boolean innovatePredicted;
    private final double maxCondition;

    private RealVector Sf;
    private RealVector Sp;
    private RealMatrix Pf;
    private double measTime;
    private double predTime;

    public CVFilter(double plantNoise, RealMatrix R, RealMatrix P0, String ordering, double maxCondition)
    {
	if (R.getRowDimension() != MEAS_DIM || R.getColumnDimension() != MEAS_DIM)
	    throw(new IllegalArgumentException("Measurement noise must be 3x3"));
	if (P0.getRowDimension() != STATE_DIM || P0.getColumnDimension() != STATE_DIM)
	    throw(new IllegalArgumentException("Initial covariance must be 6x6"));

	this.plantNoise = plantNoise;
	this.R = R.copy();
	this.Q = MatrixUtils.createRealIdentityMatrix(STATE_DIM).scalarMultiply(plantNoise);
	this.innovatePredicted = !Settings.ORDERING_PRIOR.equals(ordering);
	this.maxCondition = maxCondition;

	H = new Array2DRowRealMatrix(MEAS_DIM, STATE_DIM);
	for (int i = 0; i < MEAS_DIM; i++)
	    H.setEntry(i, i, 1.0);

	Sf = new ArrayRealVector(STATE_DIM);
	Sp = new ArrayRealVector(STATE_DIM);
	Pf = P0.copy();
    }

    public CVFilter()
    {
	this(20.0, MatrixUtils.createRealIdentityMatrix(MEAS_DIM), MatrixUtils.createRealIdentityMatrix(STATE_DIM),
	     Settings.ORDERING_PREDICTED, 1E12);
    }

    public static CVFilter fromSettings(Settings cfg)
    {
	return(new CVFilter(cfg.Filter.PlantNoise, Utilities.diagonal(cfg.Filter.MeasurementNoise),
			    Utilities.diagonal(cfg.Filter.InitialCovariance), cfg.Filter.InnovationOrdering,
			    cfg.Filter.MaxConditionNumber));
    }

    public void initialize(double x, double y, double z, double vx, double vy, double vz, double time)
    {
	Sf = new ArrayRealVector(new double[]{x, y, z, vx, vy, vz});
	Sp = Sf.copy();
	measTime = time;
	predTime = time;
    }

    public void predict(double time)
    {
	double dt = time - measTime;
	RealMatrix Phi = MatrixUtils.createRealIdentityMatrix(STATE_DIM);
	for (int i = 0; i < MEAS_DIM; i++)
	    Phi.setEntry(i, i + MEAS_DIM, dt);

	Sp = Phi.operate(Sf);
	Pf = Phi.multiply(Pf).multiply(Phi.transpose()).add(Q);
	predTime = time;
    }

    /**
     * Corrects the state with a position report. The innovation is taken against
     * the predicted state, or against the state before prediction when the filter
     * was configured with the prior ordering.
     *
     * @throws NumericalException if the innovation covariance is singular or
     *         ill-conditioned; the filter is left untouched
     */
    public void update(RealVector z)
    {
	if (z.getDimension() != MEAS_DIM)
	    throw(new IllegalArgumentException(String.format("Expected a %d-element report, got %d",
							     MEAS_DIM, z.getDimension())));

	RealVector base = innovatePredicted ? Sp : Sf;
	RealVector Inn = z.subtract(H.operate(base));
	RealMatrix S = H.multiply(Pf).multiply(H.transpose()).add(R);
	RealMatrix K = Pf.multiply(H.transpose()).multiply(invert(S));

	Sf = base.add(K.operate(Inn));
	Pf = Utilities.symmetrize(MatrixUtils.createRealIdentityMatrix(STATE_DIM).subtract(K.multiply(H)).multiply(Pf));
	Sp = Sf.copy();
	measTime = predTime;
    }

    // Keeps the predicted state when an update has to be skipped.
    public void acceptPrediction()
    {
	Sf = Sp.copy();
	measTime = predTime;
    }

    private RealMatrix invert(RealMatrix S)
    {
	if (!Utilities.isFinite(S))
	    throw(new NumericalException("Innovation covariance has non-finite entries"));

	double cond = new SingularValueDecomposition(S).getConditionNumber();
	if (!(cond <= maxCondition))
	    throw(new NumericalException(String.format("Innovation covariance is singular or ill-conditioned (condition number %g)", cond)));

	try
	{
	    return(new LUDecomposition(S).getSolver().getInverse());
	}
	catch (MathIllegalArgumentException e)
	{
	    throw(new NumericalException("Innovation covariance is singular", e));
	}
    }

    public RealVector getState()
    {
	return(Sf.copy());
    }

    public RealVector getPredictedState()
    {
	return(Sp.copy());
    }

    public RealMatrix getCovariance()
    {
	return(Pf.copy());
    }

    public double getTime()
    {
	return(measTime);
    }

    public double getPlantNoise()
    {
	return(plantNoise);
    }

    public boolean isInnovationPredicted()
    {
	return(innovatePredicted);
    }
}
