/*
 * Track.java - Single target track.
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
import java.util.Collections;
import java.util.List;
import org.hipparchus.linear.RealMatrix;
import org.hipparchus.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Track
{
    private static final Logger log = LoggerFactory.getLogger(Track.class);

    public final static String STATUS_INITIALIZED = "Initialized";
    public final static String STATUS_UPDATED = "Updated";
    public final static String STATUS_SKIPPED = "Skipped";

    // Filter output for one processed report.
    public static class Step
    {
	double Time;
	String Status;
	double[] EstimatedState;
	double[][] EstimatedCovariance;
	String Message;

	public double getTime()
	{
	    return(Time);
	}

	public String getStatus()
	{
	    return(Status);
	}

	public double[] getEstimatedState()
	{
	    return(EstimatedState.clone());
	}

	public double[][] getEstimatedCovariance()
	{
	    double[][] out = new double[EstimatedCovariance.length][];
	    for (int i = 0; i < out.length; i++)
		out[i] = EstimatedCovariance[i].clone();
	    return(out);
	}

	public String getMessage()
	{
	    return(Message);
	}
    }

    private final int id;
    private final CVFilter filter;
    private final ArrayList<Step> steps = new ArrayList<Step>();

    public Track(int id, CVFilter filter, Measurement first)
    {
	this.id = id;
	this.filter = filter;
	filter.initialize(first.getX(), first.getY(), first.getZ(), 0.0, 0.0, 0.0, first.getTime());
	record(first.getTime(), STATUS_INITIALIZED, null);
    }

    public static Track fromGroup(int id, Settings cfg, List<Measurement> group)
    {
	if (group.isEmpty())
	    throw(new IllegalArgumentException(String.format("Track %d has no measurements", id)));

	Track track = new Track(id, CVFilter.fromSettings(cfg), group.get(0));
	for (int i = 1; i < group.size(); i++)
	    track.process(group.get(i));
	return(track);
    }

    /**
     * Runs predict-then-update for one report. A numerical failure is logged and
     * the predicted state is kept.
     */
    public Step process(Measurement meas)
    {
	filter.predict(meas.getTime());
	try
	{
	    filter.update(meas.getPosition());
	    return(record(meas.getTime(), STATUS_UPDATED, null));
	}
	catch (NumericalException e)
	{
	    log.warn("Track {}: skipping update with report at t={}: {}", id, meas.getTime(), e.getMessage());
	    filter.acceptPrediction();
	    return(record(meas.getTime(), STATUS_SKIPPED, e.getMessage()));
	}
    }

    private Step record(double time, String status, String message)
    {
	Step step = new Step();
	step.Time = time;
	step.Status = status;
	step.EstimatedState = filter.getState().toArray();
	step.EstimatedCovariance = filter.getCovariance().getData();
	step.Message = message;
	steps.add(step);

	log.debug("Track {} {} at t={}: {}", id, status, time, filter.getState());
	return(step);
    }

    public int getId()
    {
	return(id);
    }

    public RealVector getState()
    {
	return(filter.getState());
    }

    public RealMatrix getCovariance()
    {
	return(filter.getCovariance());
    }

    public RealVector getPosition()
    {
	return(Utilities.position(filter.getState()));
    }

    public double getTime()
    {
	return(filter.getTime());
    }

    public List<Step> getSteps()
    {
	return(Collections.unmodifiableList(steps));
    }
}
