/*
 * Settings.java - Tracking and association settings.
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
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.util.Arrays;

/**
 * Configuration sections with their defaults. Keys missing from the JSON keep
 * the default; keys present with impossible values are rejected.
 */
public class Settings
{
    public final static String ORDERING_PREDICTED = "Predicted";
    public final static String ORDERING_PRIOR = "Prior";

    public final static String CLUSTER_NEAREST = "Nearest";
    public final static String CLUSTER_GATED = "Gated";

    public final static String OVERSIZE_GREEDY = "Greedy";
    public final static String OVERSIZE_FAIL = "Fail";

    public static class JSONFilter
    {
	public double PlantNoise = 20.0;
	public double[] MeasurementNoise;
	public double[] InitialCovariance;
	public String InnovationOrdering;
	public double MaxConditionNumber = 1E12;
    }

    public static class JSONGrouping
    {
	public double TimeWindow = 50.0;
    }

    public static class JSONAssociation
    {
	public double GateProbability = 0.95;
	public double[] GateCovariance;
	public String ClusterPolicy;
	public int MaxClusterSize = 8;
	public long MaxHypotheses = 100000;
	public String OversizePolicy;
    }

    public JSONFilter Filter;
    public JSONGrouping Grouping;
    public JSONAssociation Association;

    public static Settings loadJSON(String json)
    {
	Settings cfg;
	try
	{
	    cfg = new Gson().fromJson(json, Settings.class);
	}
	catch (JsonParseException e)
	{
	    throw(new IllegalArgumentException("Malformed settings: " + e.getMessage(), e));
	}

	if (cfg == null)
	    cfg = new Settings();
	cfg.applyDefaults();
	cfg.validate();
	return(cfg);
    }

    public static Settings defaults()
    {
	return(loadJSON("{}"));
    }

    void applyDefaults()
    {
	if (Filter == null)
	    Filter = new JSONFilter();
	if (Grouping == null)
	    Grouping = new JSONGrouping();
	if (Association == null)
	    Association = new JSONAssociation();

	if (Filter.MeasurementNoise == null)
	    Filter.MeasurementNoise = new double[]{1.0, 1.0, 1.0};
	if (Filter.InitialCovariance == null)
	{
	    Filter.InitialCovariance = new double[6];
	    Arrays.fill(Filter.InitialCovariance, 1.0);
	}
	if (Filter.InnovationOrdering == null)
	    Filter.InnovationOrdering = ORDERING_PREDICTED;

	if (Association.GateCovariance == null)
	    Association.GateCovariance = new double[]{1.0, 1.0, 1.0};
	if (Association.ClusterPolicy == null)
	    Association.ClusterPolicy = CLUSTER_NEAREST;
	if (Association.OversizePolicy == null)
	    Association.OversizePolicy = OVERSIZE_GREEDY;
    }

    void validate()
    {
	if (!(Filter.PlantNoise >= 0.0) || Double.isInfinite(Filter.PlantNoise))
	    throw(new IllegalArgumentException(String.format("Invalid Filter.PlantNoise %f", Filter.PlantNoise)));
	if (!(Filter.MaxConditionNumber > 0.0))
	    throw(new IllegalArgumentException(String.format("Invalid Filter.MaxConditionNumber %g",
							     Filter.MaxConditionNumber)));
	if (!(Grouping.TimeWindow > 0.0) || Double.isInfinite(Grouping.TimeWindow))
	    throw(new IllegalArgumentException(String.format("Invalid Grouping.TimeWindow %f", Grouping.TimeWindow)));
	if (!(Association.GateProbability > 0.0 && Association.GateProbability < 1.0))
	    throw(new IllegalArgumentException(String.format("Invalid Association.GateProbability %f",
							     Association.GateProbability)));
	if (Association.MaxClusterSize < 1)
	    throw(new IllegalArgumentException(String.format("Invalid Association.MaxClusterSize %d",
							     Association.MaxClusterSize)));
	if (Association.MaxHypotheses < 1)
	    throw(new IllegalArgumentException(String.format("Invalid Association.MaxHypotheses %d",
							     Association.MaxHypotheses)));

	checkVector("Filter.MeasurementNoise", Filter.MeasurementNoise, 3, true);
	checkVector("Filter.InitialCovariance", Filter.InitialCovariance, 6, true);
	checkVector("Association.GateCovariance", Association.GateCovariance, 3, false);
	checkOneOf("Filter.InnovationOrdering", Filter.InnovationOrdering, ORDERING_PREDICTED, ORDERING_PRIOR);
	checkOneOf("Association.ClusterPolicy", Association.ClusterPolicy, CLUSTER_NEAREST, CLUSTER_GATED);
	checkOneOf("Association.OversizePolicy", Association.OversizePolicy, OVERSIZE_GREEDY, OVERSIZE_FAIL);
    }

    // Noise terms may be zero, gate covariance terms must be strictly positive.
    private static void checkVector(String name, double[] values, int size, boolean allowZero)
    {
	if (values.length != size)
	    throw(new IllegalArgumentException(String.format("%s must have %d entries, found %d",
							     name, size, values.length)));
	for (double v : values)
	{
	    if (Double.isNaN(v) || v < 0.0 || (!allowZero && v == 0.0))
		throw(new IllegalArgumentException(String.format("Invalid %s entry %f", name, v)));
	}
    }

    private static void checkOneOf(String name, String value, String... allowed)
    {
	for (String s : allowed)
	{
	    if (s.equals(value))
		return;
	}

	throw(new IllegalArgumentException(String.format("Unknown %s '%s', expected one of %s",
							 name, value, Arrays.toString(allowed))));
    }
}
