/*
 * Measurements.java - Measurement ingestion.
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
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Measurements
{
    private static final Logger log = LoggerFactory.getLogger(Measurements.class);

    // Column layout of the sensor CSV export: range, azimuth, elevation, time.
    public final static int CSV_RANGE = 7;
    public final static int CSV_AZIMUTH = 8;
    public final static int CSV_ELEVATION = 9;
    public final static int CSV_TIME = 10;

    public static class JSONMeasurement
    {
	public Double Time;
	public Double X;
	public Double Y;
	public Double Z;
	public Double Range;
	public Double Azimuth;
	public Double Elevation;
    }

    protected List<Measurement> measobjs;

    public Measurements(List<Measurement> measobjs)
    {
	this.measobjs = Collections.unmodifiableList(new ArrayList<Measurement>(measobjs));
    }

    public static Measurements empty()
    {
	return(new Measurements(new ArrayList<Measurement>()));
    }

    public List<Measurement> getMeasurements()
    {
	return(measobjs);
    }

    public int size()
    {
	return(measobjs.size());
    }

    public static Measurements loadJSON(String json)
    {
	JSONMeasurement[] raw;
	try
	{
	    raw = new Gson().fromJson(json, JSONMeasurement[].class);
	}
	catch (JsonParseException e)
	{
	    throw(new IllegalArgumentException("Malformed measurements: " + e.getMessage(), e));
	}

	if (raw == null)
	    raw = new JSONMeasurement[0];

	ArrayList<Measurement> list = new ArrayList<Measurement>(raw.length);
	for (int i = 0; i < raw.length; i++)
	    list.add(toMeasurement(raw[i], i));

	log.debug("Loaded {} measurements from JSON", list.size());
	return(new Measurements(list));
    }

    /**
     * Reads a sensor CSV export. The first line is a header; range, azimuth and
     * elevation (degrees) are converted to Cartesian positions.
     */
    public static Measurements readCSV(String path) throws IOException
    {
	ArrayList<Measurement> list = new ArrayList<Measurement>();
	try (BufferedReader reader = Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8))
	{
	    String line = reader.readLine();
	    int lineNum = 1;
	    while ((line = reader.readLine()) != null)
	    {
		lineNum++;
		if (line.trim().isEmpty())
		    continue;

		String[] cols = line.split(",", -1);
		if (cols.length <= CSV_TIME)
		    throw(new IllegalArgumentException(String.format("%s:%d: expected at least %d columns, found %d",
								     path, lineNum, CSV_TIME + 1, cols.length)));
		try
		{
		    double mr = Double.parseDouble(cols[CSV_RANGE].trim());
		    double ma = Double.parseDouble(cols[CSV_AZIMUTH].trim());
		    double me = Double.parseDouble(cols[CSV_ELEVATION].trim());
		    double mt = Double.parseDouble(cols[CSV_TIME].trim());
		    double[] xyz = Utilities.sph2cart(ma, me, mr);
		    list.add(new Measurement(xyz[0], xyz[1], xyz[2], mt));
		}
		catch (NumberFormatException e)
		{
		    throw(new IllegalArgumentException(String.format("%s:%d: %s", path, lineNum, e.getMessage()), e));
		}
	    }
	}

	log.info("Read {} measurements from {}", list.size(), path);
	return(new Measurements(list));
    }

    static Measurement toMeasurement(JSONMeasurement jm, int index)
    {
	if (jm == null || jm.Time == null)
	    throw(new IllegalArgumentException(String.format("Measurement %d has no Time", index)));

	if (jm.X != null && jm.Y != null && jm.Z != null)
	    return(new Measurement(jm.X, jm.Y, jm.Z, jm.Time));

	if (jm.Range != null && jm.Azimuth != null && jm.Elevation != null)
	{
	    double[] xyz = Utilities.sph2cart(jm.Azimuth, jm.Elevation, jm.Range);
	    return(new Measurement(xyz[0], xyz[1], xyz[2], jm.Time));
	}

	throw(new IllegalArgumentException(String.format(
		  "Measurement %d needs either X, Y, Z or Range, Azimuth, Elevation", index)));
    }
}
