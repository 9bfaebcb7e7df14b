/*
 * Estimation.java - Track estimation and report association.
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
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.hipparchus.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Estimation
{
    private static final Logger log = LoggerFactory.getLogger(Estimation.class);

    protected Settings cfg;
    protected Measurements obs;
    protected Measurements reports;

    protected ArrayList<Track> tracks = new ArrayList<Track>();
    protected DataAssociation.Result association;

    public Estimation(String cfgjson, String obsjson, String repjson)
    {
	this(Settings.loadJSON(cfgjson), Measurements.loadJSON(obsjson),
	     repjson == null ? Measurements.empty() : Measurements.loadJSON(repjson));
    }

    public Estimation(Settings cfg, Measurements obs, Measurements reports)
    {
	this.cfg = cfg;
	this.obs = obs;
	this.reports = reports == null ? Measurements.empty() : reports;
    }

    /**
     * Builds one filtered track per time group of the measurements, then
     * associates the reports with the tracks.
     *
     * @return JSON documents: track estimates, scored hypotheses, associations
     */
    public String[] determineTracks()
    {
	filterTracks();
	associateReports();

	JSONResults results = new JSONResults();
	for (Track t : tracks)
	{
	    JSONResults.JSONTrack jt = new JSONResults.JSONTrack();
	    jt.Track = t.getId();
	    jt.Estimation = new ArrayList<Track.Step>(t.getSteps());
	    results.Tracks.add(jt);
	}

	List<Hypothesis> hyps = association.getHypotheses();
	double[] probs = association.getProbabilities();
	for (int i = 0; i < hyps.size(); i++)
	{
	    JSONResults.JSONHypothesis jh = new JSONResults.JSONHypothesis();
	    jh.Pairs = hyps.get(i).toPairs();
	    jh.Probability = probs[i];
	    results.Hypotheses.add(jh);
	}

	for (Association a : association.getAssociations())
	{
	    JSONResults.JSONAssociation ja = new JSONResults.JSONAssociation();
	    ja.Report = a.getReport();
	    ja.Track = a.isAssociated() ? Integer.valueOf(a.getTrack()) : null;
	    ja.Probability = a.getProbability();
	    results.Associations.add(ja);
	}

	Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
	return(new String[]{gson.toJson(results.Tracks), gson.toJson(results.Hypotheses),
			    gson.toJson(results.Associations)});
    }

    public List<Track> filterTracks()
    {
	tracks.clear();
	if (obs.size() == 0)
	{
	    log.info("No measurements, nothing to track");
	    return(getTracks());
	}

	List<List<Measurement>> groups = new TrackGrouper(cfg.Grouping.TimeWindow).group(obs.getMeasurements());
	for (int i = 0; i < groups.size(); i++)
	{
	    log.info("Processing group {}/{} ({} measurements)", i + 1, groups.size(), groups.get(i).size());
	    tracks.add(Track.fromGroup(i, cfg, groups.get(i)));
	}

	return(getTracks());
    }

    public DataAssociation.Result associateReports()
    {
	ArrayList<RealVector> positions = new ArrayList<RealVector>(tracks.size());
	for (Track t : tracks)
	    positions.add(t.getPosition());

	association = new DataAssociation(cfg).associate(positions, reports.getMeasurements());
	for (Association a : association.getAssociations())
	{
	    if (a.isAssociated())
		log.info("{}", a);
	}

	return(association);
    }

    public List<Track> getTracks()
    {
	return(Collections.unmodifiableList(tracks));
    }

    public DataAssociation.Result getAssociation()
    {
	return(association);
    }

    static class JSONResults
    {
	static class JSONTrack
	{
	    int Track;
	    ArrayList<Track.Step> Estimation;
	}

	static class JSONHypothesis
	{
	    int[][] Pairs;
	    double Probability;
	}

	static class JSONAssociation
	{
	    int Report;
	    Integer Track;
	    double Probability;
	}

	ArrayList<JSONTrack> Tracks = new ArrayList<JSONTrack>();
	ArrayList<JSONHypothesis> Hypotheses = new ArrayList<JSONHypothesis>();
	ArrayList<JSONAssociation> Associations = new ArrayList<JSONAssociation>();
    }
}
