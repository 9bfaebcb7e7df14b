/*
 * SettingsTest.java - Tests for settings loading.
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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SettingsTest
{
    @Test
    void defaultsAreFilledIn()
    {
	Settings cfg = Settings.loadJSON("");

	assertEquals(20.0, cfg.Filter.PlantNoise, 0.0);
	assertArrayEquals(new double[]{1.0, 1.0, 1.0}, cfg.Filter.MeasurementNoise, 0.0);
	assertEquals(6, cfg.Filter.InitialCovariance.length);
	assertEquals(Settings.ORDERING_PREDICTED, cfg.Filter.InnovationOrdering);
	assertEquals(50.0, cfg.Grouping.TimeWindow, 0.0);
	assertEquals(0.95, cfg.Association.GateProbability, 0.0);
	assertEquals(Settings.CLUSTER_NEAREST, cfg.Association.ClusterPolicy);
	assertEquals(8, cfg.Association.MaxClusterSize);
	assertEquals(Settings.OVERSIZE_GREEDY, cfg.Association.OversizePolicy);
    }

    @Test
    void valuesOverrideDefaults()
    {
	Settings cfg = Settings.loadJSON("{\"Filter\": {\"PlantNoise\": 5.0, \"InnovationOrdering\": \"Prior\"},"
					 + " \"Grouping\": {\"TimeWindow\": 12.5}}");

	assertEquals(5.0, cfg.Filter.PlantNoise, 0.0);
	assertEquals(Settings.ORDERING_PRIOR, cfg.Filter.InnovationOrdering);
	assertEquals(12.5, cfg.Grouping.TimeWindow, 0.0);
	assertEquals(0.95, cfg.Association.GateProbability, 0.0);
	assertEquals(false, CVFilter.fromSettings(cfg).isInnovationPredicted());
	assertEquals(5.0, CVFilter.fromSettings(cfg).getPlantNoise(), 0.0);
    }

    @Test
    void invalidValuesAreRejected()
    {
	assertThrows(IllegalArgumentException.class,
		     () -> Settings.loadJSON("{\"Filter\": {\"InnovationOrdering\": \"Sideways\"}}"));
	assertThrows(IllegalArgumentException.class,
		     () -> Settings.loadJSON("{\"Filter\": {\"MeasurementNoise\": [1.0, 1.0]}}"));
	assertThrows(IllegalArgumentException.class,
		     () -> Settings.loadJSON("{\"Association\": {\"GateCovariance\": [1.0, 0.0, 1.0]}}"));
	assertThrows(IllegalArgumentException.class,
		     () -> Settings.loadJSON("{\"Association\": {\"GateProbability\": 1.5}}"));
	assertThrows(IllegalArgumentException.class, () -> Settings.loadJSON("{\"Filter\": "));
    }

    @Test
    void outOfRangeNumbersAreRejectedNotReplaced()
    {
	assertThrows(IllegalArgumentException.class,
		     () -> Settings.loadJSON("{\"Filter\": {\"PlantNoise\": -5.0}}"));
	assertThrows(IllegalArgumentException.class,
		     () -> Settings.loadJSON("{\"Filter\": {\"MaxConditionNumber\": -1.0}}"));
	assertThrows(IllegalArgumentException.class,
		     () -> Settings.loadJSON("{\"Grouping\": {\"TimeWindow\": 0.0}}"));
	assertThrows(IllegalArgumentException.class,
		     () -> Settings.loadJSON("{\"Association\": {\"GateProbability\": -0.5}}"));
	assertThrows(IllegalArgumentException.class,
		     () -> Settings.loadJSON("{\"Association\": {\"GateProbability\": 0.0}}"));
	assertThrows(IllegalArgumentException.class,
		     () -> Settings.loadJSON("{\"Association\": {\"MaxClusterSize\": 0}}"));
	assertThrows(IllegalArgumentException.class,
		     () -> Settings.loadJSON("{\"Association\": {\"MaxHypotheses\": -3}}"));
    }

    @Test
    void zeroPlantNoiseIsKept()
    {
	Settings cfg = Settings.loadJSON("{\"Filter\": {\"PlantNoise\": 0.0}}");

	assertEquals(0.0, cfg.Filter.PlantNoise, 0.0);
	assertEquals(0.0, CVFilter.fromSettings(cfg).getPlantNoise(), 0.0);
	assertEquals(1E12, cfg.Filter.MaxConditionNumber, 0.0);
    }
}
