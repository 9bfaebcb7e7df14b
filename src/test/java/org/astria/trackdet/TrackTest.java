/*
 * TrackTest.java - Tests for tracks.
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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.hipparchus.linear.MatrixUtils;
import org.junit.jupiter.api.Test;

class TrackTest
{
    @Test
    void firstReportInitializesWithZeroVelocity()
    {
	Track track = Track.fromGroup(3, Settings.defaults(),
				      Arrays.asList(new Measurement(4.0, 5.0, 6.0, 1.0)));

	assertEquals(3, track.getId());
	assertEquals(1, track.getSteps().size());
	Track.Step step = track.getSteps().get(0);
	assertEquals(Track.STATUS_INITIALIZED, step.getStatus());
	assertArrayEquals(new double[]{4.0, 5.0, 6.0, 0.0, 0.0, 0.0}, step.getEstimatedState(), 0.0);
	assertEquals(1.0, track.getTime(), 0.0);
    }

    @Test
    void laterReportsArePredictedAndUpdated()
    {
	List<Measurement> group = Arrays.asList(new Measurement(0.0, 0.0, 0.0, 0.0),
						new Measurement(0.0, 10.0, 0.0, 10.0));
	Track track = Track.fromGroup(0, Settings.defaults(), group);

	assertEquals(2, track.getSteps().size());
	Track.Step step = track.getSteps().get(1);
	assertEquals(Track.STATUS_UPDATED, step.getStatus());
	assertNull(step.getMessage());
	assertEquals(10.0, step.getTime(), 0.0);
	assertEquals(100.0/122.0, step.getEstimatedState()[4], 1E-9);
	assertEquals(6, step.getEstimatedCovariance().length);
	assertEquals(10.0, track.getTime(), 0.0);
    }

    @Test
    void numericalFailureKeepsPredictedState()
    {
	CVFilter filt = new CVFilter(0.0, MatrixUtils.createRealMatrix(3, 3), MatrixUtils.createRealMatrix(6, 6),
				     Settings.ORDERING_PREDICTED, 1E12);
	Track track = new Track(1, filt, new Measurement(1.0, 2.0, 3.0, 0.0));

	Track.Step step = track.process(new Measurement(9.0, 9.0, 9.0, 4.0));

	assertEquals(Track.STATUS_SKIPPED, step.getStatus());
	assertTrue(step.getMessage().contains("Innovation covariance"));
	assertArrayEquals(new double[]{1.0, 2.0, 3.0}, track.getPosition().toArray(), 0.0);
	assertEquals(4.0, track.getTime(), 0.0);
    }

    @Test
    void emptyGroupIsRejected()
    {
	assertThrows(IllegalArgumentException.class,
		     () -> Track.fromGroup(0, Settings.defaults(), new ArrayList<Measurement>()));
    }
}
