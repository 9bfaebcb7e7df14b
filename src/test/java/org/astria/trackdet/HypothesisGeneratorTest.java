/*
 * HypothesisGeneratorTest.java - Tests for hypothesis enumeration.
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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import org.junit.jupiter.api.Test;

class HypothesisGeneratorTest
{
    private static boolean[][] allGated(int tracks, int reports)
    {
	boolean[][] gated = new boolean[tracks][reports];
	for (boolean[] row : gated)
	    Arrays.fill(row, true);
	return(gated);
    }

    @Test
    void closedFormCountMatchesEnumeration()
    {
	assertEquals(2, HypothesisGenerator.countUpperBound(1, 2));
	assertEquals(6, HypothesisGenerator.countUpperBound(2, 2));
	assertEquals(12, HypothesisGenerator.countUpperBound(2, 3));
	assertEquals(0, HypothesisGenerator.countUpperBound(3, 0));
	assertEquals(Long.MAX_VALUE, HypothesisGenerator.countUpperBound(40, 40));

	for (int n = 1; n <= 3; n++)
	{
	    for (int r = 0; r <= 3; r++)
	    {
		int[] tracks = new int[n];
		for (int i = 0; i < n; i++)
		    tracks[i] = i;
		HypothesisGenerator gen = new HypothesisGenerator(new Cluster(tracks, new int[0]), r, allGated(n, r));
		assertEquals(HypothesisGenerator.countUpperBound(n, r), gen.toList().size(), "n=" + n + " r=" + r);
	    }
	}
    }

    @Test
    void noReportIsClaimedTwiceAndSomeTrackIsAssigned()
    {
	Cluster c = new Cluster(new int[]{0, 1, 2}, new int[]{0, 1});
	for (Hypothesis h : new HypothesisGenerator(c, 2, allGated(3, 2)))
	{
	    Set<Integer> seen = new HashSet<Integer>();
	    boolean any = false;
	    for (int i = 0; i < h.size(); i++)
	    {
		assertEquals(c.getTrack(i), h.getTrack(i));
		if (!h.isAssigned(i))
		    continue;
		any = true;
		assertTrue(seen.add(h.getReport(i)), "report reused in " + h);
	    }
	    assertTrue(any);
	}
    }

    @Test
    void pairsOutsideGateAreNeverProposed()
    {
	boolean[][] gated = {{true, false}};
	List<Hypothesis> hyps = new HypothesisGenerator(new Cluster(new int[]{0}, new int[]{0}), 2, gated).toList();

	assertEquals(1, hyps.size());
	assertEquals(0, hyps.get(0).getReport(0));
    }

    @Test
    void enumerationOnlyWalksGatedReports()
    {
	int n = 8;
	int r = 41;
	boolean[][] gated = new boolean[n][r];
	int[] tracks = new int[n];
	for (int t = 0; t < n; t++)
	{
	    tracks[t] = t;
	    gated[t][0] = true;
	}
	HypothesisGenerator gen = new HypothesisGenerator(new Cluster(tracks, new int[]{0}), r, gated);

	assertEquals(255, gen.countUpperBound());
	List<Hypothesis> hyps = assertTimeoutPreemptively(Duration.ofSeconds(5), gen::toList);
	assertEquals(n, hyps.size());
	for (Hypothesis h : hyps)
	    assertEquals(n - 1, countUnassigned(h));
    }

    private static int countUnassigned(Hypothesis h)
    {
	int count = 0;
	for (int i = 0; i < h.size(); i++)
	{
	    if (!h.isAssigned(i))
		count++;
	}
	return(count);
    }

    @Test
    void clusterUsesGlobalTrackIndices()
    {
	boolean[][] gated = allGated(4, 1);
	List<Hypothesis> hyps = new HypothesisGenerator(new Cluster(new int[]{3}, new int[]{0}), 1, gated).toList();

	assertEquals(1, hyps.size());
	assertArrayEquals(new int[][]{{3, 0}}, hyps.get(0).toPairs());
    }

    @Test
    void iterationIsLazyAndRestartable()
    {
	HypothesisGenerator gen = new HypothesisGenerator(new Cluster(new int[]{0, 1}, new int[]{0, 1}), 2,
							  allGated(2, 2));

	Iterator<Hypothesis> first = gen.iterator();
	assertTrue(first.hasNext());
	assertEquals("[(0, 0), (1, -)]", first.next().toString());
	assertEquals(6, gen.toList().size());
	assertEquals("[(0, 0), (1, -)]", gen.iterator().next().toString());

	int count = 1;
	while (first.hasNext())
	{
	    first.next();
	    count++;
	}
	assertEquals(6, count);
	assertThrows(NoSuchElementException.class, first::next);
    }

    @Test
    void noReportsGiveNoHypotheses()
    {
	assertFalse(new HypothesisGenerator(new Cluster(new int[]{0}, new int[0]), 0, new boolean[1][0])
		    .iterator().hasNext());
    }

    @Test
    void greedyTakesNearestPairsFirst()
    {
	Cluster c = new Cluster(new int[]{0, 1}, new int[]{0, 1});
	double[][] d2 = {{1.0, 0.5}, {0.1, 2.0}};
	boolean[][] gated = allGated(2, 2);

	Hypothesis h = HypothesisGenerator.greedy(c, d2, gated);

	assertArrayEquals(new int[][]{{0, 1}, {1, 0}}, h.toPairs());
	assertNull(HypothesisGenerator.greedy(c, d2, new boolean[2][2]));
    }
}
