/*
 * HypothesisGenerator.java - Enumeration of joint assignment hypotheses.
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
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Enumerates the hypotheses of one cluster with a mixed-radix counter: one
 * digit per track, whose base is one more than the number of reports inside
 * that track's gate. Digit 0 leaves the track unassigned and digit v assigns
 * the v-th gated report.
 *
 * A combination is kept when at least one track takes a report and no report
 * is taken twice. Iteration is lazy and each call to {@link #iterator()}
 * starts over.
 */
public class HypothesisGenerator implements Iterable<Hypothesis>
{
    private final int[] tracks;
    private final int numReports;
    private final int[][] candidates;

    public HypothesisGenerator(Cluster cluster, int numReports, boolean[][] gated)
    {
	this.tracks = cluster.getTracks();
	this.numReports = numReports;
	this.candidates = new int[tracks.length][];
	for (int i = 0; i < tracks.length; i++)
	{
	    int n = 0;
	    int[] admitted = new int[numReports];
	    for (int r = 0; r < numReports; r++)
	    {
		if (gated[tracks[i]][r])
		    admitted[n++] = r;
	    }
	    candidates[i] = Arrays.copyOf(admitted, n);
	}
    }

    /**
     * Number of hypotheses over n tracks and r reports when every pair is
     * admissible: the sum over k = 1..min(n, r) of C(n, k)*r!/(r-k)!. Saturates
     * at {@link Long#MAX_VALUE}.
     */
    public static long countUpperBound(int n, int r)
    {
	long total = 0;
	long choose = 1;
	long perm = 1;
	try
	{
	    for (int k = 1; k <= Math.min(n, r); k++)
	    {
		choose = Math.multiplyExact(choose, (long)(n - k + 1))/k;
		perm = Math.multiplyExact(perm, (long)(r - k + 1));
		total = Math.addExact(total, Math.multiplyExact(choose, perm));
	    }
	}
	catch (ArithmeticException e)
	{
	    return(Long.MAX_VALUE);
	}

	return(total);
    }

    /**
     * Bound on the hypotheses of this cluster given its gate: the smaller of
     * the all-admissible count and the number of non-empty digit combinations.
     * Saturates at {@link Long#MAX_VALUE}.
     */
    public long countUpperBound()
    {
	long combinations = 1;
	try
	{
	    for (int[] c : candidates)
		combinations = Math.multiplyExact(combinations, (long)(c.length + 1));
	    combinations--;
	}
	catch (ArithmeticException e)
	{
	    combinations = Long.MAX_VALUE;
	}

	return(Math.min(combinations, countUpperBound(tracks.length, numReports)));
    }

    /**
     * Nearest-first assignment used when a cluster is too large to enumerate:
     * admissible pairs are taken in increasing distance order, skipping tracks
     * and reports already taken.
     *
     * @return the single resulting hypothesis, or null if no pair is admissible
     */
    public static Hypothesis greedy(Cluster cluster, double[][] d2, boolean[][] gated)
    {
	int[] tracks = cluster.getTracks();
	ArrayList<int[]> pairs = new ArrayList<int[]>();
	for (int i = 0; i < tracks.length; i++)
	{
	    for (int r = 0; r < gated[tracks[i]].length; r++)
	    {
		if (gated[tracks[i]][r])
		    pairs.add(new int[]{i, r});
	    }
	}

	pairs.sort((a, b) -> Double.compare(d2[tracks[a[0]]][a[1]], d2[tracks[b[0]]][b[1]]));

	int[] reports = new int[tracks.length];
	Arrays.fill(reports, Hypothesis.UNASSIGNED);
	boolean[] used = new boolean[d2.length == 0 ? 0 : d2[0].length];
	boolean any = false;
	for (int[] p : pairs)
	{
	    if (reports[p[0]] != Hypothesis.UNASSIGNED || used[p[1]])
		continue;
	    reports[p[0]] = p[1];
	    used[p[1]] = true;
	    any = true;
	}

	return(any ? new Hypothesis(tracks, reports) : null);
    }

    public List<Hypothesis> toList()
    {
	long bound = countUpperBound();
	ArrayList<Hypothesis> out = new ArrayList<Hypothesis>((int)Math.min(bound, 1 << 16));
	for (Hypothesis h : this)
	    out.add(h);
	return(out);
    }

    @Override
    public Iterator<Hypothesis> iterator()
    {
	return(new HypothesisIterator());
    }

    private class HypothesisIterator implements Iterator<Hypothesis>
    {
	private final int[] digits = new int[tracks.length];
	private final boolean[] used = new boolean[numReports];
	private boolean exhausted = tracks.length == 0 || numReports == 0;
	private Hypothesis next;

	@Override
	public boolean hasNext()
	{
	    if (next == null && !exhausted)
		next = advance();
	    return(next != null);
	}

	@Override
	public Hypothesis next()
	{
	    if (!hasNext())
		throw(new NoSuchElementException());
	    Hypothesis h = next;
	    next = null;
	    return(h);
	}

	private Hypothesis advance()
	{
	    while (increment())
	    {
		if (valid())
		{
		    int[] reports = new int[digits.length];
		    for (int i = 0; i < digits.length; i++)
			reports[i] = digits[i] == 0 ? Hypothesis.UNASSIGNED : candidates[i][digits[i] - 1];
		    return(new Hypothesis(tracks, reports));
		}
	    }

	    exhausted = true;
	    return(null);
	}

	// Adds one to the counter, least significant digit first.
	private boolean increment()
	{
	    for (int i = 0; i < digits.length; i++)
	    {
		if (++digits[i] <= candidates[i].length)
		    return(true);
		digits[i] = 0;
	    }

	    return(false);
	}

	private boolean valid()
	{
	    Arrays.fill(used, false);
	    boolean any = false;
	    for (int i = 0; i < digits.length; i++)
	    {
		if (digits[i] == 0)
		    continue;
		int r = candidates[i][digits[i] - 1];
		if (used[r])
		    return(false);
		used[r] = true;
		any = true;
	    }

	    return(any);
	}
    }
}
