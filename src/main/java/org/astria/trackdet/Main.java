/*
 * Main.java - Command line driver.
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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Main
{
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private Main()
    {
    }

    public static void main(String[] args)
    {
	if (args.length < 2 || args.length > 3)
	{
	    System.err.println("Usage: trackdet <config.json> <measurements.json|csv> [<reports.json|csv>]");
	    System.exit(2);
	}

	try
	{
	    for (String s : run(args))
		System.out.println(s);
	}
	catch (IOException e)
	{
	    log.error("Cannot read input", e);
	    System.exit(1);
	}
	catch (IllegalArgumentException e)
	{
	    log.error("Invalid input: {}", e.getMessage());
	    System.exit(1);
	}
    }

    static String[] run(String[] args) throws IOException
    {
	Settings cfg = Settings.loadJSON(readFile(args[0]));
	Measurements obs = load(args[1]);
	Measurements reports = args.length > 2 ? load(args[2]) : Measurements.empty();
	return(new Estimation(cfg, obs, reports).determineTracks());
    }

    static Measurements load(String path) throws IOException
    {
	if (path.toLowerCase().endsWith(".csv"))
	    return(Measurements.readCSV(path));
	return(Measurements.loadJSON(readFile(path)));
    }

    private static String readFile(String path) throws IOException
    {
	return(new String(Files.readAllBytes(Paths.get(path)), StandardCharsets.UTF_8));
    }
}
