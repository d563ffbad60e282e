package com.elphel.stereobp.export;
/**
 **
 ** EnergyTraceWriter - saving the per-iteration energy
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  EnergyTraceWriter.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class EnergyTraceWriter {
	/** Logger for this class. */
	private static final Logger LOGGER =
			LoggerFactory.getLogger(EnergyTraceWriter.class);
	public static final String HEADER = "iteration,energy";

	/**
	 * Write one "iteration,energy" line per iteration after a header line.
	 */
	public static void write(
			double [] energy,
			Path      path) throws IOException
	{
		try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			writer.write(HEADER);
			writer.newLine();
			for (int iter = 0; iter < energy.length; iter++) {
				writer.write(iter+","+energy[iter]);
				writer.newLine();
			}
		}
		LOGGER.info("Saved energy trace ("+energy.length+" iterations) to "+path);
	}

	public static String defaultFileName(double lambda) {
		return "energy_"+DisparityWriter.formatNumber(lambda)+".csv";
	}
}
