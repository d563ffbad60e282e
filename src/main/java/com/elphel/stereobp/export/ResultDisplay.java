package com.elphel.stereobp.export;
/**
 **
 ** ResultDisplay - showing disparity and energy with ImageJ
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ResultDisplay.java is free software: you can redistribute it and/or modify
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

import java.awt.GraphicsEnvironment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.stereobp.bp.BpResult;

import ij.ImagePlus;
import ij.gui.Plot;

public class ResultDisplay {
	/** Logger for this class. */
	private static final Logger LOGGER =
			LoggerFactory.getLogger(ResultDisplay.class);

	public static Plot energyPlot(
			double [] energy,
			String    title)
	{
		double [] iterations = new double [energy.length];
		for (int i = 0; i < iterations.length; i++) {
			iterations[i] = i;
		}
		Plot plot = new Plot(title, "iteration", "energy");
		plot.addPoints(iterations, energy, Plot.LINE);
		return plot;
	}

	/**
	 * Show the disparity map (gray, 0..num_labels-1) and the energy plot.
	 * @return false if there is no display
	 */
	public static boolean show(
			BpResult result,
			String   title)
	{
		if (GraphicsEnvironment.isHeadless()) {
			LOGGER.warn("Headless environment, results are not shown");
			return false;
		}
		ImagePlus imp = DisparityWriter.toImagePlus(result, false);
		imp.setTitle(title+"-disparity");
		imp.show();
		energyPlot(result.getEnergy(), title+"-energy").show();
		return true;
	}
}
