package com.elphel.stereobp.bp;
/**
 **
 ** EnergyEvaluator - MRF energy of a labeling
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  EnergyEvaluator.java is free software: you can redistribute it and/or modify
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

import com.elphel.stereobp.common.MultiThreading;

public class EnergyEvaluator {

	/**
	 * Energy of a labeling: sum of the data costs of the selected labels plus
	 * lambda for every (pixel, existing 4-neighbor) with a different label. An
	 * unordered pair of neighbors is seen from both sides. Used for diagnostics
	 * only.
	 * @param cost data cost volume
	 * @param disparity row-major labels, width*height
	 * @param lambda Potts smoothness weight
	 * @param threadsMax maximal number of threads
	 * @return total energy
	 */
	public static double energy(
			final CostVolume cost,
			final int []     disparity,
			final double     lambda,
			final int        threadsMax)
	{
		final int width =  cost.width;
		final int height = cost.height;
		final int labels = cost.labels;
		if (disparity.length != (width * height)) {
			throw new IllegalArgumentException ("disparity.length ("+disparity.length+") != width*height ("+(width * height)+")");
		}
		final double [] row_data = new double [height];
		final int []    row_diff = new int [height];
		MultiThreading.forEachIndex(height, threadsMax, y -> {
			double data = 0;
			int diff = 0;
			for (int x = 0; x < width; x++) {
				int pix = y * width + x;
				int d = disparity[pix];
				data += cost.data[pix * labels + d];
				if ((y > 0) &&            (disparity[pix - width] != d)) diff++; // above
				if ((y < (height - 1)) && (disparity[pix + width] != d)) diff++; // below
				if ((x > 0) &&            (disparity[pix - 1] != d))     diff++; // left
				if ((x < (width - 1)) &&  (disparity[pix + 1] != d))     diff++; // right
			}
			row_data[y] = data;
			row_diff[y] = diff;
		});
		// sum in row order, result does not depend on the threads
		double total_data = 0;
		long total_diff = 0;
		for (int y = 0; y < height; y++) {
			total_data += row_data[y];
			total_diff += row_diff[y];
		}
		return total_data + lambda * total_diff;
	}

	/**
	 * Number of (pixel, neighbor) pairs with different labels, each unordered
	 * pair counted twice.
	 */
	public static int countLabelChanges(
			int [] disparity,
			int    width)
	{
		int height = disparity.length / width;
		int diff = 0;
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				int pix = y * width + x;
				if ((x < (width - 1)) && (disparity[pix + 1] != disparity[pix]))     diff += 2;
				if ((y < (height - 1)) && (disparity[pix + width] != disparity[pix])) diff += 2;
			}
		}
		return diff;
	}
}
