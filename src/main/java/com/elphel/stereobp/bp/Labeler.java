package com.elphel.stereobp.bp;
/**
 **
 ** Labeler - MAP label per pixel
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Labeler.java is free software: you can redistribute it and/or modify
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

public class Labeler {

	/**
	 * Select for each pixel the label of the minimal belief. Ties resolve to the
	 * lowest label, NaN never wins over a number (all NaN - label 0).
	 * @param beliefs belief volume
	 * @param threadsMax maximal number of threads
	 * @return row-major width*height array of labels in [0, labels-1]
	 */
	public static int [] label(
			final LabelVolume beliefs,
			final int         threadsMax)
	{
		final int width =  beliefs.width;
		final int labels = beliefs.labels;
		final double [] b = beliefs.data;
		final int [] disparity = new int [width * beliefs.height];
		MultiThreading.forEachIndex(beliefs.height, threadsMax, y -> {
			for (int x = 0; x < width; x++) {
				int pix = y * width + x;
				int off = pix * labels;
				int best = 0;
				double best_value = b[off];
				for (int l = 1; l < labels; l++) {
					double v = b[off + l];
					if (!Double.isNaN(v) && (Double.isNaN(best_value) || (v < best_value))) {
						best_value = v;
						best = l;
					}
				}
				disparity[pix] = best;
			}
		});
		return disparity;
	}
}
