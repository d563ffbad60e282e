package com.elphel.stereobp.bp;
/**
 **
 ** CostVolume - truncated photometric matching cost for every pixel and label
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CostVolume.java is free software: you can redistribute it and/or modify
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

/**
 * Data cost volume, {@code get(x, y, l)} is the cost of assigning disparity l
 * to pixel (x, y). All values are in [0, tau] for finite input images. Built
 * once by {@link CostVolumeBuilder}, never modified afterwards.
 */
public class CostVolume extends LabelVolume {
	private final double tau;

	CostVolume(int width, int height, int labels, double tau, double [] data) {
		super(width, height, labels, data);
		this.tau = tau;
	}

	/**
	 * Volume from explicit costs, {@code costs[y][x][l]}. Values are used as
	 * given, no truncation.
	 */
	public static CostVolume fromArray(double [][][] costs, double tau) {
		int height = costs.length;
		int width =  costs[0].length;
		int labels = costs[0][0].length;
		double [] data = new double [width * height * labels];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				if (costs[y][x].length != labels) {
					throw new IllegalArgumentException ("costs["+y+"]["+x+"].length ("+costs[y][x].length+") != labels ("+labels+")");
				}
				System.arraycopy(costs[y][x], 0, data, (y * width + x) * labels, labels);
			}
		}
		return new CostVolume(width, height, labels, tau, data);
	}

	public double getTau() {
		return tau;
	}
}
