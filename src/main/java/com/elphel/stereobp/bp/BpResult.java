package com.elphel.stereobp.bp;
/**
 **
 ** BpResult - disparity map and energy trace of a finished run
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BpResult.java is free software: you can redistribute it and/or modify
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

import java.util.Arrays;

public class BpResult {
	private final int       width;
	private final int       height;
	private final int       num_labels;
	private final int []    disparity;
	private final double [] energy;

	public BpResult(
			int       width,
			int       height,
			int       num_labels,
			int []    disparity,
			double [] energy)
	{
		if (disparity.length != (width * height)) {
			throw new IllegalArgumentException ("disparity.length ("+disparity.length+") != width*height ("+(width * height)+")");
		}
		this.width =      width;
		this.height =     height;
		this.num_labels = num_labels;
		this.disparity =  disparity.clone();
		this.energy =     energy.clone();
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public int getNumLabels() {
		return num_labels;
	}

	public int getDisparity(int x, int y) {
		return disparity[y * width + x];
	}

	/** Row-major copy of the disparity map */
	public int [] getDisparity() {
		return disparity.clone();
	}

	public int [][] getDisparityRows() {
		int [][] rows = new int [height][];
		for (int y = 0; y < height; y++) {
			rows[y] = Arrays.copyOfRange(disparity, y * width, (y + 1) * width);
		}
		return rows;
	}

	/** Energy after every iteration, in iteration order */
	public double [] getEnergy() {
		return energy.clone();
	}

	public double getFinalEnergy() {
		return energy[energy.length - 1];
	}
}
