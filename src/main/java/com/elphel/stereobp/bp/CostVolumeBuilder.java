package com.elphel.stereobp.bp;
/**
 **
 ** CostVolumeBuilder - truncated L1 data cost of a rectified stereo pair
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CostVolumeBuilder.java is free software: you can redistribute it and/or modify
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

public class CostVolumeBuilder {
	/** Channel sum divisor, fixed for any number of channels */
	public final static double CHANNEL_NORM = 3.0;

	/**
	 * Build the data cost volume
	 * cost(x,y,l) = min(sum_c |left(x,y,c) - right(x-l,y,c)| / 3, tau).
	 * Column x-l left of the image is wrapped around to the right side
	 * (boundary_wrap) or clamped to column 0.
	 * @param left reference image, disparity is measured for its pixels
	 * @param right matched image, same shape as left
	 * @param num_labels number of disparity labels
	 * @param tau truncation of the cost
	 * @param boundary_wrap true - wrap x-l modulo width, false - clamp to 0
	 * @param threadsMax maximal number of threads
	 * @return new cost volume
	 */
	public static CostVolume build(
			final StereoImage left,
			final StereoImage right,
			final int         num_labels,
			final double      tau,
			final boolean     boundary_wrap,
			final int         threadsMax)
	{
		if (!left.sameShape(right)) {
			throw new ShapeMismatchException(left, right);
		}
		final int width =    left.getWidth();
		final int height =   left.getHeight();
		final int channels = left.getChannels();
		final double [] pix1 = left.pixels();
		final double [] pix2 = right.pixels();
		final double [] cost = new double [width * height * num_labels];
		MultiThreading.forEachIndex(height, threadsMax, y -> {
			for (int x = 0; x < width; x++) {
				int indx1 = (y * width + x) * channels;
				int base = (y * width + x) * num_labels;
				for (int l = 0; l < num_labels; l++) {
					int x2 = boundary_wrap ? Math.floorMod(x - l, width) : Math.max(x - l, 0);
					int indx2 = (y * width + x2) * channels;
					double s = 0;
					for (int c = 0; c < channels; c++) {
						s += Math.abs(pix1[indx1 + c] - pix2[indx2 + c]);
					}
					cost[base + l] = Math.min(s / CHANNEL_NORM, tau); // NaN propagates
				}
			}
		});
		return new CostVolume(width, height, num_labels, tau, cost);
	}

	public static CostVolume build(
			StereoImage  left,
			StereoImage  right,
			BpParameters bpParameters)
	{
		return build(
				left,
				right,
				bpParameters.num_labels,
				bpParameters.tau,
				bpParameters.boundary_wrap,
				bpParameters.threads_max);
	}
}
