package com.elphel.stereobp.readers;
/**
 **
 ** GaussianSmoothing - Gaussian pre-filtering of stereo images
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  GaussianSmoothing.java is free software: you can redistribute it and/or modify
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

import com.elphel.stereobp.bp.StereoImage;

import ij.plugin.filter.GaussianBlur;
import ij.process.FloatProcessor;

public class GaussianSmoothing {
	public static final double ACCURACY = 0.002; // kernel cut-off, relative

	/**
	 * Blur every channel with a Gaussian of the same sigma in both directions.
	 * @param image source image, not modified
	 * @param sigma Gaussian sigma in pixels, <= 0 returns the source image
	 * @return blurred image
	 */
	public static StereoImage smooth(
			StereoImage image,
			double      sigma)
	{
		if (sigma <= 0) {
			return image;
		}
		int width =    image.getWidth();
		int height =   image.getHeight();
		int channels = image.getChannels();
		double [] pixels = new double [width * height * channels];
		GaussianBlur gb = new GaussianBlur();
		for (int c = 0; c < channels; c++) {
			FloatProcessor fp = new FloatProcessor(width, height, image.getChannel(c));
			gb.blurGaussian(fp, sigma, sigma, ACCURACY);
			float [] fpixels = (float []) fp.getPixels();
			for (int i = 0; i < fpixels.length; i++) {
				pixels[i * channels + c] = fpixels[i];
			}
		}
		return new StereoImage(width, height, channels, pixels);
	}

	public static StereoImage [] smoothPair(
			StereoImage [] pair,
			double         sigma)
	{
		return new StereoImage [] {smooth(pair[0], sigma), smooth(pair[1], sigma)};
	}
}
