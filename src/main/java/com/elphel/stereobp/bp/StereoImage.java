package com.elphel.stereobp.bp;
/**
 **
 ** StereoImage - immutable multi-channel floating point image
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  StereoImage.java is free software: you can redistribute it and/or modify
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

/**
 * Image handed to the matcher: {@code height} rows of {@code width} pixels,
 * each pixel a vector of {@code channels} values stored interleaved in one
 * flat array at {@code (y * width + x) * channels + c}.
 */
public class StereoImage {
	private final int       width;
	private final int       height;
	private final int       channels;
	private final double [] pixels;

	/**
	 * @param width image width
	 * @param height image height
	 * @param channels number of values per pixel (1 - gray, 3 - RGB)
	 * @param pixels interleaved pixel data, copied
	 */
	public StereoImage(
			int       width,
			int       height,
			int       channels,
			double [] pixels)
	{
		if ((width <= 0) || (height <= 0) || (channels <= 0)) {
			throw new IllegalArgumentException ("Image size "+width+"x"+height+"x"+channels+" is not positive");
		}
		if (pixels.length != (width * height * channels)) {
			throw new IllegalArgumentException ("pixels.length ("+pixels.length+") != width*height*channels ("+(width * height * channels)+")");
		}
		this.width =    width;
		this.height =   height;
		this.channels = channels;
		this.pixels =   pixels.clone();
	}

	/**
	 * Single channel image from rows of values, {@code rows[y][x]}.
	 */
	public static StereoImage fromRows(double [][] rows) {
		int h = rows.length;
		int w = (h > 0) ? rows[0].length : 0;
		double [] data = new double [w * h];
		for (int y = 0; y < h; y++) {
			if (rows[y].length != w) {
				throw new IllegalArgumentException ("rows["+y+"].length ("+rows[y].length+") != width ("+w+")");
			}
			System.arraycopy(rows[y], 0, data, y * w, w);
		}
		return new StereoImage(w, h, 1, data);
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public int getChannels() {
		return channels;
	}

	public double get(int x, int y, int c) {
		return pixels[(y * width + x) * channels + c];
	}

	/** Copy of one channel as a row-major width*height array. */
	public double [] getChannel(int c) {
		double [] data = new double [width * height];
		for (int i = 0; i < data.length; i++) {
			data[i] = pixels[i * channels + c];
		}
		return data;
	}

	public boolean sameShape(StereoImage other) {
		return (width == other.width) && (height == other.height) && (channels == other.channels);
	}

	double [] pixels() { // no copy, package use only
		return pixels;
	}

	String shapeString() {
		return width+"x"+height+"x"+channels;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof StereoImage)) return false;
		StereoImage other = (StereoImage) o;
		return sameShape(other) && Arrays.equals(pixels, other.pixels);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * (31 * width + height) + channels) + Arrays.hashCode(pixels);
	}
}
