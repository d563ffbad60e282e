package com.elphel.stereobp.bp;
/**
 **
 ** LabelVolume - per-pixel, per-label array over the image grid
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  LabelVolume.java is free software: you can redistribute it and/or modify
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
 * Flat width x height x labels array, element (x, y, l) is stored at
 * {@code (y * width + x) * labels + l}. Base for the cost volume, the
 * message fields and the beliefs.
 */
public class LabelVolume {
	final int       width;
	final int       height;
	final int       labels;
	final double [] data;

	LabelVolume(int width, int height, int labels) {
		this(width, height, labels, new double [width * height * labels]);
	}

	LabelVolume(int width, int height, int labels, double [] data) {
		if (data.length != (width * height * labels)) {
			throw new IllegalArgumentException ("data.length ("+data.length+") != width*height*labels ("+(width * height * labels)+")");
		}
		this.width =  width;
		this.height = height;
		this.labels = labels;
		this.data =   data;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public int getNumLabels() {
		return labels;
	}

	/** Offset of the label vector of pixel (x,y) */
	int offset(int x, int y) {
		return (y * width + x) * labels;
	}

	public double get(int x, int y, int l) {
		return data[offset(x, y) + l];
	}

	/** Copy of the label vector of pixel (x,y) */
	public double [] getVector(int x, int y) {
		double [] v = new double [labels];
		System.arraycopy(data, offset(x, y), v, 0, labels);
		return v;
	}

	boolean sameShape(LabelVolume other) {
		return (width == other.width) && (height == other.height) && (labels == other.labels);
	}
}
