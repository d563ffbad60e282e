package com.elphel.stereobp.export;
/**
 **
 ** DisparityWriter - saving disparity maps as 8-bit images
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DisparityWriter.java is free software: you can redistribute it and/or modify
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

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.stereobp.bp.BpResult;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ByteProcessor;

public class DisparityWriter {
	/** Logger for this class. */
	private static final Logger LOGGER =
			LoggerFactory.getLogger(DisparityWriter.class);

	/**
	 * 8-bit image of the disparity map.
	 * @param result finished BP result
	 * @param stretch false - pixel value is the label, true - labels 0..num_labels-1 mapped to 0..255
	 * @return new ImagePlus, display range set to the label range
	 */
	public static ImagePlus toImagePlus(
			BpResult result,
			boolean  stretch)
	{
		int [] disparity = result.getDisparity();
		int num_labels = result.getNumLabels();
		byte [] bpixels = new byte [disparity.length];
		for (int i = 0; i < disparity.length; i++) {
			int v = disparity[i];
			if (stretch) {
				v = (num_labels > 1) ? (int) Math.round(255.0 * v / (num_labels - 1)) : 0;
			}
			bpixels[i] = (byte) Math.max(0, Math.min(v, 255));
		}
		ImagePlus imp = new ImagePlus("disparity", new ByteProcessor(result.getWidth(), result.getHeight(), bpixels));
		if (stretch) {
			imp.setDisplayRange(0, 255);
		} else {
			imp.setDisplayRange(0, Math.max(num_labels - 1, 1));
		}
		return imp;
	}

	/**
	 * Save disparity map as PNG.
	 * @throws IOException if ImageJ fails to write the file
	 */
	public static void write(
			BpResult result,
			Path     path,
			boolean  stretch) throws IOException
	{
		ImagePlus imp = toImagePlus(result, stretch);
		if (!new FileSaver(imp).saveAsPng(path.toString())) {
			throw new IOException("Failed to save disparity map to "+path);
		}
		LOGGER.info("Saved disparity map to "+path);
	}

	/**
	 * Output name for a lambda value, "disparity_10.png" for 10.0, "disparity_2.5.png" for 2.5
	 */
	public static String defaultFileName(double lambda) {
		return "disparity_"+formatNumber(lambda)+".png";
	}

	static String formatNumber(double d) {
		if ((d == Math.rint(d)) && !Double.isInfinite(d) && (Math.abs(d) < 1e15)) {
			return Long.toString((long) d);
		}
		return Double.toString(d);
	}
}
