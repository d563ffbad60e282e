package com.elphel.stereobp.readers;
/**
 **
 ** StereoPairReader - reading stereo images into matcher format
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  StereoPairReader.java is free software: you can redistribute it and/or modify
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
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.stereobp.bp.ShapeMismatchException;
import com.elphel.stereobp.bp.StereoImage;

import ij.IJ;
import ij.ImagePlus;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

public class StereoPairReader {
	/** Logger for this class. */
	private static final Logger LOGGER =
			LoggerFactory.getLogger(StereoPairReader.class);

	/**
	 * Read any image format ImageJ opens (PNG, TIFF, JPEG, ...). Only the current
	 * slice of a stack is used.
	 * @param path image file
	 * @return image with 3 channels for RGB, 1 channel otherwise
	 * @throws IOException if the file is missing or can not be decoded
	 */
	public static StereoImage readImage(Path path) throws IOException {
		if (!Files.isRegularFile(path)) {
			throw new IOException("Image file "+path+" does not exist");
		}
		ImagePlus imp = IJ.openImage(path.toString());
		if (imp == null) {
			throw new IOException("ImageJ could not open "+path);
		}
		StereoImage image = toStereoImage(imp);
		LOGGER.debug("Read "+path+": "+image.getWidth()+"x"+image.getHeight()+", "+image.getChannels()+" channel(s)");
		return image;
	}

	/**
	 * Read both images of a rectified pair.
	 * @throws ShapeMismatchException if the images differ in size or channels
	 */
	public static StereoImage [] readPair(
			Path left_path,
			Path right_path) throws IOException
	{
		StereoImage left =  readImage(left_path);
		StereoImage right = readImage(right_path);
		if (!left.sameShape(right)) {
			throw new ShapeMismatchException(left, right);
		}
		LOGGER.info("Read stereo pair "+left_path.getFileName()+", "+right_path.getFileName()+
				" ("+left.getWidth()+"x"+left.getHeight()+")");
		return new StereoImage [] {left, right};
	}

	/**
	 * Convert ImageJ image to floating point pixel vectors. RGB becomes
	 * (R, G, B) in 0..255, gray types keep their calibrated-free values.
	 */
	public static StereoImage toStereoImage(ImagePlus imp) {
		ImageProcessor ip = imp.getProcessor();
		int width =  ip.getWidth();
		int height = ip.getHeight();
		if (ip instanceof ColorProcessor) {
			int length = width * height;
			byte [][] rgb = new byte [3][length];
			((ColorProcessor) ip).getRGB(rgb[0], rgb[1], rgb[2]);
			double [] pixels = new double [3 * length];
			for (int i = 0; i < length; i++) {
				for (int c = 0; c < 3; c++) {
					pixels[3 * i + c] = rgb[c][i] & 0xff;
				}
			}
			return new StereoImage(width, height, 3, pixels);
		}
		double [] pixels = new double [width * height];
		for (int i = 0; i < pixels.length; i++) {
			pixels[i] = ip.getf(i);
		}
		return new StereoImage(width, height, 1, pixels);
	}
}
