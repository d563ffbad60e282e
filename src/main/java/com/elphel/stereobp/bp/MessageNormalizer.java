package com.elphel.stereobp.bp;
/**
 **
 ** MessageNormalizer - re-centering of messages over labels
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MessageNormalizer.java is free software: you can redistribute it and/or modify
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

public class MessageNormalizer {

	/**
	 * Subtract from every message vector (one pixel, one direction) its mean over
	 * labels. Min-sum messages are defined up to a constant, without this they
	 * drift over the iterations.
	 * @param messages messages to normalize, not modified
	 * @param threadsMax maximal number of threads
	 * @return new messages with zero mean over labels for every pixel and direction
	 */
	public static Messages normalize(
			final Messages messages,
			final int      threadsMax)
	{
		final int width =  messages.getWidth();
		final int height = messages.getHeight();
		final int labels = messages.getNumLabels();
		final MessageField [] normalized = new MessageField [Messages.DIRS];
		for (int dir = 0; dir < Messages.DIRS; dir++) {
			normalized[dir] = new MessageField(dir, width, height, labels);
		}
		MultiThreading.forEachIndex(height, threadsMax, y -> {
			for (int dir = 0; dir < Messages.DIRS; dir++) {
				double [] src = messages.get(dir).data;
				double [] dst = normalized[dir].data;
				for (int x = 0; x < width; x++) {
					int off = (y * width + x) * labels;
					double s = 0;
					for (int l = 0; l < labels; l++) {
						s += src[off + l];
					}
					double avg = s / labels;
					for (int l = 0; l < labels; l++) {
						dst[off + l] = src[off + l] - avg;
					}
				}
			}
		});
		return new Messages(normalized);
	}
}
