package com.elphel.stereobp.bp;
/**
 **
 ** MessagePasser - one synchronous round of min-sum message updates
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MessagePasser.java is free software: you can redistribute it and/or modify
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

import static com.elphel.stereobp.bp.Messages.DIRS;
import static com.elphel.stereobp.bp.Messages.DIR_D;
import static com.elphel.stereobp.bp.Messages.DIR_L;
import static com.elphel.stereobp.bp.Messages.DIR_R;
import static com.elphel.stereobp.bp.Messages.DIR_U;

import com.elphel.stereobp.common.MultiThreading;

/**
 * Min-sum update for the Potts prior (0 for equal labels, lambda otherwise):
 * m(l) = min(A(l), lambda + min_l' A(l')), where A is the data cost of the
 * sender plus the messages it received from all neighbors except the
 * recipient. Computed in O(labels) per pixel and direction.
 * <p>
 * Pixel (x,y) receives {@code D} from (x,y+1), {@code U} from (x,y-1),
 * {@code R} from (x+1,y) and {@code L} from (x-1,y) of the previous round.
 */
public class MessagePasser {

	/**
	 * Compute the messages of the next round. Only the previous round and the
	 * cost volume are read, all results go to new fields.
	 * @param cost data cost volume
	 * @param prev messages of the previous round (zeros before the first one)
	 * @param lambda Potts smoothness weight
	 * @param threadsMax maximal number of threads
	 * @return messages of the new round, not normalized
	 */
	public static Messages update(
			final CostVolume cost,
			final Messages   prev,
			final double     lambda,
			final int        threadsMax)
	{
		final int width =  cost.width;
		final int height = cost.height;
		final int labels = cost.labels;
		if ((prev.getWidth() != width) || (prev.getHeight() != height) || (prev.getNumLabels() != labels)) {
			throw new IllegalArgumentException ("Messages "+prev.getWidth()+"x"+prev.getHeight()+"x"+prev.getNumLabels()+
					" do not match cost volume "+width+"x"+height+"x"+labels);
		}
		final double [] c =  cost.data;
		final double [] mu = prev.get(DIR_U).data;
		final double [] md = prev.get(DIR_D).data;
		final double [] ml = prev.get(DIR_L).data;
		final double [] mr = prev.get(DIR_R).data;
		final MessageField [] next = new MessageField[DIRS];
		for (int dir = 0; dir < DIRS; dir++) {
			next[dir] = new MessageField(dir, width, height, labels);
		}
		MultiThreading.forEachIndex(height, threadsMax, y -> {
			double [][] a = new double [DIRS][labels];
			for (int x = 0; x < width; x++) {
				int off =       cost.offset(x, y);
				int off_below = (y < (height - 1)) ? cost.offset(x, y + 1) : -1; // sends D
				int off_above = (y > 0) ?            cost.offset(x, y - 1) : -1; // sends U
				int off_right = (x < (width - 1)) ?  cost.offset(x + 1, y) : -1; // sends R
				int off_left =  (x > 0) ?            cost.offset(x - 1, y) : -1; // sends L
				for (int l = 0; l < labels; l++) {
					double in_u = (off_below >= 0) ? md[off_below + l] : 0.0;
					double in_d = (off_above >= 0) ? mu[off_above + l] : 0.0;
					double in_l = (off_right >= 0) ? mr[off_right + l] : 0.0;
					double in_r = (off_left >= 0)  ? ml[off_left + l]  : 0.0;
					double d = c[off + l];
					a[DIR_U][l] = d + in_d + in_l + in_r;
					a[DIR_D][l] = d + in_u + in_l + in_r;
					a[DIR_L][l] = d + in_u + in_d + in_r;
					a[DIR_R][l] = d + in_u + in_d + in_l;
				}
				for (int dir = 0; dir < DIRS; dir++) {
					if (Messages.hasRecipient(dir, x, y, width, height)) {
						pottsMessage(a[dir], lambda, next[dir].data, off);
					} // messages nobody reads stay zero
				}
			}
		});
		return new Messages(next);
	}

	/**
	 * Closed form min-sum message for the Potts prior.
	 * @param a sender cost per label
	 * @param lambda penalty for different labels
	 * @param dst destination array
	 * @param dst_offset offset of the label vector in dst
	 */
	static void pottsMessage(
			double [] a,
			double    lambda,
			double [] dst,
			int       dst_offset)
	{
		double min_a = a[0];
		for (int l = 1; l < a.length; l++) {
			if (a[l] < min_a) min_a = a[l];
		}
		double cap = lambda + min_a;
		for (int l = 0; l < a.length; l++) {
			dst[dst_offset + l] = Math.min(a[l], cap);
		}
	}
}
