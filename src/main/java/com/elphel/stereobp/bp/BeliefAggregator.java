package com.elphel.stereobp.bp;
/**
 **
 ** BeliefAggregator - sum of data cost and messages
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BeliefAggregator.java is free software: you can redistribute it and/or modify
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

public class BeliefAggregator {

	/**
	 * belief(x,y,l) = cost(x,y,l) + U(x,y,l) + D(x,y,l) + L(x,y,l) + R(x,y,l)
	 * @param cost data cost volume
	 * @param messages current (normalized) messages
	 * @param threadsMax maximal number of threads
	 * @return new belief volume
	 */
	public static LabelVolume aggregate(
			final CostVolume cost,
			final Messages   messages,
			final int        threadsMax)
	{
		final int width =  cost.width;
		final int labels = cost.labels;
		final LabelVolume beliefs = new LabelVolume(width, cost.height, labels);
		final double [] c =  cost.data;
		final double [] mu = messages.get(Messages.DIR_U).data;
		final double [] md = messages.get(Messages.DIR_D).data;
		final double [] ml = messages.get(Messages.DIR_L).data;
		final double [] mr = messages.get(Messages.DIR_R).data;
		final double [] b =  beliefs.data;
		MultiThreading.forEachIndex(cost.height, threadsMax, y -> {
			int start = y * width * labels;
			int end =   start + width * labels;
			for (int i = start; i < end; i++) {
				b[i] = c[i] + mu[i] + md[i] + ml[i] + mr[i];
			}
		});
		return beliefs;
	}
}
