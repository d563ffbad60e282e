package com.elphel.stereobp.bp;
/**
 **
 ** IterationListener - per-round callback of the BP engine
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  IterationListener.java is free software: you can redistribute it and/or modify
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
 * Receives the state after every BP round. Called on the engine thread between
 * rounds, the arguments must not be modified.
 */
public interface IterationListener {
	void iterationDone(
			int      iteration,
			Messages messages,
			int []   disparity,
			double   energy);
}
