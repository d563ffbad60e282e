package com.elphel.stereobp.bp;
/**
 **
 ** ShapeMismatchException - stereo pair images of different size or channel count
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ShapeMismatchException.java is free software: you can redistribute it and/or modify
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

public class ShapeMismatchException extends IllegalArgumentException {
	private static final long serialVersionUID = -2205987130913545147L;

	public ShapeMismatchException(StereoImage first, StereoImage second) {
		super("Stereo images do not match: "+first.shapeString()+" vs "+second.shapeString());
	}
}
