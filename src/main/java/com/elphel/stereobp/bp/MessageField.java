package com.elphel.stereobp.bp;
/**
 **
 ** MessageField - messages sent by every pixel in one direction
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MessageField.java is free software: you can redistribute it and/or modify
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

public class MessageField extends LabelVolume {
	private final int dir;

	MessageField(int dir, int width, int height, int labels) {
		super(width, height, labels);
		this.dir = dir;
	}

	MessageField(int dir, int width, int height, int labels, double [] data) {
		super(width, height, labels, data);
		this.dir = dir;
	}

	/** One of {@link Messages#DIR_U}, {@link Messages#DIR_D}, {@link Messages#DIR_L}, {@link Messages#DIR_R} */
	public int getDirection() {
		return dir;
	}

	public boolean isZero() {
		for (double d : data) {
			if (d != 0.0) return false;
		}
		return true;
	}
}
