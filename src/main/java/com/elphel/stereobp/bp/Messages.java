package com.elphel.stereobp.bp;
/**
 **
 ** Messages - the four directional message fields of one BP round
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Messages.java is free software: you can redistribute it and/or modify
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
 * Message state between BP rounds. A round never updates a {@code Messages}
 * instance, it produces a new one, so the previous round stays readable until
 * the new one is complete.
 * <p>
 * Field {@code U} at row y is read by row y+1, {@code D} at row y by row y-1,
 * {@code L} at column x by column x+1 and {@code R} at column x by column x-1.
 */
public class Messages {
	public final static int      DIR_U = 0;
	public final static int      DIR_D = 1;
	public final static int      DIR_L = 2;
	public final static int      DIR_R = 3;
	public final static int      DIRS =  4;
	public final static String[] DIR_NAMES = {"U", "D", "L", "R"};
	// offset of the pixel that reads a message, {dx, dy}
	final static int [][]        RECIPIENT_XY = {{0, 1}, {0, -1}, {1, 0}, {-1, 0}};

	private final MessageField [] fields;

	Messages(MessageField [] fields) {
		if (fields.length != DIRS) {
			throw new IllegalArgumentException ("fields.length ("+fields.length+") != "+DIRS);
		}
		for (int dir = 0; dir < DIRS; dir++) {
			if ((fields[dir].getDirection() != dir) || !fields[dir].sameShape(fields[0])) {
				throw new IllegalArgumentException ("Message field "+dir+" does not match direction or shape");
			}
		}
		this.fields = fields;
	}

	/** All-zero messages, state before the first round. */
	public static Messages zeros(int width, int height, int labels) {
		MessageField [] fields = new MessageField[DIRS];
		for (int dir = 0; dir < DIRS; dir++) {
			fields[dir] = new MessageField(dir, width, height, labels);
		}
		return new Messages(fields);
	}

	/**
	 * Messages from explicit values, {@code values[dir][y][x][l]}.
	 */
	public static Messages fromArray(double [][][][] values) {
		MessageField [] fields = new MessageField[DIRS];
		for (int dir = 0; dir < DIRS; dir++) {
			CostVolume v = CostVolume.fromArray(values[dir], 0.0);
			fields[dir] = new MessageField(dir, v.width, v.height, v.labels, v.data);
		}
		return new Messages(fields);
	}

	public MessageField get(int dir) {
		return fields[dir];
	}

	public int getWidth() {
		return fields[0].width;
	}

	public int getHeight() {
		return fields[0].height;
	}

	public int getNumLabels() {
		return fields[0].labels;
	}

	public boolean isZero() {
		for (MessageField field : fields) {
			if (!field.isZero()) return false;
		}
		return true;
	}

	/**
	 * Check if the message of pixel (x,y) in direction dir has a pixel to read it.
	 */
	public static boolean hasRecipient(int dir, int x, int y, int width, int height) {
		int rx = x + RECIPIENT_XY[dir][0];
		int ry = y + RECIPIENT_XY[dir][1];
		return (rx >= 0) && (ry >= 0) && (rx < width) && (ry < height);
	}
}
