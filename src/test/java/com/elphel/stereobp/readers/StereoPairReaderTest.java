package com.elphel.stereobp.readers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.elphel.stereobp.bp.ShapeMismatchException;
import com.elphel.stereobp.bp.StereoImage;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;

class StereoPairReaderTest {

	@Test
	void colorBecomesThreeChannels() {
		ColorProcessor cp = new ColorProcessor(2, 1, new int [] {0x102030, 0xff0080});
		StereoImage image = StereoPairReader.toStereoImage(new ImagePlus("rgb", cp));

		assertEquals(3, image.getChannels());
		assertEquals(0x10, image.get(0, 0, 0));
		assertEquals(0x20, image.get(0, 0, 1));
		assertEquals(0x30, image.get(0, 0, 2));
		assertEquals(255,  image.get(1, 0, 0));
		assertEquals(0,    image.get(1, 0, 1));
		assertEquals(128,  image.get(1, 0, 2));
	}

	@Test
	void grayBecomesOneChannel() {
		FloatProcessor fp = new FloatProcessor(2, 2, new float [] {1.5f, 2f, -3f, 4f});
		StereoImage image = StereoPairReader.toStereoImage(new ImagePlus("float", fp));

		assertEquals(1, image.getChannels());
		assertEquals(1.5, image.get(0, 0, 0));
		assertEquals(-3,  image.get(0, 1, 0));
	}

	@Test
	void readsPairFromFiles(@TempDir Path dir) throws IOException {
		Path left =  save(dir.resolve("left.png"),  new ByteProcessor(3, 2, new byte [] {0, 10, 20, 30, 40, (byte) 250}));
		Path right = save(dir.resolve("right.png"), new ByteProcessor(3, 2, new byte [] {5, 15, 25, 35, 45, 55}));
		StereoImage [] pair = StereoPairReader.readPair(left, right);

		assertEquals(3, pair[0].getWidth());
		assertEquals(2, pair[0].getHeight());
		assertEquals(250, pair[0].get(2, 1, 0));
		assertEquals(15,  pair[1].get(1, 0, 0));
	}

	@Test
	void rejectsPairOfDifferentSize(@TempDir Path dir) throws IOException {
		Path left =  save(dir.resolve("left.png"),  new ByteProcessor(3, 2));
		Path right = save(dir.resolve("right.png"), new ByteProcessor(2, 2));
		assertThrows(ShapeMismatchException.class, () -> StereoPairReader.readPair(left, right));
	}

	@Test
	void missingFileIsIOException(@TempDir Path dir) {
		assertThrows(IOException.class, () -> StereoPairReader.readImage(dir.resolve("none.png")));
	}

	private static Path save(Path path, ByteProcessor bp) {
		new FileSaver(new ImagePlus(path.getFileName().toString(), bp)).saveAsPng(path.toString());
		return path;
	}
}
