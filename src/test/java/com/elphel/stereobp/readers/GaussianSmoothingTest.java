package com.elphel.stereobp.readers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.elphel.stereobp.bp.StereoImage;

class GaussianSmoothingTest {

	@Test
	void zeroSigmaIsNoOp() {
		StereoImage image = StereoImage.fromRows(new double [][] {{1, 2}, {3, 4}});
		assertSame(image, GaussianSmoothing.smooth(image, 0.0));
	}

	@Test
	void blursEachChannelSeparately() {
		int w = 9, h = 9;
		double [] pixels = new double [w * h * 2];
		for (int i = 0; i < w * h; i++) {
			pixels[2 * i + 1] = 50; // channel 1 is flat
		}
		pixels[2 * (4 * w + 4)] = 100; // impulse in channel 0
		StereoImage blurred = GaussianSmoothing.smooth(new StereoImage(w, h, 2, pixels), 1.0);

		assertEquals(2, blurred.getChannels());
		double center = blurred.get(4, 4, 0);
		assertTrue((center > 5) && (center < 100), "center = " + center);
		assertTrue(blurred.get(5, 4, 0) > 0);
		assertEquals(blurred.get(3, 4, 0), blurred.get(5, 4, 0), 1e-4);
		double sum = 0;
		for (double v : blurred.getChannel(0)) sum += v;
		assertEquals(100.0, sum, 0.5);
		for (double v : blurred.getChannel(1)) {
			assertEquals(50.0, v, 1e-3);
		}
	}
}
