package com.elphel.stereobp.bp;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;

import org.junit.jupiter.api.Test;

class BpEngineTest {

	private static StereoImage randomImage(int w, int h, int c, long seed) {
		Random rnd = new Random(seed);
		double [] pixels = new double [w * h * c];
		for (int i = 0; i < pixels.length; i++) {
			pixels[i] = 255 * rnd.nextDouble();
		}
		return new StereoImage(w, h, c, pixels);
	}

	/** right image is left shifted by a constant disparity, with some noise */
	private static StereoImage [] shiftedPair(int w, int h, int shift, long seed) {
		Random rnd = new Random(seed);
		double [] right = new double [w * h];
		double [] left =  new double [w * h];
		for (int i = 0; i < right.length; i++) {
			right[i] = 255 * rnd.nextDouble();
		}
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				left[y * w + x] = right[y * w + Math.floorMod(x - shift, w)] + rnd.nextGaussian();
			}
		}
		return new StereoImage [] {new StereoImage(w, h, 1, left), new StereoImage(w, h, 1, right)};
	}

	@Test
	void identicalFlatImagesGiveZeroDisparityAndEnergy() {
		double [][] flat = {{42, 42, 42}, {42, 42, 42}, {42, 42, 42}};
		BpParameters bpp = new BpParameters(2, 10.0, 15.0, 5);
		BpEngine engine = new BpEngine(StereoImage.fromRows(flat), StereoImage.fromRows(flat), bpp);
		BpResult result = engine.run();

		assertEquals(BpEngine.State.DONE, engine.getState());
		assertArrayEquals(new int [9], result.getDisparity());
		assertArrayEquals(new double [5], result.getEnergy(), 0.0);
	}

	@Test
	void strongDataTermWinsOverSmoothness() {
		StereoImage left =  StereoImage.fromRows(new double [][] {{100, 100}});
		StereoImage right = StereoImage.fromRows(new double [][] {{100, 0}});
		BpResult result = BpEngine.stereoBp(left, right, new BpParameters(2, 5.0, 15.0, 10));

		assertArrayEquals(new int [][] {{0, 1}}, result.getDisparityRows());
		// one differing pair seen from both pixels
		for (double e : result.getEnergy()) {
			assertEquals(10.0, e, 1e-9);
		}
	}

	@Test
	void singlePixelKeepsZeroMessages() {
		StereoImage left =  new StereoImage(1, 1, 3, new double [] {10, 20, 30});
		StereoImage right = new StereoImage(1, 1, 3, new double [] {40, 20, 0});
		List<Boolean> zero = new ArrayList<>();
		BpEngine engine = new BpEngine(left, right, new BpParameters(3, 1.0, 15.0, 4))
				.setIterationListener((iter, messages, disparity, energy) -> zero.add(messages.isZero()));
		BpResult result = engine.run();

		assertEquals(List.of(true, true, true, true), zero);
		CostVolume cost = engine.getCostVolume();
		int best = 0;
		for (int l = 1; l < 3; l++) {
			if (cost.get(0, 0, l) < cost.get(0, 0, best)) best = l;
		}
		assertEquals(best, result.getDisparity(0, 0));
	}

	@Test
	void recoversConstantShift() {
		StereoImage [] pair = shiftedPair(24, 10, 3, 21);
		BpParameters bpp = new BpParameters(6, 4.0, 15.0, 20);
		BpResult result = BpEngine.stereoBp(pair[0], pair[1], bpp);

		int [] disparity = result.getDisparity();
		int correct = 0;
		for (int d : disparity) {
			if (d == 3) correct++;
		}
		assertTrue(correct > (0.9 * disparity.length), "only " + correct + " of " + disparity.length + " pixels at shift 3");
	}

	@Test
	void labelsInRangeAndEnergyNonNegative() {
		StereoImage left =  randomImage(11, 8, 3, 1);
		StereoImage right = randomImage(11, 8, 3, 2);
		BpParameters bpp = new BpParameters(7, 8.0, 15.0, 12);
		BpEngine engine = new BpEngine(left, right, bpp);
		BpResult result = engine.run();

		for (int d : result.getDisparity()) {
			assertTrue((d >= 0) && (d < 7), "label " + d);
		}
		double [] energy = result.getEnergy();
		assertEquals(12, energy.length);
		for (double e : energy) {
			assertTrue(e >= 0, "energy " + e);
		}
		assertEquals(EnergyEvaluator.energy(engine.getCostVolume(), result.getDisparity(), 8.0, 1), result.getFinalEnergy(), 1e-9);
	}

	@Test
	void messagesAreNormalizedAfterEveryRound() {
		StereoImage left =  randomImage(5, 4, 1, 3);
		StereoImage right = randomImage(5, 4, 1, 4);
		List<Double> worst = new ArrayList<>();
		new BpEngine(left, right, new BpParameters(4, 6.0, 15.0, 6))
		.setIterationListener((iter, messages, disparity, energy) -> {
			double max_mean = 0;
			for (int dir = 0; dir < Messages.DIRS; dir++) {
				for (int y = 0; y < 4; y++) {
					for (int x = 0; x < 5; x++) {
						double s = 0;
						for (double v : messages.get(dir).getVector(x, y)) s += v;
						max_mean = Math.max(max_mean, Math.abs(s / 4));
					}
				}
			}
			worst.add(max_mean);
		}).run();

		assertEquals(6, worst.size());
		for (double m : worst) {
			assertEquals(0.0, m, 1e-9);
		}
	}

	@Test
	void repeatedRunsAreIdentical() {
		StereoImage left =  randomImage(13, 9, 3, 5);
		StereoImage right = randomImage(13, 9, 3, 6);
		BpParameters bpp = new BpParameters(5, 7.5, 15.0, 8);
		BpResult first = BpEngine.stereoBp(left, right, bpp);
		bpp.threads_max = 1;
		BpResult second = BpEngine.stereoBp(left, right, bpp);

		assertArrayEquals(first.getDisparity(), second.getDisparity());
		assertArrayEquals(first.getEnergy(), second.getEnergy(), 0.0);
	}

	@Test
	void clampModeDiffersOnlyNearLeftEdge() {
		StereoImage left =  randomImage(10, 3, 1, 7);
		StereoImage right = randomImage(10, 3, 1, 8);
		BpParameters bpp = new BpParameters(4, 0.0, 100.0, 1);
		BpEngine wrap = new BpEngine(left, right, bpp);
		wrap.run();
		bpp.boundary_wrap = false;
		BpEngine clamp = new BpEngine(left, right, bpp);
		clamp.run();

		for (int y = 0; y < 3; y++) {
			for (int x = 3; x < 10; x++) {
				assertArrayEquals(wrap.getCostVolume().getVector(x, y), clamp.getCostVolume().getVector(x, y), 0.0);
			}
			assertEquals(Math.abs(left.get(0, y, 0) - right.get(0, y, 0)) / 3, clamp.getCostVolume().get(0, y, 2), 1e-12);
		}
	}

	@Test
	void rejectsInvalidInput() {
		StereoImage a = randomImage(4, 4, 1, 9);
		StereoImage b = randomImage(4, 3, 1, 10);
		assertThrows(ShapeMismatchException.class, () -> new BpEngine(a, b, new BpParameters()));

		InvalidParameterException e = assertThrows(InvalidParameterException.class,
				() -> new BpEngine(a, a, new BpParameters(0, 1.0, 15.0, 5)));
		assertEquals("num_labels", e.getParameterName());
		assertThrows(InvalidParameterException.class, () -> new BpEngine(a, a, new BpParameters(2, 1.0, 15.0, 0)));
		assertThrows(InvalidParameterException.class, () -> new BpEngine(a, a, new BpParameters(2, 1.0, -1.0, 5)));
	}

	@Test
	void runsOnlyOnce() {
		StereoImage a = randomImage(3, 3, 1, 11);
		BpEngine engine = new BpEngine(a, a, new BpParameters(2, 1.0, 15.0, 2));
		assertEquals(BpEngine.State.INIT, engine.getState());
		assertNull(engine.getResult());
		engine.run();
		assertNotNull(engine.getResult());
		assertThrows(IllegalStateException.class, engine::run);
	}

	@Test
	void interruptStopsBetweenRounds() {
		StereoImage left =  randomImage(6, 6, 1, 12);
		StereoImage right = randomImage(6, 6, 1, 13);
		List<Integer> rounds = new ArrayList<>();
		BpEngine engine = new BpEngine(left, right, new BpParameters(3, 2.0, 15.0, 10))
				.setIterationListener((iter, messages, disparity, energy) -> {
					rounds.add(iter);
					if (iter == 1) Thread.currentThread().interrupt();
				});
		try {
			assertThrows(CancellationException.class, engine::run);
		} finally {
			Thread.interrupted(); // clear the flag for other tests
		}
		assertEquals(List.of(0, 1), rounds);
		assertNull(engine.getResult());
		assertEquals(BpEngine.State.INIT, engine.getState());
	}

	@Test
	void interruptFromAnotherThreadCancelsRun() throws InterruptedException {
		StereoImage left =  randomImage(48, 32, 3, 14);
		StereoImage right = randomImage(48, 32, 3, 15);
		CountDownLatch firstRound = new CountDownLatch(1);
		BpEngine engine = new BpEngine(left, right, new BpParameters(16, 2.0, 15.0, 1_000_000))
				.setIterationListener((iter, messages, disparity, energy) -> firstRound.countDown());
		Thread caller = Thread.currentThread();
		Thread interrupter = new Thread(() -> {
			try {
				firstRound.await();
				Thread.sleep(20);
			} catch (InterruptedException e) {
				return;
			}
			caller.interrupt();
		});
		interrupter.start();
		boolean flagKept;
		try {
			assertThrows(CancellationException.class, engine::run);
		} finally {
			flagKept = Thread.interrupted();
			interrupter.join();
		}
		assertTrue(flagKept);
		assertNull(engine.getResult());
		assertNull(engine.getMessages());
		assertEquals(BpEngine.State.INIT, engine.getState());
	}
}
