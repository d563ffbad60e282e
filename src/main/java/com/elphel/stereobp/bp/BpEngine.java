package com.elphel.stereobp.bp;
/**
 **
 ** BpEngine - loopy belief propagation stereo matcher
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BpEngine.java is free software: you can redistribute it and/or modify
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

import java.util.Objects;
import java.util.concurrent.CancellationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fixed number of min-sum BP rounds over the 4-connected pixel grid.
 * Each round: message update, normalization, beliefs, MAP labels, energy.
 * The energy is only recorded, it never stops the loop.
 * <p>
 * An engine is used once: INIT after construction, ITERATING inside
 * {@link #run()}, DONE when the result is available. An interrupt of the
 * running thread aborts the run with {@link CancellationException}, no
 * partial result is kept. It is checked between rounds, and an interrupt
 * that arrives while a stage waits for its workers stops that stage.
 */
public class BpEngine {
	/** Logger for this class. */
	private static final Logger LOGGER =
			LoggerFactory.getLogger(BpEngine.class);

	public enum State {INIT, ITERATING, DONE}

	private final StereoImage       left;
	private final StereoImage       right;
	private final BpParameters      bpParameters;
	private volatile State          state = State.INIT;
	private IterationListener       listener = null;
	private CostVolume              cost =     null;
	private Messages                messages = null;
	private BpResult                result =   null;

	/**
	 * @param left reference image
	 * @param right matched image
	 * @param bpParameters parameters, copied
	 * @throws ShapeMismatchException if the images differ in size or channels
	 * @throws InvalidParameterException if a parameter is out of range
	 */
	public BpEngine(
			StereoImage  left,
			StereoImage  right,
			BpParameters bpParameters)
	{
		Objects.requireNonNull(left, "left");
		Objects.requireNonNull(right, "right");
		if (!left.sameShape(right)) {
			throw new ShapeMismatchException(left, right);
		}
		bpParameters.validate();
		this.left =         left;
		this.right =        right;
		this.bpParameters = bpParameters.clone();
	}

	public BpEngine setIterationListener(IterationListener listener) {
		this.listener = listener;
		return this;
	}

	public State getState() {
		return state;
	}

	public BpParameters getParameters() {
		return bpParameters.clone();
	}

	/** Cost volume, null before {@link #run()} */
	public CostVolume getCostVolume() {
		return cost;
	}

	/** Messages of the last finished round, null before {@link #run()} */
	public Messages getMessages() {
		return messages;
	}

	/** Result, null until DONE */
	public BpResult getResult() {
		return result;
	}

	/**
	 * Build the cost volume and run all iterations.
	 * @return final disparity map and the energy of every iteration
	 * @throws IllegalStateException if the engine was already run
	 * @throws CancellationException if the thread was interrupted, the interrupt flag stays set
	 */
	public BpResult run() {
		if (state != State.INIT) {
			throw new IllegalStateException ("BpEngine.run(): engine is already "+state);
		}
		if (Thread.currentThread().isInterrupted()) {
			throw new CancellationException("BpEngine.run(): interrupted before start");
		}
		final int threadsMax = bpParameters.threads_max;
		final int width =      left.getWidth();
		final int height =     left.getHeight();
		final int labels =     bpParameters.num_labels;
		long start_time = System.nanoTime();
		LOGGER.info("Starting stereo BP on "+width+"x"+height+"x"+left.getChannels()+" images, "+bpParameters);

		double [] energy = new double [bpParameters.num_iterations];
		int [] disparity = null;
		state = State.ITERATING;
		try {
			cost = CostVolumeBuilder.build(left, right, bpParameters);
			messages = Messages.zeros(width, height, labels);
			for (int iter = 0; iter < bpParameters.num_iterations; iter++) {
				if (Thread.currentThread().isInterrupted()) {
					throw new CancellationException("BpEngine.run(): interrupted before iteration "+iter);
				}
				Messages updated = MessagePasser.update(cost, messages, bpParameters.lambda, threadsMax);
				messages =  MessageNormalizer.normalize(updated, threadsMax);
				// beliefs and labels are not needed for the next round, only for the energy trace
				LabelVolume beliefs = BeliefAggregator.aggregate(cost, messages, threadsMax);
				disparity = Labeler.label(beliefs, threadsMax);
				energy[iter] = EnergyEvaluator.energy(cost, disparity, bpParameters.lambda, threadsMax);
				if (bpParameters.debug_level > 0) {
					LOGGER.info("iteration "+iter+": energy = "+energy[iter]+
							", label changes = "+EnergyEvaluator.countLabelChanges(disparity, width));
				} else {
					LOGGER.debug("iteration {}: energy = {}", iter, energy[iter]);
				}
				if (listener != null) {
					listener.iterationDone(iter, messages, disparity, energy[iter]);
				}
			}
		} catch (RuntimeException e) {
			state = State.INIT;
			cost = null;
			messages = null;
			if (e.getCause() instanceof InterruptedException) {
				// interrupted while waiting for the workers of a stage, the flag is still set
				CancellationException ce = new CancellationException("BpEngine.run(): interrupted during an iteration");
				ce.initCause(e.getCause());
				throw ce;
			}
			throw e;
		}
		result = new BpResult(width, height, labels, disparity, energy);
		state = State.DONE;
		LOGGER.info(String.format("Stereo BP done in %.3f s, final energy = %f",
				(System.nanoTime() - start_time) * 1e-9, result.getFinalEnergy()));
		return result;
	}

	/**
	 * Convenience call: validate, run and return the result.
	 */
	public static BpResult stereoBp(
			StereoImage  left,
			StereoImage  right,
			BpParameters bpParameters)
	{
		return new BpEngine(left, right, bpParameters).run();
	}
}
