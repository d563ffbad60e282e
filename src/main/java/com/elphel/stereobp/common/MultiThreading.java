package com.elphel.stereobp.common;
/**
 **
 ** MultiThreading - worker thread arrays for per-row parallel loops
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MultiThreading.java is free software: you can redistribute it and/or modify
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

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

public class MultiThreading {
	public static int THREADS_MAX = 100;
	/* Create a Thread[] array as large as the number of processors available.
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	public static Thread[] newThreadArray() {
		return newThreadArray (THREADS_MAX);
	}
	public static Thread[] newThreadArray(int maxCPUs) {
		int n_cpus = Runtime.getRuntime().availableProcessors();
		if (n_cpus>maxCPUs)n_cpus=maxCPUs;
		if (n_cpus < 1) n_cpus = 1;
		return new Thread[n_cpus];
	}
/* Start all given threads and wait on each of them until all are done.
	 * If the caller is interrupted while waiting, the threads are interrupted and
	 * joined, the caller's interrupt flag is restored and a RuntimeException
	 * caused by the InterruptedException is thrown.
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	public static void startAndJoin(Thread[] threads)
	{
		for (int ithread = 0; ithread < threads.length; ++ithread)
		{
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].start();
		}
		try
		{
			for (int ithread = 0; ithread < threads.length; ++ithread)
				threads[ithread].join();
		} catch (InterruptedException ie)
		{
			// no worker may outlive the call
			for (Thread thread : threads) {
				thread.interrupt();
			}
			joinUninterruptibly(threads);
			Thread.currentThread().interrupt();
			throw new RuntimeException(ie);
		}
	}

	/**
	 * Run a body once for every index in [0, num_items), distributing indices over
	 * a thread array. Returns only after all workers finished, so the caller may
	 * treat the return as a barrier.
	 * @param num_items number of work items (typically image rows)
	 * @param threadsMax maximal number of threads to use
	 * @param body per-item work, must only write data owned by its item
	 * @throws RuntimeException caused by {@link InterruptedException} if the caller
	 * was interrupted while waiting. Workers are stopped and joined first, the
	 * interrupt flag of the caller stays set.
	 */
	public static void forEachIndex(
			final int         num_items,
			final int         threadsMax,
			final IntConsumer body)
	{
		final Thread[] threads = newThreadArray(Math.min(threadsMax, Math.max(num_items, 1)));
		final AtomicInteger ai = new AtomicInteger(0);
		final Throwable [] failure = new Throwable[1];
		for (int ithread = 0; ithread < threads.length; ithread++) {
			threads[ithread] = new Thread() {
				public void run() {
					try {
						for (int item = ai.getAndIncrement(); item < num_items; item = ai.getAndIncrement()) {
							if (isInterrupted()) {
								break;
							}
							body.accept(item);
						}
					} catch (RuntimeException | Error e) {
						synchronized (failure) {
							if (failure[0] == null) failure[0] = e;
						}
						ai.set(num_items); // stop other workers
					}
				}
			};
		}
		startAndJoin(threads);
		if (failure[0] instanceof RuntimeException) throw (RuntimeException) failure[0];
		if (failure[0] instanceof Error)            throw (Error) failure[0];
	}

	private static void joinUninterruptibly(Thread[] threads) {
		boolean interrupted = false;
		for (int ithread = 0; ithread < threads.length; ithread++) {
			while (true) {
				try {
					threads[ithread].join();
					break;
				} catch (InterruptedException ie) {
					interrupted = true;
				}
			}
		}
		if (interrupted) {
			Thread.currentThread().interrupt();
		}
	}
}
