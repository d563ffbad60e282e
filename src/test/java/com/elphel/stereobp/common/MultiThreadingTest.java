package com.elphel.stereobp.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;

import org.junit.jupiter.api.Test;

class MultiThreadingTest {

	@Test
	void everyIndexRunsOnce() {
		AtomicIntegerArray hits = new AtomicIntegerArray(257);
		MultiThreading.forEachIndex(hits.length(), 8, i -> hits.incrementAndGet(i));
		for (int i = 0; i < hits.length(); i++) {
			assertEquals(1, hits.get(i), "index " + i);
		}
	}

	@Test
	void failureInWorkerReachesCaller() {
		IllegalStateException e = assertThrows(IllegalStateException.class,
				() -> MultiThreading.forEachIndex(20, 4, i -> {
					if (i == 13) throw new IllegalStateException("row 13");
				}));
		assertEquals("row 13", e.getMessage());
	}

	@Test
	void threadArrayIsCapped() {
		assertEquals(1, MultiThreading.newThreadArray(1).length);
		assertTrue(MultiThreading.newThreadArray(1000).length <= Runtime.getRuntime().availableProcessors());
		assertEquals(1, MultiThreading.newThreadArray(0).length);
	}

	@Test
	void noItemsIsNoOp() {
		MultiThreading.forEachIndex(0, 4, i -> {
			throw new AssertionError("must not run");
		});
	}

	@Test
	void interruptWhileWaitingStopsWorkers() throws InterruptedException {
		AtomicInteger active = new AtomicInteger();
		AtomicInteger done = new AtomicInteger();
		Thread caller = Thread.currentThread();
		Thread interrupter = new Thread(() -> {
			try {
				Thread.sleep(50);
			} catch (InterruptedException e) {
				return;
			}
			caller.interrupt();
		});
		interrupter.start();
		RuntimeException e;
		boolean flagKept;
		try {
			e = assertThrows(RuntimeException.class, () -> MultiThreading.forEachIndex(1000, 4, i -> {
				active.incrementAndGet();
				try {
					Thread.sleep(10);
				} catch (InterruptedException ie) {
					Thread.currentThread().interrupt();
				} finally {
					active.decrementAndGet();
					done.incrementAndGet();
				}
			}));
		} finally {
			flagKept = Thread.interrupted();
			interrupter.join();
		}
		assertTrue(e.getCause() instanceof InterruptedException);
		assertTrue(flagKept);
		assertEquals(0, active.get());
		assertTrue(done.get() < 1000, done.get() + " items done");
	}
}
