/**
** -----------------------------------------------------------------------------**
** BlurProcessorTest.java
**
** Tests of request coordination, caching and cancellation
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  BlurProcessorTest.java is free software: you can redistribute it and/or modify
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
package com.elphel.imagej.blur;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import junit.framework.TestCase;

public class BlurProcessorTest extends TestCase {

	private static final long TIMEOUT_MS = 10000;

	private RecordingListener listener;
	private BlurProcessor processor;

	/* keeps every notification in arrival order */
	private static class RecordingListener implements BlurListener {
		final List<String> events = new ArrayList<String>();
		final List<BlurOutcome> outcomes = new ArrayList<BlurOutcome>();
		final List<ProcessingHandle> handles = new ArrayList<ProcessingHandle>();

		public synchronized void blurPreview(ProcessingHandle handle, PixelBuffer preview) {
			events.add("preview#" + handle.getRequestId());
		}

		public synchronized void blurCompleted(ProcessingHandle handle, BlurOutcome outcome) {
			events.add(outcome.getStatus() + "#" + handle.getRequestId());
			outcomes.add(outcome);
			handles.add(handle);
		}

		synchronized int count(BlurOutcome.Status status) {
			int n = 0;
			for (BlurOutcome outcome : outcomes) if (outcome.getStatus() == status) n++;
			return n;
		}

		synchronized List<String> events() {
			return new ArrayList<String>(events);
		}
	}

	/* holds jobs of one radius until they are cancelled */
	private static class GatedBlur extends SeparableGaussianBlur {
		final int gatedRadius;
		final CountDownLatch started = new CountDownLatch(1);

		GatedBlur(int gatedRadius) {
			super(2, 0);
			this.gatedRadius = gatedRadius;
		}

		@Override
		public PixelBuffer blur(PixelBuffer source, BlurKernel kernel, AtomicBoolean cancelled)
				throws BlurException, BlurCancelledException {
			if (kernel.getRadius() == gatedRadius) {
				started.countDown();
				long deadline = System.currentTimeMillis() + TIMEOUT_MS;
				while (!cancelled.get() && (System.currentTimeMillis() < deadline)) {
					try {
						Thread.sleep(1);
					} catch (InterruptedException e) {
						throw new BlurCancelledException("interrupted");
					}
				}
			}
			return super.blur(source, kernel, cancelled);
		}
	}

	/* fails the first convolution */
	private static class FailingOnceBlur extends SeparableGaussianBlur {
		boolean failed = false;

		FailingOnceBlur() {
			super(2, 0);
		}

		@Override
		public PixelBuffer blur(PixelBuffer source, BlurKernel kernel, AtomicBoolean cancelled)
				throws BlurException, BlurCancelledException {
			if (!failed) {
				failed = true;
				throw new BlurException(BlurException.Reason.ALLOCATION_ERROR, "no memory for test");
			}
			return super.blur(source, kernel, cancelled);
		}
	}

	private static BlurProcessorConfiguration configuration() {
		BlurProcessorConfiguration configuration = new BlurProcessorConfiguration();
		configuration.workerConcurrency = 2;
		configuration.engineThreads = 2;
		configuration.debugLevel = 0;
		configuration.cacheMemoryBudgetBytes = 10L * 1024 * 1024;
		return configuration;
	}

	private BlurProcessor createProcessor(SeparableGaussianBlur engine) {
		return new BlurProcessor(configuration(), engine, null, listener);
	}

	private static PixelBuffer randomImage(int width, int height, int channels) {
		byte [] pixels = new byte[width * height * channels];
		new Random(42).nextBytes(pixels);
		return new PixelBuffer(width, height, channels, pixels);
	}

	private static BlurOutcome await(ProcessingHandle handle) throws InterruptedException {
		BlurOutcome outcome = handle.waitForOutcome(TIMEOUT_MS, TimeUnit.MILLISECONDS);
		assertNotNull("no outcome for " + handle, outcome);
		return outcome;
	}

	@Override
	protected void setUp() throws Exception {
		super.setUp();
		listener = new RecordingListener();
	}

	@Override
	protected void tearDown() throws Exception {
		if (processor != null) {
			processor.shutdown();
			processor.awaitTermination(TIMEOUT_MS, TimeUnit.MILLISECONDS);
		}
		super.tearDown();
	}

	public void testZeroIntensityDeliversSourceUnchanged() throws Exception {
		processor = createProcessor(new SeparableGaussianBlur(2, 0));
		PixelBuffer source = PixelBuffer.solid(4, 4, 3, 10, 120, 250, 0);
		processor.setSourceImage("img", source);
		ProcessingHandle handle = processor.submitBlur("img", 0.0);
		assertTrue(handle.isDone());
		BlurOutcome outcome = handle.getOutcome();
		assertTrue(outcome.isReady());
		assertSame(source, outcome.getBuffer());
		assertEquals(0, processor.getEngine().getInvocationCount());
		assertEquals(0, processor.getCache().size());
		assertEquals(1, listener.count(BlurOutcome.Status.READY));
	}

	public void testSolidImageStaysSolidWithLargeRadius() throws Exception {
		processor = createProcessor(new SeparableGaussianBlur(2, 0));
		PixelBuffer source = PixelBuffer.solid(4, 4, 4, 10, 120, 250, 128);
		processor.setSourceImage("img", source);
		ProcessingHandle handle = processor.submitBlur("img", 2.0);
		assertEquals(10, handle.getRadius());
		BlurOutcome outcome = await(handle);
		assertTrue(outcome.isReady());
		assertFalse(outcome.isFromCache());
		assertEquals(4, outcome.getBuffer().getWidth());
		assertEquals(4, outcome.getBuffer().getHeight());
		assertTrue(outcome.getBuffer().samePixels(source));
		assertEquals(ProcessingHandle.State.COMPLETED, handle.getState());
		assertNull(processor.getRunning("img"));
	}

	public void testRepeatedRequestIsServedFromCache() throws Exception {
		processor = createProcessor(new SeparableGaussianBlur(2, 0));
		processor.setSourceImage("img", randomImage(32, 24, 3));
		BlurOutcome first = await(processor.submitBlur("img", 5.0));
		ProcessingHandle second = processor.submitBlur("img", 5.0);
		assertTrue(second.isDone());
		assertTrue(second.getOutcome().isFromCache());
		assertSame(first.getBuffer(), second.getOutcome().getBuffer());
		assertEquals(1, processor.getEngine().getInvocationCount());
		assertEquals(2, listener.count(BlurOutcome.Status.READY));
		assertEquals(1, processor.getCache().getStats().hitCount);
	}

	public void testIntensitiesOfSameRadiusShareCacheEntry() throws Exception {
		processor = createProcessor(new SeparableGaussianBlur(2, 0));
		processor.setSourceImage("img", randomImage(16, 16, 3));
		await(processor.submitBlur("img", 1.0));
		ProcessingHandle handle = processor.submitBlur("img", 1.02);
		assertTrue(handle.getOutcome().isFromCache());
		assertEquals(1, processor.getEngine().getInvocationCount());
	}

	public void testNewRequestSupersedesRunningOne() throws Exception {
		GatedBlur engine = new GatedBlur(25);
		processor = createProcessor(engine);
		processor.setSourceImage("img", randomImage(40, 30, 4));
		ProcessingHandle first = processor.submitBlur("img", 5.0);
		assertTrue(engine.started.await(TIMEOUT_MS, TimeUnit.MILLISECONDS));
		assertSame(first, processor.getRunning("img"));
		ProcessingHandle second = processor.submitBlur("img", 8.0);
		assertEquals(ProcessingHandle.State.CANCELLED, first.getState());
		assertTrue(first.isCancelled());
		BlurOutcome outcome = await(second);
		assertTrue(outcome.isReady());
		assertEquals(40, second.getRadius());
		processor.shutdown();
		assertTrue(processor.awaitTermination(TIMEOUT_MS, TimeUnit.MILLISECONDS));
		assertEquals(1, listener.count(BlurOutcome.Status.READY));
		List<String> events = listener.events();
		assertEquals("CANCELLED#" + first.getRequestId(), events.get(0));
		assertEquals("READY#" + second.getRequestId(), events.get(1));
		assertEquals(2, events.size());
		assertFalse(processor.getCache().contains(new BlurCacheKey("img", 25)));
		assertTrue(processor.getCache().contains(new BlurCacheKey("img", 40)));
	}

	public void testExplicitCancel() throws Exception {
		GatedBlur engine = new GatedBlur(10);
		processor = createProcessor(engine);
		processor.setSourceImage("img", randomImage(20, 20, 3));
		ProcessingHandle handle = processor.submitBlur("img", 2.0);
		assertTrue(engine.started.await(TIMEOUT_MS, TimeUnit.MILLISECONDS));
		assertTrue(processor.cancelBlur(handle));
		assertFalse(processor.cancelBlur(handle));
		assertEquals(BlurOutcome.Status.CANCELLED, await(handle).getStatus());
		assertNull(processor.getRunning("img"));
		processor.shutdown();
		assertTrue(processor.awaitTermination(TIMEOUT_MS, TimeUnit.MILLISECONDS));
		assertEquals(0, processor.getCache().size());
		assertEquals(1, listener.events().size());
	}

	public void testCancelAfterCompletionReturnsFalse() throws Exception {
		processor = createProcessor(new SeparableGaussianBlur(2, 0));
		processor.setSourceImage("img", randomImage(8, 8, 3));
		ProcessingHandle handle = processor.submitBlur("img", 1.0);
		await(handle);
		assertFalse(processor.cancel(handle));
		assertEquals(ProcessingHandle.State.COMPLETED, handle.getState());
	}

	public void testFailureIsReportedAndProcessorStaysUsable() throws Exception {
		processor = createProcessor(new FailingOnceBlur());
		processor.setSourceImage("img", randomImage(16, 16, 3));
		ProcessingHandle failed = processor.submitBlur("img", 3.0);
		BlurOutcome outcome = await(failed);
		assertEquals(BlurOutcome.Status.FAILED, outcome.getStatus());
		assertEquals(BlurException.Reason.ALLOCATION_ERROR, outcome.getReason());
		assertEquals(ProcessingHandle.State.FAILED, failed.getState());
		assertEquals(0, processor.getCache().size());
		BlurOutcome retry = await(processor.submitBlur("img", 3.0));
		assertTrue(retry.isReady());
		assertEquals(1, processor.getCache().size());
	}

	public void testUnknownImageIsInvalidRequest() throws Exception {
		processor = createProcessor(new SeparableGaussianBlur(2, 0));
		ProcessingHandle handle = processor.submitBlur("missing", 3.0);
		assertTrue(handle.isDone());
		assertEquals(BlurException.Reason.INVALID_REQUEST, handle.getOutcome().getReason());
	}

	public void testNaNIntensityIsInvalidRequest() throws Exception {
		processor = createProcessor(new SeparableGaussianBlur(2, 0));
		processor.setSourceImage("img", randomImage(8, 8, 3));
		ProcessingHandle handle = processor.submitBlur("img", Double.NaN);
		assertEquals(BlurOutcome.Status.FAILED, handle.getOutcome().getStatus());
		assertEquals(BlurException.Reason.INVALID_REQUEST, handle.getOutcome().getReason());
	}

	public void testOutOfRangeIntensityIsClamped() throws Exception {
		processor = createProcessor(new SeparableGaussianBlur(2, 0));
		processor.setSourceImage("img", randomImage(8, 8, 3));
		ProcessingHandle high = processor.submitBlur("img", 14.0);
		assertEquals(50, high.getRadius());
		assertTrue(await(high).isReady());
		ProcessingHandle low = processor.submitBlur("img", -2.0);
		assertEquals(0, low.getRadius());
		assertSame(processor.getSourceImage("img"), low.getOutcome().getBuffer());
	}

	public void testInvalidateImageDropsCacheAndSource() throws Exception {
		processor = createProcessor(new SeparableGaussianBlur(2, 0));
		processor.setSourceImage("a", randomImage(8, 8, 3));
		processor.setSourceImage("b", randomImage(8, 8, 3));
		await(processor.submitBlur("a", 1.0));
		await(processor.submitBlur("b", 1.0));
		assertTrue(processor.invalidateImage("a"));
		assertFalse(processor.invalidateImage("a"));
		assertNull(processor.getSourceImage("a"));
		assertEquals(1, processor.getCache().size());
		assertEquals(BlurOutcome.Status.FAILED, processor.submitBlur("a", 1.0).getOutcome().getStatus());
	}

	public void testReplacingSourceInvalidatesCachedResults() throws Exception {
		processor = createProcessor(new SeparableGaussianBlur(2, 0));
		processor.setSourceImage("img", randomImage(8, 8, 3));
		await(processor.submitBlur("img", 1.0));
		PixelBuffer replacement = PixelBuffer.solid(6, 6, 3, 5, 5, 5, 0);
		processor.setSourceImage("img", replacement);
		assertEquals(0, processor.getCache().size());
		BlurOutcome outcome = await(processor.submitBlur("img", 1.0));
		assertFalse(outcome.isFromCache());
		assertTrue(outcome.getBuffer().samePixels(replacement));
	}

	public void testTooLargeSourceIsRejected() {
		processor = createProcessor(new SeparableGaussianBlur(2, 0));
		try {
			processor.setSourceImage("img", PixelBuffer.solid(PixelBuffer.MAX_IMAGE_DIMENSION + 1, 1, 3, 0, 0, 0, 0));
			fail();
		} catch (BlurException e) {
			assertEquals(BlurException.Reason.INVALID_REQUEST, e.getReason());
		}
	}

	public void testProgressivePreviewPrecedesResult() throws Exception {
		BlurProcessorConfiguration configuration = configuration();
		configuration.progressive = true;
		processor = new BlurProcessor(configuration, new SeparableGaussianBlur(2, 0), null, listener);
		processor.setSourceImage("img", randomImage(24, 24, 3));
		ProcessingHandle handle = processor.submitBlur("img", 4.0);
		BlurOutcome outcome = await(handle);
		assertTrue(outcome.isReady());
		List<String> events = listener.events();
		assertEquals("preview#" + handle.getRequestId(), events.get(0));
		assertEquals("READY#" + handle.getRequestId(), events.get(1));
		assertEquals(2, processor.getEngine().getInvocationCount());
		assertEquals(1, processor.getCache().size());
	}

	public void testListenerNotifiedOnce() throws Exception {
		BlurListener mockListener = mock(BlurListener.class);
		processor = new BlurProcessor(configuration(), new SeparableGaussianBlur(2, 0), null, mockListener);
		processor.setSourceImage("img", randomImage(12, 12, 4));
		ProcessingHandle handle = processor.submitBlur("img", 3.0);
		verify(mockListener, timeout(TIMEOUT_MS)).blurCompleted(eq(handle), any(BlurOutcome.class));
		verify(mockListener, never()).blurPreview(any(ProcessingHandle.class), any(PixelBuffer.class));
		assertTrue(handle.getOutcome().isReady());
	}

	/* the listener passes computed results to a display thread and waits for it */
	public void testListenerMayWaitForDisplayThreadUsingProcessor() throws Exception {
		final ExecutorService display = Executors.newSingleThreadExecutor();
		final List<ProcessingHandle> fromDisplay = Collections.synchronizedList(new ArrayList<ProcessingHandle>());
		final List<Exception> errors = Collections.synchronizedList(new ArrayList<Exception>());
		BlurListener waitingListener = new BlurListener() {
			public void blurPreview(ProcessingHandle handle, PixelBuffer preview) {
				listener.blurPreview(handle, preview);
			}

			public void blurCompleted(ProcessingHandle handle, BlurOutcome outcome) {
				listener.blurCompleted(handle, outcome);
				if (!outcome.isReady() || outcome.isFromCache()) return;
				Future<ProcessingHandle> task = display.submit(new Callable<ProcessingHandle>() {
					public ProcessingHandle call() {
						assertNull(processor.getRunning("img"));
						return processor.submitBlur("img", 2.0);
					}
				});
				try {
					fromDisplay.add(task.get(TIMEOUT_MS, TimeUnit.MILLISECONDS));
				} catch (Exception e) {
					errors.add(e);
				}
			}
		};
		try {
			processor = new BlurProcessor(configuration(), new SeparableGaussianBlur(2, 0), null, waitingListener);
			processor.setSourceImage("img", randomImage(16, 16, 3));
			ProcessingHandle first = processor.submitBlur("img", 2.0);
			assertTrue(await(first).isReady());
			assertTrue(errors.toString(), errors.isEmpty());
			assertEquals(1, fromDisplay.size());
			ProcessingHandle second = fromDisplay.get(0);
			assertTrue(await(second).isFromCache());
			List<String> events = listener.events();
			assertEquals(2, events.size());
			assertEquals("READY#" + first.getRequestId(), events.get(0));
			assertEquals("READY#" + second.getRequestId(), events.get(1));
		} finally {
			display.shutdownNow();
		}
	}

	public void testSubmitFromListenerIsNotNested() throws Exception {
		final List<String> order = Collections.synchronizedList(new ArrayList<String>());
		final List<ProcessingHandle> submitted = Collections.synchronizedList(new ArrayList<ProcessingHandle>());
		BlurListener reentrantListener = new BlurListener() {
			public void blurPreview(ProcessingHandle handle, PixelBuffer preview) {
			}

			public void blurCompleted(ProcessingHandle handle, BlurOutcome outcome) {
				order.add("begin#" + handle.getRequestId());
				if ((handle.getRadius() == 0) && submitted.isEmpty()) {
					submitted.add(processor.submitBlur("img", 0.0));
					submitted.add(processor.submitBlur("img", 1.0));
				}
				order.add("end#" + handle.getRequestId());
			}
		};
		processor = new BlurProcessor(configuration(), new SeparableGaussianBlur(2, 0), null, reentrantListener);
		processor.setSourceImage("img", randomImage(8, 8, 3));
		ProcessingHandle zero = processor.submitBlur("img", 0.0);
		assertTrue(await(zero).isReady());
		assertEquals(2, submitted.size());
		ProcessingHandle nested = submitted.get(0);
		ProcessingHandle computed = submitted.get(1);
		assertEquals(BlurOutcome.Status.READY, await(computed).getStatus());
		// the nested radius 0 request is notified after the call that submitted it has returned
		List<String> expected = new ArrayList<String>();
		expected.add("begin#" + zero.getRequestId());
		expected.add("end#" + zero.getRequestId());
		expected.add("begin#" + nested.getRequestId());
		expected.add("end#" + nested.getRequestId());
		synchronized (order) {
			assertEquals(expected, order.subList(0, 4));
		}
	}

	public void testShutdownRejectsNewRequests() throws Exception {
		processor = createProcessor(new SeparableGaussianBlur(2, 0));
		processor.setSourceImage("img", randomImage(8, 8, 3));
		processor.shutdown();
		ProcessingHandle handle = processor.submitBlur("img", 3.0);
		assertEquals(BlurException.Reason.INVALID_REQUEST, handle.getOutcome().getReason());
	}
}
