/**
** -----------------------------------------------------------------------------**
** BlurProcessor.java
**
** Asynchronous, cancellable and cached Gaussian blur of source images
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  BlurProcessor.java is free software: you can redistribute it and/or modify
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

import ij.IJ;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Coordinates blur requests for registered source images.
 * <p>
 * Every source image has at most one running request: a new submission cancels
 * the previous one before anything else is done. Requests with radius 0 return
 * the source itself, cached results are returned from the submitting thread,
 * everything else is convolved on the worker pool. Completion of a job (cache
 * update and outcome) and cancellation are decided under the same lock, so a
 * cancelled job can not write the cache. The listener is called after the lock
 * is released, one call at a time in the order the outcomes were decided, so a
 * cancellation is never delivered after the result of its successor.
 * submit/cancel never wait for a convolution or for the listener.
 */
public class BlurProcessor {
	private final BlurProcessorConfiguration configuration;
	private final SeparableGaussianBlur      engine;
	private final BlurCache                  cache;
	private final BlurListener               listener; // may be null
	private final ExecutorService            executor;
	private final Object                     lock=new Object();
	private final HashMap<String, ImageSlot> slots=new HashMap<String, ImageSlot>(); // guarded by lock
	private final AtomicLong                 nextRequestId=new AtomicLong(1);
	private final ArrayDeque<Delivery>       deliveries=new ArrayDeque<Delivery>(); // guarded by lock
	private boolean                          delivering=false; // guarded by lock
	private boolean                          isShutdown=false; // guarded by lock
	public int debugLevel=1;

	/* source image and its running request */
	private static class ImageSlot {
		final String      sourceImageId;
		final PixelBuffer source;
		ProcessingHandle  running=null;
		ImageSlot(String sourceImageId, PixelBuffer source){
			this.sourceImageId=sourceImageId;
			this.source=source;
		}
	}

	/* listener call decided under the lock, made after it is released */
	private static class Delivery {
		final ProcessingHandle handle;
		final PixelBuffer      preview; // null for the final outcome
		final BlurOutcome      outcome;
		Delivery(ProcessingHandle handle, PixelBuffer preview, BlurOutcome outcome){
			this.handle=handle;
			this.preview=preview;
			this.outcome=outcome;
		}
	}

	public BlurProcessor(BlurProcessorConfiguration configuration, BlurListener listener){
		this(configuration, null, null, listener);
	}

	/**
	 * @param configuration settings, validated (and possibly corrected) here
	 * @param engine        convolution engine, null to create one with configuration.engineThreads
	 * @param cache         result cache, null to create one with the configured budget
	 * @param listener      receives previews and outcomes, may be null (use ProcessingHandle.waitForOutcome())
	 */
	public BlurProcessor(
			BlurProcessorConfiguration configuration,
			SeparableGaussianBlur      engine,
			BlurCache                  cache,
			BlurListener               listener){
		if (configuration==null) configuration=new BlurProcessorConfiguration();
		configuration.validate();
		this.configuration=configuration;
		this.debugLevel=configuration.debugLevel;
		this.engine=(engine!=null)?engine:new SeparableGaussianBlur(configuration.engineThreads, configuration.debugLevel);
		if (cache==null){
			cache=new BlurCache(configuration.cacheMemoryBudgetBytes, configuration.maxCacheEntries);
			cache.debugLevel=configuration.debugLevel;
		}
		this.cache=cache;
		this.listener=listener;
		this.executor=Executors.newFixedThreadPool(configuration.workerConcurrency, new WorkerThreadFactory());
		if (debugLevel>1) System.out.println("BlurProcessor: "+configuration);
	}

	private static class WorkerThreadFactory implements ThreadFactory {
		private static final AtomicInteger poolNumber=new AtomicInteger(1);
		private final AtomicInteger threadNumber=new AtomicInteger(1);
		private final String prefix="blur-"+poolNumber.getAndIncrement()+"-worker-";
		public Thread newThread(Runnable r){
			Thread thread=new Thread(r, prefix+threadNumber.getAndIncrement());
			thread.setDaemon(true);
			thread.setPriority(Thread.NORM_PRIORITY);
			return thread;
		}
	}

	/**
	 * Registers the source image under the id. If the id was used before, its running
	 * request is cancelled and all its cached results are dropped.
	 * @throws BlurException INVALID_REQUEST if the image can not be processed
	 */
	public void setSourceImage(String sourceImageId, PixelBuffer source) throws BlurException {
		if ((sourceImageId==null) || (source==null))
			throw new BlurException(BlurException.Reason.INVALID_REQUEST, "Source image id and image should not be null");
		String problem=source.validate();
		if (problem!=null) throw new BlurException(BlurException.Reason.INVALID_REQUEST, problem);
		synchronized (lock){
			if (isShutdown) throw new BlurException(BlurException.Reason.INVALID_REQUEST, "Blur processor is shut down");
			ImageSlot old=slots.remove(sourceImageId);
			if (old!=null){
				cancelRunning(old);
				cache.invalidate(sourceImageId);
			}
			slots.put(sourceImageId, new ImageSlot(sourceImageId, source));
		}
		flushDeliveries();
		if (debugLevel>1) System.out.println("BlurProcessor: source "+sourceImageId+" set to "+source);
	}

	public PixelBuffer getSourceImage(String sourceImageId){
		synchronized (lock){
			ImageSlot slot=slots.get(sourceImageId);
			return (slot==null)?null:slot.source;
		}
	}

	public ProcessingHandle submitBlur(String sourceImageId, double intensity){
		return submit(new BlurRequest(sourceImageId, intensity));
	}

	/**
	 * Starts blurring, returns immediately. The outcome is delivered to the listener and
	 * through the handle; it may already be there when this method returns (radius 0,
	 * cached result, invalid request). If another thread is notifying the listener at
	 * that moment, the immediate outcome is passed to the listener by that thread.
	 */
	public ProcessingHandle submit(BlurRequest request){
		String sourceImageId=request.getSourceImageId();
		int radius=0;
		BlurException rejected=null;
		try {
			radius=request.getRadius();
		} catch (BlurException e){
			rejected=e;
		}
		ProcessingHandle handle=new ProcessingHandle(nextRequestId.getAndIncrement(), sourceImageId, request.getIntensity(), radius);
		synchronized (lock){
			start(request, handle, rejected);
		}
		flushDeliveries();
		return handle;
	}

	/* called with lock held */
	private void start(BlurRequest request, final ProcessingHandle handle, BlurException rejected){
		String sourceImageId=handle.getSourceImageId();
		int radius=handle.getRadius();
		ImageSlot slot=(sourceImageId==null)?null:slots.get(sourceImageId);
		if ((rejected==null) && isShutdown)
			rejected=new BlurException(BlurException.Reason.INVALID_REQUEST, "Blur processor is shut down");
		if ((rejected==null) && (slot==null))
			rejected=new BlurException(BlurException.Reason.INVALID_REQUEST, "Unknown source image "+sourceImageId);
		if (rejected!=null){
			if (debugLevel>0) IJ.log("Blur request "+request+" rejected: "+rejected.getMessage());
			deliver(handle, BlurOutcome.failed(rejected));
			return;
		}
		cancelRunning(slot);
		if (radius==0){
			deliver(handle, BlurOutcome.ready(slot.source, false));
			return;
		}
		PixelBuffer cached=cache.get(new BlurCacheKey(sourceImageId, radius));
		if (cached!=null){
			if (debugLevel>1) System.out.println("BlurProcessor: "+handle+" served from cache");
			deliver(handle, BlurOutcome.ready(cached, true));
			return;
		}
		slot.running=handle;
		final ImageSlot jobSlot=slot;
		try {
			executor.execute(new Runnable(){
				public void run(){
					runJob(jobSlot, handle);
				}
			});
		} catch (RejectedExecutionException e){
			slot.running=null;
			deliver(handle, BlurOutcome.failed(BlurException.Reason.PROCESSING_FAILED, "Blur job could not be scheduled: "+e.getMessage()));
		}
	}

	/**
	 * Cancels the request. The CANCELLED outcome is delivered from this thread (unless
	 * another one is notifying the listener), the job stops at the next scan line.
	 * @return true if the request was still running
	 */
	public boolean cancel(ProcessingHandle handle){
		if (handle==null) return false;
		boolean wasRunning;
		synchronized (lock){
			ImageSlot slot=slots.get(handle.getSourceImageId());
			if ((slot!=null) && (slot.running==handle)) slot.running=null;
			wasRunning=cancelHandle(handle);
		}
		flushDeliveries();
		return wasRunning;
	}

	public boolean cancelBlur(ProcessingHandle handle){
		return cancel(handle);
	}

	/**
	 * Forgets the source image: its running request is cancelled and cached results are released
	 * @return false if there was no such image
	 */
	public boolean invalidateImage(String sourceImageId){
		ImageSlot slot;
		synchronized (lock){
			slot=slots.remove(sourceImageId);
			if (slot!=null) cancelRunning(slot);
			int removed=cache.invalidate(sourceImageId);
			if (debugLevel>1) System.out.println("BlurProcessor: invalidated "+sourceImageId+", "+removed+" cached results released");
		}
		flushDeliveries();
		return slot!=null;
	}

	/** Running request of the image, null if the image is idle */
	public ProcessingHandle getRunning(String sourceImageId){
		synchronized (lock){
			ImageSlot slot=slots.get(sourceImageId);
			return (slot==null)?null:slot.running;
		}
	}

	/** Cancels all running requests and stops the workers, the processor can not be used after that */
	public void shutdown(){
		List<ProcessingHandle> cancelled=new ArrayList<ProcessingHandle>();
		synchronized (lock){
			if (isShutdown) return;
			isShutdown=true;
			for (ImageSlot slot:slots.values()){
				if (slot.running!=null) cancelled.add(slot.running);
				cancelRunning(slot);
			}
		}
		flushDeliveries();
		executor.shutdown();
		if (debugLevel>1) System.out.println("BlurProcessor: shut down, "+cancelled.size()+" running requests cancelled");
	}

	public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
		return executor.awaitTermination(timeout, unit);
	}

	public BlurCache getCache()                           {return cache;}
	public SeparableGaussianBlur getEngine()              {return engine;}
	public BlurProcessorConfiguration getConfiguration()  {return configuration;}

	/* called with lock held */
	private void cancelRunning(ImageSlot slot){
		ProcessingHandle running=slot.running;
		slot.running=null;
		if (running!=null){
			cancelHandle(running);
			if (debugLevel>1) System.out.println("BlurProcessor: "+running+" superseded");
		}
	}

	/* called with lock held */
	private boolean cancelHandle(ProcessingHandle handle){
		handle.cancelFlag().set(true);
		return deliver(handle, BlurOutcome.cancelled());
	}

	/* called with lock held, the listener is notified by flushDeliveries() */
	private boolean deliver(ProcessingHandle handle, BlurOutcome outcome){
		if (!handle.finish(outcome)) return false;
		if (listener==null) handle.release();
		else deliveries.add(new Delivery(handle, null, outcome));
		return true;
	}

	/*
	 * Makes the queued listener calls without holding the lock, one at a time in queue order.
	 * A thread that finds another one delivering leaves its calls to that thread. Handles are
	 * released to waitForOutcome() once this thread has stopped delivering.
	 */
	private void flushDeliveries(){
		if (listener==null) return;
		synchronized (lock){
			if (delivering || deliveries.isEmpty()) return;
			delivering=true;
		}
		List<ProcessingHandle> notified=new ArrayList<ProcessingHandle>();
		boolean drained=false;
		try {
			while (!drained){
				Delivery delivery;
				synchronized (lock){
					delivery=deliveries.poll();
					if (delivery==null){ // queue empty and delivering cleared atomically
						delivering=false;
						drained=true;
						continue;
					}
				}
				notifyListener(delivery);
				if (delivery.preview==null) notified.add(delivery.handle);
			}
		} finally {
			if (!drained){ // listener threw an Error
				synchronized (lock){
					delivering=false;
				}
			}
			for (ProcessingHandle handle:notified) handle.release();
		}
	}

	private void notifyListener(Delivery delivery){
		try {
			if (delivery.preview!=null) listener.blurPreview(delivery.handle, delivery.preview);
			else                        listener.blurCompleted(delivery.handle, delivery.outcome);
		} catch (RuntimeException e){
			IJ.log("Blur listener failed for "+delivery.handle+": "+e);
		}
	}

	/* worker thread */
	private void runJob(ImageSlot slot, ProcessingHandle handle){
		if (handle.isCancelled()) return;
		int radius=handle.getRadius();
		long startTime=System.nanoTime();
		if (debugLevel>0) IJ.showStatus("Blurring "+slot.sourceImageId+", radius "+radius);
		try {
			if (configuration.progressive){
				BlurKernel previewKernel=BlurKernel.buildPreview(radius, configuration.progressiveScale);
				if ((previewKernel.getRadius()>0) && (previewKernel.getRadius()<radius)){
					PixelBuffer preview=engine.blur(slot.source, previewKernel, handle.cancelFlag());
					synchronized (lock){
						if ((slot.running==handle) && !handle.isDone() && (listener!=null))
							deliveries.add(new Delivery(handle, preview, null));
					}
					flushDeliveries();
				}
			}
			PixelBuffer result=engine.blur(slot.source, BlurKernel.build(radius), handle.cancelFlag());
			if (!result.sameDimensions(slot.source))
				throw new BlurException(BlurException.Reason.PROCESSING_FAILED,
						"Blur result "+result+" does not match source "+slot.source);
			synchronized (lock){
				if ((slot.running!=handle) || handle.isDone()) return; // superseded while finishing
				slot.running=null;
				cache.put(new BlurCacheKey(slot.sourceImageId, radius), result);
				deliver(handle, BlurOutcome.ready(result, false));
			}
			flushDeliveries();
			if (debugLevel>1) System.out.println("BlurProcessor: "+handle+" done in "+
					IJ.d2s(0.000000001*(System.nanoTime()-startTime),3)+" sec, cache "+cache.getStats());
		} catch (BlurCancelledException e){
			// interrupted without the flag (shutdown) still has to report
			cancel(handle);
			if (debugLevel>1) System.out.println("BlurProcessor: "+handle+" stopped: "+e.getMessage());
		} catch (BlurException e){
			fail(slot, handle, e);
		} catch (RuntimeException e){
			fail(slot, handle, new BlurException(BlurException.Reason.PROCESSING_FAILED, e.toString(), e));
		} finally {
			if (debugLevel>0) IJ.showStatus("");
		}
	}

	private void fail(ImageSlot slot, ProcessingHandle handle, BlurException e){
		IJ.log("Blur of "+slot.sourceImageId+" with radius "+handle.getRadius()+" failed ("+e.getReason()+"): "+e.getMessage());
		synchronized (lock){
			if (slot.running==handle) slot.running=null;
			deliver(handle, BlurOutcome.failed(e));
		}
		flushDeliveries();
	}
}
