/**
** -----------------------------------------------------------------------------**
** SeparableGaussianBlur.java
**
** Two-pass (rows, then columns) Gaussian convolution of 8-bit RGB/RGBA buffers
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  SeparableGaussianBlur.java is free software: you can redistribute it and/or modify
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

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Gaussian blur as two 1-d convolutions: each row of the source is convolved
 * into a float intermediate, then each column of the intermediate is convolved
 * into the 8-bit result. Like all convolution operations in ImageJ, out-of-image
 * pixels are assumed to have the value of the nearest edge pixel. All channels,
 * including alpha, are processed independently (no premultiplication).
 * <p>
 * Lines of each pass are distributed between threads with an atomic line
 * counter, every thread writes only the lines it took, so no locking is needed.
 * The cancellation flag is tested before each line.
 */
public class SeparableGaussianBlur {
	private final int threadsMax;
	public int debugLevel=1;
	private final AtomicLong invocations=new AtomicLong(0);

	public SeparableGaussianBlur(int threadsMax, int debugLevel){
		this.threadsMax=(threadsMax>0)?threadsMax:Runtime.getRuntime().availableProcessors();
		this.debugLevel=debugLevel;
	}

	public SeparableGaussianBlur(){
		this(Runtime.getRuntime().availableProcessors(),1);
	}

	/**
	 * Blurs the source with the kernel
	 * @param source    image to blur, not modified
	 * @param kernel    normalized kernel of odd length
	 * @param cancelled when set (by any thread) the blur is abandoned before the next line. May be null.
	 * @return new buffer of the source dimensions, or the source itself for the identity kernel
	 * @throws BlurException ALLOCATION_ERROR if buffers can not be allocated, INVALID_KERNEL for bad kernels
	 * @throws BlurCancelledException if cancelled flag was raised or the calling thread was interrupted
	 */
	public PixelBuffer blur(
			final PixelBuffer   source,
			final BlurKernel    kernel,
			final AtomicBoolean cancelled) throws BlurException, BlurCancelledException
	{
		if (source==null) throw new BlurException(BlurException.Reason.INVALID_REQUEST, "No source image to blur");
		validateKernel(kernel);
		if (kernel.isIdentity()) return source;
		invocations.incrementAndGet();
		final int width=   source.getWidth();
		final int height=  source.getHeight();
		final int channels=source.getChannels();
		final long startTime=System.nanoTime();
		float [] intermediate=null;
		byte []  result=null;
		try {
			intermediate=new float[width*height*channels];
			result=new byte[width*height*channels];
		} catch (OutOfMemoryError e){
			throw new BlurException(BlurException.Reason.ALLOCATION_ERROR,
					"Can not allocate buffers for "+width+"x"+height+"x"+channels+" image", e);
		}
		try {
			horizontalPass(source, intermediate, kernel, cancelled);
			verticalPass(intermediate, result, width, height, channels, kernel, cancelled);
		} catch (OutOfMemoryError e){
			throw new BlurException(BlurException.Reason.ALLOCATION_ERROR,
					"Out of memory while blurring "+width+"x"+height+"x"+channels+" image", e);
		}
		if (debugLevel>1) System.out.println("Blurred "+width+"x"+height+"x"+channels+" image with radius "+kernel.getRadius()+
				" in "+IJ.d2s(0.000000001*(System.nanoTime()-startTime),3)+" sec");
		return new PixelBuffer(width, height, channels, width*channels, result, true);
	}

	/** Number of convolutions actually performed (identity and rejected requests are not counted) */
	public long getInvocationCount(){
		return invocations.get();
	}

	public int getThreadsMax(){
		return threadsMax;
	}

	public static void validateKernel(BlurKernel kernel) throws BlurException {
		if ((kernel==null) || (kernel.length()==0))
			throw new BlurException(BlurException.Reason.INVALID_KERNEL, "Kernel is empty");
		if (kernel.length()!=2*kernel.getRadius()+1)
			throw new BlurException(BlurException.Reason.INVALID_KERNEL,
					"Kernel length "+kernel.length()+" does not match radius "+kernel.getRadius());
		if (!kernel.isNormalized(BlurKernel.NORMALIZATION_TOLERANCE))
			throw new BlurException(BlurException.Reason.INVALID_KERNEL, "Kernel is not normalized");
	}

	/* rows of the 8-bit source into the float intermediate */
	private void horizontalPass(
			final PixelBuffer   source,
			final float []      intermediate,
			final BlurKernel    kernel,
			final AtomicBoolean cancelled) throws BlurCancelledException
	{
		final int width=   source.getWidth();
		final int height=  source.getHeight();
		final int channels=source.getChannels();
		final int stride=  source.getStride();
		final byte [] pixels=source.pixelArray();
		final double [] weights=kernel.weightArray();
		final int radius=kernel.getRadius();
		runPass("horizontal", height, width, cancelled, new LineTask(){
			public void processLine(int y, double [] line, double [] conv){
				int rowStart=y*stride;
				int dstStart=y*width*channels;
				for (int chn=0;chn<channels;chn++){
					for (int x=0, p=rowStart+chn;x<width;x++, p+=channels) line[x]=pixels[p] & 0xff;
					convolveLine(line, conv, width, weights, radius);
					for (int x=0, p=dstStart+chn;x<width;x++, p+=channels) intermediate[p]=(float) conv[x];
				}
			}
		});
	}

	/* columns of the float intermediate into the 8-bit result */
	private void verticalPass(
			final float []      intermediate,
			final byte []       result,
			final int           width,
			final int           height,
			final int           channels,
			final BlurKernel    kernel,
			final AtomicBoolean cancelled) throws BlurCancelledException
	{
		final double [] weights=kernel.weightArray();
		final int radius=kernel.getRadius();
		final int lineInc=width*channels;
		runPass("vertical", width, height, cancelled, new LineTask(){
			public void processLine(int x, double [] line, double [] conv){
				for (int chn=0;chn<channels;chn++){
					int p0=x*channels+chn;
					for (int y=0, p=p0;y<height;y++, p+=lineInc) line[y]=intermediate[p];
					convolveLine(line, conv, height, weights, radius);
					for (int y=0, p=p0;y<height;y++, p+=lineInc) result[p]=toByte(conv[y]);
				}
			}
		});
	}

	/**
	 * Convolves one line with clamped (replicate) addressing
	 * @param input  line data, length elements used
	 * @param output convolved line
	 * @param length number of points in the line
	 * @param kernel full (2*radius+1) kernel
	 * @param radius kernel radius
	 */
	static void convolveLine(double [] input, double [] output, int length, double [] kernel, int radius){
		int last=length-1;
		int kLength=kernel.length;
		for (int x=0;x<length;x++){
			double sum=0.0;
			if ((x>=radius) && (x+radius<=last)){
				for (int k=0, i=x-radius;k<kLength;k++, i++) sum+=kernel[k]*input[i];
			} else {
				for (int k=0;k<kLength;k++){
					int i=x+k-radius;
					if      (i<0)    i=0;
					else if (i>last) i=last;
					sum+=kernel[k]*input[i];
				}
			}
			output[x]=sum;
		}
	}

	static byte toByte(double v){
		if (v<=0.0)   return 0;
		if (v>=255.0) return (byte) 255;
		return (byte) ((int) (v+0.5));
	}

	/* processes one row or column, line and conv are per-thread buffers of the line length */
	private interface LineTask {
		void processLine(int line, double [] lineBuffer, double [] convBuffer);
	}

	private void runPass(
			final String        name,
			final int           numLines,
			final int           lineLength,
			final AtomicBoolean cancelled,
			final LineTask      task) throws BlurCancelledException
	{
		if (isCancelled(cancelled)) throw new BlurCancelledException("Blur cancelled before "+name+" pass");
		final Thread[] threads = newThreadArray(Math.min(threadsMax, numLines));
		final AtomicInteger lineAtomic = new AtomicInteger(0);
		final AtomicBoolean abort = new AtomicBoolean(false);
		final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
		for (int ithread = 0; ithread < threads.length; ithread++) {
			threads[ithread] = new Thread() {
				public void run() {
					try {
						double [] lineBuf=new double[lineLength];
						double [] conv=   new double[lineLength];
						for (int line=lineAtomic.getAndIncrement(); line<numLines; line=lineAtomic.getAndIncrement()){
							if (abort.get() || isCancelled(cancelled)) break;
							task.processLine(line, lineBuf, conv);
						}
					} catch (Throwable t){
						failure.compareAndSet(null, t);
						abort.set(true);
					}
				}
			};
		}
		if (!startAndJoin(threads)){
			abort.set(true);
			joinUninterruptibly(threads);
			Thread.currentThread().interrupt();
			throw new BlurCancelledException("Blur interrupted during "+name+" pass");
		}
		Throwable t=failure.get();
		if (t instanceof OutOfMemoryError) throw (OutOfMemoryError) t;
		if (t!=null) throw new IllegalStateException("Failed "+name+" pass", t);
		if (isCancelled(cancelled)) throw new BlurCancelledException("Blur cancelled during "+name+" pass");
	}

	private static boolean isCancelled(AtomicBoolean cancelled){
		return ((cancelled!=null) && cancelled.get()) || Thread.currentThread().isInterrupted();
	}

	/* Create a Thread[] array as large as the number of processors available.
	 * From Stephan Preibisch's Multithreading.java class. See:
	 * http://repo.or.cz/w/trakem2.git?a=blob;f=mpi/fruitfly/general/MultiThreading.java;hb=HEAD
	 */
	private static Thread[] newThreadArray(int maxCPUs) {
		int n_cpus = Runtime.getRuntime().availableProcessors();
		if (n_cpus>maxCPUs)n_cpus=maxCPUs;
		if (n_cpus<1) n_cpus=1;
		return new Thread[n_cpus];
	}

	/* Start all given threads and wait on each of them until all are done.
	 * Returns false if the calling thread was interrupted while waiting.
	 */
	private static boolean startAndJoin(Thread[] threads)
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
			return false;
		}
		return true;
	}

	private static void joinUninterruptibly(Thread[] threads){
		for (int ithread = 0; ithread < threads.length; ++ithread){
			while (threads[ithread].isAlive()){
				try {
					threads[ithread].join();
				} catch (InterruptedException ie) {
					// keep waiting, the workers stop at the next line
				}
			}
		}
	}
}
