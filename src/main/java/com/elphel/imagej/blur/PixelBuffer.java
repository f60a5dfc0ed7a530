/**
** -----------------------------------------------------------------------------**
** PixelBuffer.java
**
** Immutable 8-bit RGB/RGBA raster used as blur source and result
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  PixelBuffer.java is free software: you can redistribute it and/or modify
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

import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.util.Arrays;

/**
 * Raster of 8-bit samples, 3 (RGB) or 4 (RGBA) interleaved channels per pixel.
 * Rows may be padded: sample (x,y,c) is at <code>y*stride+x*channels+c</code>.
 * The payload is never modified after construction, so a buffer can be read
 * by any number of threads and handed out by the cache without copying.
 */
public class PixelBuffer {
	public static final int MAX_IMAGE_DIMENSION=8192;

	private final int width;
	private final int height;
	private final int channels;
	private final int stride;
	private final byte [] pixels;

	/**
	 * @param width    image width in pixels
	 * @param height   image height in pixels
	 * @param channels 3 for RGB, 4 for RGBA
	 * @param stride   bytes per row, at least width*channels
	 * @param pixels   payload, at least stride*height bytes. Copied.
	 */
	public PixelBuffer(int width, int height, int channels, int stride, byte [] pixels){
		this(width, height, channels, stride, checkedCopy(pixels, stride, height), true);
	}

	public PixelBuffer(int width, int height, int channels, byte [] pixels){
		this(width, height, channels, width*channels, pixels);
	}

	/* takes ownership of pixels, used by the convolution engine for freshly allocated results */
	PixelBuffer(int width, int height, int channels, int stride, byte [] pixels, boolean owned){
		checkGeometry(width, height, channels);
		if (stride<width*channels)
			throw new IllegalArgumentException("Row stride "+stride+" is less than "+(width*channels));
		if ((pixels==null) || (pixels.length<(long) stride*height))
			throw new IllegalArgumentException("Pixel array is too short for "+width+"x"+height+" with stride "+stride);
		this.width=width;
		this.height=height;
		this.channels=channels;
		this.stride=stride;
		this.pixels=pixels;
	}

	private static void checkGeometry(int width, int height, int channels){
		if ((width<1) || (height<1))
			throw new IllegalArgumentException("Invalid dimensions "+width+"x"+height);
		if ((channels!=3) && (channels!=4))
			throw new IllegalArgumentException("Only RGB (3) and RGBA (4) channels are supported, got "+channels);
		if ((long) width*height*channels>Integer.MAX_VALUE-8)
			throw new IllegalArgumentException("Image "+width+"x"+height+"x"+channels+" does not fit in a byte array");
	}

	private static byte [] checkedCopy(byte [] pixels, int stride, int height){
		if ((pixels==null) || (pixels.length<(long) stride*height)) return pixels; // rejected by the constructor
		return Arrays.copyOf(pixels, stride*height);
	}

	/** Solid color image, alpha is used only when channels==4 */
	public static PixelBuffer solid(int width, int height, int channels, int r, int g, int b, int a){
		checkGeometry(width, height, channels);
		byte [] pixels=new byte[width*height*channels];
		for (int i=0;i<width*height;i++){
			int p=i*channels;
			pixels[p  ]=(byte) r;
			pixels[p+1]=(byte) g;
			pixels[p+2]=(byte) b;
			if (channels==4) pixels[p+3]=(byte) a;
		}
		return new PixelBuffer(width, height, channels, width*channels, pixels, true);
	}

	/**
	 * Converts any ImageJ processor to an RGB buffer. Non-color processors are
	 * converted the same way ImageJ does for display (with the current LUT and display range).
	 */
	public static PixelBuffer fromImageProcessor(ImageProcessor ip){
		ColorProcessor cp=(ip instanceof ColorProcessor)?((ColorProcessor) ip):((ColorProcessor) ip.convertToRGB());
		int w=cp.getWidth();
		int h=cp.getHeight();
		int [] rgb=(int []) cp.getPixels();
		byte [] pixels=new byte[w*h*3];
		for (int i=0;i<rgb.length;i++){
			pixels[3*i  ]=(byte) ((rgb[i]>>16) & 0xff);
			pixels[3*i+1]=(byte) ((rgb[i]>> 8) & 0xff);
			pixels[3*i+2]=(byte) ( rgb[i]      & 0xff);
		}
		return new PixelBuffer(w, h, 3, w*3, pixels, true);
	}

	/** Packs the buffer into an ImageJ ColorProcessor, alpha is dropped */
	public ColorProcessor toColorProcessor(){
		int [] rgb=new int[width*height];
		for (int y=0;y<height;y++){
			int p=y*stride;
			for (int x=0;x<width;x++, p+=channels){
				rgb[y*width+x]=((pixels[p] & 0xff)<<16) | ((pixels[p+1] & 0xff)<<8) | (pixels[p+2] & 0xff);
			}
		}
		return new ColorProcessor(width, height, rgb);
	}

	/** Checks that the buffer can be processed, returns null if it can or the reason if it can not */
	public String validate(){
		if ((width>MAX_IMAGE_DIMENSION) || (height>MAX_IMAGE_DIMENSION))
			return "Image "+width+"x"+height+" exceeds maximal dimension "+MAX_IMAGE_DIMENSION;
		return null;
	}

	public int getWidth()    {return width;}
	public int getHeight()   {return height;}
	public int getChannels() {return channels;}
	public int getStride()   {return stride;}
	public boolean hasAlpha(){return channels==4;}

	/** Memory footprint used for cache accounting */
	public long getSizeBytes(){
		return ((long) stride)*height;
	}

	public int getSample(int x, int y, int channel){
		return pixels[y*stride+x*channels+channel] & 0xff;
	}

	/** Copy of the payload */
	public byte [] getPixels(){
		return pixels.clone();
	}

	/* direct access for the engine, never written through */
	byte [] pixelArray(){
		return pixels;
	}

	public boolean sameDimensions(PixelBuffer other){
		return (other!=null) && (other.width==width) && (other.height==height) && (other.channels==channels);
	}

	/** Compares visible samples only, row padding is ignored */
	public boolean samePixels(PixelBuffer other){
		if (!sameDimensions(other)) return false;
		for (int y=0;y<height;y++){
			int p=y*stride;
			int op=y*other.stride;
			for (int i=0;i<width*channels;i++){
				if (pixels[p+i]!=other.pixels[op+i]) return false;
			}
		}
		return true;
	}

	@Override
	public String toString(){
		return "PixelBuffer["+width+"x"+height+"x"+channels+", stride="+stride+"]";
	}

	@Override
	public int hashCode(){
		return 31*(31*width+height)+channels;
	}

	@Override
	public boolean equals(Object o){
		if (this==o) return true;
		if (!(o instanceof PixelBuffer)) return false;
		return samePixels((PixelBuffer) o);
	}
}
