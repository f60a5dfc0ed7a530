/**
** -----------------------------------------------------------------------------**
** BlurKernel.java
**
** Normalized one-dimensional Gaussian kernel for separable blur
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  BlurKernel.java is free software: you can redistribute it and/or modify
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

/**
 * Symmetric 1-d Gaussian kernel of length 2*radius+1, normalized to unity sum.
 * Unlike the one-sided kernels of the ImageJ GaussianBlur, the full kernel is
 * stored so the convolution loop does not need to fold it.
 */
public class BlurKernel {
	public static final int    MAX_RADIUS=50;
	public static final double MAX_INTENSITY=10.0;
	public static final double RADIUS_PER_INTENSITY=5.0;
	public static final double NORMALIZATION_TOLERANCE=1E-6;
	private static final double MIN_SIGMA=0.0001;

	private final int radius;
	private final double sigma;
	private final double [] weights;

	/* used for tests of kernel validation only */
	BlurKernel(int radius, double sigma, double [] weights){
		this.radius=radius;
		this.sigma=sigma;
		this.weights=weights;
	}

	/**
	 * Builds the kernel for the blur radius in pixels
	 * @param radius half-width of the kernel, sigma is radius/3
	 * @return normalized kernel, radius 0 gives a single 1.0 weight
	 * @throws IllegalArgumentException for negative radius
	 */
	public static BlurKernel build(int radius){
		if (radius<0) throw new IllegalArgumentException("Kernel radius should be >=0, got "+radius);
		double sigma=Math.max(radius/3.0, MIN_SIGMA);
		double [] weights=new double[2*radius+1];
		double sum=0.0;
		for (int i=0;i<=radius;i++){ // Gaussian function, one side mirrored to the other
			double w=Math.exp(-0.5*i*i/sigma/sigma);
			weights[radius+i]=w;
			weights[radius-i]=w;
			sum+= (i==0)?w:2*w;
		}
		for (int i=0;i<weights.length;i++) weights[i]/=sum;
		// second pass removes the rounding error of the first one
		sum=weights[radius];
		for (int i=1;i<=radius;i++) sum+=2*weights[radius+i];
		for (int i=0;i<=radius;i++){
			double w=weights[radius+i]/sum;
			weights[radius+i]=w;
			weights[radius-i]=w;
		}
		return new BlurKernel(radius, sigma, weights);
	}

	/**
	 * Reduced kernel for the fast preview pass
	 * @param radius full quality radius
	 * @param scale  radius (and sigma) scale, 0.5 halves the blur
	 */
	public static BlurKernel buildPreview(int radius, double scale){
		if (!(scale>0.0)) scale=0.5;
		if (scale>1.0) scale=1.0;
		return build((int) Math.round(radius*scale));
	}

	/**
	 * Maps the user intensity to the kernel radius: round(intensity*5), clamped to [0,50].
	 * Out of range intensities are clamped rather than rejected.
	 * @throws IllegalArgumentException for NaN
	 */
	public static int radiusForIntensity(double intensity){
		if (Double.isNaN(intensity)) throw new IllegalArgumentException("Blur intensity is NaN");
		if (intensity<0.0) intensity=0.0;
		if (intensity>MAX_INTENSITY) intensity=MAX_INTENSITY;
		int radius=(int) Math.round(intensity*RADIUS_PER_INTENSITY);
		if (radius>MAX_RADIUS) radius=MAX_RADIUS;
		return radius;
	}

	public boolean isNormalized(double tolerance){
		if ((weights==null) || (weights.length==0)) return false;
		double sum=0.0;
		for (double w:weights) sum+=w;
		return Math.abs(sum-1.0)<=tolerance;
	}

	public boolean isIdentity(){
		return (weights!=null) && (weights.length==1) && (weights[0]==1.0);
	}

	public int getRadius()  {return radius;}
	public double getSigma(){return sigma;}
	public int length()     {return (weights==null)?0:weights.length;}

	/* shared with the engine, not copied */
	double [] weightArray(){
		return weights;
	}

	public double [] getWeights(){
		return (weights==null)?null:weights.clone();
	}

	@Override
	public String toString(){
		return "BlurKernel[radius="+radius+", sigma="+sigma+"]";
	}
}
