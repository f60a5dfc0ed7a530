/**
** -----------------------------------------------------------------------------**
** BlurRequest.java
**
** Blur request: source image id and intensity
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  BlurRequest.java is free software: you can redistribute it and/or modify
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

public class BlurRequest {
	private final String sourceImageId;
	private final double intensity;

	/**
	 * @param sourceImageId id the source was registered with
	 * @param intensity     blur intensity 0.0-10.0, out of range values are clamped
	 */
	public BlurRequest(String sourceImageId, double intensity){
		this.sourceImageId=sourceImageId;
		this.intensity=intensity;
	}

	public String getSourceImageId(){return sourceImageId;}
	public double getIntensity()    {return intensity;}

	/**
	 * Kernel radius for the requested intensity
	 * @throws BlurException INVALID_REQUEST if the intensity can not be mapped to a radius
	 */
	public int getRadius() throws BlurException {
		try {
			return BlurKernel.radiusForIntensity(intensity);
		} catch (IllegalArgumentException e){
			throw new BlurException(BlurException.Reason.INVALID_REQUEST, e.getMessage(), e);
		}
	}

	@Override
	public String toString(){
		return "BlurRequest["+sourceImageId+", intensity="+intensity+"]";
	}
}
