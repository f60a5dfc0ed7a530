/**
** -----------------------------------------------------------------------------**
** BlurCacheKey.java
**
** Cache key of a blur result: source image and kernel radius
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  BlurCacheKey.java is free software: you can redistribute it and/or modify
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
 * Key of a cached blur result. Intensities are quantized to the kernel radius
 * before keying, so all intensities that map to the same radius share one entry.
 */
public final class BlurCacheKey {
	private final String sourceImageId;
	private final int    radius;

	public BlurCacheKey(String sourceImageId, int radius){
		if (sourceImageId==null) throw new IllegalArgumentException("Source image id is null");
		this.sourceImageId=sourceImageId;
		this.radius=radius;
	}

	public String getSourceImageId(){return sourceImageId;}
	public int    getRadius()       {return radius;}

	@Override
	public int hashCode(){
		return 31*sourceImageId.hashCode()+radius;
	}

	@Override
	public boolean equals(Object o){
		if (this==o) return true;
		if (!(o instanceof BlurCacheKey)) return false;
		BlurCacheKey other=(BlurCacheKey) o;
		return (radius==other.radius) && sourceImageId.equals(other.sourceImageId);
	}

	@Override
	public String toString(){
		return sourceImageId+":"+radius;
	}
}
