/**
** -----------------------------------------------------------------------------**
** BlurCacheStats.java
**
** Snapshot of blur cache usage and effectiveness
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  BlurCacheStats.java is free software: you can redistribute it and/or modify
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

public class BlurCacheStats {
	public final int  currentEntries;
	public final int  maxEntries;    // 0 - no limit
	public final long currentMemory;
	public final long maxMemory;
	public final long hitCount;
	public final long missCount;
	public final long evictionCount;

	public BlurCacheStats(
			int  currentEntries,
			int  maxEntries,
			long currentMemory,
			long maxMemory,
			long hitCount,
			long missCount,
			long evictionCount){
		this.currentEntries=currentEntries;
		this.maxEntries=    maxEntries;
		this.currentMemory= currentMemory;
		this.maxMemory=     maxMemory;
		this.hitCount=      hitCount;
		this.missCount=     missCount;
		this.evictionCount= evictionCount;
	}

	/** Fraction of lookups that were served from the cache, 0 if there were none */
	public double getHitRatio(){
		long total=hitCount+missCount;
		return (total==0)?0.0:((double) hitCount)/total;
	}

	@Override
	public String toString(){
		return "entries="+currentEntries+((maxEntries>0)?("/"+maxEntries):"")+
				", memory="+currentMemory+"/"+maxMemory+
				", hits="+hitCount+", misses="+missCount+", evictions="+evictionCount;
	}
}
