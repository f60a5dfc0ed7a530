/**
** -----------------------------------------------------------------------------**
** BlurCache.java
**
** Memory-bounded LRU cache of blur results
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  BlurCache.java is free software: you can redistribute it and/or modify
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

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Least-recently-used cache of blurred images, bounded by the total size of
 * the cached buffers (and optionally by the number of entries).
 * Recency is kept by an access-ordered LinkedHashMap, so lookups, updates and
 * each eviction are O(1). All methods are synchronized on the cache instance;
 * the lock is held only for index and accounting updates.
 * Cached buffers are handed out shared: PixelBuffer is immutable.
 */
public class BlurCache {
	private final LinkedHashMap<BlurCacheKey, PixelBuffer> entries=
			new LinkedHashMap<BlurCacheKey, PixelBuffer>(16, 0.75f, true);
	private final long maxMemory;
	private final int  maxEntries; // 0 - unlimited
	private long currentMemory=0;
	private long hitCount=     0;
	private long missCount=    0;
	private long evictionCount=0;
	public int debugLevel=1;

	/**
	 * @param maxMemory  memory budget in bytes, should be positive
	 * @param maxEntries maximal number of entries, 0 for no limit
	 */
	public BlurCache(long maxMemory, int maxEntries){
		if (maxMemory<=0) throw new IllegalArgumentException("Cache memory budget should be positive, got "+maxMemory);
		if (maxEntries<0) throw new IllegalArgumentException("Cache entry limit should be >=0, got "+maxEntries);
		this.maxMemory=maxMemory;
		this.maxEntries=maxEntries;
	}

	public BlurCache(long maxMemory){
		this(maxMemory, 0);
	}

	/**
	 * Looks up the cached result, hit makes the entry most recently used
	 * @return cached buffer or null
	 */
	public synchronized PixelBuffer get(BlurCacheKey key){
		PixelBuffer buffer=entries.get(key);
		if (buffer!=null) hitCount++;
		else              missCount++;
		return buffer;
	}

	/** Lookup without statistics or recency update */
	public synchronized boolean contains(BlurCacheKey key){
		return entries.containsKey(key);
	}

	/**
	 * Inserts or replaces the entry, evicting least recently used entries until it fits.
	 * @return false if the buffer alone is larger than the budget, the cache is not modified then
	 */
	public synchronized boolean put(BlurCacheKey key, PixelBuffer buffer){
		if ((key==null) || (buffer==null)) throw new IllegalArgumentException("Cache key and buffer should not be null");
		long size=buffer.getSizeBytes();
		if (size>maxMemory){
			if (debugLevel>1) System.out.println("BlurCache: rejected "+key+", "+size+" bytes exceed the budget of "+maxMemory);
			return false;
		}
		PixelBuffer old=entries.remove(key);
		if (old!=null) currentMemory-=old.getSizeBytes();
		Iterator<Map.Entry<BlurCacheKey, PixelBuffer>> iter=entries.entrySet().iterator();
		while (iter.hasNext() && ((currentMemory+size>maxMemory) || ((maxEntries>0) && (entries.size()>=maxEntries)))){
			Map.Entry<BlurCacheKey, PixelBuffer> eldest=iter.next();
			currentMemory-=eldest.getValue().getSizeBytes();
			iter.remove();
			evictionCount++;
			if (debugLevel>2) System.out.println("BlurCache: evicted "+eldest.getKey());
		}
		entries.put(key, buffer);
		currentMemory+=size;
		return true;
	}

	/**
	 * Removes all results of the source image
	 * @return number of removed entries
	 */
	public synchronized int invalidate(String sourceImageId){
		int removed=0;
		Iterator<Map.Entry<BlurCacheKey, PixelBuffer>> iter=entries.entrySet().iterator();
		while (iter.hasNext()){
			Map.Entry<BlurCacheKey, PixelBuffer> entry=iter.next();
			if (entry.getKey().getSourceImageId().equals(sourceImageId)){
				currentMemory-=entry.getValue().getSizeBytes();
				iter.remove();
				removed++;
			}
		}
		if ((debugLevel>1) && (removed>0)) System.out.println("BlurCache: invalidated "+removed+" entries of "+sourceImageId);
		return removed;
	}

	public synchronized void clear(){
		entries.clear();
		currentMemory=0;
	}

	/**
	 * Evicts least recently used entries
	 * @param count number of entries to evict
	 * @return number of entries actually evicted
	 */
	public synchronized int evictLru(int count){
		int evicted=0;
		Iterator<Map.Entry<BlurCacheKey, PixelBuffer>> iter=entries.entrySet().iterator();
		while ((evicted<count) && iter.hasNext()){
			currentMemory-=iter.next().getValue().getSizeBytes();
			iter.remove();
			evicted++;
		}
		evictionCount+=evicted;
		return evicted;
	}

	/** @return true if used memory is at least threshold (0.0-1.0) of the budget */
	public synchronized boolean isMemoryPressure(double threshold){
		return currentMemory>=threshold*maxMemory;
	}

	public synchronized long getMemoryUsage(){
		return currentMemory;
	}

	public synchronized int size(){
		return entries.size();
	}

	public long getMaxMemory(){
		return maxMemory;
	}

	public synchronized BlurCacheStats getStats(){
		return new BlurCacheStats(entries.size(), maxEntries, currentMemory, maxMemory, hitCount, missCount, evictionCount);
	}
}
