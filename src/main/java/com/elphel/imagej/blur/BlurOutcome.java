/**
** -----------------------------------------------------------------------------**
** BlurOutcome.java
**
** Final outcome of a blur request
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  BlurOutcome.java is free software: you can redistribute it and/or modify
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
 * READY carries the result buffer (shared with the cache, must not be modified),
 * FAILED carries the reason and a message, CANCELLED carries nothing.
 */
public class BlurOutcome {
	public enum Status {READY, CANCELLED, FAILED}

	private final Status                 status;
	private final PixelBuffer            buffer;
	private final boolean                fromCache;
	private final BlurException.Reason   reason;
	private final String                 message;

	private BlurOutcome(Status status, PixelBuffer buffer, boolean fromCache, BlurException.Reason reason, String message){
		this.status=status;
		this.buffer=buffer;
		this.fromCache=fromCache;
		this.reason=reason;
		this.message=message;
	}

	public static BlurOutcome ready(PixelBuffer buffer, boolean fromCache){
		return new BlurOutcome(Status.READY, buffer, fromCache, null, null);
	}

	public static BlurOutcome cancelled(){
		return new BlurOutcome(Status.CANCELLED, null, false, null, null);
	}

	public static BlurOutcome failed(BlurException.Reason reason, String message){
		return new BlurOutcome(Status.FAILED, null, false, reason, message);
	}

	public static BlurOutcome failed(BlurException e){
		return failed(e.getReason(), e.getMessage());
	}

	public Status getStatus()                {return status;}
	public boolean isReady()                 {return status==Status.READY;}
	public PixelBuffer getBuffer()           {return buffer;}
	/** true when the result was served from the cache without convolution */
	public boolean isFromCache()             {return fromCache;}
	public BlurException.Reason getReason()  {return reason;}
	public String getMessage()               {return message;}

	@Override
	public String toString(){
		switch (status){
		case READY:  return "READY("+buffer+(fromCache?", cached":"")+")";
		case FAILED: return "FAILED("+reason+": "+message+")";
		default:     return "CANCELLED";
		}
	}
}
