/**
** -----------------------------------------------------------------------------**
** ProcessingHandle.java
**
** One asynchronous blur job
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  ProcessingHandle.java is free software: you can redistribute it and/or modify
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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle of a submitted blur request: cancellation flag shared with the
 * convolution loops and the completion channel. The state leaves RUNNING
 * exactly once.
 */
public class ProcessingHandle {
	public enum State {RUNNING, COMPLETED, CANCELLED, FAILED}

	private final long   requestId;
	private final String sourceImageId;
	private final double intensity;
	private final int    radius;
	private final AtomicBoolean  cancelled=new AtomicBoolean(false);
	private final CountDownLatch done=     new CountDownLatch(1);
	private volatile State       state=    State.RUNNING;
	private volatile BlurOutcome outcome=  null;

	ProcessingHandle(long requestId, String sourceImageId, double intensity, int radius){
		this.requestId=requestId;
		this.sourceImageId=sourceImageId;
		this.intensity=intensity;
		this.radius=radius;
	}

	/* moves out of RUNNING, returns false if already finished */
	synchronized boolean finish(BlurOutcome outcome){
		if (state!=State.RUNNING) return false;
		switch (outcome.getStatus()){
		case READY:     state=State.COMPLETED; break;
		case FAILED:    state=State.FAILED;    break;
		case CANCELLED: state=State.CANCELLED; cancelled.set(true); break;
		}
		this.outcome=outcome;
		return true;
	}

	/* opens waitForOutcome(), after the listener has been notified */
	void release(){
		done.countDown();
	}

	AtomicBoolean cancelFlag(){
		return cancelled;
	}

	/**
	 * Waits for the outcome. Returns only after the listener (if any) has received it,
	 * so it should not be called from the listener for the handle being notified.
	 * @return outcome or null if it did not arrive in time
	 */
	public BlurOutcome waitForOutcome(long timeout, TimeUnit unit) throws InterruptedException {
		if (!done.await(timeout, unit)) return null;
		return outcome;
	}

	public long getRequestId()       {return requestId;}
	public String getSourceImageId() {return sourceImageId;}
	public double getIntensity()     {return intensity;}
	public int getRadius()           {return radius;}
	public State getState()          {return state;}
	public boolean isCancelled()     {return cancelled.get();}
	public boolean isDone()          {return state!=State.RUNNING;}
	/** null while running */
	public BlurOutcome getOutcome()  {return outcome;}

	@Override
	public String toString(){
		return "#"+requestId+"["+sourceImageId+", radius="+radius+", "+state+"]";
	}
}
