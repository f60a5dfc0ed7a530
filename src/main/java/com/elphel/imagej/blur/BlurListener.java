/**
** -----------------------------------------------------------------------------**
** BlurListener.java
**
** Receives blur previews and outcomes
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  BlurListener.java is free software: you can redistribute it and/or modify
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
 * Notifications of the blur processor. The processor makes these calls without
 * holding its lock, one call at a time and in the order the outcomes were
 * decided: a superseded request gets its CANCELLED before the result of the
 * request that replaced it, a preview comes before the final outcome of its
 * request. A call is made by the thread that produced the outcome (submitting
 * thread for immediate results and cancellations, worker thread for computed
 * results and failures) or, if another thread is notifying at that moment, by
 * that thread once it is done. The processor may be called from here.
 */
public interface BlurListener {
	/** Reduced-radius approximation of a running request, never the final state */
	void blurPreview(ProcessingHandle handle, PixelBuffer preview);

	/** Called exactly once per handle */
	void blurCompleted(ProcessingHandle handle, BlurOutcome outcome);
}
