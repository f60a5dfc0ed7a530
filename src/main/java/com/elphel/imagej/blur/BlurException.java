/**
** -----------------------------------------------------------------------------**
** BlurException.java
**
** Failure of a single blur job
**
**
** Copyright (C) 2026 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  BlurException.java is free software: you can redistribute it and/or modify
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
 * Failure of one blur job. The processor stays usable after any of these,
 * the reason is reported to the caller in the FAILED outcome.
 */
public class BlurException extends Exception {
	private static final long serialVersionUID = 6137258815346524178L;

	public enum Reason {
		/** intermediate or result buffer could not be allocated */
		ALLOCATION_ERROR,
		/** kernel empty, of even length or not normalized */
		INVALID_KERNEL,
		/** unknown image, NaN intensity or unsupported image */
		INVALID_REQUEST,
		/** unexpected failure inside the blur job */
		PROCESSING_FAILED
	}

	private final Reason reason;

	public BlurException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public BlurException(Reason reason, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}
}
