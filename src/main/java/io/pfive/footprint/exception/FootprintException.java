// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.exception;

/// Superclass for all problems that abort a footprint computation. Numerical edge cases inside the
/// computation (single particles, empty epochs, empty time steps) are absorbed where they occur and
/// never surface as one of these. The ErrorType lets callers such as a job orchestration layer
/// decide whether to retry without matching on subclasses.
public abstract class FootprintException extends RuntimeException {

    public FootprintException (String message) {
        super(message);
    }

    public FootprintException (String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorType errorType ();

    public enum ErrorType {
        /// Structurally invalid trajectories or grid specification. Retrying will not help.
        INPUT,
        /// The footprint was computed but could not be persisted.
        SERIALIZATION,
        CONFIGURATION
    }
}
