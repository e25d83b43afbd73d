// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.exception;

/// Throw this to reject an ensemble or grid specification before any computation begins, rather
/// than producing a silently wrong footprint.
public class InputException extends FootprintException {

    public InputException (String message) {
        super("Invalid input: " + message);
    }

    public InputException (String message, Throwable cause) {
        super("Invalid input: " + message, cause);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.INPUT;
    }

}
