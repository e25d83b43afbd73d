// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.exception;

public class ConfigurationException extends FootprintException {

    public ConfigurationException (String message) {
        super(message);
    }

    public ConfigurationException (String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.CONFIGURATION;
    }

}
