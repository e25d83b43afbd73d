// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.exception;

import java.nio.file.Path;

public class SerializationException extends FootprintException {

    private final Path path;

    public SerializationException (Path path, String message) {
        super(String.format("Footprint file '%s': %s", path, message));
        this.path = path;
    }

    public SerializationException (Path path, String message, Throwable cause) {
        super(String.format("Footprint file '%s': %s", path, message), cause);
        this.path = path;
    }

    public Path path () {
        return path;
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.SERIALIZATION;
    }

}
