// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.output;

import io.pfive.footprint.exception.SerializationException;

import java.nio.file.Path;

/// Persists a footprint grid with its georeferencing. Failures are reported as
/// SerializationException carrying the target path.
public interface FootprintWriter {

    void write (FootprintGrid footprint, Path path) throws SerializationException;

}
