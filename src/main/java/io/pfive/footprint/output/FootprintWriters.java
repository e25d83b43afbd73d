// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.output;

import io.pfive.footprint.exception.SerializationException;

import java.nio.file.Path;
import java.util.Locale;

/// Chooses a writer from the extension of the output path.
public abstract class FootprintWriters {

    public static FootprintWriter forPath (Path path) {
        String extension = extension(path);
        return switch (extension) {
            case "kryo", "bin" -> new KryoFootprintWriter();
            case "json" -> new JsonFootprintWriter();
            case "png" -> new GeoPngFootprintWriter();
            default -> throw new SerializationException(path, "Unsupported file extension '" + extension + "'.");
        };
    }

    public static void write (FootprintGrid footprint, Path path) {
        forPath(path).write(footprint, path);
    }

    static String extension (Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) return "";
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return (dot < 0) ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

}
