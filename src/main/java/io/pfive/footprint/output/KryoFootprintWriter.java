// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.output;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import io.pfive.footprint.exception.SerializationException;
import io.pfive.footprint.grid.GridSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;

/// Saves and loads footprint grids as compact binary streams, our native lossless format. Values
/// and grid parameters are written as raw doubles, so a grid read back is identical to the one
/// written.
public class KryoFootprintWriter implements FootprintWriter {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    /// Kryo instance is not threadsafe, create one instance per call.
    private static Kryo kryoWithDefaults () {
        Kryo kryo = new Kryo();
        kryo.setReferences(false);
        kryo.setRegistrationRequired(true);
        kryo.register(FootprintGrid.class, new FootprintGridSerializer());
        return kryo;
    }

    public static void write (OutputStream outputStream, FootprintGrid footprint) {
        Kryo kryo = kryoWithDefaults();
        Output kryoOut = new Output(outputStream);
        kryo.writeObject(kryoOut, footprint);
        kryoOut.flush();
    }

    @Override
    public void write (FootprintGrid footprint, Path path) {
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
            write(out, footprint);
        } catch (IOException | KryoException e) {
            throw new SerializationException(path, "Cannot write footprint: " + e.getMessage(), e);
        }
        LOG.info("Wrote {} to {}.", footprint, path);
    }

    public static FootprintGrid read (InputStream inputStream) {
        Kryo kryo = kryoWithDefaults();
        Input kryoIn = new Input(inputStream);
        return kryo.readObject(kryoIn, FootprintGrid.class);
    }

    public static FootprintGrid read (Path path) {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            return read(in);
        } catch (IOException | KryoException e) {
            throw new SerializationException(path, "Cannot read footprint: " + e.getMessage(), e);
        }
    }

    /// Field by field, so the format does not depend on reflection over private fields.
    static class FootprintGridSerializer extends Serializer<FootprintGrid> {

        @Override
        public void write (Kryo kryo, Output output, FootprintGrid footprint) {
            GridSpec grid = footprint.grid();
            output.writeDouble(grid.xMin());
            output.writeDouble(grid.xMax());
            output.writeDouble(grid.xRes());
            output.writeDouble(grid.yMin());
            output.writeDouble(grid.yMax());
            output.writeDouble(grid.yRes());
            output.writeInt(footprint.nTrajectories());
            double[] values = footprint.valuesCopy();
            output.writeInt(values.length);
            output.writeDoubles(values, 0, values.length);
        }

        @Override
        public FootprintGrid read (Kryo kryo, Input input, Class<? extends FootprintGrid> type) {
            GridSpec grid = new GridSpec(
                  input.readDouble(), input.readDouble(), input.readDouble(),
                  input.readDouble(), input.readDouble(), input.readDouble()
            );
            int nTrajectories = input.readInt();
            int length = input.readInt();
            double[] values = input.readDoubles(length);
            return new FootprintGrid(grid, nTrajectories, values);
        }
    }

}
