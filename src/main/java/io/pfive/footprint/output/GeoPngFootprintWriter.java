// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.output;

import ar.com.hjg.pngj.FilterType;
import ar.com.hjg.pngj.ImageInfo;
import ar.com.hjg.pngj.ImageLineHelper;
import ar.com.hjg.pngj.ImageLineInt;
import ar.com.hjg.pngj.PngWriter;
import ar.com.hjg.pngj.PngjException;
import ar.com.hjg.pngj.chunks.PngChunkTextVar;
import io.pfive.footprint.exception.SerializationException;
import io.pfive.footprint.grid.Wgs84Bounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;

/// Creates a GeoPng preview of a footprint, with text chunks containing georeferencing data.
/// Values are scaled linearly so the maximum maps to 255 in every channel, giving a grayscale
/// image. This is lossy and meant for display; the maximum value is recorded in a text chunk so
/// a viewer can recover approximate magnitudes.
public class GeoPngFootprintWriter implements FootprintWriter {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    /// The PNGJ library appears to reverse the meaning of iTXt language tag and translated key.
    /// This method specifies that we want uncompressed Latin1, which creates simpler tEXt chunks
    /// instead of iTXt.
    private static void addSimpleTextTag (PngWriter png, String key, String value) {
        png.getMetadata().setText(key, value, true, false);
    }

    private static int byteVal (double value, double max) {
        if (max <= 0 || value <= 0) return 0;
        return (int) Math.min(255, Math.round(value / max * 255));
    }

    /// Closes stream when done.
    public static void streamPng (FootprintGrid footprint, OutputStream outputStream) {
        int cols = footprint.nCellsWide();
        int rows = footprint.nCellsHigh();
        double max = footprint.max();
        Wgs84Bounds bounds = footprint.wgsBounds();
        ImageInfo imi = new ImageInfo(cols, rows, 8, false); // 8 bits per channel, no alpha
        PngWriter png = new PngWriter(outputStream, imi);
        png.setFilterType(FilterType.FILTER_ADAPTIVE_FAST);
        png.setCompLevel(4);
        addSimpleTextTag(png, PngChunkTextVar.KEY_Title, "Footprint raster");
        addSimpleTextTag(png, "CRS", FootprintGrid.CRS);
        addSimpleTextTag(png, "minX", Double.toString(bounds.minLon()));
        addSimpleTextTag(png, "minY", Double.toString(bounds.minLat()));
        addSimpleTextTag(png, "maxX", Double.toString(bounds.maxLon()));
        addSimpleTextTag(png, "maxY", Double.toString(bounds.maxLat()));
        addSimpleTextTag(png, "maxValue", Double.toString(max));
        // Image line object can be reused for successive rows.
        ImageLineInt iline = new ImageLineInt(imi);
        double[][] northUp = footprint.toRowsNorthUp();
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                int v = byteVal(northUp[row][col], max);
                ImageLineHelper.setPixelRGB8(iline, col, v, v, v);
            }
            png.writeRow(iline);
        }
        png.end(); // Closes the OutputStream wrapped by the PngWriter.
    }

    @Override
    public void write (FootprintGrid footprint, Path path) {
        try {
            streamPng(footprint, new BufferedOutputStream(Files.newOutputStream(path)));
        } catch (IOException | PngjException e) {
            throw new SerializationException(path, "Cannot write footprint: " + e.getMessage(), e);
        }
        LOG.info("Wrote preview of {} to {}.", footprint, path);
    }

}
