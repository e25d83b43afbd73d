// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pfive.footprint.exception.SerializationException;
import io.pfive.footprint.grid.GridSpec;
import io.pfive.footprint.grid.Wgs84Bounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Path;

/// Writes a footprint as a self-describing JSON document, for consumers outside the JVM. Jackson
/// writes doubles in their shortest round-trip form, so the values survive a write and read exactly.
/// Values are a flat array with x varying fastest and the first row at the southern edge. The bounds
/// object gives the area covered by whole cells.
public class JsonFootprintWriter implements FootprintWriter {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final ObjectMapper objectMapper = new ObjectMapper();

    static ObjectNode toJson (FootprintGrid footprint) {
        GridSpec grid = footprint.grid();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("crs", FootprintGrid.CRS);
        root.put("xmin", grid.xMin());
        root.put("xmax", grid.xMax());
        root.put("xres", grid.xRes());
        root.put("ymin", grid.yMin());
        root.put("ymax", grid.yMax());
        root.put("yres", grid.yRes());
        Wgs84Bounds bounds = footprint.wgsBounds();
        ObjectNode boundsNode = root.putObject("bounds");
        boundsNode.put("minLon", bounds.minLon());
        boundsNode.put("minLat", bounds.minLat());
        boundsNode.put("maxLon", bounds.maxLon());
        boundsNode.put("maxLat", bounds.maxLat());
        root.put("nCellsWide", footprint.nCellsWide());
        root.put("nCellsHigh", footprint.nCellsHigh());
        root.put("nTrajectories", footprint.nTrajectories());
        ArrayNode values = root.putArray("values");
        for (double v : footprint.valuesCopy()) values.add(v);
        return root;
    }

    static FootprintGrid fromJson (JsonNode root, Path path) {
        GridSpec grid = new GridSpec(
              field(root, "xmin", path).doubleValue(),
              field(root, "xmax", path).doubleValue(),
              field(root, "xres", path).doubleValue(),
              field(root, "ymin", path).doubleValue(),
              field(root, "ymax", path).doubleValue(),
              field(root, "yres", path).doubleValue()
        );
        JsonNode valuesNode = field(root, "values", path);
        double[] values = new double[valuesNode.size()];
        for (int i = 0; i < values.length; i++) values[i] = valuesNode.get(i).doubleValue();
        return new FootprintGrid(grid, field(root, "nTrajectories", path).intValue(), values);
    }

    private static JsonNode field (JsonNode root, String name, Path path) {
        JsonNode node = root.get(name);
        if (node == null) throw new SerializationException(path, "Missing field '" + name + "'.");
        return node;
    }

    @Override
    public void write (FootprintGrid footprint, Path path) {
        try {
            objectMapper.writeValue(path.toFile(), toJson(footprint));
        } catch (IOException e) {
            throw new SerializationException(path, "Cannot write footprint: " + e.getMessage(), e);
        }
        LOG.info("Wrote {} to {}.", footprint, path);
    }

    public static FootprintGrid read (Path path) {
        try {
            return fromJson(objectMapper.readTree(path.toFile()), path);
        } catch (IOException e) {
            throw new SerializationException(path, "Cannot read footprint: " + e.getMessage(), e);
        }
    }

}
