// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.trajectory;

import io.pfive.footprint.exception.InputException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Reads a trajectory ensemble from a CSV table with a header row, as exported from a particle
/// output file. Columns can be named either descriptively or with the short names used in the
/// trajectory model's own particle output. Any other columns are ignored.
public abstract class TrajectoryCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final CSVFormat PARTICLE_CSV_FORMAT =
          CSVFormat.RFC4180.builder().setHeader().setSkipHeaderRecord(true).setTrim(true).build();

    /// Each required column with its accepted names, descriptive name first.
    enum Column {
        TRAJECTORY_ID("trajectory_id", "indx"),
        TIME("time", "time"),
        LONGITUDE("longitude", "long"),
        LATITUDE("latitude", "lati"),
        WEIGHT("weight", "foot");

        final String name;
        final String shortName;

        Column (String name, String shortName) {
            this.name = name;
            this.shortName = shortName;
        }

        int indexIn (Map<String, Integer> header) {
            Integer index = header.get(name);
            if (index == null) index = header.get(shortName);
            if (index == null) {
                throw new InputException(String.format("Missing required column '%s' (or '%s').", name, shortName));
            }
            return index;
        }
    }

    public static TrajectoryEnsemble read (Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            TrajectoryEnsemble ensemble = read(reader);
            LOG.info("Read {} samples of {} trajectories from {}.", ensemble.nSamples(), ensemble.nTrajectories(), path);
            return ensemble;
        } catch (IOException e) {
            throw new InputException("Cannot read trajectory file " + path, e);
        }
    }

    /// Closes the reader when done. Malformed CSV, such as an unterminated quoted field, is reported
    /// as an InputException naming the record where parsing stopped.
    public static TrajectoryEnsemble read (Reader reader) throws IOException {
        List<ParticleSample> samples = new ArrayList<>();
        try (CSVParser parser = PARTICLE_CSV_FORMAT.parse(reader)) {
            Map<String, Integer> header = parser.getHeaderMap();
            if (header == null) throw new InputException("Trajectory table has no header row.");
            int idCol = Column.TRAJECTORY_ID.indexIn(header);
            int timeCol = Column.TIME.indexIn(header);
            int lonCol = Column.LONGITUDE.indexIn(header);
            int latCol = Column.LATITUDE.indexIn(header);
            int weightCol = Column.WEIGHT.indexIn(header);
            try {
                for (CSVRecord record : parser) {
                    long row = record.getRecordNumber();
                    samples.add(new ParticleSample(
                          intVal(record, idCol, row),
                          doubleVal(record, timeCol, row),
                          doubleVal(record, lonCol, row),
                          doubleVal(record, latCol, row),
                          doubleVal(record, weightCol, row)
                    ));
                }
            } catch (UncheckedIOException | IllegalStateException e) {
                var message = String.format("Malformed CSV after row %d: %s", samples.size(), e.getMessage());
                throw new InputException(message, e);
            }
        }
        return TrajectoryEnsemble.of(samples);
    }

    private static String stringVal (CSVRecord record, int column, long row) {
        if (column >= record.size()) {
            throw new InputException(String.format("Row %d has only %d fields.", row, record.size()));
        }
        return record.get(column);
    }

    private static int intVal (CSVRecord record, int column, long row) {
        String val = stringVal(record, column, row);
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse trajectory ID '%s' on row %d as integer.", val, row);
            throw new InputException(message, e);
        }
    }

    private static double doubleVal (CSVRecord record, int column, long row) {
        String val = stringVal(record, column, row);
        try {
            return Double.parseDouble(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' in column %d on row %d as a number.", val, column, row);
            throw new InputException(message, e);
        }
    }

}
