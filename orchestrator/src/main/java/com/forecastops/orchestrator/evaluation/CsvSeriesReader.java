package com.forecastops.orchestrator.evaluation;

import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.task.TaskException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses a series CSV with a header row.
 *
 * Columns are located by header name, so column order does not matter and
 * extra columns are ignored. Any malformed row fails the whole file: a
 * silently shortened series would skew the score.
 */
public final class CsvSeriesReader {

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public static final String ID_COLUMN        = "id";
    public static final String TIMESTAMP_COLUMN = "timestamp";

    private CsvSeriesReader() {}

    /**
     * @param source      used in error messages only
     * @param valueColumn name of the numeric column to read (e.g. actual_power, p50)
     * @throws TaskException DATA_LOAD on any structural or parse problem
     */
    public static List<SeriesPoint> read(InputStream in, String source, String valueColumn) {
        try (CSVReader reader = new CSVReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String[] headers = reader.readNext();
            if (headers == null || headers.length == 0) {
                throw new TaskException(ErrorKind.DATA_LOAD, source + " has no header row");
            }
            List<String> names = Arrays.stream(headers).map(String::trim).toList();
            int idIdx    = columnIndex(names, ID_COLUMN, source);
            int tsIdx    = columnIndex(names, TIMESTAMP_COLUMN, source);
            int valueIdx = columnIndex(names, valueColumn, source);
            int width    = Math.max(idIdx, Math.max(tsIdx, valueIdx)) + 1;

            List<SeriesPoint> points = new ArrayList<>();
            String[] row;
            long line = 1;
            while ((row = reader.readNext()) != null) {
                line++;
                if (row.length == 1 && row[0].isBlank()) {
                    continue;   // trailing newline
                }
                if (row.length < width) {
                    throw new TaskException(ErrorKind.DATA_LOAD,
                            source + " line " + line + ": expected at least " + width + " columns, got " + row.length);
                }
                points.add(new SeriesPoint(
                        row[idIdx].trim(),
                        parseTimestamp(row[tsIdx], source, line),
                        parseValue(row[valueIdx], source, line)));
            }
            return points;
        } catch (CsvValidationException e) {
            throw new TaskException(ErrorKind.DATA_LOAD, source + " is not valid CSV: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new TaskException(ErrorKind.TRANSIENT, "Failed reading " + source + ": " + e.getMessage(), e);
        }
    }

    private static int columnIndex(List<String> names, String column, String source) {
        int idx = names.indexOf(column);
        if (idx < 0) {
            throw new TaskException(ErrorKind.DATA_LOAD, source + " is missing column '" + column + "'");
        }
        return idx;
    }

    private static LocalDateTime parseTimestamp(String raw, String source, long line) {
        try {
            return LocalDateTime.parse(raw.trim(), TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            throw new TaskException(ErrorKind.DATA_LOAD,
                    source + " line " + line + ": bad timestamp '" + raw + "'", e);
        }
    }

    private static double parseValue(String raw, String source, long line) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new TaskException(ErrorKind.DATA_LOAD,
                    source + " line " + line + ": bad value '" + raw + "'", e);
        }
    }
}
