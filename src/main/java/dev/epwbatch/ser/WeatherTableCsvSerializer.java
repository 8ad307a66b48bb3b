package dev.epwbatch.ser;

import dev.epwbatch.pipeline.WeatherRecord;
import dev.epwbatch.pipeline.WeatherTable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV codec for {@link WeatherTable}.
 *
 * <p>Layout: header {@code timestamp,<col>,...}; one row per record with an ISO-8601 local
 * timestamp followed by the column values. A missing value is an empty cell. Doubles are written
 * with {@link Double#toString(double)} so a round trip is exact.
 */
public class WeatherTableCsvSerializer implements Serializer<WeatherTable> {
    private static final String TIMESTAMP_COLUMN = "timestamp";

    @Override
    public byte[] serialize(WeatherTable table) {
        StringBuilder sb = new StringBuilder();
        sb.append(TIMESTAMP_COLUMN);
        for (String column : table.columns()) {
            if (column.indexOf(',') >= 0 || column.indexOf('\n') >= 0) {
                throw new IllegalArgumentException("Column name not CSV-safe: " + column);
            }
            sb.append(',').append(column);
        }
        sb.append('\n');
        for (WeatherRecord record : table.records()) {
            sb.append(record.timestamp());
            for (String column : table.columns()) {
                sb.append(',');
                Double v = record.values().get(column);
                if (v != null) sb.append(v);
            }
            sb.append('\n');
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public WeatherTable deserialize(byte[] bytes, Class<WeatherTable> type) {
        try (BufferedReader reader = new BufferedReader(new StringReader(new String(bytes, StandardCharsets.UTF_8)))) {
            String header = reader.readLine();
            if (header == null || !header.startsWith(TIMESTAMP_COLUMN)) {
                throw new IllegalArgumentException("Missing CSV header");
            }
            String[] headerCells = header.split(",", -1);
            List<String> columns = Arrays.asList(headerCells).subList(1, headerCells.length);

            List<WeatherRecord> records = new ArrayList<>();
            String line;
            int lineNo = 1;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isEmpty()) continue;
                String[] cells = line.split(",", -1);
                if (cells.length != headerCells.length) {
                    throw new IllegalArgumentException("Line " + lineNo + " has " + cells.length
                            + " cells, expected " + headerCells.length);
                }
                Map<String, Double> values = new LinkedHashMap<>();
                for (int i = 1; i < cells.length; i++) {
                    if (!cells[i].isEmpty()) {
                        values.put(headerCells[i], Double.parseDouble(cells[i]));
                    }
                }
                records.add(new WeatherRecord(LocalDateTime.parse(cells[0]), values));
            }
            return new WeatherTable(columns, records);
        } catch (IOException | DateTimeParseException | NumberFormatException e) {
            throw new RuntimeException("Failed to deserialize CSV weather table", e);
        }
    }
}
