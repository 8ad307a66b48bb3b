package dev.epwbatch.station;

import dev.epwbatch.error.StationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the station table, which is stored column-wise: the first row holds the station ids
 * and the next four rows hold name, abbreviation, latitude and longitude.
 */
public final class CsvStationRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CsvStationRegistry.class);
    private static final int ROWS = 5;

    private CsvStationRegistry() {}

    public static StationRegistry load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new StationException("Station info file not found: " + file, null, "load_stations");
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StationException("Failed to read station info file " + file, null, "load_stations", e);
        }
        lines.removeIf(String::isBlank);
        if (lines.size() < ROWS) {
            throw new StationException("Station info file " + file + " has " + lines.size()
                    + " rows, expected " + ROWS, null, "load_stations");
        }

        String[][] rows = new String[ROWS][];
        for (int r = 0; r < ROWS; r++) {
            rows[r] = lines.get(r).split(",", -1);
        }

        List<StationMeta> stations = new ArrayList<>();
        for (int col = 0; col < rows[0].length; col++) {
            String id = rows[0][col].trim();
            try {
                stations.add(new StationMeta(id,
                        cell(rows[1], col),
                        cell(rows[2], col),
                        Double.parseDouble(cell(rows[3], col)),
                        Double.parseDouble(cell(rows[4], col))));
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                logger.warn("Failed to load station {}: {}", id, e.getMessage());
            }
        }
        logger.info("Loaded {} weather stations from {}", stations.size(), file);
        return new InMemoryStationRegistry(stations);
    }

    private static String cell(String[] row, int col) {
        return row[col].trim();
    }
}
