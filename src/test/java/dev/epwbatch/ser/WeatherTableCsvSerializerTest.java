package dev.epwbatch.ser;

import dev.epwbatch.pipeline.WeatherRecord;
import dev.epwbatch.pipeline.WeatherTable;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WeatherTableCsvSerializerTest {

    private final WeatherTableCsvSerializer serializer = new WeatherTableCsvSerializer();

    @Test
    void writesHeaderAndEmptyCellsForMissingValues() {
        Map<String, Double> full = new LinkedHashMap<>();
        full.put("temperature", 12.5);
        full.put("humidity", 80.0);
        WeatherTable table = new WeatherTable(List.of("temperature", "humidity"), List.of(
                new WeatherRecord(LocalDateTime.of(2023, 6, 1, 13, 0), Map.of("temperature", 20.0)),
                new WeatherRecord(LocalDateTime.of(2023, 6, 1, 12, 0), full)));

        String csv = new String(serializer.serialize(table), StandardCharsets.UTF_8);

        assertEquals("timestamp,temperature,humidity\n"
                + "2023-06-01T12:00,12.5,80.0\n"
                + "2023-06-01T13:00,20.0,\n", csv);
        assertEquals(table, serializer.deserialize(csv.getBytes(StandardCharsets.UTF_8), WeatherTable.class));
    }

    @Test
    void emptyTable_hasOnlyHeader() {
        byte[] bytes = serializer.serialize(WeatherTable.empty());
        assertEquals("timestamp\n", new String(bytes, StandardCharsets.UTF_8));
        assertTrue(serializer.deserialize(bytes, WeatherTable.class).isEmpty());
    }

    @Test
    void raggedRows_areRejected() {
        byte[] bad = "timestamp,t\n2023-01-01T00:00,1.0,2.0\n".getBytes(StandardCharsets.UTF_8);
        assertThrows(IllegalArgumentException.class, () -> serializer.deserialize(bad, WeatherTable.class));
    }

    @Test
    void unparseableCells_areWrapped() {
        byte[] bad = "timestamp,t\nyesterday,1.0\n".getBytes(StandardCharsets.UTF_8);
        assertThrows(RuntimeException.class, () -> serializer.deserialize(bad, WeatherTable.class));
    }

    @Test
    void unsafeColumnNames_areRejected() {
        WeatherTable table = new WeatherTable(List.of("a,b"), List.of());
        assertThrows(IllegalArgumentException.class, () -> serializer.serialize(table));
    }

    @Test
    void undeclaredAndNullValues_roundTripWithoutLoss() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("temperature", 12.5);
        values.put("humidity", 80.0);
        values.put("pressure", null);
        WeatherTable table = new WeatherTable(List.of("temperature"), List.of(
                new WeatherRecord(LocalDateTime.of(2023, 6, 1, 12, 0), values)));

        assertEquals(List.of("temperature", "humidity"), table.columns());
        assertEquals(Map.of("temperature", 12.5, "humidity", 80.0), table.records().get(0).values());

        WeatherTable back = serializer.deserialize(serializer.serialize(table), WeatherTable.class);
        assertEquals(table, back);
    }
}
