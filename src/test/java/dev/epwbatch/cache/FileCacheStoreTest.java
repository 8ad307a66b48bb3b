package dev.epwbatch.cache;

import dev.epwbatch.api.CacheStats;
import dev.epwbatch.api.DataType;
import dev.epwbatch.config.IndexType;
import dev.epwbatch.pipeline.WeatherRecord;
import dev.epwbatch.pipeline.WeatherTable;
import dev.epwbatch.testing.MutableClock;
import dev.epwbatch.testing.TestFiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileCacheStoreTest {

    public record Sample(String name, int count) {}

    private Path tmp;
    private MutableClock clock;
    private FileCacheStore store;

    @BeforeEach
    void setUp() throws IOException {
        tmp = Files.createTempDirectory("epw-cache-");
        clock = MutableClock.startingAtMillis(1_700_000_000_000L);
    }

    @AfterEach
    void tearDown() {
        if (store != null) store.close();
        TestFiles.deleteTree(tmp);
    }

    private FileCacheStore open(long maxBytes) {
        store = new FileCacheStore(tmp, maxBytes, Duration.ofHours(24), IndexType.JSON_FILE, clock);
        return store;
    }

    private List<Path> payloadFiles(String extension) throws IOException {
        try (Stream<Path> files = Files.list(tmp)) {
            return files.filter(p -> p.getFileName().toString().endsWith(extension)).collect(Collectors.toList());
        }
    }

    private static byte[] randomBytes(int n, long seed) {
        byte[] b = new byte[n];
        new Random(seed).nextBytes(b);
        return b;
    }

    @Test
    void neverSetKey_misses() {
        open(1 << 20);
        assertFalse(store.has("nope"));
        assertTrue(store.get("nope", byte[].class).isEmpty());
    }

    @Test
    void setThenGet_returnsSameBytes() {
        open(1 << 20);
        byte[] payload = randomBytes(4096, 42);
        store.set("blob", payload);

        assertTrue(store.has("blob"));
        Optional<byte[]> back = store.get("blob", byte[].class);
        assertTrue(back.isPresent());
        assertArrayEquals(payload, back.get());
    }

    @Test
    void tabularAndRecordValues_roundTripThroughTheirCodecs() throws IOException {
        open(1 << 20);
        WeatherTable table = WeatherTable.of(List.of(
                new WeatherRecord(LocalDateTime.of(2023, 1, 1, 1, 0), Map.of("temperature", 3.5)),
                new WeatherRecord(LocalDateTime.of(2023, 1, 1, 0, 0), Map.of("temperature", -1.25))));
        store.set("table", table);
        store.set("record", new Sample("De Bilt", 8760));
        store.set("text", "hello");

        assertEquals(table, store.get("table", WeatherTable.class).orElseThrow());
        assertEquals(new Sample("De Bilt", 8760), store.get("record", Sample.class).orElseThrow());
        assertEquals("hello", store.get("text", String.class).orElseThrow());
        assertEquals(1, payloadFiles(".csv").size());
        assertEquals(1, payloadFiles(".json").size() - 1, "index file plus one record payload");
        assertEquals(1, payloadFiles(".bin").size());
    }

    @Test
    void set_replacesPriorPayloadAndMetadata() throws IOException {
        open(1 << 20);
        store.set("k", "one");
        clock.advanceMillis(1000);
        store.set("k", new Sample("two", 2));

        assertEquals(new Sample("two", 2), store.get("k", Sample.class).orElseThrow());
        assertEquals(1, store.stats().entryCount());
        assertTrue(payloadFiles(".bin").isEmpty(), "old payload with another type is removed");
    }

    @Test
    void expiredEntry_missesButFileRemainsUntilNextSweep() throws IOException {
        open(1 << 20);
        store.set("short", "value", Duration.ofSeconds(10));
        clock.advanceMillis(10_000);
        assertTrue(store.has("short"), "exactly at ttl the entry is still valid");

        clock.advanceMillis(1);
        assertFalse(store.has("short"));
        assertTrue(store.get("short", String.class).isEmpty());
        assertEquals(1, payloadFiles(".bin").size(), "get does not delete");
        assertEquals(1, store.stats().expiredCount());

        store.set("other", new Sample("x", 1));
        assertTrue(payloadFiles(".bin").isEmpty(), "sweep after set removes expired payload");
        assertEquals(1, store.stats().entryCount());
    }

    @Test
    void tamperedPayload_isAMissNotAnError() throws IOException {
        open(1 << 20);
        store.set("k", "original");
        Path file = payloadFiles(".bin").get(0);
        Files.write(file, "tampered".getBytes(StandardCharsets.UTF_8));

        assertFalse(store.has("k"));
        assertTrue(store.get("k", String.class).isEmpty());
        assertEquals(1, store.stats().entryCount(), "corrupt entry is reported, not deleted");
    }

    @Test
    void missingPayload_isAMiss_andOrphanRecordIsSwept() throws IOException {
        open(1 << 20);
        store.set("k", "v");
        Files.delete(payloadFiles(".bin").get(0));

        assertTrue(store.get("k", String.class).isEmpty());
        store.set("k2", "v2");
        assertEquals(1, store.stats().entryCount());
        assertTrue(store.has("k2"));
    }

    @Test
    void sizeSweep_evictsOldestAccessedFirst() {
        open(100);
        store.set("a", randomBytes(40, 1));
        clock.advanceMillis(10);
        store.set("b", randomBytes(40, 2));
        clock.advanceMillis(10);
        assertTrue(store.get("a", byte[].class).isPresent());  // a now newer than b
        clock.advanceMillis(10);
        store.set("c", randomBytes(40, 3));

        assertTrue(store.has("a"));
        assertFalse(store.has("b"));
        assertTrue(store.has("c"));
        CacheStats stats = store.stats();
        assertEquals(2, stats.entryCount());
        assertTrue(stats.totalBytes() <= 100);
    }

    @Test
    void sizeSweep_removesUntilWithinBudget() {
        open(100);
        for (int i = 0; i < 5; i++) {
            store.set("k" + i, randomBytes(30, i));
            clock.advanceMillis(5);
        }
        assertEquals(3, store.stats().entryCount());
        assertFalse(store.has("k0"));
        assertFalse(store.has("k1"));
        assertTrue(store.has("k4"));
        assertTrue(store.stats().totalBytes() <= 100);
    }

    @Test
    void deleteAndClear_removeFilesAndRecords() throws IOException {
        open(1 << 20);
        store.set("a", "1");
        store.set("b", "2");
        store.set("c", new Sample("c", 3));

        assertTrue(store.delete("a"));
        assertFalse(store.delete("a"));
        assertFalse(store.has("a"));
        assertEquals(2, store.stats().entryCount());

        store.clear();
        assertEquals(0, store.stats().entryCount());
        assertTrue(payloadFiles(".bin").isEmpty());
        assertTrue(Files.exists(tmp.resolve(FileCacheStore.INDEX_FILE)));
    }

    @Test
    void stats_reportCountsAndUsage() {
        open(1000);
        store.set("long", randomBytes(100, 1));
        store.set("short", randomBytes(150, 2), Duration.ofSeconds(1));
        clock.advanceMillis(5_000);

        CacheStats stats = store.stats();
        assertEquals(2, stats.entryCount());
        assertEquals(1, stats.validCount());
        assertEquals(1, stats.expiredCount());
        assertEquals(250, stats.totalBytes());
        assertEquals(1000, stats.maxBytes());
        assertEquals(25.0, stats.usagePercent(), 1e-9);
    }

    @Test
    void purgeExpired_removesOnlyExpired() {
        open(1 << 20);
        store.set("keep", "x");
        store.set("drop1", "y", Duration.ofSeconds(1));
        store.set("drop2", "z", Duration.ofSeconds(1));
        clock.advanceMillis(2_000);

        assertEquals(2, store.purgeExpired());
        assertEquals(1, store.stats().entryCount());
        assertTrue(store.has("keep"));
        assertEquals(0, store.purgeExpired());
    }

    @Test
    void unsupportedValueForDataType_isSwallowed() {
        open(1 << 20);
        assertDoesNotThrow(() -> store.set("k", "not a table", null, DataType.TABULAR));
        assertFalse(store.has("k"));
        assertDoesNotThrow(() -> store.set("n", null));
        assertFalse(store.has("n"));
    }

    @Test
    void readingWithIncompatibleType_isAMiss() {
        open(1 << 20);
        store.set("k", new Sample("x", 1));
        assertTrue(store.get("k", WeatherTable.class).isEmpty());
        assertTrue(store.get("k", Sample.class).isPresent());
    }

    @Test
    void entriesSurviveReopen() {
        open(1 << 20);
        store.set("persist", new Sample("kept", 7));
        store.close();

        open(1 << 20);
        assertEquals(new Sample("kept", 7), store.get("persist", Sample.class).orElseThrow());
    }

    @Test
    void corruptIndexAtOpen_startsEmpty() throws IOException {
        Files.write(tmp.resolve(FileCacheStore.INDEX_FILE), "{not json".getBytes(StandardCharsets.UTF_8));
        open(1 << 20);

        assertEquals(0, store.stats().entryCount());
        store.set("k", "v");
        assertEquals("v", store.get("k", String.class).orElseThrow());
    }

    @Test
    void hit_updatesLastAccessInIndex() throws IOException {
        open(1 << 20);
        store.set("k", "v");
        clock.advanceMillis(5_000);
        store.get("k", String.class);
        store.close();

        JsonFileCacheIndex index = new JsonFileCacheIndex(tmp.resolve(FileCacheStore.INDEX_FILE));
        CacheEntryMeta meta = index.get("k").orElseThrow();
        assertEquals(meta.createdAtMillis() + 5_000, meta.lastAccessMillis());
        store = null;
    }

    @Test
    void payloadFileName_isHashOfKeyWithTypeExtension() {
        open(1 << 20);
        store.set("batch_result_260_2023", new Sample("a", 1));
        String expected = CacheKeys.fileName("batch_result_260_2023", DataType.RECORD);
        assertTrue(Files.exists(tmp.resolve(expected)));
        assertEquals(64 + ".json".length(), expected.length());
    }

    @Test
    void closedStore_missesAndDropsWrites_leavingIndexOnDiskIntact() throws IOException {
        open(1 << 20);
        store.set("a", "1");
        store.set("b", "2");
        store.close();

        store.set("c", "3");
        assertFalse(store.has("a"));
        assertTrue(store.get("a", String.class).isEmpty());
        assertFalse(store.delete("a"));
        store.clear();
        assertEquals(0, store.purgeExpired());
        assertEquals(0, store.stats().entryCount());
        assertEquals(2, payloadFiles(".bin").size());

        open(1 << 20);
        assertEquals(2, store.stats().entryCount());
        assertEquals("1", store.get("a", String.class).orElseThrow());
        assertEquals("2", store.get("b", String.class).orElseThrow());
        assertFalse(store.has("c"));
    }

    @Test
    void subSecondTtl_isRejected() {
        open(1 << 20);
        assertThrows(IllegalArgumentException.class, () -> store.set("k", "v", Duration.ofMillis(1500)));
        assertThrows(IllegalArgumentException.class, () -> store.set("k", "v", Duration.ofMillis(500)));
        assertThrows(IllegalArgumentException.class, () -> store.set("k", "v", Duration.ZERO));
        assertFalse(store.has("k"));

        assertThrows(IllegalArgumentException.class,
                () -> new FileCacheStore(tmp.resolve("other"), 1 << 20, Duration.ofMillis(500), IndexType.JSON_FILE, clock));
    }

    @Test
    void wholeSecondTtl_isKeptExactly() throws IOException {
        open(1 << 20);
        store.set("k", "v", Duration.ofSeconds(2));
        clock.advanceMillis(2_000);
        assertTrue(store.has("k"));
        clock.advanceMillis(1);
        assertFalse(store.has("k"));
    }
}
