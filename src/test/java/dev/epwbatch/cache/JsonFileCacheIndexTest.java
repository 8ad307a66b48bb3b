package dev.epwbatch.cache;

import dev.epwbatch.api.DataType;
import dev.epwbatch.testing.TestFiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileCacheIndexTest {

    private Path tmp;
    private Path file;

    @BeforeEach
    void setUp() throws IOException {
        tmp = Files.createTempDirectory("epw-index-");
        file = tmp.resolve("cache_metadata.json");
    }

    @AfterEach
    void tearDown() {
        TestFiles.deleteTree(tmp);
    }

    private static CacheEntryMeta meta(String key, long created) {
        return new CacheEntryMeta(key, DataType.RECORD, created, created, 60, "0000abcd", 10);
    }

    @Test
    void everyMutationRewritesWholeFile() throws IOException {
        JsonFileCacheIndex index = new JsonFileCacheIndex(file);
        index.put(meta("a", 1));
        index.put(meta("b", 2));
        String content = Files.readString(file);
        assertTrue(content.contains("\"a\""));
        assertTrue(content.contains("\"b\""));
        assertFalse(Files.exists(tmp.resolve("cache_metadata.json.tmp")));

        index.removeAll(List.of("a", "missing"));
        JsonFileCacheIndex reloaded = new JsonFileCacheIndex(file);
        assertEquals(1, reloaded.size());
        assertEquals(meta("b", 2), reloaded.get("b").orElseThrow());
    }

    @Test
    void unreadableFile_loadsEmpty() throws IOException {
        Files.write(file, "[1,2,".getBytes(StandardCharsets.UTF_8));
        JsonFileCacheIndex index = new JsonFileCacheIndex(file);
        assertEquals(0, index.size());

        index.put(meta("x", 5));
        assertEquals(1, new JsonFileCacheIndex(file).size());
    }

    @Test
    void expiry_isStrictlyGreaterThanTtl() {
        CacheEntryMeta m = meta("k", 1_000);
        assertFalse(m.isExpired(61_000));
        assertTrue(m.isExpired(61_001));
    }

    @Test
    void failedSave_leavesInMemoryRecordsUnchanged() throws IOException {
        JsonFileCacheIndex index = new JsonFileCacheIndex(file);
        index.put(meta("a", 1));
        index.put(meta("b", 2));

        // a directory in place of the temp file makes every save fail
        Path blocker = Files.createDirectory(tmp.resolve("cache_metadata.json.tmp"));
        assertThrows(IOException.class, () -> index.remove("a"));
        assertThrows(IOException.class, () -> index.removeAll(List.of("a", "b")));
        assertThrows(IOException.class, index::clear);
        assertThrows(IOException.class, () -> index.put(meta("c", 3)));
        assertEquals(2, index.size());
        assertTrue(index.get("a").isPresent());
        assertTrue(index.get("b").isPresent());
        assertFalse(index.get("c").isPresent());

        Files.delete(blocker);
        index.remove("a");
        assertEquals(1, new JsonFileCacheIndex(file).size());
    }
}
