package dev.epwbatch.cli;

import dev.epwbatch.testing.TestFiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EpwBatchCommandTest {

    private Path tmp;
    private Path configFile;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        tmp = Files.createTempDirectory("epw-cli-");
        Path stations = tmp.resolve("stations.csv");
        Files.write(stations, List.of("260,280", "De Bilt,Eelde", "DBL,ELD", "52.100,53.125", "5.180,6.585"),
                StandardCharsets.UTF_8);
        configFile = writeConfig("config.yaml", 2);
    }

    @AfterEach
    void tearDown() {
        TestFiles.deleteTree(tmp);
    }

    private Path writeConfig(String name, int workers) throws Exception {
        Path file = tmp.resolve(name);
        Files.write(file, List.of(
                "paths:",
                "  data_dir: " + tmp.resolve("data"),
                "  epw_output_dir: " + tmp.resolve("out"),
                "  station_info_file: " + tmp.resolve("stations.csv"),
                "processing:",
                "  max_workers: " + workers,
                "  pipeline: fake"), StandardCharsets.UTF_8);
        return file;
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cmd = EpwBatchCommand.newCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private int generate(String... extra) {
        List<String> args = new ArrayList<>(List.of("generate", "--year", "2023", "--config", configFile.toString()));
        args.addAll(Arrays.asList(extra));
        return run(args.toArray(new String[0]));
    }

    @Test
    void generate_allStations_exitsZero_andWritesFiles() {
        int code = generate();

        assertEquals(0, code, err.toString());
        assertTrue(out.toString().contains("Processed 2 items: 2 successful, 0 failed"), out.toString());
        assertTrue(Files.exists(tmp.resolve("out").resolve("De Bilt").resolve("NLD_DBL_EPW_YR2023.epw")));
        assertTrue(Files.exists(tmp.resolve("out").resolve("Eelde").resolve("NLD_ELD_EPW_YR2023.epw")));
    }

    @Test
    void generate_secondRun_reportsCacheHits() {
        assertEquals(0, generate("--stations", "260"));
        assertEquals(0, generate("--stations", "260", "--sequential", "--no-streaming"));
        assertTrue(out.toString().contains("cache hits: 1, misses: 0"), out.toString());
    }

    @Test
    void generate_someFailures_stillExitsZero_andListsThem() {
        int code = generate("--stations", "260,999");
        assertEquals(0, code);
        assertTrue(out.toString().contains("999/2023"), out.toString());
    }

    @Test
    void generate_allFailed_exitsOne() {
        assertEquals(1, generate("--stations", "999", "--disable-cache"));
        assertTrue(out.toString().contains("0 successful, 1 failed"));
    }

    @Test
    void generate_invalidConfig_exitsTwo() throws Exception {
        configFile = writeConfig("bad.yaml", 0);
        assertEquals(2, generate());
        assertTrue(err.toString().contains("processing.max_workers"), err.toString());
    }

    @Test
    void generate_unknownPipeline_exitsTwo() {
        assertEquals(2, generate("--pipeline", "nope"));
        assertTrue(err.toString().contains("CONFIG_ERROR"));
    }

    @Test
    void generate_outputDirOverride_isHonoured() {
        Path other = tmp.resolve("elsewhere");
        assertEquals(0, generate("--stations", "280", "--output-dir", other.toString()));
        assertTrue(Files.exists(other.resolve("Eelde").resolve("NLD_ELD_EPW_YR2023.epw")));
    }

    @Test
    void cacheStats_purge_andClear() {
        assertEquals(0, generate());

        assertEquals(0, run("cache", "stats", "--config", configFile.toString()));
        assertTrue(out.toString().contains("Region: batch"), out.toString());
        assertTrue(out.toString().contains("Entries: 2 (2 valid, 0 expired)"), out.toString());

        assertEquals(0, run("cache", "purge", "--config", configFile.toString()));
        assertTrue(out.toString().contains("Purged 0 expired entries"), out.toString());

        assertEquals(0, run("cache", "clear", "--region", "batch", "--config", configFile.toString()));
        assertTrue(out.toString().contains("Cleared 2 entries from region batch"), out.toString());

        assertEquals(0, run("cache", "stats", "--config", configFile.toString()));
        assertTrue(out.toString().contains("Entries: 0"), out.toString());
    }

    @Test
    void noSubcommand_printsUsage() {
        assertEquals(0, run());
        assertTrue(out.toString().contains("generate"));
        assertTrue(out.toString().contains("cache"));
    }

    @Test
    void missingYear_isUsageError() {
        assertEquals(CommandLine.ExitCode.USAGE, run("generate"));
    }
}
