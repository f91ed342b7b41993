package com.rbdesugar.lowertool;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestLowerTool {

    private static final String LOC = "{\"start\":{\"line\":1,\"column\":0},\"end\":{\"line\":1,\"column\":10}}";
    private static final String MULTI_LINE_LOC = "{\"start\":{\"line\":1,\"column\":0},\"end\":{\"line\":3,\"column\":2}}";

    @TempDir
    Path tempDir;

    @Test
    void testParseDefaults() {
        LowerTool.Config config = LowerTool.Config.parse(new String[]{"trees"});
        assertNotNull(config);
        assertEquals(List.of(Path.of("trees")), config.sourceDirs);
        assertEquals(List.of("json"), config.extensions);
        assertEquals(Path.of("lower-tool-output"), config.outputDir);
        assertFalse(config.pretty);
        assertFalse(config.verbose);
        assertTrue(config.threads > 0);
    }

    @Test
    void testParseOptions() {
        LowerTool.Config config = LowerTool.Config.parse(new String[]{
            "--threads=3", "--output-dir=out", "--extensions=json,ast", "--pretty", "-v", "a", "b"
        });
        assertNotNull(config);
        assertEquals(3, config.threads);
        assertEquals(Path.of("out"), config.outputDir);
        assertEquals(List.of("json", "ast"), config.extensions);
        assertTrue(config.pretty);
        assertTrue(config.verbose);
        assertEquals(List.of(Path.of("a"), Path.of("b")), config.sourceDirs);
    }

    @Test
    void testParseRejectsBadArguments() {
        assertNull(LowerTool.Config.parse(new String[]{"--help"}));
        assertNull(LowerTool.Config.parse(new String[]{}));
        assertNull(LowerTool.Config.parse(new String[]{"--bogus", "dir"}));
        assertNull(LowerTool.Config.parse(new String[]{"--threads=zero", "dir"}));
        assertNull(LowerTool.Config.parse(new String[]{"--threads=0", "dir"}));
    }

    @Test
    void testOutputFileName() {
        LowerTool tool = new LowerTool(LowerTool.Config.parse(new String[]{"--output-dir=out", "src"}));
        assertEquals(Path.of("out", "foo.core.json"), tool.outputFileFor(Path.of("src"), Path.of("src", "foo.json")));
        assertEquals(Path.of("out", "lib", "util", "foo.core.json"),
            tool.outputFileFor(Path.of("src"), Path.of("src", "lib", "util", "foo.json")));
        assertEquals(Path.of("out", "single.core.json"),
            tool.outputFileFor(Path.of("single.json"), Path.of("single.json")));
        assertTrue(tool.hasValidExtension(Path.of("x.JSON")));
        assertFalse(tool.hasValidExtension(Path.of("x.rb")));
    }

    @Test
    void testRunLowersGoodUnitsAndRecordsFailures() throws Exception {
        Path sources = Files.createDirectories(tempDir.resolve("src"));
        Path output = tempDir.resolve("out");
        Files.writeString(sources.resolve("good.json"),
            "{\"type\": \"Send\", \"loc\": " + LOC + ", \"method\": \"puts\", \"args\": []}");
        Files.writeString(sources.resolve("unknown.json"),
            "{\"type\": \"Bogus\", \"loc\": " + LOC + "}");
        Files.writeString(sources.resolve("fatal.json"),
            "{\"type\": \"LineLiteral\", \"loc\": " + MULTI_LINE_LOC + "}");
        Files.writeString(sources.resolve("notes.txt"), "ignored");

        LowerTool tool = new LowerTool(LowerTool.Config.parse(new String[]{
            "--threads=2", "--output-dir=" + output, sources.toString()
        }));

        assertEquals(1, tool.run());
        assertEquals(1, tool.loweredCount());
        assertEquals(2, tool.failedCount());

        String lowered = Files.readString(output.resolve("good.core.json"));
        assertTrue(lowered.startsWith("{\"type\":\"ClassDef\""));
        assertTrue(lowered.contains("\"fun\":\"puts\""));
        assertFalse(Files.exists(output.resolve("fatal.core.json")));

        String summary = Files.readString(output.resolve("failure-summary.txt"));
        assertTrue(summary.contains("LOWERING_ABORTED: 1"));
        assertTrue(summary.contains("INVALID_PARSE_TREE: 1"));
        assertTrue(Files.exists(output.resolve("failures.json")));
    }

    @Test
    void testRunSucceedsWhenEveryUnitLowers() throws Exception {
        Path sources = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(sources.resolve("nil.json"), "{\"type\": \"Nil\", \"loc\": " + LOC + "}");

        LowerTool tool = new LowerTool(LowerTool.Config.parse(new String[]{
            "--output-dir=" + tempDir.resolve("out"), sources.toString()
        }));

        assertEquals(0, tool.run());
        assertFalse(Files.exists(tempDir.resolve("out").resolve("failure-summary.txt")));
    }

    @Test
    void testSameNamedUnitsInSubdirectoriesKeepSeparateOutputs() throws Exception {
        Path sources = tempDir.resolve("src");
        Files.createDirectories(sources.resolve("a"));
        Files.createDirectories(sources.resolve("b"));
        Files.writeString(sources.resolve("a").resolve("x.json"), send("aaa"));
        Files.writeString(sources.resolve("b").resolve("x.json"), send("bbb"));
        Path output = tempDir.resolve("out");

        LowerTool tool = new LowerTool(LowerTool.Config.parse(new String[]{
            "--threads=2", "--output-dir=" + output, sources.toString()
        }));

        assertEquals(0, tool.run());
        assertEquals(2, tool.loweredCount());
        String first = Files.readString(output.resolve("a").resolve("x.core.json"));
        String second = Files.readString(output.resolve("b").resolve("x.core.json"));
        assertTrue(first.contains("\"fun\":\"aaa\""));
        assertTrue(second.contains("\"fun\":\"bbb\""));
        assertFalse(Files.exists(output.resolve("x.core.json")));
    }

    @Test
    void testCollidingOutputsAreRecordedNotOverwritten() throws Exception {
        Path first = Files.createDirectories(tempDir.resolve("one"));
        Path second = Files.createDirectories(tempDir.resolve("two"));
        Files.writeString(first.resolve("x.json"), send("aaa"));
        Files.writeString(second.resolve("x.json"), send("bbb"));
        Path output = tempDir.resolve("out");

        LowerTool tool = new LowerTool(LowerTool.Config.parse(new String[]{
            "--output-dir=" + output, first.toString(), second.toString()
        }));

        assertEquals(1, tool.run());
        assertEquals(1, tool.loweredCount());
        assertEquals(1, tool.failedCount());
        assertTrue(Files.readString(output.resolve("x.core.json")).contains("\"fun\":\"aaa\""));
        assertTrue(Files.readString(output.resolve("failure-summary.txt")).contains("OUTPUT_COLLISION: 1"));
    }

    @Test
    void testMissingIdentifierIsRecordedAsAbortedUnit() throws Exception {
        Path sources = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(sources.resolve("nameless.json"),
            "{\"type\": \"Send\", \"loc\": " + LOC + ", \"args\": []}");
        Path output = tempDir.resolve("out");

        LowerTool tool = new LowerTool(LowerTool.Config.parse(new String[]{
            "--output-dir=" + output, sources.toString()
        }));

        assertEquals(1, tool.run());
        assertEquals(1, tool.failedCount());
        assertTrue(Files.readString(output.resolve("failure-summary.txt")).contains("LOWERING_ABORTED: 1"));
        assertTrue(Files.readString(output.resolve("failures.json")).contains("nameless.json"));
    }

    @Test
    void testUnexpectedRuntimeFailureIsRecorded() throws Exception {
        Path sources = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(sources.resolve("flags.json"), "{\"type\": \"Regopt\", \"loc\": " + LOC + "}");
        Path output = tempDir.resolve("out");

        LowerTool tool = new LowerTool(LowerTool.Config.parse(new String[]{
            "--output-dir=" + output, sources.toString()
        }));

        assertEquals(1, tool.run());
        assertEquals(0, tool.loweredCount());
        assertEquals(1, tool.failedCount());
        assertTrue(Files.readString(output.resolve("failure-summary.txt")).contains("UNEXPECTED_ERROR: 1"));
        assertTrue(Files.readString(output.resolve("failures.json")).contains("flags.json"));
    }

    private static String send(String method) {
        return "{\"type\": \"Send\", \"loc\": " + LOC + ", \"method\": \"" + method + "\", \"args\": []}";
    }
}
