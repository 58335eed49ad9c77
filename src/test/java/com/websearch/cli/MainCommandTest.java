package com.websearch.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.websearch.CorpusFixtures;
import com.websearch.query.QueryMode;
import com.websearch.query.SearchHit;
import com.websearch.query.SearchResult;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private PrintStream originalOut;
    private PrintStream originalErr;
    private ByteArrayOutputStream outputBuffer;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        outputBuffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void testCallWithoutSubcommand() {
        assertEquals(ExitCodes.OK, new MainCommand().call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        assertEquals(ExitCodes.OK, new CommandLine(new MainCommand()).execute("--help"));
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--threads", "6", "search", "-m", "or", "machine", "learning");

        assertNotNull(parseResult.subcommand());
        assertEquals("search", parseResult.subcommand().commandSpec().name());
        assertEquals(List.of("machine", "learning"), parseResult.subcommand().matchedPositional(0).getValue());
    }

    @Test
    void testSearchWithoutIndexReturnsIndexMissing() {
        int exitCode = new CommandLine(new MainCommand())
            .execute("--index-dir", tempDir.resolve("missing").toString(), "search", "learning");

        assertEquals(ExitCodes.INDEX_MISSING, exitCode);
    }

    @Test
    void testBatchAndStatusWithoutIndexReturnIndexMissing() {
        String indexDir = tempDir.resolve("missing").toString();

        assertEquals(ExitCodes.INDEX_MISSING, new CommandLine(new MainCommand()).execute("--index-dir", indexDir, "batch"));
        assertEquals(ExitCodes.INDEX_MISSING, new CommandLine(new MainCommand()).execute("--index-dir", indexDir, "status"));
    }

    @Test
    void testBuildMissingCorpusIsConfigError() {
        int exitCode = new CommandLine(new MainCommand()).execute(
            "--index-dir", tempDir.resolve("index").toString(), "build", tempDir.resolve("nope").toString());

        assertEquals(ExitCodes.CONFIG_ERROR, exitCode);
    }

    @Test
    void testInvalidQueryArgumentsAreConfigErrors() throws Exception {
        String indexDir = buildIndex();

        assertEquals(ExitCodes.CONFIG_ERROR,
            new CommandLine(new MainCommand()).execute("--index-dir", indexDir, "search", "-k", "0", "learning"));
        assertEquals(ExitCodes.CONFIG_ERROR,
            new CommandLine(new MainCommand()).execute("--index-dir", indexDir, "search", "-m", "xor", "learning"));
        assertEquals(ExitCodes.CONFIG_ERROR,
            new CommandLine(new MainCommand()).execute("--index-dir", indexDir, "search", "-f", "xml", "learning"));
        assertEquals(ExitCodes.CONFIG_ERROR,
            new CommandLine(new MainCommand()).execute("--index-dir", indexDir, "batch", "-k", "0"));
    }

    @Test
    void testLargeTopKIsAccepted() throws Exception {
        String indexDir = buildIndex();

        assertEquals(ExitCodes.OK,
            new CommandLine(new MainCommand()).execute("--index-dir", indexDir, "search", "-k", "5000", "-m", "or", "machine learning"));
    }

    @Test
    void testZeroResultsIsSuccess() throws Exception {
        String indexDir = buildIndex();
        outputBuffer.reset();

        int exitCode = new CommandLine(new MainCommand()).execute("--index-dir", indexDir, "search", "zebra");

        assertEquals(ExitCodes.OK, exitCode);
        assertTrue(outputBuffer.toString(StandardCharsets.UTF_8).contains("未找到匹配结果"));
    }

    @Test
    void testSearchJsonOutput() throws Exception {
        String indexDir = buildIndex();
        Path outputFile = tempDir.resolve("results/search.json");
        outputBuffer.reset();

        int exitCode = new CommandLine(new MainCommand()).execute("--index-dir", indexDir,
            "search", "-m", "OR", "-f", "json", "-o", outputFile.toString(), "machine", "learning");

        assertEquals(ExitCodes.OK, exitCode);
        assertTrue(outputBuffer.toString(StandardCharsets.UTF_8).contains("\"totalMatches\""));
        JsonNode root = new ObjectMapper().readTree(outputFile.toFile());
        assertEquals(2, root.get("machine learning").get("totalMatches").asInt());
    }

    @Test
    void testBatchWritesCanonicalResults() throws Exception {
        String indexDir = buildIndex();
        Path outputFile = tempDir.resolve("batch.json");

        int exitCode = new CommandLine(new MainCommand())
            .execute("--index-dir", indexDir, "batch", "-o", outputFile.toString());

        assertEquals(ExitCodes.OK, exitCode);
        JsonNode root = new ObjectMapper().readTree(outputFile.toFile());
        assertEquals(4, root.size());
        assertEquals("https://example.edu/ml", root.get("machine learning").get("hits").get(0).get("url").asText());
    }

    @Test
    void testInteractiveLoop() throws Exception {
        String indexDir = buildIndex();
        InputStream originalIn = System.in;
        outputBuffer.reset();
        try {
            System.setIn(new ByteArrayInputStream("learning\n\nzebra\nquit\nmachine\n".getBytes(StandardCharsets.UTF_8)));
            int exitCode = new CommandLine(new MainCommand()).execute("--index-dir", indexDir, "interactive");
            assertEquals(ExitCodes.OK, exitCode);
        } finally {
            System.setIn(originalIn);
        }

        String output = outputBuffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("https://example.edu/learn"));
        assertTrue(output.contains("未找到匹配结果"));
        assertTrue(!output.contains("\"machine\""));
    }

    @Test
    void testInteractiveStopsAtEndOfInput() throws Exception {
        String indexDir = buildIndex();
        InputStream originalIn = System.in;
        try {
            System.setIn(new ByteArrayInputStream("learning\n".getBytes(StandardCharsets.UTF_8)));
            assertEquals(ExitCodes.OK, new CommandLine(new MainCommand()).execute("--index-dir", indexDir, "interactive"));
        } finally {
            System.setIn(originalIn);
        }
    }

    @Test
    void testStatusSubcommandFormatBytesBranches() throws Exception {
        MainCommand.StatusSubcommand statusSubcommand = new MainCommand.StatusSubcommand();
        Method formatBytesMethod = MainCommand.StatusSubcommand.class.getDeclaredMethod("formatBytes", long.class);
        formatBytesMethod.setAccessible(true);

        assertEquals("512 B", formatBytesMethod.invoke(statusSubcommand, 512L));
        assertEquals("2.00 KB", formatBytesMethod.invoke(statusSubcommand, 2048L));
        assertEquals("3.00 MB", formatBytesMethod.invoke(statusSubcommand, 3L * 1024 * 1024));
        assertEquals("4.00 GB", formatBytesMethod.invoke(statusSubcommand, 4L * 1024 * 1024 * 1024));
    }

    @Test
    void testPrintTextResult() {
        SearchResult result = new SearchResult("demo", QueryMode.AND,
            List.of(new SearchHit(3, "https://example.edu/demo", 1.5)), 1, 2L);

        MainCommand.printTextResult(result);

        String output = outputBuffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("1. https://example.edu/demo (docId: 3"));
        assertTrue(output.contains("[AND]"));
    }

    @Test
    void testSubcommandsHappyPath() throws Exception {
        Path indexDir = tempDir.resolve("index");
        Path corpusDir = tempDir.resolve("corpus");
        CorpusFixtures.writeMachineLearningCorpus(corpusDir);

        MainCommand mainCommand = new MainCommand();
        setField(mainCommand, "indexDir", indexDir);
        setField(mainCommand, "threads", 2);

        MainCommand.BuildSubcommand buildSubcommand = new MainCommand.BuildSubcommand();
        setField(buildSubcommand, "main", mainCommand);
        setField(buildSubcommand, "corpusDir", corpusDir);
        setField(buildSubcommand, "maxDocs", 1);
        assertEquals(ExitCodes.OK, buildSubcommand.call());

        MainCommand.StatusSubcommand statusSubcommand = new MainCommand.StatusSubcommand();
        setField(statusSubcommand, "main", mainCommand);
        assertEquals(ExitCodes.OK, statusSubcommand.call());

        Files.delete(indexDir.resolve("documents.db"));

        MainCommand.SearchSubcommand searchSubcommand = new MainCommand.SearchSubcommand();
        setField(searchSubcommand, "main", mainCommand);
        setField(searchSubcommand, "queryWords", List.of("learning"));
        setField(searchSubcommand, "format", "text");
        assertEquals(ExitCodes.INTERNAL_ERROR, searchSubcommand.call());

        MainCommand.RebuildDocMapSubcommand rebuildSubcommand = new MainCommand.RebuildDocMapSubcommand();
        setField(rebuildSubcommand, "main", mainCommand);
        setField(rebuildSubcommand, "corpusDir", corpusDir);
        assertEquals(ExitCodes.OK, rebuildSubcommand.call());
        assertTrue(Files.isRegularFile(indexDir.resolve("documents.db")));

        assertEquals(ExitCodes.OK, searchSubcommand.call());
    }

    private String buildIndex() throws Exception {
        Path indexDir = tempDir.resolve("index");
        Path corpusDir = tempDir.resolve("corpus");
        CorpusFixtures.writeMachineLearningCorpus(corpusDir);
        int exitCode = new CommandLine(new MainCommand()).execute(
            "--index-dir", indexDir.toString(), "--threads", "2", "build", corpusDir.toString());
        assertEquals(ExitCodes.OK, exitCode);
        return indexDir.toString();
    }

    private static void setField(Object target, String fieldName, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }
}
