package com.docmend.dispatch.cli;

import com.docmend.core.apply.ApplyEngine;
import com.docmend.core.backup.BackupManager;
import com.docmend.core.backup.BackupProperties;
import com.docmend.core.corpus.CorpusIndex;
import com.docmend.core.corpus.CorpusProperties;
import com.docmend.core.health.HealthCheckService;
import com.docmend.core.health.HealthStatus;
import com.docmend.core.metrics.DocmendMetrics;
import com.docmend.core.suggest.KeywordSuggestionStrategy;
import com.docmend.core.suggest.SuggestProperties;
import com.docmend.core.suggest.SuggestionGenerator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the Docmend CLI command structure.
 * These tests exercise picocli directly without Spring context, over a real
 * corpus and backup directory in a temp folder.
 */
class CliTest {

    private static final String GUIDE = """
            # Guide
            Welcome.
            ## Agents
            Agents can delegate work.
            Use as_tool to invoke sub-agents.
            """;

    @TempDir
    Path tempDir;

    private Path docs;
    private Path backups;
    private CorpusIndex corpusIndex;
    private BackupManager backupManager;
    private SuggestionGenerator generator;
    private ApplyEngine applyEngine;
    private HealthCheckService healthCheckService;

    private record CliResult(int exitCode, String output) {}

    @BeforeEach
    void setUp() throws IOException {
        docs = Files.createDirectories(tempDir.resolve("docs"));
        backups = tempDir.resolve("backups");
        Files.writeString(docs.resolve("guide.md"), GUIDE);
        Files.writeString(docs.resolve("tools.md"), "# Tools\nTools are functions.\n");

        var corpusProperties = new CorpusProperties();
        corpusProperties.setRoot(docs.toString());
        corpusIndex = new CorpusIndex(corpusProperties);

        var backupProperties = new BackupProperties();
        backupProperties.setDir(backups.toString());
        backupManager = new BackupManager(backupProperties);

        var metrics = new DocmendMetrics(new SimpleMeterRegistry());
        var keyword = new KeywordSuggestionStrategy(corpusIndex, new SuggestProperties());
        generator = new SuggestionGenerator(keyword, keyword, metrics);
        applyEngine = new ApplyEngine(corpusIndex, backupManager, metrics);

        healthCheckService = mock(HealthCheckService.class);
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("corpus", HealthStatus.Status.UP, "2 document(s)", Map.of()),
                new HealthStatus("llm", HealthStatus.Status.DEGRADED, "No chat model enabled", Map.of())));
    }

    /**
     * Custom picocli IFactory that provides test dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == SuggestCommand.class) {
                    return (K) new SuggestCommand(generator, applyEngine);
                }
                if (cls == FilesCommand.class) {
                    return (K) new FilesCommand(corpusIndex);
                }
                if (cls == BackupsCommand.class) {
                    return (K) new BackupsCommand(backupManager);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                // Default: use picocli's default factory for other classes
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new DocmendCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            for (String sub : List.of("suggest", "files", "backups", "health", "serve", "help")) {
                assertTrue(output.contains(sub), "Help should list '" + sub + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Docmend 0.1.0"));
        }

        @Test
        @DisplayName("suggest --help shows apply options")
        void suggestHelpOutput() {
            CliResult result = execute("suggest", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--apply"));
            assertTrue(result.output().contains("--apply-all"));
        }

        @Test
        @DisplayName("no subcommand prints banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("DOCMEND v0.1.0"));
            assertTrue(result.output().contains("Usage:"));
        }
    }

    // =====================================================================
    //  suggest
    // =====================================================================

    @Nested
    @DisplayName("suggest command")
    class SuggestTests {

        @Test
        @DisplayName("prints numbered suggestions without touching files")
        void printsSuggestions() throws IOException {
            CliResult result = execute("suggest", "replace", "as_tool", "with", "handoff");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[1]"));
            assertTrue(result.output().contains("guide.md:5"));
            assertTrue(result.output().contains("Review and update the mention of 'as_tool'"));
            assertEquals(GUIDE, Files.readString(docs.resolve("guide.md")));
            assertFalse(Files.exists(backups));
        }

        @Test
        @DisplayName("a query word equal to 'serve' still runs suggest")
        void queryContainingServe() throws Exception {
            var runner = new CliRunner(new DocmendCommand(), createFactory());
            ByteArrayOutputStream capture = new ByteArrayOutputStream();
            PrintStream originalOut = System.out;
            System.setOut(new PrintStream(capture, true));
            try {
                runner.run("suggest", "update", "serve", "as_tool");
            } finally {
                System.setOut(originalOut);
            }

            assertEquals(0, runner.getExitCode());
            assertTrue(capture.toString().contains("guide.md:5"));
            assertFalse(CliRunner.isServeMode("suggest", "update", "serve", "as_tool"));
            assertTrue(CliRunner.isServeMode("serve"));
            assertFalse(CliRunner.isServeMode());
        }

        @Test
        @DisplayName("no matches is a successful, empty run")
        void noMatches() {
            CliResult result = execute("suggest", "zebra");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No matching documentation found."));
        }

        @Test
        @DisplayName("blank query exits with code 2")
        void blankQuery() {
            CliResult result = execute("suggest", "   ");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Query must not be empty"));
        }

        @Test
        @DisplayName("--apply writes the selected suggestion and reports the backup")
        void applySelected() throws IOException {
            CliResult result = execute("suggest", "as_tool", "--apply", "1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[BACKUP]"));
            assertTrue(result.output().contains("Applied 1 updates successfully"));
            assertNotEquals("Use as_tool to invoke sub-agents.", Files.readAllLines(docs.resolve("guide.md")).get(4));
            try (var listing = Files.list(backups)) {
                assertEquals(1, listing.count());
            }
        }

        @Test
        @DisplayName("--apply with unknown ids exits with code 1 and changes nothing")
        void applyUnknownIds() throws IOException {
            CliResult result = execute("suggest", "as_tool", "--apply", "7,8");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("None of the requested ids match"));
            assertEquals(GUIDE, Files.readString(docs.resolve("guide.md")));
        }

        @Test
        @DisplayName("--apply-all applies one suggestion per matching file")
        void applyAll() throws IOException {
            CliResult result = execute("suggest", "tools", "agents", "--apply-all");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Applied 2 updates successfully"));
            try (var listing = Files.list(backups)) {
                assertEquals(2, listing.count());
            }
        }
    }

    // =====================================================================
    //  Listings and health
    // =====================================================================

    @Nested
    @DisplayName("listing commands")
    class ListingTests {

        @Test
        @DisplayName("files lists every document with line counts")
        void files() {
            CliResult result = execute("files");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("2 file(s)"));
            assertTrue(result.output().contains("guide.md"));
            assertTrue(result.output().contains("tools.md"));
        }

        @Test
        @DisplayName("backups reports when nothing has been backed up")
        void noBackups() {
            CliResult result = execute("backups");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No backups found."));
        }

        @Test
        @DisplayName("backups --limit caps the table")
        void backupsLimit() {
            execute("suggest", "tools", "agents", "--apply-all");

            CliResult result = execute("backups", "--limit", "1");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Backups (1 of 2):"));
        }

        @Test
        @DisplayName("health shows each component and the overall verdict")
        void health() {
            CliResult result = execute("health");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("corpus: 2 document(s)"));
            assertTrue(result.output().contains("llm: No chat model enabled"));
            assertTrue(result.output().contains("Overall: ready"));
        }
    }
}
