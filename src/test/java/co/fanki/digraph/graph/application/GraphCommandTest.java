package co.fanki.digraph.graph.application;

import co.fanki.digraph.graph.domain.CycleDetector;
import co.fanki.digraph.graph.domain.FilterDirection;
import co.fanki.digraph.graph.domain.GraphBuilder;
import co.fanki.digraph.graph.domain.GraphFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link GraphCommand}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphCommandTest {

    private static final String DECLARATIONS = """
            [
              {"name": "UserComponent", "kind": "component",
               "dependencies": [{"token": "UserService"}]},
              {"name": "UserService", "kind": "service",
               "dependencies": [{"token": "UserComponent"},
                                {"token": "HttpClient"}]}
            ]
            """;

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream stdout;
    private DependencyGraphService graphService;
    private GraphCommand command;

    @BeforeEach
    void setUp() {
        stdout = new ByteArrayOutputStream();
        graphService = new DependencyGraphService(
                new GraphBuilder(new CycleDetector()), new GraphFilter(),
                List.of(new JsonGraphFormatter(),
                        new MermaidGraphFormatter()));
        command = new GraphCommand(new DeclarationReader(), graphService,
                new OutputWriter(new PrintStream(stdout, true,
                        StandardCharsets.UTF_8)));
    }

    private Path input(final String content) throws Exception {
        final Path file = tempDir.resolve("declarations.json");
        Files.writeString(file, content);
        return file;
    }

    private static CommandOptions options(final Path input,
            final OutputFormat format, final List<String> entries,
            final Path out) {
        return new CommandOptions(input, format, FilterDirection.DOWNSTREAM,
                entries, false, out, false);
    }

    private String printed() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    @Test
    void whenRunning_givenValidInput_shouldPrintMermaidGraph()
            throws Exception {
        final ExitCode exitCode = command.run(options(input(DECLARATIONS),
                OutputFormat.MERMAID, List.of(), null));

        assertEquals(ExitCode.SUCCESS, exitCode);
        assertEquals("""
                flowchart LR
                  UserComponent -.->|circular| UserService
                  UserService --> HttpClient
                  UserService -.->|circular| UserComponent

                  %% Circular Dependencies Detected:
                  %% UserComponent -> UserService -> UserComponent""",
                printed());
    }

    @Test
    void whenRunning_givenEntriesAndOutFile_shouldWriteFilteredJson()
            throws Exception {
        final Path out = tempDir.resolve("build/graph.json");

        final ExitCode exitCode = command.run(options(input(DECLARATIONS),
                OutputFormat.JSON, List.of("HttpClient"), out));

        assertEquals(ExitCode.SUCCESS, exitCode);
        assertEquals("", printed());
        final String json = Files.readString(out);
        assertTrue(json.contains("\"HttpClient\""));
        assertFalse(json.contains("\"UserService\""));
    }

    @Test
    void whenRunning_givenMissingFile_shouldReturnFileNotFound() {
        final ExitCode exitCode = command.run(options(
                tempDir.resolve("missing.json"), OutputFormat.JSON,
                List.of(), null));

        assertEquals(ExitCode.FILE_NOT_FOUND, exitCode);
        assertEquals(7, exitCode.code());
    }

    @Test
    void whenRunning_givenMalformedJson_shouldReturnParsingError()
            throws Exception {
        final ExitCode exitCode = command.run(options(input("[{"),
                OutputFormat.JSON, List.of(), null));

        assertEquals(ExitCode.PARSING_ERROR, exitCode);
        assertEquals("", printed());
    }

    @Test
    void whenRunning_givenContractViolation_shouldReturnParsingError()
            throws Exception {
        final ExitCode exitCode = command.run(options(
                input("[{\"name\": \"\", \"kind\": \"service\","
                        + " \"dependencies\": []}]"),
                OutputFormat.JSON, List.of(), null));

        assertEquals(ExitCode.PARSING_ERROR, exitCode);
    }

    @Test
    void whenRunning_givenUnwritableOutput_shouldReturnGeneralError()
            throws Exception {
        final ExitCode exitCode = command.run(options(input(DECLARATIONS),
                OutputFormat.JSON, List.of(), tempDir));

        assertEquals(ExitCode.GENERAL_ERROR, exitCode);
    }

    @Test
    void whenRunning_givenUnexpectedFailure_shouldReturnGeneralError()
            throws Exception {
        final DependencyGraphService failing = mock(
                DependencyGraphService.class);
        when(failing.render(any())).thenThrow(
                new IllegalStateException("boom"));
        final GraphCommand failingCommand = new GraphCommand(
                new DeclarationReader(), failing,
                new OutputWriter(new PrintStream(stdout)));

        final ExitCode exitCode = failingCommand.run(options(
                input(DECLARATIONS), OutputFormat.JSON, List.of(), null));

        assertEquals(ExitCode.GENERAL_ERROR, exitCode);
    }

}
