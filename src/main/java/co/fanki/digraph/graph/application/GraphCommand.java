package co.fanki.digraph.graph.application;

import co.fanki.digraph.graph.domain.ClassDeclaration;
import co.fanki.digraph.shared.DomainException;
import co.fanki.digraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * The command line use case: read declarations, render the graph,
 * write the result.
 *
 * <p>Failures never escape: they are logged and classified into an
 * {@link ExitCode}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GraphCommand {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphCommand.class);

    /** Error code for missing or malformed options. */
    public static final String INVALID_ARGUMENTS = "INVALID_ARGUMENTS";

    /** Error code for a missing input file. */
    public static final String FILE_NOT_FOUND = "FILE_NOT_FOUND";

    /** Error code for an unreadable input file. */
    public static final String PERMISSION_DENIED = "PERMISSION_DENIED";

    private final DeclarationReader declarationReader;

    private final DependencyGraphService graphService;

    private final OutputWriter outputWriter;

    /**
     * Creates a new GraphCommand.
     *
     * @param theDeclarationReader the declarations parser
     * @param theGraphService the graph service
     * @param theOutputWriter the output writer
     */
    public GraphCommand(final DeclarationReader theDeclarationReader,
            final DependencyGraphService theGraphService,
            final OutputWriter theOutputWriter) {
        this.declarationReader = Preconditions.requireNonNull(
                theDeclarationReader, "Declaration reader is required");
        this.graphService = Preconditions.requireNonNull(theGraphService,
                "Graph service is required");
        this.outputWriter = Preconditions.requireNonNull(theOutputWriter,
                "Output writer is required");
    }

    /**
     * Runs the command.
     *
     * @param options the parsed options
     * @return the exit code
     */
    public ExitCode run(final CommandOptions options) {
        Preconditions.requireNonNull(options, "Options are required");
        LOG.debug("Running with options {}", options);

        try {
            final List<ClassDeclaration> declarations = declarationReader
                    .read(readInput(options.input()));

            LOG.debug("Read {} class declarations from {}",
                    declarations.size(), options.input());

            final String output = graphService.render(new GraphRequest(
                    declarations,
                    options.format(),
                    options.direction(),
                    options.entries(),
                    options.includeDecorators()));

            outputWriter.write(output, options.out());

            if (options.out() != null) {
                LOG.info("Graph written to {}", options.out());
            }
            return ExitCode.SUCCESS;

        } catch (final DomainException e) {
            final ExitCode exitCode = ExitCode.of(e.getErrorCode());
            if (options.verbose()) {
                LOG.error("{} [{}]", e.getMessage(), e.getErrorCode(), e);
            } else {
                LOG.error("{} [{}]", e.getMessage(), e.getErrorCode());
            }
            return exitCode;

        } catch (final RuntimeException e) {
            LOG.error("Unexpected failure rendering the graph", e);
            return ExitCode.GENERAL_ERROR;
        }
    }

    private static String readInput(final Path input) {
        try {
            return Files.readString(input, StandardCharsets.UTF_8);
        } catch (final NoSuchFileException e) {
            throw new DomainException("Input file not found: " + input,
                    FILE_NOT_FOUND, e);
        } catch (final AccessDeniedException e) {
            throw new DomainException("Input file is not readable: " + input,
                    PERMISSION_DENIED, e);
        } catch (final IOException e) {
            throw new DomainException("Failed to read input file " + input
                    + ": " + e.getMessage(), DeclarationReader.INVALID_INPUT, e);
        }
    }

}
