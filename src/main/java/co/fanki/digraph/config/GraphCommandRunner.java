package co.fanki.digraph.config;

import co.fanki.digraph.graph.application.CommandOptions;
import co.fanki.digraph.graph.application.ExitCode;
import co.fanki.digraph.graph.application.GraphCommand;
import co.fanki.digraph.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

/**
 * Runs the {@link GraphCommand} once the context is up and exposes its
 * outcome as the process exit code.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GraphCommandRunner implements ApplicationRunner,
        ExitCodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphCommandRunner.class);

    private static final String APPLICATION_LOGGER = "co.fanki.digraph";

    private final GraphCommand graphCommand;

    private final String defaultFormat;

    private final String defaultDirection;

    private ExitCode exitCode = ExitCode.SUCCESS;

    /**
     * Creates a new GraphCommandRunner.
     *
     * @param theGraphCommand the command to run
     * @param theDefaultFormat the configured default format
     * @param theDefaultDirection the configured default direction
     */
    public GraphCommandRunner(final GraphCommand theGraphCommand,
            final String theDefaultFormat, final String theDefaultDirection) {
        this.graphCommand = theGraphCommand;
        this.defaultFormat = theDefaultFormat;
        this.defaultDirection = theDefaultDirection;
    }

    @Override
    public void run(final ApplicationArguments args) {
        final CommandOptions options;
        try {
            options = CommandOptions.from(args, defaultFormat,
                    defaultDirection);
        } catch (final DomainException e) {
            LOG.error("{} [{}]", e.getMessage(), e.getErrorCode());
            exitCode = ExitCode.of(e.getErrorCode());
            return;
        }

        if (options.verbose()) {
            LoggingSystem.get(getClass().getClassLoader())
                    .setLogLevel(APPLICATION_LOGGER, LogLevel.DEBUG);
        }

        exitCode = graphCommand.run(options);
    }

    @Override
    public int getExitCode() {
        return exitCode.code();
    }

    /**
     * Returns the outcome of the last run.
     *
     * @return the exit code
     */
    public ExitCode exitCode() {
        return exitCode;
    }

}
