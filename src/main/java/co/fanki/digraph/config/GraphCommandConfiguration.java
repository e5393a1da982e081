package co.fanki.digraph.config;

import co.fanki.digraph.graph.application.DeclarationReader;
import co.fanki.digraph.graph.application.DependencyGraphService;
import co.fanki.digraph.graph.application.GraphCommand;
import co.fanki.digraph.graph.application.OutputWriter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the command line shell.
 *
 * <p>Active unless {@code digraph.cli.enabled} is set to {@code false},
 * which lets the graph services be used without running the command on
 * startup.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "digraph.cli.enabled", havingValue = "true",
        matchIfMissing = true)
public class GraphCommandConfiguration {

    /**
     * Creates the writer printing to the process stdout.
     *
     * @return the output writer
     */
    @Bean
    OutputWriter outputWriter() {
        return new OutputWriter(System.out);
    }

    /**
     * Creates the command use case.
     *
     * @param declarationReader the declarations parser
     * @param graphService the graph service
     * @param outputWriter the output writer
     * @return the command
     */
    @Bean
    GraphCommand graphCommand(final DeclarationReader declarationReader,
            final DependencyGraphService graphService,
            final OutputWriter outputWriter) {
        return new GraphCommand(declarationReader, graphService, outputWriter);
    }

    /**
     * Creates the runner executing the command with the process
     * arguments.
     *
     * @param graphCommand the command
     * @param defaultFormat the format used without {@code --format}
     * @param defaultDirection the direction used without
     *        {@code --direction}
     * @return the runner
     */
    @Bean
    GraphCommandRunner graphCommandRunner(final GraphCommand graphCommand,
            @Value("${digraph.default-format:json}")
            final String defaultFormat,
            @Value("${digraph.default-direction:downstream}")
            final String defaultDirection) {
        return new GraphCommandRunner(graphCommand, defaultFormat,
                defaultDirection);
    }

}
