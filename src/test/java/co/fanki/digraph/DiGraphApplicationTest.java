package co.fanki.digraph;

import co.fanki.digraph.config.GraphCommandRunner;
import co.fanki.digraph.graph.application.DependencyGraphService;
import co.fanki.digraph.graph.application.GraphRequest;
import co.fanki.digraph.graph.application.OutputFormat;
import co.fanki.digraph.graph.domain.ClassDeclaration;
import co.fanki.digraph.graph.domain.DependencyDeclaration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Context test for {@link DiGraphApplication}, with the command line
 * shell disabled.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest(properties = "digraph.cli.enabled=false")
class DiGraphApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private DependencyGraphService graphService;

    @Test
    void whenStarting_givenCliDisabled_shouldNotRegisterRunner() {
        assertTrue(context.getBeansOfType(GraphCommandRunner.class)
                .isEmpty());
    }

    @Test
    void whenRendering_givenWiredContext_shouldUseRegisteredFormatters() {
        final String output = graphService.render(new GraphRequest(
                List.of(new ClassDeclaration("A", "service",
                        List.of(DependencyDeclaration.of("B")))),
                OutputFormat.MERMAID,
                null, null, false));

        assertEquals("flowchart LR\n  A --> B", output);
    }

}
