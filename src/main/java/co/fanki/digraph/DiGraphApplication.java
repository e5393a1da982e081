package co.fanki.digraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Dependency Injection Graph Application.
 *
 * <p>Command line entry point: reads the class declarations reported by
 * a declaration extractor, builds their dependency graph, optionally
 * narrows it to what is reachable from entry points, and prints it as
 * JSON or as a Mermaid flowchart.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class DiGraphApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(DiGraphApplication.class, args)));
    }

}
