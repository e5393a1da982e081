package co.fanki.digraph.graph.application;

import co.fanki.digraph.shared.DomainException;
import co.fanki.digraph.shared.Preconditions;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes rendered output to stdout or to a file.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class OutputWriter {

    /** Error code raised when the output file cannot be written. */
    public static final String OUTPUT_WRITE_ERROR = "OUTPUT_WRITE_ERROR";

    private final PrintStream stdout;

    /**
     * Creates a new OutputWriter.
     *
     * @param theStdout the stream used when no output file is given
     */
    public OutputWriter(final PrintStream theStdout) {
        this.stdout = Preconditions.requireNonNull(theStdout,
                "Stdout is required");
    }

    /**
     * Writes the content.
     *
     * <p>Missing parent directories of the file are created.</p>
     *
     * @param content the content to write
     * @param file the output file, null to write to stdout
     * @throws DomainException if the file cannot be written
     */
    public void write(final String content, final Path file) {
        Preconditions.requireNonNull(content, "Content is required");

        if (file == null) {
            stdout.print(content);
            stdout.flush();
            return;
        }

        try {
            final Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new DomainException("Failed to write output file: "
                    + e.getMessage(), OUTPUT_WRITE_ERROR, e);
        }
    }

}
