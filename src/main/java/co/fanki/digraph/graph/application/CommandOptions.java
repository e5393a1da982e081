package co.fanki.digraph.graph.application;

import co.fanki.digraph.graph.domain.FilterDirection;
import co.fanki.digraph.shared.DomainException;
import org.springframework.boot.ApplicationArguments;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line options.
 *
 * <p>Options use the {@code --name=value} form. {@code --entry} may be
 * repeated and each value may hold several comma separated ids. The
 * input file may also be given as the first non-option argument.</p>
 *
 * @param input the declarations file
 * @param format the output format
 * @param direction the filter direction
 * @param entries the entry node ids
 * @param includeDecorators whether edge flags are kept
 * @param out the output file, null for stdout
 * @param verbose whether diagnostics are logged
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CommandOptions(
        Path input,
        OutputFormat format,
        FilterDirection direction,
        List<String> entries,
        boolean includeDecorators,
        Path out,
        boolean verbose) {

    /**
     * Parses the application arguments.
     *
     * @param args the application arguments
     * @param defaultFormat the format used when {@code --format} is absent
     * @param defaultDirection the direction used when {@code --direction}
     *        is absent
     * @return the options
     * @throws DomainException if an option is missing or invalid
     */
    public static CommandOptions from(final ApplicationArguments args,
            final String defaultFormat, final String defaultDirection) {

        String input = single(args, "input");
        if (input == null && !args.getNonOptionArgs().isEmpty()) {
            input = args.getNonOptionArgs().get(0);
        }
        if (input == null || input.isBlank()) {
            throw new DomainException(
                    "Input file is required (--input=<declarations.json>)",
                    GraphCommand.INVALID_ARGUMENTS);
        }

        final String format = single(args, "format");
        final String direction = single(args, "direction");
        final String out = single(args, "out");

        return new CommandOptions(
                Path.of(input),
                OutputFormat.fromString(format != null ? format
                        : defaultFormat),
                FilterDirection.fromString(direction != null ? direction
                        : defaultDirection),
                entries(args),
                args.containsOption("include-decorators"),
                out == null || out.isBlank() ? null : Path.of(out),
                args.containsOption("verbose"));
    }

    private static String single(final ApplicationArguments args,
            final String name) {
        final List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new DomainException("Option --" + name
                    + " can only be given once", GraphCommand.INVALID_ARGUMENTS);
        }
        return values.get(0);
    }

    private static List<String> entries(final ApplicationArguments args) {
        final List<String> values = args.getOptionValues("entry");
        final List<String> entries = new ArrayList<>();
        if (values == null) {
            return entries;
        }
        for (final String value : values) {
            for (final String part : value.split(",")) {
                final String entry = part.trim();
                if (!entry.isEmpty()) {
                    entries.add(entry);
                }
            }
        }
        return List.copyOf(entries);
    }

}
