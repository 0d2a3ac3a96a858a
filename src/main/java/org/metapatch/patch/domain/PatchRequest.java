package org.metapatch.patch.domain;

import org.metapatch.shorthand.ShorthandParser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One invocation: {@code <operation> <document> "<value>[;;<value>...]" [--target=<name>] [--no-cascade]}.
 * Spring property overrides ({@code --patch.default-language=en}) may be mixed in and are ignored here.
 */
public record PatchRequest(Operation operation, Path document, List<String> values, String target,
                           boolean cascade) {

    public PatchRequest {
        values = List.copyOf(values);
    }

    public static PatchRequest parse(String[] args, String separator) {
        List<String> positional = new ArrayList<>();
        String target = null;
        boolean cascade = true;
        for (String arg : args) {
            if (arg.startsWith("--target=")) {
                target = arg.substring("--target=".length()).trim();
                if (target.isEmpty()) throw new UsageException("--target needs a name");
            } else if (arg.equals("--no-cascade")) {
                cascade = false;
            } else if (arg.startsWith("--")) {
                // Spring Boot property override, bound by the application context
                continue;
            } else {
                positional.add(arg);
            }
        }
        if (positional.size() < 2) throw new UsageException("Expected <operation> <document> [values]");
        if (positional.size() > 3) {
            throw new UsageException("Too many arguments: " + positional.subList(3, positional.size())
                    + " (quote the values and separate entries with '" + separator + "')");
        }
        Operation operation = Operation.fromName(positional.get(0));
        List<String> values = positional.size() == 3
                ? ShorthandParser.splitBatch(positional.get(2), separator) : List.of();
        if (operation.takesValues() && values.isEmpty()) {
            throw new UsageException(operation.cliName() + " needs at least one value");
        }
        if (!operation.takesValues() && !values.isEmpty()) {
            throw new UsageException(operation.cliName() + " takes no values");
        }
        return new PatchRequest(operation, Path.of(positional.get(1)), values, target, cascade);
    }
}
