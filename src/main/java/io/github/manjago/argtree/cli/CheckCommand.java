package io.github.manjago.argtree.cli;

import io.github.manjago.argtree.config.TreeDefinition;
import io.github.manjago.argtree.core.ArgumentParser;
import io.github.manjago.argtree.core.ParseException;
import io.github.manjago.argtree.help.UsageFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: check
 * 
 * Parses a token list against a tree definition and prints what got bound.
 * 
 * Usage:
 *   argtree check -d git.conf -- -vv commit -m "fix" a.txt b.txt
 *   argtree check -d git.conf -q -- push origin    (exit code only)
 */
@Command(
    name = "check",
    description = "Parse tokens against a tree definition",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-d", "--definition"}, required = true, description = "Tree definition file (HOCON)")
    private Path definition;

    @Option(names = {"-q", "--quiet"}, description = "Print nothing, report through the exit code")
    private boolean quiet;

    @Parameters(paramLabel = "TOKEN", arity = "0..*", description = "Tokens to parse (put them after --)")
    private List<String> tokens = new ArrayList<>();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ArgumentParser parser;
        try {
            parser = new TreeDefinition().load(definition);
        } catch (RuntimeException e) {
            err.println("❌ Invalid definition: " + e.getMessage());
            log.debug("Definition {} rejected", definition, e);
            return 1;
        }

        try {
            parser.parseOrThrow(tokens);
        } catch (ParseException e) {
            if (!quiet) {
                err.println("❌ " + e.getMessage());
                err.println();
                err.print(new UsageFormatter().format(parser.deepestInvoked()));
            }
            return ArgtreeCli.EXIT_PARSE_ERROR;
        }

        if (!quiet) {
            out.println("✓ " + String.join(" ", parser.invokedPath()));
            out.print(new BindingPrinter().print(parser));
        }
        return 0;
    }
}
