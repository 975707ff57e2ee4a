package io.github.manjago.argtree.cli;

import io.github.manjago.argtree.config.TreeDefinition;
import io.github.manjago.argtree.core.Command;
import io.github.manjago.argtree.help.UsageFormatter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.Callable;

/**
 * CLI command: usage
 * 
 * Usage:
 *   argtree usage -d git.conf            # Usage of the root command
 *   argtree usage -d git.conf remote add # Usage of a nested command
 */
@picocli.CommandLine.Command(
    name = "usage",
    description = "Show the usage text of a defined command",
    mixinStandardHelpOptions = true
)
public class UsageCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-d", "--definition"}, required = true, description = "Tree definition file (HOCON)")
    private Path definition;

    @Parameters(paramLabel = "COMMAND", arity = "0..*", description = "Subcommand path below the root")
    private List<String> path = new ArrayList<>();

    @Override
    public Integer call() {
        try {
            Command command = new TreeDefinition().load(definition);
            for (String name : path) {
                command = command.getCommand(name);
            }
            spec.commandLine().getOut().print(new UsageFormatter().format(command));
            return 0;
        } catch (NoSuchElementException e) {
            spec.commandLine().getErr().println("❌ " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            spec.commandLine().getErr().println("❌ Invalid definition: " + e.getMessage());
            return 1;
        }
    }
}
