package io.github.manjago.argtree.cli;

import io.github.manjago.argtree.core.ValueType;
import io.github.manjago.argtree.core.ValueTypeRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Show information about argtree.
 */
@Command(
    name = "info",
    description = "Show version and value types",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("argtree 1.0.0");
        out.println();
        out.println("Value types:");
        for (ValueType<?> type : ValueTypeRegistry.standard().types()) {
            out.printf("  %-8s %s%n", type.name(), type.javaType().getName());
        }
        out.println();
        out.println("Option kinds:    flag, value, list");
        out.println("Argument kinds:  value, list");
        return 0;
    }
}
