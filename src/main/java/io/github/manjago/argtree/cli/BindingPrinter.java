package io.github.manjago.argtree.cli;

import io.github.manjago.argtree.core.ArgumentParser;
import io.github.manjago.argtree.core.Command;
import io.github.manjago.argtree.core.FlagOption;
import io.github.manjago.argtree.core.ListArgument;
import io.github.manjago.argtree.core.ListOption;
import io.github.manjago.argtree.core.OptionalSpec;
import io.github.manjago.argtree.core.RequiredSpec;
import io.github.manjago.argtree.core.ValueArgument;
import io.github.manjago.argtree.core.ValueOption;

/**
 * Formats the values bound by a successful parse, one block per entered command.
 */
class BindingPrinter {

    private static final String ABSENT = "(absent)";

    String print(ArgumentParser parser) {
        StringBuilder sb = new StringBuilder();
        for (Command command : parser.invokedCommands()) {
            sb.append(command.path()).append('\n');
            for (RequiredSpec argument : command.arguments()) {
                line(sb, argument.displayName(), valueOf(argument));
            }
            for (OptionalSpec option : command.options()) {
                line(sb, option.displayName(), valueOf(option));
            }
        }
        return sb.toString();
    }

    private static void line(StringBuilder sb, String name, String value) {
        sb.append(String.format("  %-24s %s%n", name, value));
    }

    private static String valueOf(OptionalSpec option) {
        if (!option.isPresent()) {
            return ABSENT;
        }
        return switch (option.kind()) {
            case FLAG -> "set x" + ((FlagOption) option).count();
            case VALUE -> String.valueOf(((ValueOption<?>) option).value().orElse(null));
            case LIST -> ((ListOption<?>) option).values().toString();
        };
    }

    private static String valueOf(RequiredSpec argument) {
        if (!argument.isPresent()) {
            return ABSENT;
        }
        return switch (argument.kind()) {
            case VALUE -> String.valueOf(((ValueArgument<?>) argument).value().orElse(null));
            case LIST -> ((ListArgument<?>) argument).values().toString();
            case FLAG -> throw new IllegalStateException("Positional cannot be a flag");
        };
    }
}
