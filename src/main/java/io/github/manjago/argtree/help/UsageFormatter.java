package io.github.manjago.argtree.help;

import io.github.manjago.argtree.core.ArgumentKind;
import io.github.manjago.argtree.core.Command;
import io.github.manjago.argtree.core.ListOption;
import io.github.manjago.argtree.core.OptionalSpec;
import io.github.manjago.argtree.core.RequiredSpec;
import io.github.manjago.argtree.core.ValueOption;
import io.github.manjago.argtree.core.ValueType;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the usage text of a command.
 * <p>
 * Reads the tree only; it can be called before or after parsing.
 *
 * <h2>Output:</h2>
 * <pre>
 * usage: git commit [options] &lt;files&gt;...
 *
 * Record changes to the repository
 *
 * Arguments:
 *   &lt;files&gt;...             Files to commit
 *
 * Options:
 *   -m, --message &lt;string&gt;  Commit message
 *       --amend             Amend the previous commit
 * </pre>
 */
public class UsageFormatter {

    private static final String INDENT = "  ";
    private static final String GAP = "  ";

    /**
     * Usage line only, e.g. {@code usage: git commit [options] <files>...}.
     */
    @NotNull
    public String usageLine(@NotNull Command command) {
        StringBuilder sb = new StringBuilder("usage: ").append(command.path());
        if (!command.options().isEmpty()) {
            sb.append(" [options]");
        }
        for (RequiredSpec argument : command.arguments()) {
            sb.append(' ').append(argument.displayName());
        }
        if (!command.commands().isEmpty()) {
            sb.append(" <command>");
        }
        return sb.toString();
    }

    /**
     * Full usage text: usage line, description and one section per kind of argument.
     */
    @NotNull
    public String format(@NotNull Command command) {
        List<Row> arguments = new ArrayList<>();
        for (RequiredSpec argument : command.arguments()) {
            arguments.add(new Row(argument.displayName(), argument.description()));
        }
        List<Row> options = new ArrayList<>();
        for (OptionalSpec option : command.options()) {
            options.add(new Row(optionColumn(option), option.description()));
        }
        List<Row> commands = new ArrayList<>();
        for (Command child : command.commands()) {
            commands.add(new Row(child.getName(), child.getDescription()));
        }

        int width = 0;
        for (List<Row> section : List.of(arguments, options, commands)) {
            for (Row row : section) {
                width = Math.max(width, row.left().length());
            }
        }

        StringBuilder sb = new StringBuilder(usageLine(command)).append('\n');
        if (!command.getDescription().isEmpty()) {
            sb.append('\n').append(command.getDescription()).append('\n');
        }
        appendSection(sb, "Arguments", arguments, width);
        appendSection(sb, "Options", options, width);
        appendSection(sb, "Commands", commands, width);
        return sb.toString();
    }

    private void appendSection(StringBuilder sb, String title, List<Row> rows, int width) {
        if (rows.isEmpty()) {
            return;
        }
        sb.append('\n').append(title).append(":\n");
        for (Row row : rows) {
            sb.append(INDENT).append(row.left());
            if (!row.description().isEmpty()) {
                sb.append(" ".repeat(width - row.left().length())).append(GAP).append(row.description());
            }
            sb.append('\n');
        }
    }

    /**
     * {@code -v, --verbose}, {@code -o <path>} or {@code     --include <string>...}.
     */
    private String optionColumn(OptionalSpec option) {
        StringBuilder sb = new StringBuilder();
        if (option.hasShortName()) {
            sb.append('-').append(option.shortName());
            if (option.hasLongName()) {
                sb.append(", --").append(option.longName());
            }
        } else {
            sb.append("    --").append(option.longName());
        }
        if (option.kind() != ArgumentKind.FLAG) {
            sb.append(" <").append(typeOf(option).name()).append('>');
            if (option.kind() == ArgumentKind.LIST) {
                sb.append("...");
            }
        }
        return sb.toString();
    }

    private static ValueType<?> typeOf(OptionalSpec option) {
        return switch (option.kind()) {
            case VALUE -> ((ValueOption<?>) option).type();
            case LIST -> ((ListOption<?>) option).type();
            case FLAG -> throw new IllegalArgumentException("Flag has no value type: " + option.displayName());
        };
    }

    private record Row(String left, String description) {}
}
