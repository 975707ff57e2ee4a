package io.github.manjago.argtree.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Argtree CLI - try command tree definitions from the shell.
 * 
 * Usage:
 *   argtree check -d tree.conf -- [tokens]   - Parse tokens, show bound values
 *   argtree usage -d tree.conf [command...]  - Show usage of a command
 *   argtree info                             - Show version and value types
 */
@Command(
    name = "argtree",
    description = "Command-line parser playground for argtree definitions",
    mixinStandardHelpOptions = true,
    version = "argtree 1.0.0",
    subcommands = {
        CheckCommand.class,
        UsageCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class ArgtreeCli implements Runnable {

    /** Exit code when the checked tokens do not match the tree. */
    static final int EXIT_PARSE_ERROR = 3;

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    static CommandLine commandLine() {
        return new CommandLine(new ArgtreeCli());
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
