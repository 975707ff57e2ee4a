package io.github.manjago.argtree.core;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of a command tree.
 *
 * Works like any {@link Command} but answers a parse with a plain success flag. The
 * failure, if any, is kept in {@link #error()} for the caller to report, typically
 * together with the usage of {@link #deepestInvoked()}.
 *
 * Parsing stores values inside the registered arguments, so a parser accepts a
 * single command line. Parsing a second one throws {@link IllegalStateException}.
 */
public class ArgumentParser extends Command {

    private static final Logger log = LoggerFactory.getLogger(ArgumentParser.class);

    private boolean parsed;
    private ParseException error;

    public ArgumentParser(@NotNull String name, @NotNull String description) {
        super(name, description);
    }

    /**
     * Parse arguments, not including the program name.
     *
     * @return true if the command line matches the tree
     */
    public boolean parse(@NotNull String... args) {
        return parse(Arrays.asList(args));
    }

    /**
     * Parse arguments, not including the program name.
     *
     * @return true if the command line matches the tree
     */
    public boolean parse(@NotNull List<String> args) {
        try {
            parseOrThrow(args);
            return true;
        } catch (ParseException e) {
            return false;
        }
    }

    /**
     * Parse a C-style argument vector whose first element is the program name.
     */
    public boolean parseArgv(@NotNull String[] argv) {
        if (argv.length == 0) {
            return parse(List.of());
        }
        return parse(Arrays.asList(argv).subList(1, argv.length));
    }

    public void parseOrThrow(@NotNull String... args) throws ParseException {
        parseOrThrow(Arrays.asList(args));
    }

    /**
     * Parse arguments and throw the first mismatch.
     *
     * @throws ParseException if the command line does not match the tree
     * @throws IllegalStateException if this parser was already used
     */
    public void parseOrThrow(@NotNull List<String> args) throws ParseException {
        Objects.requireNonNull(args, "args");
        if (parsed) {
            throw new IllegalStateException("Parser '" + getName() + "' was already used; build a new tree");
        }
        parsed = true;
        List<String> tokens = List.copyOf(args);
        log.debug("Parsing {} tokens for '{}'", tokens.size(), getName());
        try {
            int consumed = ParseEngine.parse(this, tokens, false);
            log.debug("Parsed {} tokens, invoked: {}", consumed, String.join(" ", invokedPath()));
        } catch (ParseException e) {
            error = e;
            log.debug("Parse failed ({}): {}", e.getKind(), e.getMessage());
            throw e;
        }
    }

    /**
     * Whether {@code parse} was called and succeeded.
     */
    public boolean isParsed() {
        return parsed && error == null;
    }

    /**
     * Why the last parse failed; empty before parsing and after a success.
     */
    public Optional<ParseException> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Entered commands, from the root down.
     */
    @NotNull
    public List<Command> invokedCommands() {
        List<Command> chain = new ArrayList<>();
        for (Command c = this; c != null; c = invokedChild(c)) {
            chain.add(c);
        }
        return chain;
    }

    /**
     * Names of the entered commands, from the root down.
     */
    @NotNull
    public List<String> invokedPath() {
        List<String> names = new ArrayList<>();
        for (Command c : invokedCommands()) {
            names.add(c.getName());
        }
        return names;
    }

    /**
     * Innermost entered command: the command the user asked for, or the one whose
     * arguments did not match.
     */
    @NotNull
    public Command deepestInvoked() {
        List<Command> chain = invokedCommands();
        return chain.get(chain.size() - 1);
    }

    private static Command invokedChild(Command command) {
        for (Command child : command.commands()) {
            if (child.isInvoked()) {
                return child;
            }
        }
        return null;
    }
}
