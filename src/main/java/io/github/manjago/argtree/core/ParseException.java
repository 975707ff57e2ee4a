package io.github.manjago.argtree.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Command line that does not match the command tree.
 *
 * Carries enough context to build a message for the user: the path of the command
 * being parsed, the argument involved and the offending token, when there is one.
 */
public class ParseException extends Exception {

    /**
     * What went wrong.
     */
    public enum Kind {
        /** Flag token that no option of the command answers to. */
        UNKNOWN_OPTION,
        /** Value or list option matched, but no token left for it. */
        MISSING_VALUE,
        /** Token could not be converted to the argument's type. */
        CONVERSION_FAILURE,
        /** Parsing ended with a positional slot still empty. */
        UNSATISFIED_REQUIRED,
        /** Non-flag token matching neither a positional slot nor a subcommand. */
        UNEXPECTED_TOKEN,
        /** Short-flag group containing an option that takes values. */
        AMBIGUOUS_SHORT_GROUP
    }

    private final Kind kind;
    private final String commandPath;
    private final String argument;
    private final String token;

    public ParseException(@NotNull Kind kind, @NotNull String commandPath, @Nullable String argument,
                          @Nullable String token, @NotNull String message) {
        this(kind, commandPath, argument, token, message, null);
    }

    public ParseException(@NotNull Kind kind, @NotNull String commandPath, @Nullable String argument,
                          @Nullable String token, @NotNull String message, @Nullable Throwable cause) {
        super(commandPath + ": " + message, cause);
        this.kind = kind;
        this.commandPath = commandPath;
        this.argument = argument;
        this.token = token;
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }

    /**
     * Space separated names from the root to the command that failed.
     */
    @NotNull
    public String getCommandPath() {
        return commandPath;
    }

    /**
     * Display name of the argument involved ({@code --name}, {@code <count>}), if any.
     */
    @Nullable
    public String getArgument() {
        return argument;
    }

    /**
     * Offending token, if any.
     */
    @Nullable
    public String getToken() {
        return token;
    }
}
