package io.github.manjago.argtree.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Argument introduced by a short ({@code -v}) and/or long ({@code --verbose}) flag.
 *
 * The set of variants is closed; {@link #kind()} tells which one an instance is.
 */
public sealed interface OptionalSpec permits FlagOption, ValueOption, ListOption {

    /**
     * Short flag character, or {@link Command#NO_SHORT}.
     */
    char shortName();

    /**
     * Long flag without the leading dashes, or null.
     */
    @Nullable
    String longName();

    @NotNull
    String description();

    @NotNull
    ArgumentKind kind();

    /**
     * Tokens taken after the flag: 0, 1 or {@link ArgumentKind#UNBOUNDED}.
     */
    default int arity() {
        return kind().arity();
    }

    default boolean hasShortName() {
        return shortName() != Command.NO_SHORT;
    }

    default boolean hasLongName() {
        return longName() != null;
    }

    /**
     * Whether the option appeared on the command line.
     */
    boolean isPresent();

    /**
     * Name as shown to users, e.g. {@code -v/--verbose}.
     */
    @NotNull
    String displayName();
}
