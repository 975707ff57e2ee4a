package io.github.manjago.argtree.core;

import org.jetbrains.annotations.NotNull;

/**
 * Positional argument. Positionals are filled in the order they were registered.
 */
public sealed interface RequiredSpec permits ValueArgument, ListArgument {

    @NotNull
    String name();

    @NotNull
    String description();

    /**
     * {@link ArgumentKind#VALUE} or {@link ArgumentKind#LIST}.
     */
    @NotNull
    ArgumentKind kind();

    default int arity() {
        return kind().arity();
    }

    /**
     * Whether at least one token was bound.
     */
    boolean isPresent();

    /**
     * Name as shown to users: {@code <file>} or {@code <file>...}.
     */
    @NotNull
    default String displayName() {
        return kind() == ArgumentKind.LIST ? "<" + name() + ">..." : "<" + name() + ">";
    }
}
