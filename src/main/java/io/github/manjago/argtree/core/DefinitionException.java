package io.github.manjago.argtree.core;

import org.jetbrains.annotations.NotNull;

/**
 * Invalid command tree, detected while arguments are being registered.
 *
 * Thrown before any command line is seen; a tree that raised it must not be used.
 */
public class DefinitionException extends RuntimeException {

    public enum Kind {
        /** Short flag, long flag, positional or subcommand name already in use. */
        DUPLICATE_ARGUMENT,
        /** Argument that no command line could ever reach. */
        UNREACHABLE_ARGUMENT,
        /** Name that the parser cannot match. */
        INVALID_NAME
    }

    private final Kind kind;

    public DefinitionException(@NotNull Kind kind, @NotNull String message) {
        super(message);
        this.kind = kind;
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }
}
