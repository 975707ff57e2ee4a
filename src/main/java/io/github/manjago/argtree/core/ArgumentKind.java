package io.github.manjago.argtree.core;

/**
 * Behavior of an argument when it is matched on the command line.
 *
 * The kind fixes the arity: how many tokens the argument takes from the
 * window that follows it (for options) or starts with it (for positionals).
 */
public enum ArgumentKind {

    /** Switch without a value. Counts its occurrences. */
    FLAG(0),

    /** Exactly one value. */
    VALUE(1),

    /** One or more values, up to the next flag or the end of the window. */
    LIST(ArgumentKind.UNBOUNDED);

    /** Arity of arguments that take every available token. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final int arity;

    ArgumentKind(int arity) {
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }

    public boolean isUnbounded() {
        return arity == UNBOUNDED;
    }
}
