package io.github.manjago.argtree.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Switch option. Each occurrence counts, so {@code -v -v -v} and {@code -vvv}
 * both give a count of 3.
 */
public final class FlagOption implements OptionalSpec {

    private final OptionName names;
    private final String description;
    private int count;

    FlagOption(OptionName names, String description) {
        this.names = names;
        this.description = description;
    }

    @Override
    public char shortName() {
        return names.shortName();
    }

    @Override
    public @Nullable String longName() {
        return names.longName();
    }

    @Override
    public @NotNull String description() {
        return description;
    }

    @Override
    public @NotNull ArgumentKind kind() {
        return ArgumentKind.FLAG;
    }

    /**
     * Number of times the flag was given.
     */
    public int count() {
        return count;
    }

    public boolean isSet() {
        return count > 0;
    }

    @Override
    public boolean isPresent() {
        return isSet();
    }

    @Override
    public @NotNull String displayName() {
        return names.display();
    }

    void occur() {
        count++;
    }

    @Override
    public String toString() {
        return "FlagOption{" + displayName() + ", count=" + count + "}";
    }
}
