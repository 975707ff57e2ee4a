package io.github.manjago.argtree.core;

import org.jetbrains.annotations.Nullable;

/**
 * Short and long name of an option. At least one of them is set.
 */
record OptionName(char shortName, @Nullable String longName) {

    boolean hasShortName() {
        return shortName != Command.NO_SHORT;
    }

    boolean hasLongName() {
        return longName != null;
    }

    /**
     * {@code -v/--verbose}, {@code -v} or {@code --verbose}.
     */
    String display() {
        if (!hasShortName()) {
            return "--" + longName;
        }
        if (!hasLongName()) {
            return "-" + shortName;
        }
        return "-" + shortName + "/--" + longName;
    }
}
