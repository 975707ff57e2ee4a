package io.github.manjago.argtree.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Option followed by one or more values, e.g. {@code --include a b c}.
 * Values from repeated occurrences are appended in order.
 *
 * @param <T> element type
 */
public final class ListOption<T> implements OptionalSpec {

    private final OptionName names;
    private final String description;
    private final ListHolder<T> holder;

    ListOption(OptionName names, ValueType<T> type, String description) {
        this.names = names;
        this.description = description;
        this.holder = new ListHolder<>(type);
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
        return ArgumentKind.LIST;
    }

    public ValueType<T> type() {
        return holder.type();
    }

    /**
     * Parsed values in command-line order; empty if the option was not given.
     */
    public List<T> values() {
        return holder.values();
    }

    @Override
    public boolean isPresent() {
        return holder.isPresent();
    }

    @Override
    public @NotNull String displayName() {
        return names.display();
    }

    int consume(List<String> window, String commandPath) throws ParseException {
        return holder.consume(window, commandPath, displayName());
    }

    @Override
    public String toString() {
        return "ListOption{" + displayName() + ", " + type().name() + ", values=" + values() + "}";
    }
}
