package io.github.manjago.argtree.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Option followed by exactly one value, e.g. {@code --name alice}.
 *
 * @param <T> value type
 */
public final class ValueOption<T> implements OptionalSpec {

    private final OptionName names;
    private final String description;
    private final ValueHolder<T> holder;

    ValueOption(OptionName names, ValueType<T> type, String description) {
        this.names = names;
        this.description = description;
        this.holder = new ValueHolder<>(type);
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
        return ArgumentKind.VALUE;
    }

    public ValueType<T> type() {
        return holder.type();
    }

    /**
     * Parsed value; empty if the option was not given.
     */
    public Optional<T> value() {
        return holder.value();
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
        return "ValueOption{" + displayName() + ", " + type().name() + ", value=" + value().orElse(null) + "}";
    }
}
