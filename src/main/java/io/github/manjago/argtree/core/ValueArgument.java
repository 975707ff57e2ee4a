package io.github.manjago.argtree.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * Positional argument taking one token.
 *
 * @param <T> value type
 */
public final class ValueArgument<T> implements RequiredSpec {

    private final String name;
    private final String description;
    private final ValueHolder<T> holder;

    ValueArgument(String name, ValueType<T> type, String description) {
        this.name = name;
        this.description = description;
        this.holder = new ValueHolder<>(type);
    }

    @Override
    public @NotNull String name() {
        return name;
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
     * Parsed value; empty only if the parse failed before reaching this slot.
     */
    public Optional<T> value() {
        return holder.value();
    }

    @Override
    public boolean isPresent() {
        return holder.isPresent();
    }

    int consume(List<String> window, String commandPath) throws ParseException {
        return holder.consume(window, commandPath, displayName());
    }

    @Override
    public String toString() {
        return "ValueArgument{" + displayName() + ", " + type().name() + ", value=" + value().orElse(null) + "}";
    }
}
