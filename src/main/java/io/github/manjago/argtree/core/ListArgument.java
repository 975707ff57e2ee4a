package io.github.manjago.argtree.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Positional argument taking every token up to the next flag.
 *
 * @param <T> element type
 */
public final class ListArgument<T> implements RequiredSpec {

    private final String name;
    private final String description;
    private final ListHolder<T> holder;

    ListArgument(String name, ValueType<T> type, String description) {
        this.name = name;
        this.description = description;
        this.holder = new ListHolder<>(type);
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
        return ArgumentKind.LIST;
    }

    public ValueType<T> type() {
        return holder.type();
    }

    public List<T> values() {
        return holder.values();
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
        return "ListArgument{" + displayName() + ", " + type().name() + ", values=" + values() + "}";
    }
}
