package io.github.manjago.argtree.core;

import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Value types addressable by name.
 *
 * Used where a tree is described as data (see
 * {@link io.github.manjago.argtree.config.TreeDefinition}) and the type of an
 * argument is given as text. Code that registers arguments directly passes
 * {@link ValueType} instances and does not need a registry.
 */
public final class ValueTypeRegistry {

    private final Map<String, ValueType<?>> types = new LinkedHashMap<>();

    /**
     * Registry holding the built-in types.
     */
    public static ValueTypeRegistry standard() {
        ValueTypeRegistry registry = new ValueTypeRegistry();
        registry.register(ValueType.INTEGER);
        registry.register(ValueType.LONG);
        registry.register(ValueType.DOUBLE);
        registry.register(ValueType.STRING);
        registry.register(ValueType.BOOLEAN);
        registry.register(ValueType.PATH);
        return registry;
    }

    /**
     * Add a type under its {@link ValueType#name()}.
     *
     * @throws IllegalArgumentException if the name is already taken
     */
    public ValueTypeRegistry register(@NotNull ValueType<?> type) {
        String key = key(type.name());
        if (types.containsKey(key)) {
            throw new IllegalArgumentException("Value type already registered: " + type.name());
        }
        types.put(key, type);
        return this;
    }

    public Optional<ValueType<?>> find(@NotNull String name) {
        return Optional.ofNullable(types.get(key(name)));
    }

    /**
     * Look up a type by name (case-insensitive).
     *
     * @throws NoSuchElementException if no such type is registered
     */
    @NotNull
    public ValueType<?> get(@NotNull String name) {
        return find(name).orElseThrow(() ->
                new NoSuchElementException("Unknown value type: " + name + " (known: " + types.keySet() + ")"));
    }

    public Collection<ValueType<?>> types() {
        return Collections.unmodifiableCollection(types.values());
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
