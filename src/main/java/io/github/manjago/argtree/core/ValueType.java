package io.github.manjago.argtree.core;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Conversion from command-line text to a typed value.
 *
 * Implementations signal bad input by throwing {@link IllegalArgumentException}
 * ({@link NumberFormatException} and {@link java.nio.file.InvalidPathException}
 * included). The parser reports it as a conversion failure and never substitutes
 * a default.
 *
 * @param <T> the converted type
 */
public interface ValueType<T> {

    /** Signed 32-bit integer, ASCII base-10 digits only. */
    ValueType<Integer> INTEGER = of("int", Integer.class, text -> Integer.parseInt(decimalInteger(text)));

    /** Signed 64-bit integer, ASCII base-10 digits only. */
    ValueType<Long> LONG = of("long", Long.class, text -> Long.parseLong(decimalInteger(text)));

    /** Double precision number in plain decimal or exponent notation. */
    ValueType<Double> DOUBLE = of("double", Double.class, text -> Double.parseDouble(decimalNumber(text)));

    /** Verbatim text. Never fails. */
    ValueType<String> STRING = of("string", String.class, Function.identity());

    /** {@code true} or {@code false}, case-insensitive. */
    ValueType<Boolean> BOOLEAN = of("bool", Boolean.class, ValueType::parseStrictBoolean);

    /** File system path, not checked for existence. */
    ValueType<Path> PATH = of("path", Path.class, Path::of);

    /**
     * Short name used in definitions and messages ({@code int}, {@code string}).
     */
    @NotNull
    String name();

    /**
     * Java type produced by {@link #convert(String)}.
     */
    @NotNull
    Class<T> javaType();

    /**
     * Convert one token.
     *
     * @param text the raw token
     * @return converted value, never null
     * @throws IllegalArgumentException if the text is not a valid value of this type
     */
    @NotNull
    T convert(@NotNull String text);

    /**
     * Create a value type from a conversion function.
     */
    static <T> ValueType<T> of(String name, Class<T> javaType, Function<String, T> converter) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(javaType, "javaType");
        Objects.requireNonNull(converter, "converter");
        return new ValueType<>() {
            @Override
            public @NotNull String name() {
                return name;
            }

            @Override
            public @NotNull Class<T> javaType() {
                return javaType;
            }

            @Override
            public @NotNull T convert(@NotNull String text) {
                T value = converter.apply(text);
                if (value == null) {
                    throw new IllegalArgumentException("No " + name + " value for '" + text + "'");
                }
                return value;
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    private static Boolean parseStrictBoolean(String text) {
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("Expected true or false: " + text);
        };
    }

    private static String decimalInteger(String text) {
        if (!text.matches("[+-]?[0-9]+")) {
            throw new NumberFormatException("Not a base-10 integer: " + text);
        }
        return text;
    }

    // No hex, NaN, Infinity or d/f suffixes.
    private static String decimalNumber(String text) {
        if (!text.matches("[+-]?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?")) {
            throw new NumberFormatException("Not a decimal number: " + text);
        }
        return text;
    }
}
