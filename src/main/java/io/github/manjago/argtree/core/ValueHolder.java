package io.github.manjago.argtree.core;

import java.util.List;
import java.util.Optional;

/**
 * Payload of single-valued arguments, shared by {@link ValueOption} and
 * {@link ValueArgument}.
 */
final class ValueHolder<T> {

    private final ValueType<T> type;
    private T value;

    ValueHolder(ValueType<T> type) {
        this.type = type;
    }

    ValueType<T> type() {
        return type;
    }

    Optional<T> value() {
        return Optional.ofNullable(value);
    }

    boolean isPresent() {
        return value != null;
    }

    /**
     * Take the first token of the window. A repeated option keeps the last value.
     */
    int consume(List<String> window, String commandPath, String argument) throws ParseException {
        if (window.isEmpty()) {
            throw new ParseException(ParseException.Kind.MISSING_VALUE, commandPath, argument, null,
                    "missing " + type.name() + " value for " + argument);
        }
        value = convert(type, window.get(0), commandPath, argument);
        return 1;
    }

    static <T> T convert(ValueType<T> type, String token, String commandPath, String argument)
            throws ParseException {
        try {
            return type.convert(token);
        } catch (IllegalArgumentException e) {
            throw new ParseException(ParseException.Kind.CONVERSION_FAILURE, commandPath, argument, token,
                    "invalid " + type.name() + " value '" + token + "' for " + argument, e);
        }
    }
}
