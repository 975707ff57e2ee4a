package io.github.manjago.argtree.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Payload of list arguments, shared by {@link ListOption} and {@link ListArgument}.
 */
final class ListHolder<T> {

    private final ValueType<T> type;
    private final List<T> values = new ArrayList<>();
    private boolean present;

    ListHolder(ValueType<T> type) {
        this.type = type;
    }

    ValueType<T> type() {
        return type;
    }

    List<T> values() {
        return Collections.unmodifiableList(values);
    }

    boolean isPresent() {
        return present;
    }

    /**
     * Take the whole window. Nothing is stored unless every token converts.
     */
    int consume(List<String> window, String commandPath, String argument) throws ParseException {
        if (window.isEmpty()) {
            throw new ParseException(ParseException.Kind.MISSING_VALUE, commandPath, argument, null,
                    "missing " + type.name() + " values for " + argument);
        }
        List<T> converted = new ArrayList<>(window.size());
        for (String token : window) {
            converted.add(ValueHolder.convert(type, token, commandPath, argument));
        }
        values.addAll(converted);
        present = true;
        return converted.size();
    }
}
