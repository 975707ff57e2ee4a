package io.github.manjago.argtree.core;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Token-consumption loop for one command invocation.
 *
 * Tokens are read left to right from a window that shrinks as arguments take
 * their values:
 * <ol>
 *   <li>{@code --name} is a long flag, {@code -xyz} a short flag or a group of short
 *       flags, a lone {@code --} ends option processing;</li>
 *   <li>any other token fills the next empty positional, or, once all positionals
 *       are filled, names a subcommand that parses the rest of the window;</li>
 *   <li>at the end of the window every positional must be filled.</li>
 * </ol>
 * Value-taking arguments never see past the next flag token, except that a
 * positional list interrupted by {@code --} also takes every token after it. The engine does not
 * log and does not recover: the first problem ends the parse with a
 * {@link ParseException}.
 */
final class ParseEngine {

    static final String LONG_PREFIX = "--";
    static final String SHORT_PREFIX = "-";
    static final String END_OF_OPTIONS = "--";

    private static final Pattern NEGATIVE_NUMBER = Pattern.compile("-\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private enum TokenType {
        LONG_FLAG,
        SHORT_FLAG,
        END_OF_OPTIONS,
        POSITIONAL
    }

    private final Command command;
    private final String path;
    private boolean optionsEnded;

    private ParseEngine(Command command, boolean optionsEnded) {
        this.command = command;
        this.path = command.path();
        this.optionsEnded = optionsEnded;
    }

    /**
     * Parse a window on behalf of a command.
     *
     * @param command      the command being invoked
     * @param window       tokens visible to this command
     * @param optionsEnded whether a {@code --} was already seen by a parent command
     * @return number of tokens consumed, always the whole window on success
     * @throws ParseException on the first token or positional that does not fit
     */
    static int parse(Command command, List<String> window, boolean optionsEnded) throws ParseException {
        return new ParseEngine(command, optionsEnded).run(window);
    }

    private int run(List<String> window) throws ParseException {
        command.markInvoked();
        int pos = 0;
        int nextArgument = 0;
        List<RequiredSpec> arguments = command.arguments();

        while (pos < window.size()) {
            String token = window.get(pos);

            switch (classify(token)) {
                case END_OF_OPTIONS -> {
                    optionsEnded = true;
                    pos++;
                }
                case LONG_FLAG -> {
                    String longName = token.substring(LONG_PREFIX.length());
                    OptionalSpec option = command.findLong(longName).orElseThrow(() -> unknownOption(token));
                    pos += 1 + consumeOption(option, window, pos + 1);
                }
                case SHORT_FLAG -> pos += 1 + shortFlags(token, window, pos + 1);
                case POSITIONAL -> {
                    if (nextArgument < arguments.size()) {
                        RequiredSpec argument = arguments.get(nextArgument++);
                        pos += consumeArgument(argument, window.subList(pos, valueEnd(window, pos)));
                        if (argument.kind() == ArgumentKind.LIST && pos < window.size()
                                && classify(window.get(pos)) == TokenType.END_OF_OPTIONS) {
                            // A list interrupted by "--" takes everything after it.
                            optionsEnded = true;
                            pos++;
                            if (pos < window.size()) {
                                pos += consumeArgument(argument, window.subList(pos, window.size()));
                            }
                        }
                    } else {
                        Command child = command.findCommand(token).orElseThrow(() ->
                                new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, path, null, token,
                                        "unexpected argument '" + token + "'"));
                        // Subcommand owns the rest of the window.
                        return pos + 1 + parse(child, window.subList(pos + 1, window.size()), optionsEnded);
                    }
                }
            }
        }

        if (nextArgument < arguments.size()) {
            RequiredSpec missing = arguments.get(nextArgument);
            throw new ParseException(ParseException.Kind.UNSATISFIED_REQUIRED, path, missing.displayName(), null,
                    "missing required argument " + missing.displayName());
        }
        return pos;
    }

    private TokenType classify(String token) {
        if (optionsEnded) {
            return TokenType.POSITIONAL;
        }
        if (token.equals(END_OF_OPTIONS)) {
            return TokenType.END_OF_OPTIONS;
        }
        if (token.startsWith(LONG_PREFIX)) {
            return TokenType.LONG_FLAG;
        }
        if (token.startsWith(SHORT_PREFIX) && token.length() > SHORT_PREFIX.length()) {
            if (NEGATIVE_NUMBER.matcher(token).matches() && !command.hasDigitShortFlag()) {
                return TokenType.POSITIONAL;
            }
            return TokenType.SHORT_FLAG;
        }
        return TokenType.POSITIONAL;
    }

    /**
     * Handle {@code -x} or {@code -xyz}.
     *
     * @return tokens consumed after the flag token
     */
    private int shortFlags(String token, List<String> window, int valueStart) throws ParseException {
        String group = token.substring(SHORT_PREFIX.length());
        if (group.length() == 1) {
            OptionalSpec option = command.findShort(group.charAt(0)).orElseThrow(() -> unknownOption(token));
            return consumeOption(option, window, valueStart);
        }

        // Resolve the whole group before counting anything.
        FlagOption[] flags = new FlagOption[group.length()];
        for (int i = 0; i < group.length(); i++) {
            char c = group.charAt(i);
            OptionalSpec option = command.findShort(c).orElseThrow(() ->
                    new ParseException(ParseException.Kind.UNKNOWN_OPTION, path, "-" + c, token,
                            "unknown option '-" + c + "' in '" + token + "'"));
            if (option.kind() != ArgumentKind.FLAG) {
                throw new ParseException(ParseException.Kind.AMBIGUOUS_SHORT_GROUP, path, option.displayName(),
                        token, "option " + option.displayName() + " takes a value and cannot be grouped in '"
                        + token + "'");
            }
            flags[i] = (FlagOption) option;
        }
        for (FlagOption flag : flags) {
            flag.occur();
        }
        return 0;
    }

    private int consumeOption(OptionalSpec option, List<String> window, int valueStart) throws ParseException {
        List<String> values = window.subList(valueStart, valueEnd(window, valueStart));
        return switch (option.kind()) {
            case FLAG -> {
                ((FlagOption) option).occur();
                yield 0;
            }
            case VALUE -> ((ValueOption<?>) option).consume(values, path);
            case LIST -> ((ListOption<?>) option).consume(values, path);
        };
    }

    private int consumeArgument(RequiredSpec argument, List<String> values) throws ParseException {
        return switch (argument.kind()) {
            case VALUE -> ((ValueArgument<?>) argument).consume(values, path);
            case LIST -> ((ListArgument<?>) argument).consume(values, path);
            case FLAG -> throw new IllegalStateException("Positional cannot be a flag: " + argument.name());
        };
    }

    /**
     * Index of the first flag token at or after {@code from}, or the window size.
     */
    private int valueEnd(List<String> window, int from) {
        if (optionsEnded) {
            return window.size();
        }
        for (int i = from; i < window.size(); i++) {
            TokenType type = classify(window.get(i));
            if (type != TokenType.POSITIONAL) {
                return i;
            }
        }
        return window.size();
    }

    private ParseException unknownOption(String token) {
        return new ParseException(ParseException.Kind.UNKNOWN_OPTION, path, token, token,
                "unknown option '" + token + "'");
    }
}
