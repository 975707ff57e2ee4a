package io.github.manjago.argtree.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Command or subcommand with its own options, positionals and child commands.
 *
 * The tree is built with the {@code add*} methods before parsing. Each method
 * returns the registered argument; that object is the handle for reading the parsed
 * value afterwards. Conflicting registrations fail immediately with a
 * {@link DefinitionException}.
 *
 * <h2>Example:</h2>
 * <pre>
 * ArgumentParser git = new ArgumentParser("git", "Version control");
 * FlagOption verbose = git.addFlag('v', "verbose", "Be verbose");
 * Command commit = git.addCommand("commit", "Record changes");
 * ValueOption&lt;String&gt; message = commit.addValue('m', "message", ValueType.STRING, "Commit message");
 * ListArgument&lt;Path&gt; files = commit.addRequiredList("files", ValueType.PATH, "Files to commit");
 *
 * if (git.parse(args) &amp;&amp; commit.isInvoked()) {
 *     message.value().ifPresent(...);
 * }
 * </pre>
 */
public class Command {

    private static final Logger log = LoggerFactory.getLogger(Command.class);

    /** Marker for options that have no short flag. */
    public static final char NO_SHORT = '\0';

    private final String name;
    private final String description;
    private final Command parent;

    private final List<OptionalSpec> options = new ArrayList<>();
    private final List<RequiredSpec> arguments = new ArrayList<>();
    private final Map<String, Command> commands = new LinkedHashMap<>();

    private boolean invoked;

    protected Command(@NotNull String name, @NotNull String description) {
        this(name, description, null);
    }

    private Command(String name, String description, @Nullable Command parent) {
        requireValidName(name, "command");
        this.name = name;
        this.description = Objects.requireNonNull(description, "description");
        this.parent = parent;
    }

    // ========== Registration ==========

    /**
     * Register a flag.
     *
     * @param shortName short flag character or {@link #NO_SHORT}
     * @param longName  long flag without dashes, or null
     */
    public FlagOption addFlag(char shortName, @Nullable String longName, @NotNull String description) {
        return registerOption(new FlagOption(optionName(shortName, longName), description));
    }

    public <T> ValueOption<T> addValue(char shortName, @Nullable String longName, @NotNull ValueType<T> type,
                                       @NotNull String description) {
        return registerOption(new ValueOption<>(optionName(shortName, longName), type, description));
    }

    public <T> ListOption<T> addList(char shortName, @Nullable String longName, @NotNull ValueType<T> type,
                                     @NotNull String description) {
        return registerOption(new ListOption<>(optionName(shortName, longName), type, description));
    }

    public <T> ValueArgument<T> addRequiredValue(@NotNull String name, @NotNull ValueType<T> type,
                                                 @NotNull String description) {
        return registerArgument(new ValueArgument<>(name, type, description));
    }

    /**
     * Register a positional list. A command can hold only one: the first list takes
     * every non-flag token, so a second one could never be filled reliably.
     */
    public <T> ListArgument<T> addRequiredList(@NotNull String name, @NotNull ValueType<T> type,
                                               @NotNull String description) {
        return registerArgument(new ListArgument<>(name, type, description));
    }

    /**
     * Register a subcommand. Subcommand names are matched only after every
     * positional of this command has been filled.
     */
    public Command addCommand(@NotNull String name, @NotNull String description) {
        requireValidName(name, "command");
        if (commands.containsKey(name) || findArgument(name).isPresent()) {
            throw new DefinitionException(DefinitionException.Kind.DUPLICATE_ARGUMENT,
                    "Duplicated command name '" + name + "' in '" + path() + "'");
        }
        Command child = new Command(name, description, this);
        commands.put(name, child);
        log.debug("Registered command '{}'", child.path());
        return child;
    }

    private <S extends OptionalSpec> S registerOption(S option) {
        for (OptionalSpec existing : options) {
            boolean sameShort = option.hasShortName() && existing.shortName() == option.shortName();
            boolean sameLong = option.hasLongName() && option.longName().equals(existing.longName());
            if (sameShort || sameLong) {
                throw new DefinitionException(DefinitionException.Kind.DUPLICATE_ARGUMENT,
                        "Duplicated optional argument " + option.displayName() + " in '" + path()
                                + "' (conflicts with " + existing.displayName() + ")");
            }
        }
        Objects.requireNonNull(option.description(), "description");
        options.add(option);
        log.debug("Registered option {} on '{}'", option.displayName(), path());
        return option;
    }

    private <S extends RequiredSpec> S registerArgument(S argument) {
        requireValidName(argument.name(), "argument");
        Objects.requireNonNull(argument.description(), "description");
        if (findArgument(argument.name()).isPresent() || commands.containsKey(argument.name())) {
            throw new DefinitionException(DefinitionException.Kind.DUPLICATE_ARGUMENT,
                    "Duplicated required argument '" + argument.name() + "' in '" + path() + "'");
        }
        if (argument.kind().isUnbounded()) {
            for (RequiredSpec existing : arguments) {
                if (existing.kind().isUnbounded()) {
                    throw new DefinitionException(DefinitionException.Kind.UNREACHABLE_ARGUMENT,
                            "List argument " + argument.displayName() + " in '" + path()
                                    + "' follows list argument " + existing.displayName());
                }
            }
        }
        arguments.add(argument);
        log.debug("Registered argument {} on '{}'", argument.displayName(), path());
        return argument;
    }

    private static OptionName optionName(char shortName, @Nullable String longName) {
        if (shortName == NO_SHORT && longName == null) {
            throw new DefinitionException(DefinitionException.Kind.INVALID_NAME,
                    "Option needs a short or a long name");
        }
        if (shortName == '-' || Character.isWhitespace(shortName)) {
            throw new DefinitionException(DefinitionException.Kind.INVALID_NAME,
                    "Invalid short option name: '" + shortName + "'");
        }
        if (longName != null) {
            requireValidName(longName, "option");
        }
        return new OptionName(shortName, longName);
    }

    private static void requireValidName(String name, String what) {
        if (name == null || name.isBlank() || name.startsWith("-") || name.chars().anyMatch(Character::isWhitespace)) {
            throw new DefinitionException(DefinitionException.Kind.INVALID_NAME,
                    "Invalid " + what + " name: '" + name + "'");
        }
    }

    // ========== Tree ==========

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public String getDescription() {
        return description;
    }

    @Nullable
    public Command getParent() {
        return parent;
    }

    /**
     * Names from the root down to this command, separated by spaces.
     */
    @NotNull
    public String path() {
        return parent == null ? name : parent.path() + " " + name;
    }

    public List<OptionalSpec> options() {
        return Collections.unmodifiableList(options);
    }

    /**
     * Positionals in the order they are filled.
     */
    public List<RequiredSpec> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public Collection<Command> commands() {
        return Collections.unmodifiableCollection(commands.values());
    }

    /**
     * Whether the parser entered this command. The root is always entered.
     */
    public boolean isInvoked() {
        return invoked;
    }

    void markInvoked() {
        invoked = true;
    }

    // ========== Lookup ==========

    public Optional<OptionalSpec> findShort(char shortName) {
        for (OptionalSpec option : options) {
            if (option.hasShortName() && option.shortName() == shortName) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }

    public Optional<OptionalSpec> findLong(@NotNull String longName) {
        for (OptionalSpec option : options) {
            if (longName.equals(option.longName())) {
                return Optional.of(option);
            }
        }
        return Optional.empty();
    }

    public Optional<RequiredSpec> findArgument(@NotNull String name) {
        for (RequiredSpec argument : arguments) {
            if (argument.name().equals(name)) {
                return Optional.of(argument);
            }
        }
        return Optional.empty();
    }

    public Optional<Command> findCommand(@NotNull String name) {
        return Optional.ofNullable(commands.get(name));
    }

    /**
     * Whether some short flag is a digit, which turns tokens like {@code -1} into flags.
     */
    boolean hasDigitShortFlag() {
        for (OptionalSpec option : options) {
            if (option.hasShortName() && Character.isDigit(option.shortName())) {
                return true;
            }
        }
        return false;
    }

    // ========== Retrieval by name ==========

    @NotNull
    public FlagOption getFlag(@NotNull String longName) {
        return optionOfKind(longName, ArgumentKind.FLAG, FlagOption.class);
    }

    @NotNull
    public <T> ValueOption<T> getValue(@NotNull String longName, @NotNull Class<T> type) {
        ValueOption<?> option = optionOfKind(longName, ArgumentKind.VALUE, ValueOption.class);
        checkType(option.type(), type, longName);
        return narrow(option);
    }

    @NotNull
    public <T> ListOption<T> getList(@NotNull String longName, @NotNull Class<T> type) {
        ListOption<?> option = optionOfKind(longName, ArgumentKind.LIST, ListOption.class);
        checkType(option.type(), type, longName);
        return narrow(option);
    }

    @NotNull
    public <T> ValueArgument<T> getRequiredValue(@NotNull String name, @NotNull Class<T> type) {
        ValueArgument<?> argument = argumentOfKind(name, ArgumentKind.VALUE, ValueArgument.class);
        checkType(argument.type(), type, name);
        return narrow(argument);
    }

    @NotNull
    public <T> ListArgument<T> getRequiredList(@NotNull String name, @NotNull Class<T> type) {
        ListArgument<?> argument = argumentOfKind(name, ArgumentKind.LIST, ListArgument.class);
        checkType(argument.type(), type, name);
        return narrow(argument);
    }

    @NotNull
    public Command getCommand(@NotNull String name) {
        return findCommand(name).orElseThrow(() ->
                new NoSuchElementException("No command '" + name + "' in '" + path() + "'"));
    }

    private <S extends OptionalSpec> S optionOfKind(String longName, ArgumentKind kind, Class<S> variant) {
        OptionalSpec option = findLong(longName).orElseThrow(() ->
                new NoSuchElementException("No option --" + longName + " in '" + path() + "'"));
        if (option.kind() != kind) {
            throw new IllegalArgumentException("Option --" + longName + " is a " + option.kind()
                    + ", not a " + kind);
        }
        return variant.cast(option);
    }

    private <S extends RequiredSpec> S argumentOfKind(String name, ArgumentKind kind, Class<S> variant) {
        RequiredSpec argument = findArgument(name).orElseThrow(() ->
                new NoSuchElementException("No argument <" + name + "> in '" + path() + "'"));
        if (argument.kind() != kind) {
            throw new IllegalArgumentException("Argument <" + name + "> is a " + argument.kind()
                    + ", not a " + kind);
        }
        return variant.cast(argument);
    }

    private static void checkType(ValueType<?> actual, Class<?> requested, String name) {
        if (!requested.equals(actual.javaType())) {
            throw new IllegalArgumentException("'" + name + "' holds " + actual.javaType().getSimpleName()
                    + " values, not " + requested.getSimpleName());
        }
    }

    // Only called after checkType compared the element types.
    @SuppressWarnings("unchecked")
    private static <H> H narrow(Object handle) {
        return (H) handle;
    }

    @Override
    public String toString() {
        return "Command{" + path() + ", options=" + options.size() + ", arguments=" + arguments.size()
                + ", commands=" + commands.keySet() + "}";
    }
}
