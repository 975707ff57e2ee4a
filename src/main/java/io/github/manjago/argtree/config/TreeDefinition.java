package io.github.manjago.argtree.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import io.github.manjago.argtree.core.ArgumentParser;
import io.github.manjago.argtree.core.Command;
import io.github.manjago.argtree.core.ValueType;
import io.github.manjago.argtree.core.ValueTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * Builds a command tree from a HOCON document.
 * <p>
 * Default values are in reference.conf under {@code argtree.defaults}.
 *
 * <h2>Format:</h2>
 * <pre>
 * argtree.tree {
 *   name = git
 *   description = "Version control"
 *   options = [
 *     { short = v, long = verbose, kind = flag, description = "Be verbose" }
 *   ]
 *   commands = [
 *     {
 *       name = commit
 *       options = [ { short = m, long = message, kind = value } ]
 *       arguments = [ { name = files, kind = list, type = path } ]
 *     }
 *   ]
 * }
 * </pre>
 * Option kinds are {@code flag}, {@code value} and {@code list}; argument kinds are
 * {@code value} (the default) and {@code list}. Types are looked up in a
 * {@link ValueTypeRegistry}.
 */
public class TreeDefinition {

    private static final Logger log = LoggerFactory.getLogger(TreeDefinition.class);

    private static final String TREE_PATH = "argtree.tree";
    private static final String DEFAULTS_PATH = "argtree.defaults";

    private final ValueTypeRegistry types;

    public TreeDefinition() {
        this(ValueTypeRegistry.standard());
    }

    public TreeDefinition(ValueTypeRegistry types) {
        this.types = types;
    }

    /**
     * Load a definition file.
     *
     * @throws ConfigException if the file is missing or malformed
     * @throws io.github.manjago.argtree.core.DefinitionException if the tree is inconsistent
     */
    public ArgumentParser load(Path file) {
        log.info("Loading tree definition from {}", file);
        Config fileConfig = ConfigFactory.parseFile(file.toFile(),
                ConfigParseOptions.defaults().setAllowMissing(false));
        return fromConfig(fileConfig.withFallback(ConfigFactory.load()).resolve());
    }

    /**
     * Build from HOCON text.
     */
    public ArgumentParser parse(String hocon) {
        return fromConfig(ConfigFactory.parseString(hocon).withFallback(ConfigFactory.load()).resolve());
    }

    /**
     * Build from a resolved config holding {@code argtree.tree} and {@code argtree.defaults}.
     */
    public ArgumentParser fromConfig(Config config) {
        Config defaults = config.getConfig(DEFAULTS_PATH);
        Config root = config.getConfig(TREE_PATH);

        ArgumentParser parser = new ArgumentParser(root.getString("name"), description(root, defaults));
        populate(parser, root, defaults);
        log.debug("Built tree '{}' with {} options, {} arguments, {} commands",
                parser.getName(), parser.options().size(), parser.arguments().size(), parser.commands().size());
        return parser;
    }

    private void populate(Command command, Config node, Config defaults) {
        for (Config option : list(node, "options")) {
            addOption(command, option, defaults);
        }
        for (Config argument : list(node, "arguments")) {
            addArgument(command, argument, defaults);
        }
        for (Config child : list(node, "commands")) {
            Command sub = command.addCommand(child.getString("name"), description(child, defaults));
            populate(sub, child, defaults);
        }
    }

    private void addOption(Command command, Config option, Config defaults) {
        char shortName = shortName(option);
        String longName = option.hasPath("long") ? option.getString("long") : null;
        String description = description(option, defaults);
        String kind = option.hasPath("kind") ? option.getString("kind") : "flag";

        switch (kind.toLowerCase(Locale.ROOT)) {
            case "flag" -> command.addFlag(shortName, longName, description);
            case "value" -> command.addValue(shortName, longName, type(option, defaults), description);
            case "list" -> command.addList(shortName, longName, type(option, defaults), description);
            default -> throw new ConfigException.BadValue(option.origin(), "kind",
                    "Option kind must be flag, value or list, got '" + kind + "'");
        }
    }

    private void addArgument(Command command, Config argument, Config defaults) {
        String name = argument.getString("name");
        String description = description(argument, defaults);
        String kind = argument.hasPath("kind") ? argument.getString("kind") : "value";

        switch (kind.toLowerCase(Locale.ROOT)) {
            case "value" -> command.addRequiredValue(name, type(argument, defaults), description);
            case "list" -> command.addRequiredList(name, type(argument, defaults), description);
            default -> throw new ConfigException.BadValue(argument.origin(), "kind",
                    "Argument kind must be value or list, got '" + kind + "'");
        }
    }

    private ValueType<?> type(Config node, Config defaults) {
        String name = node.hasPath("type") ? node.getString("type") : defaults.getString("type");
        try {
            return types.get(name);
        } catch (NoSuchElementException e) {
            throw new ConfigException.BadValue(node.origin(), "type", e.getMessage(), e);
        }
    }

    private static char shortName(Config option) {
        if (!option.hasPath("short")) {
            return Command.NO_SHORT;
        }
        String value = option.getString("short");
        if (value.length() != 1) {
            throw new ConfigException.BadValue(option.origin(), "short",
                    "Short name must be a single character, got '" + value + "'");
        }
        return value.charAt(0);
    }

    private static String description(Config node, Config defaults) {
        return node.hasPath("description") ? node.getString("description") : defaults.getString("description");
    }

    private static List<? extends Config> list(Config node, String path) {
        return node.hasPath(path) ? node.getConfigList(path) : List.of();
    }
}
