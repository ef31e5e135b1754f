package com.brandsentinel.app;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits the command line into command words and {@code --name[=value]}
 * options.
 *
 * <p>
 * A bare {@code --name} is a flag. Option names are restricted to letters,
 * digits and dashes; values must not contain control characters.
 * </p>
 */
public final class CliArguments {

    private static final Pattern NAME = Pattern.compile("^[A-Za-z0-9-]+$");

    private final List<String> commands;
    private final Map<String, String> options;

    private CliArguments(List<String> commands, Map<String, String> options) {
        this.commands = Collections.unmodifiableList(commands);
        this.options = Collections.unmodifiableMap(options);
    }

    /**
     * @param args raw arguments; {@code null} is treated as empty
     * @throws IllegalArgumentException on a malformed option
     */
    public static CliArguments parse(String[] args) {
        List<String> commands = new ArrayList<>();
        Map<String, String> options = new LinkedHashMap<>();
        if (args == null) {
            return new CliArguments(commands, options);
        }
        for (String raw : args) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String arg = raw.trim();
            if (!arg.startsWith("--")) {
                commands.add(arg);
                continue;
            }
            String body = arg.substring(2);
            int idx = body.indexOf('=');
            String name = idx < 0 ? body : body.substring(0, idx);
            String value = idx < 0 ? "" : body.substring(idx + 1).trim();
            if (!NAME.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid option name: '" + raw + "'");
            }
            if (idx >= 0 && value.isEmpty()) {
                throw new IllegalArgumentException("Option --" + name + " requires a value");
            }
            if (value.chars().anyMatch(Character::isISOControl)) {
                throw new IllegalArgumentException("Option --" + name + " must not contain control characters");
            }
            options.put(name, value);
        }
        return new CliArguments(commands, options);
    }

    public List<String> commands() {
        return commands;
    }

    /** @return the command word at {@code index}, or empty */
    public Optional<String> command(int index) {
        return index < commands.size() ? Optional.of(commands.get(index)) : Optional.empty();
    }

    /** @return the value of {@code --name=value}; empty for flags and absent options */
    public Optional<String> option(String name) {
        String value = options.get(name);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public boolean flag(String name) {
        return options.containsKey(name);
    }

    public Set<String> optionNames() {
        return options.keySet();
    }
}
