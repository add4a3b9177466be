package io.github.drompincen.shopbench.gateway.cli;

import io.github.drompincen.shopbench.runtime.config.PreconditionException;
import org.springframework.boot.ApplicationArguments;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command line options. Values use the {@code --name=value} form; platform
 * lists are comma separated and upper-cased.
 */
public record CommandOptions(
        String setting,
        String envFile,
        Set<String> platforms,
        Set<String> excludedPlatforms,
        String scenarioStart,
        String scenarioEnd
) {
    static final String DEFAULT_ENV_FILE = ".env";
    static final List<String> VALUE_OPTIONS = List.of(
            "setting", "env", "platform", "exclude-platform", "scenario-start", "scenario-end");

    public static CommandOptions from(ApplicationArguments args) {
        requireInlineValues(args);
        return new CommandOptions(
                single(args, "setting"),
                orDefault(single(args, "env"), DEFAULT_ENV_FILE),
                platformList(single(args, "platform")),
                platformList(single(args, "exclude-platform")),
                single(args, "scenario-start"),
                single(args, "scenario-end"));
    }

    // "--platform GEMINI" would otherwise drop the filter and run every platform
    private static void requireInlineValues(ApplicationArguments args) {
        for (String name : VALUE_OPTIONS) {
            if (args.containsOption(name) && args.getOptionValues(name).stream().allMatch(v -> v == null)) {
                throw new PreconditionException("Option --" + name + " needs a value; use --" + name + "=<value>");
            }
        }
        if (!args.getNonOptionArgs().isEmpty()) {
            throw new PreconditionException("Unexpected arguments " + args.getNonOptionArgs()
                    + "; options take the form --name=value");
        }
    }

    static Set<String> platformList(String value) {
        Set<String> ids = new LinkedHashSet<>();
        if (value == null) return ids;
        Arrays.stream(value.split(","))
                .map(s -> s.strip().toUpperCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .forEach(ids::add);
        return ids;
    }

    // last occurrence wins, as with most CLI parsers
    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return null;
        String v = values.get(values.size() - 1);
        return v == null || v.isBlank() ? null : v.strip();
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
