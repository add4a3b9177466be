package io.github.drompincen.shopbench.runtime.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code KEY=VALUE} lines from an env file. Blank lines, {@code #}
 * comments and lines without {@code =} are skipped. A missing file yields an
 * empty map.
 */
@Component
public class EnvFileLoader {

    private static final Logger log = LoggerFactory.getLogger(EnvFileLoader.class);

    public Map<String, String> load(Path path) {
        Map<String, String> env = new LinkedHashMap<>();
        if (path == null) return env;

        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.warn("[Config] Env file {} not found; continuing without credentials", path);
            return env;
        } catch (IOException e) {
            throw new PreconditionException("Failed to read env file " + path + ": " + e.getMessage());
        }

        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            int eq = line.indexOf('=');
            if (eq < 0) continue;
            env.put(line.substring(0, eq).strip(), line.substring(eq + 1).strip());
        }
        log.debug("[Config] Loaded {} entries from {}", env.size(), path);
        return env;
    }
}
