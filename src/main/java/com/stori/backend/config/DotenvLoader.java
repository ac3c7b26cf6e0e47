package com.stori.backend.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local-development .env support.
 *
 * Reads {@code .env.local}, {@code .env.development} and {@code .env} from the working directory, in that
 * order, and copies each key into a System property unless an environment variable or System property
 * already defines it. The first file to define a key wins. Missing files are ignored.
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    static final List<String> CANDIDATES = List.of(".env.local", ".env.development", ".env");

    private DotenvLoader() {
    }

    public static void loadFromWorkingDirectoryIfPresent() {
        loadFrom(Path.of(""), System.getenv());
    }

    /**
     * @return number of keys set as System properties
     */
    static int loadFrom(Path directory, Map<String, String> environment) {
        int loaded = 0;
        for (String name : CANDIDATES) {
            Path envPath = directory.resolve(name);
            if (Files.isRegularFile(envPath)) {
                loaded += loadFile(envPath, environment);
            }
        }
        return loaded;
    }

    private static int loadFile(Path envPath, Map<String, String> environment) {
        int loaded = 0;
        try {
            for (String raw : Files.readAllLines(envPath, StandardCharsets.UTF_8)) {
                String line = raw.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                if (line.startsWith("export ")) line = line.substring("export ".length()).trim();

                int idx = line.indexOf('=');
                if (idx <= 0) continue;

                String key = line.substring(0, idx).trim();
                String value = unquote(line.substring(idx + 1).trim());
                if (key.isEmpty() || value.isEmpty()) continue;

                String envValue = environment.get(key);
                if (envValue != null && !envValue.isBlank()) continue;
                String sysValue = System.getProperty(key);
                if (sysValue != null && !sysValue.isBlank()) continue;

                System.setProperty(key, value);
                loaded++;
            }
        } catch (IOException e) {
            log.warn("[DotenvLoader] Failed to read {} (ignored): {}", envPath, e.getMessage());
            return loaded;
        }

        if (loaded > 0) {
            log.info("[DotenvLoader] Loaded {} keys from {} into System properties (values hidden)",
                    loaded, envPath.toAbsolutePath());
        }
        return loaded;
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
