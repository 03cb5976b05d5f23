package herald.engine.config;

import herald.engine.dispatch.HttpPlatformPublisher;
import herald.engine.dispatch.PublisherRegistry;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Loads HTTP publishing back-ends from an INI file, one section per platform:
 *
 * <pre>
 * [linkedin]
 * url = http://localhost:8002/api/v1/linkedin/publish
 * timeout_ms = 20000
 * </pre>
 *
 * {@code timeout_ms} is optional and defaults to the dispatch timeout.
 */
public final class PlatformIniLoader {

    private static final Logger log = LoggerFactory.getLogger(PlatformIniLoader.class);

    private PlatformIniLoader() {
    }

    /**
     * Register an {@link HttpPlatformPublisher} per section of {@code config.platformsFile()}.
     * A missing file leaves the registry untouched.
     *
     * @throws IllegalStateException if the file exists but cannot be read or a section is invalid
     */
    public static PublisherRegistry load(HeraldConfig config, PublisherRegistry registry) {
        Path file = config.platformsFile();
        if (file == null || !Files.exists(file)) {
            log.warn("Platforms file {} not found; no HTTP publishers configured", file);
            return registry;
        }

        Ini ini;
        try {
            ini = new Ini(file.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read platforms file " + file, e);
        }

        for (String name : ini.keySet()) {
            Profile.Section section = ini.get(name);
            String url = opt(section, "url");
            if (url == null) {
                throw new IllegalStateException("Platform [" + name + "] in " + file + " has no url");
            }

            Duration timeout = config.dispatchTimeout();
            String timeoutMs = opt(section, "timeout_ms");
            if (timeoutMs != null) {
                try {
                    timeout = Duration.ofMillis(Long.parseLong(timeoutMs));
                } catch (NumberFormatException e) {
                    throw new IllegalStateException("Platform [" + name + "] has invalid timeout_ms: " + timeoutMs, e);
                }
            }

            registry.register(name, new HttpPlatformPublisher(name, URI.create(url), config.serviceToken(), timeout));
            log.info("Platform '{}' -> {}", name, url);
        }
        return registry;
    }

    private static String opt(Profile.Section s, String key) {
        String v = s == null ? null : s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
