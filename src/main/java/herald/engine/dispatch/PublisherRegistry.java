package herald.engine.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Platform name to publisher lookup. Names are matched exactly.
 */
public final class PublisherRegistry {

    private static final Logger log = LoggerFactory.getLogger(PublisherRegistry.class);

    private final Map<String, PlatformPublisher> publishers = new ConcurrentHashMap<>();

    public PublisherRegistry register(String platform, PlatformPublisher publisher) {
        if (platform == null || platform.isBlank()) {
            throw new IllegalArgumentException("platform name is required");
        }
        PlatformPublisher previous = publishers.put(platform, publisher);
        if (previous != null) {
            log.warn("Publisher for platform '{}' replaced", platform);
        } else {
            log.info("Publisher registered for platform '{}'", platform);
        }
        return this;
    }

    public Optional<PlatformPublisher> find(String platform) {
        return platform == null ? Optional.empty() : Optional.ofNullable(publishers.get(platform));
    }

    public boolean supports(String platform) {
        return platform != null && publishers.containsKey(platform);
    }

    public Set<String> platforms() {
        return new TreeSet<>(publishers.keySet());
    }
}
