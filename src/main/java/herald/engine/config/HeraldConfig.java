package herald.engine.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for the engine.
 * All settings have sensible defaults; {@link #fromEnv()} overrides them from
 * HERALD_* environment variables.
 */
public final class HeraldConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/herald;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8001;
    private String serverHost = "0.0.0.0";

    // Scheduler settings
    private Duration pollInterval = Duration.ofSeconds(1);
    private int pollBatchSize = 100;
    private Duration stuckRunningThreshold = Duration.ofMinutes(10);
    private Duration reaperInterval = Duration.ofSeconds(60);

    // Dispatch settings
    private Duration dispatchTimeout = Duration.ofSeconds(30);
    private int dispatchThreads = 8;

    // Listing
    private int listPageSize = 200;

    // Publishers
    private Path platformsFile = Path.of("herald.ini");
    private String serviceToken = null; // bearer token this service presents to publishing back-ends

    // Auth settings (optional)
    private String apiKey = null; // If set, /api/ callers must provide X-Herald-Key header

    private HeraldConfig() {
    }

    public static HeraldConfig defaults() {
        return new HeraldConfig();
    }

    public static HeraldConfig fromEnv() {
        HeraldConfig config = new HeraldConfig();

        String dbUrl = System.getenv("HERALD_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("HERALD_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String apiKey = System.getenv("HERALD_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.apiKey = apiKey;
        }

        String pollMs = System.getenv("HERALD_POLL_INTERVAL_MS");
        if (pollMs != null && !pollMs.isBlank()) {
            config.pollInterval = Duration.ofMillis(Long.parseLong(pollMs));
        }

        String timeoutMs = System.getenv("HERALD_DISPATCH_TIMEOUT_MS");
        if (timeoutMs != null && !timeoutMs.isBlank()) {
            config.dispatchTimeout = Duration.ofMillis(Long.parseLong(timeoutMs));
        }

        String platforms = System.getenv("HERALD_PLATFORMS_FILE");
        if (platforms != null && !platforms.isBlank()) {
            config.platformsFile = Path.of(platforms);
        }

        String token = System.getenv("HERALD_SERVICE_TOKEN");
        if (token != null && !token.isBlank()) {
            config.serviceToken = token;
        }

        config.validate();
        return config;
    }

    /**
     * Reject combinations the engine cannot run with.
     *
     * @throws IllegalStateException if a setting is out of range
     */
    public HeraldConfig validate() {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalStateException("pollInterval must be positive");
        }
        if (dispatchTimeout.isNegative() || dispatchTimeout.isZero()) {
            throw new IllegalStateException("dispatchTimeout must be positive");
        }
        // measured from dispatch start: a publish still inside its timeout is never reaped
        if (stuckRunningThreshold.compareTo(dispatchTimeout) <= 0) {
            throw new IllegalStateException("stuckRunningThreshold (" + stuckRunningThreshold
                    + ") must exceed dispatchTimeout (" + dispatchTimeout + ")");
        }
        if (pollBatchSize <= 0 || dispatchThreads <= 0 || listPageSize <= 0) {
            throw new IllegalStateException("batch, thread and page sizes must be positive");
        }
        return this;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int pollBatchSize() {
        return pollBatchSize;
    }

    public Duration stuckRunningThreshold() {
        return stuckRunningThreshold;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public Duration dispatchTimeout() {
        return dispatchTimeout;
    }

    public int dispatchThreads() {
        return dispatchThreads;
    }

    public int listPageSize() {
        return listPageSize;
    }

    public Path platformsFile() {
        return platformsFile;
    }

    public String serviceToken() {
        return serviceToken;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    // Fluent setters for testing/customization
    public HeraldConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public HeraldConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public HeraldConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public HeraldConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public HeraldConfig withPollBatchSize(int size) {
        this.pollBatchSize = size;
        return this;
    }

    public HeraldConfig withDispatchTimeout(Duration timeout) {
        this.dispatchTimeout = timeout;
        return this;
    }

    public HeraldConfig withDispatchThreads(int threads) {
        this.dispatchThreads = threads;
        return this;
    }

    public HeraldConfig withStuckRunningThreshold(Duration threshold) {
        this.stuckRunningThreshold = threshold;
        return this;
    }

    public HeraldConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    public HeraldConfig withListPageSize(int size) {
        this.listPageSize = size;
        return this;
    }

    public HeraldConfig withPlatformsFile(Path file) {
        this.platformsFile = file;
        return this;
    }

    public HeraldConfig withServiceToken(String token) {
        this.serviceToken = token;
        return this;
    }

    @Override
    public String toString() {
        return "HeraldConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", pollInterval=" + pollInterval +
                ", dispatchTimeout=" + dispatchTimeout +
                ", dispatchThreads=" + dispatchThreads +
                ", platformsFile=" + platformsFile +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
