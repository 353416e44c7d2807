package caseflow.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for coordinator settings.
 * All settings have sensible defaults; {@link #fromEnv()} overrides them from
 * {@code CASEFLOW_*} environment variables.
 */
public final class CoordinatorConfig {

    public static final String CASE_QUEUE = "case-processing";

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/caseflow;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private String environment = "development";

    // Queue settings
    private String caseQueue = CASE_QUEUE;
    private int defaultMaxAttempts = 3;
    private int maxBatchSize = 10;
    private Duration queueBackoffBase = Duration.ofSeconds(2);
    private Duration queueBackoffMax = Duration.ofMinutes(5);
    private Duration jobLeaseTimeout = Duration.ofMinutes(10);
    private Duration reaperInterval = Duration.ofSeconds(30);
    private Duration retentionInterval = Duration.ofHours(1);
    private int retentionMaxAgeHours = 24;
    private boolean pollEnabled = false;
    private Duration pollInterval = Duration.ofSeconds(5);

    // External call settings
    private int maxRetries = 3;
    private Duration retryBaseDelay = Duration.ofMillis(2000);
    private Duration retryMaxDelay = Duration.ofMillis(30000);
    private Duration minCallDelay = Duration.ofMillis(1000);
    private Duration externalCallTimeout = Duration.ofSeconds(60);
    private int charactersPerToken = 4;
    private int fanOutThreads = 4;

    private String llmBaseUrl = "https://api.openai.com/v1";
    private String llmApiKey = null;
    private String caseLawBaseUrl = "https://www.courtlistener.com/api/rest/v4";
    private String caseLawApiKey = null;
    private String extractorBaseUrl = null;
    private String extractorApiKey = null;

    // Auth settings
    private String webhookSecret = null; // HMAC key for first-party change events
    private String serviceName = "caseflow-backend"; // expected X-Internal-Service
    private String serviceSecret = null; // expected X-Service-Secret
    private String tokenSecret = null; // signs live channel bearer tokens

    // Live channel
    private boolean liveChannelEnabled = true;

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        String dbUrl = env("CASEFLOW_DB_URL");
        if (dbUrl != null) {
            config.databaseUrl = dbUrl;
        }

        String port = env("CASEFLOW_PORT");
        if (port != null) {
            config.serverPort = Integer.parseInt(port);
        }

        String environment = env("CASEFLOW_ENV");
        if (environment != null) {
            config.environment = environment.toLowerCase();
        }

        String maxAttempts = env("CASEFLOW_MAX_ATTEMPTS");
        if (maxAttempts != null) {
            config.defaultMaxAttempts = Integer.parseInt(maxAttempts);
        }

        String webhookSecret = env("CASEFLOW_WEBHOOK_SECRET");
        if (webhookSecret != null) {
            config.webhookSecret = webhookSecret;
        }

        String serviceName = env("CASEFLOW_SERVICE_NAME");
        if (serviceName != null) {
            config.serviceName = serviceName;
        }

        String serviceSecret = env("CASEFLOW_SERVICE_SECRET");
        if (serviceSecret != null) {
            config.serviceSecret = serviceSecret;
        }

        String tokenSecret = env("CASEFLOW_TOKEN_SECRET");
        if (tokenSecret != null) {
            config.tokenSecret = tokenSecret;
        }

        String live = env("CASEFLOW_LIVE_CHANNEL");
        if (live != null) {
            config.liveChannelEnabled = Boolean.parseBoolean(live);
        }

        String poll = env("CASEFLOW_POLL_ENABLED");
        if (poll != null) {
            config.pollEnabled = Boolean.parseBoolean(poll);
        }

        String llmBaseUrl = env("CASEFLOW_LLM_BASE_URL");
        if (llmBaseUrl != null) {
            config.llmBaseUrl = llmBaseUrl;
        }
        config.llmApiKey = env("CASEFLOW_LLM_API_KEY");

        String caseLawBaseUrl = env("CASEFLOW_CASELAW_BASE_URL");
        if (caseLawBaseUrl != null) {
            config.caseLawBaseUrl = caseLawBaseUrl;
        }
        config.caseLawApiKey = env("CASEFLOW_CASELAW_API_KEY");

        config.extractorBaseUrl = env("CASEFLOW_EXTRACTOR_BASE_URL");
        config.extractorApiKey = env("CASEFLOW_EXTRACTOR_API_KEY");

        return config;
    }

    private static String env(String name) {
        String value = System.getenv(name);
        return value != null && !value.isBlank() ? value.trim() : null;
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

    public String environment() {
        return environment;
    }

    public boolean isProduction() {
        return "production".equals(environment);
    }

    public String caseQueue() {
        return caseQueue;
    }

    public int defaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public int maxBatchSize() {
        return maxBatchSize;
    }

    public Duration queueBackoffBase() {
        return queueBackoffBase;
    }

    public Duration queueBackoffMax() {
        return queueBackoffMax;
    }

    public Duration jobLeaseTimeout() {
        return jobLeaseTimeout;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public Duration retentionInterval() {
        return retentionInterval;
    }

    public int retentionMaxAgeHours() {
        return retentionMaxAgeHours;
    }

    public boolean pollEnabled() {
        return pollEnabled;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration retryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration retryMaxDelay() {
        return retryMaxDelay;
    }

    public Duration minCallDelay() {
        return minCallDelay;
    }

    public Duration externalCallTimeout() {
        return externalCallTimeout;
    }

    public int charactersPerToken() {
        return charactersPerToken;
    }

    public int fanOutThreads() {
        return fanOutThreads;
    }

    public String llmBaseUrl() {
        return llmBaseUrl;
    }

    public String llmApiKey() {
        return llmApiKey;
    }

    public String caseLawBaseUrl() {
        return caseLawBaseUrl;
    }

    public String caseLawApiKey() {
        return caseLawApiKey;
    }

    public String extractorBaseUrl() {
        return extractorBaseUrl;
    }

    public String extractorApiKey() {
        return extractorApiKey;
    }

    public String webhookSecret() {
        return webhookSecret;
    }

    public boolean hasWebhookSecret() {
        return webhookSecret != null && !webhookSecret.isBlank();
    }

    public String serviceName() {
        return serviceName;
    }

    public String serviceSecret() {
        return serviceSecret;
    }

    public boolean hasServiceSecret() {
        return serviceSecret != null && !serviceSecret.isBlank();
    }

    public String tokenSecret() {
        return tokenSecret;
    }

    public boolean liveChannelEnabled() {
        return liveChannelEnabled;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withEnvironment(String environment) {
        this.environment = environment;
        return this;
    }

    public CoordinatorConfig withMaxAttempts(int attempts) {
        this.defaultMaxAttempts = attempts;
        return this;
    }

    public CoordinatorConfig withQueueBackoff(Duration base, Duration max) {
        this.queueBackoffBase = base;
        this.queueBackoffMax = max;
        return this;
    }

    public CoordinatorConfig withJobLeaseTimeout(Duration timeout) {
        this.jobLeaseTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withRetry(int maxRetries, Duration baseDelay, Duration maxDelay) {
        this.maxRetries = maxRetries;
        this.retryBaseDelay = baseDelay;
        this.retryMaxDelay = maxDelay;
        return this;
    }

    public CoordinatorConfig withMinCallDelay(Duration delay) {
        this.minCallDelay = delay;
        return this;
    }

    public CoordinatorConfig withWebhookSecret(String secret) {
        this.webhookSecret = secret;
        return this;
    }

    public CoordinatorConfig withServiceCredentials(String name, String secret) {
        this.serviceName = name;
        this.serviceSecret = secret;
        return this;
    }

    public CoordinatorConfig withTokenSecret(String secret) {
        this.tokenSecret = secret;
        return this;
    }

    public CoordinatorConfig withLiveChannel(boolean enabled) {
        this.liveChannelEnabled = enabled;
        return this;
    }

    public CoordinatorConfig withPolling(boolean enabled, Duration interval) {
        this.pollEnabled = enabled;
        this.pollInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", environment='" + environment + '\'' +
                ", maxAttempts=" + defaultMaxAttempts +
                ", webhookSecretSet=" + hasWebhookSecret() +
                ", serviceSecretSet=" + hasServiceSecret() +
                ", liveChannel=" + liveChannelEnabled +
                '}';
    }
}
