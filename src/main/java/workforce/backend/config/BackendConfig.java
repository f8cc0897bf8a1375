package workforce.backend.config;

import workforce.backend.ledger.LedgerSettings;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for the backend.
 * Defaults, then an optional INI file, then environment variables.
 */
public final class BackendConfig {

    private static final Logger log = LoggerFactory.getLogger(BackendConfig.class);

    /** Env var naming an INI file to load before applying env overrides */
    public static final String CONFIG_FILE_ENV = "WORKFORCE_CONFIG";

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/workforce;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private String apiKey = null; // If set, /internal/ calls must provide X-Workforce-Key

    // Queue settings
    private int jobMaxAttempts = 3;
    private Duration jobBackoffBase = Duration.ofSeconds(5);
    private Duration jobBackoffCap = Duration.ofMinutes(10);
    private Duration pollInterval = Duration.ofSeconds(5);
    private int claimBatchSize = 10;
    private int workersPerQueue = 1;
    private Duration jobTimeout = Duration.ofSeconds(60);
    private Duration jobStuckThreshold = Duration.ofMinutes(5);
    private Duration jobReaperInterval = Duration.ofSeconds(30);

    // Ledger settings (all three required to enable)
    private String ledgerRpcUrl = null;
    private String ledgerPrivateKey = null;
    private String ledgerContractAddress = null;
    private Long ledgerChainId = null;

    // Narrative settings
    private String narrativeApiKey = null;
    private String narrativeModel = "gemini-2.5-flash";
    private Duration narrativeTimeout = Duration.ofSeconds(15);

    private BackendConfig() {
    }

    public static BackendConfig defaults() {
        return new BackendConfig();
    }

    /**
     * Defaults, then the INI file named by WORKFORCE_CONFIG (if any), then environment variables.
     */
    public static BackendConfig load() {
        Map<String, String> env = System.getenv();
        BackendConfig config = new BackendConfig();

        String iniPath = env.get(CONFIG_FILE_ENV);
        if (iniPath != null && !iniPath.isBlank()) {
            config.applyIni(new File(iniPath));
        }

        config.applyEnv(env);
        return config;
    }

    public static BackendConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static BackendConfig fromEnv(Map<String, String> env) {
        BackendConfig config = new BackendConfig();
        config.applyEnv(env);
        return config;
    }

    /**
     * Load settings from an INI file on top of the defaults.
     * Sections: [database], [server], [queue], [ledger], [narrative]. All keys optional.
     */
    public static BackendConfig fromIni(File file) {
        BackendConfig config = new BackendConfig();
        config.applyIni(file);
        return config;
    }

    private void applyIni(File file) {
        try {
            Ini ini = new Ini(file);

            Profile.Section db = ini.get("database");
            if (db != null) {
                databaseUrl = opt(db, "url", databaseUrl);
                databasePoolSize = optInt(db, "pool_size", databasePoolSize);
            }

            Profile.Section server = ini.get("server");
            if (server != null) {
                serverHost = opt(server, "host", serverHost);
                serverPort = optInt(server, "port", serverPort);
                apiKey = opt(server, "api_key", apiKey);
            }

            Profile.Section queue = ini.get("queue");
            if (queue != null) {
                jobMaxAttempts = optInt(queue, "max_attempts", jobMaxAttempts);
                jobBackoffBase = optMillis(queue, "backoff_ms", jobBackoffBase);
                jobBackoffCap = optMillis(queue, "backoff_cap_ms", jobBackoffCap);
                pollInterval = optMillis(queue, "poll_ms", pollInterval);
                claimBatchSize = optInt(queue, "batch_size", claimBatchSize);
                workersPerQueue = optInt(queue, "workers", workersPerQueue);
                jobTimeout = optMillis(queue, "timeout_ms", jobTimeout);
                jobStuckThreshold = optMillis(queue, "stuck_ms", jobStuckThreshold);
                jobReaperInterval = optMillis(queue, "reaper_ms", jobReaperInterval);
            }

            Profile.Section ledger = ini.get("ledger");
            if (ledger != null) {
                ledgerRpcUrl = opt(ledger, "rpc_url", ledgerRpcUrl);
                ledgerPrivateKey = opt(ledger, "private_key", ledgerPrivateKey);
                ledgerContractAddress = opt(ledger, "contract_address", ledgerContractAddress);
                String chainId = opt(ledger, "chain_id", null);
                if (chainId != null) {
                    ledgerChainId = Long.parseLong(chainId);
                }
            }

            Profile.Section narrative = ini.get("narrative");
            if (narrative != null) {
                narrativeApiKey = opt(narrative, "api_key", narrativeApiKey);
                narrativeModel = opt(narrative, "model", narrativeModel);
                narrativeTimeout = optMillis(narrative, "timeout_ms", narrativeTimeout);
            }

            log.info("Loaded configuration file {}", file.getAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration file: " + file, e);
        }
    }

    private void applyEnv(Map<String, String> env) {
        String dbUrl = env.get("WORKFORCE_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String port = env.get("WORKFORCE_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port);
        }

        String key = env.get("WORKFORCE_KEY");
        if (key != null && !key.isBlank()) {
            apiKey = key;
        }

        String maxAttempts = env.get("SCORING_JOB_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            jobMaxAttempts = Integer.parseInt(maxAttempts);
        }

        String backoff = env.get("SCORING_JOB_BACKOFF_MS");
        if (backoff != null && !backoff.isBlank()) {
            jobBackoffBase = Duration.ofMillis(Long.parseLong(backoff));
        }

        String poll = env.get("SCORING_POLL_MS");
        if (poll != null && !poll.isBlank()) {
            pollInterval = Duration.ofMillis(Long.parseLong(poll));
        }

        String timeout = env.get("JOB_TIMEOUT_MS");
        if (timeout != null && !timeout.isBlank()) {
            jobTimeout = Duration.ofMillis(Long.parseLong(timeout));
        }

        String stuck = env.get("JOB_STUCK_MS");
        if (stuck != null && !stuck.isBlank()) {
            jobStuckThreshold = Duration.ofMillis(Long.parseLong(stuck));
        }

        String rpcUrl = env.get("WEB3_RPC_URL");
        if (rpcUrl != null && !rpcUrl.isBlank()) {
            ledgerRpcUrl = rpcUrl;
        }

        String privateKey = env.get("DEPLOYER_PRIVATE_KEY");
        if (privateKey != null && !privateKey.isBlank()) {
            ledgerPrivateKey = privateKey;
        }

        String contract = env.get("WORKFORCE_LOGGER_ADDRESS");
        if (contract != null && !contract.isBlank()) {
            ledgerContractAddress = contract;
        }

        String chainId = env.get("WEB3_CHAIN_ID");
        if (chainId != null && !chainId.isBlank()) {
            ledgerChainId = Long.parseLong(chainId);
        }

        String geminiKey = env.get("GEMINI_API_KEY");
        if (geminiKey != null && !geminiKey.isBlank()) {
            narrativeApiKey = geminiKey;
        }

        String geminiModel = env.get("GEMINI_MODEL");
        if (geminiModel != null && !geminiModel.isBlank()) {
            narrativeModel = geminiModel;
        }
    }

    private static String opt(Profile.Section section, String key, String fallback) {
        String value = section.get(key);
        return (value == null || value.isBlank()) ? fallback : value.trim();
    }

    private static int optInt(Profile.Section section, String key, int fallback) {
        String value = opt(section, key, null);
        return value == null ? fallback : Integer.parseInt(value);
    }

    private static Duration optMillis(Profile.Section section, String key, Duration fallback) {
        String value = opt(section, key, null);
        return value == null ? fallback : Duration.ofMillis(Long.parseLong(value));
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

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public int jobMaxAttempts() {
        return jobMaxAttempts;
    }

    public Duration jobBackoffBase() {
        return jobBackoffBase;
    }

    public Duration jobBackoffCap() {
        return jobBackoffCap;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int claimBatchSize() {
        return claimBatchSize;
    }

    public int workersPerQueue() {
        return workersPerQueue;
    }

    public Duration jobTimeout() {
        return jobTimeout;
    }

    public Duration jobStuckThreshold() {
        return jobStuckThreshold;
    }

    public Duration jobReaperInterval() {
        return jobReaperInterval;
    }

    public LedgerSettings ledgerSettings() {
        return new LedgerSettings(ledgerRpcUrl, ledgerPrivateKey, ledgerContractAddress, ledgerChainId);
    }

    public String narrativeApiKey() {
        return narrativeApiKey;
    }

    public String narrativeModel() {
        return narrativeModel;
    }

    public Duration narrativeTimeout() {
        return narrativeTimeout;
    }

    // Fluent setters for testing/customization
    public BackendConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public BackendConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public BackendConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public BackendConfig withMaxAttempts(int attempts) {
        this.jobMaxAttempts = attempts;
        return this;
    }

    public BackendConfig withBackoff(Duration base, Duration cap) {
        this.jobBackoffBase = base;
        this.jobBackoffCap = cap;
        return this;
    }

    public BackendConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public BackendConfig withJobTimeout(Duration timeout) {
        this.jobTimeout = timeout;
        return this;
    }

    public BackendConfig withJobStuckThreshold(Duration threshold) {
        this.jobStuckThreshold = threshold;
        return this;
    }

    public BackendConfig withLedger(String rpcUrl, String privateKey, String contractAddress) {
        this.ledgerRpcUrl = rpcUrl;
        this.ledgerPrivateKey = privateKey;
        this.ledgerContractAddress = contractAddress;
        return this;
    }

    public BackendConfig withNarrativeApiKey(String key) {
        this.narrativeApiKey = key;
        return this;
    }

    @Override
    public String toString() {
        return "BackendConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", maxAttempts=" + jobMaxAttempts +
                ", backoffBase=" + jobBackoffBase +
                ", pollInterval=" + pollInterval +
                ", apiKeySet=" + hasApiKey() +
                ", ledgerConfigured=" + ledgerSettings().isComplete() +
                ", narrativeKeySet=" + (narrativeApiKey != null) +
                '}';
    }
}
