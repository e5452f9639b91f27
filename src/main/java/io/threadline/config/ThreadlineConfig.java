package io.threadline.config;

import io.threadline.model.CheckpointIdPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Store settings. Sources, later wins: built-in defaults, {@code threadline.properties} on the
 * classpath, {@code THREADLINE_*} environment variables, {@code threadline.*} system properties.
 */
public final class ThreadlineConfig {
    public static final String RESOURCE_NAME = "threadline.properties";
    public static final String IN_MEMORY = ":memory:";
    public static final String DEFAULT_SQLITE_PATH = "data/threadline.db";
    public static final String DEFAULT_JOURNAL_MODE = "WAL";
    public static final int DEFAULT_WORKER_THREADS = 4;

    static final String KEY_SQLITE_PATH = "sqlite.path";
    static final String KEY_JOURNAL_MODE = "sqlite.journal-mode";
    static final String KEY_POSTGRES_URL = "postgres.url";
    static final String KEY_POSTGRES_USER = "postgres.user";
    static final String KEY_POSTGRES_PASSWORD = "postgres.password";
    static final String KEY_PIPELINE = "postgres.pipeline";
    static final String KEY_WORKER_THREADS = "postgres.worker-threads";
    static final String KEY_ID_POLICY = "checkpoint.id-policy";

    private static final List<String> KEYS = List.of(
            KEY_SQLITE_PATH,
            KEY_JOURNAL_MODE,
            KEY_POSTGRES_URL,
            KEY_POSTGRES_USER,
            KEY_POSTGRES_PASSWORD,
            KEY_PIPELINE,
            KEY_WORKER_THREADS,
            KEY_ID_POLICY
    );

    private final String sqlitePath;
    private final String journalMode;
    private final String postgresUrl;
    private final String postgresUser;
    private final String postgresPassword;
    private final boolean pipeline;
    private final int workerThreads;
    private final CheckpointIdPolicy idPolicy;

    public ThreadlineConfig(
            String sqlitePath,
            String journalMode,
            String postgresUrl,
            String postgresUser,
            String postgresPassword,
            boolean pipeline,
            int workerThreads,
            CheckpointIdPolicy idPolicy
    ) {
        this.sqlitePath = sqlitePath == null || sqlitePath.isBlank() ? DEFAULT_SQLITE_PATH : sqlitePath.trim();
        this.journalMode = journalMode == null || journalMode.isBlank()
                ? DEFAULT_JOURNAL_MODE
                : journalMode.trim().toUpperCase(Locale.ROOT);
        this.postgresUrl = postgresUrl;
        this.postgresUser = postgresUser;
        this.postgresPassword = postgresPassword;
        this.pipeline = pipeline;
        this.workerThreads = workerThreads <= 0 ? DEFAULT_WORKER_THREADS : workerThreads;
        this.idPolicy = idPolicy == null ? CheckpointIdPolicy.CALLER_SUPPLIED : idPolicy;
    }

    public static ThreadlineConfig defaults() {
        return fromProperties(new Properties());
    }

    public static ThreadlineConfig inMemory() {
        return sqlite(IN_MEMORY);
    }

    public static ThreadlineConfig sqlite(String path) {
        Properties props = new Properties();
        props.setProperty(KEY_SQLITE_PATH, path == null ? IN_MEMORY : path);
        return fromProperties(props);
    }

    public static ThreadlineConfig postgres(String url) {
        Properties props = new Properties();
        props.setProperty(KEY_POSTGRES_URL, url);
        return fromProperties(props);
    }

    public static ThreadlineConfig load() {
        return load(System.getenv(), System.getProperties());
    }

    public static ThreadlineConfig load(Map<String, String> env, Properties systemProperties) {
        Properties merged = new Properties();
        try (InputStream in = ThreadlineConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + RESOURCE_NAME, e);
        }
        for (String key : KEYS) {
            String fromEnv = env.get(envName(key));
            if (fromEnv != null && !fromEnv.isBlank()) {
                merged.setProperty(key, fromEnv);
            }
            String fromSystem = systemProperties.getProperty("threadline." + key);
            if (fromSystem != null && !fromSystem.isBlank()) {
                merged.setProperty(key, fromSystem);
            }
        }
        return fromProperties(merged);
    }

    public static ThreadlineConfig fromProperties(Properties props) {
        return new ThreadlineConfig(
                props.getProperty(KEY_SQLITE_PATH),
                props.getProperty(KEY_JOURNAL_MODE),
                blankToNull(props.getProperty(KEY_POSTGRES_URL)),
                blankToNull(props.getProperty(KEY_POSTGRES_USER)),
                blankToNull(props.getProperty(KEY_POSTGRES_PASSWORD)),
                Boolean.parseBoolean(props.getProperty(KEY_PIPELINE, "false").trim()),
                parseInt(props.getProperty(KEY_WORKER_THREADS), DEFAULT_WORKER_THREADS),
                CheckpointIdPolicy.fromString(props.getProperty(KEY_ID_POLICY))
        );
    }

    static String envName(String key) {
        return "THREADLINE_" + key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    private static int parseInt(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + KEY_WORKER_THREADS + ": " + raw, e);
        }
    }

    public String sqlitePath() {
        return sqlitePath;
    }

    public boolean sqliteInMemory() {
        return IN_MEMORY.equals(sqlitePath);
    }

    public Optional<Path> sqliteFile() {
        return sqliteInMemory() ? Optional.empty() : Optional.of(Paths.get(sqlitePath).toAbsolutePath().normalize());
    }

    public String sqliteJdbcUrl() {
        return "jdbc:sqlite:" + sqliteFile().map(Path::toString).orElse(IN_MEMORY);
    }

    public String journalMode() {
        return journalMode;
    }

    public Optional<String> postgresUrl() {
        return Optional.ofNullable(postgresUrl);
    }

    public Optional<String> postgresUser() {
        return Optional.ofNullable(postgresUser);
    }

    public Optional<String> postgresPassword() {
        return Optional.ofNullable(postgresPassword);
    }

    public boolean pipeline() {
        return pipeline;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public CheckpointIdPolicy idPolicy() {
        return idPolicy;
    }
}
