package io.contractdb.core.config;

import java.util.Locale;
import java.util.Properties;

/** Simple config holder for opening a contract database. */
public final class DatabaseConfig {

    public enum Backend { MEMORY, ROCKSDB }

    public static final String BACKEND_KEY = "contractdb.backend";
    public static final String DATA_DIR_KEY = "contractdb.dataDir";
    public static final String METRICS_KEY = "contractdb.metrics";

    public final Backend backend;
    public final String dataDir;
    public final boolean metricsEnabled;

    public DatabaseConfig(Backend backend, String dataDir, boolean metricsEnabled) {
        if (backend == null) {
            throw new IllegalArgumentException("backend is required");
        }
        if (backend == Backend.ROCKSDB && (dataDir == null || dataDir.isBlank())) {
            throw new IllegalArgumentException("RocksDB backend needs a data directory");
        }
        this.backend = backend;
        this.dataDir = dataDir;
        this.metricsEnabled = metricsEnabled;
    }

    public static DatabaseConfig defaultLocal() {
        return new DatabaseConfig(Backend.MEMORY, null, true);
    }

    public static DatabaseConfig rocks(String dataDir) {
        return new DatabaseConfig(Backend.ROCKSDB, dataDir, true);
    }

    public DatabaseConfig withMetrics(boolean enabled) {
        return new DatabaseConfig(this.backend, this.dataDir, enabled);
    }

    /**
     * Read {@code contractdb.backend} (memory|rocksdb), {@code contractdb.dataDir}
     * and {@code contractdb.metrics}; missing keys fall back to {@link #defaultLocal()}.
     */
    public static DatabaseConfig fromProperties(Properties props) {
        DatabaseConfig base = defaultLocal();
        String backendRaw = props.getProperty(BACKEND_KEY);
        Backend backend = base.backend;
        if (backendRaw != null && !backendRaw.isBlank()) {
            try {
                backend = Backend.valueOf(backendRaw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown backend '" + backendRaw + "' (expected memory or rocksdb)", e);
            }
        }
        String dataDir = props.getProperty(DATA_DIR_KEY, base.dataDir);
        String metricsRaw = props.getProperty(METRICS_KEY);
        boolean metrics = metricsRaw == null ? base.metricsEnabled : Boolean.parseBoolean(metricsRaw.trim());
        return new DatabaseConfig(backend, dataDir, metrics);
    }

    public static DatabaseConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    @Override
    public String toString() {
        return "DatabaseConfig{backend=" + backend + ", dataDir=" + dataDir + ", metrics=" + metricsEnabled + "}";
    }
}
