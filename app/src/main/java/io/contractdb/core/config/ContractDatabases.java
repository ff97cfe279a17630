package io.contractdb.core.config;

import io.contractdb.core.database.ContractDatabase;
import io.contractdb.core.database.MemoryContractDatabase;
import io.contractdb.core.storage.RocksDBContractDatabase;

import java.util.logging.Logger;

/**
 * Wires a backend from config. Callers only see {@link ContractDatabase}.
 */
public final class ContractDatabases {
    private static final Logger LOG = Logger.getLogger(ContractDatabases.class.getName());

    private ContractDatabases() {}

    public static ContractDatabase open(DatabaseConfig config) {
        LOG.fine("Opening contract database: " + config);
        switch (config.backend) {
            case MEMORY:
                return new MemoryContractDatabase(config.metricsEnabled);
            case ROCKSDB:
                return RocksDBContractDatabase.open(config.dataDir, config.metricsEnabled);
            default:
                throw new IllegalArgumentException("Unsupported backend: " + config.backend);
        }
    }

    /** Convenience factory for an in-memory database. */
    public static ContractDatabase inMemory() {
        return open(DatabaseConfig.defaultLocal());
    }

    /** Convenience factory for a RocksDB-backed database. */
    public static ContractDatabase rocks(String dataDir) {
        return open(DatabaseConfig.rocks(dataDir));
    }
}
