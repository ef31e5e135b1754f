package com.brandsentinel.core.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Creates the {@link Storage} backend named in configuration.
 *
 * <p>
 * Only {@code memory} is implemented. {@code sqlite} and {@code postgres} are
 * accepted by configuration validation but fail here, at engine construction.
 * </p>
 *
 * @since 1.0.0
 */
public final class StorageFactory {

    private static final Logger LOG = LoggerFactory.getLogger(StorageFactory.class);

    private StorageFactory() {
        // utility class, not instantiable
    }

    /**
     * @param type storage type from configuration; must not be {@code null}
     * @return a new storage backend
     * @throws IllegalArgumentException if the type is unknown or not implemented
     */
    public static Storage create(String type) {
        Objects.requireNonNull(type, "Storage type must not be null");
        Storage storage = switch (type.toLowerCase(Locale.ROOT)) {
            case "memory" -> new MemoryStorage();
            case "sqlite", "postgres" -> throw new IllegalArgumentException(
                    "Storage type '" + type + "' is not implemented yet; use 'memory'");
            default -> throw new IllegalArgumentException(
                    "Unknown storage type: '" + type + "'. Supported types: memory");
        };
        LOG.info("Storage initialized: {}", type);
        return storage;
    }
}
