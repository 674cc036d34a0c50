package com.stellarsql.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current catalog snapshot and swaps it atomically on refresh.
 *
 * <p>Compilations take the current snapshot once when they start, so a
 * refresh is seen by new compilations while in-flight ones finish against
 * the snapshot they started with.
 */
public class CatalogRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CatalogRegistry.class);

    private final AtomicReference<MetadataCatalog> current;

    public CatalogRegistry(MetadataCatalog initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial catalog must not be null");
        }
        this.current = new AtomicReference<>(initial);
    }

    /**
     * Returns the snapshot new compilations should use.
     *
     * @return the current snapshot
     */
    public MetadataCatalog current() {
        return current.get();
    }

    /**
     * Publishes a new snapshot.
     *
     * @param snapshot the new snapshot; its version must exceed the current one
     * @throws IllegalArgumentException if the snapshot is older than the current one
     */
    public void refresh(MetadataCatalog snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot must not be null");
        }
        MetadataCatalog previous;
        do {
            previous = current.get();
            if (snapshot.version() <= previous.version()) {
                throw new IllegalArgumentException(
                    "Catalog version " + snapshot.version()
                    + " is not newer than current version " + previous.version());
            }
        } while (!current.compareAndSet(previous, snapshot));
        logger.debug("Catalog refreshed from version {} to {}", previous.version(), snapshot.version());
    }
}
