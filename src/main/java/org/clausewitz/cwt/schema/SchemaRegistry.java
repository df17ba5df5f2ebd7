package org.clausewitz.cwt.schema;

import org.clausewitz.cwt.error.SchemaLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current schema snapshot.
 *
 * <p>Readers call {@link #snapshot()} once and keep the returned {@link Schema} for the whole
 * unit of work; a replacement never changes a snapshot already handed out. Each installed
 * snapshot gets the next generation number. A failed load leaves the current snapshot in place.
 */
public final class SchemaRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    private final AtomicReference<Schema> current = new AtomicReference<>(Schema.EMPTY);
    private final AtomicLong generations = new AtomicLong();

    public Schema snapshot() {
        return current.get();
    }

    public long generation() {
        return current.get()
                      .generation();
    }

    /**
     * Parse, merge and check {@code sources}, then install the result.
     *
     * @throws SchemaLoadException if any file is malformed or the merged set is not closed; the
     *                             current snapshot is kept
     */
    public Schema load(List<SchemaSource> sources) throws SchemaLoadException {
        Schema schema;
        try {
            schema = SchemaLoader.load(sources);
        } catch (SchemaLoadException e) {
            LOG.warn("Keeping schema generation {}: {}", generation(), e.getMessage());
            throw e;
        }
        return install(schema);
    }

    /**
     * Publish an already loaded schema as the next generation.
     */
    public Schema install(Schema schema) {
        Objects.requireNonNull(schema, "schema");
        var published = schema.withGeneration(generations.incrementAndGet());
        current.set(published);
        LOG.info("Installed schema generation {} from {} files ({} types, {} enums, {} alias categories)",
                 published.generation(),
                 published.origins()
                          .size(),
                 published.types()
                          .size(),
                 published.enums()
                          .size(),
                 published.aliasCategories()
                          .size());
        return published;
    }

    /**
     * Drop the current schema. Validation against the empty schema reports nothing.
     */
    public void clear() {
        current.set(Schema.EMPTY.withGeneration(generations.incrementAndGet()));
        LOG.info("Cleared schema");
    }
}
