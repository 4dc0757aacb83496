package com.trustbridge.spi;

import com.trustbridge.models.audit.AuditEvent;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * A sink for the audit trail. The audit logger buffers events and hands them over in batches, already verified
 * against their checksums, in program order.
 * Implementations can choose how to persist them. Possible implementations are:
 *   - append to a local file
 *   - insert into a database
 *   - forward to syslog
 * A failure of one backend never stops the batch from reaching the others.
 */
public interface AuditStorageBackend {

    /**
     * Short name used in statistics and logs, e.g. {@code file}, {@code database}, {@code syslog}.
     */
    String type();

    /**
     * Persists a batch of events.
     *
     * @throws IOException if the batch could not be written
     */
    void store(List<AuditEvent> events) throws IOException;

    /**
     * Compacts or rotates underlying storage. Called from the audit logger's rotation loop.
     */
    default void rotate() throws IOException {
        // nothing to rotate by default
    }

    /**
     * Reads back events in the given window, for compliance reporting. Backends that cannot be read return an empty list.
     */
    default List<AuditEvent> readEvents(Instant from, Instant to) throws IOException {
        return List.of();
    }

    default void close() throws IOException {
        // no resources by default
    }
}
