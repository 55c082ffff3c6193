package cz.drbacon.pades.tsp;

import java.util.List;

/**
 * Append-only log of timestamp operations. Durable implementations live outside this library.
 */
public interface TimestampAuditLog {

    void append(TimestampAuditEntry entry);

    /**
     * @return a snapshot in append order
     */
    List<TimestampAuditEntry> entries();

    /**
     * Drop all entries. Tests and operations only; never while validations are running.
     */
    void clear();
}
