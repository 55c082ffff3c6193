package cz.drbacon.pades.tsp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Thread-safe in-process audit log. {@link #shared()} is the process-wide default.
 */
public class InMemoryTimestampAuditLog implements TimestampAuditLog {

    private static final InMemoryTimestampAuditLog SHARED = new InMemoryTimestampAuditLog();

    private final Object lock = new Object();
    private final List<TimestampAuditEntry> entries = new ArrayList<>();

    public static InMemoryTimestampAuditLog shared() {
        return SHARED;
    }

    @Override
    public void append(TimestampAuditEntry entry) {
        Objects.requireNonNull(entry, "entry");
        synchronized (lock) {
            entries.add(entry);
        }
    }

    @Override
    public List<TimestampAuditEntry> entries() {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(entries));
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            entries.clear();
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }
}
